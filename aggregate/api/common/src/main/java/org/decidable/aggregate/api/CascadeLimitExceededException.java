/*
 *
 *  Copyright 2023 Johan Haleby
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.decidable.aggregate.api;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * Thrown by an {@link OrchestratingStateComputation} when the saga keeps issuing follow-up commands beyond the configured {@link CascadeLimit}.
 * Nothing has been saved when this exception is thrown since state is only saved after the entire cascade has been computed.
 */
public class CascadeLimitExceededException extends RuntimeException {
    public final CascadeLimit cascadeLimit;
    public final Object command;

    public CascadeLimitExceededException(CascadeLimit cascadeLimit, Object command, String message) {
        super(message);
        this.cascadeLimit = cascadeLimit;
        this.command = command;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CascadeLimitExceededException)) return false;
        CascadeLimitExceededException that = (CascadeLimitExceededException) o;
        return Objects.equals(cascadeLimit, that.cascadeLimit) && Objects.equals(command, that.command) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(cascadeLimit, command);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", CascadeLimitExceededException.class.getSimpleName() + "[", "]")
                .add("cascadeLimit=" + cascadeLimit)
                .add("command=" + command)
                .add("message=" + super.getMessage())
                .toString();
    }
}
