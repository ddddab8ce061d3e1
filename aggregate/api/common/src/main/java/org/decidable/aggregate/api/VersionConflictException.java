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

import org.jspecify.annotations.Nullable;

import java.util.Objects;
import java.util.StringJoiner;

/**
 * The version supplied when saving state didn't match the version currently stored, so the state was not saved.
 * This is effectively an optimistic locking exception. Repositories that implement locking must throw this exception (or a subclass of it),
 * aggregates never catch it. A retry (re-fetching the state and handling the command again) is typically appropriate.
 */
public class VersionConflictException extends RuntimeException {
    public final @Nullable Object expectedVersion;
    public final @Nullable Object actualVersion;

    /**
     * @param expectedVersion The version that was supplied to save, {@code null} if the state was expected not to exist
     * @param actualVersion   The version currently stored, {@code null} if no state is stored
     */
    public VersionConflictException(@Nullable Object expectedVersion, @Nullable Object actualVersion, String message) {
        super(message);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public VersionConflictException(@Nullable Object expectedVersion, @Nullable Object actualVersion) {
        this(expectedVersion, actualVersion, String.format("Version conflict, expected version %s but was %s.", expectedVersion, actualVersion));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof VersionConflictException)) return false;
        VersionConflictException that = (VersionConflictException) o;
        return Objects.equals(expectedVersion, that.expectedVersion) && Objects.equals(actualVersion, that.actualVersion) && Objects.equals(getMessage(), that.getMessage());
    }

    @Override
    public int hashCode() {
        return Objects.hash(expectedVersion, actualVersion);
    }

    @Override
    public String toString() {
        return new StringJoiner(", ", VersionConflictException.class.getSimpleName() + "[", "]")
                .add("expectedVersion=" + expectedVersion)
                .add("actualVersion=" + actualVersion)
                .add("message=" + super.getMessage())
                .toString();
    }
}
