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

import org.jspecify.annotations.NullMarked;

/**
 * Limits how many follow-up commands an {@link OrchestratingStateComputation} may process as the result of a single command.
 * The default, {@link Unbounded}, relies entirely on the saga and decider to stop reacting.
 */
@NullMarked
public sealed interface CascadeLimit {

    static CascadeLimit unbounded() {
        return Unbounded.INSTANCE;
    }

    static CascadeLimit maxFollowUpCommands(int limit) {
        return new MaxFollowUpCommands(limit);
    }

    /**
     * @return {@code true} if processing {@code numberOfFollowUpCommands} follow-up commands exceeds this limit
     */
    boolean isExceededBy(long numberOfFollowUpCommands);

    record MaxFollowUpCommands(int limit) implements CascadeLimit {
        public MaxFollowUpCommands {
            if (limit < 0) {
                throw new IllegalArgumentException("Max follow-up commands cannot be negative");
            }
        }

        @Override
        public boolean isExceededBy(long numberOfFollowUpCommands) {
            return numberOfFollowUpCommands > limit;
        }
    }

    record Unbounded() implements CascadeLimit {
        static final Unbounded INSTANCE = new Unbounded();

        @Override
        public boolean isExceededBy(long numberOfFollowUpCommands) {
            return false;
        }
    }
}
