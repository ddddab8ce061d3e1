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

package org.decidable.aggregate.api.blocking;

import org.jspecify.annotations.NonNull;

import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Fetches and saves the state of an aggregate. How a command maps to the identity of the state is up to the implementation.
 *
 * @param <C> The type of command
 * @param <S> The type of state
 */
public interface StateRepository<C, S> {

    /**
     * Fetch the current state for the entity that the {@code command} targets.
     *
     * @return The current state or {@link Optional#empty()} if no state has been saved
     */
    Optional<@NonNull S> fetchState(@NonNull C command);

    /**
     * Save the state.
     *
     * @return The saved state
     */
    S save(@NonNull S state);

    static <C, S> StateRepository<C, S> create(Function<@NonNull C, S> fetchState, UnaryOperator<@NonNull S> save) {
        if (fetchState == null) throw new IllegalArgumentException("fetchState cannot be null");
        if (save == null) throw new IllegalArgumentException("save cannot be null");
        return new StateRepository<>() {
            @Override
            public Optional<S> fetchState(@NonNull C command) {
                return Optional.ofNullable(fetchState.apply(command));
            }

            @Override
            public S save(@NonNull S state) {
                return save.apply(state);
            }
        };
    }
}
