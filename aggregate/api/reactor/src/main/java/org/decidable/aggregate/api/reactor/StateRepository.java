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

package org.decidable.aggregate.api.reactor;

import org.jspecify.annotations.NonNull;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Fetches and saves the state of an aggregate, non-blocking.
 *
 * @param <C> The type of command
 * @param <S> The type of state
 */
public interface StateRepository<C, S> {

    /**
     * Fetch the current state for the entity that the {@code command} targets.
     *
     * @return A {@link Mono} with the current state, or an empty {@link Mono} if no state has been saved
     */
    Mono<S> fetchState(@NonNull C command);

    /**
     * Save the state.
     *
     * @return A {@link Mono} with the saved state
     */
    Mono<S> save(@NonNull S state);

    static <C, S> StateRepository<C, S> create(Function<@NonNull C, Mono<S>> fetchState, Function<@NonNull S, Mono<S>> save) {
        if (fetchState == null) throw new IllegalArgumentException("fetchState cannot be null");
        if (save == null) throw new IllegalArgumentException("save cannot be null");
        return new StateRepository<>() {
            @Override
            public Mono<S> fetchState(@NonNull C command) {
                return fetchState.apply(command);
            }

            @Override
            public Mono<S> save(@NonNull S state) {
                return save.apply(state);
            }
        };
    }
}
