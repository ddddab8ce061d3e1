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

import org.decidable.aggregate.api.FetchedState;
import org.decidable.aggregate.api.VersionConflictException;
import org.decidable.aggregate.api.VersionedState;
import org.jspecify.annotations.NonNull;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fetches and saves the state of an aggregate together with a version that is used for optimistic locking, non-blocking.
 *
 * @param <C> The type of command
 * @param <S> The type of state
 * @param <V> The type of version
 */
public interface StateLockingRepository<C, S, V> {

    /**
     * Fetch the current state and its version for the entity that the {@code command} targets.
     * An empty {@link Mono} is treated the same way as {@link FetchedState#absent()}.
     */
    Mono<FetchedState<S, V>> fetchState(@NonNull C command);

    /**
     * Save the state, but only if the version in storage still equals {@code version}.
     * May return the following exceptions on the error track:
     *
     * <table>
     *     <tr><th>Exception</th><th>Description</th></tr>
     *     <tr><td>{@link VersionConflictException}</td><td>When the stored version doesn't match {@code version}</td></tr>
     * </table>
     *
     * @return A {@link Mono} with the saved state and its new version
     */
    Mono<VersionedState<S, V>> save(@NonNull S state, @NonNull Optional<V> version);

    static <C, S, V> StateLockingRepository<C, S, V> create(Function<@NonNull C, Mono<FetchedState<S, V>>> fetchState,
                                                            BiFunction<@NonNull S, Optional<V>, Mono<VersionedState<S, V>>> save) {
        if (fetchState == null) throw new IllegalArgumentException("fetchState cannot be null");
        if (save == null) throw new IllegalArgumentException("save cannot be null");
        return new StateLockingRepository<>() {
            @Override
            public Mono<FetchedState<S, V>> fetchState(@NonNull C command) {
                return fetchState.apply(command);
            }

            @Override
            public Mono<VersionedState<S, V>> save(@NonNull S state, @NonNull Optional<V> version) {
                return save.apply(state, version);
            }
        };
    }
}
