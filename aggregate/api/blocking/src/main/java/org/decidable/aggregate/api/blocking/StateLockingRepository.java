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

import org.decidable.aggregate.api.FetchedState;
import org.decidable.aggregate.api.VersionConflictException;
import org.decidable.aggregate.api.VersionedState;
import org.jspecify.annotations.NonNull;

import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Fetches and saves the state of an aggregate together with a version that is used for optimistic locking.
 *
 * @param <C> The type of command
 * @param <S> The type of state
 * @param <V> The type of version
 */
public interface StateLockingRepository<C, S, V> {

    /**
     * Fetch the current state and its version for the entity that the {@code command} targets.
     *
     * @return The current state and version, both of which may be absent.
     */
    @NonNull
    FetchedState<S, V> fetchState(@NonNull C command);

    /**
     * Save the state, but only if the version in storage still equals {@code version}. An absent version means that no state is
     * expected to be stored. On success, the state is stored with a new version that differs from the previous one.
     *
     * @param state   The state to save
     * @param version The version that was fetched together with the state
     * @return The saved state and its new version
     * @throws VersionConflictException If the stored version doesn't match {@code version}
     */
    @NonNull
    VersionedState<S, V> save(@NonNull S state, @NonNull Optional<V> version);

    static <C, S, V> StateLockingRepository<C, S, V> create(Function<@NonNull C, FetchedState<S, V>> fetchState,
                                                            BiFunction<@NonNull S, Optional<V>, VersionedState<S, V>> save) {
        if (fetchState == null) throw new IllegalArgumentException("fetchState cannot be null");
        if (save == null) throw new IllegalArgumentException("save cannot be null");
        return new StateLockingRepository<>() {
            @NonNull
            @Override
            public FetchedState<S, V> fetchState(@NonNull C command) {
                FetchedState<S, V> fetched = fetchState.apply(command);
                return fetched == null ? FetchedState.absent() : fetched;
            }

            @NonNull
            @Override
            public VersionedState<S, V> save(@NonNull S state, @NonNull Optional<V> version) {
                return save.apply(state, version);
            }
        };
    }
}
