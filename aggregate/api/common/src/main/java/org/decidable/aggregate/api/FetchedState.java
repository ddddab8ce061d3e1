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

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import java.util.Optional;

/**
 * The state and version returned by a locking repository. Both may be independently absent, for example when the state has never been saved.
 *
 * @param state   The current state, if any
 * @param version The version of the current state, if any
 * @param <S>     The type of the state
 * @param <V>     The type of the version
 */
public record FetchedState<S, V>(@NonNull Optional<S> state, @NonNull Optional<V> version) {

    public FetchedState {
        if (state == null) throw new IllegalArgumentException("state cannot be null, use Optional.empty()");
        if (version == null) throw new IllegalArgumentException("version cannot be null, use Optional.empty()");
    }

    public static <S, V> FetchedState<S, V> absent() {
        return new FetchedState<>(Optional.empty(), Optional.empty());
    }

    public static <S, V> FetchedState<S, V> of(@NonNull S state, @NonNull V version) {
        return new FetchedState<>(Optional.of(state), Optional.of(version));
    }

    public static <S, V> FetchedState<S, V> ofNullable(@Nullable S state, @Nullable V version) {
        return new FetchedState<>(Optional.ofNullable(state), Optional.ofNullable(version));
    }

    public boolean isAbsent() {
        return state.isEmpty();
    }
}
