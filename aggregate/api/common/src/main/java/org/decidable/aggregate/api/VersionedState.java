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

/**
 * State together with the version it was stored with.
 *
 * @param <S> The type of the state
 * @param <V> The type of the version
 */
public record VersionedState<S, V>(S state, @NonNull V version) {
    public VersionedState {
        if (version == null) throw new IllegalArgumentException("version cannot be null");
    }
}
