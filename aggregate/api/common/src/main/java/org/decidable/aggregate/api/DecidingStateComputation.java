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

import org.decidable.dsl.decider.Decider;
import org.jspecify.annotations.NonNull;

import java.util.List;

/**
 * A {@link StateComputation} that delegates to a {@link Decider}: the events returned by {@code decide} are applied to the current state,
 * in order, using {@code evolve}.
 */
public class DecidingStateComputation<C, S, E> implements StateComputation<C, S, E> {

    protected final Decider<C, S, E> decider;
    private final S initialState;

    public DecidingStateComputation(Decider<C, S, E> decider) {
        if (decider == null) throw new IllegalArgumentException(Decider.class.getSimpleName() + " cannot be null");
        this.decider = decider;
        this.initialState = decider.initialState();
    }

    @Override
    public S initialState() {
        return initialState;
    }

    @NonNull
    @Override
    public List<E> decide(@NonNull C command, S state) {
        return decider.decide(command, state);
    }

    @Override
    public S evolve(S state, @NonNull E event) {
        return decider.evolve(state, event);
    }

    @Override
    public S computeNewState(S state, @NonNull C command) {
        List<E> events = decider.decide(command, state);
        return fold(state, events);
    }
}
