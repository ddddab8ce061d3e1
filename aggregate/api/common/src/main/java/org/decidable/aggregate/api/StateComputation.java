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
import org.decidable.dsl.decider.Saga;
import org.jspecify.annotations.NonNull;

/**
 * Computes the new state of an aggregate by deciding which events a command results in and then evolving the current state with these events.
 *
 * @param <C> The type of commands
 * @param <S> The type of state
 * @param <E> The type of events
 */
public interface StateComputation<C, S, E> extends Decider<C, S, E> {

    /**
     * Compute the new state from the current {@code state} and the {@code command}. If the command doesn't result in any events,
     * the supplied {@code state} is returned as is.
     */
    S computeNewState(S state, @NonNull C command);

    /**
     * Create a state computation that decides and evolves using the supplied {@code decider}.
     */
    static <C, S, E> StateComputation<C, S, E> create(@NonNull Decider<C, S, E> decider) {
        return new DecidingStateComputation<>(decider);
    }

    /**
     * Create a state computation that, after deciding and evolving, lets the {@code saga} react to each new event and
     * computes the state for every follow-up command, in the same pass.
     */
    static <C, S, E> OrchestratingStateComputation<C, S, E> orchestrating(@NonNull Decider<C, S, E> decider, @NonNull Saga<E, C> saga) {
        return new OrchestratingStateComputation<>(decider, saga, CascadeLimit.unbounded());
    }

    static <C, S, E> OrchestratingStateComputation<C, S, E> orchestrating(@NonNull Decider<C, S, E> decider, @NonNull Saga<E, C> saga, @NonNull CascadeLimit cascadeLimit) {
        return new OrchestratingStateComputation<>(decider, saga, cascadeLimit);
    }
}
