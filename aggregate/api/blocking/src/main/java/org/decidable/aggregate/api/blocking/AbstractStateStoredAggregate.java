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

import org.decidable.aggregate.api.StateComputation;
import org.decidable.dsl.decider.Decider;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for all state stored aggregates. It fetches the current state, computes the new state using a {@link StateComputation}
 * and then saves the new state exactly once. Subclasses decide how state is fetched and saved (with or without a version), the
 * {@link StateComputation} decides whether follow-up commands are orchestrated or not.
 * <p>
 * Aggregates don't keep any state between calls to {@link #handle(Object)}, so they are thread-safe if the repository is thread-safe.
 * Exceptions thrown by the decider, saga or repository are propagated as is.
 * </p>
 *
 * @param <C> The type of command
 * @param <S> The type of state
 * @param <E> The type of event
 * @param <F> The type of what's fetched from the repository
 * @param <R> The type returned by {@link #handle(Object)}
 */
public abstract class AbstractStateStoredAggregate<C, S, E, F, R> implements Decider<C, S, E> {
    private static final Logger log = LoggerFactory.getLogger(AbstractStateStoredAggregate.class);

    protected final StateComputation<C, S, E> computation;

    protected AbstractStateStoredAggregate(StateComputation<C, S, E> computation) {
        if (computation == null) throw new IllegalArgumentException(StateComputation.class.getSimpleName() + " cannot be null");
        this.computation = computation;
    }

    protected abstract F fetchCurrent(@NonNull C command);

    protected abstract Optional<S> currentState(@NonNull F fetched);

    protected abstract R saveNewState(@NonNull S newState, @NonNull F fetched);

    /**
     * Handle the {@code command}: fetch the current state (or use the initial state if there is none), compute the new state and save it.
     *
     * @return What the repository returned when saving the new state
     */
    public final R handle(@NonNull C command) {
        Objects.requireNonNull(command, "Command cannot be null");
        log.debug("Handling command {}", command);
        F fetched = fetchCurrent(command);
        S currentState = currentState(fetched).orElseGet(computation::initialState);
        S newState = computation.computeNewState(currentState, command);
        R result = saveNewState(newState, fetched);
        log.debug("Handled command {}", command);
        return result;
    }

    @Override
    public S initialState() {
        return computation.initialState();
    }

    @NonNull
    @Override
    public List<E> decide(@NonNull C command, S state) {
        return computation.decide(command, state);
    }

    @Override
    public S evolve(S state, @NonNull E event) {
        return computation.evolve(state, event);
    }
}
