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

import org.decidable.aggregate.api.StateComputation;
import org.decidable.dsl.decider.Decider;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Base class for all reactive state stored aggregates, see {@code org.decidable.aggregate.api.blocking.AbstractStateStoredAggregate}.
 * Fetching and saving are the only asynchronous steps. The new state is computed synchronously in between, including all follow-up
 * commands if the {@link StateComputation} is orchestrating, so once the state has been fetched the computation can't be interleaved
 * with anything else.
 * <p>
 * Nothing is fetched until the {@link Mono} returned by {@link #handle(Object)} is subscribed to. Errors from the decider, saga or
 * repository are propagated on the error track, as is.
 * </p>
 *
 * @param <C> The type of command
 * @param <S> The type of state
 * @param <E> The type of event
 * @param <F> The type of what's fetched from the repository
 * @param <R> The type emitted by {@link #handle(Object)}
 */
public abstract class AbstractStateStoredAggregate<C, S, E, F, R> implements Decider<C, S, E> {
    private static final Logger log = LoggerFactory.getLogger(AbstractStateStoredAggregate.class);

    protected final StateComputation<C, S, E> computation;

    protected AbstractStateStoredAggregate(StateComputation<C, S, E> computation) {
        if (computation == null) throw new IllegalArgumentException(StateComputation.class.getSimpleName() + " cannot be null");
        this.computation = computation;
    }

    /**
     * Fetch the current state. The returned {@link Mono} must not be empty, absence is represented by {@code F} itself.
     */
    protected abstract Mono<F> fetchCurrent(@NonNull C command);

    protected abstract Optional<S> currentState(@NonNull F fetched);

    protected abstract Mono<R> saveNewState(@NonNull S newState, @NonNull F fetched);

    public final Mono<R> handle(@NonNull C command) {
        Objects.requireNonNull(command, "Command cannot be null");
        return Mono.defer(() -> {
                    log.debug("Handling command {}", command);
                    return fetchCurrent(command);
                })
                .flatMap(fetched -> {
                    S currentState = currentState(fetched).orElseGet(computation::initialState);
                    S newState = computation.computeNewState(currentState, command);
                    return saveNewState(newState, fetched);
                })
                .doOnNext(result -> log.debug("Handled command {}, saved {}", command, result));
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
