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
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * A reactive state stored aggregate without concurrency control, see {@code org.decidable.aggregate.api.blocking.StateStoredAggregate}.
 */
public class StateStoredAggregate<C, S, E> extends AbstractStateStoredAggregate<C, S, E, Optional<S>, S> implements StateRepository<C, S> {

    protected final StateRepository<C, S> stateRepository;

    public StateStoredAggregate(Decider<C, S, E> decider, StateRepository<C, S> stateRepository) {
        this(StateComputation.create(decider), stateRepository);
    }

    protected StateStoredAggregate(StateComputation<C, S, E> computation, StateRepository<C, S> stateRepository) {
        super(computation);
        if (stateRepository == null) throw new IllegalArgumentException(StateRepository.class.getSimpleName() + " cannot be null");
        this.stateRepository = stateRepository;
    }

    @Override
    protected Mono<Optional<S>> fetchCurrent(@NonNull C command) {
        return fetchState(command)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty());
    }

    @Override
    protected Optional<S> currentState(@NonNull Optional<S> fetched) {
        return fetched;
    }

    @Override
    protected Mono<S> saveNewState(@NonNull S newState, @NonNull Optional<S> fetched) {
        return save(newState);
    }

    @Override
    public Mono<S> fetchState(@NonNull C command) {
        return stateRepository.fetchState(command);
    }

    @Override
    public Mono<S> save(@NonNull S state) {
        return stateRepository.save(state);
    }
}
