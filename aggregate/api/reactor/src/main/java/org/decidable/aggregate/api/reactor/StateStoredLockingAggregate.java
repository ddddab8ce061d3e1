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
import org.decidable.aggregate.api.StateComputation;
import org.decidable.aggregate.api.VersionedState;
import org.decidable.dsl.decider.Decider;
import org.jspecify.annotations.NonNull;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * A reactive state stored aggregate that uses optimistic locking, see {@code org.decidable.aggregate.api.blocking.StateStoredLockingAggregate}.
 */
public class StateStoredLockingAggregate<C, S, E, V> extends AbstractStateStoredAggregate<C, S, E, FetchedState<S, V>, VersionedState<S, V>>
        implements StateLockingRepository<C, S, V> {

    protected final StateLockingRepository<C, S, V> stateRepository;

    public StateStoredLockingAggregate(Decider<C, S, E> decider, StateLockingRepository<C, S, V> stateRepository) {
        this(StateComputation.create(decider), stateRepository);
    }

    protected StateStoredLockingAggregate(StateComputation<C, S, E> computation, StateLockingRepository<C, S, V> stateRepository) {
        super(computation);
        if (stateRepository == null) throw new IllegalArgumentException(StateLockingRepository.class.getSimpleName() + " cannot be null");
        this.stateRepository = stateRepository;
    }

    @Override
    protected Mono<FetchedState<S, V>> fetchCurrent(@NonNull C command) {
        return fetchState(command).defaultIfEmpty(FetchedState.absent());
    }

    @Override
    protected Optional<S> currentState(@NonNull FetchedState<S, V> fetched) {
        return fetched.state();
    }

    @Override
    protected Mono<VersionedState<S, V>> saveNewState(@NonNull S newState, @NonNull FetchedState<S, V> fetched) {
        return save(newState, fetched.version());
    }

    @Override
    public Mono<FetchedState<S, V>> fetchState(@NonNull C command) {
        return stateRepository.fetchState(command);
    }

    @Override
    public Mono<VersionedState<S, V>> save(@NonNull S state, @NonNull Optional<V> version) {
        return stateRepository.save(state, version);
    }
}
