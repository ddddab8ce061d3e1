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

import java.util.Optional;

/**
 * A state stored aggregate uses a {@link Decider} to handle commands. The current state is fetched with {@link StateRepository#fetchState(Object)},
 * the decider computes the new state, which is then saved with {@link StateRepository#save(Object)}.
 * <p>
 * There's no concurrency control, two concurrent calls for the same entity may overwrite each other. Use a {@link StateStoredLockingAggregate}
 * if this is a problem.
 * </p>
 * <p>
 * The aggregate is also a {@link StateRepository} that delegates to the repository it was created with.
 * </p>
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
    protected Optional<S> fetchCurrent(@NonNull C command) {
        return fetchState(command);
    }

    @Override
    protected Optional<S> currentState(@NonNull Optional<S> fetched) {
        return fetched;
    }

    @Override
    protected S saveNewState(@NonNull S newState, @NonNull Optional<S> fetched) {
        return save(newState);
    }

    @Override
    public Optional<@NonNull S> fetchState(@NonNull C command) {
        return stateRepository.fetchState(command);
    }

    @Override
    public S save(@NonNull S state) {
        return stateRepository.save(state);
    }
}
