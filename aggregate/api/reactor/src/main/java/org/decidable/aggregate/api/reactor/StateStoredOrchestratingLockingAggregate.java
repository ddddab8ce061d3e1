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

import org.decidable.aggregate.api.CascadeLimit;
import org.decidable.aggregate.api.OrchestratingStateComputation;
import org.decidable.aggregate.api.StateComputation;
import org.decidable.dsl.decider.Decider;
import org.decidable.dsl.decider.Saga;
import org.jspecify.annotations.NonNull;

import java.util.List;

/**
 * A reactive {@link StateStoredLockingAggregate} that lets a {@link Saga} react to the decided events before the new state is saved.
 */
public class StateStoredOrchestratingLockingAggregate<C, S, E, V> extends StateStoredLockingAggregate<C, S, E, V> implements Saga<E, C> {

    private final Saga<E, C> saga;

    public StateStoredOrchestratingLockingAggregate(Decider<C, S, E> decider, StateLockingRepository<C, S, V> stateRepository, Saga<E, C> saga) {
        this(decider, stateRepository, saga, CascadeLimit.unbounded());
    }

    public StateStoredOrchestratingLockingAggregate(Decider<C, S, E> decider, StateLockingRepository<C, S, V> stateRepository, Saga<E, C> saga,
                                                    CascadeLimit cascadeLimit) {
        this(StateComputation.orchestrating(decider, saga, cascadeLimit), stateRepository);
    }

    protected StateStoredOrchestratingLockingAggregate(OrchestratingStateComputation<C, S, E> computation, StateLockingRepository<C, S, V> stateRepository) {
        super(computation, stateRepository);
        this.saga = computation;
    }

    @NonNull
    @Override
    public List<C> react(@NonNull E event) {
        return saga.react(event);
    }
}
