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

import org.decidable.aggregate.api.CascadeLimit;
import org.decidable.aggregate.api.OrchestratingStateComputation;
import org.decidable.aggregate.api.StateComputation;
import org.decidable.dsl.decider.Decider;
import org.decidable.dsl.decider.Saga;
import org.jspecify.annotations.NonNull;

import java.util.List;

/**
 * A {@link StateStoredAggregate} that also lets a {@link Saga} react to the decided events. Commands returned by the saga are handled
 * by the same decider, recursively, before the new state is saved. This is typically used when the decider is a combination of
 * several deciders, and the saga routes the events of one of them to the commands of another, in a single transaction.
 */
public class StateStoredOrchestratingAggregate<C, S, E> extends StateStoredAggregate<C, S, E> implements Saga<E, C> {

    private final Saga<E, C> saga;

    public StateStoredOrchestratingAggregate(Decider<C, S, E> decider, StateRepository<C, S> stateRepository, Saga<E, C> saga) {
        this(decider, stateRepository, saga, CascadeLimit.unbounded());
    }

    public StateStoredOrchestratingAggregate(Decider<C, S, E> decider, StateRepository<C, S> stateRepository, Saga<E, C> saga, CascadeLimit cascadeLimit) {
        this(StateComputation.orchestrating(decider, saga, cascadeLimit), stateRepository);
    }

    protected StateStoredOrchestratingAggregate(OrchestratingStateComputation<C, S, E> computation, StateRepository<C, S> stateRepository) {
        super(computation, stateRepository);
        this.saga = computation;
    }

    @NonNull
    @Override
    public List<C> react(@NonNull E event) {
        return saga.react(event);
    }
}
