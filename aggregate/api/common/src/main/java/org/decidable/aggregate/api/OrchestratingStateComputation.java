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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * A {@link StateComputation} that, in addition to deciding and evolving, lets a {@link Saga} react to the decided events.
 * Every command returned by the saga is decided and evolved against the latest state, and the events of that command are in turn
 * sent to the saga, until the saga no longer returns any commands. All of this happens in memory, as part of a single call to
 * {@link #computeNewState(Object, Object)}, so the caller observes a single state transition.
 * <p>
 * Follow-up commands are processed depth-first. The commands that the saga returns for the events of a command are processed,
 * including all the commands they in turn give rise to, before the next sibling command. Events are reacted to in the order they
 * were decided and commands are processed in the order the saga returned them.
 * </p>
 * <p>
 * The cascade is evaluated with an explicit stack, not recursion, so a long chain of follow-up commands will not overflow the thread stack.
 * Use a {@link CascadeLimit} to protect against sagas that never stop reacting.
 * </p>
 */
public class OrchestratingStateComputation<C, S, E> extends DecidingStateComputation<C, S, E> implements Saga<E, C> {
    private static final Logger log = LoggerFactory.getLogger(OrchestratingStateComputation.class);

    protected final Saga<E, C> saga;
    private final CascadeLimit cascadeLimit;

    public OrchestratingStateComputation(Decider<C, S, E> decider, Saga<E, C> saga) {
        this(decider, saga, CascadeLimit.unbounded());
    }

    public OrchestratingStateComputation(Decider<C, S, E> decider, Saga<E, C> saga, CascadeLimit cascadeLimit) {
        super(decider);
        if (saga == null) throw new IllegalArgumentException(Saga.class.getSimpleName() + " cannot be null");
        if (cascadeLimit == null) throw new IllegalArgumentException(CascadeLimit.class.getSimpleName() + " cannot be null");
        this.saga = saga;
        this.cascadeLimit = cascadeLimit;
    }

    @NonNull
    @Override
    public List<C> react(@NonNull E event) {
        return saga.react(event);
    }

    public CascadeLimit cascadeLimit() {
        return cascadeLimit;
    }

    @Override
    public S computeNewState(S state, @NonNull C command) {
        List<E> events = decider.decide(command, state);
        S newState = fold(state, events);

        // Each entry holds the remaining follow-up commands of one already evolved command
        Deque<Iterator<C>> pending = new ArrayDeque<>();
        pending.push(followUpCommands(events));
        long numberOfFollowUpCommands = 0;
        while (!pending.isEmpty()) {
            Iterator<C> followUps = pending.peek();
            if (!followUps.hasNext()) {
                pending.pop();
                continue;
            }

            C followUpCommand = followUps.next();
            numberOfFollowUpCommands++;
            if (cascadeLimit.isExceededBy(numberOfFollowUpCommands)) {
                log.warn("Cascade started by command {} exceeded {}, aborting", command, cascadeLimit);
                throw new CascadeLimitExceededException(cascadeLimit, command,
                        String.format("Command %s resulted in more follow-up commands than allowed by %s", command, cascadeLimit));
            }
            log.trace("Processing follow-up command {} (depth={})", followUpCommand, pending.size());

            List<E> followUpEvents = decider.decide(followUpCommand, newState);
            newState = fold(newState, followUpEvents);
            pending.push(followUpCommands(followUpEvents));
        }

        if (numberOfFollowUpCommands > 0) {
            log.debug("Command {} resulted in {} follow-up command(s)", command, numberOfFollowUpCommands);
        }
        return newState;
    }

    private Iterator<C> followUpCommands(List<E> events) {
        if (events.isEmpty()) {
            return List.<C>of().iterator();
        }
        List<C> commands = new ArrayList<>();
        for (E event : events) {
            commands.addAll(saga.react(event));
        }
        return commands.iterator();
    }
}
