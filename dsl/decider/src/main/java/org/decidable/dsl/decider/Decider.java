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

package org.decidable.dsl.decider;

import org.jspecify.annotations.NonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * A decider is a model that can be implemented to get a structured way to implement decision logic for a business entity (typically aggregate) or use case.
 * <p>
 * Both {@link #decide(Object, Object)} and {@link #evolve(Object, Object)} must be pure and total. A decider may throw domain specific exceptions,
 * these are never caught by the components that use it.
 * </p>
 *
 * @param <C> The type of commands that the decider can handle
 * @param <S> The state that the decider work
 * @param <E> The type of events that the decider returns
 */
public interface Decider<C, S, E> {
    S initialState();

    /**
     * Decide which events that should be the result of applying the {@code command} to the {@code state}.
     *
     * @return The events in the order they should be applied, or an empty list if the command doesn't change anything.
     */
    @NonNull
    List<E> decide(@NonNull C command, S state);

    S evolve(S state, @NonNull E event);

    /**
     * Apply the {@code commands}, one by one, to the {@code state}. Each command sees the state produced by the previous one.
     *
     * @return A {@link Decision} holding the resulting state and all events that were decided, in order.
     */
    @NonNull
    default Decision<S, E> decideOnState(S state, @NonNull List<C> commands) {
        Objects.requireNonNull(commands, "Commands cannot be null");
        Decision<S, E> decision = new Decision<>(state, List.of());
        for (C command : commands) {
            List<E> newEvents = decide(command, decision.state);
            S newState = fold(decision.state, newEvents);
            List<E> accumulatedEvents = new ArrayList<>(decision.events);
            accumulatedEvents.addAll(newEvents);
            decision = new Decision<>(newState, accumulatedEvents);
        }
        return decision;
    }

    /**
     * Evolve the {@code state} by applying each event, left to right.
     */
    default S fold(S state, @NonNull List<E> events) {
        for (E event : events) {
            state = evolve(state, event);
        }
        return state;
    }

    record Decision<S, E>(S state, List<E> events) {
    }

    static <C, S, E> Decider<C, S, E> create(S initialState, @NonNull BiFunction<C, S, List<E>> decide, @NonNull BiFunction<S, E, S> evolve) {
        Objects.requireNonNull(decide, "decide cannot be null");
        Objects.requireNonNull(evolve, "evolve cannot be null");
        return new Decider<>() {
            @Override
            public S initialState() {
                return initialState;
            }

            @NonNull
            @Override
            public List<E> decide(@NonNull C command, S state) {
                return decide.apply(command, state);
            }

            @Override
            public S evolve(S state, @NonNull E event) {
                return evolve.apply(state, event);
            }
        };
    }
}
