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

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * A saga reacts to an action result (typically an event) by issuing new actions (typically commands).
 * It's used to route the events of one decider to the commands of another.
 * <p>
 * A saga must be pure and total. Returning an empty list is the normal way of saying "nothing to do". It's the responsibility
 * of the saga (together with the deciders it routes between) to make sure that a chain of reactions eventually ends.
 * </p>
 *
 * @param <AR> The type of the action result, typically an event
 * @param <A>  The type of the action, typically a command
 */
@FunctionalInterface
public interface Saga<AR, A> {

    @NonNull
    List<A> react(@NonNull AR actionResult);

    static <AR, A> Saga<AR, A> create(@NonNull Function<AR, List<A>> react) {
        Objects.requireNonNull(react, "react cannot be null");
        return react::apply;
    }

    /**
     * @return A saga that never reacts to anything
     */
    static <AR, A> Saga<AR, A> none() {
        return __ -> List.of();
    }
}
