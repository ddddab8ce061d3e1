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

package org.decidable.aggregate.inmemory;

import org.decidable.aggregate.api.blocking.StateRepository;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * A {@link StateRepository} that stores state in-memory. This is mainly useful for testing and/or demo purposes.
 * There's no concurrency control, the last write wins.
 * <p>
 * A state for which {@code idFromState} returns {@code null} (for example an initial state that no command has touched yet) has nowhere to
 * be stored, so saving it is a no-op that returns the state as is.
 * </p>
 *
 * @param <C>  The type of command
 * @param <S>  The type of state
 * @param <ID> The type of the id that uniquely identifies the state
 */
public class InMemoryStateRepository<C, S, ID> implements StateRepository<C, S> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStateRepository.class);

    private final Map<ID, S> states = new ConcurrentHashMap<>();
    private final Function<C, ID> idFromCommand;
    private final Function<S, ID> idFromState;

    /**
     * @param idFromCommand Get the id of the state that a command targets
     * @param idFromState   Get the id of a state, used when saving
     */
    public InMemoryStateRepository(Function<C, ID> idFromCommand, Function<S, ID> idFromState) {
        if (idFromCommand == null) throw new IllegalArgumentException("idFromCommand cannot be null");
        if (idFromState == null) throw new IllegalArgumentException("idFromState cannot be null");
        this.idFromCommand = idFromCommand;
        this.idFromState = idFromState;
    }

    @Override
    public Optional<@NonNull S> fetchState(@NonNull C command) {
        return Optional.ofNullable(states.get(idFromCommand.apply(command)));
    }

    @Override
    public S save(@NonNull S state) {
        ID id = idFromState.apply(state);
        if (id == null) {
            log.debug("Not storing {} since it has no id", state);
            return state;
        }
        states.put(id, state);
        return state;
    }

    public Optional<S> findById(ID id) {
        return Optional.ofNullable(states.get(id));
    }

    public int size() {
        return states.size();
    }
}
