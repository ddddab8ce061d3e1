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

import org.decidable.aggregate.api.FetchedState;
import org.decidable.aggregate.api.VersionConflictException;
import org.decidable.aggregate.api.VersionedState;
import org.decidable.aggregate.api.blocking.StateLockingRepository;
import org.jspecify.annotations.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * A {@link StateLockingRepository} that stores state in-memory, versioned with a {@code long} that starts at 1 and is incremented on every save.
 * A save is rejected with a {@link VersionConflictException} if the supplied version doesn't match the stored version, or, when no version
 * is supplied, if state has already been stored. The check and the write are atomic.
 * <p>
 * Every saved state must have an id. If the decider's initial state carries no id, a command that doesn't change it on an empty repository
 * is rejected with an {@link IllegalArgumentException} since there's no entry to version.
 * </p>
 *
 * @param <C>  The type of command
 * @param <S>  The type of state
 * @param <ID> The type of the id that uniquely identifies the state
 */
public class InMemoryStateLockingRepository<C, S, ID> implements StateLockingRepository<C, S, Long> {
    private static final Logger log = LoggerFactory.getLogger(InMemoryStateLockingRepository.class);

    private final Map<ID, VersionedState<S, Long>> states = new ConcurrentHashMap<>();
    private final Function<C, ID> idFromCommand;
    private final Function<S, ID> idFromState;

    public InMemoryStateLockingRepository(Function<C, ID> idFromCommand, Function<S, ID> idFromState) {
        if (idFromCommand == null) throw new IllegalArgumentException("idFromCommand cannot be null");
        if (idFromState == null) throw new IllegalArgumentException("idFromState cannot be null");
        this.idFromCommand = idFromCommand;
        this.idFromState = idFromState;
    }

    @NonNull
    @Override
    public FetchedState<S, Long> fetchState(@NonNull C command) {
        VersionedState<S, Long> versionedState = states.get(idFromCommand.apply(command));
        return versionedState == null ? FetchedState.absent() : FetchedState.of(versionedState.state(), versionedState.version());
    }

    @NonNull
    @Override
    public VersionedState<S, Long> save(@NonNull S state, @NonNull Optional<Long> version) {
        Objects.requireNonNull(version, "version cannot be null");
        ID id = idFromState.apply(state);
        if (id == null) throw new IllegalArgumentException("idFromState returned null for state " + state);
        Long expectedVersion = version.orElse(null);
        return states.compute(id, (__, current) -> {
            Long currentVersion = current == null ? null : current.version();
            if (!Objects.equals(expectedVersion, currentVersion)) {
                log.debug("Rejecting save of {} since expected version {} doesn't match current version {}", id, expectedVersion, currentVersion);
                throw new VersionConflictException(expectedVersion, currentVersion);
            }
            return new VersionedState<>(state, currentVersion == null ? 1L : currentVersion + 1);
        });
    }

    public Optional<VersionedState<S, Long>> findById(ID id) {
        return Optional.ofNullable(states.get(id));
    }
}
