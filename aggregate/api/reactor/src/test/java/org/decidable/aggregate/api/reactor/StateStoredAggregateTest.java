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

import org.decidable.dsl.decider.Decider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayNameGeneration(ReplaceUnderscores.class)
class StateStoredAggregateTest {

    private static final Decider<Integer, Integer, Integer> ADDER = Decider.create(0, (n, s) -> List.of(n), Integer::sum);

    private AtomicReference<Integer> storage;
    private CopyOnWriteArrayList<Integer> savedStates;
    private AtomicInteger fetches;
    private StateRepository<Integer, Integer> repository;

    @BeforeEach
    void create_single_slot_repository() {
        storage = new AtomicReference<>();
        savedStates = new CopyOnWriteArrayList<>();
        fetches = new AtomicInteger();
        repository = StateRepository.create(
                __ -> Mono.fromSupplier(() -> {
                    fetches.incrementAndGet();
                    return storage.get();
                }),
                state -> Mono.fromSupplier(() -> {
                    savedStates.add(state);
                    storage.set(state);
                    return state;
                }));
    }

    @Test
    void handle_on_an_empty_store_starts_from_the_initial_state() {
        // Given
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(ADDER, repository);

        // When
        Mono<Integer> result = aggregate.handle(5);

        // Then
        StepVerifier.create(result).expectNext(5).verifyComplete();
    }

    @Test
    void subsequent_handle_starts_from_the_stored_state() {
        // Given
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(ADDER, repository);

        // When
        Mono<Integer> result = aggregate.handle(5).then(aggregate.handle(3));

        // Then
        StepVerifier.create(result).expectNext(8).verifyComplete();
        assertThat(savedStates).containsExactly(5, 8);
    }

    @Test
    void nothing_is_fetched_until_subscribed() {
        // Given
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(ADDER, repository);

        // When
        Mono<Integer> result = aggregate.handle(5);

        // Then
        assertThat(fetches).hasValue(0);
        StepVerifier.create(result).expectNext(5).verifyComplete();
        assertThat(fetches).hasValue(1);
    }

    @Test
    void errors_from_decide_are_propagated_and_nothing_is_saved() {
        // Given
        Decider<Integer, Integer, Integer> failing = Decider.create(0, (n, s) -> {
            throw new IllegalStateException("expected");
        }, Integer::sum);
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(failing, repository);

        // When
        Mono<Integer> result = aggregate.handle(1);

        // Then
        StepVerifier.create(result).expectErrorMatches(t -> t instanceof IllegalStateException && t.getMessage().equals("expected")).verify();
        assertThat(savedStates).isEmpty();
    }

    @Test
    void errors_from_save_are_propagated() {
        // Given
        StateRepository<Integer, Integer> failing = StateRepository.create(__ -> Mono.empty(), state -> Mono.error(new IllegalStateException("save failed")));
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(ADDER, failing);

        // Then
        StepVerifier.create(aggregate.handle(1)).expectErrorMessage("save failed").verify();
    }

    @Test
    void handle_completes_empty_when_save_completes_empty() {
        // Given
        StateRepository<Integer, Integer> discarding = StateRepository.create(__ -> Mono.empty(), state -> Mono.empty());
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(ADDER, discarding);

        // Then
        StepVerifier.create(aggregate.handle(1)).verifyComplete();
    }

    @Test
    void aggregate_can_be_used_as_a_state_repository() {
        // Given
        StateStoredAggregate<Integer, Integer, Integer> aggregate = new StateStoredAggregate<>(ADDER, repository);

        // When
        Mono<Integer> result = aggregate.save(7).then(aggregate.fetchState(1));

        // Then
        StepVerifier.create(result).expectNext(7).verifyComplete();
        assertThat(savedStates).containsExactly(7);
    }
}
