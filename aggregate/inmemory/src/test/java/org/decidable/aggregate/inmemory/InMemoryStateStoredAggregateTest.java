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
import org.decidable.aggregate.api.blocking.StateStoredAggregate;
import org.decidable.aggregate.api.blocking.StateStoredLockingAggregate;
import org.decidable.aggregate.api.blocking.StateStoredOrchestratingLockingAggregate;
import org.decidable.dsl.decider.Decider;
import org.decidable.dsl.decider.Saga;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator.ReplaceUnderscores;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;
import static org.junit.jupiter.api.Assertions.assertAll;

@DisplayNameGeneration(ReplaceUnderscores.class)
@Timeout(10)
class InMemoryStateStoredAggregateTest {

    record Deposit(String accountId, int amount) {
    }

    record Deposited(String accountId, int amount) {
    }

    record Account(String id, int balance) {
    }

    private static final Decider<Deposit, Account, Deposited> ACCOUNT = Decider.create(new Account(null, 0),
            (command, state) -> command.amount() == 0 ? List.of() : List.of(new Deposited(command.accountId(), command.amount())),
            (state, event) -> new Account(event.accountId(), state.balance() + event.amount()));

    @Nested
    @DisplayName("plain repository")
    class PlainRepository {

        @Test
        void state_is_kept_per_entity() {
            // Given
            InMemoryStateRepository<Deposit, Account, String> repository = new InMemoryStateRepository<>(Deposit::accountId, Account::id);
            StateStoredAggregate<Deposit, Account, Deposited> aggregate = new StateStoredAggregate<>(ACCOUNT, repository);

            // When
            aggregate.handle(new Deposit("account1", 5));
            aggregate.handle(new Deposit("account2", 100));
            Account account1 = aggregate.handle(new Deposit("account1", 3));

            // Then
            assertAll(
                    () -> assertThat(account1).isEqualTo(new Account("account1", 8)),
                    () -> assertThat(repository.findById("account2")).contains(new Account("account2", 100)),
                    () -> assertThat(repository.size()).isEqualTo(2)
            );
        }

        @Test
        void command_that_leaves_the_initial_state_untouched_stores_nothing() {
            // Given
            InMemoryStateRepository<Deposit, Account, String> repository = new InMemoryStateRepository<>(Deposit::accountId, Account::id);
            StateStoredAggregate<Deposit, Account, Deposited> aggregate = new StateStoredAggregate<>(ACCOUNT, repository);

            // When
            Account account = aggregate.handle(new Deposit("account1", 0));

            // Then
            assertAll(
                    () -> assertThat(account).isEqualTo(new Account(null, 0)),
                    () -> assertThat(repository.size()).isZero()
            );
        }
    }

    @Nested
    @DisplayName("locking repository")
    class LockingRepository {

        @Test
        void versions_are_incremented_on_every_handle() {
            // Given
            InMemoryStateLockingRepository<Deposit, Account, String> repository = new InMemoryStateLockingRepository<>(Deposit::accountId, Account::id);
            StateStoredLockingAggregate<Deposit, Account, Deposited, Long> aggregate = new StateStoredLockingAggregate<>(ACCOUNT, repository);

            // When
            VersionedState<Account, Long> first = aggregate.handle(new Deposit("account1", 5));
            VersionedState<Account, Long> second = aggregate.handle(new Deposit("account1", 3));

            // Then
            assertAll(
                    () -> assertThat(first).isEqualTo(new VersionedState<>(new Account("account1", 5), 1L)),
                    () -> assertThat(second).isEqualTo(new VersionedState<>(new Account("account1", 8), 2L))
            );
        }

        @Test
        void command_that_leaves_the_initial_state_untouched_is_rejected_since_the_state_has_no_id() {
            // Given
            InMemoryStateLockingRepository<Deposit, Account, String> repository = new InMemoryStateLockingRepository<>(Deposit::accountId, Account::id);
            StateStoredLockingAggregate<Deposit, Account, Deposited, Long> aggregate = new StateStoredLockingAggregate<>(ACCOUNT, repository);

            // When
            Throwable throwable = catchThrowable(() -> aggregate.handle(new Deposit("account1", 0)));

            // Then
            assertAll(
                    () -> assertThat(throwable).isExactlyInstanceOf(IllegalArgumentException.class)
                            .hasMessage("idFromState returned null for state " + new Account(null, 0)),
                    () -> assertThat(repository.findById("account1")).isEmpty()
            );
        }

        @Test
        void exactly_one_of_two_concurrent_handles_of_the_same_entity_succeeds() throws Exception {
            // Given
            InMemoryStateLockingRepository<Deposit, Account, String> repository = new InMemoryStateLockingRepository<>(Deposit::accountId, Account::id);
            repository.save(new Account("account1", 10), Optional.empty());
            CyclicBarrier bothHaveFetched = new CyclicBarrier(2);
            StateLockingRepository<Deposit, Account, Long> repositoryThatWaitsAfterFetch = StateLockingRepository.create(
                    command -> {
                        FetchedState<Account, Long> fetched = repository.fetchState(command);
                        awaitUnchecked(bothHaveFetched);
                        return fetched;
                    },
                    repository::save);
            StateStoredLockingAggregate<Deposit, Account, Deposited, Long> aggregate = new StateStoredLockingAggregate<>(ACCOUNT, repositoryThatWaitsAfterFetch);
            ExecutorService executor = Executors.newFixedThreadPool(2);

            // When
            List<Throwable> failures = new ArrayList<>();
            List<VersionedState<Account, Long>> successes = new ArrayList<>();
            try {
                Future<VersionedState<Account, Long>> first = executor.submit(() -> aggregate.handle(new Deposit("account1", 1)));
                Future<VersionedState<Account, Long>> second = executor.submit(() -> aggregate.handle(new Deposit("account1", 2)));
                for (Future<VersionedState<Account, Long>> future : List.of(first, second)) {
                    try {
                        successes.add(future.get());
                    } catch (ExecutionException e) {
                        failures.add(e.getCause());
                    }
                }
            } finally {
                executor.shutdownNow();
            }

            // Then
            assertAll(
                    () -> assertThat(successes).hasSize(1),
                    () -> assertThat(successes.get(0).version()).isEqualTo(2L),
                    () -> assertThat(failures).singleElement().isInstanceOf(VersionConflictException.class),
                    () -> assertThat(repository.findById("account1")).contains(successes.get(0))
            );
        }

        @Test
        void orchestrating_aggregate_saves_all_follow_up_deposits_with_a_single_version_increment() {
            // Given
            InMemoryStateLockingRepository<Deposit, Account, String> repository = new InMemoryStateLockingRepository<>(Deposit::accountId, Account::id);
            // Every deposit above 10 earns a bonus of 1
            Saga<Deposited, Deposit> bonus = event -> event.amount() > 10 ? List.of(new Deposit(event.accountId(), 1)) : List.of();
            StateStoredOrchestratingLockingAggregate<Deposit, Account, Deposited, Long> aggregate = new StateStoredOrchestratingLockingAggregate<>(ACCOUNT, repository, bonus);

            // When
            VersionedState<Account, Long> result = aggregate.handle(new Deposit("account1", 50));

            // Then
            assertThat(result).isEqualTo(new VersionedState<>(new Account("account1", 51), 1L));
        }
    }

    private static void awaitUnchecked(CyclicBarrier barrier) {
        try {
            barrier.await();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
