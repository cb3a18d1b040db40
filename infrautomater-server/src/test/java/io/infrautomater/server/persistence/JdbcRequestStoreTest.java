package io.infrautomater.server.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.infrautomater.core.request.IllegalStatusTransitionException;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.ResourceRequest;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/// Integration tests for {@link JdbcRequestStore} against a real PostgreSQL instance.
///
/// Verifies row mapping, compare-and-set races, note joining and stale-claim reclaim.
class JdbcRequestStoreTest extends JdbcRequestStoreTestBase {

    private JdbcRequestStore store;

    @BeforeEach
    void setUp() throws SQLException {
        truncate();
        store = new JdbcRequestStore(dataSource, configCodec);
    }

    @Test
    void insertAndGet_roundTrip() {
        ResourceRequest inserted = store.insert(request("orders-db", RequestStatus.APPROVED));

        ResourceRequest found = store.get(inserted.id()).orElseThrow();
        assertThat(found.id()).isPositive();
        assertThat(found.name()).isEqualTo("orders-db");
        assertThat(found.resourceType()).isEqualTo("database");
        assertThat(found.config()).containsEntry("engine", "postgres").containsEntry("size", "small");
        assertThat(found.status()).isEqualTo(RequestStatus.APPROVED);
        assertThat(found.notes()).isEmpty();
        assertThat(found.userId()).isEqualTo(11L);
        assertThat(found.teamId()).isEqualTo(7L);
        assertThat(found.createdAt()).isNotNull();
        assertThat(found.updatedAt()).isNotNull();
    }

    @Test
    void get_returnsEmptyWhenNotFound() {
        assertThat(store.get(424242L)).isEmpty();
    }

    @Test
    void compareAndSet_movesOnlyFromExpectedStatus() {
        long id = store.insert(request("orders-db", RequestStatus.APPROVED)).id();

        assertThat(store.compareAndSetStatus(id, RequestStatus.APPROVED, RequestStatus.PROVISIONING))
                .isTrue();
        assertThat(store.compareAndSetStatus(id, RequestStatus.APPROVED, RequestStatus.PROVISIONING))
                .isFalse();
        assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.PROVISIONING);
    }

    @Test
    void compareAndSet_rejectsIllegalTransitionBeforeTouchingRow() {
        long id = store.insert(request("orders-db", RequestStatus.APPROVED)).id();

        assertThatThrownBy(
                        () ->
                                store.compareAndSetStatus(
                                        id, RequestStatus.APPROVED, RequestStatus.DESTROYED))
                .isInstanceOf(IllegalStatusTransitionException.class);
        assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.APPROVED);
    }

    @Test
    void compareAndSet_concurrentClaimsHaveSingleWinner() throws Exception {
        long id = store.insert(request("orders-db", RequestStatus.APPROVED)).id();
        int contenders = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(contenders);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < contenders; i++) {
                Callable<Boolean> claim =
                        () -> {
                            start.await();
                            return store.compareAndSetStatus(
                                    id, RequestStatus.APPROVED, RequestStatus.PROVISIONING);
                        };
                results.add(executor.submit(claim));
            }
            start.countDown();

            int winners = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    winners++;
                }
            }
            assertThat(winners).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void compareAndSetWithNote_writesStatusAndNoteTogether() {
        long id = store.insert(request("orders-db", RequestStatus.PROVISIONING)).id();

        boolean moved =
                store.compareAndSetStatus(
                        id, RequestStatus.PROVISIONING, RequestStatus.PROVISIONED, "Provisioned successfully");

        ResourceRequest found = store.get(id).orElseThrow();
        assertThat(moved).isTrue();
        assertThat(found.status()).isEqualTo(RequestStatus.PROVISIONED);
        assertThat(found.notes()).isEqualTo("Provisioned successfully");
    }

    @Test
    void compareAndSetWithNote_lostRaceLeavesNotesUntouched() {
        long id = store.insert(request("orders-db", RequestStatus.FAILED)).id();

        boolean moved =
                store.compareAndSetStatus(
                        id, RequestStatus.PROVISIONING, RequestStatus.PROVISIONED, "Provisioned successfully");

        assertThat(moved).isFalse();
        assertThat(store.get(id).orElseThrow().notes()).isEmpty();
    }

    @Test
    void appendNotes_joinsWithBlankLine() {
        long id = store.insert(request("orders-db", RequestStatus.PROVISIONING)).id();

        store.appendNotes(id, "Attempt 1/3 failed (TOOL_TIMEOUT): plan timed out; retrying");
        store.appendNotes(id, "Provisioned successfully");

        assertThat(store.get(id).orElseThrow().notes())
                .isEqualTo(
                        "Attempt 1/3 failed (TOOL_TIMEOUT): plan timed out; retrying\n\n"
                                + "Provisioned successfully");
    }

    @Test
    void setStatus_validatesTransition() {
        long id = store.insert(request("orders-db", RequestStatus.PROVISIONED)).id();

        store.setStatus(id, RequestStatus.DESTROYED);
        assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.DESTROYED);

        assertThatThrownBy(() -> store.setStatus(id, RequestStatus.APPROVED))
                .isInstanceOf(IllegalStatusTransitionException.class);
        assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.DESTROYED);
    }

    @Test
    void setStatus_ignoresUnknownId() {
        store.setStatus(424242L, RequestStatus.FAILED);

        assertThat(store.get(424242L)).isEmpty();
    }

    @Test
    void findIdsByStatus_returnsOldestFirstWithinLimit() {
        long first = store.insert(request("a", RequestStatus.APPROVED)).id();
        store.insert(request("b", RequestStatus.PENDING));
        long third = store.insert(request("c", RequestStatus.APPROVED)).id();
        store.insert(request("d", RequestStatus.APPROVED));

        assertThat(store.findIdsByStatus(RequestStatus.APPROVED, 2)).containsExactly(first, third);
    }

    @Test
    void reclaimStale_returnsProvisioningClaimsToApproved() {
        long claimed = store.insert(request("orders-db", RequestStatus.PROVISIONING)).id();
        long provisioned = store.insert(request("cache", RequestStatus.PROVISIONED)).id();

        List<Long> reclaimed = store.reclaimStale(Instant.now().plusSeconds(60));

        assertThat(reclaimed).containsExactly(claimed);
        ResourceRequest found = store.get(claimed).orElseThrow();
        assertThat(found.status()).isEqualTo(RequestStatus.APPROVED);
        assertThat(found.notes()).startsWith(JdbcRequestStore.RECLAIM_NOTE).endsWith("Z");
        assertThat(store.get(provisioned).orElseThrow().status()).isEqualTo(RequestStatus.PROVISIONED);
    }

    @Test
    void reclaimStale_leavesFreshClaims() {
        store.insert(request("orders-db", RequestStatus.PROVISIONING));

        assertThat(store.reclaimStale(Instant.now().minusSeconds(3600))).isEmpty();
    }
}
