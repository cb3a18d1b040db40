package io.infrautomater.core.orchestration;

import static org.assertj.core.api.Assertions.assertThat;

import io.infrautomater.core.credential.CredentialProvider;
import io.infrautomater.core.engine.ExecutionEngine;
import io.infrautomater.core.engine.ScriptedToolRunner;
import io.infrautomater.core.engine.ToolOutputParser;
import io.infrautomater.core.engine.ToolRunner;
import io.infrautomater.core.execution.FailureKind;
import io.infrautomater.core.generator.DatabaseConfigGenerator;
import io.infrautomater.core.generator.ResourceRouter;
import io.infrautomater.core.request.InMemoryRequestStore;
import io.infrautomater.core.request.RequestStatus;
import io.infrautomater.core.request.ResourceRequest;
import io.infrautomater.core.request.ResourceType;
import io.infrautomater.core.workspace.WorkspaceManager;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProvisioningWorkerPoolTest {

    @TempDir Path tempDir;

    private InMemoryRequestStore store;
    private WorkspaceManager workspaces;
    private ScriptedToolRunner runner;
    private RecordingListener listener;
    private ProvisioningWorkerPool pool;

    @BeforeEach
    void setUp() {
        store = new InMemoryRequestStore();
        workspaces = new WorkspaceManager(tempDir.resolve("workspaces"), null);
        runner = new ScriptedToolRunner();
        listener = new RecordingListener();
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.close();
        }
    }

    private ProvisioningWorkerPool pool(ToolRunner toolRunner, RetryPolicy policy) {
        ExecutionEngine engine =
                new ExecutionEngine(toolRunner, "terraform", Duration.ofSeconds(5), ToolOutputParser.verbatim());
        ResourceRouter router = new ResourceRouter(workspaces, List.of(new DatabaseConfigGenerator(engine)));
        ProvisioningOrchestrator orchestrator =
                new ProvisioningOrchestrator(store, router, workspaces, CredentialProvider.none(), false);
        DestroyWorkflow destroy =
                new DestroyWorkflow(store, workspaces, engine, CredentialProvider.none(), false);
        pool = new ProvisioningWorkerPool(orchestrator, destroy, policy, 2, listener);
        return pool;
    }

    private long approvedDatabase() {
        return store.save(
                        ResourceRequest.builder()
                                .name("ledger")
                                .resourceType(ResourceType.DATABASE)
                                .status(RequestStatus.APPROVED)
                                .build())
                .id();
    }

    private static ProvisioningOutcome await(CompletableFuture<ProvisioningOutcome> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Nested
    class RetryTest {

        @Test
        void shouldRetryRetryableFailureUntilSuccess() throws Exception {
            long id = approvedDatabase();
            runner.fail("apply", 1, "Error: throttled").succeed("apply", "");

            ProvisioningOutcome outcome =
                    await(pool(runner, RetryPolicy.fixed(3, Duration.ofMillis(10))).submitProvision(id));

            assertThat(outcome).isInstanceOf(ProvisioningOutcome.Provisioned.class);
            assertThat(runner.steps()).containsExactly("init", "plan", "apply", "init", "plan", "apply", "output");
            assertThat(listener.retries).containsExactly("1/3");
            assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.PROVISIONED);
        }

        @Test
        void shouldFinalizeFailedWhenAttemptsExhausted() throws Exception {
            long id = approvedDatabase();
            runner.timeout("plan");

            ProvisioningOutcome outcome =
                    await(pool(runner, RetryPolicy.fixed(3, Duration.ZERO)).submitProvision(id));

            assertThat(outcome).isInstanceOf(ProvisioningOutcome.Failed.class);
            assertThat(((ProvisioningOutcome.Failed) outcome).kind()).isEqualTo(FailureKind.TOOL_TIMEOUT);
            assertThat(runner.steps()).filteredOn("plan"::equals).hasSize(3);
            assertThat(listener.retries).containsExactly("1/3", "2/3");
            assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.FAILED);
        }

        @Test
        void shouldNotRetryNonRetryableFailure() throws Exception {
            long id = approvedDatabase();
            runner.missingBinary();

            ProvisioningOutcome outcome =
                    await(pool(runner, RetryPolicy.fixed(3, Duration.ZERO)).submitProvision(id));

            assertThat(((ProvisioningOutcome.Failed) outcome).kind()).isEqualTo(FailureKind.TOOL_NOT_FOUND);
            assertThat(runner.steps()).hasSize(1);
            assertThat(listener.retries).isEmpty();
        }

        @Test
        void shouldContinueHeldClaimAfterTransientFault() throws Exception {
            long id = approvedDatabase();
            runner.throwing("init", new IOException("resource temporarily unavailable"))
                    .succeed("init", "");

            ProvisioningOutcome outcome =
                    await(pool(runner, RetryPolicy.fixed(3, Duration.ZERO)).submitProvision(id));

            assertThat(outcome).isInstanceOf(ProvisioningOutcome.Provisioned.class);
            assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.PROVISIONED);
        }

        @Test
        void shouldAbandonClaimWhenTransientFaultsPersist() throws Exception {
            long id = approvedDatabase();
            runner.throwing("init", new IOException("resource temporarily unavailable"));

            ProvisioningOutcome outcome =
                    await(pool(runner, RetryPolicy.fixed(2, Duration.ZERO)).submitProvision(id));

            assertThat(outcome)
                    .isEqualTo(
                            new ProvisioningOutcome.Failed(
                                    id, FailureKind.TRANSIENT, "resource temporarily unavailable"));
            assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.FAILED);
            assertThat(store.get(id).orElseThrow().notes())
                    .isEqualTo("Provisioning error: resource temporarily unavailable");
        }

        @Test
        void shouldNoteDestroyWhenTransientFaultsPersist() throws Exception {
            long id = approvedDatabase();
            ProvisioningWorkerPool workerPool = pool(runner, RetryPolicy.fixed(3, Duration.ofMillis(5)));
            await(workerPool.submitProvision(id));
            runner.throwing("init", new IOException("Cannot run program: error=13, Permission denied"));

            ProvisioningOutcome outcome = await(workerPool.submitDestroy(id));

            assertThat(outcome)
                    .isEqualTo(
                            new ProvisioningOutcome.Failed(
                                    id,
                                    FailureKind.TRANSIENT,
                                    "Cannot run program: error=13, Permission denied"));
            assertThat(listener.retries).containsExactly("1/3", "2/3");
            ResourceRequest request = store.get(id).orElseThrow();
            assertThat(request.status()).isEqualTo(RequestStatus.PROVISIONED);
            assertThat(request.notes())
                    .startsWith("Provisioned successfully")
                    .endsWith("\n\nDestroy failed: Cannot run program: error=13, Permission denied");
            assertThat(workspaces.exists(id)).isTrue();
        }
    }

    @Nested
    class ListenerTest {

        @Test
        void shouldCompleteJobWhenListenerThrows() throws Exception {
            long id = approvedDatabase();
            listener.throwOnCallbacks = true;
            ProvisioningWorkerPool workerPool = pool(runner, RetryPolicy.none());

            ProvisioningOutcome outcome = await(workerPool.submitProvision(id));

            assertThat(outcome).isInstanceOf(ProvisioningOutcome.Provisioned.class);
            assertThat(workerPool.isInFlight(id)).isFalse();
            assertThat(listener.completed).containsExactly("provision");
            assertThat(store.get(id).orElseThrow().status()).isEqualTo(RequestStatus.PROVISIONED);
        }

        @Test
        void shouldKeepRetryingWhenListenerThrows() throws Exception {
            long id = approvedDatabase();
            listener.throwOnCallbacks = true;
            runner.fail("apply", 1, "Error: throttled").succeed("apply", "");

            ProvisioningOutcome outcome =
                    await(pool(runner, RetryPolicy.fixed(3, Duration.ZERO)).submitProvision(id));

            assertThat(outcome).isInstanceOf(ProvisioningOutcome.Provisioned.class);
            assertThat(listener.retries).containsExactly("1/3");
        }
    }

    @Nested
    class InFlightTest {

        @Test
        void shouldDeduplicateConcurrentSubmissions() throws Exception {
            long id = approvedDatabase();
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            ToolRunner blocking =
                    (workDir, command, env, timeout) -> {
                        entered.countDown();
                        try {
                            release.await(10, TimeUnit.SECONDS);
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        return runner.run(workDir, command, env, timeout);
                    };
            ProvisioningWorkerPool workerPool = pool(blocking, RetryPolicy.none());

            CompletableFuture<ProvisioningOutcome> first = workerPool.submitProvision(id);
            assertThat(entered.await(10, TimeUnit.SECONDS)).isTrue();
            CompletableFuture<ProvisioningOutcome> second = workerPool.submitProvision(id);

            assertThat(second).isSameAs(first);
            assertThat(workerPool.isInFlight(id)).isTrue();
            assertThat(workerPool.inFlightCount()).isEqualTo(1);

            release.countDown();
            assertThat(await(first)).isInstanceOf(ProvisioningOutcome.Provisioned.class);
            assertThat(workerPool.isInFlight(id)).isFalse();
            assertThat(runner.steps()).filteredOn("init"::equals).hasSize(1);
        }

        @Test
        void shouldAcceptResubmissionAfterCompletion() throws Exception {
            long id = approvedDatabase();
            ProvisioningWorkerPool workerPool = pool(runner, RetryPolicy.none());

            CompletableFuture<ProvisioningOutcome> first = workerPool.submitProvision(id);
            await(first);
            CompletableFuture<ProvisioningOutcome> second = workerPool.submitProvision(id);

            assertThat(second).isNotSameAs(first);
            assertThat(await(second)).isInstanceOf(ProvisioningOutcome.Skipped.class);
        }

        @Test
        void shouldRunDestroyJobs() throws Exception {
            long id = approvedDatabase();
            ProvisioningWorkerPool workerPool = pool(runner, RetryPolicy.none());
            await(workerPool.submitProvision(id));

            ProvisioningOutcome outcome = await(workerPool.submitDestroy(id));

            assertThat(outcome).isInstanceOf(ProvisioningOutcome.Destroyed.class);
            assertThat(listener.completed).containsExactly("provision", "destroy");
            assertThat(workspaces.exists(id)).isFalse();
        }
    }

    private static final class RecordingListener implements ProvisioningListener {
        final List<String> retries = new CopyOnWriteArrayList<>();
        final List<String> completed = new CopyOnWriteArrayList<>();
        volatile boolean throwOnCallbacks;

        @Override
        public void onAttemptStarted(long requestId, ProvisioningAction action, ProvisioningAttempt attempt) {
            failIfRequested();
        }

        @Override
        public void onRetryScheduled(
                long requestId,
                ProvisioningAction action,
                ProvisioningAttempt failedAttempt,
                Duration delay,
                String reason) {
            retries.add(failedAttempt.toString());
            failIfRequested();
        }

        @Override
        public void onCompleted(long requestId, ProvisioningAction action, ProvisioningOutcome outcome) {
            completed.add(action.value());
            failIfRequested();
        }

        private void failIfRequested() {
            if (throwOnCallbacks) {
                throw new IllegalStateException("listener failure");
            }
        }
    }
}
