package hooks.engine;

import hooks.apply.ApplyMechanism;
import hooks.apply.ResourceHandle;
import hooks.apply.ScriptedApplyMechanism;
import hooks.apply.SubmitResult;
import hooks.config.HookConfig;
import hooks.exceptions.ReadinessTimeoutException;
import hooks.manifest.AnnotationExtractor;
import hooks.manifest.Manifest;
import hooks.manifest.Manifests;
import hooks.plan.HookSet;
import hooks.readiness.ObservedState;
import hooks.readiness.ReadinessState;
import hooks.result.FailureReason;
import hooks.result.HookReport;
import hooks.result.PhaseResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static hooks.phase.PhaseIdentifier.POST_INSTALL;
import static hooks.phase.PhaseIdentifier.PRE_INSTALL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("PhaseExecutor")
class PhaseExecutorTest {

    private static final HookConfig FAST = HookConfig.builder()
            .readinessTimeout(Duration.ofSeconds(5))
            .pollIntervalMillis(5)
            .build();

    @Mock
    private ApplyMechanism apply;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    private static HookSet hooks(Manifest... manifests) throws Exception {
        return HookSet.assemble(List.of(manifests), new AnnotationExtractor());
    }

    private static ResourceHandle handle(String name) {
        return new ResourceHandle("Job", name, null);
    }

    @Nested
    @DisplayName("empty phase")
    class EmptyPhase {

        @Test
        @DisplayName("should succeed without touching the apply mechanism")
        void shouldSucceedWithoutApplyCalls() throws Exception {
            PhaseExecutor executor = new PhaseExecutor(apply, FAST);

            PhaseResult result = executor.run(PRE_INSTALL, hooks(Manifests.job("other", "post-install")));

            assertThat(result.success()).isTrue();
            assertThat(result.reports()).isEmpty();
            assertThat(result.failedHook()).isNull();
            verifyNoInteractions(apply);
        }
    }

    @Nested
    @DisplayName("non-polled kinds")
    class NonPolledKinds {

        @Test
        @DisplayName("should be ready once the submission is accepted, without polling")
        void shouldBeReadyOnAcceptance() throws Exception {
            Manifest cfg = Manifests.configMap("cfg", "pre-install");
            when(apply.submit(cfg)).thenReturn(SubmitResult.accepted(new ResourceHandle("ConfigMap", "cfg", "uid-1")));

            PhaseResult result = new PhaseExecutor(apply, FAST).run(PRE_INSTALL, hooks(cfg));

            assertThat(result.success()).isTrue();
            assertThat(result.reports()).singleElement()
                    .satisfies(r -> assertThat(r.state()).isEqualTo(ReadinessState.READY));
            verify(apply).submit(cfg);
            verify(apply, never()).poll(any());
        }

        @Test
        @DisplayName("should pass the manifest through unmodified")
        void shouldPassManifestThrough() throws Exception {
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism();
            Manifest secret = Manifests.hook("Secret", "creds", "pre-install");

            new PhaseExecutor(fake, FAST).run(PRE_INSTALL, hooks(secret));

            assertThat(fake.submittedNames()).containsExactly("creds");
            assertThat(fake.events()).containsExactly("submit:creds");
        }
    }

    @Nested
    @DisplayName("run-to-completion hooks")
    class RunToCompletion {

        @Test
        @DisplayName("should succeed only after observing terminal success")
        void shouldSucceedAfterTerminalSuccess() throws Exception {
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism()
                    .script("init", ObservedState.active(), ObservedState.active(), ObservedState.succeeded());

            PhaseResult result = new PhaseExecutor(fake, FAST).run(PRE_INSTALL, hooks(Manifests.job("init", "pre-install")));

            assertThat(result.success()).isTrue();
            assertThat(fake.pollsOf("init")).isEqualTo(3);
            assertThat(fake.events()).last().isEqualTo("poll:init");
        }

        @Test
        @DisplayName("should fail on terminal failure and not submit later hooks")
        void shouldFailAndStopOnTerminalFailure() throws Exception {
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism()
                    .script("first", ObservedState.active(), ObservedState.failed("BackoffLimitExceeded"))
                    .script("second", ObservedState.succeeded());

            PhaseResult result = new PhaseExecutor(fake, FAST).run(PRE_INSTALL,
                    hooks(Manifests.job("first", "pre-install"), Manifests.job("second", "pre-install")));

            assertThat(result.success()).isFalse();
            assertThat(result.aborted()).isTrue();
            assertThat(result.failedHook().name()).isEqualTo("Job/first");
            assertThat(result.failureReason()).isEqualTo(FailureReason.HOOK_FAILED);
            assertThat(result.failedHook().message()).isEqualTo("BackoffLimitExceeded");
            assertThat(result.skipped()).isEqualTo(1);
            assertThat(fake.submittedNames()).containsExactly("first");
        }

        @Test
        @DisplayName("should time out a hook that never finishes")
        void shouldTimeOut() throws Exception {
            HookConfig config = HookConfig.builder()
                    .readinessTimeout(Duration.ofMillis(60))
                    .pollIntervalMillis(5)
                    .build();
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism().script("stuck", ObservedState.active());

            PhaseResult result = new PhaseExecutor(fake, config).run(PRE_INSTALL, hooks(Manifests.job("stuck", "pre-install")));

            HookReport report = result.failedHook();
            assertThat(report.reason()).isEqualTo(FailureReason.READINESS_TIMEOUT);
            assertThat(report.error()).isInstanceOf(ReadinessTimeoutException.class);
            assertThat(report.message()).contains("Job/stuck").contains("60 ms");
            assertThat(report.durationMs()).isGreaterThanOrEqualTo(60);
            assertThat(fake.pollsOf("stuck")).isGreaterThan(1);
        }

        @Test
        @DisplayName("should treat a timeout too large for nanoseconds as a long deadline")
        void shouldAcceptHugeTimeout() throws Exception {
            HookConfig config = HookConfig.builder()
                    .readinessTimeoutSeconds(10_000_000_000L)
                    .pollIntervalMillis(5)
                    .build();
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism()
                    .script("migrate", ObservedState.active(), ObservedState.succeeded());

            PhaseResult result = new PhaseExecutor(fake, config).run(PRE_INSTALL, hooks(Manifests.job("migrate", "pre-install")));

            assertThat(result.success()).isTrue();
            assertThat(fake.pollsOf("migrate")).isEqualTo(2);
        }

        @Test
        @DisplayName("should cut a huge poll interval short at the deadline")
        void shouldCapHugePollIntervalAtDeadline() throws Exception {
            HookConfig config = HookConfig.builder()
                    .readinessTimeout(Duration.ofMillis(50))
                    .pollIntervalMillis(Long.MAX_VALUE)
                    .build();
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism().script("stuck", ObservedState.active());

            PhaseResult result = new PhaseExecutor(fake, config).run(PRE_INSTALL, hooks(Manifests.job("stuck", "pre-install")));

            assertThat(result.failureReason()).isEqualTo(FailureReason.READINESS_TIMEOUT);
        }

        @Test
        @DisplayName("should fail the hook when polling throws")
        void shouldFailWhenPollThrows() throws Exception {
            Manifest job = Manifests.job("flaky", "pre-install");
            when(apply.submit(job)).thenReturn(SubmitResult.accepted(handle("flaky")));
            when(apply.poll(handle("flaky"))).thenThrow(new IOException("connection reset"));

            PhaseResult result = new PhaseExecutor(apply, FAST).run(PRE_INSTALL, hooks(job));

            assertThat(result.failureReason()).isEqualTo(FailureReason.HOOK_FAILED);
            assertThat(result.failedHook().error()).isInstanceOf(IOException.class);
            assertThat(result.failedHook().message()).contains("connection reset");
        }

        @Test
        @DisplayName("should stop waiting when cancelled")
        void shouldStopWhenCancelled() throws Exception {
            HookConfig unbounded = HookConfig.builder()
                    .readinessTimeout(HookConfig.NO_TIMEOUT)
                    .pollIntervalMillis(10_000)
                    .build();
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism().script("long", ObservedState.active());
            CancellationSignal cancel = new CancellationSignal();
            PhaseExecutor executor = new PhaseExecutor(fake, unbounded);
            HookSet set = hooks(Manifests.job("long", "pre-install"));

            CompletableFuture<PhaseResult> running = CompletableFuture.supplyAsync(() -> executor.run(PRE_INSTALL, set, cancel));
            while (fake.pollsOf("long") == 0) {
                Thread.sleep(5);
            }
            cancel.cancel();

            PhaseResult result = running.get(5, TimeUnit.SECONDS);
            assertThat(result.failureReason()).isEqualTo(FailureReason.CANCELLED);
            assertThat(cancel.isCancelled()).isTrue();
        }
    }

    @Nested
    @DisplayName("submission failures")
    class SubmissionFailures {

        @Test
        @DisplayName("should fail immediately when the apply mechanism rejects a hook")
        void shouldFailOnRejection() throws Exception {
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism().reject("bad");

            PhaseResult result = new PhaseExecutor(fake, FAST).run(POST_INSTALL,
                    hooks(Manifests.configMap("bad", "post-install"), Manifests.job("next", "post-install")));

            assertThat(result.failureReason()).isEqualTo(FailureReason.SUBMISSION_FAILED);
            assertThat(result.failedHook().message()).contains("admission denied");
            assertThat(fake.events()).containsExactly("submit:bad");
        }

        @Test
        @DisplayName("should treat a submit exception as a rejection")
        void shouldTreatExceptionAsRejection() throws Exception {
            Manifest job = Manifests.job("j", "pre-install");
            when(apply.submit(job)).thenThrow(new IllegalStateException("conflict"));

            PhaseResult result = new PhaseExecutor(apply, FAST).run(PRE_INSTALL, hooks(job));

            assertThat(result.failureReason()).isEqualTo(FailureReason.SUBMISSION_FAILED);
            assertThat(result.failedHook().error()).hasMessage("conflict");
            verify(apply, never()).poll(any());
        }
    }

    @Nested
    @DisplayName("execution order")
    class ExecutionOrder {

        @Test
        @DisplayName("should run hooks serially, each reaching a terminal state before the next is submitted")
        void shouldRunSerially() throws Exception {
            ScriptedApplyMechanism fake = new ScriptedApplyMechanism()
                    .script("a", ObservedState.active(), ObservedState.succeeded())
                    .script("b", ObservedState.succeeded());

            PhaseResult result = new PhaseExecutor(fake, FAST).run(PRE_INSTALL, hooks(
                    Manifests.job("a", "pre-install"),
                    Manifests.configMap("c", "pre-install"),
                    Manifests.job("b", "pre-install")));

            assertThat(result.success()).isTrue();
            assertThat(fake.submittedNames()).containsExactlyInAnyOrder("a", "b", "c");

            // events of one hook are contiguous
            List<String> owners = new ArrayList<>();
            for (String e : fake.events()) {
                String owner = e.substring(e.indexOf(':') + 1);
                if (owners.isEmpty() || !owners.get(owners.size() - 1).equals(owner)) {
                    owners.add(owner);
                }
            }
            assertThat(owners).doesNotHaveDuplicates().hasSize(3);
        }
    }
}
