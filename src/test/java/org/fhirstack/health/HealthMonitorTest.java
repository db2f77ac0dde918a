package org.fhirstack.health;

import org.fhirstack.junit.extensions.logging.AllowLog;
import org.fhirstack.junit.extensions.logging.ExpectLog;
import org.fhirstack.junit.extensions.logging.LogLevel;
import org.fhirstack.junit.extensions.logging.LogWatchExtension;
import org.fhirstack.spec.HealthProbeSpec;
import org.fhirstack.spec.ProbeType;
import org.fhirstack.spec.RestartPolicy;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.InstanceState;
import org.fhirstack.supervisor.ProcessSupervisor;
import org.fhirstack.supervisor.ServiceInstance;
import org.fhirstack.testsupport.FakeLauncher;
import org.fhirstack.testsupport.ScriptedProbeFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class HealthMonitorTest {

    private static final ProbeResult OK = ProbeResult.success("ok");
    private static final ProbeResult FAIL = ProbeResult.failure("connection refused");

    private static HealthProbeSpec thresholds(int successes, int failures, Duration startPeriod) {
        return new HealthProbeSpec(ProbeType.PROCESS, null, Duration.ofMillis(20), Duration.ofMillis(100),
            successes, failures, startPeriod);
    }

    @Nested
    @DisplayName("evaluate")
    class Evaluate {

        @Test
        @DisplayName("N consecutive successes make a service healthy")
        void successThreshold() {
            HealthProbeSpec spec = thresholds(2, 3, Duration.ZERO);

            HealthRecord first = HealthMonitor.evaluate(HealthRecord.unknown(), OK, spec, false);
            HealthRecord second = HealthMonitor.evaluate(first, OK, spec, false);

            assertThat(first.status()).isEqualTo(HealthStatus.UNKNOWN);
            assertThat(second.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(second.consecutiveSuccesses()).isEqualTo(2);
        }

        @Test
        @DisplayName("M consecutive failures make a service unhealthy; a success in between resets the count")
        void failureThreshold() {
            HealthProbeSpec spec = thresholds(1, 3, Duration.ZERO);

            HealthRecord record = HealthRecord.unknown();
            record = HealthMonitor.evaluate(record, FAIL, spec, false);
            record = HealthMonitor.evaluate(record, FAIL, spec, false);
            assertThat(record.status()).isEqualTo(HealthStatus.UNKNOWN);
            assertThat(record.consecutiveFailures()).isEqualTo(2);

            HealthRecord recovered = HealthMonitor.evaluate(record, OK, spec, false);
            assertThat(recovered.consecutiveFailures()).isZero();

            record = HealthMonitor.evaluate(record, FAIL, spec, false);
            assertThat(record.status()).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(record.lastMessage()).isEqualTo("connection refused");
        }

        @Test
        @DisplayName("Failures in the start period are not counted before the first healthy result")
        void startPeriod() {
            HealthProbeSpec spec = thresholds(1, 1, Duration.ofSeconds(30));

            HealthRecord inGrace = HealthMonitor.evaluate(HealthRecord.unknown(), FAIL, spec, true);
            assertThat(inGrace.status()).isEqualTo(HealthStatus.UNKNOWN);
            assertThat(inGrace.consecutiveFailures()).isZero();
            assertThat(inGrace.lastMessage()).endsWith("(start period)");

            HealthRecord healthy = HealthMonitor.evaluate(inGrace, OK, spec, true);
            HealthRecord afterHealthy = HealthMonitor.evaluate(healthy, FAIL, spec, true);
            assertThat(afterHealthy.status()).isEqualTo(HealthStatus.UNHEALTHY);
        }
    }

    @Nested
    @DisplayName("polling")
    class Polling {

        private FakeLauncher launcher;
        private ScriptedProbeFactory probes;
        private ProcessSupervisor supervisor;
        private HealthMonitor monitor;
        private final List<HealthTransition> transitions = new CopyOnWriteArrayList<>();

        @BeforeEach
        void setUp() {
            launcher = new FakeLauncher();
            probes = new ScriptedProbeFactory();
            supervisor = new ProcessSupervisor(launcher);
            monitor = new HealthMonitor(probes);
            supervisor.addListener(monitor);
            monitor.addListener(transitions::add);
        }

        @AfterEach
        void tearDown() {
            monitor.close();
            supervisor.close();
        }

        private ServiceSpec service(String name, int successes, int failures) {
            return ServiceSpec.builder(name).command("fake")
                .health(thresholds(successes, failures, Duration.ZERO))
                .restart(RestartPolicy.never())
                .build();
        }

        @Test
        @DisplayName("Readiness completes once the service is healthy")
        void readiness_completesWhenHealthy() throws Exception {
            probes.script("db", call -> call < 3 ? FAIL : OK);
            CompletableFuture<HealthRecord> ready = monitor.readiness("db");

            supervisor.start(service("db", 1, 5));

            HealthRecord record = ready.get(5, TimeUnit.SECONDS);
            assertThat(record.status()).isEqualTo(HealthStatus.HEALTHY);
            assertThat(probes.calls("db")).isGreaterThanOrEqualTo(3);
            assertThat(monitor.record("db")).map(HealthRecord::status).contains(HealthStatus.HEALTHY);
            assertThat(transitions).extracting(HealthTransition::newStatus).containsExactly(HealthStatus.HEALTHY);
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*HealthMonitor",
            messagePattern = "Service 'db' is unhealthy after 3 failed probe\\(s\\): connection refused")
        @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = ".*'db' is unhealthy.*does not restart it")
        @DisplayName("Three failed probes fail the readiness signal with UnhealthyServiceException")
        void readiness_failsWhenUnhealthy() throws Exception {
            probes.alwaysFailing("db", "connection refused");
            CompletableFuture<HealthRecord> ready = monitor.readiness("db");

            supervisor.start(service("db", 1, 3));

            assertThatThrownBy(() -> ready.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(UnhealthyServiceException.class)
                .hasMessageContaining("'db'")
                .hasMessageContaining("connection refused");
            assertThat(probes.calls("db")).isGreaterThanOrEqualTo(3);
            await().atMost(2, TimeUnit.SECONDS).until(() -> !transitions.isEmpty());
            assertThat(transitions.get(0).newStatus()).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'db' exited unexpectedly \\(exit code 1\\)")
        @DisplayName("A crash after becoming healthy resets readiness until the next run is healthy")
        void readiness_resetByCrash() throws Exception {
            ServiceInstance instance = supervisor.start(ServiceSpec.builder("db").command("fake")
                .health(thresholds(1, 3, Duration.ZERO))
                .restart(RestartPolicy.onFailure(Duration.ofSeconds(10), Duration.ofSeconds(10), 3))
                .build());
            monitor.readiness("db").get(5, TimeUnit.SECONDS);

            launcher.lastHandle("db").exit(1);

            await().atMost(2, TimeUnit.SECONDS).until(() -> instance.getState() == InstanceState.CRASHED);
            await().atMost(2, TimeUnit.SECONDS).until(() -> !monitor.readiness("db").isDone());
            TimeUnit.MILLISECONDS.sleep(100);
            assertThat(monitor.readiness("db")).isNotDone();
        }

        @Test
        @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*HealthMonitor",
            messagePattern = "Service 'db' is unhealthy after 3 failed probe\\(s\\): connection refused")
        @DisplayName("A service that turns unhealthy after being healthy fails later readiness requests")
        void readiness_failsAfterHealthyTurnsUnhealthy() throws Exception {
            probes.script("db", call -> call == 1 ? OK : FAIL);

            supervisor.start(service("db", 1, 3));

            await().atMost(5, TimeUnit.SECONDS).until(() -> transitions.stream()
                .anyMatch(transition -> transition.newStatus() == HealthStatus.UNHEALTHY));
            assertThat(transitions).extracting(HealthTransition::newStatus)
                .containsExactly(HealthStatus.HEALTHY, HealthStatus.UNHEALTHY);
            assertThatThrownBy(() -> monitor.readiness("db").get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOf(UnhealthyServiceException.class)
                .hasMessageContaining("connection refused");
        }

        @Test
        @DisplayName("expectNewRun replaces the outcome of an earlier run with a pending signal")
        void expectNewRun_discardsEarlierOutcome() throws Exception {
            supervisor.start(service("db", 1, 3));
            monitor.readiness("db").get(5, TimeUnit.SECONDS);

            monitor.expectNewRun("db");
            CompletableFuture<HealthRecord> pending = monitor.readiness("db");
            monitor.expectNewRun("db");

            assertThat(pending).isNotDone();
            assertThat(monitor.readiness("db")).isNotDone();
        }

        @Test
        @DisplayName("Stopping a service fails its pending readiness and ends polling")
        void readiness_failsWhenStopped() throws Exception {
            probes.alwaysFailing("db", "starting up");
            CompletableFuture<HealthRecord> ready = monitor.readiness("db");
            ServiceInstance instance = supervisor.start(service("db", 1, 100));
            await().atMost(2, TimeUnit.SECONDS).until(() -> monitor.record("db").isPresent());

            supervisor.stop(instance, Duration.ofSeconds(1));

            assertThatThrownBy(() -> ready.get(5, TimeUnit.SECONDS))
                .cause()
                .isInstanceOf(UnhealthyServiceException.class)
                .hasMessageContaining("was stopped");
            await().atMost(2, TimeUnit.SECONDS).until(() -> monitor.record("db").isEmpty());
            int calls = probes.calls("db");
            TimeUnit.MILLISECONDS.sleep(100);
            assertThat(probes.calls("db")).isEqualTo(calls);
        }

        @Test
        @DisplayName("Watching a new run starts again from UNKNOWN")
        void watch_resetsRecord() throws Exception {
            ServiceInstance instance = supervisor.start(ServiceSpec.builder("db").command("fake")
                .health(thresholds(1, 3, Duration.ZERO).withInterval(Duration.ofMillis(300)))
                .build());
            monitor.readiness("db").get(5, TimeUnit.SECONDS);

            monitor.watch(instance);

            assertThat(monitor.record("db")).map(HealthRecord::status).contains(HealthStatus.UNKNOWN);
            assertThat(monitor.readiness("db")).isNotDone();
        }

        @Test
        @DisplayName("probeOnce runs the probe without changing the record")
        void probeOnce_doesNotTouchRecord() throws Exception {
            probes.alwaysFailing("db", "nope");
            ServiceInstance instance = supervisor.start(service("db", 1, 100));

            ProbeResult result = monitor.probeOnce(instance);

            assertThat(result.success()).isFalse();
            assertThat(result.message()).isEqualTo("nope");
        }
    }
}
