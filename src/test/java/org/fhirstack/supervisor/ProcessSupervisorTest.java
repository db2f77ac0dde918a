package org.fhirstack.supervisor;

import org.fhirstack.health.HealthRecord;
import org.fhirstack.health.HealthStatus;
import org.fhirstack.health.HealthTransition;
import org.fhirstack.junit.extensions.logging.AllowLog;
import org.fhirstack.junit.extensions.logging.ExpectLog;
import org.fhirstack.junit.extensions.logging.LogLevel;
import org.fhirstack.junit.extensions.logging.LogWatchExtension;
import org.fhirstack.spec.RestartPolicy;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.LaunchException;
import org.fhirstack.testsupport.FakeLauncher;
import org.fhirstack.testsupport.FakeServiceHandle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ProcessSupervisorTest {

    private FakeLauncher launcher;
    private ProcessSupervisor supervisor;
    private final List<InstanceStateChangedEvent> events = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        launcher = new FakeLauncher();
        supervisor = new ProcessSupervisor(launcher);
        supervisor.addListener(events::add);
    }

    @AfterEach
    void tearDown() {
        supervisor.close();
    }

    private static ServiceSpec service(String name, RestartPolicy policy) {
        return ServiceSpec.builder(name).command("fake").restart(policy).build();
    }

    private static RestartPolicy onFailure(long baseMillis, int maxAttempts) {
        return RestartPolicy.onFailure(Duration.ofMillis(baseMillis), Duration.ofSeconds(10), maxAttempts);
    }

    @Test
    @DisplayName("start launches the service and reports STARTING then RUNNING")
    void start_reachesRunning() throws Exception {
        ServiceInstance instance = supervisor.start(service("db", RestartPolicy.never()));

        assertThat(instance.getState()).isEqualTo(InstanceState.RUNNING);
        assertThat(instance.getHandle()).isSameAs(launcher.lastHandle("db"));
        assertThat(supervisor.instance("db")).containsSame(instance);
        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
            assertThat(events).extracting(InstanceStateChangedEvent::newState)
                .containsExactly(InstanceState.STARTING, InstanceState.RUNNING));
    }

    @Test
    @DisplayName("A live service cannot be started twice")
    void start_rejectsSecondLiveInstance() throws Exception {
        ServiceSpec spec = service("db", RestartPolicy.never());
        supervisor.start(spec);

        assertThatThrownBy(() -> supervisor.start(spec))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("RUNNING");
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'worker' exited unexpectedly.*")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'worker' failed .*exhausted after 3 restart\\(s\\)")
    @DisplayName("Crashes are restarted after base, 2x base and 4x base, then the service fails")
    void onExit_restartsWithExponentialBackoff() throws Exception {
        ServiceInstance instance = supervisor.start(service("worker", onFailure(100, 3)));

        for (int launch = 1; launch <= 3; launch++) {
            launcher.lastHandle("worker").exit(1);
            int expected = launch + 1;
            await().atMost(5, TimeUnit.SECONDS).until(() -> launcher.launchCount("worker") == expected
                && instance.getState() == InstanceState.RUNNING);
        }
        launcher.lastHandle("worker").exit(1);
        await().atMost(5, TimeUnit.SECONDS).until(() -> instance.getState() == InstanceState.FAILED);

        assertThat(instance.getRestartHistory())
            .extracting(RestartAttempt::delay)
            .containsExactly(Duration.ofMillis(100), Duration.ofMillis(200), Duration.ofMillis(400));
        assertThat(instance.getRestartCount()).isEqualTo(3);
        assertThat(instance.getLastExitCode()).isEqualTo(1);

        List<Long> launches = launcher.launchTimes();
        assertThat(TimeUnit.NANOSECONDS.toMillis(launches.get(1) - launches.get(0))).isGreaterThanOrEqualTo(90);
        assertThat(TimeUnit.NANOSECONDS.toMillis(launches.get(2) - launches.get(1))).isGreaterThanOrEqualTo(190);
        assertThat(TimeUnit.NANOSECONDS.toMillis(launches.get(3) - launches.get(2))).isGreaterThanOrEqualTo(390);
        assertThat(launcher.launchCount("worker")).isEqualTo(4);
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'job' exited unexpectedly \\(exit code 0\\)")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'job' failed.*on-failure.*")
    @DisplayName("A clean exit is not restarted under on-failure")
    void onExit_cleanExitFailsUnderOnFailure() throws Exception {
        ServiceInstance instance = supervisor.start(service("job", onFailure(50, 3)));

        launcher.lastHandle("job").exit(0);

        await().atMost(2, TimeUnit.SECONDS).until(() -> instance.getState() == InstanceState.FAILED);
        assertThat(launcher.launchCount("job")).isEqualTo(1);
        assertThat(instance.getLastExitCode()).isZero();
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'job' exited unexpectedly \\(exit code 0\\)")
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'job' failed.*")
    @DisplayName("always restarts even after a clean exit")
    void onExit_alwaysRestartsCleanExit() throws Exception {
        ServiceInstance instance = supervisor.start(
            service("job", RestartPolicy.always(Duration.ofMillis(50), Duration.ofSeconds(1), 1)));

        launcher.lastHandle("job").exit(0);

        await().atMost(2, TimeUnit.SECONDS).until(() -> launcher.launchCount("job") == 2
            && instance.getState() == InstanceState.RUNNING);
        assertThat(instance.getRestartHistory()).singleElement()
            .satisfies(attempt -> assertThat(attempt.reason()).isEqualTo("exit code 0"));
    }

    @Test
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'db' exited unexpectedly.*")
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'db' failed.*never.*")
    @DisplayName("A crash under never fails the service and notifies listeners")
    void onExit_neverFailsImmediately() throws Exception {
        ServiceInstance instance = supervisor.start(service("db", RestartPolicy.never()));

        launcher.lastHandle("db").exit(2);

        await().atMost(2, TimeUnit.SECONDS).untilAsserted(() ->
            assertThat(events).extracting(InstanceStateChangedEvent::newState)
                .endsWith(InstanceState.CRASHED, InstanceState.FAILED));
        assertThat(instance.getRestartCount()).isZero();
        assertThat(instance.getHandle()).isNull();
    }

    @Test
    @DisplayName("stop terminates gracefully, releases the handle and is not mistaken for a crash")
    void stop_terminatesWithoutRestart() throws Exception {
        ServiceInstance instance = supervisor.start(service("db", onFailure(10, 5)));
        FakeServiceHandle handle = launcher.lastHandle("db");

        supervisor.stop(instance, Duration.ofSeconds(1));

        assertThat(instance.getState()).isEqualTo(InstanceState.STOPPED);
        assertThat(handle.terminateCalls()).isEqualTo(1);
        assertThat(handle.killCalls()).isZero();
        assertThat(handle.releaseCalls()).isEqualTo(1);
        assertThat(supervisor.instance("db")).isEmpty();
        TimeUnit.MILLISECONDS.sleep(100);
        assertThat(launcher.launchCount("db")).isEqualTo(1);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'db' did not stop within 100 ms, killing it")
    @DisplayName("stop kills a service that ignores the termination request")
    void stop_killsAfterTimeout() throws Exception {
        launcher.customize("db", FakeServiceHandle::ignoringTerminate);
        ServiceInstance instance = supervisor.start(service("db", RestartPolicy.never()));

        supervisor.stop(instance, Duration.ofMillis(100));

        assertThat(instance.getState()).isEqualTo(InstanceState.STOPPED);
        assertThat(launcher.lastHandle("db").killCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("Stopping a failed instance only removes it from the table")
    @AllowLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor")
    void stop_onTerminalInstanceIsNoOp() throws Exception {
        ServiceInstance instance = supervisor.start(service("db", RestartPolicy.never()));
        launcher.lastHandle("db").exit(1);
        await().atMost(2, TimeUnit.SECONDS).until(() -> instance.getState() == InstanceState.FAILED);

        supervisor.stop(instance, Duration.ofSeconds(1));

        assertThat(instance.getState()).isEqualTo(InstanceState.FAILED);
        assertThat(supervisor.instance("db")).isEmpty();
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = ".*simulated launch failure Retrying in \\d+ ms\\.", occurrences = 2)
    @DisplayName("Failed launches are retried with backoff")
    void start_retriesFailedLaunch() throws Exception {
        launcher.failLaunches("db", 2);

        ServiceInstance instance = supervisor.start(service("db", onFailure(20, 3)));

        assertThat(instance.getState()).isEqualTo(InstanceState.RUNNING);
        assertThat(launcher.launchCount("db")).isEqualTo(3);
        assertThat(instance.getRestartHistory()).extracting(RestartAttempt::delay)
            .containsExactly(Duration.ofMillis(20), Duration.ofMillis(40));
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*ProcessSupervisor", messagePattern = "Failed to launch 'db': simulated launch failure")
    @DisplayName("A launch failure without restart budget surfaces and fails the instance")
    void start_surfacesLaunchFailure() {
        launcher.failLaunches("db", 1);

        assertThatThrownBy(() -> supervisor.start(service("db", RestartPolicy.never())))
            .isInstanceOfSatisfying(LaunchException.class, e -> assertThat(e.getServiceName()).isEqualTo("db"));
        assertThat(supervisor.instance("db")).map(ServiceInstance::getState).contains(InstanceState.FAILED);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'store' is unhealthy \\(connection refused\\); terminating it for restart")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'store' exited unexpectedly \\(unhealthy\\)")
    @DisplayName("An unhealthy verdict restarts the service like a crash")
    void onHealthChanged_unhealthyRestarts() throws Exception {
        ServiceInstance instance = supervisor.start(service("store", onFailure(20, 3)));
        FakeServiceHandle first = launcher.lastHandle("store");

        supervisor.onHealthChanged(new HealthTransition(instance, instance.getGeneration(), HealthStatus.HEALTHY,
            new HealthRecord(HealthStatus.UNHEALTHY, 0, 3, Instant.now(), "connection refused")));

        await().atMost(2, TimeUnit.SECONDS).until(() -> launcher.launchCount("store") == 2
            && instance.getState() == InstanceState.RUNNING);
        assertThat(first.terminateCalls()).isEqualTo(1);
        assertThat(instance.getRestartHistory()).singleElement()
            .satisfies(attempt -> assertThat(attempt.reason()).isEqualTo("unhealthy"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'store' is unhealthy \\(connection refused\\); terminating it for restart")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Failed to terminate unhealthy service 'store' \\(daemon hiccup\\), killing it")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*ProcessSupervisor", messagePattern = "Service 'store' exited unexpectedly \\(unhealthy\\)")
    @DisplayName("A failed termination of an unhealthy service escalates to a kill and the restart still happens")
    void onHealthChanged_terminateFailureKillsAndRestarts() throws Exception {
        launcher.customize("store", handle -> launcher.launchCount("store") == 1
            ? handle.failingTerminate(new IllegalStateException("daemon hiccup"))
            : handle);
        ServiceInstance instance = supervisor.start(service("store", onFailure(50, 3)));
        FakeServiceHandle first = launcher.lastHandle("store");

        supervisor.onHealthChanged(new HealthTransition(instance, instance.getGeneration(), HealthStatus.HEALTHY,
            new HealthRecord(HealthStatus.UNHEALTHY, 0, 3, Instant.now(), "connection refused")));

        await().atMost(2, TimeUnit.SECONDS).until(() -> launcher.launchCount("store") == 2
            && instance.getState() == InstanceState.RUNNING);
        assertThat(first.terminateCalls()).isEqualTo(1);
        assertThat(first.killCalls()).isEqualTo(1);
        assertThat(first.isAlive()).isFalse();
        assertThat(instance.getRestartHistory()).singleElement()
            .satisfies(attempt -> assertThat(attempt.reason()).isEqualTo("unhealthy"));
    }

    @Test
    @DisplayName("Health events of an earlier generation are ignored")
    void onHealthChanged_ignoresStaleGeneration() throws Exception {
        ServiceInstance instance = supervisor.start(service("store", onFailure(20, 3)));

        supervisor.onHealthChanged(new HealthTransition(instance, instance.getGeneration() - 1, HealthStatus.HEALTHY,
            new HealthRecord(HealthStatus.UNHEALTHY, 0, 3, Instant.now(), "stale")));

        TimeUnit.MILLISECONDS.sleep(100);
        assertThat(launcher.lastHandle("store").terminateCalls()).isZero();
        assertThat(instance.getState()).isEqualTo(InstanceState.RUNNING);
    }

    @Test
    @DisplayName("adopt registers a discovered handle as running")
    void adopt_registersRunningInstance() {
        FakeServiceHandle handle = new FakeServiceHandle("container abc");

        ServiceInstance instance = supervisor.adopt(service("db", RestartPolicy.never()), handle);

        assertThat(instance.getState()).isEqualTo(InstanceState.RUNNING);
        assertThat(instance.snapshot().handleId()).isEqualTo("container abc");
        assertThat(supervisor.snapshots()).extracting(InstanceSnapshot::name).containsExactly("db");
    }
}
