package org.fhirstack.cli.rendering;

import org.fhirstack.health.HealthRecord;
import org.fhirstack.health.HealthStatus;
import org.fhirstack.health.ProbeResult;
import org.fhirstack.orchestrator.ServiceStatus;
import org.fhirstack.supervisor.InstanceState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StatusTableRendererTest {

    private static final HealthRecord HEALTHY = new HealthRecord(HealthStatus.HEALTHY, 3, 0, Instant.now(), "connected");

    @Test
    @DisplayName("Columns are aligned across rows")
    void render_alignsColumns() {
        StringWriter buffer = new StringWriter();
        List<ServiceStatus> statuses = List.of(
            new ServiceStatus("mongodb", InstanceState.RUNNING, HEALTHY, 2, "c0ffee", null),
            ServiceStatus.notRunning("spark-fhir-store"));

        new StatusTableRenderer().render(statuses, Map.of(), new PrintWriter(buffer));

        String[] lines = buffer.toString().split("\\R");
        assertThat(lines).hasSize(3);
        assertThat(lines[0]).startsWith("SERVICE");
        int stateColumn = lines[0].indexOf("STATE");
        assertThat(lines[1].indexOf("RUNNING")).isEqualTo(stateColumn);
        assertThat(lines[2].indexOf("NOT RUNNING")).isEqualTo(stateColumn);
        assertThat(lines[1]).endsWith("connected");
        assertThat(lines[2]).endsWith(" -");
    }

    @Test
    @DisplayName("The detail column prefers probe results, then exit codes, then the last health message")
    void detail_precedence() {
        ServiceStatus running = new ServiceStatus("db", InstanceState.RUNNING, HEALTHY, 0, "h", null);
        ServiceStatus exited = new ServiceStatus("db", InstanceState.FAILED, HEALTHY, 5, "h", 137);

        assertThat(StatusTableRenderer.detail(running, ProbeResult.failure("refused"))).isEqualTo("probe failed: refused");
        assertThat(StatusTableRenderer.detail(running, null)).isEqualTo("connected");
        assertThat(StatusTableRenderer.detail(exited, null)).isEqualTo("exit code 137");
        assertThat(StatusTableRenderer.detail(ServiceStatus.notRunning("db"), null)).isEmpty();
    }
}
