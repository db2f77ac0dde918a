package org.fhirstack.cli.rendering;

import org.fhirstack.health.ProbeResult;
import org.fhirstack.orchestrator.ServiceStatus;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the {@code status} view as a fixed-width text table, one row per service.
 */
public class StatusTableRenderer {

    private static final String[] HEADERS = {"SERVICE", "STATE", "HEALTH", "RESTARTS", "HANDLE", "DETAIL"};

    /**
     * @param statuses services in startup order
     * @param probes   on-demand probe results by service name, empty if no probes were run
     * @param out      target writer
     */
    public void render(final List<ServiceStatus> statuses, final Map<String, ProbeResult> probes, final PrintWriter out) {
        final List<String[]> rows = new ArrayList<>();
        rows.add(HEADERS);
        for (final ServiceStatus status : statuses) {
            rows.add(new String[] {
                status.name(),
                status.state() == null ? "NOT RUNNING" : status.state().name(),
                status.health().status().name(),
                Integer.toString(status.restartCount()),
                status.handleId() == null ? "-" : status.handleId(),
                detail(status, probes.get(status.name()))
            });
        }

        final int[] widths = new int[HEADERS.length];
        for (final String[] row : rows) {
            for (int i = 0; i < row.length; i++) {
                widths[i] = Math.max(widths[i], row[i].length());
            }
        }
        for (final String[] row : rows) {
            final StringBuilder line = new StringBuilder();
            for (int i = 0; i < row.length; i++) {
                if (i == row.length - 1) {
                    line.append(row[i]);
                } else {
                    line.append(String.format("%-" + widths[i] + "s  ", row[i]));
                }
            }
            out.println(line.toString().stripTrailing());
        }
        out.flush();
    }

    static String detail(final ServiceStatus status, final ProbeResult probe) {
        if (probe != null) {
            return (probe.success() ? "probe ok: " : "probe failed: ") + probe.message();
        }
        if (status.state() == null) {
            return "";
        }
        if (status.lastExitCode() != null && !status.isRunning()) {
            return "exit code " + status.lastExitCode();
        }
        final String message = status.health().lastMessage();
        return message == null ? "" : message;
    }
}
