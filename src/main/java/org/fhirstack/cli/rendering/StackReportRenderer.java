package org.fhirstack.cli.rendering;

import org.fhirstack.orchestrator.ServiceReport;
import org.fhirstack.orchestrator.StackReport;
import org.fhirstack.orchestrator.TeardownReport;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;

/**
 * Prints the results of {@code up} and {@code down} for humans.
 */
public class StackReportRenderer {

    public void render(final StackReport report, final boolean requireHealthy, final PrintWriter out) {
        for (final ServiceReport service : report.services()) {
            out.printf("  %-24s %-9s %-9s %s%n",
                service.name(), service.outcome(), service.health(), service.message() == null ? "" : service.message());
        }
        report.error().ifPresent(error -> out.println("Error: " + error));
        if (report.success()) {
            out.println("Stack '" + report.stackName() + "' is up.");
        } else {
            final List<ServiceReport> failures = report.failures(requireHealthy);
            out.println("Stack '" + report.stackName() + "' failed to start. Failed services:");
            for (final ServiceReport failure : failures) {
                out.println("  - " + failure.name() + ": " + reason(failure, requireHealthy));
            }
        }
        out.flush();
    }

    public void render(final TeardownReport report, final String stackName, final PrintWriter out) {
        for (final String name : report.stopped()) {
            out.println("  stopped " + name);
        }
        for (final TeardownReport.StopFailure failure : report.failures()) {
            out.println("  failed to stop " + failure.name() + ": " + failure.message());
        }
        out.println(report.isSuccess()
            ? "Stack '" + stackName + "' is down."
            : "Stack '" + stackName + "' is down with " + report.failures().size() + " stop failure(s).");
        out.flush();
    }

    static String reason(final ServiceReport failure, final boolean requireHealthy) {
        if (failure.isSuccess(false) && requireHealthy) {
            return "started but " + failure.health().name().toLowerCase(Locale.ROOT);
        }
        return failure.outcome() + (failure.message() == null ? "" : " (" + failure.message() + ")");
    }
}
