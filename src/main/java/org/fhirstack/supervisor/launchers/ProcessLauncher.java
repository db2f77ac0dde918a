package org.fhirstack.supervisor.launchers;

import org.fhirstack.spec.LaunchDescriptor;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.ILauncher;
import org.fhirstack.supervisor.spi.IServiceHandle;
import org.fhirstack.supervisor.spi.LaunchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Launches {@link LaunchDescriptor.Kind#COMMAND} services as local child processes.
 * <p>
 * Standard output and error of each service are appended to {@code <logDirectory>/<service>.log}.
 * The environment of the orchestrator is inherited and extended with the service's environment.
 */
public class ProcessLauncher implements ILauncher {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessLauncher.class);

    private final Path logDirectory;

    /**
     * @param logDirectory directory receiving one log file per service; created on demand
     */
    public ProcessLauncher(final Path logDirectory) {
        this.logDirectory = logDirectory;
    }

    @Override
    public boolean supports(final ServiceSpec spec) {
        return spec.launch().kind() == LaunchDescriptor.Kind.COMMAND;
    }

    @Override
    public IServiceHandle launch(final ServiceSpec spec) throws LaunchException {
        final LaunchDescriptor launch = spec.launch();
        final ProcessBuilder builder = new ProcessBuilder(launch.command());
        if (launch.workingDirectory() != null) {
            builder.directory(new File(launch.workingDirectory()));
        }
        builder.environment().putAll(spec.environment());
        builder.redirectErrorStream(true);

        final Path logFile = logDirectory.resolve(spec.name() + ".log");
        try {
            Files.createDirectories(logDirectory);
        } catch (final IOException e) {
            throw new LaunchException(spec.name(), "cannot create log directory " + logDirectory, e);
        }
        builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));

        final Process process;
        try {
            process = builder.start();
        } catch (final IOException e) {
            throw new LaunchException(spec.name(), "cannot execute '" + launch.command().get(0) + "': " + e.getMessage(), e);
        }
        LOGGER.debug("Launched '{}' as pid {}, output in {}", spec.name(), process.pid(), logFile);
        return new LocalProcessHandle(process);
    }

    /**
     * Handle of a child process. Termination signals are sent to the whole process tree.
     */
    static final class LocalProcessHandle implements IServiceHandle {

        private final Process process;
        private final CompletableFuture<Integer> exit;

        LocalProcessHandle(final Process process) {
            this.process = process;
            this.exit = process.onExit().thenApply(Process::exitValue);
        }

        @Override
        public String id() {
            return "pid " + process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public CompletableFuture<Integer> onExit() {
            return exit;
        }

        @Override
        public void terminate() {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }

        @Override
        public void kill() {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        }

        @Override
        public void release() {
            try {
                process.getOutputStream().close();
            } catch (final IOException e) {
                throw new UncheckedIOException("Failed to close stdin of pid " + process.pid(), e);
            }
        }
    }
}
