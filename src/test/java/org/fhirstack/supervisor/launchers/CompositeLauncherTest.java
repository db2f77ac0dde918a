package org.fhirstack.supervisor.launchers;

import org.fhirstack.junit.extensions.logging.ExpectLog;
import org.fhirstack.junit.extensions.logging.LogLevel;
import org.fhirstack.junit.extensions.logging.LogWatchExtension;
import org.fhirstack.spec.ServiceSpec;
import org.fhirstack.supervisor.spi.ILauncher;
import org.fhirstack.supervisor.spi.IServiceHandle;
import org.fhirstack.supervisor.spi.LaunchException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class CompositeLauncherTest {

    private final ServiceSpec imageService = ServiceSpec.builder("db").image("mongo").build();
    private final ServiceSpec commandService = ServiceSpec.builder("worker").command("sleep", "60").build();

    private ILauncher processes;
    private ILauncher containers;
    private CompositeLauncher launcher;

    @BeforeEach
    void setUp() {
        processes = mock(ILauncher.class);
        containers = mock(ILauncher.class);
        when(processes.supports(commandService)).thenReturn(true);
        when(containers.supports(imageService)).thenReturn(true);
        launcher = new CompositeLauncher(List.of(processes, containers));
    }

    @Test
    @DisplayName("Each service goes to the launcher that supports it")
    void launch_dispatchesByKind() throws Exception {
        IServiceHandle handle = mock(IServiceHandle.class);
        when(containers.launch(imageService)).thenReturn(handle);

        assertThat(launcher.launch(imageService)).isSameAs(handle);
        verify(processes, never()).launch(imageService);
    }

    @Test
    @DisplayName("A service no delegate supports cannot be launched or discovered")
    void launch_withoutDelegate() {
        CompositeLauncher processesOnly = new CompositeLauncher(List.of(processes));

        assertThat(processesOnly.supports(imageService)).isFalse();
        assertThat(processesOnly.discover(imageService)).isEmpty();
        assertThatThrownBy(() -> processesOnly.launch(imageService))
            .isInstanceOf(LaunchException.class)
            .hasMessage("Failed to launch 'db': no launcher available for IMAGE services");
    }

    @Test
    @DisplayName("Discovery is delegated as well")
    void discover_delegates() {
        IServiceHandle handle = mock(IServiceHandle.class);
        when(containers.discover(imageService)).thenReturn(Optional.of(handle));

        assertThat(launcher.discover(imageService)).containsSame(handle);
    }

    @Test
    @DisplayName("All delegates are closed even if one fails")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*CompositeLauncher", messagePattern = "Failed to close .*: socket gone")
    void close_closesAllDelegates() {
        doThrow(new IllegalStateException("socket gone")).when(processes).close();

        launcher.close();

        verify(processes).close();
        verify(containers).close();
    }
}
