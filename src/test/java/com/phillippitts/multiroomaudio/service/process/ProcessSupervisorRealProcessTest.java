package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.annotation.RequiresRealBinary;
import com.phillippitts.multiroomaudio.util.BinaryLocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

@RequiresRealBinary("/bin/sh, setsid and kill")
class ProcessSupervisorRealProcessTest {

    @TempDir
    Path logDir;

    private ProcessSupervisor supervisor() {
        CommandRunner runner = new DefaultCommandRunner();
        ProcessGroupStrategy strategy = ProcessGroupStrategies.select(
                ProcessGroupStrategies.AUTO, BinaryLocator.fromEnvironment(), runner);
        return new ProcessSupervisor(new DefaultProcessFactory(), strategy, logDir,
                Duration.ofMillis(300), Duration.ofSeconds(2), Duration.ofSeconds(2));
    }

    @Test
    void startsAndStopsLongRunningShell() {
        ProcessSupervisor supervisor = supervisor();

        StartOutcome outcome = supervisor.start("sleeper", List.of("/bin/sh", "-c", "sleep 30"), null);
        assertThat(outcome.success()).isTrue();
        assertThat(supervisor.isRunning("sleeper")).isTrue();

        assertThat(supervisor.stop("sleeper").success()).isTrue();
        assertThat(supervisor.isRunning("sleeper")).isFalse();
    }

    @Test
    void stopAlsoTerminatesChildrenOfThePlayer() throws Exception {
        ProcessSupervisor supervisor = supervisor();
        Path pidFile = logDir.resolve("child.pid");

        supervisor.start("forker",
                List.of("/bin/sh", "-c", "sleep 30 & echo $! > " + pidFile + "; wait"), null);
        await().atMost(2, TimeUnit.SECONDS).until(() -> Files.exists(pidFile) && Files.size(pidFile) > 0);
        long childPid = Long.parseLong(Files.readString(pidFile).trim());

        supervisor.stop("forker");

        await().atMost(3, TimeUnit.SECONDS).until(() ->
                ProcessHandle.of(childPid).map(h -> !h.isAlive()).orElse(true));
    }

    @Test
    void immediateFailureCarriesProcessOutput() {
        ProcessSupervisor supervisor = supervisor();

        StartOutcome outcome = supervisor.start("broken",
                List.of("/bin/sh", "-c", "echo 'cannot open audio device' >&2; exit 3"), null);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).contains("cannot open audio device").contains("exit code 3");
    }

    @Test
    void missingBinaryIsReported() {
        ProcessSupervisor supervisor = supervisor();

        StartOutcome outcome = supervisor.start("ghost", List.of("definitely-not-installed-player"), null);

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.message()).isEqualTo("Binary 'definitely-not-installed-player' not found");
    }
}
