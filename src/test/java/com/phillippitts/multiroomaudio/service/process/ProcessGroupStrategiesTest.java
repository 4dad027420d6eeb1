package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.util.BinaryLocator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class ProcessGroupStrategiesTest {

    private final CommandRunner runner = mock(CommandRunner.class);

    @Test
    void explicitModesSelectTheirStrategy() {
        BinaryLocator locator = new BinaryLocator("");

        assertThat(ProcessGroupStrategies.select("posix", locator, runner)).isInstanceOf(PosixProcessGroupStrategy.class);
        assertThat(ProcessGroupStrategies.select("TREE", locator, runner)).isInstanceOf(ProcessTreeStrategy.class);
    }

    @Test
    void autoFallsBackToProcessTreeWithoutSetsid(@TempDir Path emptyDir) {
        BinaryLocator locator = new BinaryLocator(emptyDir.toString());

        assertThat(ProcessGroupStrategies.select("auto", locator, runner)).isInstanceOf(ProcessTreeStrategy.class);
        assertThat(ProcessGroupStrategies.select(null, locator, runner)).isInstanceOf(ProcessTreeStrategy.class);
    }

    @Test
    void unknownModeIsRejected() {
        assertThatThrownBy(() -> ProcessGroupStrategies.select("cgroups", new BinaryLocator(""), runner))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cgroups");
    }
}
