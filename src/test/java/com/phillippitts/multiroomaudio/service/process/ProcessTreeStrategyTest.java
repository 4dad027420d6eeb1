package com.phillippitts.multiroomaudio.service.process;

import com.phillippitts.multiroomaudio.testutil.FakeProcess;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProcessTreeStrategyTest {

    private final ProcessTreeStrategy strategy = new ProcessTreeStrategy();

    @Test
    void leavesCommandUnchanged() {
        assertThat(strategy.prepareCommand(List.of("sendspin", "--url", "ws://host:8927")))
                .containsExactly("sendspin", "--url", "ws://host:8927");
    }

    @Test
    void terminateAndKillReachProcessWithoutNativeHandle() {
        FakeProcess graceful = FakeProcess.ignoringTerminate();

        strategy.terminate(graceful);
        assertThat(graceful.destroyCalls()).isEqualTo(1);
        assertThat(graceful.isAlive()).isTrue();

        strategy.kill(graceful);
        assertThat(graceful.destroyForciblyCalls()).isEqualTo(1);
        assertThat(graceful.isAlive()).isFalse();
    }
}
