package com.warden.core.engine;

import com.warden.core.action.StepAction;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedActionExecutorTest {

    @Test
    void reportsWhatWouldHaveBeenDone() throws Exception {
        var executor = new SimulatedActionExecutor(Duration.ZERO);

        Object result = executor.execute(new StepAction("open the browser"), "Open browser");

        assertEquals("Simulated result for: Open browser", result);
    }
}
