package com.warden.core.engine;

import com.warden.core.action.AgentAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Stand-in executor used when no real device or tool integration is wired: waits briefly
 * and reports what would have been done.
 */
@Component
public class SimulatedActionExecutor implements ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimulatedActionExecutor.class);

    private final Duration delay;

    public SimulatedActionExecutor(@Value("${warden.executor.simulated-delay:PT0.5S}") Duration delay) {
        this.delay = delay;
    }

    @Override
    public Object execute(AgentAction action, String description) throws InterruptedException {
        log.info("Simulating {} ({}): {}", action.name(), action.kind(), description);
        if (!delay.isZero() && !delay.isNegative()) {
            Thread.sleep(delay.toMillis());
        }
        return "Simulated result for: " + description;
    }
}
