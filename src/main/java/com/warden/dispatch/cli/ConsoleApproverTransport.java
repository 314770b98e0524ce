package com.warden.dispatch.cli;

import com.warden.core.confirmation.ApproverTransport;
import com.warden.core.confirmation.ConfirmationGateway;
import com.warden.core.confirmation.ConfirmationSnapshot;
import com.warden.core.confirmation.ResponseResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Asks the person at the terminal to approve each pending confirmation.
 * <p>
 * Prompts are queued and answered one at a time on a dedicated thread, so publishing never
 * blocks the task that asked. Answers go back through {@link ConfirmationGateway#submitResponse};
 * a prompt answered after its request timed out is reported and ignored.
 */
public class ConsoleApproverTransport implements ApproverTransport, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ConsoleApproverTransport.class);

    static final String RESOLVER = "console";

    private final ConfirmationGateway gateway;
    private final BufferedReader in;
    private final PrintStream out;
    private final ExecutorService prompter = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "console-approver");
        t.setDaemon(true);
        return t;
    });

    public ConsoleApproverTransport(ConfirmationGateway gateway, BufferedReader in, PrintStream out) {
        this.gateway = gateway;
        this.in = in;
        this.out = out;
    }

    @Override
    public void publish(ConfirmationSnapshot request) {
        prompter.submit(() -> prompt(request));
    }

    @Override
    public void resolved(ConfirmationSnapshot request) {
        if (!RESOLVER.equals(request.resolvedBy())) {
            out.println("  " + request.id() + " resolved " + request.status()
                    + (request.reason() != null ? " (" + request.reason() + ")" : ""));
        }
    }

    private void prompt(ConfirmationSnapshot request) {
        if (gateway.find(request.id()).map(s -> s.status().isTerminal()).orElse(true)) {
            return;
        }
        ConsoleOutput.confirmation(out, request);
        out.print("  Approve? [y/N] ");
        out.flush();

        String answer;
        try {
            answer = in.readLine();
        } catch (IOException e) {
            log.warn("Cannot read approval for {}: {}", request.id(), e.getMessage());
            answer = null;
        }
        if (answer == null) {
            // end of input: leave the request to its timeout
            return;
        }
        boolean approved = answer.trim().equalsIgnoreCase("y") || answer.trim().equalsIgnoreCase("yes");
        ResponseResult result = gateway.submitResponse(request.id(), approved, RESOLVER);
        switch (result) {
            case RESOLVED -> out.println("  " + (approved ? "Approved" : "Denied") + " " + request.id());
            case ALREADY_RESOLVED -> out.println("  Too late: " + request.id() + " was already resolved");
            case NOT_FOUND -> out.println("  Unknown request " + request.id());
        }
    }

    @Override
    public void close() {
        prompter.shutdownNow();
    }
}
