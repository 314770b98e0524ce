package com.warden.dispatch.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.warden.core.action.ActionFactory;
import com.warden.core.audit.AuditExporter;
import com.warden.core.confirmation.ConfirmationGateway;
import com.warden.core.engine.ActionExecutor;
import com.warden.core.engine.PlanEngine;
import com.warden.core.engine.PlanExporter;
import com.warden.core.engine.RunOptions;
import com.warden.core.events.EventBus;
import com.warden.core.events.WardenEvent;
import com.warden.core.model.DecomposedStep;
import com.warden.core.model.Plan;
import com.warden.core.model.PlanStatus;
import com.warden.core.model.PlanSummary;
import com.warden.core.scheduler.SchedulerProperties;
import com.warden.dispatch.api.PlanRequest;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden run "&lt;goal&gt;"
 * <p>
 * Builds a plan for the goal (from --step, --plan-file, or decomposition), runs it to the end
 * and prints the summary. With --interactive, confirmations are asked on the terminal; without
 * it, anything that needs approval waits for its timeout and is denied.
 * <p>
 * Exit code 0 when every task completed, 1 otherwise, 2 for invalid input.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Plan and run a goal")
@Component
public class RunCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "What the plan should achieve")
    private String goal;

    @Option(names = {"--step", "-s"}, description = "Explicit step description (repeatable, run in order)")
    private List<String> steps = new ArrayList<>();

    @Option(names = "--plan-file", description = "JSON array of steps: [{id, description, depends_on, action: {kind, params}}]")
    private Path planFile;

    @Option(names = {"--interactive", "-i"}, description = "Ask for confirmations on the terminal")
    private boolean interactive;

    @Option(names = "--timeout", description = "Seconds each task waits for confirmation")
    private Integer timeoutSeconds;

    @Option(names = {"--parallel", "-p"}, description = "Maximum concurrent tasks")
    private Integer parallel;

    @Option(names = "--export", description = "Write the plan as JSON to this file")
    private Path exportFile;

    @Option(names = "--audit-export", description = "Write the audit log as JSON to this file")
    private Path auditExportFile;

    private final PlanEngine planEngine;
    private final ConfirmationGateway gateway;
    private final ActionExecutor executor;
    private final EventBus eventBus;
    private final PlanExporter planExporter;
    private final AuditExporter auditExporter;
    private final SchedulerProperties schedulerProperties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RunCommand(PlanEngine planEngine, ConfirmationGateway gateway, ActionExecutor executor, EventBus eventBus,
                      PlanExporter planExporter, AuditExporter auditExporter, SchedulerProperties schedulerProperties) {
        this.planEngine = planEngine;
        this.gateway = gateway;
        this.executor = executor;
        this.eventBus = eventBus;
        this.planExporter = planExporter;
        this.auditExporter = auditExporter;
        this.schedulerProperties = schedulerProperties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Plan plan;
        RunOptions options;
        try {
            options = runOptions();
            List<DecomposedStep> explicit = explicitSteps();
            plan = explicit.isEmpty() ? planEngine.buildPlan(goal) : planEngine.buildPlan(goal, explicit);
        } catch (IllegalArgumentException | IOException e) {
            ConsoleOutput.error("Invalid plan: " + e.getMessage());
            return 2;
        }

        System.out.println();
        System.out.println("PLAN " + plan.id());
        System.out.println("Goal: " + goal);
        for (var task : plan.tasks()) {
            System.out.printf("  %s. [%-16s] %s%s%n", task.id(), task.actionKind(), task.description(),
                    task.dependencies().isEmpty() ? "" : "  (after " + String.join(", ", task.dependencies()) + ")");
        }
        System.out.println();
        if (!interactive) {
            ConsoleOutput.warn("Non-interactive: actions that need approval will time out after "
                    + options.confirmationTimeout().toSeconds() + "s and be denied");
        }

        EventBus.Subscription subscription = eventBus.subscribe(plan.id(),
                event -> ConsoleOutput.watchEvent(event.eventType(), describe(event)));
        ConsoleApproverTransport console = null;
        ConfirmationGateway.Registration registration = null;
        if (interactive) {
            console = new ConsoleApproverTransport(gateway,
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
            registration = gateway.registerTransport(console);
        }

        PlanSummary summary;
        try {
            summary = planEngine.runPlan(plan, executor, options);
        } finally {
            subscription.unsubscribe();
            if (registration != null) {
                registration.remove();
                console.close();
            }
        }

        ConsoleOutput.summary(summary);
        ConsoleOutput.reflection(planEngine.reflect(plan));
        export(plan);

        boolean clean = plan.status() == PlanStatus.COMPLETED && summary.failed() == 0;
        if (clean) {
            ConsoleOutput.success("Plan " + plan.id() + " completed");
        } else {
            ConsoleOutput.error("Plan " + plan.id() + " finished " + plan.status()
                    + " with " + summary.failed() + " failed task(s)");
        }
        return clean ? 0 : 1;
    }

    private RunOptions runOptions() {
        RunOptions options = RunOptions.from(schedulerProperties);
        if (parallel != null) {
            options = options.withParallelism(parallel);
        }
        if (timeoutSeconds != null) {
            options = options.withConfirmationTimeout(Duration.ofSeconds(timeoutSeconds));
        }
        return options;
    }

    private List<DecomposedStep> explicitSteps() throws IOException {
        var result = new ArrayList<DecomposedStep>();
        if (planFile != null) {
            List<PlanRequest.StepRequest> fromFile = objectMapper.readValue(planFile.toFile(),
                    new TypeReference<List<PlanRequest.StepRequest>>() {});
            for (PlanRequest.StepRequest step : fromFile) {
                result.add(new DecomposedStep(step.id(), step.description(), step.dependsOn(),
                        step.action() != null
                                ? ActionFactory.fromSpec(step.action().kind(), step.action().params())
                                : null));
            }
        }
        for (String step : steps) {
            result.add(DecomposedStep.of(step));
        }
        return result;
    }

    private void export(Plan plan) {
        try {
            if (exportFile != null) {
                planExporter.exportTo(plan, exportFile);
                ConsoleOutput.info("Plan exported to " + exportFile);
            }
            if (auditExportFile != null) {
                auditExporter.exportTo(auditExportFile);
                ConsoleOutput.info("Audit log exported to " + auditExportFile);
            }
        } catch (IOException e) {
            ConsoleOutput.error("Export failed: " + e.getMessage());
        }
    }

    private static String describe(WardenEvent event) {
        var sb = new StringBuilder();
        if (event.taskId() != null) {
            sb.append(event.taskId()).append(' ');
        }
        event.payload().forEach((k, v) -> sb.append(k).append('=').append(v).append(' '));
        return sb.toString().trim();
    }
}
