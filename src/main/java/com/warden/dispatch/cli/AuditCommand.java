package com.warden.dispatch.cli;

import com.warden.core.audit.AuditExporter;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI command: warden audit &lt;file&gt;
 * <p>
 * Pretty-prints an audit log written by {@code run --audit-export} or {@code GET /api/v1/audit/export}.
 */
@Command(name = "audit", mixinStandardHelpOptions = true, description = "Show an exported audit log")
@Component
public class AuditCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Exported audit log (JSON)")
    private Path file;

    @Option(names = {"--outcome", "-o"}, description = "Only show entries with this outcome (e.g. blocked, timed-out)")
    private String outcome;

    private final AuditExporter auditExporter;

    public AuditCommand(AuditExporter auditExporter) {
        this.auditExporter = auditExporter;
    }

    @Override
    public Integer call() {
        Map<String, Object> document;
        try {
            document = auditExporter.read(file);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        ConsoleOutput.info("Audit log exported at " + document.get("exportedAt")
                + " (" + document.get("totalEntries") + " entries)");
        Object entries = document.get("entries");
        if (!(entries instanceof List<?> list)) {
            ConsoleOutput.error("No entries in " + file);
            return 1;
        }
        int shown = 0;
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> entry)) continue;
            if (outcome != null && !outcome.equalsIgnoreCase(String.valueOf(entry.get("outcome")))) continue;
            System.out.printf("%s  %-9s %-13s %-7s %s%s%n",
                    entry.get("timestamp"),
                    entry.get("actor"),
                    entry.get("outcome"),
                    entry.get("risk_tier") != null ? entry.get("risk_tier") : "-",
                    entry.get("action"),
                    entry.get("error") != null ? "  (" + entry.get("error") + ")" : "");
            shown++;
        }
        if (outcome != null) {
            ConsoleOutput.info(shown + " matching entries");
        }
        return 0;
    }
}
