package com.warden.dispatch.cli;

import com.warden.core.integrity.IntegrityChecker;
import com.warden.core.integrity.IntegrityViolation;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: warden integrity
 * <p>
 * Verifies the files listed under {@code warden.integrity.files} against the baseline taken at startup.
 */
@Command(name = "integrity", mixinStandardHelpOptions = true, description = "Verify tracked files")
@Component
public class IntegrityCommand implements Callable<Integer> {

    private final IntegrityChecker integrityChecker;

    public IntegrityCommand(IntegrityChecker integrityChecker) {
        this.integrityChecker = integrityChecker;
    }

    @Override
    public Integer call() {
        List<String> tracked = integrityChecker.trackedFiles();
        if (tracked.isEmpty()) {
            ConsoleOutput.warn("No files tracked; set warden.integrity.files");
            return 0;
        }
        List<IntegrityViolation> violations = integrityChecker.verify();
        if (violations.isEmpty()) {
            ConsoleOutput.success(tracked.size() + " file(s) intact");
            return 0;
        }
        for (IntegrityViolation v : violations) {
            ConsoleOutput.error(v.kind() + " " + v.path() + " (" + v.detail() + ")");
        }
        return 1;
    }
}
