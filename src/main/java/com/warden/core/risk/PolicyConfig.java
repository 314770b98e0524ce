package com.warden.core.risk;

import com.warden.core.action.ApprovalCategory;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable classification policy handed to the {@link RiskClassifier}.
 *
 * @param blockedPatterns    case-insensitive substrings that make an action {@link RiskTier#BLOCKED}
 * @param criticalActions    action names that are always {@link RiskTier#DANGER}
 * @param approvalCategories categories that need confirmation ({@link RiskTier#WARNING})
 * @param dangerKeywords     case-insensitive substrings in the details that escalate to {@link RiskTier#DANGER}
 * @param protectedPaths     globs of files that may be read but never mutated
 * @param criticalMarker     prefix added to the description of critical actions
 */
public record PolicyConfig(
    List<String> blockedPatterns,
    Set<String> criticalActions,
    Set<ApprovalCategory> approvalCategories,
    List<String> dangerKeywords,
    List<String> protectedPaths,
    String criticalMarker
) {

    public static final String DEFAULT_CRITICAL_MARKER = "[CRITICAL ACTION] ";

    public PolicyConfig {
        blockedPatterns = blockedPatterns == null ? List.of() : lowerCase(blockedPatterns);
        criticalActions = criticalActions == null ? Set.of() : Set.copyOf(criticalActions);
        approvalCategories = approvalCategories == null || approvalCategories.isEmpty()
                ? Set.of() : Set.copyOf(EnumSet.copyOf(approvalCategories));
        dangerKeywords = dangerKeywords == null ? List.of() : lowerCase(dangerKeywords);
        protectedPaths = protectedPaths == null ? List.of() : List.copyOf(protectedPaths);
        criticalMarker = criticalMarker == null ? DEFAULT_CRITICAL_MARKER : criticalMarker;
    }

    /**
     * Policy used when nothing is configured: drive wipes, elevation and registry edits are blocked,
     * the well-known critical operations need confirmation, and every mutating category is gated.
     */
    public static PolicyConfig defaults() {
        return new PolicyConfig(
                List.of("rm -rf", "sudo ", "format_drive", "format c:", "mkfs", "dd if=/dev",
                        "del /s /f /q", "diskpart", "reg add", "reg delete", "runas "),
                Set.of("delete_system_file", "modify_registry", "disable_security", "execute_untrusted_code"),
                EnumSet.allOf(ApprovalCategory.class),
                List.of("system32", "registry", "powershell", "cmd.exe", "/etc/", "administrator"),
                List.of(),
                DEFAULT_CRITICAL_MARKER);
    }

    private static List<String> lowerCase(List<String> values) {
        return values.stream()
                .filter(v -> v != null && !v.isBlank())
                .map(String::toLowerCase)
                .toList();
    }
}
