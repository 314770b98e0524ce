package com.warden.core.risk;

import com.warden.core.action.ApprovalCategory;
import com.warden.core.action.CommandAction;
import com.warden.core.action.FileAction;
import com.warden.core.action.FileOperation;
import com.warden.core.action.NetworkAction;
import com.warden.core.action.PrivilegedAction;
import com.warden.core.action.StepAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RiskClassifierTest {

    private final RiskClassifier classifier = new RiskClassifier(PolicyConfig.defaults());

    @Nested
    @DisplayName("default policy")
    class DefaultPolicy {

        @Test
        @DisplayName("a plain step is safe")
        void plainStepIsSafe() {
            var result = classifier.classify(new StepAction("Open the notes app"), "Open the notes app");

            assertEquals(RiskTier.SAFE, result.tier());
            assertEquals("Open the notes app", result.description());
        }

        @Test
        @DisplayName("reading a file is safe, writing one needs confirmation")
        void readVersusWrite() {
            assertEquals(RiskTier.SAFE,
                    classifier.classify(new FileAction(FileOperation.READ, "/tmp/a.txt"), "read a").tier());

            var write = classifier.classify(new FileAction(FileOperation.WRITE, "/tmp/a.txt"), "write a");
            assertEquals(RiskTier.WARNING, write.tier());
            assertTrue(write.reason().contains("FILE_MUTATION"));
        }

        @Test
        @DisplayName("blocked patterns match the description case-insensitively")
        void blockedPatternInDescription() {
            var result = classifier.classify(new StepAction("FORMAT_DRIVE now"), "FORMAT_DRIVE now");

            assertEquals(RiskTier.BLOCKED, result.tier());
            assertTrue(result.reason().contains("format_drive"));
        }

        @Test
        @DisplayName("blocked patterns also match the action details")
        void blockedPatternInDetails() {
            var result = classifier.classify(new CommandAction("sudo rm -rf /"), "clean up");

            assertEquals(RiskTier.BLOCKED, result.tier());
        }

        @Test
        @DisplayName("critical action names are danger and get the critical marker")
        void criticalActionIsDanger() {
            var result = classifier.classify(new PrivilegedAction("disable_security", Map.of()), "Turn off defender");

            assertEquals(RiskTier.DANGER, result.tier());
            assertEquals(PolicyConfig.DEFAULT_CRITICAL_MARKER + "Turn off defender", result.description());
        }

        @Test
        @DisplayName("danger keywords in the details escalate to danger")
        void dangerKeyword() {
            var result = classifier.classify(new CommandAction("cat /etc/hosts"), "Show hosts file");

            assertEquals(RiskTier.DANGER, result.tier());
            assertTrue(result.reason().contains("/etc/"));
        }

        @Test
        @DisplayName("the critical marker is not applied twice")
        void markerNotDoubled() {
            String marked = PolicyConfig.DEFAULT_CRITICAL_MARKER + "Turn off defender";
            var result = classifier.classify(new PrivilegedAction("disable_security", Map.of()), marked);

            assertEquals(marked, result.description());
        }

        @Test
        @DisplayName("network access needs confirmation")
        void networkAccessIsWarning() {
            var result = classifier.classify(new NetworkAction("https://example.com", null), "Fetch page");

            assertEquals(RiskTier.WARNING, result.tier());
        }

        @Test
        @DisplayName("classification is deterministic")
        void deterministic() {
            var action = new CommandAction("ls -la");
            assertEquals(classifier.classify(action, "list"), classifier.classify(action, "list"));
        }

        @Test
        @DisplayName("actions known only by name can be classified")
        void classifyByName() {
            var result = classifier.classify("modify_registry", Optional.empty(), "Edit run key", Map.of());

            assertEquals(RiskTier.DANGER, result.tier());
        }
    }

    @Nested
    @DisplayName("custom policy")
    class CustomPolicy {

        @Test
        @DisplayName("mutating a protected path is blocked, reading it is not")
        void protectedPaths() {
            var policy = new PolicyConfig(List.of(), Set.of(), EnumSet.allOf(ApprovalCategory.class), List.of(),
                    List.of("/opt/app/config/**"), null);
            var custom = new RiskClassifier(policy);

            assertEquals(RiskTier.BLOCKED, custom.classify(
                    new FileAction(FileOperation.WRITE, "/opt/app/config/app.yml"), "edit config").tier());
            assertEquals(RiskTier.SAFE, custom.classify(
                    new FileAction(FileOperation.READ, "/opt/app/config/app.yml"), "read config").tier());
        }

        @Test
        @DisplayName("categories left out of the policy are safe")
        void noApprovalCategories() {
            var policy = new PolicyConfig(List.of(), Set.of(), Set.of(), List.of(), List.of(), null);
            var custom = new RiskClassifier(policy);

            assertEquals(RiskTier.SAFE,
                    custom.classify(new FileAction(FileOperation.DELETE, "/tmp/x"), "delete x").tier());
        }

        @Test
        @DisplayName("blank patterns are ignored and values are lower-cased")
        void normalisesPatterns() {
            var policy = new PolicyConfig(List.of(" ", "DROP TABLE"), null, null, null, null, null);

            assertEquals(List.of("drop table"), policy.blockedPatterns());
            assertEquals(PolicyConfig.DEFAULT_CRITICAL_MARKER, policy.criticalMarker());
            assertEquals(RiskTier.BLOCKED, new RiskClassifier(policy)
                    .classify(new StepAction("drop table users"), "drop table users").tier());
        }
    }

    @Test
    @DisplayName("only warning and danger require confirmation")
    void requiresConfirmation() {
        assertFalse(RiskTier.SAFE.requiresConfirmation());
        assertTrue(RiskTier.WARNING.requiresConfirmation());
        assertTrue(RiskTier.DANGER.requiresConfirmation());
        assertFalse(RiskTier.BLOCKED.requiresConfirmation());
    }
}
