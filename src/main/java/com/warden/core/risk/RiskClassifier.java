package com.warden.core.risk;

import com.warden.core.action.AgentAction;
import com.warden.core.action.ApprovalCategory;
import com.warden.core.action.FileAction;
import org.springframework.stereotype.Service;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps an action to a {@link RiskTier}.
 * <p>
 * Decision order: blocked pattern, protected path mutation, critical action name,
 * danger keyword, approval category, otherwise safe. Pure and deterministic; the
 * same input always yields the same assessment.
 */
@Service
public class RiskClassifier {

    private final PolicyConfig policy;
    private final List<PathMatcher> protectedPathMatchers;

    public RiskClassifier(PolicyConfig policy) {
        this.policy = policy;
        this.protectedPathMatchers = policy.protectedPaths().stream()
                .map(glob -> FileSystems.getDefault().getPathMatcher("glob:" + glob))
                .toList();
    }

    public RiskAssessment classify(AgentAction action, String description) {
        return classify(action.name(), action.category(), description, action.details(), action);
    }

    /**
     * Classifies an action known only by its name, category and details.
     */
    public RiskAssessment classify(String actionName, Optional<ApprovalCategory> category,
                                   String description, Map<String, ?> details) {
        return classify(actionName, category, description, details, null);
    }

    public PolicyConfig policy() {
        return policy;
    }

    private RiskAssessment classify(String actionName, Optional<ApprovalCategory> category,
                                    String description, Map<String, ?> details, AgentAction action) {
        String text = description != null ? description : "";
        String haystack = (text + " " + serialize(details)).toLowerCase();

        for (String pattern : policy.blockedPatterns()) {
            if (haystack.contains(pattern)) {
                return new RiskAssessment(RiskTier.BLOCKED, "blocked pattern '" + pattern.trim() + "'", text);
            }
        }

        if (action instanceof FileAction file && file.operation().isMutating() && isProtected(file.path())) {
            return new RiskAssessment(RiskTier.BLOCKED, "protected path " + file.path(), text);
        }

        Set<String> critical = policy.criticalActions();
        if (actionName != null && critical.contains(actionName)) {
            return new RiskAssessment(RiskTier.DANGER, "critical action " + actionName, markCritical(text));
        }

        String detailText = serialize(details).toLowerCase();
        for (String keyword : policy.dangerKeywords()) {
            if (detailText.contains(keyword)) {
                return new RiskAssessment(RiskTier.DANGER, "danger keyword '" + keyword + "'", markCritical(text));
            }
        }

        if (category.isPresent() && policy.approvalCategories().contains(category.get())) {
            return new RiskAssessment(RiskTier.WARNING, "requires approval: " + category.get(), text);
        }

        return new RiskAssessment(RiskTier.SAFE, "no policy match", text);
    }

    private String markCritical(String description) {
        String marker = policy.criticalMarker();
        return description.startsWith(marker) ? description : marker + description;
    }

    private boolean isProtected(String path) {
        if (protectedPathMatchers.isEmpty()) {
            return false;
        }
        try {
            var candidate = Paths.get(path).normalize();
            for (PathMatcher matcher : protectedPathMatchers) {
                if (matcher.matches(candidate)) {
                    return true;
                }
            }
            return false;
        } catch (InvalidPathException e) {
            // unparseable paths are treated as protected
            return true;
        }
    }

    private static String serialize(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        details.forEach((k, v) -> sb.append(k).append('=').append(v).append(' '));
        return sb.toString();
    }
}
