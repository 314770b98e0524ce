package com.warden.core.risk;

import com.warden.core.action.ApprovalCategory;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

@Component
@ConfigurationProperties(prefix = "warden.policy")
public class PolicyProperties {

    private final PolicyConfig defaults = PolicyConfig.defaults();

    private List<String> blockedPatterns = defaults.blockedPatterns();
    private Set<String> criticalActions = defaults.criticalActions();
    private Set<ApprovalCategory> approvalCategories = EnumSet.allOf(ApprovalCategory.class);
    private List<String> dangerKeywords = defaults.dangerKeywords();
    private List<String> protectedPaths = List.of();
    private String criticalMarker = PolicyConfig.DEFAULT_CRITICAL_MARKER;

    public List<String> getBlockedPatterns() {
        return blockedPatterns;
    }

    public void setBlockedPatterns(List<String> blockedPatterns) {
        this.blockedPatterns = blockedPatterns;
    }

    public Set<String> getCriticalActions() {
        return criticalActions;
    }

    public void setCriticalActions(Set<String> criticalActions) {
        this.criticalActions = criticalActions;
    }

    public Set<ApprovalCategory> getApprovalCategories() {
        return approvalCategories;
    }

    public void setApprovalCategories(Set<ApprovalCategory> approvalCategories) {
        this.approvalCategories = approvalCategories;
    }

    public List<String> getDangerKeywords() {
        return dangerKeywords;
    }

    public void setDangerKeywords(List<String> dangerKeywords) {
        this.dangerKeywords = dangerKeywords;
    }

    public List<String> getProtectedPaths() {
        return protectedPaths;
    }

    public void setProtectedPaths(List<String> protectedPaths) {
        this.protectedPaths = protectedPaths;
    }

    public String getCriticalMarker() {
        return criticalMarker;
    }

    public void setCriticalMarker(String criticalMarker) {
        this.criticalMarker = criticalMarker;
    }

    public PolicyConfig toPolicyConfig() {
        return new PolicyConfig(blockedPatterns, criticalActions, approvalCategories,
                dangerKeywords, protectedPaths, criticalMarker);
    }
}
