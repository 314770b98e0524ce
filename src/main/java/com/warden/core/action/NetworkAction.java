package com.warden.core.action;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Performs an HTTP request against a remote host.
 */
public record NetworkAction(String url, String method) implements AgentAction {

    public NetworkAction {
        requireHttpUrl(url);
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase();
    }

    static void requireHttpUrl(String url) {
        AgentAction.requireText(url, "url");
        String scheme;
        try {
            scheme = URI.create(url).getScheme();
        } catch (IllegalArgumentException e) {
            throw new InvalidActionException("Malformed url: " + url);
        }
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new InvalidActionException("Only http and https urls are supported: " + url);
        }
    }

    @Override
    public ActionKind kind() {
        return ActionKind.NETWORK_ACCESS;
    }

    @Override
    public String name() {
        return "network_request";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("url", url);
        details.put("method", method);
        return details;
    }

    @Override
    public Optional<ApprovalCategory> category() {
        return Optional.of(ApprovalCategory.NETWORK_ACCESS);
    }
}
