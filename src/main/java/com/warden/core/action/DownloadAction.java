package com.warden.core.action;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Downloads a remote file to the local disk.
 */
public record DownloadAction(String url, String fileName, long sizeBytes) implements AgentAction {

    public DownloadAction {
        NetworkAction.requireHttpUrl(url);
        AgentAction.requireText(fileName, "fileName");
        if (sizeBytes < 0) {
            throw new InvalidActionException("sizeBytes must be non-negative");
        }
    }

    @Override
    public ActionKind kind() {
        return ActionKind.DOWNLOAD_FILE;
    }

    @Override
    public String name() {
        return "download_file";
    }

    @Override
    public Map<String, Object> details() {
        var details = new LinkedHashMap<String, Object>();
        details.put("url", url);
        details.put("file_name", fileName);
        details.put("file_size_mb", Math.round(sizeBytes / (1024.0 * 1024.0) * 100) / 100.0);
        return details;
    }

    @Override
    public Optional<ApprovalCategory> category() {
        return Optional.of(ApprovalCategory.DOWNLOAD);
    }
}
