package com.warden.core.integrity;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "warden.integrity")
public class IntegrityProperties {

    /** Files or directories whose content is hashed at startup; directories are walked recursively. */
    private List<String> files = new ArrayList<>();

    /** Period of the background verification; zero disables it. */
    private Duration checkInterval = Duration.ZERO;

    public List<String> getFiles() {
        return files;
    }

    public void setFiles(List<String> files) {
        this.files = files;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }
}
