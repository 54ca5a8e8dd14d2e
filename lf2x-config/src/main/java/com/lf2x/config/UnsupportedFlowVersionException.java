package com.lf2x.config;

import java.util.List;

public final class UnsupportedFlowVersionException extends FlowExportException {
    private final String version;
    private final List<String> supportedVersions;

    public UnsupportedFlowVersionException(String version, List<String> supportedVersions) {
        super("Unsupported flow version '" + version + "'. Supported: " + String.join(", ", supportedVersions));
        this.version = version;
        this.supportedVersions = List.copyOf(supportedVersions);
    }

    public String version() {
        return version;
    }

    public List<String> supportedVersions() {
        return supportedVersions;
    }
}
