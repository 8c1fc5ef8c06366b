package com.mender.workspace;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mender.workspace")
public class WorkspaceProperties {

    /** Root directory of the codebase findings and fixes refer to. */
    private String root = ".";

    public String getRoot() {
        return root;
    }

    public void setRoot(String root) {
        this.root = root;
    }
}
