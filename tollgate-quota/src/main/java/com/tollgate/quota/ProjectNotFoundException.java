package com.tollgate.quota;

import java.util.UUID;

/**
 * No quota row exists for the project; the tenant is mis-provisioned.
 */
public final class ProjectNotFoundException extends RuntimeException {

    private final UUID projectId;

    public ProjectNotFoundException(UUID projectId) {
        super("Project not found: " + projectId);
        this.projectId = projectId;
    }

    public UUID getProjectId() {
        return projectId;
    }
}
