package com.dailyprojects.core.engine;

public class ProjectNotFoundException extends RuntimeException {

    private final String projectId;

    public ProjectNotFoundException(String projectId) {
        super("Project not found: " + projectId);
        this.projectId = projectId;
    }

    public String getProjectId() {
        return projectId;
    }
}
