package io.rtpi.workspace.common;

public class WorkspaceNotFoundException extends RuntimeException {
    public WorkspaceNotFoundException(String message) {
        super(message);
    }

    public static WorkspaceNotFoundException workspace(String workspaceId) {
        return new WorkspaceNotFoundException("Workspace " + workspaceId + " not found");
    }

    public static WorkspaceNotFoundException session() {
        return new WorkspaceNotFoundException("Session not found or already terminated");
    }
}
