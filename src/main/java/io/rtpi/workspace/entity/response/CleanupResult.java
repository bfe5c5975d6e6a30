package io.rtpi.workspace.entity.response;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class CleanupResult {
    private int workspacesTerminated;
    private int sessionsTerminated;
}
