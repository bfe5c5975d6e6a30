package io.rtpi.workspace.service.impl;

import io.rtpi.workspace.common.OrchestrationUnavailableException;
import io.rtpi.workspace.common.QuotaExceededException;
import io.rtpi.workspace.common.WorkspaceForbiddenException;
import io.rtpi.workspace.common.WorkspaceNotFoundException;
import io.rtpi.workspace.config.OrchestrationProperties;
import io.rtpi.workspace.entity.RtpiWorkspace;
import io.rtpi.workspace.entity.RtpiWorkspaceSession;
import io.rtpi.workspace.entity.ShareGrant;
import io.rtpi.workspace.entity.SnapshotRecord;
import io.rtpi.workspace.entity.WorkspaceMetadata;
import io.rtpi.workspace.entity.response.ExpiringWorkspace;
import io.rtpi.workspace.entity.response.SessionInfo;
import io.rtpi.workspace.entity.response.WorkspaceProvisionResult;
import io.rtpi.workspace.enums.WorkspaceStatus;
import io.rtpi.workspace.service.RtpiWorkspaceService;
import io.rtpi.workspace.service.RtpiWorkspaceSessionService;
import io.rtpi.workspace.support.MutableClock;
import io.rtpi.workspace.workspace.OrchestrationClient;
import io.rtpi.workspace.workspace.RemoteSession;
import io.rtpi.workspace.workspace.WorkspaceConfig;
import io.rtpi.workspace.workspace.WorkspaceProperties;
import io.rtpi.workspace.workspace.WorkspaceStartupMonitor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class WorkspaceLifecycleServiceImplTest {

    private static final Instant T0 = Instant.parse("2025-03-01T10:00:00Z");
    private static final LocalDateTime NOW = LocalDateTime.ofInstant(T0, ZoneOffset.UTC);

    private RtpiWorkspaceService workspaceService;
    private RtpiWorkspaceSessionService sessionService;
    private OrchestrationClient client;
    private WorkspaceStartupMonitor monitor;
    private WorkspaceProperties props;
    private WorkspaceLifecycleServiceImpl service;

    @BeforeEach
    void setUp() {
        workspaceService = mock(RtpiWorkspaceService.class);
        sessionService = mock(RtpiWorkspaceSessionService.class);
        client = mock(OrchestrationClient.class);
        monitor = mock(WorkspaceStartupMonitor.class);
        props = new WorkspaceProperties();
        props.setEnabled(true);
        OrchestrationProperties orchestrationProps = new OrchestrationProperties();
        orchestrationProps.setAccessDomain("ws.rtpi.local");
        orchestrationProps.setAccessPort(8443);
        service = new WorkspaceLifecycleServiceImpl(workspaceService, sessionService, client, monitor,
                props, orchestrationProps, new MutableClock(T0));
    }

    private static WorkspaceConfig config(String userId, String type) {
        WorkspaceConfig c = new WorkspaceConfig();
        c.setUserId(userId);
        c.setWorkspaceType(type);
        return c;
    }

    private static RemoteSession remote(String sessionId) {
        RemoteSession rs = new RemoteSession();
        rs.setSessionId(sessionId);
        rs.setContainerId("c-" + sessionId);
        rs.setRemoteUserId("ru-1");
        rs.setInternalIp("10.1.1.1");
        return rs;
    }

    private static RtpiWorkspace existing(String id, String owner) {
        RtpiWorkspace w = new RtpiWorkspace();
        w.setId(id);
        w.setUserId(owner);
        w.setExternalSessionId("sess-" + id);
        w.setStatus(WorkspaceStatus.RUNNING.code());
        w.setExpiresAt(NOW.plusHours(2));
        w.setMetadata(new WorkspaceMetadata());
        return w;
    }

    private static List<RtpiWorkspace> active(int n) {
        List<RtpiWorkspace> out = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            RtpiWorkspace w = new RtpiWorkspace();
            w.setCpuLimit("1");
            w.setMemoryLimit("1024M");
            out.add(w);
        }
        return out;
    }

    // ---------------- provision ----------------

    @Test
    void provision_happyPath_persistsStartingRecordAndStartsMonitor() {
        when(workspaceService.listActiveByUser("u1")).thenReturn(List.of());
        when(client.createSession("kasmweb/kali-rolling-desktop:1.17.0", "2", "4096M")).thenReturn(remote("s-1"));
        doAnswer(inv -> {
            ((RtpiWorkspace) inv.getArgument(0)).setId("ws-1");
            return true;
        }).when(workspaceService).save(any(RtpiWorkspace.class));

        WorkspaceConfig c = config("u1", "kali");
        c.setExpiryHours(1);
        c.setMetadata(Map.of("engagement", "acme"));
        WorkspaceProvisionResult r = service.provisionWorkspace(c);

        assertThat(r.getId()).isEqualTo("ws-1");
        assertThat(r.getStatus()).isEqualTo("starting");
        assertThat(r.getExternalSessionId()).isEqualTo("s-1");
        assertThat(r.getAccessUrl()).isEqualTo("https://ws.rtpi.local:8443/#/session/s-1");
        assertThat(r.getExpiresAt()).isEqualTo(NOW.plusHours(1));

        ArgumentCaptor<RtpiWorkspace> saved = ArgumentCaptor.forClass(RtpiWorkspace.class);
        verify(workspaceService).save(saved.capture());
        assertThat(saved.getValue().getWorkspaceName()).isEqualTo("kali-s-1");
        assertThat(saved.getValue().getCpuLimit()).isEqualTo("2");
        assertThat(saved.getValue().getMemoryLimit()).isEqualTo("4096M");
        assertThat(saved.getValue().getMetadata().getExtra()).containsEntry("engagement", "acme");
        verify(monitor).watch("ws-1");
    }

    @Test
    void provision_defaultExpiryIs24Hours() {
        when(workspaceService.listActiveByUser("u1")).thenReturn(List.of());
        when(client.createSession(anyString(), anyString(), anyString())).thenReturn(remote("s-2"));

        WorkspaceProvisionResult r = service.provisionWorkspace(config("u1", "firefox"));

        assertThat(r.getExpiresAt()).isEqualTo(NOW.plusHours(24));
    }

    @Test
    void provision_quotaExceeded_createsNothing() {
        when(workspaceService.listActiveByUser("u1")).thenReturn(active(5));

        assertThatThrownBy(() -> service.provisionWorkspace(config("u1", "kali")))
                .isInstanceOf(QuotaExceededException.class);
        verifyNoInteractions(client, monitor);
        verify(workspaceService, never()).save(any(RtpiWorkspace.class));
    }

    @Test
    void provision_remoteCreateFails_noRecord() {
        when(workspaceService.listActiveByUser("u1")).thenReturn(List.of());
        when(client.createSession(anyString(), anyString(), anyString()))
                .thenThrow(new OrchestrationUnavailableException("down"));

        assertThatThrownBy(() -> service.provisionWorkspace(config("u1", "vscode")))
                .isInstanceOf(OrchestrationUnavailableException.class);
        verify(workspaceService, never()).save(any(RtpiWorkspace.class));
        verifyNoInteractions(monitor);
    }

    @Test
    void provision_insertFails_remoteSessionIsRolledBack() {
        when(workspaceService.listActiveByUser("u1")).thenReturn(List.of());
        when(client.createSession(anyString(), anyString(), anyString())).thenReturn(remote("s-3"));
        doThrow(new IllegalStateException("db down")).when(workspaceService).save(any(RtpiWorkspace.class));

        assertThatThrownBy(() -> service.provisionWorkspace(config("u1", "burp")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("db down");
        verify(client).deleteSession("s-3");
        verifyNoInteractions(monitor);
    }

    @Test
    void provision_rejectsInvalidInput() {
        assertThatThrownBy(() -> service.provisionWorkspace(config(null, "kali")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.provisionWorkspace(config("u1", "notepad")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid workspaceType");
        WorkspaceConfig c = config("u1", "kali");
        c.setExpiryHours(0);
        assertThatThrownBy(() -> service.provisionWorkspace(c)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(client);
    }

    @Test
    void provision_disabledManager() {
        props.setEnabled(false);
        assertThatThrownBy(() -> service.provisionWorkspace(config("u1", "kali")))
                .isInstanceOf(OrchestrationUnavailableException.class);
        verifyNoInteractions(client);
    }

    // ---------------- terminate ----------------

    @Test
    void terminate_remoteDeleteFailureStillTerminatesLocally() {
        when(workspaceService.getById("w1")).thenReturn(existing("w1", "u1"));
        doThrow(new OrchestrationUnavailableException("down")).when(client).deleteSession("sess-w1");

        service.terminateWorkspace("w1");

        verify(workspaceService).terminateLocal("w1", NOW);
    }

    @Test
    void terminate_alreadyTerminatedReissuesRemoteDelete() {
        RtpiWorkspace w = existing("w1", "u1");
        w.setTerminatedAt(NOW.minusHours(1));
        when(workspaceService.getById("w1")).thenReturn(w);
        doThrow(new OrchestrationUnavailableException("404 session not found")).when(client).deleteSession("sess-w1");

        service.terminateWorkspace("w1");

        verify(client).deleteSession("sess-w1");
        verify(workspaceService).terminateLocal("w1", NOW);
    }

    @Test
    void terminate_unknownWorkspace() {
        assertThatThrownBy(() -> service.terminateWorkspace("nope"))
                .isInstanceOf(WorkspaceNotFoundException.class)
                .hasMessage("Workspace nope not found");
    }

    @Test
    void terminate_ownerScopedRejectsOthers() {
        when(workspaceService.getById("w1")).thenReturn(existing("w1", "u1"));

        assertThatThrownBy(() -> service.terminateWorkspace("w1", "u2"))
                .isInstanceOf(WorkspaceForbiddenException.class);
        verify(workspaceService, never()).terminateLocal(anyString(), any());
    }

    // ---------------- extend ----------------

    @Test
    void extend_addsHoursToCurrentExpiry() {
        RtpiWorkspace w = existing("w1", "u1");
        when(workspaceService.getById("w1")).thenReturn(w);
        when(workspaceService.extendExpiry("w1", NOW.plusHours(2), NOW.plusHours(5))).thenReturn(true);

        assertThat(service.extendWorkspaceExpiry("w1", 3)).isEqualTo(NOW.plusHours(5));
    }

    @Test
    void extend_rejectsNonPositiveHours() {
        assertThatThrownBy(() -> service.extendWorkspaceExpiry("w1", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.extendWorkspaceExpiry("w1", -2)).isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(workspaceService);
    }

    @Test
    void extend_terminatedWorkspaceIsRejected() {
        RtpiWorkspace w = existing("w1", "u1");
        w.setTerminatedAt(NOW);
        when(workspaceService.getById("w1")).thenReturn(w);

        assertThatThrownBy(() -> service.extendWorkspaceExpiry("w1", 1)).isInstanceOf(IllegalStateException.class);
    }

    // ---------------- sessions ----------------

    @Test
    void updateSessionActivity_unknownToken() {
        when(sessionService.touchByToken(eq("t-x"), any())).thenReturn(false);

        assertThatThrownBy(() -> service.updateSessionActivity("t-x")).isInstanceOf(WorkspaceNotFoundException.class);
    }

    @Test
    void terminateSession_isIdempotent() {
        RtpiWorkspaceSession s = new RtpiWorkspaceSession();
        s.setId("sid");
        s.setWorkspaceId("w1");
        when(sessionService.getByToken("t-1")).thenReturn(s);
        when(sessionService.terminateByToken("t-1", NOW)).thenReturn(true, false);

        service.terminateSession("t-1");
        service.terminateSession("t-1");

        assertThatThrownBy(() -> service.terminateSession("t-unknown")).isInstanceOf(WorkspaceNotFoundException.class);
    }

    @Test
    void createSession_workspaceTerminatedDuringInsertDropsNewSession() {
        RtpiWorkspace live = existing("w1", "u1");
        RtpiWorkspace terminated = existing("w1", "u1");
        terminated.setStatus(WorkspaceStatus.STOPPED.code());
        terminated.setTerminatedAt(NOW);
        when(workspaceService.getById("w1")).thenReturn(live, terminated);
        doAnswer(inv -> {
            ((RtpiWorkspaceSession) inv.getArgument(0)).setId("racing-sess");
            return true;
        }).when(sessionService).save(any(RtpiWorkspaceSession.class));

        assertThatThrownBy(() -> service.createSession("w1", "u1", "10.0.0.9", "curl"))
                .isInstanceOf(IllegalStateException.class);

        verify(sessionService).terminateById("racing-sess", NOW);
        verify(workspaceService, never()).touchLastAccessed(anyString(), any());
    }

    // ---------------- sharing ----------------

    @Test
    void share_replacesPreviousGrantForSameTarget() {
        RtpiWorkspace w = existing("w1", "u1");
        w.getMetadata().getSharedWith().add(new ShareGrant("u2", NOW.minusDays(1), "old-sess"));
        when(workspaceService.getById("w1")).thenReturn(w);
        when(workspaceService.updateMetadata(eq("w1"), any())).thenReturn(true);
        doAnswer(inv -> {
            ((RtpiWorkspaceSession) inv.getArgument(0)).setId("new-sess");
            return true;
        }).when(sessionService).save(any(RtpiWorkspaceSession.class));

        SessionInfo info = service.shareWorkspace("w1", "u1", "u2");

        assertThat(info.getId()).isEqualTo("new-sess");
        assertThat(info.getUserId()).isEqualTo("u2");
        assertThat(info.getExpiresAt()).isEqualTo(NOW.plusHours(12));
        verify(sessionService).terminateById("old-sess", NOW);
        ArgumentCaptor<WorkspaceMetadata> md = ArgumentCaptor.forClass(WorkspaceMetadata.class);
        verify(workspaceService).updateMetadata(eq("w1"), md.capture());
        assertThat(md.getValue().getSharedWith()).hasSize(1);
        assertThat(md.getValue().getSharedWith().get(0).getSessionId()).isEqualTo("new-sess");
    }

    @Test
    void share_rejectsOwnerAsTargetAndNonOwners() {
        when(workspaceService.getById("w1")).thenReturn(existing("w1", "u1"));

        assertThatThrownBy(() -> service.shareWorkspace("w1", "u1", "u1")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.shareWorkspace("w1", "u3", "u2")).isInstanceOf(WorkspaceForbiddenException.class);
    }

    @Test
    void revoke_terminatesTargetSessionsAndDropsGrant() {
        RtpiWorkspace w = existing("w1", "u1");
        w.getMetadata().getSharedWith().add(new ShareGrant("u2", NOW, "s-2"));
        when(workspaceService.getById("w1")).thenReturn(w);

        service.revokeWorkspaceSharing("w1", "u1", "u2");

        verify(sessionService).terminateActiveByWorkspaceAndUser("w1", "u2", NOW);
        ArgumentCaptor<WorkspaceMetadata> md = ArgumentCaptor.forClass(WorkspaceMetadata.class);
        verify(workspaceService).updateMetadata(eq("w1"), md.capture());
        assertThat(md.getValue().getSharedWith()).isEmpty();
    }

    @Test
    void hasAccess_ownerOrGrantee() {
        RtpiWorkspace w = existing("w1", "u1");
        w.getMetadata().getSharedWith().add(new ShareGrant("u2", NOW, "s-2"));

        assertThat(service.hasAccess(w, "u1")).isTrue();
        assertThat(service.hasAccess(w, "u2")).isTrue();
        assertThat(service.hasAccess(w, "u3")).isFalse();
        assertThat(service.hasAccess(w, null)).isFalse();
    }

    // ---------------- snapshots ----------------

    @Test
    void createSnapshot_appendsRecord() {
        when(workspaceService.getById("w1")).thenReturn(existing("w1", "u1"));
        when(client.createSnapshot("sess-w1", "snap-1")).thenReturn(4096L);
        when(workspaceService.updateMetadata(eq("w1"), any())).thenReturn(true);

        SnapshotRecord rec = service.createSnapshot("w1", "u1", "snap-1", Map.of("note", "pre-exploit"));

        assertThat(rec.getSize()).isEqualTo(4096L);
        assertThat(rec.getCreatedAt()).isEqualTo(NOW);
        assertThat(rec.getMetadata()).containsEntry("note", "pre-exploit");
        ArgumentCaptor<WorkspaceMetadata> md = ArgumentCaptor.forClass(WorkspaceMetadata.class);
        verify(workspaceService).updateMetadata(eq("w1"), md.capture());
        assertThat(md.getValue().getSnapshots()).extracting(SnapshotRecord::getSnapshotName).containsExactly("snap-1");
    }

    @Test
    void createSnapshot_remoteFailureLeavesMetadataUntouched() {
        when(workspaceService.getById("w1")).thenReturn(existing("w1", "u1"));
        when(client.createSnapshot(anyString(), anyString())).thenThrow(new OrchestrationUnavailableException("down"));

        assertThatThrownBy(() -> service.createSnapshot("w1", "u1", "snap-1", null))
                .isInstanceOf(OrchestrationUnavailableException.class);
        verify(workspaceService, never()).updateMetadata(anyString(), any());
    }

    @Test
    void restore_requiresKnownSnapshot() {
        RtpiWorkspace w = existing("w1", "u1");
        w.getMetadata().getSnapshots().add(new SnapshotRecord("w1", "snap-1", NOW, 1L, Map.of()));
        when(workspaceService.getById("w1")).thenReturn(w);

        assertThatThrownBy(() -> service.restoreFromSnapshot("w1", "u1", "snap-x"))
                .isInstanceOf(WorkspaceNotFoundException.class);
        service.restoreFromSnapshot("w1", "u1", "snap-1");

        verify(client).restoreSnapshot("sess-w1", "snap-1");
        verify(workspaceService, never()).extendExpiry(anyString(), any(), any());
    }

    @Test
    void listSnapshots_grantedUserCanRead() {
        RtpiWorkspace w = existing("w1", "u1");
        w.getMetadata().getSharedWith().add(new ShareGrant("u2", NOW, "s-2"));
        w.getMetadata().getSnapshots().add(new SnapshotRecord("w1", "snap-1", NOW, 1L, Map.of()));
        when(workspaceService.getById("w1")).thenReturn(w);

        assertThat(service.listSnapshots("w1", "u2")).hasSize(1);
        assertThatThrownBy(() -> service.listSnapshots("w1", "u3")).isInstanceOf(WorkspaceForbiddenException.class);
    }

    // ---------------- reclamation ----------------

    @Test
    void cleanupExpiredWorkspaces_containsPerItemFailures() {
        RtpiWorkspace a = existing("a", "u1");
        RtpiWorkspace b = existing("b", "u1");
        RtpiWorkspace c = existing("c", "u2");
        when(workspaceService.listExpired(NOW)).thenReturn(List.of(a, b, c));
        when(workspaceService.terminateLocal("a", NOW)).thenReturn(true);
        when(workspaceService.terminateLocal("b", NOW)).thenThrow(new RuntimeException("db hiccup"));
        when(workspaceService.terminateLocal("c", NOW)).thenReturn(true);

        assertThat(service.cleanupExpiredWorkspaces()).isEqualTo(2);
    }

    @Test
    void cleanupExpiredSessions_includesIdleWhenConfigured() {
        props.setSessionIdleTimeoutMinutes(30);
        when(sessionService.terminateExpired(NOW)).thenReturn(2);
        when(sessionService.terminateIdle(NOW.minusMinutes(30), NOW)).thenReturn(1);

        assertThat(service.cleanupExpiredSessions()).isEqualTo(3);
    }

    @Test
    void cleanupExpiredSessions_idleDisabledByDefault() {
        when(sessionService.terminateExpired(NOW)).thenReturn(4);

        assertThat(service.cleanupExpiredSessions()).isEqualTo(4);
        verify(sessionService, never()).terminateIdle(any(), any());
    }

    @Test
    void expiringSoon_reportsMinutesLeft() {
        RtpiWorkspace w = existing("w1", "u1");
        w.setWorkspaceName("kali-s-1");
        w.setExpiresAt(NOW.plusMinutes(45));
        when(workspaceService.listExpiringBefore(NOW.plusMinutes(60))).thenReturn(List.of(w));

        List<ExpiringWorkspace> out = service.getExpiringSoonWorkspaces();

        assertThat(out).hasSize(1);
        assertThat(out.get(0).getMinutesUntilExpiry()).isEqualTo(45);
        assertThat(out.get(0).getWorkspaceName()).isEqualTo("kali-s-1");
    }

    @Test
    void initialize_disabledDoesNothing() {
        props.setEnabled(false);

        service.initialize();

        verifyNoInteractions(client, workspaceService, sessionService);
    }

    @Test
    void initialize_authenticatesThenCatchesUp() {
        when(workspaceService.listExpired(NOW)).thenReturn(List.of());

        service.initialize();

        verify(client).authenticate();
        verify(workspaceService).listExpired(NOW);
        verify(sessionService).terminateExpired(NOW);
    }
}
