package io.rtpi.workspace.workspace;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.rtpi.workspace.common.OrchestrationUnavailableException;
import io.rtpi.workspace.config.OrchestrationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 远端容器编排 API 的轻量客户端（Bearer token）。
 *
 * <p>约定：</p>
 * <ul>
 *   <li>任何调用都可能失败（网络/鉴权），统一抛 {@link OrchestrationUnavailableException}，内部不重试</li>
 *   <li>token 只在 {@link #authenticate()} 时刷新，调用中遇到 401 不会自动重新鉴权</li>
 *   <li>token 写入后只读，多线程共享同一个 HttpClient</li>
 * </ul>
 */
@Component
public class OrchestrationClient {
    private static final Logger log = LoggerFactory.getLogger(OrchestrationClient.class);

    private final OrchestrationProperties props;
    private final ObjectMapper objectMapper;
    private final HttpClient httpClient;

    private volatile String token;

    public OrchestrationClient(OrchestrationProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
        HttpClient.Builder b = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1);
        if (props != null && props.getConnectTimeoutMs() > 0) {
            b.connectTimeout(Duration.ofMillis(props.getConnectTimeoutMs()));
        }
        this.httpClient = b.build();
    }

    public boolean isAuthenticated() {
        return StringUtils.hasText(token);
    }

    /**
     * POST /api/auth {api_key, api_secret} -> {token}
     */
    public String authenticate() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("api_key", props.getApiKey());
        body.put("api_secret", props.getApiSecret());
        JsonNode resp;
        try {
            resp = requestJson("POST", "/api/auth", body, false);
        } catch (OrchestrationUnavailableException e) {
            throw new OrchestrationUnavailableException("Failed to authenticate with orchestration API: " + e.getMessage(), e);
        }
        String t = text(resp, "token");
        if (!StringUtils.hasText(t)) {
            throw new OrchestrationUnavailableException("Failed to authenticate with orchestration API: empty token");
        }
        this.token = t;
        log.info("orchestration api authenticated: baseUrl={}", props.getBaseUrl());
        return t;
    }

    /**
     * POST /api/sessions -> {session:{session_id, container_id, user_id, ip, status}}
     */
    public RemoteSession createSession(String imageRef, String cpuLimit, String memoryLimit) {
        Map<String, Object> env = new LinkedHashMap<>();
        env.put("CPU_LIMIT", cpuLimit);
        env.put("MEMORY_LIMIT", memoryLimit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("image_src", imageRef);
        body.put("enable_sharing", false);
        body.put("environment", env);

        JsonNode session = requestJson("POST", "/api/sessions", body, true).path("session");
        String sessionId = text(session, "session_id");
        if (!StringUtils.hasText(sessionId)) {
            throw new OrchestrationUnavailableException("create session failed: response has no session_id");
        }
        RemoteSession rs = new RemoteSession();
        rs.setSessionId(sessionId);
        rs.setContainerId(text(session, "container_id"));
        rs.setRemoteUserId(text(session, "user_id"));
        rs.setInternalIp(text(session, "ip"));
        rs.setStatus(text(session, "status"));
        return rs;
    }

    /**
     * GET /api/sessions/{id} -> session.status（小写；缺失时返回 "unknown"）
     */
    public String getSessionStatus(String sessionId) {
        JsonNode resp = requestJson("GET", "/api/sessions/" + pathSegment(sessionId), null, true);
        String status = text(resp.path("session"), "status");
        return StringUtils.hasText(status) ? status.trim().toLowerCase(Locale.ROOT) : "unknown";
    }

    public void deleteSession(String sessionId) {
        requestJson("DELETE", "/api/sessions/" + pathSegment(sessionId), null, true);
    }

    /**
     * POST /api/sessions/{id}/snapshot {snapshot_name} -> {snapshot:{size}}，返回 size（缺省 0）
     */
    public long createSnapshot(String sessionId, String snapshotName) {
        JsonNode resp = requestJson("POST", "/api/sessions/" + pathSegment(sessionId) + "/snapshot",
                Map.of("snapshot_name", snapshotName), true);
        return resp.path("snapshot").path("size").asLong(0);
    }

    public void restoreSnapshot(String sessionId, String snapshotName) {
        requestJson("POST", "/api/sessions/" + pathSegment(sessionId) + "/restore",
                Map.of("snapshot_name", snapshotName), true);
    }

    private JsonNode requestJson(String method, String path, Object bodyObj, boolean authorized) {
        if (props == null || !StringUtils.hasText(props.getBaseUrl())) {
            throw new OrchestrationUnavailableException("rtpi.orchestration.base-url 未配置");
        }
        String m = method.toUpperCase(Locale.ROOT);
        byte[] bodyBytes = new byte[0];
        if (bodyObj != null) {
            try {
                bodyBytes = objectMapper.writeValueAsBytes(bodyObj);
            } catch (Exception e) {
                throw new OrchestrationUnavailableException("orchestration request encode failed: " + e.getMessage(), e);
            }
        }

        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(joinUrl(props.getBaseUrl(), path)));
        if (props.getReadTimeoutMs() > 0) {
            b.timeout(Duration.ofMillis(props.getReadTimeoutMs()));
        }
        if (bodyObj == null) {
            b.method(m, HttpRequest.BodyPublishers.noBody());
        } else {
            b.method(m, HttpRequest.BodyPublishers.ofByteArray(bodyBytes));
            b.header("Content-Type", "application/json");
        }
        b.header("Accept", "application/json");
        if (authorized) {
            String t = token;
            if (!StringUtils.hasText(t)) {
                throw new OrchestrationUnavailableException("orchestration api not authenticated");
            }
            b.header("Authorization", "Bearer " + t);
        }

        HttpResponse<byte[]> resp;
        try {
            resp = httpClient.send(b.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OrchestrationUnavailableException("orchestration request interrupted: " + m + " " + path);
        } catch (Exception e) {
            throw new OrchestrationUnavailableException("orchestration request failed: " + m + " " + path + ", error=" + e.getMessage(), e);
        }

        byte[] raw = resp.body() == null ? new byte[0] : resp.body();
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new OrchestrationUnavailableException("orchestration error: " + m + " " + path
                    + ", http=" + resp.statusCode() + ", body=" + abbreviate(new String(raw, StandardCharsets.UTF_8)));
        }
        if (raw.length == 0) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(raw);
        } catch (Exception e) {
            throw new OrchestrationUnavailableException("orchestration decode failed: " + m + " " + path
                    + ", http=" + resp.statusCode() + ", body=" + abbreviate(new String(raw, StandardCharsets.UTF_8)), e);
        }
    }

    private String text(JsonNode node, String field) {
        if (node == null) return null;
        JsonNode v = node.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private String joinUrl(String baseUrl, String path) {
        String b = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        return b + (path.startsWith("/") ? path : "/" + path);
    }

    private String pathSegment(String s) {
        if (!StringUtils.hasText(s)) {
            throw new IllegalArgumentException("sessionId is required");
        }
        return URLEncoder.encode(s, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private String abbreviate(String s) {
        if (s == null) return "";
        return s.length() > 300 ? s.substring(0, 300) + "..." : s;
    }
}
