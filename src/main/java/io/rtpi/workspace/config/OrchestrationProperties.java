package io.rtpi.workspace.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 远端容器编排 API 配置。
 *
 * <p>示例：</p>
 * <pre>
 * rtpi.orchestration.base-url=https://kasm-api:443
 * rtpi.orchestration.api-key=xxxx
 * rtpi.orchestration.api-secret=xxxx
 * rtpi.orchestration.access-domain=workspaces.example.com
 * rtpi.orchestration.access-port=8443
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "rtpi.orchestration")
public class OrchestrationProperties {

    private String baseUrl = "https://kasm-api:443";

    private String apiKey = "";

    private String apiSecret = "";

    /**
     * 连接超时
     */
    private long connectTimeoutMs = 5000;

    /**
     * 单次请求总超时（包含读取）。0 表示不设置。
     */
    private long readTimeoutMs = 30000;

    /**
     * 生成浏览器访问地址：https://{accessDomain}:{accessPort}/#/session/{sessionId}
     */
    private String accessDomain = "localhost";

    private int accessPort = 8443;

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public void setApiKey(String apiKey) {
        this.apiKey = apiKey;
    }

    public String getApiSecret() {
        return apiSecret;
    }

    public void setApiSecret(String apiSecret) {
        this.apiSecret = apiSecret;
    }

    public long getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public void setConnectTimeoutMs(long connectTimeoutMs) {
        this.connectTimeoutMs = connectTimeoutMs;
    }

    public long getReadTimeoutMs() {
        return readTimeoutMs;
    }

    public void setReadTimeoutMs(long readTimeoutMs) {
        this.readTimeoutMs = readTimeoutMs;
    }

    public String getAccessDomain() {
        return accessDomain;
    }

    public void setAccessDomain(String accessDomain) {
        this.accessDomain = accessDomain;
    }

    public int getAccessPort() {
        return accessPort;
    }

    public void setAccessPort(int accessPort) {
        this.accessPort = accessPort;
    }
}
