package io.rtpi.workspace.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 运维接口（/api/rtpi/admin/**）访问控制。
 *
 * <pre>
 * rtpi.admin.enabled=true
 * rtpi.admin.allowed-ips=127.0.0.1,10.0.0.0/8
 * rtpi.admin.token=${RTPI_ADMIN_TOKEN}
 * rtpi.admin.trust-forwarded-for=false
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "rtpi.admin")
public class AdminSecurityProperties {

    /**
     * false 时不做任何校验（仅限内网调试）
     */
    private boolean enabled = true;

    /**
     * 精确 IP、CIDR 或 "*"
     */
    private List<String> allowedIps = new ArrayList<>(List.of("127.0.0.1", "::1"));

    private String token = "";

    /**
     * 前面有可信反向代理时才打开；否则 X-Forwarded-For / X-Real-IP 可被客户端伪造
     */
    private boolean trustForwardedFor = false;
}
