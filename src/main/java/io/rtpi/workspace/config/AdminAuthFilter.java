package io.rtpi.workspace.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.rtpi.workspace.common.Result;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * /api/rtpi/admin/** 管理接口鉴权：
 * - 来源 IP 在白名单内：默认只看 remoteAddr；trust-forwarded-for=true 时 X-Forwarded-For 第一个值也算
 * - Header 携带 X-Admin-Token
 */
public class AdminAuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(AdminAuthFilter.class);

    static final String PREFIX = "/api/rtpi/admin/";
    static final String HDR = "X-Admin-Token";
    private static final String PLACEHOLDER_TOKEN = "CHANGE_ME_STRONG_ADMIN_TOKEN";

    private final AdminSecurityProperties props;
    private final ObjectMapper objectMapper;

    public AdminAuthFilter(AdminSecurityProperties props, ObjectMapper objectMapper) {
        this.props = props;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        if (!StringUtils.hasText(uri) || !uri.startsWith(PREFIX)) return true;
        return props == null || !props.isEnabled();
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String remoteIp = request.getRemoteAddr();
        String forwardedIp = props.isTrustForwardedFor() ? forwardedIp(request) : null;
        if (!isAllowed(remoteIp) && !isAllowed(forwardedIp)) {
            log.warn("admin request rejected: uri={}, remoteIp={}, forwardedIp={}",
                    request.getRequestURI(), remoteIp, forwardedIp);
            deny(response, 403, "admin forbidden: ip not allowed");
            return;
        }

        String expected = props.getToken();
        if (!StringUtils.hasText(expected) || PLACEHOLDER_TOKEN.equals(expected)) {
            deny(response, 500, "admin token not configured");
            return;
        }
        if (!expected.equals(request.getHeader(HDR))) {
            deny(response, 401, "admin unauthorized");
            return;
        }
        filterChain.doFilter(request, response);
    }

    boolean isAllowed(String ip) {
        if (!StringUtils.hasText(ip)) return false;
        List<String> rules = props.getAllowedIps();
        if (rules == null) return false;
        for (String raw : rules) {
            if (!StringUtils.hasText(raw)) continue;
            String rule = raw.trim();
            if ("*".equals(rule)) return true;
            if (rule.contains("/") ? inCidr(ip.trim(), rule) : rule.equals(ip.trim())) return true;
        }
        return false;
    }

    private boolean inCidr(String ip, String cidr) {
        int slash = cidr.indexOf('/');
        try {
            byte[] addr = InetAddress.getByName(ip).getAddress();
            byte[] net = InetAddress.getByName(cidr.substring(0, slash)).getAddress();
            int bits = Integer.parseInt(cidr.substring(slash + 1));
            if (addr.length != net.length || bits < 0 || bits > addr.length * 8) return false;
            for (int i = 0; i < bits; i++) {
                int mask = 0x80 >>> (i % 8);
                if ((addr[i / 8] & mask) != (net[i / 8] & mask)) return false;
            }
            return true;
        } catch (Exception e) {
            log.debug("invalid cidr rule or ip: cidr={}, ip={}", cidr, ip);
            return false;
        }
    }

    private String forwardedIp(HttpServletRequest request) {
        String xff = request.getHeader("X-Forwarded-For");
        if (StringUtils.hasText(xff)) {
            String first = xff.split(",")[0].trim();
            if (StringUtils.hasText(first)) return first;
        }
        String xri = request.getHeader("X-Real-IP");
        return StringUtils.hasText(xri) ? xri.trim() : null;
    }

    private void deny(HttpServletResponse resp, int code, String msg) throws IOException {
        resp.setStatus(code);
        resp.setContentType(MediaType.APPLICATION_JSON_VALUE);
        resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resp.getWriter().write(objectMapper.writeValueAsString(Result.error(code, msg)));
    }
}
