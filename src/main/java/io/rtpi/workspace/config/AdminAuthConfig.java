package io.rtpi.workspace.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.Ordered;

/**
 * 只挂在运维前缀上；业务接口不经过这层。
 */
@Configuration
public class AdminAuthConfig {

    @Bean
    public FilterRegistrationBean<AdminAuthFilter> rtpiAdminAuthFilter(AdminSecurityProperties adminProps,
                                                                       ObjectMapper objectMapper) {
        FilterRegistrationBean<AdminAuthFilter> registration =
                new FilterRegistrationBean<>(new AdminAuthFilter(adminProps, objectMapper));
        registration.setName("rtpiAdminAuthFilter");
        registration.addUrlPatterns(AdminAuthFilter.PREFIX + "*");
        registration.setOrder(Ordered.HIGHEST_PRECEDENCE + 10);
        return registration;
    }
}
