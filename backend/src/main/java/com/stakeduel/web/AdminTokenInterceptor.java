package com.stakeduel.web;

import com.stakeduel.config.StakeduelProperties;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Rejects admin requests that do not carry the configured admin token.
 * A blank configured token leaves the admin routes open.
 */
public class AdminTokenInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(AdminTokenInterceptor.class);

    private final StakeduelProperties stakeduelProperties;

    public AdminTokenInterceptor(StakeduelProperties stakeduelProperties) {
        this.stakeduelProperties = stakeduelProperties;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        StakeduelProperties.Admin admin = stakeduelProperties.getAdmin();
        if (!StringUtils.hasText(admin.getToken())) {
            return true;
        }

        String presented = request.getHeader(admin.getHeaderName());
        if (presented != null && MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                admin.getToken().getBytes(StandardCharsets.UTF_8))) {
            return true;
        }

        log.warn("admin_rejected method={} uri={}", request.getMethod(), request.getRequestURI());
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"code\":\"unauthorized\",\"message\":\"Admin token required\"}");
        return false;
    }
}
