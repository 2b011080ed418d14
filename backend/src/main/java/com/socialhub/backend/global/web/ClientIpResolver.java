package com.socialhub.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Best-effort client address: first {@code X-Forwarded-For} hop, then {@code X-Real-IP},
 * then the socket peer.
 */
@Component
public class ClientIpResolver {

    static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    static final String REAL_IP_HEADER = "X-Real-IP";

    private final boolean trustForwardedHeaders;

    public ClientIpResolver(@Value("${social.client-ip.trust-forwarded-headers:true}") boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public String resolve(HttpServletRequest request) {
        if (trustForwardedHeaders) {
            String forwardedFor = request.getHeader(FORWARDED_FOR_HEADER);
            if (StringUtils.hasText(forwardedFor)) {
                String first = forwardedFor.split(",")[0].trim();
                if (!first.isEmpty()) {
                    return first;
                }
            }
            String realIp = request.getHeader(REAL_IP_HEADER);
            if (StringUtils.hasText(realIp)) {
                return realIp.trim();
            }
        }
        return request.getRemoteAddr();
    }
}
