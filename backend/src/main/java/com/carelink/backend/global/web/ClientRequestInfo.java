package com.carelink.backend.global.web;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * Caller network details recorded on sessions and audit entries.
 */
public record ClientRequestInfo(String ipAddress, String userAgent) {

    private static final String FORWARDED_FOR_HEADER = "X-Forwarded-For";
    private static final int USER_AGENT_MAX_LENGTH = 512;

    public static final ClientRequestInfo UNKNOWN = new ClientRequestInfo(null, null);

    public static ClientRequestInfo from(HttpServletRequest request) {
        if (request == null) {
            return UNKNOWN;
        }
        String forwarded = request.getHeader(FORWARDED_FOR_HEADER);
        String ip = StringUtils.hasText(forwarded)
                ? forwarded.split(",")[0].trim()
                : request.getRemoteAddr();
        String userAgent = request.getHeader(HttpHeaders.USER_AGENT);
        if (userAgent != null && userAgent.length() > USER_AGENT_MAX_LENGTH) {
            userAgent = userAgent.substring(0, USER_AGENT_MAX_LENGTH);
        }
        return new ClientRequestInfo(ip, userAgent);
    }
}
