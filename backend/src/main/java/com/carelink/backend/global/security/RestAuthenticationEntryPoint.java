package com.carelink.backend.global.security;

import java.io.IOException;

import com.carelink.backend.global.error.ProblemResponse;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * 401 for the API. A bearer token that failed verification is reported as {@code INVALID_ACCESS_TOKEN}
 * with an RFC 6750 challenge, so clients know to refresh rather than log in again.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String BEARER_REALM = "Bearer realm=\"carelink\"";

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean invalidToken = Boolean.TRUE.equals(request.getAttribute(JwtAuthenticationFilter.INVALID_TOKEN_ATTRIBUTE));
        ProblemResponse body;
        if (invalidToken) {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BEARER_REALM + ", error=\"invalid_token\"");
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, "INVALID_ACCESS_TOKEN",
                    "Access token is invalid or expired", request.getRequestURI());
        } else {
            response.setHeader(HttpHeaders.WWW_AUTHENTICATE, BEARER_REALM);
            body = ProblemResponse.of(HttpStatus.UNAUTHORIZED, "AUTHENTICATION_REQUIRED",
                    "Sign in to access this resource", request.getRequestURI());
        }

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
