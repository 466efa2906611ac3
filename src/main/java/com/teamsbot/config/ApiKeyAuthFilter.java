package com.teamsbot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.teamsbot.model.ErrorResponse;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

/**
 * Shared-secret check for the {@code /bots} API. Accepts {@code Authorization: Bearer <key>} or
 * {@code Authorization: Token <key>}. Disabled when {@code bot.api-key} is empty.
 */
@Slf4j
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    private final String apiKey;
    private final ObjectMapper objectMapper;

    public ApiKeyAuthFilter(@Value("${bot.api-key:}") String apiKey, ObjectMapper objectMapper) {
        this.apiKey = apiKey != null ? apiKey.trim() : "";
        this.objectMapper = objectMapper;
        if (this.apiKey.isEmpty()) {
            log.warn("bot.api-key is not set, /bots endpoints are unauthenticated");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return apiKey.isEmpty() || !(path.equals("/bots") || path.startsWith("/bots/"));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        String presented = extractKey(header);
        if (presented == null) {
            reject(response, "Missing or malformed Authorization header");
            return;
        }
        if (!MessageDigest.isEqual(presented.getBytes(StandardCharsets.UTF_8), apiKey.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected request to {} with invalid API key", request.getRequestURI());
            reject(response, "Invalid API key");
            return;
        }
        chain.doFilter(request, response);
    }

    private static String extractKey(String header) {
        if (header == null) {
            return null;
        }
        String value = header.trim();
        for (String scheme : new String[] {"Bearer ", "Token "}) {
            if (value.regionMatches(true, 0, scheme, 0, scheme.length())) {
                String key = value.substring(scheme.length()).trim();
                return key.isEmpty() ? null : key;
            }
        }
        return null;
    }

    private void reject(HttpServletResponse response, String detail) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getWriter(), ErrorResponse.of("Unauthorized", detail));
    }
}
