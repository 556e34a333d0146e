package com.lemur.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Checks the API key on /agent/** requests, including the WebSocket handshake.
 * Browsers cannot set headers on a WebSocket handshake, so the key is also accepted
 * as the {@code api_key} query parameter.
 */
@Component
public class ApiKeyAuthFilter extends OncePerRequestFilter {

    static final String API_KEY_HEADER = "X-Api-Key";
    static final String API_KEY_PARAM = "api_key";

    @Value("${agent.api.key:}")
    private String apiKey;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (!request.getRequestURI().startsWith("/agent/")) {
            filterChain.doFilter(request, response);
            return;
        }

        // No key configured: open access (development mode)
        if (apiKey == null || apiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(API_KEY_HEADER);
        if (providedKey == null || providedKey.isBlank()) {
            providedKey = request.getParameter(API_KEY_PARAM);
        }

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing X-Api-Key header");
            return;
        }

        if (!apiKey.equals(providedKey)) {
            reject(response, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String error) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"" + error + "\"}");
    }
}
