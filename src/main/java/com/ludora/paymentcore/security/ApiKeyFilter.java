package com.ludora.paymentcore.security;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import java.io.IOException;

/**
 * Checks "Authorization: ApiKey &lt;key&gt;" on the checkout API.
 * Provider webhooks are authenticated by their HMAC signature instead.
 */
@Component
public class ApiKeyFilter extends OncePerRequestFilter {

    static final String WEBHOOK_PREFIX = "/api/v1/webhooks/";

    @Value("${app.api-key}")
    private String apiKey;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        String method = request.getMethod();

        if ("OPTIONS".equalsIgnoreCase(method)) return true; // CORS preflight
        if (path.equals("/h2-console") || path.startsWith("/h2-console/")) return true;
        if (path.startsWith(WEBHOOK_PREFIX)) return true;
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response,
                                    FilterChain filterChain) throws IOException, ServletException {
        String header = request.getHeader("Authorization");
        if (header == null || !header.equals("ApiKey " + apiKey)) {
            response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
            response.getWriter().write("Unauthorized: missing or invalid API key");
            return;
        }
        filterChain.doFilter(request, response);
    }
}
