package com.solusoft.medclaims.security;

import java.io.IOException;
import java.util.Collections;

import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import com.solusoft.medclaims.security.service.ApiKeyService;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Resolves the {@code X-API-KEY} header into a {@link ClaimsPrincipal}. Requests without a
 * (valid) key continue anonymously and are stopped later by the authorization rules.
 */
@Slf4j
public class ApiKeyAuthenticationFilter extends OncePerRequestFilter {

    public static final String HEADER = "X-API-KEY";

    private final ApiKeyService apiKeyService;

    public ApiKeyAuthenticationFilter(ApiKeyService apiKeyService) {
        this.apiKeyService = apiKeyService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String clientKey = request.getHeader(HEADER);

        if (StringUtils.hasText(clientKey)) {
            try {
                apiKeyService.authenticate(clientKey).ifPresentOrElse(principal -> {
                    UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                        principal, null,
                        Collections.singletonList(new SimpleGrantedAuthority(principal.role().authority()))
                    );
                    SecurityContextHolder.getContext().setAuthentication(auth);
                }, () -> log.warn("Rejected unknown or revoked API key on {}", request.getRequestURI()));
            } catch (RuntimeException e) {
                log.error("API key lookup failed, continuing unauthenticated", e);
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }
}
