package com.solusoft.medclaims.aspect;

import java.time.Duration;
import java.time.Instant;

import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import com.solusoft.medclaims.security.ClaimsPrincipal;

import lombok.extern.slf4j.Slf4j;

@Aspect
@Component
@Slf4j
public class AuditLoggingAspect {

    // Intercept every controller action annotated with @Audited
    @Around("@annotation(audited)")
    public Object traceAction(ProceedingJoinPoint joinPoint, Audited audited) throws Throwable {

        // 1. Who is calling?
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        String user = "Anonymous";
        String role = "[]";
        if (auth != null && auth.getPrincipal() instanceof ClaimsPrincipal principal) {
            user = principal.email() + "#" + principal.userId();
            role = String.valueOf(principal.role());
        } else if (auth != null) {
            user = auth.getName();
            role = auth.getAuthorities().toString();
        }

        // 2. What are they calling?
        String action = audited.value().isEmpty() ? joinPoint.getSignature().getName() : audited.value();

        log.info("[AUDIT START] User='{}' Role={} Action='{}'", user, role, action);

        Instant start = Instant.now();
        boolean success = true;
        String errorMessage = null;

        try {
            return joinPoint.proceed();
        } catch (Throwable ex) {
            success = false;
            errorMessage = ex.getMessage();
            throw ex;
        } finally {
            long timeTaken = Duration.between(start, Instant.now()).toMillis();
            if (success) {
                log.info("[AUDIT SUCCESS] User='{}' Action='{}' Time={}ms", user, action, timeTaken);
            } else {
                log.warn("[AUDIT FAILURE] User='{}' Action='{}' Time={}ms Error='{}'", user, action, timeTaken, errorMessage);
            }
        }
    }
}
