package com.medledger.consentservice.aspects;

import com.github.benmanes.caffeine.cache.Cache;
import com.medledger.consentservice.annotations.RateLimited;
import com.medledger.consentservice.exceptions.RateLimitExceededException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Enforces {@link RateLimited} with fixed windows kept in a Caffeine cache.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitAspect {

    static final String USER_HEADER = "X-User-Id";

    private final Cache<String, RateLimitBucket> rateLimitCache;

    @Around("@annotation(rateLimited)")
    public Object rateLimit(ProceedingJoinPoint joinPoint, RateLimited rateLimited) throws Throwable {
        ServletRequestAttributes attributes = (ServletRequestAttributes) RequestContextHolder.getRequestAttributes();

        if (attributes == null) {
            log.warn("No request attributes found for rate limiting");
            return joinPoint.proceed();
        }

        HttpServletRequest request = attributes.getRequest();
        String caller = callerOf(request);
        String bucketName = rateLimited.key().isEmpty() ? request.getRequestURI() : rateLimited.key();
        String rateLimitKey = String.format("rate_limit:%s:%s", caller, bucketName);

        RateLimitBucket bucket = rateLimitCache.get(rateLimitKey,
                k -> new RateLimitBucket(rateLimited.maxRequests(), rateLimited.windowSeconds()));

        if (!bucket.tryConsume()) {
            log.warn("Rate limit exceeded for {} on {} ({} requests/{} sec)",
                    caller, bucketName, rateLimited.maxRequests(), rateLimited.windowSeconds());
            throw new RateLimitExceededException(rateLimited.message(), bucket.getRetryAfterSeconds());
        }

        return joinPoint.proceed();
    }

    private String callerOf(HttpServletRequest request) {
        String userId = request.getHeader(USER_HEADER);
        if (userId != null && !userId.isBlank()) {
            return "user:" + userId.trim();
        }
        String ip = request.getHeader("X-Forwarded-For");
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getHeader("X-Real-IP");
        }
        if (ip == null || ip.isEmpty() || "unknown".equalsIgnoreCase(ip)) {
            ip = request.getRemoteAddr();
        }
        if (ip != null && ip.contains(",")) {
            ip = ip.split(",")[0].trim();
        }
        return "ip:" + (ip != null ? ip : "unknown");
    }

    /**
     * Fixed window counter.
     */
    public static class RateLimitBucket {
        private final int maxRequests;
        private final int windowSeconds;
        private final AtomicInteger requestCount = new AtomicInteger(0);
        private volatile Instant windowStart;

        public RateLimitBucket(int maxRequests, int windowSeconds) {
            this.maxRequests = maxRequests;
            this.windowSeconds = windowSeconds;
            this.windowStart = Instant.now();
        }

        public synchronized boolean tryConsume() {
            Instant now = Instant.now();
            if (now.isAfter(windowStart.plusSeconds(windowSeconds))) {
                windowStart = now;
                requestCount.set(0);
            }
            return requestCount.incrementAndGet() <= maxRequests;
        }

        public long getRetryAfterSeconds() {
            return Math.max(1, Duration.between(Instant.now(), windowStart.plusSeconds(windowSeconds)).getSeconds());
        }
    }
}
