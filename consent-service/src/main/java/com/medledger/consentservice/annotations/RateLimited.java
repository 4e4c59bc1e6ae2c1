package com.medledger.consentservice.annotations;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Limits how often one caller may hit an endpoint. Callers are identified by the gateway's
 * {@code X-User-Id} header, falling back to the client IP.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface RateLimited {

    /**
     * Maximum number of requests allowed within the time window
     */
    int maxRequests() default 30;

    /**
     * Time window in seconds, at most 60 (the bucket cache TTL)
     */
    int windowSeconds() default 60;

    /**
     * Bucket name shared by endpoints that should count together; defaults to the request URI
     */
    String key() default "";

    String message() default "Too many requests. Please try again later.";
}
