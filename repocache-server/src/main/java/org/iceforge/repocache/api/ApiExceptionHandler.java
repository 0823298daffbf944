package org.iceforge.repocache.api;

import org.iceforge.repocache.core.upstream.UpstreamException;
import org.iceforge.repocache.core.upstream.UpstreamRateLimitedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/** Maps cache and upstream failures to plain-text HTTP errors. */
@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = Objects.requireNonNull(clock);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<String> badRequest(IllegalArgumentException e) {
        return text(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(UnknownViewException.class)
    public ResponseEntity<String> unknownView(UnknownViewException e) {
        return text(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler(CacheUnavailableException.class)
    public ResponseEntity<String> cacheUnavailable(CacheUnavailableException e) {
        return text(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    @ExceptionHandler(UpstreamRateLimitedException.class)
    public ResponseEntity<String> rateLimited(UpstreamRateLimitedException e) {
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header("Retry-After", Long.toString(Math.max(0L, Duration.between(clock.instant(), e.resetAt()).toSeconds())))
                .contentType(MediaType.TEXT_PLAIN)
                .body(e.getMessage());
    }

    @ExceptionHandler(UpstreamException.class)
    public ResponseEntity<String> upstreamFailed(UpstreamException e) {
        log.warn("Forwarded request failed with status {}: {}", e.statusCode(), e.getMessage());
        return text(HttpStatus.BAD_GATEWAY, e.getMessage());
    }

    private static ResponseEntity<String> text(HttpStatus status, String message) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(message);
    }
}
