package com.evently.booking.admission;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Per-client fixed one-minute window. Lock, confirm and cancel calls get a tighter limit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RateLimitService {

    static final Duration WINDOW = Duration.ofSeconds(60);

    private final StringRedisTemplate redisTemplate;
    private final AdmissionProperties properties;

    static String rateLimitKey(String clientId) {
        return "rate_limit:" + clientId;
    }

    /**
     * Count the request and report whether it is within the client's limit
     */
    public boolean tryConsume(String clientId, boolean bookingOperation) {
        String key = rateLimitKey(clientId);
        try {
            Long current = redisTemplate.opsForValue().increment(key);
            if (current == null) {
                return true;
            }
            if (current == 1L) {
                redisTemplate.expire(key, WINDOW);
            }

            AdmissionProperties.RateLimit limits = properties.getRateLimit();
            int maxRequests = bookingOperation ? limits.getBookingRequestsPerMinute() : limits.getRequestsPerMinute();

            boolean allowed = current <= maxRequests;
            if (!allowed) {
                log.debug("Rate limit exceeded: client={} count={} limit={}", clientId, current, maxRequests);
            }
            return allowed;

        } catch (Exception e) {
            log.error("Rate limit check failed for client {}, letting request through", clientId, e);
            return true;
        }
    }
}
