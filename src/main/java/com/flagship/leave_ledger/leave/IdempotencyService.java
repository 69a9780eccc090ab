package com.flagship.leave_ledger.leave;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency keys of leave intake.
 *
 * Redis is the fast path and may be down. The unique idempotency_key column
 * of leave_requests is the source of truth, so a key is never lost even if
 * Redis never saw it.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "leave-idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final LeaveRequestPersistenceService persistenceService;
    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public IdempotencyService(LeaveRequestPersistenceService persistenceService,
                              Optional<RedisTemplate<String, String>> redisTemplate) {
        this.persistenceService = persistenceService;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the id of the leave request already created with this key
     */
    public Optional<UUID> findRequestId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> stored = persistenceService.findIdByIdempotencyKey(idempotencyKey);
        stored.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return stored;
    }

    /**
     * Caches the mapping in Redis. The database row was already written with the request.
     */
    public void remember(String idempotencyKey, UUID leaveRequestId) {
        requireKey(idempotencyKey);
        if (leaveRequestId == null) {
            throw new IllegalArgumentException("Leave request id cannot be null");
        }
        cache(idempotencyKey, leaveRequestId);
    }

    private void cache(String idempotencyKey, UUID leaveRequestId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue()
                .set(REDIS_KEY_PREFIX + idempotencyKey, leaveRequestId.toString(), REDIS_TTL);
        } catch (Exception e) {
            // Best effort: the database stays authoritative
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
