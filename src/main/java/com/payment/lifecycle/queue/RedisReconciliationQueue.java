package com.payment.lifecycle.queue;

import com.payment.lifecycle.config.ReconciliationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Redis-backed queue. Membership and ordering live in a sorted set (member = reference,
 * score = next check in epoch millis); attempts live in a JSON value per entry. Member and
 * value are written and deleted together by Lua scripts. The sorted set is authoritative:
 * a value without a member is ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RedisReconciliationQueue implements ReconciliationQueue {

    static final String PENDING_KEY = "payment:reconciliation:pending";
    static final String ENTRY_KEY_PREFIX = "payment:reconciliation:entry:";

    /**
     * Returns up to ARGV[3] members due at ARGV[1], oldest first and newline separated, and
     * moves each to score ARGV[2] (the lease deadline) in the same atomic step.
     */
    static final String CLAIM_SCRIPT =
            "local due = redis.call('ZRANGEBYSCORE', KEYS[1], '-inf', ARGV[1], 'LIMIT', 0, tonumber(ARGV[3])) " +
            "for _, member in ipairs(due) do " +
            "  redis.call('ZADD', KEYS[1], 'XX', ARGV[2], member) " +
            "end " +
            "return table.concat(due, '\\n')";

    /** Adds member ARGV[1] with score ARGV[2] and value ARGV[3] unless it is already queued. */
    static final String ENQUEUE_SCRIPT =
            "if redis.call('ZADD', KEYS[1], 'NX', ARGV[2], ARGV[1]) == 1 then " +
            "  redis.call('SET', KEYS[2], ARGV[3]) " +
            "  return 1 " +
            "end " +
            "return 0";

    /** Sets score ARGV[2] and value ARGV[3] for ARGV[1] only if it is still a member. */
    static final String UPDATE_IF_PRESENT_SCRIPT =
            "if redis.call('ZSCORE', KEYS[1], ARGV[1]) then " +
            "  redis.call('ZADD', KEYS[1], 'XX', ARGV[2], ARGV[1]) " +
            "  redis.call('SET', KEYS[2], ARGV[3]) " +
            "  return 1 " +
            "end " +
            "return 0";

    static final String REMOVE_SCRIPT =
            "local removed = redis.call('ZREM', KEYS[1], ARGV[1]) " +
            "redis.call('DEL', KEYS[2]) " +
            "return removed";

    private static final DefaultRedisScript<String> CLAIM = new DefaultRedisScript<>(CLAIM_SCRIPT, String.class);
    private static final DefaultRedisScript<Long> ENQUEUE = new DefaultRedisScript<>(ENQUEUE_SCRIPT, Long.class);
    private static final DefaultRedisScript<Long> UPDATE_IF_PRESENT =
            new DefaultRedisScript<>(UPDATE_IF_PRESENT_SCRIPT, Long.class);
    private static final DefaultRedisScript<Long> REMOVE = new DefaultRedisScript<>(REMOVE_SCRIPT, Long.class);

    private static final QueueEntryRedisSerializer ENTRY_SERIALIZER = new QueueEntryRedisSerializer();

    private final StringRedisTemplate stringRedisTemplate;
    private final RedisTemplate<String, QueueEntry> queueEntryRedisTemplate;
    private final ReconciliationProperties properties;

    @Override
    public boolean enqueue(String externalReference, Instant firstCheckTime) {
        QueueEntry entry = QueueEntry.builder()
                .externalReference(externalReference)
                .nextCheckTime(firstCheckTime)
                .attempts(0)
                .maxAttempts(properties.getMaxAttempts())
                .build();
        Long added = stringRedisTemplate.execute(ENQUEUE, keys(externalReference),
                externalReference, String.valueOf(firstCheckTime.toEpochMilli()), toJson(entry));
        if (added == null || added != 1L) {
            log.debug("Already queued for reconciliation: reference={}", externalReference);
            return false;
        }
        log.info("Queued for reconciliation: reference={}, firstCheck={}", externalReference, firstCheckTime);
        return true;
    }

    @Override
    public List<QueueEntry> dueEntries(Instant now, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        long leaseUntil = now.plus(properties.getLease()).toEpochMilli();
        String claimedLines = stringRedisTemplate.execute(CLAIM, List.of(PENDING_KEY),
                String.valueOf(now.toEpochMilli()), String.valueOf(leaseUntil), String.valueOf(limit));
        if (!StringUtils.hasText(claimedLines)) {
            return Collections.emptyList();
        }
        List<String> claimed = Arrays.asList(claimedLines.split("\n"));

        List<QueueEntry> values = queueEntryRedisTemplate.opsForValue().multiGet(
                claimed.stream().map(RedisReconciliationQueue::entryKey).collect(Collectors.toList()));
        List<QueueEntry> entries = new ArrayList<>(claimed.size());
        for (int i = 0; i < claimed.size(); i++) {
            QueueEntry value = values != null ? values.get(i) : null;
            if (value == null) {
                log.warn("Queue entry value missing, restarting attempt count: reference={}", claimed.get(i));
                value = QueueEntry.builder()
                        .externalReference(claimed.get(i))
                        .nextCheckTime(now)
                        .attempts(0)
                        .maxAttempts(properties.getMaxAttempts())
                        .build();
            }
            entries.add(value);
        }
        log.debug("Claimed {} due reconciliation entries at {}", entries.size(), now);
        return entries;
    }

    @Override
    public void reschedule(String externalReference, int attempts, int unavailableStreak, Instant nextCheckTime) {
        QueueEntry current = queueEntryRedisTemplate.opsForValue().get(entryKey(externalReference));
        int maxAttempts = current != null ? current.getMaxAttempts() : properties.getMaxAttempts();
        QueueEntry updated = QueueEntry.builder()
                .externalReference(externalReference)
                .nextCheckTime(nextCheckTime)
                .attempts(attempts)
                .maxAttempts(maxAttempts)
                .unavailableStreak(unavailableStreak)
                .build();
        if (!updateIfPresent(updated)) {
            log.debug("Skip reschedule of removed entry: reference={}", externalReference);
        }
    }

    @Override
    public void expedite(String externalReference, Instant now) {
        QueueEntry current = queueEntryRedisTemplate.opsForValue().get(entryKey(externalReference));
        QueueEntry updated = current != null
                ? current.toBuilder().nextCheckTime(now).build()
                : QueueEntry.builder()
                    .externalReference(externalReference)
                    .nextCheckTime(now)
                    .attempts(0)
                    .maxAttempts(properties.getMaxAttempts())
                    .build();
        if (!updateIfPresent(updated)) {
            enqueue(externalReference, now);
            return;
        }
        log.info("Reconciliation expedited: reference={}", externalReference);
    }

    @Override
    public void remove(String externalReference) {
        Long removed = stringRedisTemplate.execute(REMOVE, keys(externalReference), externalReference);
        if (removed != null && removed > 0) {
            log.info("Removed from reconciliation queue: reference={}", externalReference);
        }
    }

    @Override
    public Optional<QueueEntry> find(String externalReference) {
        Double score = stringRedisTemplate.opsForZSet().score(PENDING_KEY, externalReference);
        if (score == null) {
            return Optional.empty();
        }
        QueueEntry value = queueEntryRedisTemplate.opsForValue().get(entryKey(externalReference));
        Instant nextCheck = Instant.ofEpochMilli(score.longValue());
        if (value == null) {
            return Optional.of(QueueEntry.builder()
                    .externalReference(externalReference)
                    .nextCheckTime(nextCheck)
                    .attempts(0)
                    .maxAttempts(properties.getMaxAttempts())
                    .build());
        }
        return Optional.of(value.toBuilder().nextCheckTime(nextCheck).build());
    }

    @Override
    public long size() {
        Long size = stringRedisTemplate.opsForZSet().zCard(PENDING_KEY);
        return size != null ? size : 0L;
    }

    private boolean updateIfPresent(QueueEntry entry) {
        String reference = entry.getExternalReference();
        Long result = stringRedisTemplate.execute(UPDATE_IF_PRESENT, keys(reference),
                reference, String.valueOf(entry.getNextCheckTime().toEpochMilli()), toJson(entry));
        return result != null && result == 1L;
    }

    private static List<String> keys(String externalReference) {
        return List.of(PENDING_KEY, entryKey(externalReference));
    }

    static String toJson(QueueEntry entry) {
        return new String(ENTRY_SERIALIZER.serialize(entry), StandardCharsets.UTF_8);
    }

    static String entryKey(String externalReference) {
        return ENTRY_KEY_PREFIX + externalReference;
    }
}
