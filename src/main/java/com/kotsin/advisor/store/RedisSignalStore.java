package com.kotsin.advisor.store;

import com.kotsin.advisor.config.SignalProps;
import com.kotsin.advisor.model.AutoGenPreferences;
import com.kotsin.advisor.model.Signal;
import com.kotsin.advisor.model.SignalCategory;
import com.kotsin.advisor.service.ErrorMonitoringService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Redis-backed store.
 *
 * Keys:
 *   signals:active:{category}  JSON array of active signals
 *   signals:completed          list, one JSON signal per entry, appended with RPUSH in the same
 *                              MULTI that removes the signal from its active partition
 *   signals:autogen            JSON auto-generation preferences
 *
 * Partition writes use WATCH/MULTI/EXEC so writers in other processes cannot lose each other's updates.
 * A per-category lock keeps writers in this process from burning retries against each other.
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "signals.store", name = "type", havingValue = "redis", matchIfMissing = true)
public class RedisSignalStore extends AbstractSignalStore {

    static final String ACTIVE_PREFIX = "signals:active:";
    static final String COMPLETED_KEY = "signals:completed";
    static final String PREFS_KEY = "signals:autogen";

    private final RedisTemplate<String, String> advisorStringRedisTemplate;
    private final SignalRecordNormalizer normalizer;
    private final ErrorMonitoringService errorMonitoringService;
    private final int maxWriteAttempts;
    private final Map<SignalCategory, ReentrantLock> locks = new EnumMap<>(SignalCategory.class);
    private final ReentrantLock prefsLock = new ReentrantLock();

    public RedisSignalStore(RedisTemplate<String, String> advisorStringRedisTemplate,
                            SignalRecordNormalizer normalizer,
                            ErrorMonitoringService errorMonitoringService,
                            SignalProps props) {
        this.advisorStringRedisTemplate = advisorStringRedisTemplate;
        this.normalizer = normalizer;
        this.errorMonitoringService = errorMonitoringService;
        this.maxWriteAttempts = Math.max(1, props.store().maxWriteAttempts());
        for (SignalCategory c : SignalCategory.values()) {
            locks.put(c, new ReentrantLock());
        }
    }

    static String activeKey(SignalCategory category) {
        return ACTIVE_PREFIX + category.key();
    }

    @Override
    public List<Signal> getActive(SignalCategory category) {
        try {
            String raw = advisorStringRedisTemplate.opsForValue().get(activeKey(category));
            return normalizer.readArray(raw, category);
        } catch (DataAccessException e) {
            errorMonitoringService.recordError("store.read", "active read failed category=" + category, e);
            return new ArrayList<>();
        }
    }

    @Override
    public void replaceActive(SignalCategory category, List<Signal> signals) {
        List<Signal> copy = new ArrayList<>(signals);
        updateActive(category, current -> copy);
    }

    @Override
    protected List<Signal> updateActive(SignalCategory category,
                                        UnaryOperator<List<Signal>> mutation,
                                        Supplier<Signal> completedEntry) {
        String key = activeKey(category);
        ReentrantLock lock = locks.get(category);
        lock.lock();
        try {
            for (int attempt = 1; attempt <= maxWriteAttempts; attempt++) {
                AtomicReference<List<Signal>> written = new AtomicReference<>();
                List<Object> result = advisorStringRedisTemplate.execute(new SessionCallback<List<Object>>() {
                    @Override
                    @SuppressWarnings("unchecked")
                    public <K, V> List<Object> execute(RedisOperations<K, V> operations) throws DataAccessException {
                        RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
                        ops.watch(key);
                        List<Signal> current = normalizer.readArray(ops.opsForValue().get(key), category);
                        List<Signal> next = normalizer.dedupe(mutation.apply(current));
                        Signal archived = completedEntry.get();
                        written.set(next);
                        ops.multi();
                        ops.opsForValue().set(key, normalizer.writeArray(next));
                        if (archived != null) {
                            ops.opsForList().rightPush(COMPLETED_KEY, normalizer.write(archived));
                        }
                        return ops.exec();
                    }
                });
                if (result != null && !result.isEmpty()) {
                    return written.get();
                }
                log.debug("signal_partition_conflict category={} attempt={}", category, attempt);
            }
            throw new ConcurrentPartitionUpdateException(category, maxWriteAttempts);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Signal> getCompleted() {
        try {
            List<String> raw = advisorStringRedisTemplate.opsForList().range(COMPLETED_KEY, 0, -1);
            if (raw == null) {
                return new ArrayList<>();
            }
            List<Signal> out = new ArrayList<>(raw.size());
            for (String json : raw) {
                normalizer.readOne(json, null).ifPresent(s -> {
                    if (s.getArchivedCategory() == null) {
                        s.setArchivedCategory(s.getCategory());
                    }
                    out.add(s);
                });
            }
            return normalizer.dedupe(out);
        } catch (DataAccessException e) {
            errorMonitoringService.recordError("store.read", "completed read failed", e);
            return new ArrayList<>();
        }
    }

    @Override
    public AutoGenPreferences getPreferences() {
        try {
            String raw = advisorStringRedisTemplate.opsForValue().get(PREFS_KEY);
            if (raw == null || raw.isBlank()) {
                return new AutoGenPreferences();
            }
            return normalizer.mapper().readValue(raw, AutoGenPreferences.class);
        } catch (Exception e) {
            log.warn("autogen_prefs_unreadable err={}", e.getMessage());
            return new AutoGenPreferences();
        }
    }

    @Override
    public void setPreferences(AutoGenPreferences preferences) {
        prefsLock.lock();
        try {
            advisorStringRedisTemplate.opsForValue().set(PREFS_KEY, normalizer.write(preferences));
        } finally {
            prefsLock.unlock();
        }
    }

    @Override
    protected void updatePreferences(UnaryOperator<AutoGenPreferences> mutation) {
        prefsLock.lock();
        try {
            setPreferences(mutation.apply(getPreferences()));
        } finally {
            prefsLock.unlock();
        }
    }

    @Override
    public void clearAll() {
        List<String> keys = new ArrayList<>();
        for (SignalCategory c : SignalCategory.values()) {
            keys.add(activeKey(c));
        }
        keys.add(COMPLETED_KEY);
        keys.add(PREFS_KEY);
        advisorStringRedisTemplate.delete(keys);
        log.info("signal_store_cleared keys={}", keys);
    }
}
