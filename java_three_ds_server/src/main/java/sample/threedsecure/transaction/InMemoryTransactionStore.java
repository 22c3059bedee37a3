package sample.threedsecure.transaction;

import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Process-local {@link TransactionStore}. Entries are held serialized under
 * "{prefix}:{transactionId}". Expired entries are dropped when read and
 * swept on every put.
 */
public class InMemoryTransactionStore implements TransactionStore {

    private static final class Entry {
        final String serialized;
        final Instant expiresAt;

        Entry(String serialized, Instant expiresAt) {
            this.serialized = serialized;
            this.expiresAt = expiresAt;
        }
    }

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final String keyPrefix;
    private final Clock clock;

    public InMemoryTransactionStore(String keyPrefix) {
        this(keyPrefix, Clock.systemUTC());
    }

    public InMemoryTransactionStore(String keyPrefix, Clock clock) {
        this.keyPrefix = keyPrefix;
        this.clock = clock;
    }

    @Override
    public void put(String transactionId, TransactionRecord record, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("TTL must be positive");
        }
        Instant now = clock.instant();
        purgeExpired(now);
        entries.put(key(transactionId), new Entry(record.toJson(), now.plus(ttl)));
        Logger.getGlobal().log(Level.FINE, "InMemoryTransactionStore:put stored {0}", transactionId);
    }

    @Override
    public Optional<TransactionRecord> get(String transactionId) {
        Entry entry = liveEntry(key(transactionId));
        return entry == null ? Optional.empty() : Optional.of(restore(entry));
    }

    @Override
    public void update(String transactionId, TransactionRecord record) throws TransactionNotFoundException {
        String key = key(transactionId);
        Entry updated = entries.computeIfPresent(key, (k, existing) ->
            existing.expiresAt.isAfter(clock.instant()) ? new Entry(record.toJson(), existing.expiresAt) : null);
        if (updated == null) {
            throw new TransactionNotFoundException(transactionId);
        }
    }

    @Override
    public Optional<TransactionRecord> findByAcsTransId(String acsTransId) {
        for (String key : entries.keySet()) {
            Entry entry = liveEntry(key);
            if (entry == null) {
                continue;
            }
            TransactionRecord record = restore(entry);
            if (acsTransId.equals(record.getAcsTransId())) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    int size() {
        return entries.size();
    }

    /**
     * Drops every expired entry. Runs on each put so transactions that are
     * never read again do not accumulate.
     */
    private void purgeExpired(Instant now) {
        entries.values().removeIf(entry -> !entry.expiresAt.isAfter(now));
    }

    private String key(String transactionId) {
        return keyPrefix + ":" + transactionId;
    }

    private Entry liveEntry(String key) {
        Entry entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (!entry.expiresAt.isAfter(clock.instant())) {
            entries.remove(key, entry);
            return null;
        }
        return entry;
    }

    private TransactionRecord restore(Entry entry) {
        try {
            return TransactionRecord.fromJson(entry.serialized);
        } catch (GeneralSecurityException e) {
            // only our own serialized form is stored
            throw new IllegalStateException("Stored transaction could not be restored", e);
        }
    }
}
