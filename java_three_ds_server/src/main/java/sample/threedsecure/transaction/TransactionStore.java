package sample.threedsecure.transaction;

import java.time.Duration;
import java.util.Optional;

/**
 * Keyed transaction state with expiry. Records are copied in and out, so
 * callers must {@link #update} after changing a record.
 */
public interface TransactionStore {

    void put(String transactionId, TransactionRecord record, Duration ttl);

    Optional<TransactionRecord> get(String transactionId);

    /**
     * Replace an existing record, keeping its remaining time to live.
     */
    void update(String transactionId, TransactionRecord record) throws TransactionNotFoundException;

    /**
     * Locate a transaction by the acsTransID it was issued. Linear in the
     * number of live transactions.
     */
    Optional<TransactionRecord> findByAcsTransId(String acsTransId);
}
