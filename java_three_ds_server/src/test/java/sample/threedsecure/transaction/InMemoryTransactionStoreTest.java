package sample.threedsecure.transaction;

import org.json.JSONObject;
import org.junit.Test;
import sample.threedsecure.ecdh.EphemeralKeyGenerator;
import sample.threedsecure.ecdh.EphemeralKeyPair;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.Assert.*;

/**
 * Tests for the in-memory transaction store.
 */
public class InMemoryTransactionStoreTest {

    private static final Duration TTL = Duration.ofSeconds(1200);

    /** Clock that only moves when told to. */
    private static final class ManualClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T00:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }

    private final ManualClock clock = new ManualClock();
    private final InMemoryTransactionStore store = new InMemoryTransactionStore("3ds_transaction", clock);

    private static TransactionRecord record(String threeDSServerTransId, String acsTransId) {
        TransactionRecord record = new TransactionRecord();
        record.setThreeDSServerTransId(threeDSServerTransId);
        record.setAcsTransId(acsTransId);
        record.setDsTransId("ds-" + threeDSServerTransId);
        record.setRedirectUrl("https://merchant.example/return");
        return record;
    }

    @Test
    public void testPutAndGet() {
        store.put("t1", record("t1", "a1"), TTL);
        TransactionRecord loaded = store.get("t1").orElseThrow();
        assertEquals("a1", loaded.getAcsTransId());
        assertEquals("https://merchant.example/return", loaded.getRedirectUrl());
        assertNull(loaded.getSdkTransId());
    }

    @Test
    public void testRecordsAreCopies() {
        TransactionRecord original = record("t1", "a1");
        store.put("t1", original, TTL);
        original.setRedirectUrl("changed");
        assertEquals("https://merchant.example/return", store.get("t1").orElseThrow().getRedirectUrl());
    }

    @Test
    public void testEntriesExpire() {
        store.put("t1", record("t1", "a1"), TTL);
        clock.advance(TTL.minusSeconds(1));
        assertTrue(store.get("t1").isPresent());
        clock.advance(Duration.ofSeconds(1));
        assertFalse("Entry should be gone at its TTL", store.get("t1").isPresent());
        assertFalse(store.findByAcsTransId("a1").isPresent());
    }

    @Test
    public void testUpdateKeepsExpiry() throws Exception {
        store.put("t1", record("t1", "a1"), TTL);
        clock.advance(Duration.ofSeconds(600));

        TransactionRecord loaded = store.get("t1").orElseThrow();
        JSONObject results = new JSONObject().put("transStatus", "Y");
        loaded.setResultsRequest(results);
        store.update("t1", loaded);

        assertEquals("Y", store.get("t1").orElseThrow().getResultsRequest().getString("transStatus"));
        clock.advance(Duration.ofSeconds(600));
        assertFalse("Update must not extend the TTL", store.get("t1").isPresent());
    }

    @Test(expected = TransactionNotFoundException.class)
    public void testUpdateOfMissingTransactionFails() throws Exception {
        store.update("missing", record("missing", "a1"));
    }

    @Test(expected = TransactionNotFoundException.class)
    public void testUpdateOfExpiredTransactionFails() throws Exception {
        store.put("t1", record("t1", "a1"), TTL);
        clock.advance(TTL);
        store.update("t1", record("t1", "a1"));
    }

    @Test
    public void testPutSweepsTransactionsNeverReadAgain() {
        for (int i = 0; i < 500; i++) {
            store.put("old-" + i, record("old-" + i, "a-old-" + i), Duration.ofSeconds(1));
        }
        clock.advance(Duration.ofHours(1));
        for (int i = 0; i < 500; i++) {
            store.put("new-" + i, record("new-" + i, "a-new-" + i), TTL);
            assertTrue(store.get("new-" + i).isPresent());
        }
        assertEquals("Expired transactions should be reclaimed", 500, store.size());
    }

    @Test
    public void testFindByAcsTransId() {
        store.put("t1", record("t1", "a1"), TTL);
        store.put("t2", record("t2", "a2"), TTL);
        assertEquals("t2", store.findByAcsTransId("a2").orElseThrow().getThreeDSServerTransId());
        assertFalse(store.findByAcsTransId("a3").isPresent());
    }

    @Test
    public void testEphemeralKeysSurviveStorage() {
        EphemeralKeyPair keys = new EphemeralKeyGenerator().generate();
        TransactionRecord record = record("t1", "a1");
        record.setEphemeralKeys(keys);
        record.setSdkEphemeralPublicKey(new EphemeralKeyGenerator().generate().toPublicJwk());
        store.put("t1", record, TTL);

        TransactionRecord loaded = store.get("t1").orElseThrow();
        assertEquals(keys.toPublicJwk().toString(), loaded.getEphemeralKeys().toPublicJwk().toString());
        assertEquals("EC", loaded.getSdkEphemeralPublicKey().getString("kty"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroTtlRejected() {
        store.put("t1", record("t1", "a1"), Duration.ZERO);
    }

    @Test
    public void testExpiredEntriesAreEvictedOnRead() {
        store.put("t1", record("t1", "a1"), TTL);
        clock.advance(TTL);
        store.get("t1");
        assertEquals(0, store.size());
    }
}
