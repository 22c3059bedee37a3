package sample.threedsecure;

import org.junit.Test;

import java.time.Duration;

import static org.junit.Assert.*;

public class ServerSettingsTest {

    private static ServerSettings settings(String host, int port, long ttl, String prefix, String redirect) {
        return new ServerSettings(host, port, ttl, prefix, redirect, "certs/acs_cert.pem", "certs/acs_private_key.pem");
    }

    @Test
    public void testDefaultsAreValid() {
        ServerSettings settings = settings("127.0.0.1", 8080, 1200, "3ds_transaction", "https://juspay.api.in.end").validate();
        assertEquals("http://127.0.0.1:8080", settings.getServerUrl());
        assertEquals(Duration.ofMinutes(20), settings.getTransactionTtl());
        assertEquals("acs_cert.pem", settings.getAcsCertificatePath().getFileName().toString());
    }

    @Test
    public void testInvalidSettingsRejected() {
        assertInvalid(settings(" ", 8080, 1200, "3ds_transaction", "https://a"), "host");
        assertInvalid(settings("127.0.0.1", 0, 1200, "3ds_transaction", "https://a"), "port");
        assertInvalid(settings("127.0.0.1", 8080, 0, "3ds_transaction", "https://a"), "TTL");
        assertInvalid(settings("127.0.0.1", 8080, 1200, "", "https://a"), "prefix");
        assertInvalid(settings("127.0.0.1", 8080, 1200, "3ds_transaction", null), "redirect");
    }

    private static void assertInvalid(ServerSettings settings, String expectedWord) {
        try {
            settings.validate();
            fail("Expected validation failure mentioning " + expectedWord);
        } catch (IllegalStateException e) {
            assertTrue(e.getMessage(), e.getMessage().contains(expectedWord));
        }
    }
}
