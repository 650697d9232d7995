package adm.java.http;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ClientIdentitiesTest {

    @Test
    void testForwardedFor_firstHopWins() {
        assertEquals("203.0.113.7", ClientIdentities.resolve("203.0.113.7, 10.0.0.2, 10.0.0.3", "10.0.0.3:443"));
    }

    @Test
    void testForwardedFor_skipsBlankHops() {
        assertEquals("198.51.100.9", ClientIdentities.resolve(" , 198.51.100.9", "10.0.0.3:443"));
    }

    @Test
    void testBlankForwardedFor_fallsBackToPeer() {
        assertEquals("10.0.0.3", ClientIdentities.resolve("  ", "10.0.0.3:51234"));
        assertEquals("10.0.0.3", ClientIdentities.resolve(null, "/10.0.0.3:51234"));
    }

    @Test
    void testNothingKnown_returnsUnknown() {
        assertEquals(ClientIdentities.UNKNOWN, ClientIdentities.resolve(null, null));
        assertEquals(ClientIdentities.UNKNOWN, ClientIdentities.resolve("", " "));
    }

    @Test
    void testStripPort_handlesAddressForms() {
        assertEquals("192.0.2.1", ClientIdentities.stripPort("192.0.2.1:8080"));
        assertEquals("192.0.2.1", ClientIdentities.stripPort("192.0.2.1"));
        assertEquals("2001:db8::1", ClientIdentities.stripPort("[2001:db8::1]:8080"));
        assertEquals("2001:db8::1", ClientIdentities.stripPort("/[2001:db8::1]:8080"));
        assertEquals("2001:db8::1", ClientIdentities.stripPort("2001:db8::1"));
        assertEquals("::1", ClientIdentities.stripPort("::1"));
    }
}
