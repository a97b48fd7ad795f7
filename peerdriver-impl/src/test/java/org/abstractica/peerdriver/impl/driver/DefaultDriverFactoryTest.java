package org.abstractica.peerdriver.impl.driver;

import org.abstractica.peerdriver.ChannelKind;
import org.abstractica.peerdriver.Driver;
import org.abstractica.peerdriver.DriverFactory;
import org.abstractica.peerdriver.DriverStats;
import org.abstractica.peerdriver.Timeout;
import org.abstractica.peerdriver.impl.transport.IpcTransport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link DefaultDriverFactory}.
 */
class DefaultDriverFactoryTest
{
    private final DriverFactory factory = new DefaultDriverFactory();

    @Test
    void build_defaults_bindsBothEndpoints()
    {
        try (Driver driver = factory.builder().build())
        {
            Map<ChannelKind, String> address = driver.getAddress();

            assertEquals(2, address.size());
            assertTrue(address.get(ChannelKind.UNICAST_INBOUND).startsWith("tcp://"));
            assertTrue(address.get(ChannelKind.BROADCAST_INBOUND).startsWith("tcp://"));
            assertNotEquals(address.get(ChannelKind.UNICAST_INBOUND), address.get(ChannelKind.BROADCAST_INBOUND));
        }
    }

    @Test
    void build_usesAdvertisedHost()
    {
        try (Driver driver = factory.builder().advertisedHost("127.0.0.1").build())
        {
            assertTrue(driver.getAddress().get(ChannelKind.UNICAST_INBOUND).startsWith("tcp://127.0.0.1:"));
        }
    }

    @Test
    void build_freshDriver_hasZeroStats()
    {
        try (Driver driver = factory.builder().advertisedHost("127.0.0.1").build())
        {
            DriverStats stats = driver.getStats();

            assertEquals(0, stats.getMessagesSent());
            assertEquals(0, stats.getMessagesBroadcast());
            assertEquals(0, stats.getMessagesReceived());
            assertEquals(0, stats.getSendFailures());
            assertEquals(0, stats.getConnectedPeers());
            assertEquals(0, stats.getBroadcastSubscribers());
            assertTrue(driver.getPeers().isEmpty());
        }
    }

    @Test
    void address_isUnmodifiable()
    {
        try (Driver driver = factory.builder().advertisedHost("127.0.0.1").build())
        {
            assertThrows(UnsupportedOperationException.class,
                    () -> driver.getAddress().put(ChannelKind.UNICAST_INBOUND, "tcp://x:1"));
        }
    }

    @Test
    void protocol_unknown_throws()
    {
        assertThrows(IllegalArgumentException.class, () -> factory.builder().protocol("inproc"));
    }

    @Test
    void options_invalidValues_throw()
    {
        DriverFactory.Builder builder = factory.builder();

        assertThrows(IllegalArgumentException.class, () -> builder.maxMessageSize(0));
        assertThrows(IllegalArgumentException.class, () -> builder.advertisedHost(" "));
        assertThrows(NullPointerException.class, () -> builder.sendTimeout(null));
        assertThrows(NullPointerException.class, () -> builder.logger(null));
        assertThrows(NullPointerException.class, () -> builder.serializer(null));
    }

    @Test
    void customIpcTransport_createsAndRemovesSocketFiles(@TempDir Path socketDir)
    {
        Driver driver = ((DefaultDriverFactory.DefaultBuilder) factory.builder())
                .transport(new IpcTransport(socketDir))
                .sendTimeout(Timeout.ofMillis(500))
                .build();

        String unicast = driver.getAddress().get(ChannelKind.UNICAST_INBOUND);
        Path socketFile = Path.of(unicast.substring("ipc://".length()));
        assertTrue(socketFile.startsWith(socketDir.toAbsolutePath()));
        assertTrue(Files.exists(socketFile));

        driver.close();

        assertFalse(Files.exists(socketFile));
    }
}
