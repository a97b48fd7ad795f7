package org.abstractica.peerdriver;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ChannelKind}.
 */
class ChannelKindTest
{
    @Test
    void fromWireName_knownNames()
    {
        assertEquals(ChannelKind.UNICAST_INBOUND, ChannelKind.fromWireName("unicast"));
        assertEquals(ChannelKind.BROADCAST_INBOUND, ChannelKind.fromWireName("broadcast"));
    }

    @Test
    void fromWireName_unknownName_throwsSocketTypeException()
    {
        SocketTypeException e = assertThrows(SocketTypeException.class,
                () -> ChannelKind.fromWireName("multicast"));
        assertTrue(e.getMessage().contains("multicast"));
    }

    @Test
    void fromWireName_isCaseSensitive()
    {
        assertThrows(SocketTypeException.class, () -> ChannelKind.fromWireName("UNICAST"));
    }

    @Test
    void fromWireName_null_throwsSocketTypeException()
    {
        assertThrows(SocketTypeException.class, () -> ChannelKind.fromWireName(null));
    }
}
