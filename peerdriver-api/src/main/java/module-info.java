/**
 * Peer driver API module.
 *
 * <p>Provides the driver, message and error types for exchanging messages
 * with named peers over unicast and broadcast channels.</p>
 */
module peerdriver.api
{
    requires transitive org.slf4j;

    exports org.abstractica.peerdriver;
}
