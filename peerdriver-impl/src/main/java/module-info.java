/**
 * Peer driver implementation module.
 *
 * <p>Provides the default driver over TCP and Unix domain socket transports.</p>
 */
module peerdriver.impl
{
    requires peerdriver.api;
    requires org.slf4j;

    // Export the factory for external use
    exports org.abstractica.peerdriver.impl.driver;

    // Export transports and the default codec for custom configurations
    exports org.abstractica.peerdriver.impl.transport;
    exports org.abstractica.peerdriver.impl.serialization;
}
