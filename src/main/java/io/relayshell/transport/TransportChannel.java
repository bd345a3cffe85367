package io.relayshell.transport;

import io.relayshell.config.ServerProfile;

/**
 * Establishes a byte stream to a profile's target, directly or through its relay hops.
 */
public interface TransportChannel {

    /**
     * @throws io.relayshell.error.ConnectFailureException naming the failing stage; a relay
     *         failure names the exact hop
     */
    Connection connect(ServerProfile profile);
}
