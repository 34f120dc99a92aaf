package org.janelia.coreprep.channels;

public class ChannelDiscoveryException extends RuntimeException {

    public ChannelDiscoveryException(String message) {
        super(message);
    }
}
