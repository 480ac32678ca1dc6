package com.flowo.live.core.upstream;

/**
 * A LISTEN (or subscribe) for one channel was rejected or failed on an otherwise usable connection.
 */
public class ChannelRegistrationException extends RuntimeException {

    private final String channel;

    public ChannelRegistrationException(String channel, Throwable cause) {
        super("Registration failed for channel '" + channel + "': " + cause.getMessage(), cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
