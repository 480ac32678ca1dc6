package com.flowo.live.core.session;

import java.util.Collection;
import java.util.List;

/**
 * None of the requested channels is authorized for the caller.
 */
public class ForbiddenChannelException extends RuntimeException {

    private final List<String> requested;

    public ForbiddenChannelException(Collection<String> requested) {
        super("None of the requested channels is authorized: " + requested);
        this.requested = List.copyOf(requested);
    }

    public List<String> getRequested() {
        return requested;
    }
}
