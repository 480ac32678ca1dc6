package com.flowo.live.web;

import java.util.Collection;
import java.util.Set;

/**
 * Decides which of the requested channels the current caller may subscribe to.
 *
 * <p>Replace the default bean to plug in real authorization (tenant or user checks).</p>
 */
public interface ChannelAuthorizer {

    /**
     * @return the authorized subset of {@code requested}; empty when nothing is allowed
     */
    Set<String> authorize(Collection<String> requested);
}
