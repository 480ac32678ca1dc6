package com.flowo.live.web;

import com.flowo.live.core.channel.LiveChannels;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Authorizes every well-formed channel of a known family, nothing else.
 */
public class DefaultChannelAuthorizer implements ChannelAuthorizer {

    @Override
    public Set<String> authorize(Collection<String> requested) {
        Set<String> out = new LinkedHashSet<>();
        for (String channel : requested) {
            if (LiveChannels.isKnownFamily(channel)) {
                out.add(channel);
            }
        }
        return out;
    }
}
