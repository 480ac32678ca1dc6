package com.flowo.live.config;

import com.flowo.live.core.session.LiveUpdateHub;
import com.flowo.live.core.upstream.UpstreamLink;

import org.springframework.beans.factory.DisposableBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Starts the upstream link when the application is ready and shuts the hub down with the context.
 *
 * <ul>
 *   <li>Nothing connects during context refresh, so an unreachable database never blocks startup.</li>
 *   <li>On shutdown sessions are detached first, then the upstream connection is closed.</li>
 * </ul>
 */
@Component
public class LiveHubLifecycle implements DisposableBean {

    private final UpstreamLink link;
    private final LiveUpdateHub hub;

    public LiveHubLifecycle(UpstreamLink link, LiveUpdateHub hub) {
        this.link = link;
        this.hub = hub;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onAppReady() {
        link.start();
    }

    @Override
    public void destroy() {
        try {
            hub.close();
        } finally {
            link.close();
        }
    }
}
