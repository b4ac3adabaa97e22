package com.panelkit.gateway;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelkit.common.config.ConfigService;
import com.panelkit.gateway.ratelimit.TokenBucketRateLimiter;
import com.panelkit.gateway.websocket.MirrorMethodRouter;
import com.panelkit.gateway.websocket.PanelMirrorMethods;
import com.panelkit.gateway.websocket.WebSocketLiveUpdateChannel;
import com.panelkit.panel.broadcast.PanelBroadcaster;
import com.panelkit.panel.web.PanelWebAdapter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the panel mirror gateway beans.
 */
@Configuration
public class GatewayBeanConfig {

    @Bean
    public MirrorMethodRouter mirrorMethodRouter(PanelWebAdapter webAdapter) {
        MirrorMethodRouter router = new MirrorMethodRouter();
        new PanelMirrorMethods(webAdapter).registerAll(router);
        return router;
    }

    @Bean
    public WebSocketLiveUpdateChannel webSocketLiveUpdateChannel(ObjectMapper objectMapper,
            PanelBroadcaster broadcaster) {
        WebSocketLiveUpdateChannel channel = new WebSocketLiveUpdateChannel(objectMapper);
        broadcaster.addChannel(channel);
        return channel;
    }

    @Bean
    public TokenBucketRateLimiter mirrorRateLimiter(ConfigService configService) {
        return new TokenBucketRateLimiter(configService.loadConfig().getWebMirror().getRateLimit());
    }
}
