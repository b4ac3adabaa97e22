package com.panelkit.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.panelkit.common.config.ConfigService;
import com.panelkit.gateway.ratelimit.TokenBucketRateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Registers the panel mirror socket at {@value #PATH}.
 */
@Slf4j
@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String PATH = "/panels/ws";

    private final ObjectMapper objectMapper;
    private final MirrorMethodRouter methodRouter;
    private final WebSocketLiveUpdateChannel liveUpdates;
    private final TokenBucketRateLimiter rateLimiter;
    private final ConfigService configService;

    public WebSocketConfig(ObjectMapper objectMapper, MirrorMethodRouter methodRouter,
            WebSocketLiveUpdateChannel liveUpdates, TokenBucketRateLimiter rateLimiter,
            ConfigService configService) {
        this.objectMapper = objectMapper;
        this.methodRouter = methodRouter;
        this.liveUpdates = liveUpdates;
        this.rateLimiter = rateLimiter;
        this.configService = configService;
    }

    @Override
    public void registerWebSocketHandlers(@NonNull WebSocketHandlerRegistry registry) {
        if (!configService.loadConfig().getWebMirror().isEnabled()) {
            log.info("Web mirror disabled, not registering {}", PATH);
            return;
        }
        registry.addHandler(panelMirrorWebSocketHandler(), PATH)
                .addInterceptors(tokenInterceptor())
                .setAllowedOrigins("*");
    }

    @Bean
    public PanelMirrorWebSocketHandler panelMirrorWebSocketHandler() {
        return new PanelMirrorWebSocketHandler(objectMapper, methodRouter, liveUpdates, rateLimiter,
                () -> configService.loadConfig().getWebMirror().getAuthToken());
    }

    /**
     * Copies the {@code token} query parameter into the session attributes; the
     * handler decides whether to accept the connection.
     */
    @Bean
    public HandshakeInterceptor tokenInterceptor() {
        return new HandshakeInterceptor() {
            @Override
            public boolean beforeHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @NonNull Map<String, Object> attributes) {
                String token = queryParam(request.getURI(), "token");
                if (token != null) {
                    attributes.put(PanelMirrorWebSocketHandler.TOKEN_ATTRIBUTE, token);
                }
                return true;
            }

            @Override
            public void afterHandshake(@NonNull ServerHttpRequest request,
                    @NonNull ServerHttpResponse response,
                    @NonNull WebSocketHandler wsHandler,
                    @Nullable Exception exception) {
                // nothing to do
            }
        };
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(512 * 1024);
        container.setMaxBinaryMessageBufferSize(512 * 1024);
        container.setMaxSessionIdleTimeout(300_000L);
        return container;
    }

    static String queryParam(URI uri, String name) {
        String query = uri.getRawQuery();
        if (query == null) {
            return null;
        }
        for (String param : query.split("&")) {
            String[] kv = param.split("=", 2);
            if (kv.length == 2 && name.equals(kv[0])) {
                return URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        return null;
    }
}
