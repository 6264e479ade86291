// terminal-relay-service/src/main/java/com/example/terminal_relay_service/config/WebSocketConfig.java
package com.example.terminal_relay_service.config;

import com.example.terminal_relay_service.handler.CollaborationHandler;
import com.example.terminal_relay_service.handler.TerminalHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.HandshakeInterceptor;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

@Configuration
@EnableWebSocket
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    private final TerminalHandler terminalHandler;
    private final CollaborationHandler collaborationHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(TerminalHandler terminalHandler,
                           CollaborationHandler collaborationHandler,
                           @Value("${relay.websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.terminalHandler = terminalHandler;
        this.collaborationHandler = collaborationHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // Terminal stream: ?sessionId=..&terminalKind=..
        registry.addHandler(terminalHandler, "/ws/terminal")
                .addInterceptors(new QueryParameterInterceptor(
                        List.of(TerminalHandler.ATTR_SESSION_ID, TerminalHandler.ATTR_TERMINAL_KIND)))
                .setAllowedOrigins(allowedOrigins);

        // Collaboration: ?sessionId=..&userId=..
        registry.addHandler(collaborationHandler, "/ws/collab")
                .addInterceptors(new QueryParameterInterceptor(
                        List.of(CollaborationHandler.ATTR_SESSION_ID, CollaborationHandler.ATTR_USER_ID)))
                .setAllowedOrigins(allowedOrigins);
    }

    /**
     * Copies the named query parameters into the session attributes. Missing parameters
     * are left for the handler to reject with a protocol error frame, so the upgrade
     * itself always proceeds.
     */
    static class QueryParameterInterceptor implements HandshakeInterceptor {

        private final List<String> names;

        QueryParameterInterceptor(List<String> names) {
            this.names = names;
        }

        @Override
        public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                       WebSocketHandler wsHandler, Map<String, Object> attributes) {
            MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
            for (String name : names) {
                String raw = params.getFirst(name);
                if (raw != null) {
                    attributes.put(name, URLDecoder.decode(raw, StandardCharsets.UTF_8));
                }
            }
            log.debug("Handshake {} with attributes {}", request.getURI().getPath(), attributes);
            return true;
        }

        @Override
        public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Exception exception) {
            if (exception != null) {
                log.error("❌ WebSocket handshake failed for {}", request.getURI().getPath(), exception);
            }
        }
    }
}
