/**
 * WebSocketConfig.java
 *
 * 配置终端的原生 WebSocket 端点。
 * 终端输出是原始字节流，直接以二进制帧传输，不经过 STOMP 消息代理。
 * 握手时根据上游认证层传入的用户信息为每个连接确定 Principal，TerminalWebSocketHandler 据此校验会话归属。
 */
package club.ppmc.remote.config;

import club.ppmc.remote.model.RemoteUser;
import club.ppmc.remote.websocket.TerminalWebSocketHandler;
import java.security.Principal;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.support.DefaultHandshakeHandler;
import org.springframework.web.util.UriComponentsBuilder;

@Configuration
@EnableWebSocket
@Slf4j
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USERNAME_HEADER = "X-Username";

    private final TerminalWebSocketHandler terminalWebSocketHandler;
    private final String[] allowedOrigins;

    public WebSocketConfig(
            TerminalWebSocketHandler terminalWebSocketHandler,
            @Value("${remote.allowed-origins:*}") String[] allowedOrigins) {
        this.terminalWebSocketHandler = terminalWebSocketHandler;
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(terminalWebSocketHandler, "/api/terminal/ws")
                .setAllowedOriginPatterns(allowedOrigins)
                .setHandshakeHandler(new DefaultHandshakeHandler() {
                    @Override
                    protected Principal determineUser(
                            ServerHttpRequest request, WebSocketHandler wsHandler, Map<String, Object> attributes) {
                        return resolveUser(request);
                    }
                });
    }

    /**
     * 从请求头（或查询参数 user_id / username）中解析用户。无法解析时返回 null。
     */
    static RemoteUser resolveUser(ServerHttpRequest request) {
        var query = UriComponentsBuilder.fromUri(request.getURI()).build().getQueryParams();
        String userId = request.getHeaders().getFirst(USER_ID_HEADER);
        if (!StringUtils.hasText(userId)) {
            userId = query.getFirst("user_id");
        }
        String username = request.getHeaders().getFirst(USERNAME_HEADER);
        if (!StringUtils.hasText(username)) {
            username = query.getFirst("username");
        }
        if (!StringUtils.hasText(userId)) {
            return null;
        }
        try {
            long id = Long.parseLong(userId.trim());
            return new RemoteUser(id, StringUtils.hasText(username) ? username : "user-" + id);
        } catch (NumberFormatException e) {
            log.warn("握手请求中的用户ID无效: {}", userId);
            return null;
        }
    }
}
