/**
 * TerminalWebSocketHandler.java
 *
 * 终端的双向 WebSocket 处理器。
 * 客户端连接时附加到已有的持久会话（persistent=true&session_id=...），或新建一个会话；
 * 随后发送一条 session_info 文本消息、一次历史输出回放，然后持续以二进制帧推送实时输出。
 * 客户端发来的文本帧和二进制帧都被视为原始键盘输入写入 shell。
 * 非持久模式下，连接断开时会话随之关闭；持久模式下会话继续运行，可以稍后重新连接。
 */
package club.ppmc.remote.websocket;

import club.ppmc.remote.exception.NotFoundException;
import club.ppmc.remote.exception.RemoteException;
import club.ppmc.remote.exception.SessionClosedException;
import club.ppmc.remote.model.RemoteUser;
import club.ppmc.remote.model.TerminalSettings;
import club.ppmc.remote.service.TerminalSession;
import club.ppmc.remote.service.TerminalSession.TerminalSubscription;
import club.ppmc.remote.service.TerminalSessionManager;
import club.ppmc.remote.util.OutputChannel;
import com.google.gson.Gson;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.util.UriComponentsBuilder;

@Component
@Slf4j
public class TerminalWebSocketHandler extends AbstractWebSocketHandler {

    private static final int SEND_TIME_LIMIT_MILLIS = 10_000;
    private static final int SEND_BUFFER_LIMIT_BYTES = 1024 * 1024;

    private final TerminalSessionManager sessionManager;
    private final TerminalSettings settings;
    private final Gson gson;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final ExecutorService executorService = Executors.newCachedThreadPool();

    public TerminalWebSocketHandler(TerminalSessionManager sessionManager, TerminalSettings settings, Gson gson) {
        this.sessionManager = sessionManager;
        this.settings = settings;
        this.gson = gson;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession webSocketSession) throws Exception {
        if (!settings.isEnabled()) {
            webSocketSession.close(CloseStatus.POLICY_VIOLATION.withReason("terminal is disabled"));
            return;
        }
        if (!(webSocketSession.getPrincipal() instanceof RemoteUser user)) {
            webSocketSession.close(CloseStatus.POLICY_VIOLATION.withReason("unauthorized"));
            return;
        }

        var query = queryParams(webSocketSession.getUri());
        boolean persistent = "true".equals(query.get("persistent"));
        String requestedSessionId = query.get("session_id");
        var out = new ConcurrentWebSocketSessionDecorator(
                webSocketSession, SEND_TIME_LIMIT_MILLIS, SEND_BUFFER_LIMIT_BYTES);
        log.info("用户 {} 已连接终端 (persistent: {}, session: {})", user.username(), persistent, requestedSessionId);

        TerminalSession session;
        if (persistent && StringUtils.hasText(requestedSessionId)) {
            session = sessionManager.getSession(requestedSessionId)
                    .filter(candidate -> candidate.getUserId() == user.id())
                    .orElse(null);
            if (session == null) {
                sendError(out, "Session not found or access denied");
                out.close(CloseStatus.POLICY_VIOLATION);
                return;
            }
        } else {
            try {
                session = sessionManager.createSession(user.id(), user.username());
            } catch (RemoteException e) {
                sendError(out, "Failed to create session: " + e.getMessage());
                out.close(CloseStatus.SERVER_ERROR);
                return;
            }
        }

        var info = new LinkedHashMap<String, Object>();
        info.put("type", "session_info");
        info.put("session", session.info());
        out.sendMessage(new TextMessage(gson.toJson(info)));

        String clientId = "client-" + user.id() + "-" + webSocketSession.getId();
        TerminalSubscription subscription = session.subscribe(clientId);
        var connection = new Connection(session, clientId, !persistent, out);
        connections.put(webSocketSession.getId(), connection);
        if (subscription.history().length > 0) {
            out.sendMessage(new BinaryMessage(subscription.history()));
        }
        executorService.execute(() -> forward(connection, subscription.channel()));
    }

    private void forward(Connection connection, OutputChannel channel) {
        try {
            byte[] chunk;
            while ((chunk = channel.take()) != null) {
                connection.out().sendMessage(new BinaryMessage(chunk));
            }
            // 通道结束：会话已关闭或客户端已退订
            if (connection.out().isOpen()) {
                connection.out().close(CloseStatus.NORMAL.withReason("session closed"));
            }
        } catch (IOException e) {
            log.debug("向终端客户端 {} 发送数据失败: {}", connection.clientId(), e.getMessage());
            connection.session().unsubscribe(connection.clientId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession webSocketSession, TextMessage message) throws Exception {
        writeInput(webSocketSession, message.getPayload().getBytes(StandardCharsets.UTF_8));
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession webSocketSession, BinaryMessage message) throws Exception {
        ByteBuffer payload = message.getPayload();
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        writeInput(webSocketSession, bytes);
    }

    private void writeInput(WebSocketSession webSocketSession, byte[] input) throws IOException {
        Connection connection = connections.get(webSocketSession.getId());
        if (connection == null) {
            return;
        }
        try {
            connection.session().write(input);
        } catch (SessionClosedException e) {
            webSocketSession.close(CloseStatus.NORMAL.withReason("session closed"));
        } catch (IOException e) {
            log.warn("向终端会话 {} 写入失败: {}", connection.session().getId(), e.getMessage());
            webSocketSession.close(CloseStatus.SERVER_ERROR);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession webSocketSession, Throwable exception) {
        log.debug("终端 WebSocket {} 传输错误: {}", webSocketSession.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession webSocketSession, CloseStatus status) {
        Connection connection = connections.remove(webSocketSession.getId());
        if (connection == null) {
            return;
        }
        TerminalSession session = connection.session();
        session.unsubscribe(connection.clientId());
        if (connection.ephemeral()) {
            try {
                sessionManager.closeSession(session.getId());
            } catch (NotFoundException e) {
                log.debug("临时终端会话 {} 已被移除。", session.getId());
            }
        }
        log.info("用户 {} 已断开终端会话 {} (会话仍活动: {})",
                session.getUsername(), session.getId(), !session.isClosed());
    }

    private void sendError(WebSocketSession out, String message) throws IOException {
        out.sendMessage(new TextMessage("\r\n\u001b[1;31m" + message + "\u001b[0m\r\n"));
    }

    private static Map<String, String> queryParams(URI uri) {
        var result = new LinkedHashMap<String, String>();
        if (uri != null) {
            UriComponentsBuilder.fromUri(uri).build().getQueryParams()
                    .forEach((key, values) -> result.put(key, values.isEmpty() ? null : values.get(0)));
        }
        return result;
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    private record Connection(
            TerminalSession session, String clientId, boolean ephemeral, WebSocketSession out) {}
}
