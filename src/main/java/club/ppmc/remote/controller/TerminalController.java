/**
 * TerminalController.java
 *
 * 管理持久化终端会话的REST接口：列出、创建、关闭会话以及调整终端尺寸。
 * 终端的输入输出本身通过 TerminalWebSocketHandler 传输。
 * 终端功能被禁用时，所有接口返回 403。
 */
package club.ppmc.remote.controller;

import club.ppmc.remote.config.WebSocketConfig;
import club.ppmc.remote.exception.NotFoundException;
import club.ppmc.remote.exception.QuotaExceededException;
import club.ppmc.remote.exception.SessionClosedException;
import club.ppmc.remote.exception.SpawnFailedException;
import club.ppmc.remote.model.TerminalResizeRequest;
import club.ppmc.remote.model.TerminalSessionInfo;
import club.ppmc.remote.model.TerminalSettings;
import club.ppmc.remote.service.TerminalSession;
import club.ppmc.remote.service.TerminalSessionManager;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/terminal/sessions")
@Slf4j
public class TerminalController {

    private static final ResponseEntity<Map<String, Object>> DISABLED =
            ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "terminal is disabled"));

    private final TerminalSessionManager sessionManager;
    private final TerminalSettings settings;

    public TerminalController(TerminalSessionManager sessionManager, TerminalSettings settings) {
        this.sessionManager = sessionManager;
        this.settings = settings;
    }

    /**
     * 列出当前用户的所有活动会话。
     */
    @GetMapping
    public ResponseEntity<Map<String, Object>> listSessions(@RequestHeader(WebSocketConfig.USER_ID_HEADER) long userId) {
        if (!settings.isEnabled()) {
            return DISABLED;
        }
        List<TerminalSessionInfo> infos = sessionManager.getUserSessions(userId).stream()
                .filter(session -> !session.isClosed())
                .map(TerminalSession::info)
                .toList();
        return ResponseEntity.ok(Map.of("sessions", infos));
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> createSession(
            @RequestHeader(WebSocketConfig.USER_ID_HEADER) long userId,
            @RequestHeader(value = WebSocketConfig.USERNAME_HEADER, defaultValue = "") String username) {
        if (!settings.isEnabled()) {
            return DISABLED;
        }
        try {
            TerminalSession session =
                    sessionManager.createSession(userId, username.isEmpty() ? "user-" + userId : username);
            return ResponseEntity.status(HttpStatus.CREATED).body(Map.of("session", session.info()));
        } catch (QuotaExceededException e) {
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(e.toErrorData());
        } catch (SpawnFailedException e) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(e.toErrorData());
        }
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Map<String, Object>> closeSession(
            @PathVariable String sessionId, @RequestHeader(WebSocketConfig.USER_ID_HEADER) long userId) {
        if (!settings.isEnabled()) {
            return DISABLED;
        }
        Optional<ResponseEntity<Map<String, Object>>> denied = checkOwnership(sessionId, userId);
        if (denied.isPresent()) {
            return denied.get();
        }
        try {
            sessionManager.closeSession(sessionId);
            return ResponseEntity.ok(Map.of("message", "session closed"));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.toErrorData());
        }
    }

    @PostMapping("/{sessionId}/resize")
    public ResponseEntity<Map<String, Object>> resize(
            @PathVariable String sessionId,
            @RequestHeader(WebSocketConfig.USER_ID_HEADER) long userId,
            @Valid @RequestBody TerminalResizeRequest request) {
        if (!settings.isEnabled()) {
            return DISABLED;
        }
        Optional<ResponseEntity<Map<String, Object>>> denied = checkOwnership(sessionId, userId);
        if (denied.isPresent()) {
            return denied.get();
        }
        try {
            sessionManager.getSession(sessionId)
                    .orElseThrow(() -> NotFoundException.session(sessionId))
                    .resize(request.cols(), request.rows());
            return ResponseEntity.ok(Map.of("cols", request.cols(), "rows", request.rows()));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.toErrorData());
        } catch (SessionClosedException e) {
            return ResponseEntity.status(HttpStatus.CONFLICT).body(e.toErrorData());
        } catch (IOException e) {
            log.error("调整终端会话 {} 的尺寸失败", sessionId, e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Map.of("error", e.getMessage()));
        }
    }

    private Optional<ResponseEntity<Map<String, Object>>> checkOwnership(String sessionId, long userId) {
        Optional<TerminalSession> session = sessionManager.getSession(sessionId);
        if (session.isEmpty()) {
            return Optional.of(ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(NotFoundException.session(sessionId).toErrorData()));
        }
        if (session.get().getUserId() != userId) {
            log.warn("用户 {} 试图操作不属于自己的终端会话 {}", userId, sessionId);
            return Optional.of(ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "access denied")));
        }
        return Optional.empty();
    }
}
