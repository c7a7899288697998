/**
 * ExecutionController.java
 *
 * 该控制器处理命令执行相关的HTTP请求：触发一次执行、查询执行记录，以及订阅执行输出的事件流。
 * 执行本身在 ExecutionService 的后台线程中进行，触发接口立即返回 202。
 */
package club.ppmc.remote.controller;

import club.ppmc.remote.config.WebSocketConfig;
import club.ppmc.remote.exception.NotFoundException;
import club.ppmc.remote.model.Execution;
import club.ppmc.remote.service.ExecutionService;
import club.ppmc.remote.stream.ExecutionStreamer;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@RestController
@RequestMapping("/api")
@Slf4j
public class ExecutionController {

    private final ExecutionService executionService;
    private final ExecutionStreamer executionStreamer;

    public ExecutionController(ExecutionService executionService, ExecutionStreamer executionStreamer) {
        this.executionService = executionService;
        this.executionStreamer = executionStreamer;
    }

    /**
     * 触发一次命令执行，立即返回执行ID和事件流地址。
     */
    @PostMapping("/commands/{id}/execute")
    public ResponseEntity<Map<String, Object>> execute(
            @PathVariable String id, @RequestHeader(WebSocketConfig.USER_ID_HEADER) long userId) {
        try {
            Execution execution = executionService.createExecution(id, userId);
            executionService.executeAsync(execution.id()).exceptionally(error -> {
                log.error("执行 {} 异常结束", execution.id(), error);
                return null;
            });
            return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                    "execution_id", execution.id(),
                    "stream_url", "/api/executions/" + execution.id() + "/stream"));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.toErrorData());
        }
    }

    @GetMapping("/executions")
    public ResponseEntity<List<Execution>> listExecutions(
            @RequestParam(defaultValue = "50") int limit, @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(executionService.getExecutions(limit, offset));
    }

    @GetMapping("/executions/{id}")
    public ResponseEntity<?> getExecution(@PathVariable String id) {
        try {
            return ResponseEntity.ok(executionService.getExecutionById(id));
        } catch (NotFoundException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.toErrorData());
        }
    }

    /**
     * 执行输出的事件流：先回放已有输出，再推送实时输出，最后发送 complete 事件。
     */
    @GetMapping("/executions/{id}/stream")
    public ResponseEntity<SseEmitter> stream(@PathVariable String id) {
        SseEmitter emitter = executionStreamer.stream(id);
        return ResponseEntity.ok()
                .header("Cache-Control", "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(emitter);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(NotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.APPLICATION_JSON)
                .body(e.toErrorData());
    }
}
