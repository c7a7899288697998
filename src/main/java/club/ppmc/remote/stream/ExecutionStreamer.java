/**
 * ExecutionStreamer.java
 *
 * 将一次执行的输出以 Server-Sent Events 的形式推送给浏览器。
 * 连接建立后先发送已捕获输出的回放，再持续推送实时输出；空闲时发送注释形式的心跳，
 * 执行进入终态后发送唯一的一条 complete 事件并结束响应，以此与“暂时没有输出”区分开。
 */
package club.ppmc.remote.stream;

import club.ppmc.remote.model.Execution;
import club.ppmc.remote.model.ExecutionSettings;
import club.ppmc.remote.service.ExecutionAttachment;
import club.ppmc.remote.service.ExecutionService;
import club.ppmc.remote.util.OutputChannel;
import club.ppmc.remote.util.Utf8ChunkDecoder;
import com.google.gson.Gson;
import com.google.gson.annotations.SerializedName;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

@Service
@Slf4j
public class ExecutionStreamer {

    public static final String OUTPUT_EVENT = "output";
    public static final String COMPLETE_EVENT = "complete";

    private final ExecutionService executionService;
    private final ExecutionSettings settings;
    private final Gson gson;
    private final Duration keepAliveInterval;
    private final ExecutorService executorService = Executors.newCachedThreadPool();

    public ExecutionStreamer(
            ExecutionService executionService,
            ExecutionSettings settings,
            Gson gson,
            @Value("${remote.stream.keep-alive:15s}") Duration keepAliveInterval) {
        this.executionService = executionService;
        this.settings = settings;
        this.gson = gson;
        this.keepAliveInterval = keepAliveInterval;
    }

    /**
     * 为执行打开一个事件流。
     *
     * @throws club.ppmc.remote.exception.NotFoundException 执行不存在（在响应开始之前抛出）。
     */
    public SseEmitter stream(String executionId) {
        ExecutionAttachment attachment = executionService.attach(executionId);

        // 最长的执行也会在最大超时后结束，多留一分钟的余量
        long timeoutMillis = Duration.ofSeconds(settings.getMaxTimeoutSeconds()).plusMinutes(1).toMillis();
        var emitter = new SseEmitter(timeoutMillis);
        var active = new AtomicBoolean(true);
        Runnable release = () -> {
            if (active.compareAndSet(true, false)) {
                executionService.detach(executionId, attachment.channel());
            }
        };
        emitter.onCompletion(release);
        emitter.onTimeout(release);
        emitter.onError(error -> release.run());

        executorService.execute(() -> pump(executionId, attachment, emitter, active));
        return emitter;
    }

    void pump(String executionId, ExecutionAttachment attachment, SseEmitter emitter, AtomicBoolean active) {
        var decoder = new Utf8ChunkDecoder();
        OutputChannel channel = attachment.channel();
        try {
            sendOutput(emitter, decoder.decode(attachment.replay()));
            while (active.get()) {
                byte[] chunk = channel.poll(keepAliveInterval);
                if (chunk != null) {
                    sendOutput(emitter, decoder.decode(chunk));
                } else if (channel.isFinished()) {
                    break;
                } else {
                    emitter.send(SseEmitter.event().comment("keep-alive"));
                }
            }
            if (!active.get()) {
                return;
            }
            sendOutput(emitter, decoder.flush());

            Execution execution = executionService.getExecutionById(executionId);
            var complete = new CompleteEvent(execution.status().value(), execution.exitCode(), execution.outputTruncated());
            emitter.send(SseEmitter.event().name(COMPLETE_EVENT).data(gson.toJson(complete)));
            emitter.complete();
        } catch (IOException e) {
            log.debug("执行 {} 的事件流已断开: {}", executionId, e.getMessage());
            emitter.completeWithError(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            emitter.complete();
        } catch (RuntimeException e) {
            log.error("推送执行 {} 的事件流时出错", executionId, e);
            emitter.completeWithError(e);
        } finally {
            if (active.compareAndSet(true, false)) {
                executionService.detach(executionId, channel);
            }
        }
    }

    private void sendOutput(SseEmitter emitter, String text) throws IOException {
        if (!text.isEmpty()) {
            emitter.send(SseEmitter.event().name(OUTPUT_EVENT).data(gson.toJson(new OutputEvent(text))));
        }
    }

    @PreDestroy
    public void shutdown() {
        executorService.shutdownNow();
    }

    record OutputEvent(String data) {}

    record CompleteEvent(
            String status,
            @SerializedName("exit_code") Integer exitCode,
            boolean truncated) {}
}
