package club.ppmc.remote.stream;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import club.ppmc.remote.config.AppConfig;
import club.ppmc.remote.model.Execution;
import club.ppmc.remote.model.ExecutionSettings;
import club.ppmc.remote.model.ExecutionStatus;
import club.ppmc.remote.service.ExecutionAttachment;
import club.ppmc.remote.service.ExecutionOutput;
import club.ppmc.remote.service.ExecutionService;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.servlet.mvc.method.annotation.ResponseBodyEmitter.DataWithMediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

class ExecutionStreamerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ExecutionService executionService;
    private ExecutionStreamer streamer;

    @BeforeEach
    void setUp() {
        executionService = mock(ExecutionService.class);
        streamer = new ExecutionStreamer(
                executionService, new ExecutionSettings(), new AppConfig().gson(), Duration.ofMillis(50));
    }

    private void finishedAs(String id, ExecutionStatus status, Integer exitCode, boolean truncated) {
        Execution execution = Execution.pending(id, "cmd", 1, T0)
                .running(T0)
                .finish(status, new byte[0], truncated, exitCode, T0);
        when(executionService.getExecutionById(id)).thenReturn(execution);
    }

    private static void append(ExecutionOutput output, String text) {
        byte[] bytes = text.getBytes(UTF_8);
        output.append(bytes, 0, bytes.length);
    }

    @Test
    void sendsReplayThenLiveOutputThenSingleCompleteEvent() {
        finishedAs("e1", ExecutionStatus.SUCCESS, 0, false);
        var output = new ExecutionOutput(1024);
        append(output, "hello\n");
        ExecutionAttachment attachment = output.attach();
        append(output, "world\n");
        output.finish();
        var emitter = new CapturingEmitter();

        streamer.pump("e1", attachment, emitter, new AtomicBoolean(true));

        assertThat(emitter.events).hasSize(3);
        assertThat(emitter.events.get(0)).contains("event:output").contains("{\"data\":\"hello\\n\"}");
        assertThat(emitter.events.get(1)).contains("{\"data\":\"world\\n\"}");
        assertThat(emitter.events.get(2))
                .contains("event:complete")
                .contains("{\"status\":\"success\",\"exit_code\":0,\"truncated\":false}");
        assertThat(emitter.completed).isTrue();
        verify(executionService).detach("e1", attachment.channel());
    }

    @Test
    void timeoutCompletesWithNullExitCode() {
        finishedAs("e2", ExecutionStatus.TIMEOUT, null, true);
        var output = new ExecutionOutput(1024);
        output.finish();
        var emitter = new CapturingEmitter();

        streamer.pump("e2", output.attach(), emitter, new AtomicBoolean(true));

        assertThat(emitter.events).singleElement().asString()
                .contains("\"status\":\"timeout\"")
                .contains("\"exit_code\":null")
                .contains("\"truncated\":true");
    }

    @Test
    void sendsKeepAliveWhileWaitingForOutput() throws Exception {
        finishedAs("e3", ExecutionStatus.SUCCESS, 0, false);
        var output = new ExecutionOutput(1024);
        ExecutionAttachment attachment = output.attach();
        var emitter = new CapturingEmitter();
        Thread finisher = new Thread(() -> {
            try {
                Thread.sleep(300);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            append(output, "late");
            output.finish();
        });
        finisher.start();

        streamer.pump("e3", attachment, emitter, new AtomicBoolean(true));
        finisher.join();

        assertThat(emitter.events).anyMatch(event -> event.contains(":keep-alive"));
        assertThat(emitter.events).anyMatch(event -> event.contains("{\"data\":\"late\"}"));
        assertThat(emitter.events.get(emitter.events.size() - 1)).contains("event:complete");
    }

    @Test
    void multiByteCharacterSplitAcrossChunksIsSentWhole() {
        finishedAs("e4", ExecutionStatus.SUCCESS, 0, false);
        byte[] bytes = "终".getBytes(UTF_8);
        var output = new ExecutionOutput(1024);
        ExecutionAttachment attachment = output.attach();
        output.append(bytes, 0, 1);
        output.append(bytes, 1, bytes.length - 1);
        output.finish();
        var emitter = new CapturingEmitter();

        streamer.pump("e4", attachment, emitter, new AtomicBoolean(true));

        assertThat(emitter.events).hasSize(2);
        assertThat(emitter.events.get(0)).contains("{\"data\":\"终\"}");
    }

    @Test
    void disconnectedViewerStopsWithoutCompleteEvent() {
        var output = new ExecutionOutput(1024);
        ExecutionAttachment attachment = output.attach();
        var emitter = new CapturingEmitter();

        streamer.pump("e5", attachment, emitter, new AtomicBoolean(false));

        assertThat(emitter.events).isEmpty();
        assertThat(emitter.completed).isFalse();
    }

    @Test
    void sendFailureEndsStreamWithError() {
        var output = new ExecutionOutput(1024);
        append(output, "x");
        ExecutionAttachment attachment = output.attach();
        var emitter = new CapturingEmitter();
        emitter.failSends = true;

        streamer.pump("e6", attachment, emitter, new AtomicBoolean(true));

        assertThat(emitter.error).isInstanceOf(IOException.class);
        verify(executionService).detach("e6", attachment.channel());
    }

    private static class CapturingEmitter extends SseEmitter {

        final List<String> events = new CopyOnWriteArrayList<>();
        volatile boolean completed;
        volatile boolean failSends;
        volatile Throwable error;

        @Override
        public void send(SseEventBuilder builder) throws IOException {
            if (failSends) {
                throw new IOException("broken pipe");
            }
            events.add(builder.build().stream()
                    .map(DataWithMediaType::getData)
                    .map(String::valueOf)
                    .collect(Collectors.joining()));
        }

        @Override
        public void complete() {
            completed = true;
        }

        @Override
        public void completeWithError(Throwable ex) {
            error = ex;
        }
    }
}
