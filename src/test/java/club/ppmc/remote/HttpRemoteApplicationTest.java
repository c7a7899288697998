package club.ppmc.remote;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.remote.model.Command;
import club.ppmc.remote.model.ExecutionStatus;
import club.ppmc.remote.repository.InMemoryCommandRepository;
import club.ppmc.remote.service.ExecutionService;
import club.ppmc.remote.service.PipePtyHandle;
import club.ppmc.remote.service.PtySpawner;
import club.ppmc.remote.service.TerminalSession;
import club.ppmc.remote.service.TerminalSessionManager;
import club.ppmc.remote.service.Waits;
import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class HttpRemoteApplicationTest {

    @LocalServerPort
    private int port;

    @Autowired
    private TestRestTemplate restTemplate;

    @Autowired
    private InMemoryCommandRepository commandRepository;

    @Autowired
    private ExecutionService executionService;

    @Autowired
    private TerminalSessionManager sessionManager;

    @TestConfiguration
    static class PipeTerminalConfig {

        @Bean
        @Primary
        PtySpawner pipeSpawner() {
            return PipePtyHandle.spawning("cat");
        }
    }

    @AfterEach
    void closeSessions() {
        sessionManager.getUserSessions(7).forEach(TerminalSession::close);
    }

    private HttpHeaders userHeaders() {
        var headers = new HttpHeaders();
        headers.set("X-User-Id", "7");
        headers.set("X-Username", "alice");
        return headers;
    }

    @Test
    @SuppressWarnings("unchecked")
    void triggeredExecutionRunsInBackground() throws Exception {
        commandRepository.save(new Command("greet", "greet", "echo from-api", null, 10));

        ResponseEntity<Map> accepted = restTemplate.postForEntity(
                "/api/commands/greet/execute", new HttpEntity<>(userHeaders()), Map.class);

        assertThat(accepted.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        String id = (String) accepted.getBody().get("execution_id");
        assertThat(Waits.waitUntil(
                () -> executionService.getExecutionById(id).status() == ExecutionStatus.SUCCESS,
                Duration.ofSeconds(10))).isTrue();

        Map<String, Object> record = restTemplate.getForObject("/api/executions/" + id, Map.class);
        assertThat(record).containsEntry("output", "from-api\n").containsEntry("exit_code", 0);

        String events = restTemplate.getForObject("/api/executions/" + id + "/stream", String.class);
        assertThat(events).contains("event:output").contains("from-api").contains("event:complete");
    }

    @Test
    void unknownCommandIsNotFound() {
        ResponseEntity<String> response = restTemplate.postForEntity(
                "/api/commands/missing/execute", new HttpEntity<>(userHeaders()), String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void ephemeralTerminalEchoesAndClosesWithConnection() throws Exception {
        var client = new RecordingClient();
        WebSocketSession ws = connect(client, "");

        String info = client.texts.poll(5, TimeUnit.SECONDS);
        assertThat(info).contains("\"type\":\"session_info\"");
        assertThat(sessionManager.getUserSessions(7)).hasSize(1);

        ws.sendMessage(new TextMessage("ping\n"));
        assertThat(Waits.waitUntil(() -> client.output().contains("ping\n"), Duration.ofSeconds(5))).isTrue();

        ws.close();
        assertThat(Waits.waitUntil(() -> sessionManager.getUserSessions(7).isEmpty(), Duration.ofSeconds(5)))
                .isTrue();
    }

    @Test
    void persistentTerminalReplaysHistoryOnReconnect() throws Exception {
        ResponseEntity<Map> created = restTemplate.postForEntity(
                "/api/terminal/sessions", new HttpEntity<>(userHeaders()), Map.class);
        assertThat(created.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        String sessionId = (String) ((Map<?, ?>) created.getBody().get("session")).get("id");
        TerminalSession session = sessionManager.getSession(sessionId).orElseThrow();

        var first = new RecordingClient();
        WebSocketSession ws = connect(first, "?persistent=true&session_id=" + sessionId);
        ws.sendMessage(new TextMessage("remember me\n"));
        assertThat(Waits.waitUntil(() -> first.output().contains("remember me"), Duration.ofSeconds(5))).isTrue();
        ws.close();
        assertThat(Waits.waitUntil(() -> session.clientCount() == 0, Duration.ofSeconds(5))).isTrue();
        assertThat(session.isClosed()).isFalse();

        var second = new RecordingClient();
        WebSocketSession reconnected = connect(second, "?persistent=true&session_id=" + sessionId);

        assertThat(Waits.waitUntil(() -> second.output().contains("remember me"), Duration.ofSeconds(5))).isTrue();
        reconnected.close();
    }

    @Test
    void foreignSessionIsRejected() throws Exception {
        TerminalSession other = sessionManager.createSession(8, "bob");
        try {
            var client = new RecordingClient();
            connect(client, "?persistent=true&session_id=" + other.getId());

            String error = client.texts.poll(5, TimeUnit.SECONDS);
            assertThat(error).contains("Session not found or access denied");
        } finally {
            sessionManager.closeSession(other.getId());
        }
    }

    private WebSocketSession connect(RecordingClient client, String query) throws Exception {
        var headers = new WebSocketHttpHeaders();
        headers.set("X-User-Id", "7");
        headers.set("X-Username", "alice");
        URI uri = URI.create("ws://localhost:" + port + "/api/terminal/ws" + query);
        return new StandardWebSocketClient().execute(client, headers, uri).get(5, TimeUnit.SECONDS);
    }

    private static class RecordingClient extends AbstractWebSocketHandler {

        final BlockingQueue<String> texts = new LinkedBlockingQueue<>();
        private final ByteArrayOutputStream binary = new ByteArrayOutputStream();

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            texts.add(message.getPayload());
        }

        @Override
        protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
            ByteBuffer payload = message.getPayload();
            byte[] bytes = new byte[payload.remaining()];
            payload.get(bytes);
            synchronized (binary) {
                binary.write(bytes, 0, bytes.length);
            }
        }

        String output() {
            synchronized (binary) {
                return binary.toString(UTF_8);
            }
        }
    }
}
