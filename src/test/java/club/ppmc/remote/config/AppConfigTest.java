package club.ppmc.remote.config;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.remote.model.TerminalSessionInfo;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AppConfigTest {

    @Test
    void parsesKeyValueEnvironmentEntries() {
        var env = AppConfig.parseEnvironment(List.of("LANG=C.UTF-8", " EDITOR =vim", "OPTS=a=b", "broken", "=nokey"));

        assertThat(env).containsExactly(
                Map.entry("LANG", "C.UTF-8"),
                Map.entry("EDITOR", "vim"),
                Map.entry("OPTS", "a=b"));
    }

    @Test
    void gsonWritesInstantsAsIsoStrings() {
        var info = new TerminalSessionInfo(
                "term-1-x", "Session x", Instant.parse("2024-01-01T00:00:00Z"), Instant.parse("2024-01-01T00:00:05Z"), 2, true);

        String json = new AppConfig().gson().toJson(info);

        assertThat(json)
                .contains("\"created_at\":\"2024-01-01T00:00:00Z\"")
                .contains("\"client_count\":2")
                .contains("\"is_active\":true");
    }

    @Test
    void terminalSettingsCombineShellAndArgs() {
        var settings = new AppConfig().terminalSettings(
                true, "/bin/zsh", List.of("-l", "-i"), List.of("A=1"), "", 3, 1024,
                Duration.ofMinutes(1), Duration.ofSeconds(10));

        assertThat(settings.command()).containsExactly("/bin/zsh", "-l", "-i");
        assertThat(settings.getEnv()).containsEntry("A", "1");
        assertThat(settings.getWorkingDir()).isNull();
        assertThat(settings.getMaxSessionsPerUser()).isEqualTo(3);
    }
}
