/**
 * AppConfig.java
 *
 * Spring Boot 应用的基础配置类。
 * 定义应用级别的Bean：JSON 序列化用的 Gson、时钟，以及从 application.properties 读取的执行与终端配置。
 * 其他服务都应依赖这里产出的配置对象，而不是直接使用 @Value 注解。
 */
package club.ppmc.remote.config;

import club.ppmc.remote.model.ExecutionSettings;
import club.ppmc.remote.model.TerminalSettings;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

@Configuration
public class AppConfig {

    /**
     * 定义一个全局的 Gson Bean。
     * 在 SSE 和 WebSocket 推送中用于手动构造 JSON 消息。
     */
    @Bean
    public Gson gson() {
        return new GsonBuilder()
                .registerTypeAdapter(Instant.class, new InstantTypeAdapter())
                .disableHtmlEscaping()
                .create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExecutionSettings executionSettings(
            @Value("${remote.execution.default-timeout:300}") int defaultTimeout,
            @Value("${remote.execution.max-timeout:3600}") int maxTimeout,
            @Value("${remote.execution.max-output-size:10485760}") int maxOutputSize,
            @Value("${remote.execution.kill-grace:2s}") Duration killGrace) {
        var settings = new ExecutionSettings();
        settings.setDefaultTimeoutSeconds(defaultTimeout);
        settings.setMaxTimeoutSeconds(maxTimeout);
        settings.setMaxOutputSize(maxOutputSize);
        settings.setKillGraceMillis(killGrace.toMillis());
        return settings;
    }

    @Bean
    public TerminalSettings terminalSettings(
            @Value("${remote.terminal.enabled:true}") boolean enabled,
            @Value("${remote.terminal.shell:/bin/bash}") String shell,
            @Value("${remote.terminal.args:-l}") List<String> args,
            @Value("${remote.terminal.env:}") List<String> env,
            @Value("${remote.terminal.working-dir:}") String workingDir,
            @Value("${remote.terminal.max-sessions-per-user:10}") int maxSessionsPerUser,
            @Value("${remote.terminal.buffer-size:65536}") int bufferSize,
            @Value("${remote.terminal.session-ttl:24h}") Duration sessionTtl,
            @Value("${remote.terminal.sweep-interval:5m}") Duration sweepInterval) {
        var settings = new TerminalSettings();
        settings.setEnabled(enabled);
        settings.setShell(shell);
        settings.setArgs(args);
        settings.setEnv(parseEnvironment(env));
        settings.setWorkingDir(StringUtils.hasText(workingDir) ? workingDir : null);
        settings.setMaxSessionsPerUser(maxSessionsPerUser);
        settings.setBufferSize(bufferSize);
        settings.setSessionTtl(sessionTtl);
        settings.setSweepInterval(sweepInterval);
        return settings;
    }

    /**
     * 将 "KEY=VALUE" 形式的列表解析为环境变量表。没有等号的项被忽略。
     */
    static Map<String, String> parseEnvironment(List<String> entries) {
        var env = new LinkedHashMap<String, String>();
        for (String entry : entries) {
            int separator = entry.indexOf('=');
            if (separator > 0) {
                env.put(entry.substring(0, separator).trim(), entry.substring(separator + 1));
            }
        }
        return env;
    }
}
