/**
 * TerminalSettings.java
 *
 * 持久化终端会话的配置项。由 AppConfig 从 application.properties 中的 remote.terminal.* 读取。
 */
package club.ppmc.remote.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Data;

@Data
public class TerminalSettings {

    private boolean enabled = true;

    private String shell = "/bin/bash";

    private List<String> args = new ArrayList<>(List.of("-l"));

    /** 追加到继承环境之上的环境变量。 */
    private Map<String, String> env = new LinkedHashMap<>();

    /** 终端启动目录；为空时使用当前用户的主目录。 */
    private String workingDir;

    private int maxSessionsPerUser = 10;

    /** 每个会话用于回放的历史缓冲区大小（字节）。 */
    private int bufferSize = 64 * 1024;

    private Duration sessionTtl = Duration.ofHours(24);

    private Duration sweepInterval = Duration.ofMinutes(5);

    private int initialColumns = 120;

    private int initialRows = 40;

    /** 关闭会话时等待 shell 退出的宽限时间。 */
    private Duration killGrace = Duration.ofSeconds(2);

    public List<String> command() {
        var command = new ArrayList<String>();
        command.add(shell);
        command.addAll(args);
        return command;
    }
}
