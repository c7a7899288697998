/**
 * ExecutionSettings.java
 *
 * 命令执行引擎的配置项。由 AppConfig 从 application.properties 中的 remote.execution.* 读取。
 */
package club.ppmc.remote.model;

import lombok.Data;

@Data
public class ExecutionSettings {

    /** 命令未设置超时时使用的默认超时秒数。 */
    private int defaultTimeoutSeconds = 300;

    /** 系统允许的最大超时秒数，命令自身的超时会被限制在此值以内。 */
    private int maxTimeoutSeconds = 3600;

    /** 单次执行捕获输出的最大字节数，超出部分被静默丢弃。 */
    private int maxOutputSize = 10 * 1024 * 1024;

    /** 超时后等待进程退出的宽限时间（毫秒）。 */
    private long killGraceMillis = 2000;

    /**
     * 计算实际生效的超时：命令自身的超时（未设置时使用默认值），再限制到最大值。
     */
    public int effectiveTimeoutSeconds(int commandTimeoutSeconds) {
        int timeout = commandTimeoutSeconds > 0 ? commandTimeoutSeconds : defaultTimeoutSeconds;
        return Math.min(timeout, maxTimeoutSeconds);
    }
}
