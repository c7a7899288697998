/**
 * Command.java
 *
 * 可被远程触发的命令定义。命令本身的增删改查不属于本服务，
 * 这里只保留执行引擎需要的字段，由 CommandRepository 提供。
 *
 * @param id 命令ID。
 * @param name 显示名称。
 * @param command 交给 {@code sh -c} 执行的命令文本。
 * @param workingDir 执行时的工作目录。
 * @param timeoutSeconds 命令自身的超时秒数；小于等于 0 表示使用系统默认值。
 */
package club.ppmc.remote.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Command(
        String id,
        String name,
        String command,
        @JsonProperty("working_dir") String workingDir,
        @JsonProperty("timeout_seconds") int timeoutSeconds) {}
