/**
 * Execution.java
 *
 * 一次命令执行的记录。它是一个不可变的记录(record)，每次状态变更都会生成一个新实例，
 * 并在变更时校验状态机，保证：
 * finishedAt 当且仅当状态为终态时存在；exitCode 当且仅当状态为 SUCCESS 或 FAILED 时存在。
 * 捕获的输出以原始字节保存，回放时原样发送；REST 返回的文本视图由字节解码得到，其 UTF-8 长度不超过字节数。
 * 由 ExecutionService 创建和推进，由 ExecutionRepository 保存。
 */
package club.ppmc.remote.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.time.Instant;

/**
 * @param id 执行ID。
 * @param commandId 被执行命令的ID。
 * @param userId 发起执行的用户ID。
 * @param status 当前状态。
 * @param outputBytes 已捕获的原始输出字节（不超过配置的上限）。
 * @param outputTruncated 输出是否因超出上限而被截断。
 * @param exitCode 进程退出码，仅 SUCCESS/FAILED 时存在。
 * @param startedAt 开始运行的时间。
 * @param finishedAt 结束时间，仅终态时存在。
 * @param createdAt 记录创建时间。
 */
public record Execution(
        String id,
        @JsonProperty("command_id") String commandId,
        @JsonProperty("user_id") long userId,
        ExecutionStatus status,
        @JsonIgnore byte[] outputBytes,
        @JsonProperty("output_truncated") boolean outputTruncated,
        @JsonProperty("exit_code") Integer exitCode,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("created_at") Instant createdAt) {

    public static Execution pending(String id, String commandId, long userId, Instant createdAt) {
        return new Execution(id, commandId, userId, ExecutionStatus.PENDING, new byte[0], false, null, null, null, createdAt);
    }

    public Execution running(Instant startedAt) {
        checkTransition(ExecutionStatus.RUNNING);
        return new Execution(id, commandId, userId, ExecutionStatus.RUNNING, outputBytes, outputTruncated, null, startedAt, null, createdAt);
    }

    /**
     * 生成终态记录。
     *
     * @param status SUCCESS、FAILED 或 TIMEOUT。
     * @param exitCode 退出码；TIMEOUT 时必须为 null，其余终态必须非 null。
     */
    public Execution finish(ExecutionStatus status, byte[] output, boolean truncated, Integer exitCode, Instant finishedAt) {
        checkTransition(status);
        if (status.hasExitCode() != (exitCode != null)) {
            throw new IllegalArgumentException("状态 " + status.value() + " 与退出码 " + exitCode + " 不匹配");
        }
        return new Execution(
                id, commandId, userId, status, output.clone(), truncated, exitCode, startedAt, finishedAt, createdAt);
    }

    @Override
    @JsonIgnore
    public byte[] outputBytes() {
        return outputBytes.clone();
    }

    /**
     * 输出的文本视图。无效或被截断的 UTF-8 序列会被丢弃，不会用替换字符补齐，
     * 因此文本编码后的长度不会超过捕获的字节数。
     */
    @JsonProperty("output")
    public String output() {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(outputBytes))
                    .toString();
        } catch (CharacterCodingException e) {
            // IGNORE 模式下不会发生
            throw new IllegalStateException(e);
        }
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void checkTransition(ExecutionStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    String.format("执行 %s 不能从 %s 变为 %s", id, status.value(), next.value()));
        }
    }
}
