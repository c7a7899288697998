/**
 * ExecutionStatus.java
 *
 * 命令执行的状态。状态只能单向推进：
 * PENDING -> RUNNING -> {SUCCESS | FAILED | TIMEOUT}。
 */
package club.ppmc.remote.model;

import com.google.gson.annotations.SerializedName;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ExecutionStatus {
    @SerializedName("pending")
    PENDING,
    @SerializedName("running")
    RUNNING,
    @SerializedName("success")
    SUCCESS,
    @SerializedName("failed")
    FAILED,
    @SerializedName("timeout")
    TIMEOUT;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED || this == TIMEOUT;
    }

    /** 只有 SUCCESS 和 FAILED 携带退出码，TIMEOUT 没有。 */
    public boolean hasExitCode() {
        return this == SUCCESS || this == FAILED;
    }

    public boolean canTransitionTo(ExecutionStatus next) {
        return switch (this) {
            case PENDING -> next == RUNNING;
            case RUNNING -> next.isTerminal();
            default -> false;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
