/**
 * TerminalSessionInfo.java
 *
 * 终端会话的只读快照，用于 REST 响应和 WebSocket 的 session_info 消息。
 */
package club.ppmc.remote.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.gson.annotations.SerializedName;
import java.time.Instant;

public record TerminalSessionInfo(
        String id,
        String name,
        @JsonProperty("created_at") @SerializedName("created_at") Instant createdAt,
        @JsonProperty("last_activity") @SerializedName("last_activity") Instant lastActivity,
        @JsonProperty("client_count") @SerializedName("client_count") int clientCount,
        @JsonProperty("is_active") @SerializedName("is_active") boolean active) {}
