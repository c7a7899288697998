/**
 * QuotaExceededException.java
 *
 * 用户的活动终端会话数已达上限。调用方可以在关闭旧会话后重试。
 */
package club.ppmc.remote.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class QuotaExceededException extends RemoteException {

    private final long userId;
    private final int limit;

    public QuotaExceededException(long userId, int limit) {
        super("QUOTA_EXCEEDED", String.format("maximum sessions (%d) reached for user", limit));
        this.userId = userId;
        this.limit = limit;
    }

    @Override
    public Map<String, Object> toErrorData() {
        return Map.of("type", getType(), "error", getMessage(), "limit", limit);
    }
}
