/**
 * RemoteException.java
 *
 * 本服务所有业务异常的基类。
 * 每个异常都携带一个错误类型标识，Controller 层通过 toErrorData() 将其转换为对前端友好的响应。
 */
package club.ppmc.remote.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public abstract class RemoteException extends RuntimeException {

    /** 错误类型标识，如 "NOT_FOUND"、"QUOTA_EXCEEDED"。 */
    private final String type;

    protected RemoteException(String type, String message) {
        super(message);
        this.type = type;
    }

    protected RemoteException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    /**
     * 将异常信息转换为一个Map，便于序列化为JSON。
     */
    public Map<String, Object> toErrorData() {
        return Map.of("type", type, "error", getMessage());
    }
}
