/**
 * NotFoundException.java
 *
 * 请求的终端会话、执行记录或命令不存在。
 */
package club.ppmc.remote.exception;

import java.util.Map;
import lombok.Getter;

@Getter
public class NotFoundException extends RemoteException {

    /** 资源类型："session"、"execution" 或 "command"。 */
    private final String resource;

    private final String resourceId;

    public NotFoundException(String resource, String resourceId) {
        super("NOT_FOUND", resource + " not found: " + resourceId);
        this.resource = resource;
        this.resourceId = resourceId;
    }

    public static NotFoundException session(String id) {
        return new NotFoundException("session", id);
    }

    public static NotFoundException execution(String id) {
        return new NotFoundException("execution", id);
    }

    public static NotFoundException command(String id) {
        return new NotFoundException("command", id);
    }

    @Override
    public Map<String, Object> toErrorData() {
        return Map.of("type", getType(), "error", resource + " not found", "resource", resource);
    }
}
