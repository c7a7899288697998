/**
 * SessionClosedException.java
 *
 * 向已关闭的终端会话写入。调用方收到后应停止发送。
 */
package club.ppmc.remote.exception;

public class SessionClosedException extends RemoteException {

    public SessionClosedException(String sessionId) {
        super("SESSION_CLOSED", "session is closed: " + sessionId);
    }
}
