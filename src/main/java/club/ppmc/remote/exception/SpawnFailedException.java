/**
 * SpawnFailedException.java
 *
 * 无法启动 shell 进程或伪终端。
 */
package club.ppmc.remote.exception;

public class SpawnFailedException extends RemoteException {

    public SpawnFailedException(String message, Throwable cause) {
        super("SPAWN_FAILED", message, cause);
    }
}
