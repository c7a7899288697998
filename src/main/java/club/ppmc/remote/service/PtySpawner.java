/**
 * PtySpawner.java
 *
 * 在伪终端下启动 shell 的工厂。TerminalSessionManager 通过它创建会话进程。
 */
package club.ppmc.remote.service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@FunctionalInterface
public interface PtySpawner {

    /**
     * @param command shell 程序及其参数。
     * @param environment 完整的环境变量。
     * @param workingDirectory 启动目录。
     * @return 已启动的进程句柄。
     * @throws IOException 进程或伪终端无法启动时。
     */
    PtyHandle spawn(List<String> command, Map<String, String> environment, Path workingDirectory) throws IOException;
}
