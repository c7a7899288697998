/**
 * Pty4jSpawner.java
 *
 * 基于 pty4j 的伪终端实现。
 */
package club.ppmc.remote.service;

import club.ppmc.remote.model.TerminalSettings;
import com.pty4j.PtyProcess;
import com.pty4j.PtyProcessBuilder;
import com.pty4j.WinSize;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class Pty4jSpawner implements PtySpawner {

    private final TerminalSettings settings;

    public Pty4jSpawner(TerminalSettings settings) {
        this.settings = settings;
    }

    @Override
    public PtyHandle spawn(List<String> command, Map<String, String> environment, Path workingDirectory)
            throws IOException {
        PtyProcess process = new PtyProcessBuilder(command.toArray(new String[0]))
                .setEnvironment(environment)
                .setDirectory(workingDirectory.toString())
                .setInitialColumns(settings.getInitialColumns())
                .setInitialRows(settings.getInitialRows())
                .setRedirectErrorStream(true)
                .setConsole(false)
                .start();
        log.debug("已在伪终端中启动进程 PID {}: {}", process.pid(), String.join(" ", command));
        return new Pty4jHandle(process);
    }

    private record Pty4jHandle(PtyProcess process) implements PtyHandle {

        @Override
        public InputStream getInputStream() {
            return process.getInputStream();
        }

        @Override
        public OutputStream getOutputStream() {
            return process.getOutputStream();
        }

        @Override
        public void resize(int columns, int rows) {
            process.setWinSize(new WinSize(columns, rows));
        }

        @Override
        public long pid() {
            return process.pid();
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void terminate(Duration grace) throws InterruptedException {
            if (!process.isAlive()) {
                return;
            }
            // 关闭主端即挂断终端，交互式 shell 忽略 SIGTERM，但会在 SIGHUP 时退出
            try {
                close();
            } catch (IOException e) {
                log.debug("挂断伪终端 PID {} 时出错: {}", process.pid(), e.getMessage());
            }
            process.destroy();
            if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                ProcessHandle.of(process.pid())
                        .ifPresent(handle -> handle.descendants().forEach(ProcessHandle::destroyForcibly));
                process.destroyForcibly();
                process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
        }

        @Override
        public void close() throws IOException {
            // 关闭流会释放伪终端主端，阻塞中的读取随之返回
            process.getOutputStream().close();
            process.getInputStream().close();
        }
    }
}
