package club.ppmc.remote.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 用普通管道代替伪终端的测试替身，进程的标准输出与错误输出合并。
 */
public class PipePtyHandle implements PtyHandle {

    private final Process process;
    private volatile int columns;
    private volatile int rows;

    private PipePtyHandle(Process process) {
        this.process = process;
    }

    public static PipePtyHandle start(String... command) throws IOException {
        return new PipePtyHandle(new ProcessBuilder(List.of(command)).redirectErrorStream(true).start());
    }

    public static PtySpawner spawning(String... command) {
        return (ignored, env, dir) -> start(command);
    }

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
        this.columns = columns;
        this.rows = rows;
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
        process.destroy();
        if (!process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    @Override
    public void close() throws IOException {
        process.getOutputStream().close();
        process.getInputStream().close();
    }

    int columns() {
        return columns;
    }

    int rows() {
        return rows;
    }
}
