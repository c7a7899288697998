/**
 * TerminalSession.java
 *
 * 一个持久化的交互式终端会话。
 * 会话在伪终端中运行一个 shell，由一个专用的读取线程持续读取输出，写入环形缓冲区以供回放，
 * 并以非阻塞方式广播给所有已订阅的客户端。客户端断开不会结束会话，重新连接时可以回放最近的历史输出。
 * 会话由 TerminalSessionManager 创建和管理。
 */
package club.ppmc.remote.service;

import club.ppmc.remote.exception.SessionClosedException;
import club.ppmc.remote.model.TerminalSessionInfo;
import club.ppmc.remote.util.OutputChannel;
import club.ppmc.remote.util.RingBuffer;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TerminalSession {

    static final int READ_CHUNK_SIZE = 4096;

    private final String id;
    private final long userId;
    private final String username;
    private final List<String> shell;
    private final Instant createdAt;
    private final Clock clock;
    private final PtyHandle pty;
    private final RingBuffer buffer;
    private final Duration killGrace;

    private final ReentrantLock inputLock = new ReentrantLock();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Instant lastActivity;

    // 读锁：读取线程追加缓冲区并广播；写锁：订阅、退订与关闭
    private final ReentrantReadWriteLock clientsLock = new ReentrantReadWriteLock();
    private final Map<String, OutputChannel> clients = new HashMap<>();

    // 注册与触发互斥，保证每个监听器恰好执行一次
    private final ReentrantLock listenerLock = new ReentrantLock();
    private final List<Consumer<TerminalSession>> closeListeners = new ArrayList<>();
    private boolean listenersFired;

    TerminalSession(
            String id,
            long userId,
            String username,
            List<String> shell,
            PtyHandle pty,
            int bufferSize,
            Duration killGrace,
            Clock clock) {
        this.id = id;
        this.userId = userId;
        this.username = username;
        this.shell = List.copyOf(shell);
        this.pty = pty;
        this.buffer = new RingBuffer(bufferSize);
        this.killGrace = killGrace;
        this.clock = clock;
        this.createdAt = clock.instant();
        this.lastActivity = createdAt;
    }

    /**
     * 启动后台读取线程。每个会话只调用一次。
     */
    void start(ThreadFactory threadFactory) {
        Thread reader = threadFactory.newThread(this::readLoop);
        reader.setName("terminal-reader-" + id);
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop() {
        byte[] chunkBuffer = new byte[READ_CHUNK_SIZE];
        InputStream in = pty.getInputStream();
        try {
            int read;
            while (!closed.get() && (read = in.read(chunkBuffer)) != -1) {
                if (read > 0) {
                    publish(Arrays.copyOf(chunkBuffer, read));
                }
            }
        } catch (IOException e) {
            if (!closed.get()) {
                log.warn("读取终端会话 {} 的输出时出错: {}", id, e.getMessage());
            }
        } finally {
            log.info("终端会话 {} 的输出流已结束。", id);
            close();
        }
    }

    private void publish(byte[] chunk) {
        clientsLock.readLock().lock();
        try {
            buffer.write(chunk);
            lastActivity = clock.instant();
            for (var entry : clients.entrySet()) {
                if (!entry.getValue().offer(chunk)) {
                    log.debug("客户端 {} 的通道已满，丢弃会话 {} 的一个输出块。", entry.getKey(), id);
                }
            }
        } finally {
            clientsLock.readLock().unlock();
        }
    }

    /**
     * 将客户端输入写入 shell。
     *
     * @throws SessionClosedException 会话已关闭时。
     * @throws IOException 写入伪终端失败时。
     */
    public void write(byte[] data) throws IOException {
        inputLock.lock();
        try {
            if (closed.get()) {
                throw new SessionClosedException(id);
            }
            OutputStream out = pty.getOutputStream();
            out.write(data);
            out.flush();
            lastActivity = clock.instant();
        } finally {
            inputLock.unlock();
        }
    }

    /**
     * 调整伪终端的窗口尺寸。
     */
    public void resize(int columns, int rows) throws IOException {
        inputLock.lock();
        try {
            if (closed.get()) {
                throw new SessionClosedException(id);
            }
            pty.resize(columns, rows);
        } finally {
            inputLock.unlock();
        }
    }

    /**
     * 为客户端注册一个输出通道，并返回当前的历史输出用于回放。
     * 快照与后续推送的数据之间既不遗漏也不重复。
     * 同一客户端ID重复订阅时，旧通道会被关闭并替换；会话已关闭时返回一个已关闭的通道。
     */
    public TerminalSubscription subscribe(String clientId) {
        clientsLock.writeLock().lock();
        try {
            var channel = new OutputChannel();
            byte[] history = buffer.readAll();
            if (closed.get()) {
                channel.close();
                return new TerminalSubscription(clientId, channel, history);
            }
            OutputChannel previous = clients.put(clientId, channel);
            if (previous != null) {
                previous.close();
            }
            log.info("客户端 {} 已订阅终端会话 {}", clientId, id);
            return new TerminalSubscription(clientId, channel, history);
        } finally {
            clientsLock.writeLock().unlock();
        }
    }

    /**
     * 移除并关闭客户端的通道。未知的客户端ID直接忽略。
     */
    public void unsubscribe(String clientId) {
        clientsLock.writeLock().lock();
        try {
            OutputChannel channel = clients.remove(clientId);
            if (channel != null) {
                channel.close();
                log.info("客户端 {} 已退订终端会话 {}", clientId, id);
            }
        } finally {
            clientsLock.writeLock().unlock();
        }
    }

    /**
     * 关闭会话。并发调用时拆除逻辑只执行一次：
     * 关闭所有订阅通道，终止 shell 进程并回收，释放伪终端，随后通知关闭监听器。
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("正在关闭终端会话 {} (用户 {})。", id, username);

        clientsLock.writeLock().lock();
        try {
            clients.values().forEach(OutputChannel::close);
            clients.clear();
        } finally {
            clientsLock.writeLock().unlock();
        }

        try {
            pty.terminate(killGrace);
        } catch (InterruptedException e) {
            log.warn("等待终端会话 {} 的进程退出时被中断。", id);
            Thread.currentThread().interrupt();
        }
        try {
            pty.close();
        } catch (IOException e) {
            log.warn("关闭终端会话 {} 的伪终端时出错: {}", id, e.getMessage());
        }

        List<Consumer<TerminalSession>> toNotify;
        listenerLock.lock();
        try {
            listenersFired = true;
            toNotify = new ArrayList<>(closeListeners);
            closeListeners.clear();
        } finally {
            listenerLock.unlock();
        }
        for (var listener : toNotify) {
            try {
                listener.accept(this);
            } catch (RuntimeException e) {
                log.error("终端会话 {} 的关闭监听器执行失败", id, e);
            }
        }
    }

    /**
     * 注册会话关闭时的回调。会话已关闭时立即执行。
     */
    void onClose(Consumer<TerminalSession> listener) {
        listenerLock.lock();
        try {
            if (!listenersFired) {
                closeListeners.add(listener);
                return;
            }
        } finally {
            listenerLock.unlock();
        }
        listener.accept(this);
    }

    public boolean isClosed() {
        return closed.get();
    }

    public int clientCount() {
        clientsLock.readLock().lock();
        try {
            return clients.size();
        } finally {
            clientsLock.readLock().unlock();
        }
    }

    public Duration idleTime(Instant now) {
        return Duration.between(lastActivity, now);
    }

    public TerminalSessionInfo info() {
        return new TerminalSessionInfo(id, displayName(), createdAt, lastActivity, clientCount(), !isClosed());
    }

    public String displayName() {
        return "Session " + id.substring(Math.max(0, id.length() - 8));
    }

    public String getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    public String getUsername() {
        return username;
    }

    public List<String> getShell() {
        return shell;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getLastActivity() {
        return lastActivity;
    }

    /**
     * 一次订阅的结果。
     *
     * @param clientId 订阅者ID。
     * @param channel 实时输出通道。
     * @param history 订阅时刻的历史输出快照。
     */
    public record TerminalSubscription(String clientId, OutputChannel channel, byte[] history) {}
}
