/**
 * TerminalSessionManager.java
 *
 * 该服务负责管理所有持久化终端会话的生命周期。
 * 它维护会话ID到会话的注册表，以及用户ID到其会话ID列表的索引，两者由同一把读写锁保护，
 * 因此创建、关闭和空闲清理不会让两者出现不一致的中间状态。
 * 每个用户的活动会话数受配置上限约束；超过空闲时间的会话会被定期清理。
 */
package club.ppmc.remote.service;

import club.ppmc.remote.exception.NotFoundException;
import club.ppmc.remote.exception.QuotaExceededException;
import club.ppmc.remote.exception.SpawnFailedException;
import club.ppmc.remote.model.TerminalSettings;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class TerminalSessionManager {

    private final TerminalSettings settings;
    private final PtySpawner spawner;
    private final Clock clock;
    private final ThreadFactory readerThreadFactory = Executors.defaultThreadFactory();
    private final ScheduledExecutorService sweepScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        Thread thread = new Thread(runnable, "terminal-session-sweeper");
        thread.setDaemon(true);
        return thread;
    });

    private final ExecutorService closer = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "terminal-closer");
        thread.setDaemon(true);
        return thread;
    });

    // 两个结构构成一个整体不变式，只能在同一把锁下修改
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, TerminalSession> sessions = new HashMap<>();
    private final Map<Long, List<String>> userSessions = new HashMap<>();

    public TerminalSessionManager(TerminalSettings settings, PtySpawner spawner, Clock clock) {
        this.settings = settings;
        this.spawner = spawner;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        long intervalMillis = settings.getSweepInterval().toMillis();
        sweepScheduler.scheduleAtFixedRate(this::runSweep, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        log.info("终端会话管理器已启动。每用户最多 {} 个会话，空闲超时 {}，清理间隔 {}。",
                settings.getMaxSessionsPerUser(), settings.getSessionTtl(), settings.getSweepInterval());
    }

    /**
     * 为用户创建一个新的终端会话，并启动其读取线程。
     *
     * @throws QuotaExceededException 用户的活动会话数已达上限。
     * @throws SpawnFailedException shell 进程无法启动。此时注册表保持不变。
     */
    public TerminalSession createSession(long userId, String username) {
        lock.writeLock().lock();
        try {
            List<String> owned = userSessions.getOrDefault(userId, List.of());
            if (owned.size() >= settings.getMaxSessionsPerUser()) {
                log.warn("用户 {} 的终端会话数已达上限 {}，拒绝创建。", username, settings.getMaxSessionsPerUser());
                throw new QuotaExceededException(userId, settings.getMaxSessionsPerUser());
            }

            String sessionId = "term-" + userId + "-" + UUID.randomUUID().toString().replace("-", "");
            PtyHandle pty;
            try {
                pty = spawner.spawn(settings.command(), buildEnvironment(), resolveWorkingDirectory());
            } catch (IOException | RuntimeException e) {
                log.error("为用户 {} 启动终端进程失败: {}", username, e.getMessage());
                throw new SpawnFailedException("failed to start PTY: " + e.getMessage(), e);
            }

            var session = new TerminalSession(
                    sessionId,
                    userId,
                    username,
                    settings.command(),
                    pty,
                    settings.getBufferSize(),
                    settings.getKillGrace(),
                    clock);
            sessions.put(sessionId, session);
            userSessions.computeIfAbsent(userId, key -> new ArrayList<>()).add(sessionId);
            session.onClose(closed -> deregister(closed));
            session.start(readerThreadFactory);

            log.info("已为用户 {} 创建终端会话 {} (PID {})", username, sessionId, pty.pid());
            return session;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<TerminalSession> getSession(String sessionId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(sessions.get(sessionId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<TerminalSession> getUserSessions(long userId) {
        lock.readLock().lock();
        try {
            var result = new ArrayList<TerminalSession>();
            for (String id : userSessions.getOrDefault(userId, List.of())) {
                TerminalSession session = sessions.get(id);
                if (session != null) {
                    result.add(session);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 关闭并移除会话。
     *
     * @throws NotFoundException 会话不存在。
     */
    public void closeSession(String sessionId) {
        TerminalSession session;
        lock.writeLock().lock();
        try {
            session = sessions.get(sessionId);
            if (session == null) {
                throw NotFoundException.session(sessionId);
            }
            removeUnlocked(session);
        } finally {
            lock.writeLock().unlock();
        }
        session.close();
        log.info("已关闭终端会话 {}", sessionId);
    }

    /**
     * 关闭并移除所有空闲时间超过 TTL 的会话。
     *
     * @return 被清理的会话数量。
     */
    public int sweepIdleSessions() {
        Instant now = clock.instant();
        var expired = new ArrayList<TerminalSession>();
        lock.writeLock().lock();
        try {
            for (TerminalSession session : sessions.values()) {
                if (session.idleTime(now).compareTo(settings.getSessionTtl()) > 0) {
                    expired.add(session);
                }
            }
            expired.forEach(this::removeUnlocked);
        } finally {
            lock.writeLock().unlock();
        }
        expired.forEach(session ->
                log.info("清理用户 {} 的过期终端会话 {}", session.getUsername(), session.getId()));
        closeAll(expired);
        return expired.size();
    }

    private void runSweep() {
        try {
            int evicted = sweepIdleSessions();
            if (evicted > 0) {
                log.info("本轮空闲清理移除了 {} 个终端会话。", evicted);
            }
        } catch (RuntimeException e) {
            log.error("清理空闲终端会话时出错", e);
        }
    }

    /** 所有用户的活动会话总数。系统只限制每个用户的会话数，不限制总数。 */
    public int sessionCount() {
        lock.readLock().lock();
        try {
            return sessions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 TerminalSessionManager。将销毁所有活动的终端会话。");
        sweepScheduler.shutdownNow();
        List<TerminalSession> all;
        lock.writeLock().lock();
        try {
            all = new ArrayList<>(sessions.values());
            sessions.clear();
            userSessions.clear();
        } finally {
            lock.writeLock().unlock();
        }
        closeAll(all);
        closer.shutdown();
    }

    // 并行关闭，每个会话的宽限等待互不叠加
    private void closeAll(List<TerminalSession> toClose) {
        if (toClose.size() == 1) {
            toClose.get(0).close();
            return;
        }
        CompletableFuture<?>[] closing = toClose.stream()
                .map(session -> CompletableFuture.runAsync(session::close, closer))
                .toArray(CompletableFuture[]::new);
        try {
            CompletableFuture.allOf(closing).join();
        } catch (CompletionException e) {
            log.error("关闭终端会话时出错", e.getCause());
        }
    }

    // 会话因进程退出而自行关闭时，从注册表中移除
    private void deregister(TerminalSession session) {
        lock.writeLock().lock();
        try {
            if (sessions.get(session.getId()) == session) {
                removeUnlocked(session);
                log.info("终端会话 {} 已结束，已从注册表移除。", session.getId());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void removeUnlocked(TerminalSession session) {
        sessions.remove(session.getId());
        List<String> owned = userSessions.get(session.getUserId());
        if (owned != null) {
            owned.remove(session.getId());
            if (owned.isEmpty()) {
                userSessions.remove(session.getUserId());
            }
        }
    }

    private Map<String, String> buildEnvironment() {
        var env = new HashMap<>(System.getenv());
        env.put("TERM", "xterm-256color");
        env.putAll(settings.getEnv());
        return env;
    }

    private Path resolveWorkingDirectory() {
        if (StringUtils.hasText(settings.getWorkingDir())) {
            return Paths.get(settings.getWorkingDir()).toAbsolutePath().normalize();
        }
        return Paths.get(System.getProperty("user.home"));
    }
}
