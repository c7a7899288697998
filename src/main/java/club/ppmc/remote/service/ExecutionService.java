/**
 * ExecutionService.java
 *
 * 命令执行引擎。
 * createExecution() 只创建一条 pending 记录并立即返回；execute() 应由调用方放到后台线程中运行，
 * 它启动 {@code sh -c <command>}，在截止时间内逐块读取合并后的标准输出和错误输出，
 * 并在进程结束或超时后一次性提交终态记录。执行期间的输出通过 ExecutionOutput 推送给观看者。
 * 每条执行记录只有执行它的那个线程会修改，因此不需要额外的同步。
 */
package club.ppmc.remote.service;

import club.ppmc.remote.exception.NotFoundException;
import club.ppmc.remote.model.Command;
import club.ppmc.remote.model.Execution;
import club.ppmc.remote.model.ExecutionSettings;
import club.ppmc.remote.model.ExecutionStatus;
import club.ppmc.remote.repository.CommandRepository;
import club.ppmc.remote.repository.ExecutionRepository;
import club.ppmc.remote.util.OutputChannel;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Service
@Slf4j
public class ExecutionService {

    static final int DEFAULT_PAGE_SIZE = 50;
    private static final int READ_CHUNK_SIZE = 4096;

    private final CommandRepository commandRepository;
    private final ExecutionRepository executionRepository;
    private final ExecutionSettings settings;
    private final Clock clock;

    private final Map<String, ExecutionOutput> outputs = new ConcurrentHashMap<>();
    private final Map<String, Process> processes = new ConcurrentHashMap<>();
    private final Set<String> claimed = ConcurrentHashMap.newKeySet();
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService executor = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "execution-worker-" + threadCounter.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    public ExecutionService(
            CommandRepository commandRepository,
            ExecutionRepository executionRepository,
            ExecutionSettings settings,
            Clock clock) {
        this.commandRepository = commandRepository;
        this.executionRepository = executionRepository;
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * 为命令创建一条 pending 状态的执行记录。不会同步执行任何东西。
     *
     * @throws NotFoundException 命令不存在。
     */
    public Execution createExecution(String commandId, long userId) {
        commandRepository.findById(commandId).orElseThrow(() -> NotFoundException.command(commandId));

        var execution = Execution.pending(UUID.randomUUID().toString(), commandId, userId, clock.instant());
        outputs.put(execution.id(), new ExecutionOutput(settings.getMaxOutputSize()));
        executionRepository.save(execution);
        log.info("已为命令 {} 创建执行 {} (用户 {})", commandId, execution.id(), userId);
        return execution;
    }

    /**
     * 在引擎的工作线程上执行。
     *
     * @return 一个在终态记录提交后完成的 CompletableFuture。
     */
    public CompletableFuture<Execution> executeAsync(String executionId) {
        return CompletableFuture.supplyAsync(() -> execute(executionId), executor);
    }

    /**
     * 运行一条 pending 状态的执行，阻塞到进程结束或超时，返回终态记录。
     *
     * @throws NotFoundException 执行记录不存在。
     * @throws IllegalStateException 执行不是 pending 状态，或已被另一个线程接管。
     */
    public Execution execute(String executionId) {
        Execution execution = getExecutionById(executionId);
        if (execution.status() != ExecutionStatus.PENDING || !claimed.add(executionId)) {
            throw new IllegalStateException(
                    String.format("执行 %s 的状态为 %s，不能再次执行", executionId, execution.status().value()));
        }

        ExecutionOutput output =
                outputs.computeIfAbsent(executionId, key -> new ExecutionOutput(settings.getMaxOutputSize()));
        log.info("开始执行 {}", executionId);
        try {
            Execution finished = run(execution, output);
            log.info("执行 {} 已结束，状态={}，退出码={}", executionId, finished.status().value(), finished.exitCode());
            return finished;
        } finally {
            // 终态记录已提交，此后加入的观看者直接从记录中回放
            output.finish();
            outputs.remove(executionId, output);
            claimed.remove(executionId);
        }
    }

    private Execution run(Execution pending, ExecutionOutput output) {
        Execution running = pending.running(clock.instant());
        executionRepository.save(running);

        Command command = commandRepository.findById(running.commandId()).orElse(null);
        if (command == null) {
            return fail(running, output, "command not found: " + running.commandId());
        }

        Path workingDir = resolveWorkingDirectory(command);
        if (!Files.isDirectory(workingDir)) {
            return fail(running, output, "Working directory does not exist: " + workingDir);
        }

        int timeoutSeconds = settings.effectiveTimeoutSeconds(command.timeoutSeconds());
        log.info("在目录 {} 中运行命令 '{}' (执行 {}，超时 {} 秒)", workingDir, command.name(), running.id(), timeoutSeconds);

        Process process;
        try {
            process = new ProcessBuilder("sh", "-c", command.command())
                    .directory(workingDir.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.error("启动执行 {} 的进程失败", running.id(), e);
            return fail(running, output, "failed to start command: " + e.getMessage());
        }
        processes.put(running.id(), process);

        try {
            CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> pump(running.id(), process, output), executor);

            boolean exited;
            try {
                exited = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("执行 {} 在等待进程时被中断，将终止进程。", running.id());
                kill(process);
                awaitReader(running.id(), process, reader);
                return fail(running, output, "execution interrupted");
            }

            if (!exited) {
                log.warn("执行 {} 超过 {} 秒未结束，将强制终止。", running.id(), timeoutSeconds);
                kill(process);
                awaitReader(running.id(), process, reader);
                return commit(running.finish(
                        ExecutionStatus.TIMEOUT, output.snapshot(), output.isTruncated(), null, clock.instant()));
            }

            awaitReader(running.id(), process, reader);
            int exitCode = process.exitValue();
            ExecutionStatus status = exitCode == 0 ? ExecutionStatus.SUCCESS : ExecutionStatus.FAILED;
            return commit(running.finish(status, output.snapshot(), output.isTruncated(), exitCode, clock.instant()));
        } finally {
            processes.remove(running.id());
        }
    }

    private void pump(String executionId, Process process, ExecutionOutput output) {
        byte[] buffer = new byte[READ_CHUNK_SIZE];
        try (InputStream in = process.getInputStream()) {
            int read;
            while ((read = in.read(buffer)) != -1) {
                output.append(buffer, 0, read);
            }
        } catch (IOException e) {
            // 进程被强制终止时读取流会抛出异常，这是正常现象
            log.debug("读取执行 {} 的输出流时出错: {}", executionId, e.getMessage());
        }
    }

    // 进程已退出后等待输出读完；若有遗留的子进程仍占着管道，超过宽限时间后关闭流
    private void awaitReader(String executionId, Process process, CompletableFuture<Void> reader) {
        try {
            reader.get(settings.getKillGraceMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("执行 {} 的输出流在进程结束后仍未关闭，将强制关闭。", executionId);
            closeQuietly(executionId, process);
        } catch (ExecutionException e) {
            log.warn("执行 {} 的输出读取线程异常结束", executionId, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(executionId, process);
        }
    }

    private void closeQuietly(String executionId, Process process) {
        try {
            process.getInputStream().close();
        } catch (IOException e) {
            log.warn("关闭执行 {} 的输出流时出错: {}", executionId, e.getMessage());
        }
    }

    private void kill(Process process) {
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
        try {
            if (!process.waitFor(settings.getKillGraceMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("进程 PID {} 在强制终止后仍未退出。", process.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Execution fail(Execution running, ExecutionOutput output, String message) {
        log.warn("执行 {} 失败: {}", running.id(), message);
        byte[] bytes = message.getBytes(StandardCharsets.UTF_8);
        output.append(bytes, 0, bytes.length);
        return commit(running.finish(ExecutionStatus.FAILED, output.snapshot(), output.isTruncated(), -1, clock.instant()));
    }

    private Execution commit(Execution finished) {
        executionRepository.save(finished);
        return finished;
    }

    private static Path resolveWorkingDirectory(Command command) {
        if (!StringUtils.hasText(command.workingDir())) {
            return Paths.get(System.getProperty("user.dir"));
        }
        return Paths.get(command.workingDir()).toAbsolutePath().normalize();
    }

    /**
     * 开始观看一次执行：返回已有输出的快照和实时输出通道。
     * 执行已结束时，返回记录中保存的输出和一个已关闭的通道。
     *
     * @throws NotFoundException 执行记录不存在。
     */
    public ExecutionAttachment attach(String executionId) {
        ExecutionOutput output = outputs.get(executionId);
        if (output != null) {
            return output.attach();
        }
        Execution execution = getExecutionById(executionId);
        var closed = new OutputChannel();
        closed.close();
        return new ExecutionAttachment(execution.outputBytes(), closed);
    }

    public void detach(String executionId, OutputChannel channel) {
        ExecutionOutput output = outputs.get(executionId);
        if (output != null) {
            output.detach(channel);
        } else {
            channel.close();
        }
    }

    /**
     * @throws NotFoundException 执行记录不存在。
     */
    public Execution getExecutionById(String executionId) {
        return executionRepository.findById(executionId).orElseThrow(() -> NotFoundException.execution(executionId));
    }

    /**
     * 按创建时间倒序分页查询。limit 小于等于 0 时使用默认的 50 条。
     */
    public List<Execution> getExecutions(int limit, int offset) {
        return executionRepository.findAll(limit <= 0 ? DEFAULT_PAGE_SIZE : limit, Math.max(0, offset));
    }

    @PreDestroy
    public void shutdown() {
        log.info("正在关闭 ExecutionService，将终止 {} 个运行中的进程。", processes.size());
        processes.values().forEach(process -> {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
        });
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("执行线程池未能在 5 秒内结束。");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
