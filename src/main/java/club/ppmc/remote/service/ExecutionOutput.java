/**
 * ExecutionOutput.java
 *
 * 单次执行的输出累加器，同时负责把新输出推送给正在观看的客户端。
 * 只有执行该命令的线程会调用 append()，累加的字节数不超过配置上限，超出部分被静默丢弃并标记为已截断。
 * 新加入的观看者先拿到已累加内容的快照，再切换到实时输出；快照与实时数据来自同一个按追加顺序的来源，
 * 既不遗漏也不重复。
 */
package club.ppmc.remote.service;

import club.ppmc.remote.util.OutputChannel;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

public class ExecutionOutput {

    private final int maxSize;
    private final ReentrantLock lock = new ReentrantLock();
    private final ByteArrayOutputStream captured = new ByteArrayOutputStream();
    private final List<OutputChannel> channels = new ArrayList<>();
    private boolean truncated;
    private boolean finished;

    public ExecutionOutput(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("输出上限不能为负数: " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /**
     * 追加一段输出。超出上限的字节被丢弃，不会报错。
     *
     * @return 实际被捕获的字节数。
     */
    public int append(byte[] bytes, int offset, int length) {
        lock.lock();
        try {
            if (finished) {
                return 0;
            }
            int accepted = Math.min(length, maxSize - captured.size());
            if (accepted < length) {
                truncated = true;
            }
            if (accepted <= 0) {
                return 0;
            }
            captured.write(bytes, offset, accepted);
            byte[] chunk = new byte[accepted];
            System.arraycopy(bytes, offset, chunk, 0, accepted);
            for (OutputChannel channel : channels) {
                channel.offer(chunk);
            }
            return accepted;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 注册一个观看者。执行已结束时返回完整输出和一个已关闭的通道。
     */
    public ExecutionAttachment attach() {
        lock.lock();
        try {
            var channel = new OutputChannel();
            if (finished) {
                channel.close();
            } else {
                channels.add(channel);
            }
            return new ExecutionAttachment(captured.toByteArray(), channel);
        } finally {
            lock.unlock();
        }
    }

    public void detach(OutputChannel channel) {
        lock.lock();
        try {
            if (channels.remove(channel)) {
                channel.close();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 标记输出结束并关闭所有观看者的通道。幂等。
     */
    public void finish() {
        lock.lock();
        try {
            if (finished) {
                return;
            }
            finished = true;
            channels.forEach(OutputChannel::close);
            channels.clear();
        } finally {
            lock.unlock();
        }
    }

    public byte[] snapshot() {
        lock.lock();
        try {
            return captured.toByteArray();
        } finally {
            lock.unlock();
        }
    }

    public boolean isTruncated() {
        lock.lock();
        try {
            return truncated;
        } finally {
            lock.unlock();
        }
    }

    public boolean isFinished() {
        lock.lock();
        try {
            return finished;
        } finally {
            lock.unlock();
        }
    }

    public int viewerCount() {
        lock.lock();
        try {
            return channels.size();
        } finally {
            lock.unlock();
        }
    }
}
