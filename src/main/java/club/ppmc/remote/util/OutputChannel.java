/**
 * OutputChannel.java
 *
 * 单个订阅者的有界输出通道。
 * 生产者（会话或执行的读取线程）通过 offer() 以非阻塞方式投递数据块，通道满时直接丢弃该块，
 * 保证生产者永远不会因为慢速的消费者而被阻塞。消费者在通道关闭后仍可读完剩余数据，随后收到流结束信号。
 */
package club.ppmc.remote.util;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

public class OutputChannel {

    public static final int DEFAULT_CAPACITY = 256;

    private static final byte[] END_OF_STREAM = new byte[0];

    private final int capacity;
    // 预留一个位置给结束标记，close() 时一定能放入
    private final BlockingQueue<byte[]> queue;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean finished;

    public OutputChannel() {
        this(DEFAULT_CAPACITY);
    }

    public OutputChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("通道容量必须大于 0: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity + 1);
    }

    /**
     * 非阻塞投递。调用方需保证同一通道上的 offer() 与 close() 是串行的。
     *
     * @return 投递成功返回 true；通道已满或已关闭时丢弃并返回 false。
     */
    public boolean offer(byte[] chunk) {
        if (closed.get() || queue.size() >= capacity) {
            dropped.incrementAndGet();
            return false;
        }
        return queue.offer(chunk);
    }

    /**
     * 关闭通道。幂等。
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.offer(END_OF_STREAM);
        }
    }

    /**
     * 阻塞等待下一个数据块。
     *
     * @return 数据块；流结束时返回 null。
     */
    public byte[] take() throws InterruptedException {
        if (finished) {
            return null;
        }
        return unwrap(queue.take());
    }

    /**
     * 在给定时间内等待下一个数据块。
     *
     * @return 数据块；超时或流结束时返回 null，两者可通过 {@link #isFinished()} 区分。
     */
    public byte[] poll(Duration timeout) throws InterruptedException {
        if (finished) {
            return null;
        }
        byte[] chunk = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        return chunk == null ? null : unwrap(chunk);
    }

    private byte[] unwrap(byte[] chunk) {
        if (chunk == END_OF_STREAM) {
            finished = true;
            return null;
        }
        return chunk;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /** 消费者已读到流结束标记。 */
    public boolean isFinished() {
        return finished;
    }

    /** 因通道已满或已关闭而被丢弃的数据块数量。 */
    public long droppedChunks() {
        return dropped.get();
    }

    public int pending() {
        int size = queue.size();
        return closed.get() && !finished ? Math.max(0, size - 1) : size;
    }
}
