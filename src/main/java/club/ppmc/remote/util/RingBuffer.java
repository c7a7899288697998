/**
 * RingBuffer.java
 *
 * 固定容量的环形字节缓冲区，用于保存终端输出历史，供新连接的客户端回放。
 * 缓冲区写满后，每写入一个新字节就淘汰最旧的一个字节（严格的先进先出）。
 */
package club.ppmc.remote.util;

import java.util.concurrent.locks.ReentrantLock;

public class RingBuffer {

    private final byte[] data;
    private final ReentrantLock lock = new ReentrantLock();
    private int start;
    private int end;
    private boolean full;

    public RingBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("容量必须大于 0: " + capacity);
        }
        this.data = new byte[capacity];
    }

    public void write(byte[] bytes) {
        write(bytes, 0, bytes.length);
    }

    /**
     * 追加数据。已满时每个新字节覆盖最旧的字节，永不失败。
     */
    public void write(byte[] bytes, int offset, int length) {
        lock.lock();
        try {
            for (int i = offset; i < offset + length; i++) {
                data[end] = bytes[i];
                end = (end + 1) % data.length;
                if (full) {
                    start = (start + 1) % data.length;
                }
                if (end == start) {
                    full = true;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 按写入顺序返回当前内容的副本（最旧的字节在前）。
     *
     * @return 内容副本；从未写入时返回空数组。
     */
    public byte[] readAll() {
        lock.lock();
        try {
            int size = sizeUnlocked();
            byte[] result = new byte[size];
            if (size == 0) {
                return result;
            }
            if (start < end) {
                System.arraycopy(data, start, result, 0, size);
            } else {
                int tail = data.length - start;
                System.arraycopy(data, start, result, 0, tail);
                System.arraycopy(data, 0, result, tail, end);
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return sizeUnlocked();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return data.length;
    }

    private int sizeUnlocked() {
        if (full) {
            return data.length;
        }
        return end >= start ? end - start : data.length - start + end;
    }
}
