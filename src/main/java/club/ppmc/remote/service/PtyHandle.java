/**
 * PtyHandle.java
 *
 * 一个挂在伪终端上的子进程。TerminalSession 独占持有它：
 * 从 getInputStream() 读取终端输出，向 getOutputStream() 写入键盘输入。
 */
package club.ppmc.remote.service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

public interface PtyHandle {

    InputStream getInputStream();

    OutputStream getOutputStream();

    void resize(int columns, int rows) throws IOException;

    long pid();

    boolean isAlive();

    /**
     * 终止进程：先发送终止信号，在宽限时间内等待退出，超时后强制结束进程及其子进程，最后回收进程。
     * 进程已经退出时直接返回。
     */
    void terminate(Duration grace) throws InterruptedException;

    /** 释放伪终端的文件句柄。 */
    void close() throws IOException;
}
