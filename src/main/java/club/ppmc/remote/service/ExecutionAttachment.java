/**
 * ExecutionAttachment.java
 *
 * 观看一次执行的句柄：先回放 replay，再从 channel 读取实时输出，直到通道结束。
 *
 * @param replay 加入时刻已捕获的输出。
 * @param channel 实时输出通道；执行结束时关闭。
 */
package club.ppmc.remote.service;

import club.ppmc.remote.util.OutputChannel;

public record ExecutionAttachment(byte[] replay, OutputChannel channel) {}
