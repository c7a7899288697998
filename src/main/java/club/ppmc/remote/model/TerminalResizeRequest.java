/**
 * TerminalResizeRequest.java
 *
 * 该文件定义了一个DTO，用于从前端向后端传递终端尺寸调整的信息。
 */
package club.ppmc.remote.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * 封装终端尺寸信息的记录。
 *
 * @param cols 终端的列数。
 * @param rows 终端的行数。
 */
public record TerminalResizeRequest(@Min(1) @Max(1000) int cols, @Min(1) @Max(1000) int rows) {}
