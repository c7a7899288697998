/**
 * CommandRepository.java
 *
 * 命令定义的查询接口。命令的持久化由外部系统负责，执行引擎只通过该接口按ID查找命令。
 */
package club.ppmc.remote.repository;

import club.ppmc.remote.model.Command;
import java.util.Optional;

public interface CommandRepository {

    Optional<Command> findById(String id);
}
