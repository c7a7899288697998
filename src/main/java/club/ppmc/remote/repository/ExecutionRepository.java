/**
 * ExecutionRepository.java
 *
 * 执行记录的存取接口。
 */
package club.ppmc.remote.repository;

import club.ppmc.remote.model.Execution;
import java.util.List;
import java.util.Optional;

public interface ExecutionRepository {

    /** 新增或覆盖同ID的记录。 */
    void save(Execution execution);

    Optional<Execution> findById(String id);

    /**
     * 按创建时间倒序分页查询。
     */
    List<Execution> findAll(int limit, int offset);
}
