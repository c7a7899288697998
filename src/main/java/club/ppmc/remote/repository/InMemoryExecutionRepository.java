/**
 * InMemoryExecutionRepository.java
 *
 * 基于内存的执行记录存储，作为默认实现。
 */
package club.ppmc.remote.repository;

import club.ppmc.remote.model.Execution;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    @Override
    public void save(Execution execution) {
        executions.put(execution.id(), execution);
    }

    @Override
    public Optional<Execution> findById(String id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public List<Execution> findAll(int limit, int offset) {
        return executions.values().stream()
                .sorted(Comparator.comparing(Execution::createdAt).reversed().thenComparing(Execution::id))
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }
}
