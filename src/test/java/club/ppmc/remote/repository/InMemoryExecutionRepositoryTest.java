package club.ppmc.remote.repository;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.remote.model.Execution;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class InMemoryExecutionRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    @Test
    void saveReplacesRecordWithSameId() {
        var repository = new InMemoryExecutionRepository();
        Execution pending = Execution.pending("e1", "c1", 1, T0);

        repository.save(pending);
        repository.save(pending.running(T0));

        assertThat(repository.findAll(10, 0)).hasSize(1);
        assertThat(repository.findById("e1")).hasValueSatisfying(e -> assertThat(e.startedAt()).isEqualTo(T0));
    }

    @Test
    void ordersByCreationTimeNewestFirstWithStableTieBreak() {
        var repository = new InMemoryExecutionRepository();
        repository.save(Execution.pending("b", "c1", 1, T0));
        repository.save(Execution.pending("a", "c1", 1, T0));
        repository.save(Execution.pending("z", "c1", 1, T0.plusSeconds(1)));

        assertThat(repository.findAll(10, 0)).extracting(Execution::id).containsExactly("z", "a", "b");
        assertThat(repository.findAll(1, 2)).extracting(Execution::id).containsExactly("b");
        assertThat(repository.findAll(0, 0)).isEmpty();
    }
}
