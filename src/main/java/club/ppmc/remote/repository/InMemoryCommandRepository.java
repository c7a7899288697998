/**
 * InMemoryCommandRepository.java
 *
 * 基于内存的命令定义存储。
 * 启动时如果 remote.commands-file 指向的JSON文件存在，则从中加载命令列表；
 * 文件不存在时以空列表启动。文件格式为命令对象的数组，字段见 {@link Command}。
 */
package club.ppmc.remote.repository;

import club.ppmc.remote.model.Command;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
@Slf4j
public class InMemoryCommandRepository implements CommandRepository {

    private final Map<String, Command> commands = new ConcurrentHashMap<>();
    private final String commandsFile;
    private final ObjectMapper objectMapper =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public InMemoryCommandRepository(@Value("${remote.commands-file:}") String commandsFile) {
        this.commandsFile = commandsFile;
    }

    @PostConstruct
    public void init() {
        if (!StringUtils.hasText(commandsFile)) {
            return;
        }
        Path path = Paths.get(commandsFile).toAbsolutePath().normalize();
        if (Files.notExists(path)) {
            log.info("未找到命令文件 {}，将以空命令列表启动。", path);
            return;
        }
        try {
            load(path);
        } catch (IOException e) {
            throw new IllegalStateException("读取命令文件失败: " + path, e);
        }
    }

    void load(Path path) throws IOException {
        List<Command> loaded = objectMapper.readValue(Files.readAllBytes(path), new TypeReference<>() {});
        loaded.forEach(this::save);
        log.info("已从 {} 加载 {} 条命令。", path, loaded.size());
    }

    public void save(Command command) {
        if (!StringUtils.hasText(command.id())) {
            throw new IllegalArgumentException("命令ID不能为空");
        }
        commands.put(command.id(), command);
    }

    @Override
    public Optional<Command> findById(String id) {
        return Optional.ofNullable(commands.get(id));
    }
}
