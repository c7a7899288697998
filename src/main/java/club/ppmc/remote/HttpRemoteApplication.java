/**
 * HttpRemoteApplication.java
 *
 * Spring Boot 应用的主入口类。
 * 负责启动远程命令执行服务与持久化终端会话服务。
 * WebSocket 端点由 WebSocketConfig 中的 @EnableWebSocket 启用。
 */
package club.ppmc.remote;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HttpRemoteApplication {

    public static void main(String[] args) {
        SpringApplication.run(HttpRemoteApplication.class, args);
    }
}
