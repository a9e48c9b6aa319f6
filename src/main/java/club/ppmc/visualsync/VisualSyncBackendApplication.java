/**
 * VisualSyncBackendApplication.java
 *
 * Spring Boot 应用的主入口类。
 * @EnableWebSocketMessageBroker 注解用于启用 WebSocket 和 STOMP 消息代理，同步通知通过它推送到前端。
 */
package club.ppmc.visualsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;

@SpringBootApplication
@EnableWebSocketMessageBroker
public class VisualSyncBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(VisualSyncBackendApplication.class, args);
    }
}
