/**
 * AppConfig.java
 *
 * 应用级别的基础 Bean 配置。
 * 目前只定义 Gson：同步通知服务用它把树、选区和事件序列化为 JSON 再推送到 WebSocket。
 */
package club.ppmc.visualsync.config;

import club.ppmc.visualsync.model.value.AttributeValue;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonPrimitive;
import com.google.gson.JsonSerializer;
import java.time.Instant;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AppConfig {

    /**
     * 全局 Gson Bean。
     * 属性值按其普通对象形式输出 (字符串、数字、布尔、列表)，时间戳输出为 ISO-8601 字符串，
     * 因为 JDK 17 下无法通过反射读取 java.time 的内部字段。
     *
     * @return 配置好的 Gson 实例。
     */
    @Bean
    public Gson gson() {
        return createGson();
    }

    public static Gson createGson() {
        return new GsonBuilder()
                .registerTypeHierarchyAdapter(
                        AttributeValue.class,
                        (JsonSerializer<AttributeValue>)
                                (value, type, context) -> context.serialize(value.toPlainObject()))
                .registerTypeAdapter(
                        Instant.class,
                        (JsonSerializer<Instant>)
                                (instant, type, context) -> new JsonPrimitive(instant.toString()))
                .serializeNulls()
                .create();
    }
}
