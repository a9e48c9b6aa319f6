/**
 * WebConfig.java
 *
 * 全局 Spring Web MVC 配置，负责跨域资源共享 (CORS)。
 * 可视化编辑器前端通常运行在另一个端口上，需要跨域访问 /api 下的同步端点。
 */
package club.ppmc.visualsync.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns("*") // 与 allowCredentials(true) 兼容，不能使用 allowedOrigins("*")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true);
    }
}
