/**
 * 此文件定义了Spring Web MVC的核心配置。
 *
 * 主要职责:
 * - 为`/api/**`下的监控和配置接口配置CORS (跨域资源共享)。
 *
 * 关联:
 * - `AppProperties`: 从此类型安全的配置类中获取CORS允许的源列表。
 */
package club.duocall.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class WebConfig implements WebMvcConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebConfig.class);

    private static final String API_PATHS_PATTERN = "/api/**";
    private static final String[] ALLOWED_CORS_METHODS = new String[] {"GET", "OPTIONS"};

    private final String[] allowedCorsOrigins;

    public WebConfig(AppProperties appProperties) {
        this.allowedCorsOrigins = appProperties.origins().toArray(new String[0]);
        logger.info("WebConfig初始化。CORS允许的源: {}", appProperties.origins());
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API_PATHS_PATTERN)
                .allowedOrigins(this.allowedCorsOrigins)
                .allowedMethods(ALLOWED_CORS_METHODS)
                .allowedHeaders("*");

        logger.info("CORS映射已配置: 路径[{}], 允许的源[{}], 允许的方法[{}]",
                API_PATHS_PATTERN,
                String.join(", ", this.allowedCorsOrigins),
                String.join(", ", ALLOWED_CORS_METHODS));
    }
}
