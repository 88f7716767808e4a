/**
 * 此文件定义了WebSocket连接的Spring配置。
 *
 * 主要职责:
 * - 启用WebSocket支持 (`@EnableWebSocket`)。
 * - 注册`RoomSignalingHandler`来处理`/ws/video/{room}/`路径上的信令连接，并挂载握手限流拦截器。
 * - 配置WebSocket服务器的底层参数，如缓冲区大小和会话超时时间。
 *
 * 关联:
 * - `RoomSignalingHandler`: 在此被注册为WebSocket消息处理器。
 * - `JoinRateLimitInterceptor`: 在握手阶段限制同一客户端的连接频率。
 * - `AppProperties`: 从此类型安全的配置类中获取WebSocket允许的源列表。
 */
package club.duocall.config;

import club.duocall.handler.RoomSignalingHandler;
import club.duocall.interceptor.JoinRateLimitInterceptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

@Configuration
@EnableWebSocket
@EnableConfigurationProperties({AppProperties.class, SignalingProperties.class})
public class WebSocketConfig implements WebSocketConfigurer {

    private static final Logger logger = LoggerFactory.getLogger(WebSocketConfig.class);
    // 同时接受带和不带结尾斜杠的房间路径
    private static final String[] ROOM_PATHS = {"/ws/video/*", "/ws/video/*/"};
    private static final int KB_TO_BYTES = 1024;
    private static final long MIN_TO_MS = 60 * 1000L;

    private final RoomSignalingHandler roomSignalingHandler;
    private final JoinRateLimitInterceptor joinRateLimitInterceptor;
    private final String[] allowedOrigins;
    private final int maxTextMessageBufferSize;
    private final int maxBinaryMessageBufferSize;
    private final long maxSessionIdleTimeoutMs;

    public WebSocketConfig(
            RoomSignalingHandler roomSignalingHandler,
            JoinRateLimitInterceptor joinRateLimitInterceptor,
            AppProperties appProperties,
            @Value("${websocket.max.text-buffer-size-kb}") int maxTextMessageBufferSizeKb,
            @Value("${websocket.max.binary-buffer-size-kb}") int maxBinaryMessageBufferSizeKb,
            @Value("${websocket.max.session-timeout-min}") long maxSessionIdleTimeoutMin) {

        this.roomSignalingHandler = roomSignalingHandler;
        this.joinRateLimitInterceptor = joinRateLimitInterceptor;
        this.allowedOrigins = appProperties.origins().toArray(new String[0]);
        this.maxTextMessageBufferSize = maxTextMessageBufferSizeKb * KB_TO_BYTES;
        this.maxBinaryMessageBufferSize = maxBinaryMessageBufferSizeKb * KB_TO_BYTES;
        this.maxSessionIdleTimeoutMs = maxSessionIdleTimeoutMin * MIN_TO_MS;

        logger.info("WebSocketConfig初始化。信令路径: {}, 允许的源: {}",
                String.join(", ", ROOM_PATHS), appProperties.origins());
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(roomSignalingHandler, ROOM_PATHS)
                .addInterceptors(joinRateLimitInterceptor)
                .setAllowedOrigins(this.allowedOrigins);
        logger.info("已为路径'{}'注册RoomSignalingHandler。", String.join(", ", ROOM_PATHS));
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer() {
        var container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(this.maxTextMessageBufferSize);
        container.setMaxBinaryMessageBufferSize(this.maxBinaryMessageBufferSize);
        container.setMaxSessionIdleTimeout(this.maxSessionIdleTimeoutMs);
        logger.info(
                "WebSocket容器已配置: MaxTextSize[{} B], MaxBinarySize[{} B], IdleTimeout[{} ms]",
                this.maxTextMessageBufferSize,
                this.maxBinaryMessageBufferSize,
                this.maxSessionIdleTimeoutMs);
        return container;
    }
}
