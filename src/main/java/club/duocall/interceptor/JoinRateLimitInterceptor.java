/**
 * 此文件定义了一个用于限制信令握手频率的拦截器。
 *
 * 主要职责:
 * - 在WebSocket握手之前进行拦截。
 * - 基于客户端IP地址，限制每分钟内可以发起的房间连接次数，减少对房间ID的暴力探测。
 * - 如果超过限制，则中断握手并返回`429 Too Many Requests`响应。
 *
 * 注意: 这只是限流，并不是访问控制。持有房间链接的人仍然可以加入房间。
 *
 * 关联:
 * - `WebSocketConfig`: 此拦截器在此类中被注册。
 * - `RateLimitInfo`: 用于存储每个客户端的握手计数和窗口起点的记录类。
 * - `application.yml`: 从此文件读取每分钟握手次数上限 (`signaling.join.rate-limit-per-minute`)。
 */
package club.duocall.interceptor;

import club.duocall.model.RateLimitInfo;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.ServerHttpRequest;
import org.springframework.http.server.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketHandler;
import org.springframework.web.socket.server.HandshakeInterceptor;

@Component
public class JoinRateLimitInterceptor implements HandshakeInterceptor {

    private static final Logger logger = LoggerFactory.getLogger(JoinRateLimitInterceptor.class);
    private static final String HEADER_X_FORWARDED_FOR = "X-Forwarded-For";
    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Map<String, RateLimitInfo> requestCounts = new ConcurrentHashMap<>();
    private final int limitPerMinute;
    private final Clock clock;

    @Autowired
    public JoinRateLimitInterceptor(@Value("${signaling.join.rate-limit-per-minute}") int limitPerMinute) {
        this(limitPerMinute, Clock.systemUTC());
    }

    JoinRateLimitInterceptor(int limitPerMinute, Clock clock) {
        this.limitPerMinute = limitPerMinute;
        this.clock = clock;
        logger.info("握手限流拦截器初始化，每分钟限制为 {} 次连接。", limitPerMinute);
    }

    @Override
    public boolean beforeHandshake(ServerHttpRequest request, ServerHttpResponse response,
                                   WebSocketHandler wsHandler, Map<String, Object> attributes) {
        var clientId = getClientIdentifier(request);
        var now = clock.instant();

        // 原子地更新或创建客户端的握手计数信息
        var info = requestCounts.compute(clientId, (key, currentInfo) -> {
            if (currentInfo == null || !now.isBefore(currentInfo.windowStart().plus(WINDOW))) {
                return new RateLimitInfo(1, now); // 新窗口或新客户端，重置计数为1
            }
            return new RateLimitInfo(currentInfo.count() + 1, currentInfo.windowStart());
        });

        if (info.count() > limitPerMinute) {
            logger.warn("握手频率超出限制: 客户端ID '{}', 当前窗口内次数 {}, 限制 {}", clientId, info.count(), limitPerMinute);
            response.setStatusCode(HttpStatus.TOO_MANY_REQUESTS);
            return false; // 拒绝握手
        }

        logger.debug("握手允许: 客户端ID '{}', 当前窗口内次数 {}/{}", clientId, info.count(), limitPerMinute);
        return true;
    }

    @Override
    public void afterHandshake(ServerHttpRequest request, ServerHttpResponse response,
                               WebSocketHandler wsHandler, Exception exception) {
        if (exception != null) {
            logger.warn("握手失败 | URI {}: {}", request.getURI(), exception.getMessage());
        }
    }

    /**
     * 移除窗口已过期的计数，防止映射无限增长。
     *
     * @return 被移除的条目数。
     */
    public int evictExpired() {
        var now = clock.instant();
        var before = requestCounts.size();
        requestCounts.entrySet().removeIf(entry -> !now.isBefore(entry.getValue().windowStart().plus(WINDOW)));
        return before - requestCounts.size();
    }

    /**
     * 获取客户端标识符，优先使用代理服务器设置的头信息，最后回退到直接连接的IP地址。
     */
    private String getClientIdentifier(ServerHttpRequest request) {
        var ip = request.getHeaders().getFirst(HEADER_X_FORWARDED_FOR);
        if (ip != null && !ip.isBlank() && !"unknown".equalsIgnoreCase(ip)) {
            // 如果`X-Forwarded-For`包含多个IP，第一个通常是原始客户端IP
            return ip.split(",")[0].trim();
        }
        var remote = request.getRemoteAddress();
        return remote != null && remote.getAddress() != null ? remote.getAddress().getHostAddress() : "unknown";
    }
}
