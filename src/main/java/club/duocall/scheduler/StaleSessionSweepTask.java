/**
 * 此文件定义了一个用于清理失效连接的定时任务。
 *
 * 主要职责:
 * - 定期查找传输层已关闭但仍登记在房间中的会话，并按正常离开处理，
 *   使另一名成员收到`peer_disconnected`，房间不会被永久占满。
 * - 顺带清理握手限流中已过期的计数条目。
 *
 * 关联:
 * - `RoomRegistry`: 提供失效会话列表。
 * - `SignalingRelay`: 执行离开逻辑并通知剩余成员。
 * - `JoinRateLimitInterceptor`: 清理过期计数。
 * - `DuoCallApplication`: 需要有`@EnableScheduling`注解来启用此定时任务。
 */
package club.duocall.scheduler;

import club.duocall.interceptor.JoinRateLimitInterceptor;
import club.duocall.service.RoomRegistry;
import club.duocall.service.SignalingRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class StaleSessionSweepTask {

    private static final Logger logger = LoggerFactory.getLogger(StaleSessionSweepTask.class);

    private final RoomRegistry roomRegistry;
    private final SignalingRelay signalingRelay;
    private final JoinRateLimitInterceptor joinRateLimitInterceptor;

    public StaleSessionSweepTask(RoomRegistry roomRegistry,
                                 SignalingRelay signalingRelay,
                                 JoinRateLimitInterceptor joinRateLimitInterceptor) {
        this.roomRegistry = roomRegistry;
        this.signalingRelay = signalingRelay;
        this.joinRateLimitInterceptor = joinRateLimitInterceptor;
    }

    /**
     * 按`signaling.sweep-interval-ms`的间隔执行。
     *
     * @return 本次清理的失效会话数。
     */
    @Scheduled(fixedDelayString = "${signaling.sweep-interval-ms}", initialDelayString = "${signaling.sweep-interval-ms}")
    public int sweep() {
        var swept = 0;
        try {
            for (var session : roomRegistry.findStaleSessions()) {
                logger.warn("发现已关闭但未清理的会话 {}，按离开处理。", session.getId());
                signalingRelay.depart(session);
                swept++;
            }
            var evicted = joinRateLimitInterceptor.evictExpired();
            if (swept > 0 || evicted > 0) {
                logger.info("定时清理完成: 失效会话 {} 个，过期限流条目 {} 个。", swept, evicted);
            }
        } catch (Exception e) {
            // 捕获并记录所有异常，防止定时任务因未捕获的异常而停止后续执行。
            logger.error("执行失效会话清理任务时发生错误。", e);
        }
        return swept;
    }
}
