/**
 * 此文件定义了信令服务的类型安全配置。
 *
 * 关联:
 * - `RoomSignalingHandler`: 使用发送超时和发送缓冲区上限包装每个会话。
 * - `CallConfigController`: 将NAT穿透服务器列表提供给客户端。
 * - `application.yml`: 以 "signaling" 为前缀的配置项。
 */
package club.duocall.config;

import club.duocall.dto.IceServer;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param iceServers       提供给客户端的STUN/TURN服务器。
 * @param sendTimeLimitMs  向单个会话发送一条消息允许的最长时间。
 * @param sendBufferSizeKb 单个会话待发送消息缓冲区的上限。
 */
@ConfigurationProperties(prefix = "signaling")
public record SignalingProperties(
        List<IceServer> iceServers,
        @DefaultValue("10000") int sendTimeLimitMs,
        @DefaultValue("512") int sendBufferSizeKb) {

    public SignalingProperties {
        iceServers = iceServers == null ? List.of() : List.copyOf(iceServers);
    }
}
