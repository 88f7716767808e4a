/**
 * 此文件定义了NAT穿透辅助服务器 (STUN/TURN) 的配置项。
 *
 * 既用于服务端`application.yml`中`signaling.ice-servers`的绑定，
 * 也作为客户端创建对等连接时传给底层传输库的配置。
 *
 * 关联:
 * - `SignalingProperties`: 以列表形式持有此记录。
 * - `CallConfigController`: 通过`/api/call/ice-servers`对外提供。
 * - `PeerConnectionConfiguration`: 客户端创建对等连接时使用。
 */
package club.duocall.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IceServer(List<String> urls, String username, String credential) {

    public IceServer {
        urls = urls == null ? List.of() : List.copyOf(urls);
    }

    /**
     * 创建一个不需要凭据的STUN服务器配置。
     */
    public static IceServer stun(String url) {
        return new IceServer(List.of(url), null, null);
    }
}
