package club.duocall.client;

import club.duocall.client.media.MediaConstraints;
import club.duocall.dto.IceServer;
import java.net.URI;
import java.time.Duration;
import java.util.List;

/**
 * 客户端配置。
 *
 * @param relayBaseUri         信令服务器地址，例如`ws://localhost:8080`。
 * @param iceServers           创建对等连接时传给传输库的STUN/TURN服务器。
 * @param iceCandidatePoolSize 预先收集的候选地址数量。
 * @param mediaConstraints     申请本地媒体时的约束。
 * @param joinTimeout          等待服务器确认加入房间的最长时间。
 * @param routeCheckInterval   连接建立后检查媒体路径的间隔。
 */
public record CallClientSettings(
        URI relayBaseUri,
        List<IceServer> iceServers,
        int iceCandidatePoolSize,
        MediaConstraints mediaConstraints,
        Duration joinTimeout,
        Duration routeCheckInterval) {

    public static final List<IceServer> DEFAULT_ICE_SERVERS = List.of(
            IceServer.stun("stun:stun.l.google.com:19302"),
            IceServer.stun("stun:stun1.l.google.com:19302"),
            IceServer.stun("stun:stun2.l.google.com:19302"),
            IceServer.stun("stun:stun3.l.google.com:19302"),
            IceServer.stun("stun:stun4.l.google.com:19302"));

    public CallClientSettings {
        iceServers = List.copyOf(iceServers);
    }

    public static CallClientSettings defaults(URI relayBaseUri) {
        return new CallClientSettings(relayBaseUri, DEFAULT_ICE_SERVERS, 10, MediaConstraints.defaults(),
                Duration.ofSeconds(15), Duration.ofSeconds(30));
    }

    public CallClientSettings withIceServers(List<IceServer> servers) {
        return new CallClientSettings(relayBaseUri, servers, iceCandidatePoolSize, mediaConstraints,
                joinTimeout, routeCheckInterval);
    }
}
