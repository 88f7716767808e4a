package club.duocall.client.rtc;

import club.duocall.dto.IceServer;
import java.util.List;

/**
 * @param iceServers         STUN/TURN服务器。
 * @param iceCandidatePoolSize 预先收集的候选地址数量。
 */
public record PeerConnectionConfiguration(List<IceServer> iceServers, int iceCandidatePoolSize) {

    public PeerConnectionConfiguration {
        iceServers = List.copyOf(iceServers);
    }
}
