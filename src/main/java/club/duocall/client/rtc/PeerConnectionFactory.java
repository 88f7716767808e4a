package club.duocall.client.rtc;

/**
 * 创建对等连接。NAT穿透服务器等配置在创建时一次性传入。
 */
public interface PeerConnectionFactory {

    PeerConnection create(PeerConnectionConfiguration configuration, PeerConnectionObserver observer);
}
