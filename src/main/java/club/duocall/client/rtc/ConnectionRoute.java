package club.duocall.client.rtc;

/**
 * 媒体数据实际经过的路径，由当前候选地址对的类型推断。
 */
public enum ConnectionRoute {
    DIRECT("Direct P2P"),
    STUN("STUN (NAT)"),
    TURN("TURN Relay"),
    UNKNOWN("Unknown");

    private final String label;

    ConnectionRoute(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * 双方都是host候选时为直连；任一方为srflx时经过NAT映射；任一方为relay时经过中继。
     */
    public static ConnectionRoute classify(String localType, String remoteType) {
        if ("host".equals(localType) && "host".equals(remoteType)) {
            return DIRECT;
        }
        if ("srflx".equals(localType) || "srflx".equals(remoteType)) {
            return STUN;
        }
        if ("relay".equals(localType) || "relay".equals(remoteType)) {
            return TURN;
        }
        return UNKNOWN;
    }
}
