package club.duocall.client.negotiation;

/**
 * 通话结束的原因，每个原因对应一条展示给用户的提示。
 */
public enum EndReason {
    LOCAL_HANGUP("通话已结束"),
    PEER_DISCONNECTED("对方已离开通话"),
    CALL_ENDED_BY_PEER("对方已结束通话"),
    ROOM_FULL("房间已满，请稍后再试。"),
    RELAY_LOST("与信令服务器的连接已断开。"),
    TRANSPORT_FAILURE("连接失败，请重试。"),
    MEDIA_ACCESS_DENIED("无法访问摄像头或麦克风。");

    private final String notice;

    EndReason(String notice) {
        this.notice = notice;
    }

    public String notice() {
        return notice;
    }

    /**
     * 由对方或本地用户正常结束，而不是错误。
     */
    public boolean isNormal() {
        return this == LOCAL_HANGUP || this == PEER_DISCONNECTED || this == CALL_ENDED_BY_PEER;
    }
}
