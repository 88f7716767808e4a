package club.duocall.dto;

import org.springframework.web.socket.CloseStatus;

/**
 * 信令连接使用的应用层关闭码。
 */
public final class SignalingCloseStatus {

    /** 房间已有两名成员，第三个加入者的连接以此关闭码被拒绝。 */
    public static final int ROOM_FULL_CODE = 4000;

    public static final CloseStatus ROOM_FULL = new CloseStatus(ROOM_FULL_CODE, "Room is full");

    private SignalingCloseStatus() {}
}
