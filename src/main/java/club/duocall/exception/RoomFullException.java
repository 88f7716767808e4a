package club.duocall.exception;

/**
 * 房间已有两名成员时的加入请求被拒绝。对本次加入是致命的，不应自动重试。
 */
public class RoomFullException extends RuntimeException {

    private final String roomId;

    public RoomFullException(String roomId) {
        super("房间 '" + roomId + "' 已满");
        this.roomId = roomId;
    }

    public String getRoomId() {
        return roomId;
    }
}
