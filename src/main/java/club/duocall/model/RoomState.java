package club.duocall.model;

/**
 * 房间的生命周期状态。
 */
public enum RoomState {
    EMPTY,
    WAITING_FOR_PEER,
    FULL,
    CLOSED
}
