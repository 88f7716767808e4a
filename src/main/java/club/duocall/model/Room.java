/**
 * 此文件定义了通话房间的不可变快照。
 *
 * 主要职责:
 * - 按加入顺序保存至多两个成员的WebSocket会话。
 * - 每一次成员变更都返回一个新的`Room`实例，原实例保持不变，
 *   使`RoomRegistry`可以在`ConcurrentHashMap.compute`中原子地替换房间状态。
 *
 * 关联:
 * - `RoomRegistry`: 持有所有活跃房间。
 * - `SignalingRelay`: 根据快照向成员发送消息。
 */
package club.duocall.model;

import java.util.ArrayList;
import java.util.List;
import org.springframework.web.socket.WebSocketSession;

public record Room(String roomId, List<WebSocketSession> members, boolean closed) {

    /** 每个房间允许的最大成员数。 */
    public static final int MAX_PARTICIPANTS = 2;

    public Room {
        members = List.copyOf(members);
        if (members.size() > MAX_PARTICIPANTS) {
            throw new IllegalArgumentException("房间成员数不能超过 " + MAX_PARTICIPANTS + ": " + members.size());
        }
    }

    /**
     * 以第一个成员创建一个新房间。
     */
    public static Room open(String roomId, WebSocketSession first) {
        return new Room(roomId, List.of(first), false);
    }

    public Room with(WebSocketSession session) {
        var next = new ArrayList<>(members);
        next.add(session);
        return new Room(roomId, next, closed);
    }

    public Room without(String sessionId) {
        var next = new ArrayList<WebSocketSession>(members.size());
        for (var member : members) {
            if (!member.getId().equals(sessionId)) {
                next.add(member);
            }
        }
        return new Room(roomId, next, closed);
    }

    public Room asClosed() {
        return new Room(roomId, members, true);
    }

    public int size() {
        return members.size();
    }

    public boolean isFull() {
        return members.size() >= MAX_PARTICIPANTS;
    }

    public boolean contains(String sessionId) {
        return members.stream().anyMatch(member -> member.getId().equals(sessionId));
    }

    /**
     * 返回成员的加入顺序；不是成员时返回`null`。
     */
    public ParticipantRole roleOf(String sessionId) {
        for (int i = 0; i < members.size(); i++) {
            if (members.get(i).getId().equals(sessionId)) {
                return i == 0 ? ParticipantRole.FIRST : ParticipantRole.SECOND;
            }
        }
        return null;
    }

    /**
     * 除指定会话以外的其他成员。
     */
    public List<WebSocketSession> othersThan(String sessionId) {
        return members.stream().filter(member -> !member.getId().equals(sessionId)).toList();
    }

    public RoomState state() {
        if (closed) {
            return RoomState.CLOSED;
        }
        return switch (members.size()) {
            case 0 -> RoomState.EMPTY;
            case 1 -> RoomState.WAITING_FOR_PEER;
            default -> RoomState.FULL;
        };
    }

    @Override
    public String toString() {
        return "Room{roomId='" + roomId + "', members=" + members.size() + ", state=" + state() + '}';
    }
}
