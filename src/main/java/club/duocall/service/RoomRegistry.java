/**
 * 此服务类负责管理所有活跃的通话房间及其成员。
 *
 * 主要职责:
 * - 线程安全地处理成员的加入、离开以及房间的关闭。
 * - 保证每个房间的成员数始终在 {0, 1, 2} 之内，第三个加入者被直接拒绝而不是排队。
 * - 维护会话ID到房间ID的反向映射，以便在连接断开时快速找到所属房间。
 *
 * 关联:
 * - `SignalingRelay`: 依赖此服务来决定消息的接收者并在成员变化时发送通知。
 * - `MonitorController`: 依赖此服务来获取房间和成员的统计数据。
 * - `StaleSessionSweepTask`: 依赖此服务来查找已断开但尚未清理的会话。
 */
package club.duocall.service;

import club.duocall.exception.RoomFullException;
import club.duocall.model.JoinResult;
import club.duocall.model.Room;
import club.duocall.model.RoomState;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.WebSocketSession;

@Service
public class RoomRegistry {
    private static final Logger logger = LoggerFactory.getLogger(RoomRegistry.class);

    // 映射: roomId -> Room (不可变快照)，每次变更整体替换。
    private final Map<String, Room> rooms = new ConcurrentHashMap<>();
    // 映射: sessionId -> roomId，用于连接断开时反向查找房间。
    private final Map<String, String> sessionToRoomMap = new ConcurrentHashMap<>();

    /**
     * 将一个会话加入指定房间。房间不存在时以该会话为唯一成员创建房间。
     *
     * @param roomId  房间ID。
     * @param session 成员的WebSocket会话。
     * @return 加入顺序以及加入后的房间快照。
     * @throws RoomFullException 房间已有两名成员。此时房间状态不会有任何改变。
     */
    public JoinResult join(String roomId, WebSocketSession session) {
        if (roomId == null || roomId.isBlank() || session == null) {
            throw new IllegalArgumentException("房间ID和会话都不能为空");
        }

        // 核心逻辑: compute对同一个roomId的调用是串行的，容量检查和成员追加在同一个原子操作中完成，
        // 不会出现两个连接同时看到"一名成员"并都被接纳为第二名成员的情况。
        var rejected = new AtomicBoolean(false);
        // 反向索引也在compute内更新，与close(roomId)的remove串行，不会留下指向已销毁房间的索引。
        var room = rooms.compute(roomId, (key, existing) -> {
            if (existing != null && existing.isFull() && !existing.contains(session.getId())) {
                rejected.set(true);
                return existing;
            }
            sessionToRoomMap.put(session.getId(), key);
            if (existing == null) {
                return Room.open(key, session);
            }
            return existing.contains(session.getId()) ? existing : existing.with(session);
        });

        if (rejected.get()) {
            logger.warn("房间 '{}' 已满，会话 {} 的加入请求被拒绝。", roomId, session.getId());
            throw new RoomFullException(roomId);
        }

        var role = room.roleOf(session.getId());
        logger.info("会话 {} 已加入房间 '{}'，顺序: {}，当前成员数: {}", session.getId(), roomId, role, room.size());
        return new JoinResult(role, room);
    }

    /**
     * 将成员从房间中移除。最后一名成员离开时房间被销毁。
     *
     * @param roomId  房间ID。
     * @param session 要移除的成员。
     * @return 移除后仍有成员时返回剩余房间的快照；房间被销毁或会话并非成员时返回`null`。
     */
    public Room leave(String roomId, WebSocketSession session) {
        if (roomId == null || session == null) return null;
        var sessionId = session.getId();
        var remaining = new AtomicReference<Room>();

        rooms.computeIfPresent(roomId, (key, room) -> {
            if (!room.contains(sessionId)) {
                return room;
            }
            var next = room.without(sessionId);
            if (next.size() == 0) {
                return null; // 返回null即从映射中删除该房间
            }
            remaining.set(next);
            return next;
        });
        sessionToRoomMap.remove(sessionId, roomId);

        var result = remaining.get();
        if (result != null) {
            logger.info("会话 {} 离开房间 '{}'，剩余成员数: {}", sessionId, roomId, result.size());
        } else {
            logger.info("会话 {} 离开房间 '{}'，房间已不存在或已销毁。", sessionId, roomId);
        }
        return result;
    }

    /**
     * 关闭并销毁整个房间，所有成员一并移除。
     *
     * @param roomId 房间ID。
     * @return 关闭时的房间快照 (状态为`CLOSED`)；房间不存在时返回`null`。
     */
    public Room close(String roomId) {
        if (roomId == null) return null;
        var removed = rooms.remove(roomId);
        if (removed == null) {
            return null;
        }
        removed.members().forEach(member -> sessionToRoomMap.remove(member.getId(), roomId));
        logger.info("房间 '{}' 已关闭，移除成员数: {}", roomId, removed.size());
        return removed.asClosed();
    }

    /**
     * 根据会话查找其所在的房间ID。
     *
     * @return 房间ID；会话不在任何房间中时返回`null`。
     */
    public String roomOf(WebSocketSession session) {
        return session != null ? sessionToRoomMap.get(session.getId()) : null;
    }

    /**
     * 获取房间的当前快照。
     *
     * @return 房间快照；房间不存在时返回`null`。
     */
    public Room find(String roomId) {
        return roomId != null ? rooms.get(roomId) : null;
    }

    public int getActiveRoomCount() {
        return rooms.size();
    }

    public int countRooms(RoomState state) {
        return (int) rooms.values().stream().filter(room -> room.state() == state).count();
    }

    public int getParticipantCount() {
        return rooms.values().stream().mapToInt(Room::size).sum();
    }

    /**
     * 查找所有传输层已关闭、但仍登记为房间成员的会话。
     */
    public List<WebSocketSession> findStaleSessions() {
        return rooms.values().stream()
                .flatMap(room -> room.members().stream())
                .filter(member -> !member.isOpen())
                .toList();
    }
}
