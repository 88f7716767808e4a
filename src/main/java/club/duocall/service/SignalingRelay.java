/**
 * 此服务类负责在同一房间的成员之间转发信令消息。
 *
 * 主要职责:
 * - 接纳新成员并在成员变化时向所有成员广播`room_status`。
 * - 将offer/answer/ice-candidate等消息原样转发给房间内的另一名成员，不解析其负载。
 * - 处理主动结束通话 (`end_call`) 和连接断开两种离开方式。
 *
 * 消息顺序: 同一发送方的消息在其连接的处理线程上被同步转发，
 * 而每个接收方的会话都经过`ConcurrentWebSocketSessionDecorator`包装，因此同一发送方的消息按发送顺序到达。
 *
 * 关联:
 * - `RoomRegistry`: 房间成员状态的唯一来源。
 * - `RoomSignalingHandler`: 将WebSocket事件委托给此服务。
 * - `StaleSessionSweepTask`: 对已失效的会话调用`depart`。
 */
package club.duocall.service;

import club.duocall.dto.MessageType;
import club.duocall.dto.SignalingMessage;
import club.duocall.model.JoinResult;
import club.duocall.model.Room;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

@Service
public class SignalingRelay {
    private static final Logger logger = LoggerFactory.getLogger(SignalingRelay.class);

    private final RoomRegistry roomRegistry;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public SignalingRelay(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * 将会话加入房间，并向房间内所有成员广播新的成员数。
     *
     * @throws club.duocall.exception.RoomFullException 房间已满，房间状态保持不变。
     */
    public JoinResult admit(String roomId, WebSocketSession session) {
        var result = roomRegistry.join(roomId, session);
        broadcastRoomStatus(result.room());
        return result;
    }

    /**
     * 将一条消息原样转发给发送方所在房间的其他成员。
     *
     * @param sender  发送方会话。
     * @param payload 原始的消息文本。
     * @return 实际转发的接收方数量。
     */
    public int relay(WebSocketSession sender, String payload) {
        var roomId = roomRegistry.roomOf(sender);
        if (roomId == null) {
            logger.warn("会话 {} 不在任何房间中，消息未转发。", sender.getId());
            return 0;
        }
        return relay(roomId, sender, payload);
    }

    public int relay(String roomId, WebSocketSession sender, String payload) {
        var room = roomRegistry.find(roomId);
        if (room == null || !room.contains(sender.getId())) {
            logger.warn("会话 {} 不是房间 '{}' 的成员，消息未转发。", sender.getId(), roomId);
            return 0;
        }

        var recipients = room.othersThan(sender.getId());
        for (var recipient : recipients) {
            sendRaw(recipient, payload);
        }
        logger.debug("房间 '{}' 中来自会话 {} 的消息已转发给 {} 个成员。", roomId, sender.getId(), recipients.size());
        return recipients.size();
    }

    /**
     * 向房间内每个成员发送当前成员数以及该成员自己的加入顺序。
     * 按加入顺序倒序发送，新加入者先收到通知，先加入者随后才会据此创建offer。
     */
    public void broadcastRoomStatus(Room room) {
        var members = new ArrayList<>(room.members());
        Collections.reverse(members);
        for (var member : members) {
            sendMessage(member, SignalingMessage.roomStatus(room.size(), room.roleOf(member.getId())));
        }
    }

    /**
     * 处理成员主动结束通话: 通知另一名成员，销毁房间并关闭双方连接。
     *
     * @return 房间被关闭时返回`true`；发送方不在任何房间中时返回`false`。
     */
    public boolean endCall(WebSocketSession sender) {
        var roomId = roomRegistry.roomOf(sender);
        var room = roomRegistry.find(roomId);
        if (room == null || !room.contains(sender.getId())) {
            logger.warn("会话 {} 请求结束通话，但不在任何房间中。", sender.getId());
            return false;
        }

        var closed = roomRegistry.close(roomId);
        if (closed == null) {
            // 另一方的结束请求或断开已先一步销毁了房间
            return false;
        }
        for (var other : closed.othersThan(sender.getId())) {
            sendMessage(other, SignalingMessage.of(MessageType.CALL_ENDED));
        }
        for (var member : closed.members()) {
            closeQuietly(member, CloseStatus.NORMAL);
        }
        logger.info("房间 '{}' 的通话已由会话 {} 结束。", roomId, sender.getId());
        return true;
    }

    /**
     * 处理成员离开 (连接断开)。剩余成员会收到一次`peer_disconnected`以及新的成员数。
     */
    public void depart(WebSocketSession session) {
        var roomId = roomRegistry.roomOf(session);
        if (roomId == null) {
            logger.debug("会话 {} 断开时不在任何房间中。", session.getId());
            return;
        }

        var remaining = roomRegistry.leave(roomId, session);
        if (remaining == null) {
            return;
        }
        for (var member : remaining.members()) {
            sendMessage(member, SignalingMessage.of(MessageType.PEER_DISCONNECTED));
        }
        broadcastRoomStatus(remaining);
    }

    public void sendMessage(WebSocketSession session, SignalingMessage message) {
        try {
            sendRaw(session, objectMapper.writeValueAsString(message));
        } catch (Exception e) {
            logger.error("序列化信令消息失败 | 会话ID {}: {}", session.getId(), e.getMessage(), e);
        }
    }

    private void sendRaw(WebSocketSession session, String payload) {
        try {
            if (session.isOpen()) {
                session.sendMessage(new TextMessage(payload));
            } else {
                logger.warn("尝试向已关闭的会话 {} 发送消息失败。", session.getId());
            }
        } catch (Exception e) {
            logger.error("通过WebSocket发送消息失败 | 会话ID {}: {}", session.getId(), e.getMessage(), e);
        }
    }

    private void closeQuietly(WebSocketSession session, CloseStatus status) {
        try {
            if (session.isOpen()) {
                session.close(status);
            }
        } catch (Exception e) {
            logger.warn("关闭会话 {} 失败: {}", session.getId(), e.getMessage());
        }
    }
}
