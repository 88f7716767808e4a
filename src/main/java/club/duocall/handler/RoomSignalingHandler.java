/**
 * 此文件是通话房间的WebSocket消息处理器，负责双人通话的信令交换。
 *
 * 主要职责:
 * - 在连接建立时从路径`/ws/video/{room}/`中解析房间ID并尝试加入房间 (`afterConnectionEstablished`)。
 * - 房间已满时以关闭码4000关闭连接，不影响房间内已有成员。
 * - 只解析消息的`type`字段，并据此转发、结束通话或响应心跳 (`handleMessage`)。
 * - 连接关闭时通知房间内的另一名成员 (`afterConnectionClosed`)。
 *
 * 关联:
 * - `SignalingRelay`: 实际执行加入、转发和离开逻辑。
 * - `SignalingProperties`: 提供发送超时和发送缓冲区上限。
 * - `WebSocketConfig`: 在此类中被注册到WebSocket路由。
 */
package club.duocall.handler;

import club.duocall.config.SignalingProperties;
import club.duocall.dto.MessageType;
import club.duocall.dto.SignalingCloseStatus;
import club.duocall.dto.SignalingMessage;
import club.duocall.exception.RoomFullException;
import club.duocall.service.SignalingRelay;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.util.UriComponentsBuilder;

@Component
public class RoomSignalingHandler implements WebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(RoomSignalingHandler.class);

    private static final Pattern ROOM_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final int KB_TO_BYTES = 1024;
    private static final String ROOM_PATH_PREFIX = "video";
    private static final String OUTBOUND_SESSION_ATTR = "duocall.outboundSession";

    private final SignalingRelay signalingRelay;
    private final int sendTimeLimitMs;
    private final int sendBufferSizeLimit;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public RoomSignalingHandler(SignalingRelay signalingRelay, SignalingProperties signalingProperties) {
        this.signalingRelay = signalingRelay;
        this.sendTimeLimitMs = signalingProperties.sendTimeLimitMs();
        this.sendBufferSizeLimit = signalingProperties.sendBufferSizeKb() * KB_TO_BYTES;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        var roomId = extractRoomId(session);
        if (roomId == null) {
            logger.warn("连接路径中缺少有效的房间ID，关闭会话 {} | URI: {}", session.getId(), session.getUri());
            session.close(CloseStatus.BAD_DATA);
            return;
        }

        // 对同一接收方的并发发送必须串行化，装饰器同时保证了消息的先后顺序
        var decorated = new ConcurrentWebSocketSessionDecorator(session, sendTimeLimitMs, sendBufferSizeLimit);
        session.getAttributes().put(OUTBOUND_SESSION_ATTR, decorated);
        try {
            var result = signalingRelay.admit(roomId, decorated);
            logger.info("新的信令连接已建立: 会话ID {} | 房间 '{}' | 顺序 {}", session.getId(), roomId, result.role());
        } catch (RoomFullException e) {
            logger.warn("房间 '{}' 已满，拒绝会话 {}。", roomId, session.getId());
            session.close(SignalingCloseStatus.ROOM_FULL);
        }
    }

    @Override
    public void handleMessage(WebSocketSession session, WebSocketMessage<?> message) {
        var payload = message.getPayload().toString();
        MessageType type;
        try {
            var node = objectMapper.readTree(payload);
            type = MessageType.fromWireName(node.path("type").asText(null));
        } catch (JsonProcessingException e) {
            logger.warn("收到无效的JSON | 会话ID {}: {}", session.getId(), e.getOriginalMessage());
            signalingRelay.sendMessage(outbound(session), SignalingMessage.error("无效的JSON格式"));
            return;
        }

        try {
            handleSignalingMessage(session, type, payload);
        } catch (Exception e) {
            logger.error("处理信令消息失败 | 会话ID {}: {}", session.getId(), e.getMessage(), e);
            signalingRelay.sendMessage(outbound(session), SignalingMessage.error("服务器内部错误"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus closeStatus) {
        logger.info("信令连接已关闭: 会话ID {} | 状态: {}", session.getId(), closeStatus);
        signalingRelay.depart(session); // 通知房间内的另一名成员
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        logger.error("WebSocket传输错误 | 会话ID {}: {}", session.getId(), exception.getMessage());
    }

    @Override
    public boolean supportsPartialMessages() {
        return false; // 信令消息通常较小，不支持分片消息
    }

    private void handleSignalingMessage(WebSocketSession session, MessageType type, String payload) {
        if (type == null) {
            logger.warn("收到未知的消息类型 | 会话ID: {}", session.getId());
            signalingRelay.sendMessage(outbound(session), SignalingMessage.error("未知的消息类型"));
            return;
        }

        if (type.isRelayed()) {
            logger.debug("收到消息: {} | 会话: {}", type, session.getId());
            signalingRelay.relay(session, payload);
            return;
        }

        switch (type) {
            case END_CALL -> {
                logger.info("收到消息: END_CALL | 会话: {}", session.getId());
                signalingRelay.endCall(session);
            }
            case PING -> {
                logger.debug("收到来自会话 {} 的Ping，将发送Pong。", session.getId());
                signalingRelay.sendMessage(outbound(session), SignalingMessage.of(MessageType.PONG));
            }
            default -> {
                logger.warn("客户端不应发送的消息类型: {} | 会话ID: {}", type, session.getId());
                signalingRelay.sendMessage(outbound(session), SignalingMessage.error("不支持的消息类型: " + type.wireName()));
            }
        }
    }

    /**
     * 返回连接建立时创建的线程安全发送包装；没有包装时退回原始会话。
     */
    private WebSocketSession outbound(WebSocketSession session) {
        var decorated = session.getAttributes().get(OUTBOUND_SESSION_ATTR);
        return decorated instanceof WebSocketSession outboundSession ? outboundSession : session;
    }

    /**
     * 从`/ws/video/{room}/`形式的路径中取出房间ID。
     *
     * @return 合法的房间ID；路径不符合要求时返回`null`。
     */
    static String extractRoomId(WebSocketSession session) {
        var uri = session.getUri();
        if (uri == null) {
            return null;
        }
        var segments = UriComponentsBuilder.fromUri(uri).build().getPathSegments();
        if (segments.size() < 2 || !ROOM_PATH_PREFIX.equals(segments.get(segments.size() - 2))) {
            return null;
        }
        var candidate = segments.get(segments.size() - 1);
        return ROOM_ID_PATTERN.matcher(candidate).matches() ? candidate : null;
    }
}
