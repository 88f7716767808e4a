/**
 * 基于Spring `StandardWebSocketClient`的信令连接实现。
 *
 * 主要职责:
 * - 建立到`/ws/video/{room}/`的WebSocket连接，并把收到的JSON解析为`SignalingMessage`。
 * - 把连接的打开、消息和关闭事件交给`RelayListener`。
 *
 * 关联:
 * - `CallController`: 通过`RelayConnector`接口使用此类。
 */
package club.duocall.client;

import club.duocall.dto.SignalingMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketHttpHeaders;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.WebSocketClient;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

public class WebSocketRelayConnector implements RelayConnector {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketRelayConnector.class);

    private final WebSocketClient webSocketClient;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public WebSocketRelayConnector() {
        this(new StandardWebSocketClient());
    }

    public WebSocketRelayConnector(WebSocketClient webSocketClient) {
        this.webSocketClient = webSocketClient;
    }

    @Override
    public CompletableFuture<RelayChannel> connect(URI uri, RelayListener listener) {
        logger.info("正在连接信令服务器: {}", uri);
        var handler = new RelayHandler(listener);
        return webSocketClient.execute(handler, new WebSocketHttpHeaders(), uri)
                .thenApply(session -> handler.channel);
    }

    private final class RelayHandler extends TextWebSocketHandler {
        private final RelayListener listener;
        private volatile SessionChannel channel;

        RelayHandler(RelayListener listener) {
            this.listener = listener;
        }

        @Override
        public void afterConnectionEstablished(WebSocketSession session) {
            logger.info("信令连接已建立: 会话ID {}", session.getId());
            channel = new SessionChannel(session);
            listener.onOpen(channel);
        }

        @Override
        protected void handleTextMessage(WebSocketSession session, TextMessage message) {
            SignalingMessage signalingMessage;
            try {
                signalingMessage = objectMapper.readValue(message.getPayload(), SignalingMessage.class);
            } catch (JsonProcessingException e) {
                logger.warn("无法解析服务器消息，已忽略: {}", e.getOriginalMessage());
                return;
            }
            logger.debug("收到信令消息: {}", signalingMessage);
            listener.onMessage(signalingMessage);
        }

        @Override
        public void handleTransportError(WebSocketSession session, Throwable exception) {
            logger.error("信令连接传输错误 | 会话ID {}: {}", session.getId(), exception.getMessage());
        }

        @Override
        public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
            logger.info("信令连接已关闭: 会话ID {} | 状态: {}", session.getId(), status);
            listener.onClosed(status.getCode(), status.getReason());
        }
    }

    private final class SessionChannel implements RelayChannel {
        private final WebSocketSession session;

        SessionChannel(WebSocketSession session) {
            this.session = session;
        }

        @Override
        public synchronized void send(SignalingMessage message) {
            if (!session.isOpen()) {
                logger.warn("信令连接已关闭，消息未发送: {}", message.type());
                return;
            }
            try {
                session.sendMessage(new TextMessage(objectMapper.writeValueAsString(message)));
                logger.debug("已发送信令消息: {}", message);
            } catch (IOException e) {
                logger.error("发送信令消息失败: {}", e.getMessage(), e);
            }
        }

        @Override
        public boolean isOpen() {
            return session.isOpen();
        }

        @Override
        public synchronized void close() {
            if (!session.isOpen()) {
                return;
            }
            try {
                session.close(CloseStatus.NORMAL);
            } catch (IOException e) {
                logger.warn("关闭信令连接失败: {}", e.getMessage());
            }
        }
    }
}
