package club.duocall.client;

import club.duocall.dto.SignalingMessage;

/**
 * 到信令服务器的一条已建立的连接。
 */
public interface RelayChannel {

    void send(SignalingMessage message);

    boolean isOpen();

    /**
     * 关闭连接。重复调用无副作用。
     */
    void close();
}
