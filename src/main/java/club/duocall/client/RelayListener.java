package club.duocall.client;

import club.duocall.dto.SignalingMessage;

/**
 * 信令连接的回调。`onOpen`一定先于该连接上的任何`onMessage`。
 */
public interface RelayListener {

    void onOpen(RelayChannel channel);

    void onMessage(SignalingMessage message);

    void onClosed(int code, String reason);
}
