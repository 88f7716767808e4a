package club.duocall.client.rtc;

import club.duocall.client.media.MediaTrack;
import club.duocall.dto.IceCandidate;

/**
 * 底层传输库的回调。回调可能发生在传输库自己的线程上。
 */
public interface PeerConnectionObserver {

    /** 本地收集到一个新的候选地址。 */
    void onIceCandidate(IceCandidate candidate);

    void onIceConnectionStateChange(IceConnectionState state);

    /** 收到远端的媒体轨道。 */
    default void onRemoteTrack(MediaTrack track) {}
}
