/**
 * 底层实时传输库中对等连接的抽象。
 *
 * 实现需保证: 各方法按调用顺序依次生效 (例如先调用`setRemoteDescription`再调用`addIceCandidate`时，
 * 候选地址一定在远端描述设置之后才被应用)，与浏览器中对等连接的内部操作队列一致。
 * 返回的`CompletableFuture`可能在任意线程上完成。
 */
package club.duocall.client.rtc;

import club.duocall.client.media.MediaTrack;
import club.duocall.dto.IceCandidate;
import club.duocall.dto.SessionDescription;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

public interface PeerConnection {

    void addTrack(MediaTrack track);

    CompletableFuture<SessionDescription> createOffer();

    CompletableFuture<SessionDescription> createAnswer();

    CompletableFuture<Void> setLocalDescription(SessionDescription description);

    CompletableFuture<Void> setRemoteDescription(SessionDescription description);

    CompletableFuture<Void> addIceCandidate(IceCandidate candidate);

    /**
     * 当前正在使用的候选地址对；尚未选定时为空。
     */
    CompletableFuture<Optional<CandidatePairStats>> activeCandidatePair();

    /**
     * 关闭连接并释放传输资源。重复调用无副作用。
     */
    void close();
}
