package club.duocall.client.negotiation;

import club.duocall.dto.IceCandidate;
import club.duocall.dto.SessionDescription;
import club.duocall.model.ParticipantRole;

/**
 * 驱动协商状态机的输入: 用户操作、信令消息以及底层传输库的回调。
 */
public sealed interface NegotiationEvent {

    /** 用户发起或加入通话。 */
    record Start(String roomId) implements NegotiationEvent {}

    /** 服务器通知房间成员数，`role`是本参与者的加入顺序。 */
    record RoomStatus(int count, ParticipantRole role) implements NegotiationEvent {}

    record OfferReceived(SessionDescription offer) implements NegotiationEvent {}

    record AnswerReceived(SessionDescription answer) implements NegotiationEvent {}

    /** 底层传输库完成了offer的创建。 */
    record LocalOfferCreated(SessionDescription offer) implements NegotiationEvent {}

    /** 底层传输库完成了answer的创建。 */
    record LocalAnswerCreated(SessionDescription answer) implements NegotiationEvent {}

    record LocalCandidate(IceCandidate candidate) implements NegotiationEvent {}

    record RemoteCandidate(IceCandidate candidate) implements NegotiationEvent {}

    record PeerDisconnected() implements NegotiationEvent {}

    record CallEnded() implements NegotiationEvent {}

    /** 服务器以关闭码4000拒绝了加入请求。 */
    record RoomFull() implements NegotiationEvent {}

    /** 与信令服务器的连接意外断开。 */
    record RelayLost(int closeCode) implements NegotiationEvent {}

    /** ICE失败或协商操作失败，不自动重试。 */
    record TransportFailed(String detail) implements NegotiationEvent {}

    record MediaAccessDenied(String detail) implements NegotiationEvent {}

    /** 用户主动挂断。 */
    record EndRequested() implements NegotiationEvent {}
}
