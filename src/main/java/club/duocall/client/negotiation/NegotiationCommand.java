package club.duocall.client.negotiation;

import club.duocall.dto.IceCandidate;
import club.duocall.dto.SessionDescription;
import club.duocall.dto.SignalingMessage;

/**
 * 状态迁移产生的副作用，由`CallController`按顺序执行。
 */
public sealed interface NegotiationCommand {

    record CreateOffer() implements NegotiationCommand {}

    record CreateAnswer() implements NegotiationCommand {}

    record ApplyLocalDescription(SessionDescription description) implements NegotiationCommand {}

    record ApplyRemoteDescription(SessionDescription description) implements NegotiationCommand {}

    record AddRemoteCandidate(IceCandidate candidate) implements NegotiationCommand {}

    record SendSignal(SignalingMessage message) implements NegotiationCommand {}

    /** 向用户展示的状态提示。 */
    record NotifyStatus(String message) implements NegotiationCommand {}

    /** 释放媒体采集、对等连接和信令连接。 */
    record ReleaseResources() implements NegotiationCommand {}

    /** 通话结束，向用户报告一次原因。 */
    record Terminate(EndReason reason) implements NegotiationCommand {}
}
