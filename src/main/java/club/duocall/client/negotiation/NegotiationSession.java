/**
 * 一个参与者的协商会话快照。
 *
 * 每次状态迁移都由`NegotiationStateMachine`返回一个新的实例，原实例不会被修改，
 * 因此任何时刻读到的快照都是完整一致的。
 *
 * - `pendingLocalCandidates`: 加入房间确认之前本地产生、尚未发送的候选地址。
 * - `pendingRemoteCandidates`: 远端描述设置之前收到、尚未应用的候选地址，按到达顺序保存。
 */
package club.duocall.client.negotiation;

import club.duocall.dto.IceCandidate;
import club.duocall.dto.SessionDescription;
import club.duocall.model.ParticipantRole;
import java.util.ArrayList;
import java.util.List;

public record NegotiationSession(
        NegotiationState state,
        String roomId,
        ParticipantRole role,
        SessionDescription localDescription,
        SessionDescription remoteDescription,
        List<IceCandidate> pendingLocalCandidates,
        List<IceCandidate> pendingRemoteCandidates,
        boolean offerRequested,
        EndReason endReason) {

    public NegotiationSession {
        pendingLocalCandidates = List.copyOf(pendingLocalCandidates);
        pendingRemoteCandidates = List.copyOf(pendingRemoteCandidates);
    }

    public static NegotiationSession idle() {
        return new NegotiationSession(NegotiationState.IDLE, null, null, null, null, List.of(), List.of(), false, null);
    }

    public NegotiationSession withState(NegotiationState next) {
        return new NegotiationSession(next, roomId, role, localDescription, remoteDescription,
                pendingLocalCandidates, pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession withRoomId(String next) {
        return new NegotiationSession(state, next, role, localDescription, remoteDescription,
                pendingLocalCandidates, pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession withRole(ParticipantRole next) {
        return new NegotiationSession(state, roomId, next, localDescription, remoteDescription,
                pendingLocalCandidates, pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession withLocalDescription(SessionDescription next) {
        return new NegotiationSession(state, roomId, role, next, remoteDescription,
                pendingLocalCandidates, pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession withRemoteDescription(SessionDescription next) {
        return new NegotiationSession(state, roomId, role, localDescription, next,
                pendingLocalCandidates, pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession withOfferRequested(boolean next) {
        return new NegotiationSession(state, roomId, role, localDescription, remoteDescription,
                pendingLocalCandidates, pendingRemoteCandidates, next, endReason);
    }

    public NegotiationSession plusLocalCandidate(IceCandidate candidate) {
        var next = new ArrayList<>(pendingLocalCandidates);
        next.add(candidate);
        return new NegotiationSession(state, roomId, role, localDescription, remoteDescription,
                next, pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession withoutLocalCandidates() {
        return new NegotiationSession(state, roomId, role, localDescription, remoteDescription,
                List.of(), pendingRemoteCandidates, offerRequested, endReason);
    }

    public NegotiationSession plusRemoteCandidate(IceCandidate candidate) {
        var next = new ArrayList<>(pendingRemoteCandidates);
        next.add(candidate);
        return new NegotiationSession(state, roomId, role, localDescription, remoteDescription,
                pendingLocalCandidates, next, offerRequested, endReason);
    }

    public NegotiationSession withoutRemoteCandidates() {
        return new NegotiationSession(state, roomId, role, localDescription, remoteDescription,
                pendingLocalCandidates, List.of(), offerRequested, endReason);
    }

    /**
     * 进入终止状态，同时丢弃所有待处理的候选地址。
     */
    public NegotiationSession ended(EndReason reason) {
        return new NegotiationSession(NegotiationState.ENDED, roomId, role, localDescription, remoteDescription,
                List.of(), List.of(), offerRequested, reason);
    }

    public boolean isEnded() {
        return state == NegotiationState.ENDED;
    }

    public boolean isInitiator() {
        return role != null && role.isInitiator();
    }
}
