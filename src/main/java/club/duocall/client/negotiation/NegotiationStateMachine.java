/**
 * 此文件定义了单个参与者的会话协商状态机。
 *
 * 主要职责:
 * - 以`apply(session, event) -> Transition`的形式描述全部状态迁移，不持有任何可变状态，
 *   也不直接接触信令连接或传输库，因此可以脱离真实连接进行测试。
 * - 以房间的加入顺序决定发起方: 先加入者在第二名成员到达后创建offer，后加入者只等待offer。
 * - 只有在`HAVE_LOCAL_OFFER`状态下才应用answer，其他状态下收到的answer按协议违规丢弃并记录日志。
 * - 远端描述设置之前收到的ICE候选按到达顺序缓存，远端描述设置后立即依次应用。
 *
 * 关联:
 * - `NegotiationSession`: 状态快照。
 * - `NegotiationEvent`, `NegotiationCommand`: 状态机的输入和输出。
 * - `CallController`: 在单线程事件循环中调用此状态机并执行返回的命令。
 */
package club.duocall.client.negotiation;

import club.duocall.client.negotiation.NegotiationCommand.AddRemoteCandidate;
import club.duocall.client.negotiation.NegotiationCommand.ApplyLocalDescription;
import club.duocall.client.negotiation.NegotiationCommand.ApplyRemoteDescription;
import club.duocall.client.negotiation.NegotiationCommand.CreateAnswer;
import club.duocall.client.negotiation.NegotiationCommand.CreateOffer;
import club.duocall.client.negotiation.NegotiationCommand.NotifyStatus;
import club.duocall.client.negotiation.NegotiationCommand.ReleaseResources;
import club.duocall.client.negotiation.NegotiationCommand.SendSignal;
import club.duocall.client.negotiation.NegotiationCommand.Terminate;
import club.duocall.client.negotiation.NegotiationEvent.AnswerReceived;
import club.duocall.client.negotiation.NegotiationEvent.CallEnded;
import club.duocall.client.negotiation.NegotiationEvent.EndRequested;
import club.duocall.client.negotiation.NegotiationEvent.LocalAnswerCreated;
import club.duocall.client.negotiation.NegotiationEvent.LocalCandidate;
import club.duocall.client.negotiation.NegotiationEvent.LocalOfferCreated;
import club.duocall.client.negotiation.NegotiationEvent.MediaAccessDenied;
import club.duocall.client.negotiation.NegotiationEvent.OfferReceived;
import club.duocall.client.negotiation.NegotiationEvent.PeerDisconnected;
import club.duocall.client.negotiation.NegotiationEvent.RelayLost;
import club.duocall.client.negotiation.NegotiationEvent.RemoteCandidate;
import club.duocall.client.negotiation.NegotiationEvent.RoomFull;
import club.duocall.client.negotiation.NegotiationEvent.RoomStatus;
import club.duocall.client.negotiation.NegotiationEvent.Start;
import club.duocall.client.negotiation.NegotiationEvent.TransportFailed;
import club.duocall.dto.MessageType;
import club.duocall.dto.SignalingMessage;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NegotiationStateMachine {
    private static final Logger logger = LoggerFactory.getLogger(NegotiationStateMachine.class);

    /**
     * 计算一次状态迁移。
     *
     * @param session 当前快照。
     * @param event   输入事件。
     * @return 新快照和需要执行的命令；事件被忽略时快照不变且没有命令。
     */
    public Transition apply(NegotiationSession session, NegotiationEvent event) {
        if (session.isEnded()) {
            logger.debug("通话已结束，忽略事件: {}", event.getClass().getSimpleName());
            return Transition.unchanged(session);
        }

        if (event instanceof Start start) {
            return onStart(session, start);
        } else if (event instanceof RoomStatus status) {
            return onRoomStatus(session, status);
        } else if (event instanceof LocalOfferCreated created) {
            return onLocalOfferCreated(session, created);
        } else if (event instanceof OfferReceived offer) {
            return onOfferReceived(session, offer);
        } else if (event instanceof LocalAnswerCreated created) {
            return onLocalAnswerCreated(session, created);
        } else if (event instanceof AnswerReceived answer) {
            return onAnswerReceived(session, answer);
        } else if (event instanceof LocalCandidate local) {
            return onLocalCandidate(session, local);
        } else if (event instanceof RemoteCandidate remote) {
            return onRemoteCandidate(session, remote);
        } else if (event instanceof EndRequested) {
            return onEndRequested(session);
        } else if (event instanceof PeerDisconnected) {
            return terminate(session, EndReason.PEER_DISCONNECTED);
        } else if (event instanceof CallEnded) {
            return terminate(session, EndReason.CALL_ENDED_BY_PEER);
        } else if (event instanceof RoomFull) {
            return terminate(session, EndReason.ROOM_FULL);
        } else if (event instanceof RelayLost lost) {
            logger.warn("与信令服务器的连接已断开，关闭码: {}", lost.closeCode());
            return terminate(session, EndReason.RELAY_LOST);
        } else if (event instanceof TransportFailed failed) {
            logger.error("底层传输失败，结束通话: {}", failed.detail());
            return terminate(session, EndReason.TRANSPORT_FAILURE);
        } else if (event instanceof MediaAccessDenied denied) {
            logger.warn("无法获取本地媒体: {}", denied.detail());
            return terminate(session, EndReason.MEDIA_ACCESS_DENIED);
        }
        throw new IllegalArgumentException("未处理的协商事件: " + event);
    }

    private Transition onStart(NegotiationSession session, Start start) {
        if (session.state() != NegotiationState.IDLE) {
            logger.warn("重复的开始请求，当前状态: {}", session.state());
            return Transition.unchanged(session);
        }
        var next = session.withRoomId(start.roomId()).withState(NegotiationState.JOINING);
        return Transition.of(next, new NotifyStatus("正在加入房间..."));
    }

    private Transition onRoomStatus(NegotiationSession session, RoomStatus status) {
        var state = session.state();
        if (status.role() == null) {
            logger.warn("房间状态更新缺少加入顺序，忽略。");
            return Transition.unchanged(session);
        }
        if (state != NegotiationState.JOINING && state != NegotiationState.WAITING_FOR_PEER) {
            if (state != NegotiationState.IDLE && session.role() == null) {
                // 对方的offer先于本方的加入确认到达: 只补记加入顺序并补发候选，协商状态不变
                logger.info("协商已开始后收到加入确认，顺序: {}", status.role());
                return new Transition(session.withRole(status.role()).withoutLocalCandidates(),
                        flushLocalCandidates(session));
            }
            logger.debug("状态 {} 下忽略房间状态更新: count={}", state, status.count());
            return Transition.unchanged(session);
        }

        // 加入确认之前产生的本地候选，此时按顺序补发
        var commands = new ArrayList<NegotiationCommand>(flushLocalCandidates(session));
        var next = session.withRole(status.role())
                .withState(NegotiationState.WAITING_FOR_PEER)
                .withoutLocalCandidates();

        if (status.count() >= 2 && status.role().isInitiator()) {
            if (next.offerRequested()) {
                return new Transition(next, commands);
            }
            commands.add(new NotifyStatus("对方已加入，正在发起通话..."));
            commands.add(new CreateOffer());
            return new Transition(next.withOfferRequested(true), commands);
        }
        if (status.count() >= 2) {
            commands.add(new NotifyStatus("已加入通话，等待连接..."));
        } else {
            commands.add(new NotifyStatus("等待对方加入..."));
        }
        return new Transition(next, commands);
    }

    private Transition onLocalOfferCreated(NegotiationSession session, LocalOfferCreated created) {
        if (session.state() != NegotiationState.WAITING_FOR_PEER
                || !session.offerRequested()
                || session.localDescription() != null) {
            logger.warn("状态 {} 下不应产生本地offer，丢弃。", session.state());
            return Transition.unchanged(session);
        }
        var next = session.withLocalDescription(created.offer()).withState(NegotiationState.HAVE_LOCAL_OFFER);
        return Transition.of(next,
                new ApplyLocalDescription(created.offer()),
                new SendSignal(SignalingMessage.offer(created.offer())),
                new NotifyStatus("正在等待对方应答..."));
    }

    private Transition onOfferReceived(NegotiationSession session, OfferReceived received) {
        var state = session.state();
        var acceptsOffer = state == NegotiationState.IDLE
                || state == NegotiationState.JOINING
                || state == NegotiationState.WAITING_FOR_PEER;
        if (!acceptsOffer || session.isInitiator() || session.remoteDescription() != null) {
            logger.warn("协议违规: 状态 {} (发起方={}) 下收到offer，已丢弃。", state, session.isInitiator());
            return Transition.unchanged(session);
        }

        var commands = new ArrayList<NegotiationCommand>();
        commands.add(new NotifyStatus("正在接听..."));
        commands.add(new ApplyRemoteDescription(received.offer()));
        commands.addAll(drainRemoteCandidates(session));
        commands.add(new CreateAnswer());
        var next = session.withRemoteDescription(received.offer())
                .withoutRemoteCandidates()
                .withState(NegotiationState.HAVE_REMOTE_OFFER);
        return new Transition(next, commands);
    }

    private Transition onLocalAnswerCreated(NegotiationSession session, LocalAnswerCreated created) {
        if (session.state() != NegotiationState.HAVE_REMOTE_OFFER || session.localDescription() != null) {
            logger.warn("状态 {} 下不应产生本地answer，丢弃。", session.state());
            return Transition.unchanged(session);
        }
        var next = session.withLocalDescription(created.answer()).withState(NegotiationState.CONNECTED);
        return Transition.of(next,
                new ApplyLocalDescription(created.answer()),
                new SendSignal(SignalingMessage.answer(created.answer())),
                new NotifyStatus("通话已连接！"));
    }

    private Transition onAnswerReceived(NegotiationSession session, AnswerReceived received) {
        if (session.state() != NegotiationState.HAVE_LOCAL_OFFER) {
            logger.warn("协议违规: 状态 {} 下收到answer (重复或乱序)，已丢弃。", session.state());
            return Transition.unchanged(session);
        }

        var commands = new ArrayList<NegotiationCommand>();
        commands.add(new ApplyRemoteDescription(received.answer()));
        commands.addAll(drainRemoteCandidates(session));
        commands.add(new NotifyStatus("通话已连接！"));
        var next = session.withRemoteDescription(received.answer())
                .withoutRemoteCandidates()
                .withState(NegotiationState.CONNECTED);
        return new Transition(next, commands);
    }

    private Transition onLocalCandidate(NegotiationSession session, LocalCandidate local) {
        var state = session.state();
        if (state == NegotiationState.IDLE || state == NegotiationState.JOINING) {
            return Transition.unchanged(session.plusLocalCandidate(local.candidate()));
        }
        return Transition.of(session, new SendSignal(SignalingMessage.iceCandidate(local.candidate())));
    }

    private Transition onRemoteCandidate(NegotiationSession session, RemoteCandidate remote) {
        if (session.remoteDescription() == null) {
            logger.debug("远端描述尚未设置，缓存ICE候选 (已缓存 {} 个)。", session.pendingRemoteCandidates().size() + 1);
            return Transition.unchanged(session.plusRemoteCandidate(remote.candidate()));
        }
        return Transition.of(session, new AddRemoteCandidate(remote.candidate()));
    }

    private Transition onEndRequested(NegotiationSession session) {
        if (session.state() == NegotiationState.IDLE) {
            return terminate(session, EndReason.LOCAL_HANGUP);
        }
        return terminate(session, EndReason.LOCAL_HANGUP, new SendSignal(SignalingMessage.of(MessageType.END_CALL)));
    }

    private Transition terminate(NegotiationSession session, EndReason reason, NegotiationCommand... before) {
        var commands = new ArrayList<NegotiationCommand>(List.of(before));
        commands.add(new ReleaseResources());
        commands.add(new NotifyStatus(reason.notice()));
        commands.add(new Terminate(reason));
        logger.info("通话结束: 状态 {} -> ENDED | 原因 {}", session.state(), reason);
        return new Transition(session.ended(reason), commands);
    }

    private static List<NegotiationCommand> flushLocalCandidates(NegotiationSession session) {
        return session.pendingLocalCandidates().stream()
                .<NegotiationCommand>map(candidate -> new SendSignal(SignalingMessage.iceCandidate(candidate)))
                .toList();
    }

    private static List<NegotiationCommand> drainRemoteCandidates(NegotiationSession session) {
        return session.pendingRemoteCandidates().stream()
                .<NegotiationCommand>map(AddRemoteCandidate::new)
                .toList();
    }
}
