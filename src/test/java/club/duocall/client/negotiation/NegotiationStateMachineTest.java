package club.duocall.client.negotiation;

import static org.assertj.core.api.Assertions.assertThat;

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
import club.duocall.dto.IceCandidate;
import club.duocall.dto.MessageType;
import club.duocall.dto.SessionDescription;
import club.duocall.dto.SignalingMessage;
import club.duocall.model.ParticipantRole;
import java.util.List;
import org.junit.jupiter.api.Test;

class NegotiationStateMachineTest {

    private static final SessionDescription OFFER = SessionDescription.offer("v=0 offer");
    private static final SessionDescription ANSWER = SessionDescription.answer("v=0 answer");

    private final NegotiationStateMachine machine = new NegotiationStateMachine();

    @Test
    void startMovesToJoining() {
        var t = machine.apply(NegotiationSession.idle(), new Start("r1"));

        assertThat(t.session().state()).isEqualTo(NegotiationState.JOINING);
        assertThat(t.session().roomId()).isEqualTo("r1");
        assertThat(t.commands()).hasSize(1).first().isInstanceOf(NotifyStatus.class);
    }

    @Test
    void firstJoinerWaitsAloneWithoutCreatingOffer() {
        var t = machine.apply(joining(), new RoomStatus(1, ParticipantRole.FIRST));

        assertThat(t.session().state()).isEqualTo(NegotiationState.WAITING_FOR_PEER);
        assertThat(t.session().isInitiator()).isTrue();
        assertThat(t.commands()).noneMatch(c -> c instanceof CreateOffer);
    }

    @Test
    void initiatorCreatesOfferExactlyOnceWhenPeerArrives() {
        var waiting = machine.apply(joining(), new RoomStatus(1, ParticipantRole.FIRST)).session();

        var first = machine.apply(waiting, new RoomStatus(2, ParticipantRole.FIRST));
        var repeated = machine.apply(first.session(), new RoomStatus(2, ParticipantRole.FIRST));

        assertThat(first.commands()).filteredOn(c -> c instanceof CreateOffer).hasSize(1);
        assertThat(first.session().offerRequested()).isTrue();
        assertThat(repeated.commands()).noneMatch(c -> c instanceof CreateOffer);
    }

    @Test
    void secondJoinerNeverCreatesOffer() {
        var t = machine.apply(joining(), new RoomStatus(2, ParticipantRole.SECOND));

        assertThat(t.session().role()).isEqualTo(ParticipantRole.SECOND);
        assertThat(t.commands()).noneMatch(c -> c instanceof CreateOffer);
    }

    @Test
    void initiatorPathReachesConnected() {
        var session = initiatorAwaitingOffer();

        var offered = machine.apply(session, new LocalOfferCreated(OFFER));
        assertThat(offered.session().state()).isEqualTo(NegotiationState.HAVE_LOCAL_OFFER);
        assertThat(offered.commands()).containsSubsequence(
                new ApplyLocalDescription(OFFER),
                new SendSignal(SignalingMessage.offer(OFFER)));

        var answered = machine.apply(offered.session(), new AnswerReceived(ANSWER));
        assertThat(answered.session().state()).isEqualTo(NegotiationState.CONNECTED);
        assertThat(answered.commands()).first().isEqualTo(new ApplyRemoteDescription(ANSWER));
    }

    @Test
    void responderPathReachesConnected() {
        var session = machine.apply(joining(), new RoomStatus(2, ParticipantRole.SECOND)).session();

        var received = machine.apply(session, new OfferReceived(OFFER));
        assertThat(received.session().state()).isEqualTo(NegotiationState.HAVE_REMOTE_OFFER);
        assertThat(received.commands()).containsSubsequence(new ApplyRemoteDescription(OFFER), new CreateAnswer());

        var answered = machine.apply(received.session(), new LocalAnswerCreated(ANSWER));
        assertThat(answered.session().state()).isEqualTo(NegotiationState.CONNECTED);
        assertThat(answered.commands()).containsSubsequence(
                new ApplyLocalDescription(ANSWER),
                new SendSignal(SignalingMessage.answer(ANSWER)));
    }

    @Test
    void offerArrivingBeforeRoomStatusIsStillAnswered() {
        var received = machine.apply(joining(), new OfferReceived(OFFER));

        assertThat(received.session().state()).isEqualTo(NegotiationState.HAVE_REMOTE_OFFER);
        assertThat(received.commands()).contains(new CreateAnswer());
    }

    @Test
    void lateRoomStatusRecordsRoleAndFlushesHeldCandidatesWithoutRestartingNegotiation() {
        var c1 = candidate("local1");
        var held = machine.apply(joining(), new LocalCandidate(c1)).session();
        var answering = machine.apply(held, new OfferReceived(OFFER)).session();
        var connected = machine.apply(answering, new LocalAnswerCreated(ANSWER)).session();

        var late = machine.apply(connected, new RoomStatus(2, ParticipantRole.SECOND));

        assertThat(late.session().state()).isEqualTo(NegotiationState.CONNECTED);
        assertThat(late.session().role()).isEqualTo(ParticipantRole.SECOND);
        assertThat(late.session().pendingLocalCandidates()).isEmpty();
        assertThat(late.session().remoteDescription()).isEqualTo(OFFER);
        assertThat(late.commands()).containsExactly(new SendSignal(SignalingMessage.iceCandidate(c1)));

        var repeated = machine.apply(late.session(), new RoomStatus(2, ParticipantRole.SECOND));
        assertThat(repeated.session()).isEqualTo(late.session());
        assertThat(repeated.commands()).isEmpty();
    }

    @Test
    void answerOutsideHaveLocalOfferIsDiscarded() {
        var waiting = initiatorAwaitingOffer();
        var connected = connectedInitiator();

        var early = machine.apply(waiting, new AnswerReceived(ANSWER));
        var duplicate = machine.apply(connected, new AnswerReceived(ANSWER));

        assertThat(early.session()).isEqualTo(waiting);
        assertThat(early.commands()).isEmpty();
        assertThat(duplicate.session()).isEqualTo(connected);
        assertThat(duplicate.commands()).isEmpty();
    }

    @Test
    void offerReceivedByInitiatorIsDiscarded() {
        var waiting = initiatorAwaitingOffer();

        var t = machine.apply(waiting, new OfferReceived(OFFER));

        assertThat(t.session()).isEqualTo(waiting);
        assertThat(t.commands()).isEmpty();
    }

    @Test
    void secondOfferIsDiscarded() {
        var session = machine.apply(joining(), new RoomStatus(2, ParticipantRole.SECOND)).session();
        var received = machine.apply(session, new OfferReceived(OFFER)).session();

        var again = machine.apply(received, new OfferReceived(SessionDescription.offer("v=0 other")));

        assertThat(again.session()).isEqualTo(received);
        assertThat(again.commands()).isEmpty();
    }

    @Test
    void remoteCandidatesAreQueuedUntilRemoteDescriptionThenAppliedInOrder() {
        var c1 = candidate("c1");
        var c2 = candidate("c2");
        var c3 = candidate("c3");
        var session = machine.apply(joining(), new RoomStatus(2, ParticipantRole.SECOND)).session();

        var t1 = machine.apply(session, new RemoteCandidate(c1));
        var t2 = machine.apply(t1.session(), new RemoteCandidate(c2));
        assertThat(t1.commands()).isEmpty();
        assertThat(t2.commands()).isEmpty();
        assertThat(t2.session().pendingRemoteCandidates()).containsExactly(c1, c2);

        var received = machine.apply(t2.session(), new OfferReceived(OFFER));
        assertThat(received.commands()).containsSubsequence(
                new ApplyRemoteDescription(OFFER),
                new AddRemoteCandidate(c1),
                new AddRemoteCandidate(c2),
                new CreateAnswer());
        assertThat(received.session().pendingRemoteCandidates()).isEmpty();

        var late = machine.apply(received.session(), new RemoteCandidate(c3));
        assertThat(late.commands()).containsExactly(new AddRemoteCandidate(c3));
    }

    @Test
    void initiatorDrainsCandidatesAfterAnswer() {
        var c1 = candidate("c1");
        var offered = machine.apply(initiatorAwaitingOffer(), new LocalOfferCreated(OFFER)).session();
        var queued = machine.apply(offered, new RemoteCandidate(c1)).session();

        var answered = machine.apply(queued, new AnswerReceived(ANSWER));

        assertThat(answered.commands()).containsSubsequence(new ApplyRemoteDescription(ANSWER), new AddRemoteCandidate(c1));
    }

    @Test
    void localCandidatesAreHeldUntilJoinConfirmed() {
        var c1 = candidate("local1");
        var held = machine.apply(joining(), new LocalCandidate(c1));
        assertThat(held.commands()).isEmpty();

        var confirmed = machine.apply(held.session(), new RoomStatus(1, ParticipantRole.FIRST));
        assertThat(confirmed.commands()).first().isEqualTo(
                new SendSignal(SignalingMessage.iceCandidate(c1)));
        assertThat(confirmed.session().pendingLocalCandidates()).isEmpty();

        var later = machine.apply(confirmed.session(), new LocalCandidate(candidate("local2")));
        assertThat(later.commands()).hasSize(1);
    }

    @Test
    void hangupSendsEndCallThenReleasesAndTerminates() {
        var t = machine.apply(connectedInitiator(), new EndRequested());

        assertThat(t.session().state()).isEqualTo(NegotiationState.ENDED);
        assertThat(t.session().endReason()).isEqualTo(EndReason.LOCAL_HANGUP);
        assertThat(t.commands().get(0)).isInstanceOfSatisfying(SendSignal.class,
                send -> assertThat(send.message().type()).isEqualTo(MessageType.END_CALL));
        assertThat(t.commands()).containsSubsequence(new ReleaseResources(), new Terminate(EndReason.LOCAL_HANGUP));
    }

    @Test
    void hangupBeforeStartDoesNotSignal() {
        var t = machine.apply(NegotiationSession.idle(), new EndRequested());

        assertThat(t.session().isEnded()).isTrue();
        assertThat(t.commands()).noneMatch(c -> c instanceof SendSignal);
    }

    @Test
    void terminalEventsMapToEndReasons() {
        assertEnds(new PeerDisconnected(), EndReason.PEER_DISCONNECTED);
        assertEnds(new CallEnded(), EndReason.CALL_ENDED_BY_PEER);
        assertEnds(new RoomFull(), EndReason.ROOM_FULL);
        assertEnds(new RelayLost(1006), EndReason.RELAY_LOST);
        assertEnds(new TransportFailed("ice failed"), EndReason.TRANSPORT_FAILURE);
        assertEnds(new MediaAccessDenied("denied"), EndReason.MEDIA_ACCESS_DENIED);
    }

    @Test
    void endedSessionIgnoresEverything() {
        var ended = machine.apply(connectedInitiator(), new PeerDisconnected()).session();

        for (var event : List.of(new EndRequested(), new OfferReceived(OFFER), new RemoteCandidate(candidate("x")),
                new RoomStatus(2, ParticipantRole.FIRST), new TransportFailed("late"))) {
            var t = machine.apply(ended, event);
            assertThat(t.session()).isEqualTo(ended);
            assertThat(t.commands()).isEmpty();
        }
    }

    @Test
    void endingDropsQueuedCandidates() {
        var queued = machine.apply(joining(), new RemoteCandidate(candidate("c1"))).session();

        var ended = machine.apply(queued, new RelayLost(1006)).session();

        assertThat(ended.pendingRemoteCandidates()).isEmpty();
        assertThat(ended.pendingLocalCandidates()).isEmpty();
    }

    private void assertEnds(NegotiationEvent event, EndReason reason) {
        var t = machine.apply(connectedInitiator(), event);
        assertThat(t.session().endReason()).isEqualTo(reason);
        assertThat(t.commands()).endsWith(new ReleaseResources(), new NotifyStatus(reason.notice()), new Terminate(reason));
    }

    private NegotiationSession joining() {
        return machine.apply(NegotiationSession.idle(), new Start("r1")).session();
    }

    private NegotiationSession initiatorAwaitingOffer() {
        var waiting = machine.apply(joining(), new RoomStatus(1, ParticipantRole.FIRST)).session();
        return machine.apply(waiting, new RoomStatus(2, ParticipantRole.FIRST)).session();
    }

    private NegotiationSession connectedInitiator() {
        var offered = machine.apply(initiatorAwaitingOffer(), new LocalOfferCreated(OFFER)).session();
        return machine.apply(offered, new AnswerReceived(ANSWER)).session();
    }

    private static IceCandidate candidate(String id) {
        return new IceCandidate("candidate:" + id + " 1 udp 2122260223 192.168.1.5 54321 typ host", "0", 0);
    }
}
