/**
 * 此文件定义了一通双人通话的客户端控制器。
 *
 * 主要职责:
 * - 确定房间ID: 主动发起时生成新的ID (`host`)，通过链接加入时从链接中读取 (`joinFromLink`)。
 * - 在加入房间之前先获取本地媒体，并用其创建对等连接。
 * - 把信令消息和传输库回调翻译成`NegotiationEvent`，在单线程事件循环中交给`NegotiationStateMachine`，
 *   再依次执行状态机返回的命令。
 * - 提供幂等的`end()`以及不触发重新协商的`muteAudio()` / `disableVideo()`。
 *
 * 错误传播:
 * - 房间已满 (`RoomFullException`) 和媒体权限错误 (`MediaAccessException`) 由`start`同步抛给调用方，不自动重试。
 * - 协议违规在状态机内部记录并丢弃，不向外传播。
 * - 传输失败使通话进入`ENDED`，并通过`CallListener.onCallEnded`报告一次。
 *
 * 关联:
 * - `NegotiationStateMachine`: 纯粹的状态迁移函数。
 * - `RelayConnector`: 信令连接。
 * - `MediaDevices`, `PeerConnectionFactory`: 底层媒体和传输库的接入点。
 */
package club.duocall.client;

import club.duocall.client.media.MediaAccessException;
import club.duocall.client.media.MediaCapture;
import club.duocall.client.media.MediaDevices;
import club.duocall.client.media.MediaTrack;
import club.duocall.client.negotiation.NegotiationCommand;
import club.duocall.client.negotiation.NegotiationCommand.AddRemoteCandidate;
import club.duocall.client.negotiation.NegotiationCommand.ApplyLocalDescription;
import club.duocall.client.negotiation.NegotiationCommand.ApplyRemoteDescription;
import club.duocall.client.negotiation.NegotiationCommand.CreateAnswer;
import club.duocall.client.negotiation.NegotiationCommand.CreateOffer;
import club.duocall.client.negotiation.NegotiationCommand.NotifyStatus;
import club.duocall.client.negotiation.NegotiationCommand.ReleaseResources;
import club.duocall.client.negotiation.NegotiationCommand.SendSignal;
import club.duocall.client.negotiation.NegotiationCommand.Terminate;
import club.duocall.client.negotiation.NegotiationEvent;
import club.duocall.client.negotiation.NegotiationSession;
import club.duocall.client.negotiation.NegotiationState;
import club.duocall.client.negotiation.NegotiationStateMachine;
import club.duocall.client.negotiation.EndReason;
import club.duocall.client.rtc.CandidatePairStats;
import club.duocall.client.rtc.IceConnectionState;
import club.duocall.client.rtc.PeerConnection;
import club.duocall.client.rtc.PeerConnectionConfiguration;
import club.duocall.client.rtc.PeerConnectionFactory;
import club.duocall.client.rtc.PeerConnectionObserver;
import club.duocall.dto.IceCandidate;
import club.duocall.dto.SignalingCloseStatus;
import club.duocall.dto.SignalingMessage;
import club.duocall.exception.CallSetupException;
import club.duocall.exception.RoomFullException;
import club.duocall.model.ParticipantRole;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class CallController {
    private static final Logger logger = LoggerFactory.getLogger(CallController.class);

    private static final long END_TIMEOUT_SECONDS = 5;
    private static final long FIRST_ROUTE_CHECK_DELAY_MS = 1000;
    // 未收到关闭帧的异常断开
    private static final int ABNORMAL_CLOSE_CODE = 1006;

    private final CallClientSettings settings;
    private final MediaDevices mediaDevices;
    private final PeerConnectionFactory peerConnectionFactory;
    private final RelayConnector relayConnector;
    private final CallListener listener;
    private final NegotiationStateMachine stateMachine = new NegotiationStateMachine();
    private final ScheduledExecutorService eventLoop;
    private final CompletableFuture<ParticipantRole> joined = new CompletableFuture<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    private volatile Thread eventLoopThread;
    private volatile NegotiationSession session = NegotiationSession.idle();
    private volatile MediaCapture mediaCapture;
    private volatile PeerConnection peerConnection;
    private volatile RelayChannel channel;
    private volatile String roomId;

    // 以下字段只在事件循环线程上访问
    private IceConnectionState iceState = IceConnectionState.NEW;
    private ScheduledFuture<?> routeCheck;

    public CallController(CallClientSettings settings,
                          MediaDevices mediaDevices,
                          PeerConnectionFactory peerConnectionFactory,
                          RelayConnector relayConnector,
                          CallListener listener) {
        this.settings = settings;
        this.mediaDevices = mediaDevices;
        this.peerConnectionFactory = peerConnectionFactory;
        this.relayConnector = relayConnector;
        this.listener = listener;
        this.eventLoop = Executors.newSingleThreadScheduledExecutor(runnable -> {
            var thread = new Thread(runnable, "call-event-loop");
            thread.setDaemon(true);
            eventLoopThread = thread;
            return thread;
        });
    }

    /**
     * 生成新的房间ID并作为第一名成员加入。
     *
     * @return 新房间的ID，用于生成分享链接。
     */
    public String host() throws MediaAccessException {
        var newRoomId = RoomLinks.generateRoomId();
        start(newRoomId);
        return newRoomId;
    }

    /**
     * 通过分享链接加入房间。
     *
     * @throws IllegalArgumentException 链接中没有有效的房间ID。
     */
    public ParticipantRole joinFromLink(String link) throws MediaAccessException {
        var linkedRoomId = RoomLinks.extractRoomId(link)
                .orElseThrow(() -> new IllegalArgumentException("链接中没有有效的房间ID: " + link));
        return start(linkedRoomId);
    }

    /**
     * 获取本地媒体、连接信令服务器并加入房间，直到服务器确认加入后返回。
     *
     * @return 本参与者的加入顺序；`FIRST`表示本方将发起会话。
     * @throws MediaAccessException 无法获取摄像头或麦克风。
     * @throws RoomFullException    房间已有两名成员。
     * @throws CallSetupException   信令服务器不可达或确认超时。
     */
    public ParticipantRole start(String targetRoomId) throws MediaAccessException {
        if (!RoomLinks.isValidRoomId(targetRoomId)) {
            throw new IllegalArgumentException("无效的房间ID: " + targetRoomId);
        }
        if (session.isEnded() || !started.compareAndSet(false, true)) {
            throw new IllegalStateException("每个CallController只能开始一次通话");
        }
        this.roomId = targetRoomId;

        try {
            logger.info("正在申请本地媒体...");
            mediaCapture = mediaDevices.acquire(settings.mediaConstraints());
        } catch (MediaAccessException e) {
            logger.error("无法获取本地媒体: {} ({})", e.getMessage(), e.getReason());
            runAndWait(new NegotiationEvent.MediaAccessDenied(e.getMessage()));
            throw e;
        }
        logger.info("本地媒体已就绪，轨道数: {}", mediaCapture.tracks().size());

        peerConnection = peerConnectionFactory.create(
                new PeerConnectionConfiguration(settings.iceServers(), settings.iceCandidatePoolSize()),
                new TransportObserver());
        mediaCapture.tracks().forEach(peerConnection::addTrack);

        dispatch(new NegotiationEvent.Start(targetRoomId));

        var timeoutMs = settings.joinTimeout().toMillis();
        var connecting = relayConnector.connect(RoomLinks.relayUri(settings.relayBaseUri(), targetRoomId), new RelayEvents());
        try {
            var relay = connecting.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (session.isEnded()) {
                // 连接建立期间通话已被结束
                closeLateChannel(relay);
            }
            var role = joined.get(timeoutMs, TimeUnit.MILLISECONDS);
            logger.info("已加入房间 '{}'，顺序: {}", targetRoomId, role);
            return role;
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof RoomFullException roomFull) {
                throw roomFull;
            }
            runAndWait(new NegotiationEvent.RelayLost(ABNORMAL_CLOSE_CODE));
            if (cause instanceof CallSetupException setupException) {
                throw setupException;
            }
            throw new CallSetupException("无法连接信令服务器", cause);
        } catch (TimeoutException e) {
            connecting.cancel(false);
            end();
            throw new CallSetupException("加入房间超时 (" + timeoutMs + " ms)", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connecting.cancel(false);
            end();
            throw new CallSetupException("加入房间时被中断", e);
        }
    }

    /**
     * 结束通话并释放媒体采集、对等连接和信令连接。可以在任何状态下调用，重复调用无副作用。
     */
    public void end() {
        if (session.isEnded()) {
            return;
        }
        runAndWait(new NegotiationEvent.EndRequested());
    }

    /**
     * 切换麦克风轨道的启用状态，不重新协商会话。
     *
     * @return 切换后音频轨道是否处于启用状态。
     */
    public boolean muteAudio() {
        return toggleTrack(MediaTrack.Kind.AUDIO);
    }

    /**
     * 切换摄像头轨道的启用状态，不重新协商会话。
     *
     * @return 切换后视频轨道是否处于启用状态。
     */
    public boolean disableVideo() {
        return toggleTrack(MediaTrack.Kind.VIDEO);
    }

    public NegotiationState state() {
        return session.state();
    }

    public ParticipantRole role() {
        return session.role();
    }

    public NegotiationSession snapshot() {
        return session;
    }

    public String roomId() {
        return roomId;
    }

    /**
     * 阻塞直到事件循环处理完当前已排队的事件，以及由这些事件同步引发的后续事件。
     *
     * <p>状态和回调都在事件循环上异步更新。界面或宿主程序需要在某个操作之后读取一致的
     * `snapshot()` 时 (例如调用`end()`后关闭窗口之前)，可以先调用此方法。通话结束后立即返回。
     *
     * @throws IllegalStateException 事件循环在超时时间内没有响应。
     */
    public void awaitIdle() throws InterruptedException {
        for (int i = 0; i < 10; i++) {
            var barrier = new CompletableFuture<Void>();
            try {
                eventLoop.execute(() -> barrier.complete(null));
            } catch (RejectedExecutionException e) {
                return;
            }
            try {
                barrier.get(END_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (ExecutionException | TimeoutException e) {
                throw new IllegalStateException("事件循环没有响应", e);
            }
        }
    }

    private boolean toggleTrack(MediaTrack.Kind kind) {
        var capture = mediaCapture;
        if (capture == null || session.isEnded()) {
            logger.warn("没有可用的本地媒体，无法切换{}轨道。", kind);
            return false;
        }
        var track = capture.firstTrack(kind).orElse(null);
        if (track == null) {
            logger.warn("本地媒体中没有{}轨道。", kind);
            return false;
        }
        var enabled = !track.isEnabled();
        track.setEnabled(enabled);
        logger.info("{}轨道已{}", kind, enabled ? "启用" : "停用");
        return enabled;
    }

    private void dispatch(NegotiationEvent event) {
        try {
            eventLoop.execute(() -> handle(event));
        } catch (RejectedExecutionException e) {
            logger.debug("事件循环已停止，忽略事件: {}", event.getClass().getSimpleName());
        }
    }

    private void runOnLoop(Runnable task) {
        try {
            eventLoop.execute(task);
        } catch (RejectedExecutionException e) {
            logger.debug("事件循环已停止，忽略回调。");
        }
    }

    private void runAndWait(NegotiationEvent event) {
        if (Thread.currentThread() == eventLoopThread) {
            handle(event);
            return;
        }
        var done = new CompletableFuture<Void>();
        try {
            eventLoop.execute(() -> {
                handle(event);
                done.complete(null);
            });
        } catch (RejectedExecutionException e) {
            return;
        }
        try {
            done.get(END_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException | TimeoutException e) {
            logger.warn("等待事件 {} 处理完成失败: {}", event.getClass().getSimpleName(), e.getMessage());
        }
    }

    private void handle(NegotiationEvent event) {
        var previous = session;
        var transition = stateMachine.apply(previous, event);
        session = transition.session();

        if (previous.state() != session.state()) {
            logger.info("协商状态: {} -> {}", previous.state(), session.state());
            notifyListener(() -> listener.onStateChanged(previous.state(), session.state()));
        }
        for (var command : transition.commands()) {
            execute(command);
        }
        if (session.role() != null && !session.isEnded()) {
            joined.complete(session.role());
        }
    }

    private void execute(NegotiationCommand command) {
        var connection = peerConnection;
        if (command instanceof CreateOffer) {
            if (connection == null) return;
            connection.createOffer().whenComplete((offer, error) -> dispatch(error == null
                    ? new NegotiationEvent.LocalOfferCreated(offer)
                    : new NegotiationEvent.TransportFailed("创建offer失败: " + error.getMessage())));
        } else if (command instanceof CreateAnswer) {
            if (connection == null) return;
            connection.createAnswer().whenComplete((answer, error) -> dispatch(error == null
                    ? new NegotiationEvent.LocalAnswerCreated(answer)
                    : new NegotiationEvent.TransportFailed("创建answer失败: " + error.getMessage())));
        } else if (command instanceof ApplyLocalDescription apply) {
            if (connection == null) return;
            failOnError(connection.setLocalDescription(apply.description()), "设置本地描述失败");
        } else if (command instanceof ApplyRemoteDescription apply) {
            if (connection == null) return;
            failOnError(connection.setRemoteDescription(apply.description()), "设置远端描述失败");
        } else if (command instanceof AddRemoteCandidate add) {
            if (connection == null) return;
            connection.addIceCandidate(add.candidate()).whenComplete((ignored, error) -> {
                if (error != null) {
                    // 单个候选地址无效不影响通话
                    logger.warn("应用ICE候选失败: {}", error.getMessage());
                }
            });
        } else if (command instanceof SendSignal send) {
            var relay = channel;
            if (relay == null) {
                logger.warn("信令连接尚未建立，消息未发送: {}", send.message().type());
                return;
            }
            relay.send(send.message());
        } else if (command instanceof NotifyStatus notify) {
            notifyListener(() -> listener.onStatus(notify.message()));
        } else if (command instanceof ReleaseResources) {
            releaseResources();
        } else if (command instanceof Terminate terminate) {
            failPendingJoin(terminate.reason());
            notifyListener(() -> listener.onCallEnded(terminate.reason()));
        }
    }

    private void closeLateChannel(RelayChannel relay) {
        if (relay != null && relay.isOpen()) {
            logger.info("通话已结束，关闭迟到的信令连接: 房间 '{}'", roomId);
            relay.close();
        }
    }

    private void failOnError(CompletableFuture<Void> operation, String what) {
        operation.whenComplete((ignored, error) -> {
            if (error != null) {
                dispatch(new NegotiationEvent.TransportFailed(what + ": " + error.getMessage()));
            }
        });
    }

    private void failPendingJoin(EndReason reason) {
        if (joined.isDone()) {
            return;
        }
        if (reason == EndReason.ROOM_FULL) {
            joined.completeExceptionally(new RoomFullException(roomId));
        } else {
            joined.completeExceptionally(new CallSetupException(reason.notice()));
        }
    }

    private void releaseResources() {
        if (routeCheck != null) {
            routeCheck.cancel(false);
            routeCheck = null;
        }
        var capture = mediaCapture;
        if (capture != null) {
            capture.release();
        }
        var connection = peerConnection;
        if (connection != null) {
            connection.close();
        }
        var relay = channel;
        if (relay != null) {
            relay.close();
        }
        logger.info("通话资源已释放: 房间 '{}'", roomId);
        // 已排队的任务仍会执行，之后的事件一律被拒绝
        eventLoop.shutdown();
    }

    private void onIceConnectionState(IceConnectionState state) {
        iceState = state;
        logger.info("ICE连接状态: {}", state);
        switch (state) {
            case CHECKING -> notifyListener(() -> listener.onStatus("正在连接对方..."));
            case CONNECTED, COMPLETED -> scheduleRouteChecks();
            case DISCONNECTED -> notifyListener(() -> listener.onStatus("对方网络连接中断"));
            case FAILED -> handle(new NegotiationEvent.TransportFailed("ICE连接失败"));
            default -> logger.debug("忽略ICE连接状态: {}", state);
        }
    }

    private void scheduleRouteChecks() {
        if (session.isEnded()) {
            return;
        }
        try {
            eventLoop.schedule(this::checkRoute, FIRST_ROUTE_CHECK_DELAY_MS, TimeUnit.MILLISECONDS);
            if (routeCheck == null) {
                var intervalMs = settings.routeCheckInterval().toMillis();
                routeCheck = eventLoop.scheduleWithFixedDelay(this::checkRoute, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            }
        } catch (RejectedExecutionException e) {
            logger.debug("事件循环已停止，不再检查媒体路径。");
        }
    }

    private void checkRoute() {
        var connection = peerConnection;
        if (session.isEnded() || !iceState.isEstablished() || connection == null) {
            return;
        }
        connection.activeCandidatePair()
                .whenComplete((pair, error) -> runOnLoop(() -> reportRoute(pair, error)));
    }

    private void reportRoute(Optional<CandidatePairStats> pair, Throwable error) {
        if (session.isEnded()) {
            return;
        }
        if (error != null) {
            logger.warn("检查媒体路径失败: {}", error.getMessage());
            return;
        }
        if (pair == null || pair.isEmpty()) {
            logger.debug("尚未选定候选地址对。");
            return;
        }
        var stats = pair.get();
        var route = stats.route();
        logger.info("媒体路径: {} | 本地 {} ({}) | 远端 {} ({})", route.label(),
                stats.localCandidateType(), CandidatePairStats.maskAddress(stats.localAddress()),
                stats.remoteCandidateType(), CandidatePairStats.maskAddress(stats.remoteAddress()));
        notifyListener(() -> listener.onRouteDetected(route));
    }

    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.error("CallListener回调抛出异常: {}", e.getMessage(), e);
        }
    }

    private final class RelayEvents implements RelayListener {

        @Override
        public void onOpen(RelayChannel openedChannel) {
            // 先发布连接再检查状态: 释放资源时要么能看到这条连接，要么这里能看到通话已结束
            channel = openedChannel;
            if (session.isEnded()) {
                closeLateChannel(openedChannel);
                return;
            }
            openedChannel.send(SignalingMessage.join(roomId));
        }

        @Override
        public void onMessage(SignalingMessage message) {
            if (message.type() == null) {
                logger.warn("收到未知类型的信令消息，已忽略。");
                return;
            }
            switch (message.type()) {
                case ROOM_STATUS -> {
                    if (message.count() == null) {
                        logger.warn("房间状态消息缺少成员数，已忽略。");
                        return;
                    }
                    dispatch(new NegotiationEvent.RoomStatus(message.count(), message.role()));
                }
                case OFFER -> {
                    if (message.offer() == null) {
                        logger.warn("offer消息缺少会话描述，已忽略。");
                        return;
                    }
                    dispatch(new NegotiationEvent.OfferReceived(message.offer()));
                }
                case ANSWER -> {
                    if (message.answer() == null) {
                        logger.warn("answer消息缺少会话描述，已忽略。");
                        return;
                    }
                    dispatch(new NegotiationEvent.AnswerReceived(message.answer()));
                }
                case ICE_CANDIDATE -> {
                    if (message.candidate() != null) {
                        dispatch(new NegotiationEvent.RemoteCandidate(message.candidate()));
                    }
                }
                case PEER_DISCONNECTED -> dispatch(new NegotiationEvent.PeerDisconnected());
                case CALL_ENDED -> dispatch(new NegotiationEvent.CallEnded());
                case JOIN -> logger.debug("对方已进入房间 '{}'", message.room());
                case PONG -> logger.debug("收到Pong。");
                case ERROR -> logger.warn("信令服务器返回错误: {}", message.error());
                default -> logger.warn("客户端不处理的消息类型: {}", message.type());
            }
        }

        @Override
        public void onClosed(int code, String reason) {
            if (code == SignalingCloseStatus.ROOM_FULL_CODE) {
                logger.warn("房间 '{}' 已满: {}", roomId, reason);
                dispatch(new NegotiationEvent.RoomFull());
            } else {
                dispatch(new NegotiationEvent.RelayLost(code));
            }
        }
    }

    private final class TransportObserver implements PeerConnectionObserver {

        @Override
        public void onIceCandidate(IceCandidate candidate) {
            dispatch(new NegotiationEvent.LocalCandidate(candidate));
        }

        @Override
        public void onIceConnectionStateChange(IceConnectionState state) {
            runOnLoop(() -> onIceConnectionState(state));
        }

        @Override
        public void onRemoteTrack(MediaTrack track) {
            logger.info("收到远端{}轨道。", track.kind());
        }
    }
}
