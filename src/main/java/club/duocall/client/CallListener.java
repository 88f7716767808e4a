package club.duocall.client;

import club.duocall.client.negotiation.EndReason;
import club.duocall.client.negotiation.NegotiationState;
import club.duocall.client.rtc.ConnectionRoute;

/**
 * 面向界面的通话回调。所有回调都在通话的事件循环线程上执行，不应长时间阻塞。
 */
public interface CallListener {

    /** 展示给用户的状态提示。 */
    default void onStatus(String message) {}

    default void onStateChanged(NegotiationState previous, NegotiationState current) {}

    /** 媒体路径检测结果。 */
    default void onRouteDetected(ConnectionRoute route) {}

    /** 通话结束，每通电话只回调一次。 */
    default void onCallEnded(EndReason reason) {}
}
