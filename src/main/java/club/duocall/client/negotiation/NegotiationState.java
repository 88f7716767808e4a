package club.duocall.client.negotiation;

/**
 * 单个参与者的协商状态。`ENDED`是终止状态，进入后不再离开。
 */
public enum NegotiationState {
    IDLE,
    JOINING,
    WAITING_FOR_PEER,
    HAVE_LOCAL_OFFER,
    HAVE_REMOTE_OFFER,
    CONNECTED,
    ENDED;

    public boolean isNegotiating() {
        return this == HAVE_LOCAL_OFFER || this == HAVE_REMOTE_OFFER;
    }
}
