package club.duocall.client.rtc;

public enum IceConnectionState {
    NEW,
    CHECKING,
    CONNECTED,
    COMPLETED,
    DISCONNECTED,
    FAILED,
    CLOSED;

    public boolean isEstablished() {
        return this == CONNECTED || this == COMPLETED;
    }
}
