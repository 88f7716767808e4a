package club.duocall.client.media;

/**
 * 一条本地采集的音频或视频轨道。
 */
public interface MediaTrack {

    enum Kind { AUDIO, VIDEO }

    Kind kind();

    boolean isEnabled();

    /**
     * 启用或静音该轨道。不会触发会话重新协商。
     */
    void setEnabled(boolean enabled);

    /**
     * 停止采集。停止后轨道不可再启用。
     */
    void stop();
}
