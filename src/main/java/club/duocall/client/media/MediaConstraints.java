package club.duocall.client.media;

/**
 * 申请本地媒体时的约束条件。
 */
public record MediaConstraints(
        boolean audio,
        boolean video,
        int idealWidth,
        int idealHeight,
        String facingMode,
        boolean echoCancellation,
        boolean noiseSuppression,
        boolean autoGainControl) {

    /**
     * 1280x720前置摄像头，音频开启回声消除、降噪和自动增益。
     */
    public static MediaConstraints defaults() {
        return new MediaConstraints(true, true, 1280, 720, "user", true, true, true);
    }
}
