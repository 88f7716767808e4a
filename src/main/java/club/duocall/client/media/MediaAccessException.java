package club.duocall.client.media;

/**
 * 无法获取本地媒体设备。对通话的启动是致命的，需要展示给用户。
 */
public class MediaAccessException extends Exception {

    public enum Reason {
        PERMISSION_DENIED("摄像头或麦克风访问被拒绝，请检查权限设置。"),
        DEVICE_NOT_FOUND("未找到摄像头或麦克风，请检查设备。"),
        DEVICE_IN_USE("摄像头或麦克风正被其他应用程序占用。"),
        ABORTED("媒体采集已中止。"),
        INSECURE_CONTEXT("当前环境不允许访问媒体设备。"),
        UNKNOWN("获取媒体设备时发生未知错误。");

        private final String userMessage;

        Reason(String userMessage) {
            this.userMessage = userMessage;
        }

        public String userMessage() {
            return userMessage;
        }
    }

    private final Reason reason;

    public MediaAccessException(Reason reason, String detail) {
        super(detail == null ? reason.userMessage() : reason.userMessage() + " (" + detail + ")");
        this.reason = reason;
    }

    public MediaAccessException(Reason reason, Throwable cause) {
        super(reason.userMessage(), cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
