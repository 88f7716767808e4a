package club.duocall.exception;

/**
 * 建立通话失败 (信令服务器不可达、加入超时等)，区别于房间已满和媒体权限错误。
 */
public class CallSetupException extends RuntimeException {

    public CallSetupException(String message) {
        super(message);
    }

    public CallSetupException(String message, Throwable cause) {
        super(message, cause);
    }
}
