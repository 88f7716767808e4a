package club.duocall.client.media;

/**
 * 本地媒体设备的入口。实现可能因等待用户授权而长时间阻塞。
 */
public interface MediaDevices {

    /**
     * 按约束申请摄像头和麦克风。
     *
     * @throws MediaAccessException 权限被拒绝、设备不存在或被占用等。
     */
    MediaCapture acquire(MediaConstraints constraints) throws MediaAccessException;
}
