package club.duocall.client.media;

import java.util.List;
import java.util.Optional;

/**
 * 本地音视频采集句柄，由一个`CallController`独占，通话结束时释放。
 */
public interface MediaCapture {

    List<MediaTrack> tracks();

    default Optional<MediaTrack> firstTrack(MediaTrack.Kind kind) {
        return tracks().stream().filter(track -> track.kind() == kind).findFirst();
    }

    /**
     * 停止所有轨道并释放设备。重复调用无副作用。
     */
    void release();
}
