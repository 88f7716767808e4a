package club.duocall.client;

import club.duocall.client.media.MediaAccessException;
import club.duocall.client.media.MediaCapture;
import club.duocall.client.media.MediaConstraints;
import club.duocall.client.media.MediaDevices;
import club.duocall.client.media.MediaTrack;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 不接触真实设备的媒体入口，记录释放次数。
 */
class FakeMediaDevices implements MediaDevices {

    private final MediaAccessException failure;
    final AtomicInteger releases = new AtomicInteger();
    volatile MediaConstraints requested;
    volatile FakeCapture capture;

    FakeMediaDevices() {
        this(null);
    }

    FakeMediaDevices(MediaAccessException failure) {
        this.failure = failure;
    }

    @Override
    public MediaCapture acquire(MediaConstraints constraints) throws MediaAccessException {
        requested = constraints;
        if (failure != null) {
            throw failure;
        }
        capture = new FakeCapture();
        return capture;
    }

    final class FakeCapture implements MediaCapture {
        final FakeTrack audio = new FakeTrack(MediaTrack.Kind.AUDIO);
        final FakeTrack video = new FakeTrack(MediaTrack.Kind.VIDEO);

        @Override
        public List<MediaTrack> tracks() {
            return List.of(audio, video);
        }

        @Override
        public void release() {
            audio.stop();
            video.stop();
            releases.incrementAndGet();
        }
    }

    static final class FakeTrack implements MediaTrack {
        private final Kind kind;
        private volatile boolean enabled = true;
        volatile boolean stopped;

        FakeTrack(Kind kind) {
            this.kind = kind;
        }

        @Override
        public Kind kind() {
            return kind;
        }

        @Override
        public boolean isEnabled() {
            return enabled;
        }

        @Override
        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        @Override
        public void stop() {
            stopped = true;
        }
    }
}
