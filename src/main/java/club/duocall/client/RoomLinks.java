/**
 * 房间ID与分享链接之间的转换。
 *
 * 主动发起方生成一个新的随机房间ID并把它作为`room`查询参数放进分享链接；
 * 加入方从收到的链接中读出房间ID，而不是自己生成。
 */
package club.duocall.client;

import java.net.URI;
import java.security.SecureRandom;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.web.util.UriComponentsBuilder;

public final class RoomLinks {

    public static final String ROOM_QUERY_PARAM = "room";

    private static final String ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ROOM_ID_LENGTH = 10;
    private static final Pattern ROOM_ID_PATTERN = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final SecureRandom RANDOM = new SecureRandom();

    private RoomLinks() {}

    public static String generateRoomId() {
        var builder = new StringBuilder(ROOM_ID_LENGTH);
        for (int i = 0; i < ROOM_ID_LENGTH; i++) {
            builder.append(ALPHABET.charAt(RANDOM.nextInt(ALPHABET.length())));
        }
        return builder.toString();
    }

    public static boolean isValidRoomId(String roomId) {
        return roomId != null && ROOM_ID_PATTERN.matcher(roomId).matches();
    }

    /**
     * 在页面地址上设置`room`参数，已有的同名参数会被替换。
     */
    public static String shareLink(String pageUrl, String roomId) {
        return UriComponentsBuilder.fromUriString(pageUrl)
                .replaceQueryParam(ROOM_QUERY_PARAM, roomId)
                .build()
                .toUriString();
    }

    /**
     * 从分享链接中读出房间ID。
     *
     * @return 链接中没有合法的`room`参数时为空。
     */
    public static Optional<String> extractRoomId(String link) {
        if (link == null || link.isBlank()) {
            return Optional.empty();
        }
        var roomId = UriComponentsBuilder.fromUriString(link).build().getQueryParams().getFirst(ROOM_QUERY_PARAM);
        return isValidRoomId(roomId) ? Optional.of(roomId) : Optional.empty();
    }

    /**
     * 信令连接地址: `{base}/ws/video/{room}/`。
     */
    public static URI relayUri(URI relayBaseUri, String roomId) {
        return UriComponentsBuilder.fromUri(relayBaseUri)
                .pathSegment("ws", "video", roomId)
                .path("/")
                .build()
                .toUri();
    }
}
