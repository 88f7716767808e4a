package club.duocall.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 会话描述 (offer/answer)。对信令层而言是不透明的负载，只在两端的传输库之间传递。
 *
 * @param type `offer` 或 `answer`。
 * @param sdp  会话描述文本。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionDescription(String type, String sdp) {

    public static SessionDescription offer(String sdp) {
        return new SessionDescription("offer", sdp);
    }

    public static SessionDescription answer(String sdp) {
        return new SessionDescription("answer", sdp);
    }

    @Override
    public String toString() {
        // 不在日志中输出完整的SDP
        return "SessionDescription{type=" + type + ", sdp=<" + (sdp == null ? 0 : sdp.length()) + " chars>}";
    }
}
