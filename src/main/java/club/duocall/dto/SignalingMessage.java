/**
 * 此文件定义了通话房间信令消息的数据传输对象(DTO)。
 *
 * 使用JDK 17的`record`类型实现，提供了不可变性、简洁性和自动生成的方法。
 * `@JsonInclude(JsonInclude.Include.NON_NULL)`确保在序列化为JSON时，
 * null值的字段会被忽略，从而保持消息体的整洁。
 * 服务器端只读取`type`字段并原样转发其余内容，此记录主要供客户端使用和服务器构造通知消息。
 *
 * 关联:
 * - `RoomSignalingHandler`, `SignalingRelay`: 创建服务器通知消息。
 * - `CallController`: 解析收到的消息并发送协商消息。
 * - `MessageType`: 作为此记录的一个字段，定义了消息的类型。
 */
package club.duocall.dto;

import club.duocall.model.ParticipantRole;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record SignalingMessage(
        MessageType type,
        String room,
        SessionDescription offer,
        SessionDescription answer,
        IceCandidate candidate,
        Integer count,
        ParticipantRole role,
        String error) {

    public static SignalingMessage join(String room) {
        return new SignalingMessage(MessageType.JOIN, room, null, null, null, null, null, null);
    }

    public static SignalingMessage roomStatus(int count, ParticipantRole role) {
        return new SignalingMessage(MessageType.ROOM_STATUS, null, null, null, null, count, role, null);
    }

    public static SignalingMessage offer(SessionDescription offer) {
        return new SignalingMessage(MessageType.OFFER, null, offer, null, null, null, null, null);
    }

    public static SignalingMessage answer(SessionDescription answer) {
        return new SignalingMessage(MessageType.ANSWER, null, null, answer, null, null, null, null);
    }

    public static SignalingMessage iceCandidate(IceCandidate candidate) {
        return new SignalingMessage(MessageType.ICE_CANDIDATE, null, null, null, candidate, null, null, null);
    }

    public static SignalingMessage of(MessageType type) {
        return new SignalingMessage(type, null, null, null, null, null, null, null);
    }

    public static SignalingMessage error(String error) {
        return new SignalingMessage(MessageType.ERROR, null, null, null, null, null, null, error);
    }

    /**
     * 重写toString方法以避免在日志中记录完整的会话描述和候选地址。
     */
    @Override
    public String toString() {
        var builder = new StringBuilder("SignalingMessage{");
        builder.append("type=").append(type);
        if (room != null) builder.append(", room='").append(room).append('\'');
        if (offer != null) builder.append(", offer='<sdp>'");
        if (answer != null) builder.append(", answer='<sdp>'");
        if (candidate != null) builder.append(", candidate='<ice>'");
        if (count != null) builder.append(", count=").append(count);
        if (role != null) builder.append(", role=").append(role);
        if (error != null) builder.append(", error='").append(error).append('\'');
        builder.append('}');
        return builder.toString();
    }
}
