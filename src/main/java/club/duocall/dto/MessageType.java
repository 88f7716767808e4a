/**
 * 此文件定义了通话房间信令协议中使用的所有消息类型。
 *
 * `enum` 提供了一种类型安全的方式来识别和处理不同种类的信令消息。
 * 每个常量都绑定了线上传输时使用的字符串 (`wireName`)，序列化与反序列化均以此为准。
 *
 * 关联:
 * - `SignalingMessage`: 使用此枚举来标识消息的具体类型。
 * - `RoomSignalingHandler`: 根据此枚举的值来路由和处理消息。
 * - `NegotiationStateMachine`: 客户端按此类型把收到的消息翻译为协商事件。
 */
package club.duocall.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageType {
    // 客户端行为
    JOIN("join"),                   // 客户端进入房间后的通告，原样转发给房间内其他成员
    END_CALL("end_call"),           // 客户端主动结束通话
    PING("ping"),                   // 客户端发送心跳以保持连接

    // 会话协商 (服务器只转发，不解析负载)
    OFFER("offer"),
    ANSWER("answer"),
    ICE_CANDIDATE("ice-candidate"),

    // 服务器通知
    ROOM_STATUS("room_status"),             // 房间成员数变化
    PEER_DISCONNECTED("peer_disconnected"), // 对方连接已断开
    CALL_ENDED("call_ended"),               // 对方主动结束了通话
    PONG("pong"),                           // 服务器对PING的心跳响应
    ERROR("error");                         // 服务器发往客户端的错误消息

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * 需要由服务器原样转发给房间内其他成员的消息类型。
     */
    public boolean isRelayed() {
        return this == JOIN || this == OFFER || this == ANSWER || this == ICE_CANDIDATE;
    }

    /**
     * 根据线上字符串查找消息类型。
     *
     * @param wireName 消息中`type`字段的值。
     * @return 对应的枚举常量；未知或为空时返回`null`。
     */
    @JsonCreator
    public static MessageType fromWireName(String wireName) {
        if (wireName == null) {
            return null;
        }
        for (var type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        return null;
    }
}
