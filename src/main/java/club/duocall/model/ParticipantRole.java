package club.duocall.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 成员在房间中的加入顺序。先加入者 (`FIRST`) 是会话发起方，负责创建offer。
 */
public enum ParticipantRole {
    FIRST("first"),
    SECOND("second");

    private final String wireName;

    ParticipantRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isInitiator() {
        return this == FIRST;
    }

    @JsonCreator
    public static ParticipantRole fromWireName(String wireName) {
        for (var role : values()) {
            if (role.wireName.equals(wireName)) {
                return role;
            }
        }
        return null;
    }
}
