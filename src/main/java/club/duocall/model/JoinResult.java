package club.duocall.model;

/**
 * 一次成功加入的结果。`role`是判定会话发起方的唯一依据。
 *
 * @param role 新成员的加入顺序。
 * @param room 加入后房间的快照。
 */
public record JoinResult(ParticipantRole role, Room room) {}
