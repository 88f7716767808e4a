/**
 * 此文件定义了用于表示信令服务器状态的数据传输对象(DTO)。
 *
 * 只包含聚合计数，不包含任何房间标识 (房间标识本身就是加入通话的凭据)。
 *
 * 关联:
 * - `MonitorController`: 使用此DTO作为其`/api/monitor/status`端点的响应体。
 */
package club.duocall.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ServerStatusDto(
        int activeRooms,
        int waitingRooms,
        int fullRooms,
        int participants,
        long serverTime,
        String status,
        String errorMessage) {

    /**
     * 创建一个表示成功状态的DTO实例。
     */
    public static ServerStatusDto success(int activeRooms, int waitingRooms, int fullRooms, int participants, long serverTime) {
        return new ServerStatusDto(activeRooms, waitingRooms, fullRooms, participants, serverTime, "运行中", null);
    }

    /**
     * 创建一个表示错误状态的DTO实例。
     * @param message 错误信息。
     */
    public static ServerStatusDto error(String message) {
        return new ServerStatusDto(-1, -1, -1, -1, System.currentTimeMillis(), "错误", message);
    }
}
