/**
 * 此文件提供了用于监控信令服务器状态的API端点。
 *
 * 主要职责:
 * - 提供一个`/api/monitor/status`接口，返回活跃房间数、各状态房间数、在线成员数和服务器时间。
 * - 不返回任何房间ID: 房间ID即加入通话的凭据。
 *
 * 关联:
 * - `RoomRegistry`: 用于获取房间和成员的统计数据。
 * - `ServerStatusDto`: 作为此Controller的响应数据结构。
 */
package club.duocall.controller;

import club.duocall.dto.ServerStatusDto;
import club.duocall.model.RoomState;
import club.duocall.service.RoomRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/monitor")
public class MonitorController {

    private static final Logger logger = LoggerFactory.getLogger(MonitorController.class);

    private final RoomRegistry roomRegistry;

    public MonitorController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    /**
     * 获取服务器状态。
     * @return 包含房间统计的`ServerStatusDto`对象。
     */
    @GetMapping("/status")
    public ServerStatusDto getServerStatus() {
        logger.info("收到获取服务器状态的请求 /api/monitor/status");
        try {
            var status = ServerStatusDto.success(
                    roomRegistry.getActiveRoomCount(),
                    roomRegistry.countRooms(RoomState.WAITING_FOR_PEER),
                    roomRegistry.countRooms(RoomState.FULL),
                    roomRegistry.getParticipantCount(),
                    System.currentTimeMillis());

            logger.debug("服务器状态获取成功: {}", status);
            return status;
        } catch (Exception e) {
            logger.error("获取服务器状态时发生未知错误。", e);
            return ServerStatusDto.error(e.getMessage());
        }
    }
}
