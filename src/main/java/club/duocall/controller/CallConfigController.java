/**
 * 此文件提供了客户端建立对等连接前所需的配置。
 *
 * 主要职责:
 * - 通过`/api/call/ice-servers`返回配置的STUN/TURN服务器列表。
 *   这些地址只是传输层的外部配置，不属于信令协议本身。
 *
 * 关联:
 * - `SignalingProperties`: NAT穿透服务器列表的来源。
 */
package club.duocall.controller;

import club.duocall.config.SignalingProperties;
import club.duocall.dto.IceServer;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/call")
public class CallConfigController {

    private static final Logger logger = LoggerFactory.getLogger(CallConfigController.class);

    private final SignalingProperties signalingProperties;

    public CallConfigController(SignalingProperties signalingProperties) {
        this.signalingProperties = signalingProperties;
    }

    @GetMapping("/ice-servers")
    public List<IceServer> getIceServers() {
        var iceServers = signalingProperties.iceServers();
        logger.debug("返回 {} 个NAT穿透服务器配置。", iceServers.size());
        return iceServers;
    }
}
