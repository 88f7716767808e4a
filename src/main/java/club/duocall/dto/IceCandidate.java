package club.duocall.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 一个ICE候选地址，作为不透明负载在两端之间交换。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record IceCandidate(String candidate, String sdpMid, Integer sdpMLineIndex) {}
