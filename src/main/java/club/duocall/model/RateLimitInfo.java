/**
 * 此文件定义了一个用于存储客户端握手限流信息的数据记录。
 *
 * 使用JDK 17的`record`类型，使其成为一个简洁、不可变的数据载体。
 *
 * 关联:
 * - `JoinRateLimitInterceptor`: 使用此记录类在内存中跟踪每个客户端在当前窗口内的握手次数。
 */
package club.duocall.model;

import java.time.Instant;

public record RateLimitInfo(int count, Instant windowStart) {}
