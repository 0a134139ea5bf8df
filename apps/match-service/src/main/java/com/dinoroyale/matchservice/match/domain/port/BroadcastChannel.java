package com.dinoroyale.matchservice.match.domain.port;

/**
 * 广播通道（抽象边界）。
 *
 * 语义：
 * - 发后即忘，对每个当前在线的订阅者至多送达一次；
 * - 不保留历史：事件发生之后才订阅的观察者收不到补发，
 *   需要通过拉取接口（阶段 / 模式 / 安全区状态）自行对齐。
 */
public interface BroadcastChannel {

    /**
     * 向所有当前订阅者广播。
     * @param eventName 事件名（见 MatchEvents）
     * @param payload   事件载荷
     */
    void publish(String eventName, Object payload);

    /**
     * 只发给指定玩家（如圈外伤害提示、观战模式、落点）。
     */
    void sendTo(String playerId, String eventName, Object payload);
}
