package com.dinoroyale.matchservice.match.interfaces.ws.dto;

import lombok.Data;

/**
 * WebSocket 消息对象定义（DTO）
 * ----------------------------------------
 *   1. 客户端 -> 服务端：/app/match.* 指令
 *   2. 服务端 -> 客户端：BroadcastEvent（/topic/match.{matchId} 与 /user/queue/match）
 */
public class MatchMessages {

    /**
     * 切换模式（仅大厅阶段有效）
     */
    @Data
    public static class ModeChangeCmd {
        private String mode;
    }

    /**
     * 位置上报（客户端权威，不做反作弊校验）
     */
    @Data
    public static class PositionCmd {
        private double x;
        private double y;
        private double z;
    }

    /**
     * 统一事件结构。
     *   - type   ：事件名（PhaseChanged / LobbyStatus / ...）
     *   - seq    ：服务端单调递增序号
     *   - ts     ：服务端发送时间（毫秒）
     */
    @Data
    public static class BroadcastEvent {
        private String matchId;
        private String type;
        private long seq;
        private long ts;
        private Object payload;
    }
}
