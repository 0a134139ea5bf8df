package com.dinoroyale.matchservice.match.domain.event;

import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.model.Winner;

/**
 * 对局广播事件名与载荷定义。
 * 事件名对客户端是稳定契约，修改前需同步前端。
 */
public final class MatchEvents {

    private MatchEvents() {
        // 常量类，禁止实例化
    }

    // ========== 对外广播 ==========

    public static final String PHASE_CHANGED = "PhaseChanged";
    public static final String LOBBY_STATUS = "LobbyStatus";
    public static final String COUNTDOWN = "Countdown";
    public static final String ALIVE_COUNT_UPDATE = "AliveCountUpdate";
    public static final String ZONE_WARNING = "ZoneWarning";
    public static final String ZONE_UPDATE = "ZoneUpdate";
    public static final String VICTORY_DECLARED = "VictoryDeclared";
    public static final String PLAYER_ELIMINATED = "PlayerEliminated";

    // ========== 点对点 ==========

    public static final String ZONE_DAMAGE = "ZoneDamage";
    public static final String SPECTATOR_MODE = "SpectatorMode";
    public static final String PLAYER_PLACED = "PlayerPlaced";
    public static final String MATCH_SNAPSHOT = "MatchSnapshot";
    public static final String ERROR = "Error";

    // ========== 载荷 ==========

    public record PhaseChanged(String newPhase, String oldPhase) {}

    public record LobbyStatus(int currentPlayers, int requiredPlayers, int timeRemaining, boolean canStart) {}

    public record Countdown(int secondsRemaining) {}

    public record AliveCountUpdate(int players, int teams) {}

    /** upcomingPhase = 0 表示开局宽限期 */
    public record ZoneWarning(int delaySeconds, int upcomingPhase) {}

    public record ZoneUpdate(int phase, double targetRadius, Position targetCenter, double damage) {}

    public record ZoneDamage(String playerId, double amount) {}

    public record VictoryDeclared(Winner winner) {}

    /** killerId 可为空（断线、圈外死亡等） */
    public record PlayerEliminated(String victimId, String killerId) {}

    public record SpectatorMode(boolean enabled) {}

    /** reason: DROP / LOBBY */
    public record PlayerPlaced(Position position, String reason) {}

    public record ErrorNotice(String message) {}
}
