package com.dinoroyale.matchservice.match.domain.rule;

import com.dinoroyale.matchservice.match.domain.model.AliveCounts;
import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import com.dinoroyale.matchservice.match.domain.model.Team;
import com.dinoroyale.matchservice.match.domain.model.TeamSet;
import com.dinoroyale.matchservice.match.domain.model.Winner;

import java.util.Map;
import java.util.Optional;

/**
 * 胜负判定（纯函数，无状态）。
 * - 单人模式：恰好剩 1 名存活玩家时该玩家获胜；0 人存活不判胜（只能走超时结束）；
 * - 组队模式：恰好剩 1 支有存活成员的队伍时该队获胜；
 *   同一轮里两队同时被清空视为本轮无胜者，下一轮继续判定。
 */
public final class VictoryEvaluator {

    private VictoryEvaluator() {
    }

    /**
     * @param mode      本局模式
     * @param counts    本轮存活统计
     * @param teams     本局队伍划分
     * @param aliveById 玩家存活表（不在表中视为已淘汰）
     * @return 胜者；尚未分出胜负返回 empty
     */
    public static Optional<Winner> evaluate(ModeConfig mode,
                                            AliveCounts counts,
                                            TeamSet teams,
                                            Map<String, Boolean> aliveById) {
        if (mode.isSolo()) {
            if (counts.players() != 1) return Optional.empty();
            // 优先按队伍顺序找，保证确定性
            for (Team t : teams.teams()) {
                for (String member : t.members()) {
                    if (isAlive(aliveById, member)) return Optional.of(Winner.player(member));
                }
            }
            return aliveById.entrySet().stream()
                    .filter(e -> Boolean.TRUE.equals(e.getValue()))
                    .map(e -> Winner.player(e.getKey()))
                    .findFirst();
        }

        if (counts.teams() != 1) return Optional.empty();
        for (Team t : teams.teams()) {
            if (hasAliveMember(t, aliveById)) return Optional.of(Winner.team(t));
        }
        return Optional.empty();
    }

    /**
     * 按存活表统计存活玩家数与存活队伍数。
     */
    public static AliveCounts countAlive(TeamSet teams, Map<String, Boolean> aliveById) {
        int players = (int) aliveById.values().stream().filter(Boolean.TRUE::equals).count();
        int teamsAlive = 0;
        for (Team t : teams.teams()) {
            if (hasAliveMember(t, aliveById)) teamsAlive++;
        }
        return new AliveCounts(players, teamsAlive);
    }

    /** 队伍中是否还有存活成员 */
    public static boolean hasAliveMember(Team team, Map<String, Boolean> aliveById) {
        for (String member : team.members()) {
            if (isAlive(aliveById, member)) return true;
        }
        return false;
    }

    private static boolean isAlive(Map<String, Boolean> aliveById, String playerId) {
        return Boolean.TRUE.equals(aliveById.get(playerId));
    }
}
