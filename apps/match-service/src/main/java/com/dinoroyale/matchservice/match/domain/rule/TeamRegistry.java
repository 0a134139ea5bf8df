package com.dinoroyale.matchservice.match.domain.rule;

import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import com.dinoroyale.matchservice.match.domain.model.Team;
import com.dinoroyale.matchservice.match.domain.model.TeamSet;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 队伍划分。
 * - 单人模式：每个玩家自成一队，队伍 key 为玩家 ID；
 * - 组队模式：按名册遍历顺序依次装入 team_1、team_2 …，每队装满 teamSize 再开下一队。
 * 不做洗牌、不按水平分组；同一名册顺序得到同一划分。
 * 本局内划分冻结，玩家断线也不重新分配。
 */
@Slf4j
public class TeamRegistry {

    /** 组队模式下的队伍 key 前缀 */
    public static final String TEAM_KEY_PREFIX = "team_";

    private volatile TeamSet current = TeamSet.empty();

    /**
     * 按模式划分队伍，并记为当前划分。
     * @param mode        本局模式
     * @param rosterOrder 名册中的玩家 ID（按名册顺序，重复 ID 只取第一次）
     */
    public TeamSet formTeams(ModeConfig mode, List<String> rosterOrder) {
        List<String> players = new ArrayList<>(new LinkedHashSet<>(rosterOrder));
        List<Team> teams = new ArrayList<>();

        if (mode.isSolo()) {
            for (String playerId : players) {
                teams.add(new Team(playerId, List.of(playerId)));
            }
        } else {
            int teamSize = mode.teamSize();
            int teamIndex = 1;
            List<String> bucket = new ArrayList<>(teamSize);
            for (String playerId : players) {
                bucket.add(playerId);
                if (bucket.size() >= teamSize) {
                    teams.add(new Team(TEAM_KEY_PREFIX + teamIndex++, bucket));
                    bucket = new ArrayList<>(teamSize);
                }
            }
            // 最后一支未满的队伍
            if (!bucket.isEmpty()) {
                teams.add(new Team(TEAM_KEY_PREFIX + teamIndex, bucket));
            }
        }

        TeamSet set = new TeamSet(teams);
        this.current = set;
        log.info("Formed {} teams for mode: {} (players={})", set.size(), mode.id(), players.size());
        return set;
    }

    public TeamSet current() {
        return current;
    }

    public void clear() {
        this.current = TeamSet.empty();
    }
}
