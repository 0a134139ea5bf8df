package com.dinoroyale.matchservice.match.domain.rule;

import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import com.dinoroyale.matchservice.match.domain.model.Team;
import com.dinoroyale.matchservice.match.domain.model.TeamSet;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TeamRegistryTest {

    private final TeamRegistry registry = new TeamRegistry();

    @Test
    void soloGivesEachPlayerOwnTeamKeyedById() {
        TeamSet set = registry.formTeams(new ModeConfig("solo", "Solo", 1), List.of("a", "b", "c"));

        assertThat(set.teams()).extracting(Team::key).containsExactly("a", "b", "c");
        assertThat(set.teams()).allSatisfy(t -> assertThat(t.members()).hasSize(1));
    }

    @Test
    void duosPacksSequentiallyWithPartialLastTeam() {
        TeamSet set = registry.formTeams(new ModeConfig("duos", "Duos", 2), List.of("a", "b", "c", "d", "e"));

        assertThat(set.teams()).extracting(Team::key).containsExactly("team_1", "team_2", "team_3");
        assertThat(set.teams().get(0).members()).containsExactly("a", "b");
        assertThat(set.teams().get(1).members()).containsExactly("c", "d");
        assertThat(set.teams().get(2).members()).containsExactly("e");
    }

    @Test
    void triosWithFourPlayers() {
        TeamSet set = registry.formTeams(new ModeConfig("trios", "Trios", 3), List.of("a", "b", "c", "d"));

        assertThat(set.size()).isEqualTo(2);
        assertThat(set.teams().get(1).members()).containsExactly("d");
    }

    @Test
    void duplicateIdsAreCountedOnce() {
        TeamSet set = registry.formTeams(new ModeConfig("duos", "Duos", 2), List.of("a", "a", "b"));

        assertThat(set.allMembers()).containsExactly("a", "b");
        assertThat(set.size()).isEqualTo(1);
    }

    @Test
    void clearDropsCurrentSet() {
        registry.formTeams(new ModeConfig("solo", "Solo", 1), List.of("a"));
        assertThat(registry.current().isEmpty()).isFalse();

        registry.clear();
        assertThat(registry.current().isEmpty()).isTrue();
    }
}
