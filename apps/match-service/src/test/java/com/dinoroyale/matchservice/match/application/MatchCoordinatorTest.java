package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.config.MatchProperties;
import com.dinoroyale.matchservice.match.config.ModeCatalog;
import com.dinoroyale.matchservice.match.config.PhaseTableValidator;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents.Countdown;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents.LobbyStatus;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents.PhaseChanged;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents.PlayerEliminated;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents.PlayerPlaced;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents.VictoryDeclared;
import com.dinoroyale.matchservice.match.domain.model.MatchPhase;
import com.dinoroyale.matchservice.match.domain.model.PlayerRecord;
import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.model.Winner;
import com.dinoroyale.matchservice.match.domain.port.DinosaurSpawnController;
import com.dinoroyale.matchservice.match.domain.port.LootController;
import com.dinoroyale.matchservice.match.domain.port.SpawnPointProvider;
import com.dinoroyale.matchservice.match.domain.rule.TeamRegistry;
import com.dinoroyale.matchservice.support.ManualTickScheduler;
import com.dinoroyale.matchservice.support.RecordingBroadcastChannel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.offset;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class MatchCoordinatorTest {

    private MatchProperties props;
    private ManualTickScheduler scheduler;
    private RecordingBroadcastChannel channel;
    private PlayerRoster roster;
    private TeamRegistry teamRegistry;
    private DinosaurSpawnController dinosaurs;
    private LootController loot;
    private ZoneController zone;
    private MatchCoordinator coordinator;

    @BeforeEach
    void setUp() {
        props = new MatchProperties();
        props.setMinPlayersToStart(2);
        props.setLobbyWaitSeconds(5);
        props.setCountdownSeconds(3);
        props.setDropSettleSeconds(1);
        props.setMatchMaxDurationSeconds(30);
        props.setResultsDisplaySeconds(2);
        props.setIntermissionSeconds(2);
        props.getZone().setGracePeriodSeconds(0);

        scheduler = new ManualTickScheduler();
        channel = new RecordingBroadcastChannel();
        roster = new PlayerRoster();
        teamRegistry = new TeamRegistry();
        dinosaurs = mock(DinosaurSpawnController.class);
        loot = mock(LootController.class);
        coordinator = build(new MatchCollaborators(dinosaurs, loot));
    }

    private MatchCoordinator build(MatchCollaborators collaborators) {
        return build(collaborators, new MapLayout(null, props.getMap()));
    }

    private MatchCoordinator build(MatchCollaborators collaborators, MapLayout layout) {
        RosterDamageSink sink = new RosterDamageSink(roster);
        zone = new ZoneController(props.getZone(), PhaseTableValidator.DEFAULT_TABLE, layout, scheduler, channel,
                new RosterPositionSource(roster), sink, new Random(7));
        MatchCoordinator c = new MatchCoordinator(props, new ModeCatalog(props.getModes(), "solo"), roster,
                teamRegistry, zone, layout, channel, scheduler, collaborators);
        sink.setDepletionListener(id -> c.eliminatePlayer(id, null));
        c.start();
        return c;
    }

    private void join(String... ids) {
        for (String id : ids) {
            coordinator.onPlayerJoined(id, "name-" + id);
        }
    }

    private void advanceUntil(MatchPhase target, long maxMillis) {
        long waited = 0;
        while (coordinator.getPhase() != target && waited < maxMillis) {
            scheduler.advance(100);
            waited += 100;
        }
        assertThat(coordinator.getPhase()).isEqualTo(target);
    }

    private List<String> phaseHistory() {
        return channel.published(MatchEvents.PHASE_CHANGED, PhaseChanged.class).stream()
                .map(PhaseChanged::newPhase)
                .toList();
    }

    @Test
    void fullCycleVisitsEveryPhaseInOrder() {
        join("p1", "p2");

        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(100);
        coordinator.eliminatePlayer("p2", "p1");
        advanceUntil(MatchPhase.LOBBY, 20_000);

        assertThat(phaseHistory()).containsExactly("Starting", "Dropping", "Match", "Ending", "Cleanup", "Lobby");
        assertThat(channel.published(MatchEvents.PHASE_CHANGED, PhaseChanged.class).get(0).oldPhase())
                .isEqualTo("Lobby");
        assertThat(channel.published(MatchEvents.COUNTDOWN, Countdown.class))
                .extracting(Countdown::secondsRemaining)
                .containsExactly(3, 2, 1);
    }

    @Test
    void lastSurvivorWinsAndCleanupResetsState() {
        join("p1", "p2");
        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(100);
        assertThat(zone.getState().active()).isTrue();
        verify(dinosaurs).startSpawning();

        coordinator.eliminatePlayer("p2", "p1");
        advanceUntil(MatchPhase.ENDING, 1_000);

        assertThat(channel.published(MatchEvents.PLAYER_ELIMINATED, PlayerEliminated.class))
                .containsExactly(new PlayerEliminated("p2", "p1"));
        assertThat(channel.published(MatchEvents.VICTORY_DECLARED, VictoryDeclared.class))
                .extracting(VictoryDeclared::winner)
                .containsExactly(Winner.player("p1"));

        advanceUntil(MatchPhase.LOBBY, 20_000);

        assertThat(zone.getState().active()).isFalse();
        assertThat(zone.getState().phase()).isZero();
        assertThat(zone.getState().currentRadius()).isEqualTo(500.0);
        assertThat(teamRegistry.current().isEmpty()).isTrue();
        assertThat(roster.snapshot()).noneMatch(PlayerRecord::isAlive);
        verify(dinosaurs).stopSpawning();
        verify(dinosaurs).despawnAll();
        verify(loot).spawnAllLoot();
        verify(loot).resetLoot();
        assertThat(channel.sentTo("p1", MatchEvents.PLAYER_PLACED, PlayerPlaced.class))
                .extracting(PlayerPlaced::reason)
                .containsExactly("DROP", "LOBBY");
        assertThat(roster.find("p1").orElseThrow().getPosition()).isEqualTo(new Position(0, 10, 0));
    }

    @Test
    void droppingPlacesEveryPlayerOnTheFallbackRing() {
        join("p1", "p2", "p3");
        advanceUntil(MatchPhase.DROPPING, 20_000);
        scheduler.advance(100);

        List<Position> placed = new ArrayList<>();
        for (String id : List.of("p1", "p2", "p3")) {
            List<PlayerPlaced> msgs = channel.sentTo(id, MatchEvents.PLAYER_PLACED, PlayerPlaced.class);
            assertThat(msgs).hasSize(1);
            placed.add(msgs.get(0).position());
        }
        assertThat(placed).doesNotHaveDuplicates();
        assertThat(placed).allSatisfy(p -> {
            assertThat(p.y()).isEqualTo(500.0);
            assertThat(p.planarDistanceTo(Position.ORIGIN)).isCloseTo(2048 * 0.15, offset(1e-6));
        });
        assertThat(roster.snapshot()).allMatch(PlayerRecord::isAlive);
    }

    @Test
    void morePlayersThanDropPointsAreAssignedRoundRobin() {
        SpawnPointProvider spawns = mock(SpawnPointProvider.class);
        when(spawns.getPlayerSpawnPoints()).thenReturn(List.of(new Position(10, 0, 10), new Position(-10, 0, -10)));
        when(spawns.getMapCenter()).thenReturn(Position.ORIGIN);
        when(spawns.getMapSize()).thenReturn(2048.0);
        coordinator.shutdown();
        coordinator = build(new MatchCollaborators(dinosaurs, loot), new MapLayout(spawns, props.getMap()));

        join("p1", "p2", "p3", "p4", "p5");
        advanceUntil(MatchPhase.DROPPING, 20_000);
        scheduler.advance(100);

        Position first = new Position(10, 500, 10);
        Position second = new Position(-10, 500, -10);
        List<Position> expected = List.of(first, second, first, second, first);
        List<String> ids = List.of("p1", "p2", "p3", "p4", "p5");
        for (int i = 0; i < ids.size(); i++) {
            assertThat(channel.sentTo(ids.get(i), MatchEvents.PLAYER_PLACED, PlayerPlaced.class))
                    .extracting(PlayerPlaced::position)
                    .containsExactly(expected.get(i));
            assertThat(roster.find(ids.get(i)).orElseThrow().getPosition()).isEqualTo(expected.get(i));
        }
    }

    @Test
    void timeoutEndsMatchWithoutVictory() {
        props.getZone().setEnabled(false);
        join("p1", "p2");
        advanceUntil(MatchPhase.MATCH, 20_000);
        long matchStart = scheduler.currentTimeMillis();

        advanceUntil(MatchPhase.ENDING, 40_000);

        assertThat(scheduler.currentTimeMillis() - matchStart).isBetween(30_000L, 30_100L);
        assertThat(channel.published(MatchEvents.VICTORY_DECLARED, VictoryDeclared.class)).isEmpty();
        assertThat(zone.getState().active()).isFalse();
    }

    @Test
    void lobbyTimerResetsWhenQuorumIsLost() {
        join("p1", "p2");
        scheduler.advance(2_000);
        assertThat(channel.lastPublished(MatchEvents.LOBBY_STATUS, LobbyStatus.class))
                .isEqualTo(new LobbyStatus(2, 2, 3, true));

        coordinator.onPlayerLeft("p2");
        scheduler.advance(100);
        assertThat(channel.lastPublished(MatchEvents.LOBBY_STATUS, LobbyStatus.class))
                .isEqualTo(new LobbyStatus(1, 2, 5, false));

        join("p2");
        scheduler.advance(4_900);
        assertThat(coordinator.getPhase()).isEqualTo(MatchPhase.LOBBY);
        scheduler.advance(100);
        assertThat(coordinator.getPhase()).isEqualTo(MatchPhase.STARTING);
    }

    @Test
    void modeChangeOnlyAllowedInLobby() {
        assertThat(coordinator.requestModeChange("duos")).isTrue();
        assertThat(coordinator.getMode().id()).isEqualTo("duos");
        assertThat(coordinator.requestModeChange("squads")).isFalse();
        assertThat(coordinator.getMode().id()).isEqualTo("duos");

        join("p1", "p2");
        advanceUntil(MatchPhase.STARTING, 20_000);

        assertThat(coordinator.requestModeChange("trios")).isFalse();
        assertThat(coordinator.getMode().id()).isEqualTo("duos");
    }

    @Test
    void eliminationIsIdempotent() {
        join("p1", "p2", "p3");
        advanceUntil(MatchPhase.MATCH, 20_000);

        coordinator.eliminatePlayer("p3", "p1");
        coordinator.eliminatePlayer("p3", "p2");
        coordinator.eliminatePlayer("ghost", null);

        assertThat(channel.published(MatchEvents.PLAYER_ELIMINATED, PlayerEliminated.class))
                .containsExactly(new PlayerEliminated("p3", "p1"));
        assertThat(coordinator.getAliveCounts().players()).isEqualTo(2);
    }

    @Test
    void concurrentEliminationsProduceOneEvent() throws InterruptedException {
        join("p1", "p2", "p3");
        advanceUntil(MatchPhase.MATCH, 20_000);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        for (int i = 0; i < 8; i++) {
            pool.submit(() -> {
                go.await();
                coordinator.eliminatePlayer("p2", null);
                return null;
            });
        }
        go.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(channel.published(MatchEvents.PLAYER_ELIMINATED, PlayerEliminated.class)).hasSize(1);
    }

    @Test
    void teamWinsWhenOtherTeamIsWipedOut() {
        coordinator.requestModeChange("duos");
        join("p1", "p2", "p3", "p4");
        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(100);

        coordinator.eliminatePlayer("p3", "p1");
        scheduler.advance(100);
        assertThat(coordinator.getPhase()).isEqualTo(MatchPhase.MATCH);
        coordinator.eliminatePlayer("p4", "p2");
        advanceUntil(MatchPhase.ENDING, 1_000);

        Winner winner = channel.lastPublished(MatchEvents.VICTORY_DECLARED, VictoryDeclared.class).winner();
        assertThat(winner.kind()).isEqualTo(Winner.Kind.TEAM);
        assertThat(winner.id()).isEqualTo("team_1");
        assertThat(winner.members()).containsExactly("p1", "p2");
    }

    @Test
    void leavingMidMatchCountsAsElimination() {
        join("p1", "p2");
        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(100);

        coordinator.onPlayerLeft("p2");
        advanceUntil(MatchPhase.ENDING, 1_000);

        assertThat(channel.published(MatchEvents.PLAYER_ELIMINATED, PlayerEliminated.class))
                .containsExactly(new PlayerEliminated("p2", null));
        assertThat(channel.lastPublished(MatchEvents.VICTORY_DECLARED, VictoryDeclared.class).winner().id())
                .isEqualTo("p1");
    }

    @Test
    void lateJoinerBecomesSpectator() {
        join("p1", "p2");
        advanceUntil(MatchPhase.MATCH, 20_000);

        coordinator.onPlayerJoined("late", "Late");

        assertThat(channel.sentTo("late", MatchEvents.SPECTATOR_MODE, MatchEvents.SpectatorMode.class))
                .containsExactly(new MatchEvents.SpectatorMode(true));
        assertThat(roster.find("late").orElseThrow().isAlive()).isFalse();
        assertThat(coordinator.getAliveCounts().players()).isEqualTo(2);
    }

    @Test
    void failingCollaboratorsDoNotStallTheCycle() {
        doThrow(new IllegalStateException("loot down")).when(loot).spawnAllLoot();
        doThrow(new IllegalStateException("dinos down")).when(dinosaurs).startSpawning();
        doThrow(new IllegalStateException("dinos down")).when(dinosaurs).despawnAll();
        join("p1", "p2");

        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(100);
        coordinator.eliminatePlayer("p2", null);
        advanceUntil(MatchPhase.LOBBY, 20_000);

        verify(loot, times(1)).spawnAllLoot();
        verify(loot).resetLoot();
        assertThat(scheduler.failures()).isEmpty();
    }

    @Test
    void missingCollaboratorsAreSkipped() {
        coordinator.shutdown();
        coordinator = build(MatchCollaborators.none());
        join("p1", "p2");

        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(100);
        coordinator.eliminatePlayer("p1", null);
        advanceUntil(MatchPhase.LOBBY, 20_000);

        assertThat(scheduler.failures()).isEmpty();
    }

    @Test
    void broadcastFailuresDoNotStallTheCycle() {
        join("p1", "p2");
        channel.setFailing(true);

        advanceUntil(MatchPhase.DROPPING, 20_000);

        assertThat(scheduler.failures()).isEmpty();
    }

    @Test
    void testModeStartsWithOnePlayerAndSkipsVictory() {
        props.getTestMode().setEnabled(true);
        join("solo");

        scheduler.advance(100);
        assertThat(channel.lastPublished(MatchEvents.LOBBY_STATUS, LobbyStatus.class).requiredPlayers()).isEqualTo(1);

        advanceUntil(MatchPhase.MATCH, 20_000);
        scheduler.advance(5_000);

        assertThat(coordinator.getPhase()).isEqualTo(MatchPhase.MATCH);
        assertThat(channel.published(MatchEvents.VICTORY_DECLARED, VictoryDeclared.class)).isEmpty();
    }

    @Test
    void snapshotReflectsCurrentState() {
        join("p1");

        MatchSnapshot snap = coordinator.snapshot();

        assertThat(snap.matchId()).isEqualTo("main");
        assertThat(snap.phase()).isEqualTo("Lobby");
        assertThat(snap.mode()).isEqualTo("solo");
        assertThat(snap.connectedPlayers()).isEqualTo(1);
        assertThat(snap.zone().active()).isFalse();
    }
}
