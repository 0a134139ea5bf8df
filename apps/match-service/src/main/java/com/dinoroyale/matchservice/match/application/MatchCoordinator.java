package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.clock.scheduler.TickScheduler;
import com.dinoroyale.matchservice.match.config.MatchProperties;
import com.dinoroyale.matchservice.match.config.ModeCatalog;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents;
import com.dinoroyale.matchservice.match.domain.model.AliveCounts;
import com.dinoroyale.matchservice.match.domain.model.MatchPhase;
import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import com.dinoroyale.matchservice.match.domain.model.PlayerRecord;
import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.model.TeamSet;
import com.dinoroyale.matchservice.match.domain.model.Winner;
import com.dinoroyale.matchservice.match.domain.model.ZoneState;
import com.dinoroyale.matchservice.match.domain.port.BroadcastChannel;
import com.dinoroyale.matchservice.match.domain.port.DinosaurSpawnController;
import com.dinoroyale.matchservice.match.domain.port.LootController;
import com.dinoroyale.matchservice.match.domain.rule.TeamRegistry;
import com.dinoroyale.matchservice.match.domain.rule.VictoryEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * MatchCoordinator
 * -------------------------------------------------
 * 对局生命周期协调器（应用编排层）。
 *
 * 职责：
 * 1) 以固定 tick 驱动阶段机 LOBBY -> STARTING -> DROPPING -> MATCH -> ENDING -> CLEANUP -> LOBBY；
 *    每个 tick 只执行当前阶段的一个处理器，处理器不阻塞，所有“等待”都是截止时间比较；
 * 2) 对外提供模式切换、淘汰、玩家加入/离开与状态查询；
 * 3) 编排安全区、队伍划分、胜负判定与外部协作方（恐龙、物资）。
 *
 * 并发约定：
 * - driverTick 与 requestModeChange 在同一把锁内执行，阶段与模式不会交错修改；
 * - eliminatePlayer 不拿锁，靠 PlayerRecord 的 CAS 保证同一玩家只淘汰一次；
 * - 阶段进入动作先置“已进入”再执行：进入动作抛错时不会重复执行，本阶段的推进逻辑下个 tick 继续。
 */
@Slf4j
public class MatchCoordinator {

    public static final String DRIVER_KEY = "match:driver";

    private final MatchProperties props;
    private final ModeCatalog modes;
    private final PlayerRoster roster;
    private final TeamRegistry teamRegistry;
    private final ZoneController zone;
    private final MapLayout mapLayout;
    private final BroadcastChannel broadcast;
    private final TickScheduler scheduler;
    private final MatchCollaborators collaborators;

    private final MatchContext ctx = new MatchContext();
    private final Object lock = new Object();

    public MatchCoordinator(MatchProperties props,
                            ModeCatalog modes,
                            PlayerRoster roster,
                            TeamRegistry teamRegistry,
                            ZoneController zone,
                            MapLayout mapLayout,
                            BroadcastChannel broadcast,
                            TickScheduler scheduler,
                            MatchCollaborators collaborators) {
        this.props = props;
        this.modes = modes;
        this.roster = roster;
        this.teamRegistry = teamRegistry;
        this.zone = zone;
        this.mapLayout = mapLayout;
        this.broadcast = broadcast;
        this.scheduler = scheduler;
        this.collaborators = collaborators == null ? MatchCollaborators.none() : collaborators;
        this.ctx.setMode(modes.defaultMode());
    }

    /**
     * 应用就绪后启动对局驱动。
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        start();
    }

    /**
     * 启动对局驱动，注册 match:driver 周期任务。
     */
    public void start() {
        synchronized (lock) {
            ctx.setLastTickAt(scheduler.currentTimeMillis());
        }
        scheduler.startAtFixedRate(DRIVER_KEY, 0, Math.max(1, props.getTickMillis()), this::driverTick);
        if (props.getTestMode().isEnabled()) {
            log.warn("TEST MODE ENABLED - minPlayers={}, autoStart={}s, victoryDisabled={}",
                    props.getTestMode().getMinPlayersToStart(),
                    props.getTestMode().getAutoStartDelaySeconds(),
                    props.getTestMode().isDisableVictory());
        }
        log.info("对局驱动已启动: matchId={}, mode={}, tickMs={}",
                props.getId(), ctx.getMode().id(), props.getTickMillis());
    }

    public void shutdown() {
        scheduler.stop(DRIVER_KEY);
        zone.stop();
        log.info("对局驱动已停止: matchId={}", props.getId());
    }

    // ========== 查询 ==========

    public MatchPhase getPhase() {
        return ctx.getPhase();
    }

    public ModeConfig getMode() {
        return ctx.getMode();
    }

    public ZoneState getZoneState() {
        return zone.getState();
    }

    public AliveCounts getAliveCounts() {
        return VictoryEvaluator.countAlive(teamRegistry.current(), roster.aliveById());
    }

    public MatchSnapshot snapshot() {
        ModeConfig mode = ctx.getMode();
        return new MatchSnapshot(
                props.getId(),
                ctx.getPhase().displayName(),
                mode.id(),
                mode.teamSize(),
                zone.getState(),
                getAliveCounts(),
                roster.size(),
                teamRegistry.current().size(),
                scheduler.currentTimeMillis());
    }

    // ========== 命令 ==========

    /**
     * 大厅内切换模式。
     * @return 非大厅阶段或未知模式时返回 false，状态不变
     */
    public boolean requestModeChange(String modeId) {
        Optional<ModeConfig> target = modes.find(modeId);
        if (target.isEmpty()) {
            log.info("拒绝切换模式：未知模式 {}", modeId);
            return false;
        }
        synchronized (lock) {
            if (ctx.getPhase() != MatchPhase.LOBBY) {
                log.info("拒绝切换模式：当前阶段 {} 不允许切换", ctx.getPhase().displayName());
                return false;
            }
            ctx.setMode(target.get());
        }
        log.info("Game mode changed to: {}", target.get().id());
        return true;
    }

    /**
     * 淘汰玩家。对同一玩家重复调用只生效一次。
     * @param playerId 被淘汰玩家
     * @param killerId 击杀者，可为 null
     */
    public void eliminatePlayer(String playerId, String killerId) {
        PlayerRecord victim = roster.find(playerId).orElse(null);
        if (victim == null || !victim.markEliminated()) {
            return;
        }
        log.info("Player eliminated: {} (killer={})", playerId, killerId);
        publish(MatchEvents.PLAYER_ELIMINATED, new MatchEvents.PlayerEliminated(playerId, killerId));

        // 组队模式：检查整队是否已被淘汰（仅记录，胜负由下个 tick 判定）
        if (!activeMode().isSolo()) {
            teamRegistry.current().teamOf(playerId).ifPresent(team -> {
                if (!VictoryEvaluator.hasAliveMember(team, roster.aliveById())) {
                    log.info("Team eliminated: {}", team.key());
                }
            });
        }
    }

    public PlayerRecord onPlayerJoined(String playerId, String displayName) {
        PlayerRecord r = roster.join(playerId, displayName);
        log.info("Player joined: {} ({}), phase={}, total={}",
                playerId, r.getDisplayName(), ctx.getPhase().displayName(), roster.size());
        // 对局中途加入：只能观战
        if (ctx.getPhase() == MatchPhase.MATCH) {
            sendTo(playerId, MatchEvents.SPECTATOR_MODE, new MatchEvents.SpectatorMode(true));
            log.info("Player {} joined mid-match, set to spectator", playerId);
        }
        return r;
    }

    public void onPlayerLeft(String playerId) {
        // 离开视为淘汰（无击杀者）
        eliminatePlayer(playerId, null);
        roster.remove(playerId).ifPresent(r ->
                log.info("Player left: {}, total={}", playerId, roster.size()));
    }

    /**
     * 客户端位置上报。
     * @return 玩家不在名册中返回 false
     */
    public boolean reportPosition(String playerId, Position position) {
        return roster.updatePosition(playerId, position);
    }

    // ========== 驱动 ==========

    void driverTick() {
        synchronized (lock) {
            long now = scheduler.currentTimeMillis();
            try {
                switch (ctx.getPhase()) {
                    case LOBBY -> lobbyTick(now);
                    case STARTING -> startingTick(now);
                    case DROPPING -> droppingTick(now);
                    case MATCH -> matchTick(now);
                    case ENDING -> endingTick(now);
                    case CLEANUP -> cleanupTick(now);
                }
            } catch (RuntimeException e) {
                log.error("阶段处理异常，下个 tick 重试: phase={}", ctx.getPhase().displayName(), e);
            } finally {
                ctx.setLastTickAt(now);
            }
        }
    }

    private void lobbyTick(long now) {
        int required = requiredPlayers();
        long waitMs = lobbyWaitMillis();
        if (enter()) {
            ctx.setLobbyRemainingMillis(waitMs);
            log.info("Lobby phase started, waiting for {} players", required);
        }

        int count = roster.size();
        boolean quorum = count >= required;
        if (quorum) {
            ctx.setLobbyRemainingMillis(ctx.getLobbyRemainingMillis() - (now - ctx.getLastTickAt()));
        } else {
            // 人数不足：计时器整段重置，而不是暂停
            ctx.setLobbyRemainingMillis(waitMs);
        }
        long remaining = Math.max(0, ctx.getLobbyRemainingMillis());
        publish(MatchEvents.LOBBY_STATUS,
                new MatchEvents.LobbyStatus(count, required, ceilSeconds(remaining), quorum));

        if (quorum && remaining <= 0) {
            transitionTo(MatchPhase.STARTING);
        }
    }

    private void startingTick(long now) {
        if (enter()) {
            // 本局模式从这里起冻结
            ModeConfig mode = ctx.getMode();
            ctx.setActiveMode(mode);
            teamRegistry.formTeams(mode, roster.playerIds());

            int countdown = props.getCountdownSeconds();
            ctx.setCountdownRemaining(countdown);
            ctx.setNextCountdownAt(now + 1000);
            log.info("Match starting in {} seconds...", countdown);
            if (countdown > 0) {
                publish(MatchEvents.COUNTDOWN, new MatchEvents.Countdown(countdown));
            }
            return;
        }
        if (ctx.getCountdownRemaining() > 0) {
            if (now < ctx.getNextCountdownAt()) return;
            int left = ctx.getCountdownRemaining() - 1;
            ctx.setCountdownRemaining(left);
            ctx.setNextCountdownAt(ctx.getNextCountdownAt() + 1000);
            if (left > 0) {
                publish(MatchEvents.COUNTDOWN, new MatchEvents.Countdown(left));
                return;
            }
        }

        // 仍在名册中的队员复活并回满血
        int revived = 0;
        for (String member : teamRegistry.current().allMembers()) {
            Optional<PlayerRecord> r = roster.find(member);
            if (r.isPresent()) {
                r.get().revive(props.getMaxHealth());
                revived++;
            }
        }
        log.info("Marked {} players alive", revived);
        transitionTo(MatchPhase.DROPPING);
    }

    private void droppingTick(long now) {
        if (enter()) {
            call("loot.spawnAllLoot", collaborators.loot(), LootController::spawnAllLoot);

            List<Position> drops = mapLayout.dropPositions(props.getDropHeight());
            List<PlayerRecord> players = roster.snapshot();
            for (int i = 0; i < players.size(); i++) {
                place(players.get(i), drops.get(i % drops.size()), "DROP");
            }
            ctx.setPhaseDeadline(now + props.getDropSettleSeconds() * 1000L);
            log.info("Dropping {} players ({} drop positions)", players.size(), drops.size());
            return;
        }
        if (now >= ctx.getPhaseDeadline()) {
            ctx.setMatchStartedAt(now);
            transitionTo(MatchPhase.MATCH);
        }
    }

    private void matchTick(long now) {
        if (enter()) {
            if (props.getZone().isEnabled()) {
                run("zone.start", zone::start);
            } else {
                log.info("Zone disabled, skipping zone start");
            }
            if (props.getCreatures().isEnabled()) {
                call("dinosaurs.startSpawning", collaborators.dinosaurs(), DinosaurSpawnController::startSpawning);
            }
            log.info("Match started! mode={}, teams={}", activeMode().id(), teamRegistry.current().size());
        }

        Map<String, Boolean> alive = roster.aliveById();
        TeamSet teams = teamRegistry.current();
        AliveCounts counts = VictoryEvaluator.countAlive(teams, alive);

        if (!victoryDisabled()) {
            Optional<Winner> winner = VictoryEvaluator.evaluate(activeMode(), counts, teams, alive);
            if (winner.isPresent()) {
                log.info("Victory declared! winner={} ({})", winner.get().id(), winner.get().kind());
                publish(MatchEvents.VICTORY_DECLARED, new MatchEvents.VictoryDeclared(winner.get()));
                transitionTo(MatchPhase.ENDING);
                return;
            }
        }

        long maxMs = props.getMatchMaxDurationSeconds() * 1000L;
        if (now - ctx.getMatchStartedAt() >= maxMs) {
            log.info("Match timed out after {}s without a winner", props.getMatchMaxDurationSeconds());
            transitionTo(MatchPhase.ENDING);
            return;
        }

        publish(MatchEvents.ALIVE_COUNT_UPDATE, new MatchEvents.AliveCountUpdate(counts.players(), counts.teams()));
    }

    private void endingTick(long now) {
        if (enter()) {
            run("zone.stop", zone::stop);
            call("dinosaurs.stopSpawning", collaborators.dinosaurs(), DinosaurSpawnController::stopSpawning);
            ctx.setPhaseDeadline(now + props.getResultsDisplaySeconds() * 1000L);
            log.info("Match ended, showing results for {}s", props.getResultsDisplaySeconds());
            return;
        }
        if (now >= ctx.getPhaseDeadline()) {
            transitionTo(MatchPhase.CLEANUP);
        }
    }

    private void cleanupTick(long now) {
        if (enter()) {
            call("dinosaurs.despawnAll", collaborators.dinosaurs(), DinosaurSpawnController::despawnAll);
            call("loot.resetLoot", collaborators.loot(), LootController::resetLoot);

            Position lobby = mapLayout.lobbySpawn();
            for (PlayerRecord r : roster.snapshot()) {
                place(r, lobby, "LOBBY");
            }
            roster.clearAlive();
            teamRegistry.clear();
            run("zone.reset", zone::reset);
            ctx.setActiveMode(null);
            ctx.setMatchStartedAt(0);
            ctx.setPhaseDeadline(now + props.getIntermissionSeconds() * 1000L);
            log.info("Cleanup complete, next match in {}s", props.getIntermissionSeconds());
            return;
        }
        if (now >= ctx.getPhaseDeadline()) {
            transitionTo(MatchPhase.LOBBY);
        }
    }

    // ========== 内部工具 ==========

    /**
     * 首次进入当前阶段时返回 true（并标记已进入）。
     */
    private boolean enter() {
        if (ctx.isPhaseEntered()) return false;
        ctx.setPhaseEntered(true);
        return true;
    }

    private void transitionTo(MatchPhase target) {
        MatchPhase old = ctx.getPhase();
        if (old.next() != target) {
            throw new IllegalStateException("illegal phase transition: " + old + " -> " + target);
        }
        ctx.setPhase(target);
        ctx.setPhaseEntered(false);
        log.info("State changed: {} -> {}", old.displayName(), target.displayName());
        publish(MatchEvents.PHASE_CHANGED, new MatchEvents.PhaseChanged(target.displayName(), old.displayName()));
    }

    private ModeConfig activeMode() {
        ModeConfig active = ctx.getActiveMode();
        return active != null ? active : ctx.getMode();
    }

    private int requiredPlayers() {
        MatchProperties.TestMode t = props.getTestMode();
        return t.isEnabled() ? t.getMinPlayersToStart() : props.getMinPlayersToStart();
    }

    private long lobbyWaitMillis() {
        MatchProperties.TestMode t = props.getTestMode();
        int seconds = t.isEnabled() ? t.getAutoStartDelaySeconds() : props.getLobbyWaitSeconds();
        return seconds * 1000L;
    }

    private boolean victoryDisabled() {
        MatchProperties.TestMode t = props.getTestMode();
        return t.isEnabled() && t.isDisableVictory();
    }

    private static int ceilSeconds(long millis) {
        return (int) ((millis + 999) / 1000);
    }

    private void place(PlayerRecord r, Position pos, String reason) {
        r.setPosition(pos);
        sendTo(r.getPlayerId(), MatchEvents.PLAYER_PLACED, new MatchEvents.PlayerPlaced(pos, reason));
    }

    /**
     * 调用可选协作方：缺失时记日志跳过，出错时记日志继续。
     */
    private <T> void call(String what, T collaborator, Consumer<T> action) {
        if (collaborator == null) {
            log.debug("{} 未接入，跳过", what);
            return;
        }
        try {
            action.accept(collaborator);
        } catch (RuntimeException e) {
            log.warn("协作方调用失败，继续推进: {}", what, e);
        }
    }

    private void run(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("调用失败，继续推进: {}", what, e);
        }
    }

    private void publish(String event, Object payload) {
        try {
            broadcast.publish(event, payload);
        } catch (RuntimeException e) {
            log.warn("广播失败: event={}", event, e);
        }
    }

    private void sendTo(String playerId, String event, Object payload) {
        try {
            broadcast.sendTo(playerId, event, payload);
        } catch (RuntimeException e) {
            log.warn("点对点消息发送失败: playerId={}, event={}", playerId, event, e);
        }
    }
}
