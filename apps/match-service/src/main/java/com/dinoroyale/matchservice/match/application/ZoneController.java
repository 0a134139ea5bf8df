package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.clock.scheduler.TickScheduler;
import com.dinoroyale.matchservice.match.config.MatchProperties;
import com.dinoroyale.matchservice.match.domain.event.MatchEvents;
import com.dinoroyale.matchservice.match.domain.model.PhaseConfig;
import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.model.ZoneState;
import com.dinoroyale.matchservice.match.domain.port.BroadcastChannel;
import com.dinoroyale.matchservice.match.domain.port.DamageSink;
import com.dinoroyale.matchservice.match.domain.port.PlayerPositionSource;
import com.dinoroyale.matchservice.match.domain.port.PlayerPositionSource.TrackedPlayer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Random;

/**
 * ZoneController
 * ---------------------------------------
 * 安全区（缩圈）控制器。
 *
 * 两个周期任务：
 *  - zone:progress：宽限期倒计时 -> 每个阶段的等待倒计时 -> 半径/圆心插值 -> 下一阶段；
 *  - zone:damage：按固定间隔对圈外存活玩家结算伤害。
 *
 * 并发约定：
 *  - 几何状态写入都在 writeLock 内完成；当前圆与目标圆各自是一个不可变对象，
 *    读方一次读出半径与圆心，不会读到一半新一半旧；
 *  - 每次 start 生成新的 generation，旧任务残留的最后一次执行发现代数不一致直接返回；
 *  - stop 之后几何状态冻结，reset 只能在停止状态下调用。
 */
@Slf4j
public class ZoneController {

    public static final String PROGRESS_KEY = "zone:progress";
    public static final String DAMAGE_KEY = "zone:damage";

    private enum Stage { GRACE, WAITING, SHRINKING, DONE }

    private record Circle(double radius, Position center) {}

    private final MatchProperties.Zone settings;
    private final List<PhaseConfig> phases;
    private final MapLayout mapLayout;
    private final TickScheduler scheduler;
    private final BroadcastChannel broadcast;
    private final PlayerPositionSource positions;
    private final DamageSink damageSink;
    private final Random random;
    /** 额外伤害系数（测试模式下调低），与 damage-multiplier 相乘 */
    private final double damageScale;

    private final Object writeLock = new Object();

    private volatile boolean active;
    private volatile Circle current;
    private volatile Circle target;
    private volatile int phaseIndex;
    private volatile boolean inGrace;
    private volatile int graceRemaining;
    private volatile int generation;

    // 以下字段只在 writeLock 内访问
    private Stage stage = Stage.DONE;
    private int secondsLeft;
    private long nextSecondAt;
    private Circle shrinkFrom;
    private long shrinkStartedAt;
    private long shrinkDurationMs;

    public ZoneController(MatchProperties.Zone settings,
                          List<PhaseConfig> phases,
                          MapLayout mapLayout,
                          TickScheduler scheduler,
                          BroadcastChannel broadcast,
                          PlayerPositionSource positions,
                          DamageSink damageSink,
                          Random random) {
        this(settings, phases, mapLayout, scheduler, broadcast, positions, damageSink, random, 1.0);
    }

    public ZoneController(MatchProperties.Zone settings,
                          List<PhaseConfig> phases,
                          MapLayout mapLayout,
                          TickScheduler scheduler,
                          BroadcastChannel broadcast,
                          PlayerPositionSource positions,
                          DamageSink damageSink,
                          Random random,
                          double damageScale) {
        this.settings = settings;
        this.phases = List.copyOf(phases);
        this.mapLayout = mapLayout;
        this.scheduler = scheduler;
        this.broadcast = broadcast;
        this.positions = positions;
        this.damageSink = damageSink;
        this.random = random;
        this.damageScale = damageScale;
        Circle initial = initialCircle();
        this.current = initial;
        this.target = initial;
    }

    /**
     * 启动缩圈。已在运行时只告警，不重复启动。
     */
    public void start() {
        synchronized (writeLock) {
            if (active) {
                log.warn("Zone already active, start ignored");
                return;
            }
            int gen = ++generation;
            Circle initial = initialCircle();
            current = initial;
            target = initial;
            phaseIndex = 0;
            active = true;

            long now = scheduler.currentTimeMillis();
            int grace = Math.max(0, settings.getGracePeriodSeconds());
            if (grace > 0) {
                inGrace = true;
                graceRemaining = grace;
                stage = Stage.GRACE;
                nextSecondAt = now + 1000;
                publish(MatchEvents.ZONE_WARNING, new MatchEvents.ZoneWarning(grace, 0));
            } else {
                inGrace = false;
                graceRemaining = 0;
                beginPhase(1, now);
            }

            long interp = Math.max(1, settings.getInterpolationMillis());
            long dmg = Math.max(1, settings.getDamageIntervalMillis());
            if (stage != Stage.DONE) {
                scheduler.startAtFixedRate(PROGRESS_KEY, interp, interp, () -> progressTick(gen));
            }
            scheduler.startAtFixedRate(DAMAGE_KEY, dmg, dmg, () -> damageTick(gen));
            log.info("Zone started - radius: {}, center: {}, grace: {}s, phases: {}",
                    initial.radius(), initial.center(), grace, phases.size());
        }
    }

    /**
     * 停止缩圈，几何状态保持在当前值。
     */
    public void stop() {
        synchronized (writeLock) {
            if (!active) {
                log.debug("Zone not active, stop ignored");
                return;
            }
            active = false;
            inGrace = false;
            stage = Stage.DONE;
            scheduler.stop(PROGRESS_KEY);
            scheduler.stop(DAMAGE_KEY);
            log.info("Zone stopped at phase {} radius {}", phaseIndex, current.radius());
        }
    }

    /**
     * 回到初始状态。运行中调用无效。
     * @return 是否执行了重置
     */
    public boolean reset() {
        synchronized (writeLock) {
            if (active) {
                log.warn("Zone still active, reset ignored");
                return false;
            }
            Circle initial = initialCircle();
            current = initial;
            target = initial;
            phaseIndex = 0;
            inGrace = false;
            graceRemaining = 0;
            return true;
        }
    }

    public ZoneState getState() {
        Circle c = current;
        Circle t = target;
        return new ZoneState(phaseIndex, c.radius(), t.radius(), c.center(), t.center(),
                active, currentDamage(), inGrace, graceRemaining);
    }

    /** 平面距离 ≤ 当前半径即在圈内（边界算圈内） */
    public boolean isInsideZone(Position pos) {
        Circle c = current;
        return pos.planarDistanceTo(c.center()) <= c.radius();
    }

    /** 正数表示距离边界还有多远，负数表示已在圈外多远 */
    public double getDistanceToZone(Position pos) {
        Circle c = current;
        return c.radius() - pos.planarDistanceTo(c.center());
    }

    /** 当前阶段每次结算的伤害；阶段 0（未开始 / 宽限期）为 0 */
    public double currentDamage() {
        int p = phaseIndex;
        if (p < 1 || p > phases.size()) return 0;
        return damageOf(phases.get(p - 1));
    }

    // ========== 推进 ==========

    private void progressTick(int gen) {
        synchronized (writeLock) {
            if (!active || gen != generation) return;
            long now = scheduler.currentTimeMillis();
            switch (stage) {
                case GRACE -> tickGrace(now);
                case WAITING -> tickWaiting(now);
                case SHRINKING -> tickShrinking(now);
                case DONE -> { }
            }
        }
    }

    private void tickGrace(long now) {
        while (graceRemaining > 0 && now >= nextSecondAt) {
            graceRemaining--;
            nextSecondAt += 1000;
            int left = graceRemaining;
            if (left == 30 || left == 10 || (left > 0 && left <= 5)) {
                publish(MatchEvents.ZONE_WARNING, new MatchEvents.ZoneWarning(left, 0));
            }
        }
        if (graceRemaining > 0) return;

        inGrace = false;
        log.info("Zone grace period ended - damage now active");
        Circle c = current;
        publish(MatchEvents.ZONE_UPDATE, new MatchEvents.ZoneUpdate(0, c.radius(), c.center(), 0));
        beginPhase(1, now);
    }

    private void beginPhase(int index, long now) {
        if (index > phases.size()) {
            stage = Stage.DONE;
            scheduler.stop(PROGRESS_KEY);
            log.info("Zone reached final phase, radius {}", current.radius());
            return;
        }
        phaseIndex = index;
        PhaseConfig cfg = phases.get(index - 1);
        secondsLeft = cfg.delaySeconds();
        nextSecondAt = now + 1000;
        stage = Stage.WAITING;
        publish(MatchEvents.ZONE_WARNING, new MatchEvents.ZoneWarning(cfg.delaySeconds(), index));
        log.debug("Zone phase {} waiting {}s", index, cfg.delaySeconds());
        if (secondsLeft <= 0) {
            startShrink(now);
        }
    }

    private void tickWaiting(long now) {
        int warn = settings.getWarningSeconds();
        while (secondsLeft > 0 && now >= nextSecondAt) {
            secondsLeft--;
            nextSecondAt += 1000;
            if (secondsLeft > 0 && secondsLeft < warn) {
                publish(MatchEvents.ZONE_WARNING, new MatchEvents.ZoneWarning(secondsLeft, phaseIndex));
            }
        }
        if (secondsLeft <= 0) {
            startShrink(now);
        }
    }

    private void startShrink(long now) {
        PhaseConfig cfg = phases.get(phaseIndex - 1);
        Circle from = current;
        double maxOffset = cfg.centerOffsetFraction() * from.radius();
        double ox = (random.nextDouble() - 0.5) * 2 * maxOffset;
        double oz = (random.nextDouble() - 0.5) * 2 * maxOffset;
        Position c = from.center();
        Circle to = new Circle(cfg.endRadius(), new Position(c.x() + ox, c.y(), c.z() + oz));

        target = to;
        shrinkFrom = from;
        shrinkStartedAt = now;
        shrinkDurationMs = cfg.shrinkSeconds() * 1000L;
        stage = Stage.SHRINKING;

        publish(MatchEvents.ZONE_UPDATE,
                new MatchEvents.ZoneUpdate(phaseIndex, to.radius(), to.center(), damageOf(cfg)));
        log.info("Zone phase {} shrinking: {} -> {} over {}s",
                phaseIndex, from.radius(), to.radius(), cfg.shrinkSeconds());

        if (shrinkDurationMs <= 0) {
            finishShrink(now);
        }
    }

    private void tickShrinking(long now) {
        long elapsed = now - shrinkStartedAt;
        if (elapsed >= shrinkDurationMs) {
            finishShrink(now);
            return;
        }
        double alpha = (double) elapsed / shrinkDurationMs;
        Circle from = shrinkFrom;
        Circle to = target;
        double r = from.radius() + (to.radius() - from.radius()) * alpha;
        // 插值误差不能越过目标半径
        r = Math.max(to.radius(), r);
        current = new Circle(r, from.center().lerp(to.center(), alpha));
    }

    private void finishShrink(long now) {
        current = target;
        log.debug("Zone phase {} shrink complete, radius {}", phaseIndex, current.radius());
        beginPhase(phaseIndex + 1, now);
    }

    // ========== 伤害 ==========

    /**
     * 整个结算过程持有 writeLock：stop() 返回之后不会再有伤害落地。
     * 伤害回调（耗尽 -> 淘汰）不会反向获取 writeLock。
     */
    private void damageTick(int gen) {
        synchronized (writeLock) {
            if (!active || gen != generation || inGrace) return;
            double damage = currentDamage();
            if (damage <= 0) return;

            Circle zone = current;
            for (TrackedPlayer p : positions.trackedPlayers()) {
                if (!p.connected() || !p.alive() || p.position() == null) continue;
                if (p.position().planarDistanceTo(zone.center()) <= zone.radius()) continue;
                try {
                    damageSink.applyDamage(p.playerId(), damage);
                } catch (RuntimeException e) {
                    log.warn("圈外伤害结算失败: playerId={}", p.playerId(), e);
                    continue;
                }
                try {
                    broadcast.sendTo(p.playerId(), MatchEvents.ZONE_DAMAGE,
                            new MatchEvents.ZoneDamage(p.playerId(), damage));
                } catch (RuntimeException e) {
                    log.warn("圈外伤害通知失败: playerId={}", p.playerId(), e);
                }
            }
        }
    }

    private double damageOf(PhaseConfig cfg) {
        return cfg.damage() * settings.getDamageMultiplier() * damageScale;
    }

    private Circle initialCircle() {
        return new Circle(settings.getInitialRadius(), mapLayout.mapCenter());
    }

    private void publish(String event, Object payload) {
        try {
            broadcast.publish(event, payload);
        } catch (RuntimeException e) {
            log.warn("广播失败: event={}", event, e);
        }
    }
}
