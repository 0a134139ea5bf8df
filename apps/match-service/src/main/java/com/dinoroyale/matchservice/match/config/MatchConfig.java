package com.dinoroyale.matchservice.match.config;

import com.dinoroyale.matchservice.clock.scheduler.TickScheduler;
import com.dinoroyale.matchservice.match.application.MapLayout;
import com.dinoroyale.matchservice.match.application.MatchCollaborators;
import com.dinoroyale.matchservice.match.application.MatchCoordinator;
import com.dinoroyale.matchservice.match.application.PlayerRoster;
import com.dinoroyale.matchservice.match.application.RosterDamageSink;
import com.dinoroyale.matchservice.match.application.RosterPositionSource;
import com.dinoroyale.matchservice.match.application.ZoneController;
import com.dinoroyale.matchservice.match.domain.model.PhaseConfig;
import com.dinoroyale.matchservice.match.domain.port.BroadcastChannel;
import com.dinoroyale.matchservice.match.domain.port.DamageSink;
import com.dinoroyale.matchservice.match.domain.port.DinosaurSpawnController;
import com.dinoroyale.matchservice.match.domain.port.LootController;
import com.dinoroyale.matchservice.match.domain.port.PlayerPositionSource;
import com.dinoroyale.matchservice.match.domain.port.SpawnPointProvider;
import com.dinoroyale.matchservice.match.domain.rule.TeamRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Random;

/**
 * 对局模块装配。
 * 可选协作方（出生点、恐龙、物资）在这里统一解析一次，缺失时记日志，调用处直接跳过。
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MatchProperties.class)
public class MatchConfig {

    @Bean
    public ModeCatalog modeCatalog(MatchProperties props) {
        return new ModeCatalog(props.getModes(), props.getDefaultMode());
    }

    @Bean
    public PlayerRoster playerRoster() {
        return new PlayerRoster();
    }

    @Bean
    public TeamRegistry teamRegistry() {
        return new TeamRegistry();
    }

    @Bean
    public MapLayout mapLayout(MatchProperties props, ObjectProvider<SpawnPointProvider> spawnPoints) {
        return new MapLayout(spawnPoints.getIfAvailable(), props.getMap());
    }

    @Bean
    @ConditionalOnMissingBean(PlayerPositionSource.class)
    public PlayerPositionSource playerPositionSource(PlayerRoster roster) {
        return new RosterPositionSource(roster);
    }

    @Bean
    @ConditionalOnMissingBean(DamageSink.class)
    public DamageSink damageSink(PlayerRoster roster) {
        return new RosterDamageSink(roster);
    }

    @Bean
    public ZoneController zoneController(MatchProperties props,
                                         MapLayout mapLayout,
                                         TickScheduler tickScheduler,
                                         BroadcastChannel broadcastChannel,
                                         PlayerPositionSource positionSource,
                                         DamageSink damageSink) {
        return new ZoneController(props.getZone(), resolvePhaseTable(props.getZone()), mapLayout,
                tickScheduler, broadcastChannel, positionSource, damageSink, new Random(), zoneDamageScale(props));
    }

    /** 测试模式下按 test-mode.damage-multiplier 降低圈外伤害 */
    static double zoneDamageScale(MatchProperties props) {
        MatchProperties.TestMode t = props.getTestMode();
        return t.isEnabled() ? t.getDamageMultiplier() : 1.0;
    }

    @Bean(destroyMethod = "shutdown")
    public MatchCoordinator matchCoordinator(MatchProperties props,
                                             ModeCatalog modeCatalog,
                                             PlayerRoster roster,
                                             TeamRegistry teamRegistry,
                                             ZoneController zoneController,
                                             MapLayout mapLayout,
                                             BroadcastChannel broadcastChannel,
                                             TickScheduler tickScheduler,
                                             DamageSink damageSink,
                                             ObjectProvider<DinosaurSpawnController> dinosaurs,
                                             ObjectProvider<LootController> loot) {
        MatchCollaborators collaborators = new MatchCollaborators(dinosaurs.getIfAvailable(), loot.getIfAvailable());
        if (collaborators.dinosaurs() == null) log.info("未接入恐龙刷新控制，相关动作将跳过");
        if (collaborators.loot() == null) log.info("未接入物资控制，相关动作将跳过");

        MatchCoordinator coordinator = new MatchCoordinator(props, modeCatalog, roster, teamRegistry,
                zoneController, mapLayout, broadcastChannel, tickScheduler, collaborators);
        // 血量归零 -> 淘汰（无击杀者）
        if (damageSink instanceof RosterDamageSink rosterSink) {
            rosterSink.setDepletionListener(playerId -> coordinator.eliminatePlayer(playerId, null));
        }
        return coordinator;
    }

    /**
     * 校验配置的缩圈表；为空或不合法时退回内置默认表，不阻止启动。
     */
    static List<PhaseConfig> resolvePhaseTable(MatchProperties.Zone zone) {
        if (zone.getPhases() == null || zone.getPhases().isEmpty()) {
            log.info("未配置缩圈表，使用内置默认表（{} 个阶段）", PhaseTableValidator.DEFAULT_TABLE.size());
            return PhaseTableValidator.DEFAULT_TABLE;
        }
        List<String> errors = PhaseTableValidator.validate(zone.getPhases(), zone.getInitialRadius());
        if (!errors.isEmpty()) {
            errors.forEach(e -> log.error("缩圈表配置错误: {}", e));
            log.error("缩圈表不合法，改用内置默认表");
            return PhaseTableValidator.DEFAULT_TABLE;
        }
        List<PhaseConfig> table = PhaseTableValidator.toConfigs(zone.getPhases());
        log.info("缩圈表已加载: {} 个阶段", table.size());
        return table;
    }
}
