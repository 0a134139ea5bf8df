package com.dinoroyale.matchservice.match.config;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 对局相关配置（前缀 match）。
 * 时间类配置统一用秒，调度周期用毫秒。支持通过 application.yml 或环境变量覆盖。
 */
@Data
@ConfigurationProperties(prefix = "match")
public class MatchProperties {

    /** 对局实例 ID，用于广播主题 /topic/match.{id} */
    private String id = "main";

    /** 对局驱动 tick 周期（毫秒） */
    private long tickMillis = 100;

    /** 开局最少人数 */
    private int minPlayersToStart = 4;

    /** 大厅人数达标后的等待时间 */
    private int lobbyWaitSeconds = 60;

    /** 开局倒计时（每秒一跳） */
    private int countdownSeconds = 5;

    /** 空投落地等待时间 */
    private int dropSettleSeconds = 3;

    /** 空投高度 */
    private double dropHeight = 500;

    /** 单局最长时长，超时直接结束且不判胜 */
    private int matchMaxDurationSeconds = 600;

    /** 结算展示时间 */
    private int resultsDisplaySeconds = 10;

    /** 两局之间的间隔 */
    private int intermissionSeconds = 15;

    /** 开局满血值 */
    private double maxHealth = 100;

    /** 默认模式 */
    private String defaultMode = "solo";

    /** 模式表：key 为模式 ID */
    private Map<String, Mode> modes = defaultModes();

    private MapSettings map = new MapSettings();

    private Zone zone = new Zone();

    private Creatures creatures = new Creatures();

    private TestMode testMode = new TestMode();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Mode {
        private String name;
        private int teamSize = 1;
    }

    /**
     * 出生点协作方不可用时使用的地图默认值。
     */
    @Data
    public static class MapSettings {
        private double centerX = 0;
        private double centerY = 0;
        private double centerZ = 0;
        private double defaultSize = 2048;
        /** 环形备用落点数量 */
        private int dropRingPoints = 20;
        /** 环形备用落点半径占地图尺寸的比例 */
        private double dropRingFraction = 0.15;
        /** 回大厅时的高度 */
        private double lobbySpawnHeight = 10;
    }

    @Data
    public static class Zone {
        private boolean enabled = true;
        private double initialRadius = 500;
        /** 插值采样周期（毫秒），50ms ≈ 20Hz */
        private long interpolationMillis = 50;
        private long damageIntervalMillis = 1000;
        /** 剩余秒数低于该值时逐秒预警 */
        private int warningSeconds = 10;
        /** 开局宽限期，0 表示关闭 */
        private int gracePeriodSeconds = 30;
        private double damageMultiplier = 1.0;
        /** 为空时使用内置默认缩圈表 */
        private List<Phase> phases = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Phase {
        private int delaySeconds;
        private int shrinkSeconds;
        private double endRadius;
        private double centerOffsetFraction;
        private double damage;
    }

    @Data
    public static class Creatures {
        private boolean enabled = true;
    }

    /**
     * 单人测试模式：降低开局人数、缩短大厅等待，可关闭胜负判定自由探索。
     */
    @Data
    public static class TestMode {
        private boolean enabled = false;
        private int minPlayersToStart = 1;
        private int autoStartDelaySeconds = 3;
        private boolean disableVictory = true;
        /** 测试模式下圈外伤害系数 */
        private double damageMultiplier = 0.25;
    }

    private static Map<String, Mode> defaultModes() {
        Map<String, Mode> m = new LinkedHashMap<>();
        m.put("solo", new Mode("Solo", 1));
        m.put("duos", new Mode("Duos", 2));
        m.put("trios", new Mode("Trios", 3));
        return m;
    }
}
