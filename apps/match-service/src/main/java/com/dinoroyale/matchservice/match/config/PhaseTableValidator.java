package com.dinoroyale.matchservice.match.config;

import com.dinoroyale.matchservice.match.domain.model.PhaseConfig;

import java.util.ArrayList;
import java.util.List;

/**
 * 缩圈表校验。
 * 配置错误不会让进程退出：校验结果以错误列表返回，由装配方决定是否退回内置默认表。
 */
public final class PhaseTableValidator {

    /** 内置默认缩圈表（5 个阶段，总时长约 6~7 分钟） */
    public static final List<PhaseConfig> DEFAULT_TABLE = List.of(
            new PhaseConfig(30, 20, 200, 0.10, 1),
            new PhaseConfig(20, 15, 120, 0.15, 2),
            new PhaseConfig(15, 12, 60, 0.20, 4),
            new PhaseConfig(10, 10, 25, 0.15, 8),
            new PhaseConfig(5, 8, 0, 0.0, 16)
    );

    private PhaseTableValidator() {
    }

    /**
     * 校验缩圈表。
     * @param phases        配置的阶段列表
     * @param initialRadius 初始半径
     * @return 错误信息列表；为空表示合法
     */
    public static List<String> validate(List<MatchProperties.Phase> phases, double initialRadius) {
        List<String> errors = new ArrayList<>();
        if (!(initialRadius > 0)) {
            errors.add("initial-radius must be > 0, got " + initialRadius);
        }
        if (phases == null || phases.isEmpty()) {
            errors.add("phase table is empty");
            return errors;
        }
        double previousRadius = initialRadius;
        for (int i = 0; i < phases.size(); i++) {
            MatchProperties.Phase p = phases.get(i);
            int n = i + 1;
            if (p == null) {
                errors.add("phase " + n + " is null");
                continue;
            }
            if (p.getDelaySeconds() < 0) errors.add("phase " + n + ": delay-seconds < 0");
            if (p.getShrinkSeconds() < 0) errors.add("phase " + n + ": shrink-seconds < 0");
            if (p.getEndRadius() < 0) errors.add("phase " + n + ": end-radius < 0");
            if (p.getEndRadius() > previousRadius) {
                errors.add("phase " + n + ": end-radius " + p.getEndRadius()
                        + " is larger than the previous radius " + previousRadius);
            }
            if (p.getCenterOffsetFraction() < 0 || p.getCenterOffsetFraction() > 1) {
                errors.add("phase " + n + ": center-offset-fraction must be within [0,1]");
            }
            if (p.getDamage() < 0) errors.add("phase " + n + ": damage < 0");
            previousRadius = p.getEndRadius();
        }
        return errors;
    }

    /**
     * 转成不可变的 PhaseConfig 列表（调用前应先 {@link #validate}）。
     */
    public static List<PhaseConfig> toConfigs(List<MatchProperties.Phase> phases) {
        return phases.stream()
                .map(p -> new PhaseConfig(p.getDelaySeconds(), p.getShrinkSeconds(), p.getEndRadius(),
                        p.getCenterOffsetFraction(), p.getDamage()))
                .toList();
    }
}
