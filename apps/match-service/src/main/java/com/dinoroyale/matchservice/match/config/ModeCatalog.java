package com.dinoroyale.matchservice.match.config;

import com.dinoroyale.matchservice.match.domain.model.ModeConfig;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 模式目录：模式 ID（小写）-> ModeConfig。启动时加载一次，之后只读。
 */
@Slf4j
public class ModeCatalog {

    private final Map<String, ModeConfig> modes;
    private final ModeConfig defaultMode;

    public ModeCatalog(Map<String, MatchProperties.Mode> configured, String defaultModeId) {
        Map<String, ModeConfig> loaded = new LinkedHashMap<>();
        if (configured != null) {
            configured.forEach((id, m) -> {
                try {
                    String key = normalize(id);
                    String name = StringUtils.defaultIfBlank(m.getName(), StringUtils.capitalize(key));
                    loaded.put(key, new ModeConfig(key, name, m.getTeamSize()));
                } catch (IllegalArgumentException e) {
                    log.error("忽略非法模式配置 {}: {}", id, e.getMessage());
                }
            });
        }
        if (loaded.isEmpty()) {
            log.warn("未配置任何有效模式，使用内置 solo/duos/trios");
            loaded.put("solo", new ModeConfig("solo", "Solo", 1));
            loaded.put("duos", new ModeConfig("duos", "Duos", 2));
            loaded.put("trios", new ModeConfig("trios", "Trios", 3));
        }
        this.modes = Collections.unmodifiableMap(loaded);

        ModeConfig def = loaded.get(normalize(defaultModeId));
        if (def == null) {
            def = loaded.values().iterator().next();
            log.warn("默认模式 {} 不存在，改用 {}", defaultModeId, def.id());
        }
        this.defaultMode = def;
    }

    /** 按 ID 查找（忽略大小写与首尾空白） */
    public Optional<ModeConfig> find(String modeId) {
        if (StringUtils.isBlank(modeId)) return Optional.empty();
        return Optional.ofNullable(modes.get(normalize(modeId)));
    }

    public ModeConfig defaultMode() {
        return defaultMode;
    }

    public Collection<ModeConfig> all() {
        return modes.values();
    }

    private static String normalize(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }
}
