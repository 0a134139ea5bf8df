package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.domain.port.DinosaurSpawnController;
import com.dinoroyale.matchservice.match.domain.port.LootController;

/**
 * 可选外部协作方。任一为 null 表示未接入，对应动作只记日志并跳过。
 */
public record MatchCollaborators(DinosaurSpawnController dinosaurs, LootController loot) {

    public static MatchCollaborators none() {
        return new MatchCollaborators(null, null);
    }
}
