package com.dinoroyale.matchservice.match.application;

import com.dinoroyale.matchservice.match.config.MatchProperties;
import com.dinoroyale.matchservice.match.domain.model.Position;
import com.dinoroyale.matchservice.match.domain.port.SpawnPointProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MapLayoutTest {

    @Test
    void fallbackRingSurroundsDefaultCenter() {
        MapLayout layout = new MapLayout(null, new MatchProperties.MapSettings());

        List<Position> ring = layout.dropPositions(500);

        assertThat(ring).hasSize(20);
        assertThat(ring).allSatisfy(p -> {
            assertThat(p.y()).isEqualTo(500.0);
            assertThat(Math.abs(p.planarDistanceTo(Position.ORIGIN) - 307.2)).isLessThan(1e-6);
        });
        assertThat(layout.lobbySpawn()).isEqualTo(new Position(0, 10, 0));
    }

    @Test
    void providerSpawnPointsAreLiftedToDropHeight() {
        SpawnPointProvider provider = mock(SpawnPointProvider.class);
        when(provider.getPlayerSpawnPoints()).thenReturn(List.of(new Position(1, 0, 2), new Position(3, 0, 4)));
        when(provider.getLobbySpawn()).thenReturn(Optional.of(new Position(9, 9, 9)));
        MapLayout layout = new MapLayout(provider, new MatchProperties.MapSettings());

        assertThat(layout.dropPositions(500)).containsExactly(new Position(1, 500, 2), new Position(3, 500, 4));
        assertThat(layout.lobbySpawn()).isEqualTo(new Position(9, 9, 9));
    }

    @Test
    void brokenProviderFallsBackToDefaults() {
        SpawnPointProvider provider = mock(SpawnPointProvider.class);
        when(provider.getPlayerSpawnPoints()).thenThrow(new IllegalStateException("terrain not loaded"));
        when(provider.getMapCenter()).thenReturn(new Position(100, 0, 100));
        when(provider.getMapSize()).thenReturn(1000.0);
        when(provider.getLobbySpawn()).thenReturn(Optional.empty());
        MapLayout layout = new MapLayout(provider, new MatchProperties.MapSettings());

        List<Position> ring = layout.dropPositions(500);

        assertThat(ring).hasSize(20);
        assertThat(Math.abs(ring.get(0).planarDistanceTo(new Position(100, 0, 100)) - 150.0)).isLessThan(1e-6);
        assertThat(layout.lobbySpawn()).isEqualTo(new Position(100, 10, 100));
    }
}
