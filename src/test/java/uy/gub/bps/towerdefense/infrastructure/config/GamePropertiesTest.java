package uy.gub.bps.towerdefense.infrastructure.config;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Difficulty;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.TowerType;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GamePropertiesTest {

    @Test
    void defaults_shouldMatchSimulationDefaults() {
        SimulationSettings settings = new GameProperties().toSettings();
        SimulationSettings defaults = SimulationSettings.defaults();

        assertThat(settings.getGridWidth()).isEqualTo(defaults.getGridWidth());
        assertThat(settings.getSpawns()).isEqualTo(defaults.getSpawns());
        assertThat(settings.getGoal()).isEqualTo(defaults.getGoal());
        assertThat(settings.getStartingCurrency()).isEqualTo(defaults.getStartingCurrency());
        assertThat(settings.getTicksPerSecond()).isEqualTo(defaults.getTicksPerSecond());
    }

    @Test
    void toSettings_shouldMapOverrides() {
        GameProperties properties = new GameProperties();
        properties.setGridWidth(8);
        properties.setGridHeight(6);
        properties.setSpawns(List.of(new GameProperties.CellProperties(0, 2)));
        properties.setGoal(new GameProperties.CellProperties(7, 2));
        properties.setBlocked(List.of(new GameProperties.CellProperties(4, 0)));
        properties.setDifficulty(Difficulty.HARD);
        properties.setTowerCosts(Map.of(TowerType.WALL, 5));

        SimulationSettings settings = properties.toSettings();

        assertThat(settings.getGridWidth()).isEqualTo(8);
        assertThat(settings.getGridHeight()).isEqualTo(6);
        assertThat(settings.getSpawns()).containsExactly(new Cell(0, 2));
        assertThat(settings.getGoal()).isEqualTo(new Cell(7, 2));
        assertThat(settings.getBlocked()).containsExactly(new Cell(4, 0));
        assertThat(settings.getDifficulty()).isEqualTo(Difficulty.HARD);
        assertThat(settings.getTowerCosts()).containsEntry(TowerType.WALL, 5);
    }

    @Test
    void toSettings_shouldRejectNonPositiveTickRate() {
        GameProperties properties = new GameProperties();
        properties.setTicksPerSecond(0);

        assertThatThrownBy(properties::toSettings).isInstanceOf(IllegalArgumentException.class);
    }
}
