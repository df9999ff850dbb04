package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.SimulationInvariantException;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Collectible;
import uy.gub.bps.towerdefense.domain.model.CollectibleType;
import uy.gub.bps.towerdefense.domain.model.EntityKind;
import uy.gub.bps.towerdefense.domain.model.Position;
import uy.gub.bps.towerdefense.domain.model.Tower;
import uy.gub.bps.towerdefense.domain.model.TowerType;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class EntityRegistryTest {

    private final EntityRegistry registry = new EntityRegistry();

    private Tower tower(int x) {
        return registry.register(Tower.builder()
                .id(registry.nextId())
                .type(TowerType.BASIC)
                .cell(new Cell(x, 0))
                .build());
    }

    @Test
    void nextId_shouldBeSequentialAndUnique() {
        Tower first = tower(0);
        Tower second = tower(1);

        assertThat(second.getId()).isEqualTo(first.getId() + 1);
        assertThat(registry.towers()).containsExactly(first, second);
    }

    @Test
    void register_shouldRejectIdsItNeverIssued() {
        Tower stray = Tower.builder().id(42).type(TowerType.BASIC).cell(new Cell(0, 0)).build();

        assertThatThrownBy(() -> registry.register(stray)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void register_shouldRejectDuplicates() {
        Tower tower = tower(0);

        assertThatThrownBy(() -> registry.register(tower)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void scheduleRemoval_shouldDeferUntilFlush() {
        Tower tower = tower(0);
        Collectible coin = registry.register(Collectible.builder()
                .id(registry.nextId())
                .type(CollectibleType.EXTRA_CURRENCY)
                .position(new Position(1, 1))
                .build());

        registry.scheduleRemoval(tower.getId());

        assertThat(registry.contains(tower.getId())).isTrue();
        assertThat(registry.isPendingRemoval(tower.getId())).isTrue();

        assertThat(registry.flushRemovals()).containsExactly(tower);
        assertThat(registry.contains(tower.getId())).isFalse();
        assertThat(registry.count(EntityKind.TOWER)).isZero();
        assertThat(registry.count(EntityKind.COLLECTIBLE)).isEqualTo(1);
        assertThat(registry.find(coin.getId())).contains(coin);
    }

    @Test
    void removeNow_shouldDropImmediately() {
        Tower tower = tower(0);

        assertThat(registry.removeNow(tower.getId())).isSameAs(tower);
        assertThat(registry.tower(tower.getId())).isEmpty();
        assertThat(registry.removeNow(tower.getId())).isNull();
    }

    @Test
    void require_shouldTreatMissingEntitiesAsInvariantViolations() {
        assertThatThrownBy(() -> registry.require(5)).isInstanceOf(SimulationInvariantException.class);
    }

    @Test
    void idsShouldNeverBeReusedAfterRemoval() {
        Tower tower = tower(0);
        registry.removeNow(tower.getId());

        assertThat(tower(1).getId()).isGreaterThan(tower.getId());
    }
}
