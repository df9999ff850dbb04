package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.CollectibleType;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.EnemyType;
import uy.gub.bps.towerdefense.domain.model.Player;
import uy.gub.bps.towerdefense.domain.model.PlayerAttribute;
import uy.gub.bps.towerdefense.domain.model.Position;
import uy.gub.bps.towerdefense.domain.model.PowerUpType;
import uy.gub.bps.towerdefense.domain.model.SpawnGroup;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class PlayerControllerTest {

    private SimulationContext ctx;
    private PlayerController controller;
    private Player player;

    @BeforeEach
    void setUp() {
        ctx = new SimulationContext(TestSettings.corridor(10, 3).playerEnabled(true).build());
        controller = new PlayerController(ctx);
        player = ctx.getFactory().player(new Position(5, 1.5));
    }

    @Test
    void move_shouldStayInsideTheGrid() {
        controller.steer(player, -1, 0);

        controller.move(player, 100);

        assertThat(player.getPosition().x()).isEqualTo(0.5);
        assertThat(player.getPosition().y()).isEqualTo(1.5);
    }

    @Test
    void steer_shouldNormaliseTheDirection() {
        controller.steer(player, 3, 4);

        assertThat(player.getVx()).isCloseTo(0.6, within(1e-9));
        assertThat(player.getVy()).isCloseTo(0.8, within(1e-9));
    }

    @Test
    void damage_shouldBeAbsorbedByShield() {
        player.getActiveEffects().put(PowerUpType.SHIELD, 100.0);

        controller.damage(player, 30);

        assertThat(player.getHealth()).isEqualTo(player.getMaxHealth());
    }

    @Test
    void downedPlayer_shouldCostALifeAndRespawnAtTheGoal() {
        int lives = ctx.getScoreboard().getLives();

        controller.damage(player, 1000);

        assertThat(ctx.getScoreboard().getLives()).isEqualTo(lives - 1);
        assertThat(player.getHealth()).isEqualTo(player.getMaxHealth());
        assertThat(player.getPosition()).isEqualTo(new Cell(9, 1).center());
    }

    @Test
    void contact_shouldHurtOncePerInterval() {
        Enemy enemy = ctx.getFactory().enemy(SpawnGroup.of(EnemyType.TANK, 1, 0),
                ctx.getPlanner().routeFrom(new Cell(0, 1)), 1);
        enemy.setProgress(4.5);
        double full = player.getHealth();

        controller.interact(player);
        controller.interact(player);

        assertThat(player.getHealth()).isCloseTo(full - EnemyType.TANK.contactDamage, within(1e-9));
        assertThat(enemy.getContactCooldown()).isEqualTo(PlayerController.CONTACT_INTERVAL);
    }

    @Test
    void pickups_shouldApplyTheirEffect() {
        player.setHealth(10);
        ctx.getFactory().collectible(CollectibleType.HEALTH, new Position(5.2, 1.5), 0);
        ctx.getFactory().collectible(CollectibleType.EXTRA_CURRENCY, new Position(5, 1.8), 0);
        ctx.getFactory().collectible(CollectibleType.SHIELD, new Position(5, 1.5), 0);
        ctx.getFactory().collectible(CollectibleType.DAMAGE_BOOST, new Position(9, 2.5), 0);

        controller.interact(player);

        assertThat(player.getHealth()).isEqualTo(35);
        assertThat(ctx.getLedger().pendingRewards()).isEqualTo(25);
        assertThat(player.hasEffect(PowerUpType.SHIELD)).isTrue();
        assertThat(player.hasEffect(PowerUpType.DAMAGE_BOOST)).isFalse();
        assertThat(ctx.getRegistry().collectibles())
                .filteredOn(c -> !ctx.getRegistry().isPendingRemoval(c.getId()))
                .extracting(c -> c.getType())
                .containsExactly(CollectibleType.DAMAGE_BOOST);
    }

    @Test
    void effects_shouldExpireBySimulationTime() {
        player.getActiveEffects().put(PowerUpType.SPEED_BOOST, 1.0);
        double boosted = player.getSpeed();

        ctx.advanceTime(1.0);
        controller.move(player, 0);

        assertThat(player.hasEffect(PowerUpType.SPEED_BOOST)).isFalse();
        assertThat(player.getSpeed()).isLessThan(boosted);
    }

    @Test
    void regeneration_shouldHealUpToMax() {
        player.incrementLevel(PlayerAttribute.REGENERATION);
        player.setHealth(player.getMaxHealth() - 0.1);

        controller.move(player, 0.5);
        controller.move(player, 0.5);

        assertThat(player.getHealth()).isEqualTo(player.getMaxHealth());
    }
}
