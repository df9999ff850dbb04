package uy.gub.bps.towerdefense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public record SimulationSnapshot(
    @JsonProperty("tk") long tick,
    @JsonProperty("tm") double time,
    @JsonProperty("st") GameStatus status,
    @JsonProperty("cu") int currency,
    @JsonProperty("li") int lives,
    @JsonProperty("sc") long score,
    @JsonProperty("wv") int wave,
    @JsonProperty("wp") WavePhase wavePhase,
    @JsonProperty("tw") List<TowerView> towers,
    @JsonProperty("en") List<EnemyView> enemies,
    @JsonProperty("pl") PlayerView player,
    @JsonProperty("pr") List<ProjectileView> projectiles,
    @JsonProperty("co") List<CollectibleView> collectibles,
    @JsonProperty("ki") List<Kill> kills
) {
    public SimulationSnapshot {
        towers = List.copyOf(towers);
        enemies = List.copyOf(enemies);
        projectiles = List.copyOf(projectiles);
        collectibles = List.copyOf(collectibles);
        kills = List.copyOf(kills);
    }

    public record TowerView(
        @JsonProperty("i") long id,
        @JsonProperty("t") TowerType type,
        @JsonProperty("x") int x,
        @JsonProperty("y") int y,
        @JsonProperty("lv") Map<TowerAttribute, Integer> levels,
        @JsonProperty("sp") int cumulativeSpend
    ) {
        public TowerView {
            levels = levels.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(levels));
        }

        public static TowerView of(Tower tower) {
            return new TowerView(tower.getId(), tower.getType(), tower.getCell().x(), tower.getCell().y(),
                    tower.getUpgradeLevels(), tower.getCumulativeSpend());
        }

        public int level(TowerAttribute attribute) {
            return levels.getOrDefault(attribute, 0);
        }
    }

    public record EnemyView(
        @JsonProperty("i") long id,
        @JsonProperty("t") EnemyType type,
        @JsonProperty("x") double x,
        @JsonProperty("y") double y,
        @JsonProperty("h") double health,
        @JsonProperty("mh") double maxHealth,
        @JsonProperty("b") boolean boss
    ) {
        public static EnemyView of(Enemy enemy) {
            Position p = enemy.getPosition();
            return new EnemyView(enemy.getId(), enemy.getType(), p.x(), p.y(), enemy.getHealth(),
                    enemy.getMaxHealth(), enemy.isBoss());
        }
    }

    public record PlayerView(
        @JsonProperty("i") long id,
        @JsonProperty("x") double x,
        @JsonProperty("y") double y,
        @JsonProperty("h") double health,
        @JsonProperty("mh") double maxHealth,
        @JsonProperty("lv") Map<PlayerAttribute, Integer> levels,
        @JsonProperty("ef") Map<PowerUpType, Double> effects
    ) {
        public PlayerView {
            levels = levels.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(levels));
            effects = effects.isEmpty() ? Map.of() : Map.copyOf(new EnumMap<>(effects));
        }

        public static PlayerView of(Player player) {
            return new PlayerView(player.getId(), player.getPosition().x(), player.getPosition().y(),
                    player.getHealth(), player.getMaxHealth(), player.getUpgradeLevels(), player.getActiveEffects());
        }
    }

    public record ProjectileView(
        @JsonProperty("i") long id,
        @JsonProperty("k") ProjectileKind kind,
        @JsonProperty("x") double x,
        @JsonProperty("y") double y
    ) {
        public static ProjectileView of(Projectile projectile) {
            return new ProjectileView(projectile.getId(), projectile.getProjectileKind(),
                    projectile.getPosition().x(), projectile.getPosition().y());
        }
    }

    public record CollectibleView(
        @JsonProperty("i") long id,
        @JsonProperty("t") CollectibleType type,
        @JsonProperty("x") double x,
        @JsonProperty("y") double y
    ) {
        public static CollectibleView of(Collectible collectible) {
            return new CollectibleView(collectible.getId(), collectible.getType(),
                    collectible.getPosition().x(), collectible.getPosition().y());
        }
    }
}
