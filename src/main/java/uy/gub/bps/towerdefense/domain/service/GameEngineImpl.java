package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.SimulationInvariantException;
import uy.gub.bps.towerdefense.domain.grid.PathPlanner;
import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Collectible;
import uy.gub.bps.towerdefense.domain.model.CommandFailure;
import uy.gub.bps.towerdefense.domain.model.CommandResult;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.GameStatus;
import uy.gub.bps.towerdefense.domain.model.Player;
import uy.gub.bps.towerdefense.domain.model.PlayerAttribute;
import uy.gub.bps.towerdefense.domain.model.Position;
import uy.gub.bps.towerdefense.domain.model.Projectile;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot;
import uy.gub.bps.towerdefense.domain.model.Tower;
import uy.gub.bps.towerdefense.domain.model.TowerAttribute;
import uy.gub.bps.towerdefense.domain.model.TowerType;
import uy.gub.bps.towerdefense.domain.model.WavePhase;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Single-threaded engine. Commands are validated and applied between ticks; a command issued while a tick
 * runs, or outside PLAYING, is rejected with {@link CommandFailure#INVALID_STATE}.
 */
@Slf4j
public class GameEngineImpl implements GameEngine {

    private final SimulationSettings settings;
    private final GameStateMachine stateMachine = new GameStateMachine();

    private SimulationContext ctx;
    private WaveScheduler waves;
    private PlayerController playerController;
    private SimulationClock clock;
    private TowerType selectedTowerType;
    private Long selectedTowerId;

    public GameEngineImpl(SimulationSettings settings) {
        this.settings = settings;
        build();
    }

    private void build() {
        ctx = new SimulationContext(settings);
        waves = new WaveScheduler(ctx, WavePlan.from(settings));
        playerController = new PlayerController(ctx);
        clock = new SimulationClock(ctx, stateMachine, waves, new EnemyMovement(ctx), new CombatResolver(ctx),
                playerController);
        if (settings.isPlayerEnabled()) {
            ctx.getFactory().player(ctx.getGrid().getGoal().center());
        }
        selectedTowerType = null;
        selectedTowerId = null;
    }

    // --- commands ---

    @Override
    public CommandResult<Tower> placeTower(Cell cell) {
        if (selectedTowerType == null) {
            return CommandResult.failed(CommandFailure.NO_TARGET_SELECTED);
        }
        return placeTower(cell, selectedTowerType);
    }

    @Override
    public CommandResult<Tower> placeTower(Cell cell, TowerType type) {
        if (!acceptsCommands()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        if (type == null) {
            return CommandResult.failed(CommandFailure.NO_TARGET_SELECTED);
        }
        int cost = ctx.getLedger().towerCost(type);
        if (!ctx.getLedger().canAfford(cost)) {
            log.debug("Cannot afford {} ({})", type, cost);
            return CommandResult.failed(CommandFailure.INSUFFICIENT_FUNDS);
        }
        Set<Cell> anchors = enemyAnchors();
        CommandFailure failure = ctx.getGrid().checkPlacement(cell, anchors);
        if (failure != null) {
            log.debug("Placement of {} at {} rejected: {}", type, cell, failure);
            return CommandResult.failed(failure);
        }
        ctx.getLedger().spend(cost);
        long id = ctx.getRegistry().nextId();
        if (!ctx.getGrid().placeTower(cell, id, anchors).isSuccess()) {
            throw new SimulationInvariantException("Validated placement at " + cell + " failed to commit");
        }
        Tower tower = ctx.getFactory().tower(id, type, cell, cost);
        log.debug("Placed {} {} at {}", type, id, cell);
        return CommandResult.ok(tower);
    }

    @Override
    public CommandResult<Integer> sellTower(long towerId) {
        if (!acceptsCommands()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        Optional<Tower> found = ctx.getRegistry().tower(towerId);
        if (found.isEmpty()) {
            return CommandResult.failed(CommandFailure.UNKNOWN_ENTITY);
        }
        Tower tower = found.get();
        int refund = ctx.getLedger().refundFor(tower.getCumulativeSpend());
        ctx.getGrid().removeTower(tower.getCell());
        for (Projectile projectile : List.copyOf(ctx.getRegistry().projectiles())) {
            if (projectile.getOwnerId() == towerId) {
                ctx.getRegistry().removeNow(projectile.getId());
            }
        }
        ctx.getRegistry().removeNow(towerId);
        ctx.getLedger().credit(refund);
        if (selectedTowerId != null && selectedTowerId == towerId) {
            selectedTowerId = null;
        }
        log.debug("Sold tower {} for {}", towerId, refund);
        return CommandResult.ok(refund);
    }

    @Override
    public CommandResult<Integer> upgradeTower(long towerId, TowerAttribute attribute) {
        if (!acceptsCommands()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        Optional<Tower> found = ctx.getRegistry().tower(towerId);
        if (found.isEmpty()) {
            return CommandResult.failed(CommandFailure.UNKNOWN_ENTITY);
        }
        Tower tower = found.get();
        UpgradeCostCurve curve = ctx.getLedger().curve(tower.getType(), attribute);
        int level = tower.getLevel(attribute);
        if (!curve.canAdvance(level)) {
            return CommandResult.failed(CommandFailure.MAX_LEVEL_REACHED);
        }
        int cost = curve.costAt(level);
        CommandResult<Integer> paid = ctx.getLedger().spend(cost);
        if (!paid.isSuccess()) {
            return paid;
        }
        tower.incrementLevel(attribute);
        tower.setCumulativeSpend(tower.getCumulativeSpend() + cost);
        log.debug("Tower {} {} -> level {}", towerId, attribute, level + 1);
        return CommandResult.ok(level + 1);
    }

    @Override
    public CommandResult<Integer> upgradeSelectedTower(TowerAttribute attribute) {
        if (selectedTowerId == null) {
            return CommandResult.failed(CommandFailure.NO_TARGET_SELECTED);
        }
        return upgradeTower(selectedTowerId, attribute);
    }

    @Override
    public CommandResult<Integer> upgradePlayer(PlayerAttribute attribute) {
        if (!acceptsCommands()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        Optional<Player> found = ctx.getRegistry().player();
        if (found.isEmpty()) {
            return CommandResult.failed(CommandFailure.UNKNOWN_ENTITY);
        }
        Player player = found.get();
        UpgradeCostCurve curve = ctx.getLedger().curve(attribute);
        int level = player.getLevel(attribute);
        if (!curve.canAdvance(level)) {
            return CommandResult.failed(CommandFailure.MAX_LEVEL_REACHED);
        }
        CommandResult<Integer> paid = ctx.getLedger().spend(curve.costAt(level));
        if (!paid.isSuccess()) {
            return paid;
        }
        double maxBefore = player.getMaxHealth();
        player.incrementLevel(attribute);
        if (attribute == PlayerAttribute.HEALTH) {
            player.setHealth(player.getHealth() + player.getMaxHealth() - maxBefore);
        }
        return CommandResult.ok(level + 1);
    }

    @Override
    public CommandResult<Integer> startNextWave() {
        if (!acceptsCommands()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        return waves.startNextWave();
    }

    @Override
    public CommandResult<Position> movePlayer(double dx, double dy) {
        if (!acceptsCommands()) {
            return CommandResult.failed(CommandFailure.INVALID_STATE);
        }
        Optional<Player> player = ctx.getRegistry().player();
        if (player.isEmpty()) {
            return CommandResult.failed(CommandFailure.UNKNOWN_ENTITY);
        }
        playerController.steer(player.get(), dx, dy);
        return CommandResult.ok(player.get().getPosition());
    }

    @Override
    public CommandResult<Long> selectTower(Long towerId) {
        if (towerId == null) {
            selectedTowerId = null;
            return CommandResult.ok(null);
        }
        if (ctx.getRegistry().tower(towerId).isEmpty()) {
            return CommandResult.failed(CommandFailure.UNKNOWN_ENTITY);
        }
        selectedTowerId = towerId;
        return CommandResult.ok(towerId);
    }

    @Override
    public void setSelectedTowerType(TowerType type) {
        selectedTowerType = type;
    }

    @Override
    public boolean start() {
        return stateMachine.start();
    }

    @Override
    public boolean pause() {
        return stateMachine.pause();
    }

    @Override
    public boolean resume() {
        return stateMachine.resume();
    }

    /** Discards the current game and goes back to MENU with a fresh world. */
    @Override
    public boolean reset() {
        if (clock.isTicking()) {
            throw new IllegalStateException("reset() called while a tick is in progress");
        }
        build();
        stateMachine.reset();
        log.info("Game reset");
        return true;
    }

    @Override
    public boolean tick(double deltaSeconds) {
        return clock.tick(deltaSeconds);
    }

    private boolean acceptsCommands() {
        return stateMachine.isPlaying() && !clock.isTicking();
    }

    private Set<Cell> enemyAnchors() {
        Set<Cell> anchors = new LinkedHashSet<>();
        for (Enemy enemy : ctx.getRegistry().enemies()) {
            if (enemy.isAlive() && !enemy.hasReachedGoal() && !ctx.getRegistry().isPendingRemoval(enemy.getId())) {
                anchors.addAll(PathPlanner.footprint(enemy));
            }
        }
        return anchors;
    }

    // --- queries ---

    @Override
    public int getCurrency() {
        return ctx.getLedger().getBalance();
    }

    @Override
    public int getLives() {
        return ctx.getScoreboard().getLives();
    }

    @Override
    public long getScore() {
        return ctx.getScoreboard().getScore();
    }

    @Override
    public int getCurrentWave() {
        return waves.getCurrentWave();
    }

    @Override
    public WavePhase getWavePhase() {
        return waves.getPhase();
    }

    @Override
    public GameStatus getStatus() {
        return stateMachine.getStatus();
    }

    @Override
    public TowerType getSelectedTowerType() {
        return selectedTowerType;
    }

    @Override
    public Optional<Tower> getSelectedTower() {
        return selectedTowerId == null ? Optional.empty() : ctx.getRegistry().tower(selectedTowerId);
    }

    @Override
    public List<Enemy> getEnemies() {
        return List.copyOf(ctx.getRegistry().enemies());
    }

    @Override
    public List<Tower> getTowers() {
        return List.copyOf(ctx.getRegistry().towers());
    }

    @Override
    public List<Projectile> getProjectiles() {
        return List.copyOf(ctx.getRegistry().projectiles());
    }

    @Override
    public List<Collectible> getCollectibles() {
        return List.copyOf(ctx.getRegistry().collectibles());
    }

    @Override
    public Optional<Player> getPlayer() {
        return ctx.getRegistry().player();
    }

    @Override
    public SimulationSettings getSettings() {
        return settings;
    }

    @Override
    public SimulationSnapshot snapshot() {
        List<SimulationSnapshot.TowerView> towers = new ArrayList<>();
        ctx.getRegistry().towers().forEach(t -> towers.add(SimulationSnapshot.TowerView.of(t)));
        List<SimulationSnapshot.EnemyView> enemies = new ArrayList<>();
        ctx.getRegistry().enemies().forEach(e -> enemies.add(SimulationSnapshot.EnemyView.of(e)));
        List<SimulationSnapshot.ProjectileView> projectiles = new ArrayList<>();
        ctx.getRegistry().projectiles().forEach(p -> projectiles.add(SimulationSnapshot.ProjectileView.of(p)));
        List<SimulationSnapshot.CollectibleView> collectibles = new ArrayList<>();
        ctx.getRegistry().collectibles().forEach(c -> collectibles.add(SimulationSnapshot.CollectibleView.of(c)));
        SimulationSnapshot.PlayerView player = ctx.getRegistry().player()
                .map(SimulationSnapshot.PlayerView::of)
                .orElse(null);
        return new SimulationSnapshot(ctx.getTick(), ctx.getTime(), stateMachine.getStatus(),
                ctx.getLedger().getBalance(), ctx.getScoreboard().getLives(), ctx.getScoreboard().getScore(),
                waves.getCurrentWave(), waves.getPhase(), towers, enemies, player, projectiles, collectibles,
                ctx.getScoreboard().drainKills());
    }

    @Override
    public void addStateListener(GameStateMachine.TransitionListener listener) {
        stateMachine.addListener(listener);
    }

    SimulationContext context() {
        return ctx;
    }
}
