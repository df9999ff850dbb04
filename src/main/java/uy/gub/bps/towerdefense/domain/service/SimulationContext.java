package uy.gub.bps.towerdefense.domain.service;

import lombok.Getter;
import uy.gub.bps.towerdefense.domain.grid.PathPlanner;
import uy.gub.bps.towerdefense.domain.grid.SpatialGrid;
import uy.gub.bps.towerdefense.domain.model.SimulationSettings;

import java.util.Random;

/**
 * The state one game runs on, passed explicitly to every subsystem instead of living in globals.
 */
@Getter
public class SimulationContext {
    private final SimulationSettings settings;
    private final SpatialGrid grid;
    private final PathPlanner planner;
    private final EntityRegistry registry;
    private final EconomyLedger ledger;
    private final Scoreboard scoreboard;
    private final DifficultyCurve difficulty;
    private final EntityFactory factory;
    private final Random random;
    private long tick;
    private double time;

    public SimulationContext(SimulationSettings settings) {
        this.settings = settings;
        this.grid = new SpatialGrid(settings);
        this.planner = new PathPlanner(grid);
        this.registry = new EntityRegistry();
        this.ledger = new EconomyLedger(settings);
        this.scoreboard = new Scoreboard(settings.getStartingLives());
        this.difficulty = new DifficultyCurve(settings.getDifficulty());
        this.factory = new EntityFactory(settings, registry, ledger, difficulty);
        this.random = new Random(settings.getRandomSeed());
    }

    void advanceTime(double deltaSeconds) {
        tick++;
        time += deltaSeconds;
    }
}
