package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.model.Cell;
import uy.gub.bps.towerdefense.domain.model.Collectible;
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

import java.util.List;
import java.util.Optional;

public interface GameEngine {
    CommandResult<Tower> placeTower(Cell cell, TowerType type);
    CommandResult<Tower> placeTower(Cell cell);
    CommandResult<Integer> sellTower(long towerId);
    CommandResult<Integer> upgradeTower(long towerId, TowerAttribute attribute);
    CommandResult<Integer> upgradeSelectedTower(TowerAttribute attribute);
    CommandResult<Integer> upgradePlayer(PlayerAttribute attribute);
    CommandResult<Integer> startNextWave();
    CommandResult<Position> movePlayer(double dx, double dy);
    CommandResult<Long> selectTower(Long towerId);
    void setSelectedTowerType(TowerType type);

    boolean start();
    boolean pause();
    boolean resume();
    boolean reset();

    boolean tick(double deltaSeconds);

    int getCurrency();
    int getLives();
    long getScore();
    int getCurrentWave();
    WavePhase getWavePhase();
    GameStatus getStatus();
    TowerType getSelectedTowerType();
    Optional<Tower> getSelectedTower();
    List<Enemy> getEnemies();
    List<Tower> getTowers();
    List<Projectile> getProjectiles();
    List<Collectible> getCollectibles();
    Optional<Player> getPlayer();
    SimulationSettings getSettings();

    /** Copies the current state; kills recorded since the previous snapshot travel with it. */
    SimulationSnapshot snapshot();

    void addStateListener(GameStateMachine.TransitionListener listener);
}
