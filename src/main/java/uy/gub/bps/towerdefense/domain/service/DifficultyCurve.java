package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.model.Difficulty;

/**
 * Per-wave enemy scaling. Every factor is a non-decreasing function of the wave number and equals the
 * difficulty preset on wave 1.
 */
public class DifficultyCurve {
    static final double HEALTH_GROWTH = 1.1;
    static final double SPEED_GROWTH = 1.05;
    static final double REWARD_GROWTH = 1.15;
    static final double MAX_SPEED_SCALE = 2.0;

    public static final double BOSS_HEALTH = 5.0;
    public static final double BOSS_SPEED = 0.5;
    public static final double BOSS_REWARD = 5.0;

    private final Difficulty difficulty;

    public DifficultyCurve(Difficulty difficulty) {
        this.difficulty = difficulty;
    }

    public double healthMultiplier(int wave) {
        return difficulty.enemyHealthMultiplier * Math.pow(HEALTH_GROWTH, steps(wave));
    }

    public double speedMultiplier(int wave) {
        return difficulty.enemySpeedMultiplier * Math.min(MAX_SPEED_SCALE, Math.pow(SPEED_GROWTH, steps(wave)));
    }

    public double rewardMultiplier(int wave) {
        return difficulty.currencyMultiplier * Math.pow(REWARD_GROWTH, steps(wave));
    }

    public Difficulty getDifficulty() {
        return difficulty;
    }

    private static int steps(int wave) {
        return Math.max(0, wave - 1);
    }
}
