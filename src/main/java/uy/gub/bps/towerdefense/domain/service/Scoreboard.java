package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.model.Kill;

import java.util.ArrayList;
import java.util.List;

public class Scoreboard {
    private int lives;
    private long score;
    private int leaks;
    private int kills;
    private final List<Kill> recentKills = new ArrayList<>();

    public Scoreboard(int startingLives) {
        this.lives = Math.max(0, startingLives);
    }

    public int getLives() {
        return lives;
    }

    public long getScore() {
        return score;
    }

    public int getLeaks() {
        return leaks;
    }

    public int getKills() {
        return kills;
    }

    public void loseLives(int amount) {
        lives = Math.max(0, lives - Math.max(0, amount));
    }

    public void recordLeak(int livesCost) {
        leaks++;
        loseLives(livesCost);
    }

    public void addScore(long amount) {
        score += Math.max(0, amount);
    }

    public void recordKill(Kill kill) {
        kills++;
        score += kill.score();
        recentKills.add(kill);
    }

    public List<Kill> drainKills() {
        List<Kill> drained = List.copyOf(recentKills);
        recentKills.clear();
        return drained;
    }
}
