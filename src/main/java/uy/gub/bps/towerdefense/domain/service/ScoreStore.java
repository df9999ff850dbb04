package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.model.ScoreEntry;

import java.util.List;

/**
 * Where finished games are recorded. The engine never reads it back during play.
 */
public interface ScoreStore {
    void save(ScoreEntry entry);

    List<ScoreEntry> top(int limit);
}
