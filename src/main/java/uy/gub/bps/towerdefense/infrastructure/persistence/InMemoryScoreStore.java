package uy.gub.bps.towerdefense.infrastructure.persistence;

import uy.gub.bps.towerdefense.domain.model.ScoreEntry;
import uy.gub.bps.towerdefense.domain.service.ScoreStore;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

public class InMemoryScoreStore implements ScoreStore {
    private final int capacity;
    private final List<ScoreEntry> entries = new ArrayList<>();

    public InMemoryScoreStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void save(ScoreEntry entry) {
        entries.add(entry);
        entries.sort(Comparator.comparingLong(ScoreEntry::score).reversed());
        while (entries.size() > capacity) {
            entries.remove(entries.size() - 1);
        }
    }

    @Override
    public synchronized List<ScoreEntry> top(int limit) {
        return List.copyOf(entries.subList(0, Math.max(0, Math.min(limit, entries.size()))));
    }
}
