package uy.gub.bps.towerdefense.domain.service;

import uy.gub.bps.towerdefense.domain.SimulationInvariantException;
import uy.gub.bps.towerdefense.domain.model.Collectible;
import uy.gub.bps.towerdefense.domain.model.Enemy;
import uy.gub.bps.towerdefense.domain.model.EntityKind;
import uy.gub.bps.towerdefense.domain.model.GameObject;
import uy.gub.bps.towerdefense.domain.model.Player;
import uy.gub.bps.towerdefense.domain.model.Projectile;
import uy.gub.bps.towerdefense.domain.model.Tower;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Owns every live entity. Ids are handed out sequentially and never reused; iteration follows insertion order
 * so ticks replay identically. Removal is deferred until {@link #flushRemovals()}.
 */
public class EntityRegistry {
    private final Map<Long, GameObject> all = new LinkedHashMap<>();
    private final Map<Long, Tower> towers = new LinkedHashMap<>();
    private final Map<Long, Enemy> enemies = new LinkedHashMap<>();
    private final Map<Long, Projectile> projectiles = new LinkedHashMap<>();
    private final Map<Long, Collectible> collectibles = new LinkedHashMap<>();
    private final Set<Long> pendingRemoval = new LinkedHashSet<>();
    private Player player;
    private long nextId = 1;

    public long nextId() {
        return nextId++;
    }

    public <T extends GameObject> T register(T object) {
        if (object.getId() <= 0 || object.getId() >= nextId) {
            throw new IllegalArgumentException("Id " + object.getId() + " was not issued by this registry");
        }
        if (all.putIfAbsent(object.getId(), object) != null) {
            throw new IllegalArgumentException("Id " + object.getId() + " is already registered");
        }
        switch (object.getKind()) {
            case TOWER -> towers.put(object.getId(), (Tower) object);
            case ENEMY -> enemies.put(object.getId(), (Enemy) object);
            case PROJECTILE -> projectiles.put(object.getId(), (Projectile) object);
            case COLLECTIBLE -> collectibles.put(object.getId(), (Collectible) object);
            case PLAYER -> {
                if (player != null) {
                    all.remove(object.getId());
                    throw new IllegalArgumentException("A player is already registered");
                }
                player = (Player) object;
            }
        }
        return object;
    }

    public Optional<GameObject> find(long id) {
        return Optional.ofNullable(all.get(id));
    }

    public boolean contains(long id) {
        return all.containsKey(id);
    }

    public Optional<Tower> tower(long id) {
        return Optional.ofNullable(towers.get(id));
    }

    public Optional<Enemy> enemy(long id) {
        return Optional.ofNullable(enemies.get(id));
    }

    /**
     * Looks up an id that live state depends on. A miss means the simulation lost track of an entity.
     */
    public GameObject require(long id) {
        GameObject object = all.get(id);
        if (object == null) {
            throw new SimulationInvariantException("Entity " + id + " is referenced but not registered");
        }
        return object;
    }

    public Collection<Tower> towers() {
        return Collections.unmodifiableCollection(towers.values());
    }

    public Collection<Enemy> enemies() {
        return Collections.unmodifiableCollection(enemies.values());
    }

    public Collection<Projectile> projectiles() {
        return Collections.unmodifiableCollection(projectiles.values());
    }

    public Collection<Collectible> collectibles() {
        return Collections.unmodifiableCollection(collectibles.values());
    }

    public Optional<Player> player() {
        return Optional.ofNullable(player);
    }

    public int count(EntityKind kind) {
        return switch (kind) {
            case TOWER -> towers.size();
            case ENEMY -> enemies.size();
            case PROJECTILE -> projectiles.size();
            case COLLECTIBLE -> collectibles.size();
            case PLAYER -> player == null ? 0 : 1;
        };
    }

    public void scheduleRemoval(long id) {
        if (all.containsKey(id)) {
            pendingRemoval.add(id);
        }
    }

    public boolean isPendingRemoval(long id) {
        return pendingRemoval.contains(id);
    }

    /**
     * Removes right away. Only for commands applied between ticks.
     */
    public GameObject removeNow(long id) {
        pendingRemoval.remove(id);
        GameObject removed = all.remove(id);
        if (removed != null) {
            detach(removed);
        }
        return removed;
    }

    public List<GameObject> flushRemovals() {
        List<GameObject> removed = new ArrayList<>(pendingRemoval.size());
        for (Long id : pendingRemoval) {
            GameObject object = all.remove(id);
            if (object != null) {
                detach(object);
                removed.add(object);
            }
        }
        pendingRemoval.clear();
        return removed;
    }

    private void detach(GameObject object) {
        switch (object.getKind()) {
            case TOWER -> towers.remove(object.getId());
            case ENEMY -> enemies.remove(object.getId());
            case PROJECTILE -> projectiles.remove(object.getId());
            case COLLECTIBLE -> collectibles.remove(object.getId());
            case PLAYER -> player = null;
        }
    }
}
