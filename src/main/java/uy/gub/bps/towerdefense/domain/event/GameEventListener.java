package uy.gub.bps.towerdefense.domain.event;

@FunctionalInterface
public interface GameEventListener {
    void onEvent(GameEvent<?> event);
}
