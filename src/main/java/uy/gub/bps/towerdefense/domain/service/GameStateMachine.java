package uy.gub.bps.towerdefense.domain.service;

import lombok.extern.slf4j.Slf4j;
import uy.gub.bps.towerdefense.domain.model.GameStatus;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * MENU, PLAYING, PAUSED, GAME_OVER and VICTORY. Listeners hear about every real transition exactly once;
 * rejected and same-state requests are silent.
 */
@Slf4j
public class GameStateMachine {

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(GameStatus from, GameStatus to);
    }

    private final List<TransitionListener> listeners = new CopyOnWriteArrayList<>();
    private GameStatus status = GameStatus.MENU;

    public GameStatus getStatus() {
        return status;
    }

    public boolean isPlaying() {
        return status == GameStatus.PLAYING;
    }

    public void addListener(TransitionListener listener) {
        listeners.add(listener);
    }

    public boolean start() {
        return transition(EnumSet.of(GameStatus.MENU), GameStatus.PLAYING);
    }

    public boolean pause() {
        return transition(EnumSet.of(GameStatus.PLAYING), GameStatus.PAUSED);
    }

    public boolean resume() {
        return transition(EnumSet.of(GameStatus.PAUSED), GameStatus.PLAYING);
    }

    public boolean lose() {
        return transition(EnumSet.of(GameStatus.PLAYING, GameStatus.PAUSED), GameStatus.GAME_OVER);
    }

    public boolean win() {
        return transition(EnumSet.of(GameStatus.PLAYING), GameStatus.VICTORY);
    }

    public boolean reset() {
        return transition(EnumSet.allOf(GameStatus.class), GameStatus.MENU);
    }

    private boolean transition(Set<GameStatus> allowedFrom, GameStatus to) {
        GameStatus from = status;
        if (from == to || !allowedFrom.contains(from)) {
            return false;
        }
        status = to;
        log.info("Game state {} -> {}", from, to);
        for (TransitionListener listener : listeners) {
            listener.onTransition(from, to);
        }
        return true;
    }
}
