package uy.gub.bps.towerdefense.domain.model;

public enum GameStatus {
    MENU,
    PLAYING,
    PAUSED,
    GAME_OVER,
    VICTORY;

    public boolean isTerminal() {
        return this == GAME_OVER || this == VICTORY;
    }
}
