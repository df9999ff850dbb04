package uy.gub.bps.towerdefense.domain.event;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A change between two snapshots. {@code before} is {@code null} for things that appeared,
 * {@code after} for things that went away.
 */
public record GameEvent<T>(
    @JsonProperty("e") GameEventType type,
    @JsonProperty("tk") long tick,
    @JsonProperty("b") T before,
    @JsonProperty("a") T after
) {
    public static <T> GameEvent<T> of(GameEventType type, long tick, T before, T after) {
        return new GameEvent<>(type, tick, before, after);
    }
}
