package uy.gub.bps.towerdefense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScoreEntry(
    @JsonProperty("s") long score,
    @JsonProperty("w") int wave,
    @JsonProperty("o") GameStatus outcome,
    @JsonProperty("d") Difficulty difficulty
) {
}
