package uy.gub.bps.towerdefense.infrastructure.websocket;

import com.fasterxml.jackson.annotation.JsonProperty;
import uy.gub.bps.towerdefense.domain.event.GameEvent;
import uy.gub.bps.towerdefense.domain.model.SimulationSnapshot;

import java.util.List;

public record StateMessage(
    @JsonProperty("t") String type,
    @JsonProperty("s") SimulationSnapshot snapshot,
    @JsonProperty("ev") List<GameEvent<?>> events
) {
    public static StateMessage of(SimulationSnapshot snapshot, List<GameEvent<?>> events) {
        return new StateMessage("STATE", snapshot, List.copyOf(events));
    }
}
