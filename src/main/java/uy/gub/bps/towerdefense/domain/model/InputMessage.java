package uy.gub.bps.towerdefense.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class InputMessage {
    @JsonProperty("t")
    private String type; // e.g. "PLACE_TOWER"
    @JsonProperty("d")
    private String payload; // e.g. "4,3,SNIPER"
}
