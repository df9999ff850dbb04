package uy.gub.bps.towerdefense.domain;

/**
 * Internal state is inconsistent. Thrown to abort the current tick; never a validation outcome.
 */
public class SimulationInvariantException extends RuntimeException {
    public SimulationInvariantException(String message) {
        super(message);
    }
}
