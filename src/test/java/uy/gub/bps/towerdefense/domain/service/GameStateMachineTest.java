package uy.gub.bps.towerdefense.domain.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import uy.gub.bps.towerdefense.domain.model.GameStatus;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class GameStateMachineTest {

    private final GameStateMachine machine = new GameStateMachine();
    private final List<String> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        machine.addListener((from, to) -> transitions.add(from + "->" + to));
    }

    @Test
    void shouldWalkTheNormalLifecycle() {
        assertThat(machine.start()).isTrue();
        assertThat(machine.pause()).isTrue();
        assertThat(machine.resume()).isTrue();
        assertThat(machine.win()).isTrue();

        assertThat(machine.getStatus()).isEqualTo(GameStatus.VICTORY);
        assertThat(transitions).containsExactly("MENU->PLAYING", "PLAYING->PAUSED", "PAUSED->PLAYING",
                "PLAYING->VICTORY");
    }

    @Test
    void rejectedTransitions_shouldBeSilent() {
        assertThat(machine.pause()).isFalse();
        assertThat(machine.resume()).isFalse();
        assertThat(machine.win()).isFalse();
        assertThat(machine.reset()).isFalse();

        machine.start();
        assertThat(machine.start()).isFalse();
        assertThat(machine.resume()).isFalse();

        assertThat(transitions).containsExactly("MENU->PLAYING");
    }

    @Test
    void lose_shouldWorkWhilePaused() {
        machine.start();
        machine.pause();

        assertThat(machine.win()).isFalse();
        assertThat(machine.lose()).isTrue();
        assertThat(machine.getStatus().isTerminal()).isTrue();
    }

    @Test
    void terminalStates_shouldOnlyLeaveThroughReset() {
        machine.start();
        machine.lose();

        assertThat(machine.start()).isFalse();
        assertThat(machine.resume()).isFalse();
        assertThat(machine.reset()).isTrue();
        assertThat(machine.getStatus()).isEqualTo(GameStatus.MENU);
        assertThat(machine.start()).isTrue();
    }
}
