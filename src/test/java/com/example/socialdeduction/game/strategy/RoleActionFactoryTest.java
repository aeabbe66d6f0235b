package com.example.socialdeduction.game.strategy;

import com.example.socialdeduction.game.variant.mafia.DetectiveAction;
import com.example.socialdeduction.game.variant.mafia.DoctorAction;
import com.example.socialdeduction.game.variant.mafia.MafiaAction;
import com.example.socialdeduction.game.variant.mafia.MafiaRole;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoleActionFactoryTest {

    @Test
    @DisplayName("powers are ordered by night priority whatever the registration order")
    void ordersByPriority() {
        // given
        RoleActionFactory factory = new RoleActionFactory(List.of(
                new DetectiveAction(), new MafiaAction(), new DoctorAction()));

        // when
        List<NightPriority> order = factory.getStrategies().stream()
                .map(RoleActionStrategy::getPriority)
                .toList();

        // then
        assertThat(order).containsExactly(NightPriority.PROTECTION, NightPriority.ELIMINATION,
                NightPriority.INVESTIGATION);
        assertThat(factory.getStrategies(NightPriority.ELIMINATION)).hasSize(1);
        assertThat(factory.canActAtNight(MafiaRole.DOCTOR)).isTrue();
        assertThat(factory.canActAtNight(MafiaRole.TOWNSPERSON)).isFalse();
    }

    @Test
    @DisplayName("a role may not ask for two up-front decisions in one night")
    void rejectsDuplicateDecision() {
        assertThatThrownBy(() -> new RoleActionFactory(List.of(new DoctorAction(), new DoctorAction())))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a variant without night powers has an empty factory")
    void none() {
        assertThat(RoleActionFactory.none().isEmpty()).isTrue();
    }
}
