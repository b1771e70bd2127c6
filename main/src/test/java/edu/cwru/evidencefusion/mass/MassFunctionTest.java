package edu.cwru.evidencefusion.mass;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Map;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.exceptions.InvalidMassAssignmentException;

public class MassFunctionTest {

    private final Frame frame = Frame.of("a", "b", "c");

    @Test
    public void keepsOnlyFocalElements() {
        MassFunction m = MassFunction.builder(frame).add(0.5, "a").add(0.0, "b").add(0.5, "a", "b", "c").build();

        assertThat(m.focalElements()).containsExactly(0b001, 0b111);
        assertThat(m.mass(0b010)).isZero();
        assertThat(m.isNormalized()).isTrue();
    }

    @Test
    public void sumsRepeatedSubsetsInBuilder() {
        MassFunction m = MassFunction.builder(frame).add(0.25, "a").add(0.25, "a").add(0.5, "b").build();

        assertThat(m.mass(frame.singleton("a"))).isEqualTo(0.5);
    }

    @Test
    public void rejectsMassesNotSummingToOne() {
        assertThatThrownBy(() -> MassFunction.builder(frame).add(0.5, "a").add(0.4, "b").build())
                .isInstanceOf(InvalidMassAssignmentException.class).hasMessageContaining("sum");
    }

    @Test
    public void rejectsNegativeMass() {
        assertThatThrownBy(() -> MassFunction.of(frame, Map.of(1, 1.2, 2, -0.2)))
                .isInstanceOf(InvalidMassAssignmentException.class);
    }

    @Test
    public void rejectsEmptySetMassUnlessUnnormalized() {
        Map<Integer, Double> masses = Map.of(0, 0.3, 1, 0.7);

        assertThatThrownBy(() -> MassFunction.of(frame, masses)).isInstanceOf(InvalidMassAssignmentException.class);

        MassFunction raw = MassFunction.unnormalized(frame, masses);
        assertThat(raw.isNormalized()).isFalse();
        assertThat(raw.emptySetMass()).isEqualTo(0.3);
    }

    @Test
    public void rejectsSubsetOutsideFrame() {
        assertThatThrownBy(() -> MassFunction.of(frame, Map.of(0b1000, 1.0)))
                .isInstanceOf(InvalidMassAssignmentException.class);
    }

    @Test
    public void beliefAndPlausibilityOfCompositeQuery() {
        MassFunction m = MassFunction.builder(frame).add(0.3, "a").add(0.2, "b").add(0.1, "a", "b").add(0.15, "c")
                .add(0.25, "a", "b", "c").build();
        int ab = frame.maskOf("a", "b");

        assertThat(m.belief(ab)).isCloseTo(0.6, within(1e-12));
        assertThat(m.plausibility(ab)).isCloseTo(0.85, within(1e-12));
        assertThat(m.belief(frame.fullMask())).isCloseTo(1.0, within(1e-12));
        assertThat(m.plausibility(frame.singleton("c"))).isCloseTo(0.4, within(1e-12));
    }

    @Test
    public void vacuousAssignmentIsTotalIgnorance() {
        MassFunction m = MassFunction.vacuous(frame);

        assertThat(m.mass(frame.fullMask())).isEqualTo(1.0);
        assertThat(m.belief(frame.singleton("a"))).isZero();
        assertThat(m.plausibility(frame.singleton("a"))).isEqualTo(1.0);
    }

    @Test
    public void fuzzyEqualsToleratesRoundOff() {
        MassFunction m1 = MassFunction.builder(frame).add(0.3, "a").add(0.7, "a", "b", "c").build();
        MassFunction m2 = MassFunction.builder(frame).add(0.3 + 1e-12, "a").add(0.7 - 1e-12, "a", "b", "c").build();
        MassFunction m3 = MassFunction.builder(frame).add(0.3, "b").add(0.7, "a", "b", "c").build();

        assertThat(m1.fuzzyEquals(m2, 1e-9)).isTrue();
        assertThat(m1.fuzzyEquals(m3, 1e-9)).isFalse();
        assertThat(m1).isNotEqualTo(m2);
    }

    @Test
    public void rescalesMassesWithinTolerance() {
        MassFunction m = MassFunction.builder(frame).add(0.4 + 0.9e-9, "a").add(0.6, "a", "b", "c").build();

        assertThat(m.total()).isCloseTo(1.0, within(1e-15));
        assertThat(m.mass(frame.singleton("a"))).isCloseTo(0.4, within(1e-9));
    }
}
