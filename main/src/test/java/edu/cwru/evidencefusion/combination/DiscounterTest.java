package edu.cwru.evidencefusion.combination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

public class DiscounterTest {

    private final Frame frame = Frame.of("a", "b", "c");

    private final MassFunction m = MassFunction.builder(frame).add(0.6, "a").add(0.4, "b").build();

    @Test
    public void movesRemainderToTheta() {
        MassFunction d = Discounter.discount(m, 0.5);

        assertThat(d.mass(frame.singleton("a"))).isCloseTo(0.3, within(1e-12));
        assertThat(d.mass(frame.singleton("b"))).isCloseTo(0.2, within(1e-12));
        assertThat(d.mass(frame.fullMask())).isCloseTo(0.5, within(1e-12));
    }

    @Test
    public void mergesWithExistingThetaMass() {
        MassFunction withTheta = MassFunction.builder(frame).add(0.8, "a").add(0.2, "a", "b", "c").build();

        MassFunction d = Discounter.discount(withTheta, 0.5);

        assertThat(d.mass(frame.singleton("a"))).isCloseTo(0.4, within(1e-12));
        assertThat(d.mass(frame.fullMask())).isCloseTo(0.6, within(1e-12));
    }

    @Test
    public void fullReliabilityKeepsTheSource() {
        assertThat(Discounter.discount(m, 1.0)).isSameAs(m);
    }

    @Test
    public void zeroReliabilityGivesIgnorance() {
        assertThat(Discounter.discount(m, 0.0)).isEqualTo(MassFunction.vacuous(frame));
    }

    @Test
    public void rejectsInvalidInput() {
        MassFunction product = MassFunction.builder(frame).add(0.3, new String[0]).add(0.7, "a").buildUnnormalized();

        assertThatThrownBy(() -> Discounter.discount(m, 1.2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Discounter.discount(product, 0.5)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void weightScalings() {
        assertThat(WeightScaling.NONE.toDiscountFactors(new double[] { 0.9, 0.4 })).containsExactly(0.9, 0.4);
        assertThat(WeightScaling.SUM.toDiscountFactors(new double[] { 1, 3 })).containsExactly(0.25, 0.75);
        assertThat(WeightScaling.MAX.toDiscountFactors(new double[] { 1, 2 })).containsExactly(0.5, 1.0);
        assertThatThrownBy(() -> WeightScaling.NONE.toDiscountFactors(new double[] { 1.5 }))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
