package edu.cwru.evidencefusion.combination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Arrays;
import java.util.Collections;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

public class ConflictMeasureTest {

    private final Frame frame = Frame.of("a", "b", "c");

    private final MassFunction m1 = MassFunction.builder(frame).add(0.6, "a").add(0.4, "a", "b", "c").build();
    private final MassFunction m2 = MassFunction.builder(frame).add(0.5, "b").add(0.5, "a", "b", "c").build();

    @Test
    public void sumsProductsOfDisjointFocalElements() {
        assertThat(ConflictMeasure.conflict(m1, m2)).isCloseTo(0.3, within(1e-12));
        assertThat(ConflictMeasure.conflict(m2, m1)).isCloseTo(0.3, within(1e-12));
    }

    @Test
    public void noConflictWithIgnorance() {
        assertThat(ConflictMeasure.conflict(m1, MassFunction.vacuous(frame))).isZero();
    }

    @Test
    public void disjointCategoricalSourcesConflictTotally() {
        double k = ConflictMeasure.conflict(MassFunction.categorical(frame, frame.singleton("a")),
                MassFunction.categorical(frame, frame.maskOf("b", "c")));

        assertThat(k).isEqualTo(1.0);
        assertThat(ConflictMeasure.isTotal(k)).isTrue();
        assertThat(ConflictMeasure.isTotal(0.999)).isFalse();
    }

    @Test
    public void meanOverAllPairs() {
        double mean = ConflictMeasure.meanPairwiseConflict(Arrays.asList(m1, m2, MassFunction.vacuous(frame)));

        assertThat(mean).isCloseTo(0.1, within(1e-12));
        assertThat(ConflictMeasure.meanPairwiseConflict(Collections.singletonList(m1))).isZero();
    }

    @Test
    public void framesMustMatch() {
        MassFunction other = MassFunction.vacuous(Frame.of("x", "y"));

        assertThatThrownBy(() -> ConflictMeasure.conflict(m1, other)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void nestedCategoricalSourcesDoNotConflict() {
        MassFunction a = MassFunction.categorical(frame, frame.singleton("a"));
        MassFunction ab = MassFunction.categorical(frame, frame.maskOf("a", "b"));

        assertThat(ConflictMeasure.conflict(a, ab)).isZero();
        assertThat(DempsterRule.INSTANCE.combine(a, ab)).isEqualTo(a);
    }
}
