package edu.cwru.evidencefusion.bpa;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.ahp.ConsistencyPolicy;
import edu.cwru.evidencefusion.ahp.PairwiseComparisonMatrix;
import edu.cwru.evidencefusion.ahp.PriorityMethod;
import edu.cwru.evidencefusion.exceptions.InconsistentJudgmentException;
import edu.cwru.evidencefusion.exceptions.MalformedMatrixException;
import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

public class BpaBuilderTest {

    private final Frame frame = Frame.of("a", "b", "c");

    private static final double[][] CYCLIC = { { 1, 9, 1.0 / 9 }, { 1.0 / 9, 1, 9 }, { 9, 1.0 / 9, 1 } };

    private static BpaBuilder builder(MassMapping mapping, ConsistencyPolicy policy) {
        return new BpaBuilder(PriorityMethod.EIGENVECTOR, mapping, 0.1, policy, 1e-3);
    }

    @Test
    public void confidenceMappingScalesPriorities() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.fromPriorities(new double[] { 0.5, 0.3, 0.2 });

        BpaBuildResult result = builder(new ConfidenceScaledMapping(0.8), ConsistencyPolicy.REJECT).build("e1", "c1",
                frame, m);
        MassFunction bpa = result.getMassFunction();

        assertThat(bpa.mass(frame.singleton("a"))).isCloseTo(0.40, within(1e-9));
        assertThat(bpa.mass(frame.singleton("b"))).isCloseTo(0.24, within(1e-9));
        assertThat(bpa.mass(frame.singleton("c"))).isCloseTo(0.16, within(1e-9));
        assertThat(bpa.mass(frame.fullMask())).isCloseTo(0.20, within(1e-9));
        assertThat(bpa.total()).isCloseTo(1.0, within(1e-9));
        assertThat(result.isConsistent()).isTrue();
        assertThat(result.getExpertId()).isEqualTo("e1");
    }

    @Test
    public void dsAhpMappingLeavesRootDOnTheta() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.fromPriorities(new double[] { 0.5, 0.3, 0.2 });

        MassFunction bpa = builder(new DsAhpMapping(1.0), ConsistencyPolicy.REJECT).build("e1", "c1", frame, m)
                .getMassFunction();
        double denominator = 1.0 + Math.sqrt(3);

        assertThat(bpa.mass(frame.fullMask())).isCloseTo(Math.sqrt(3) / denominator, within(1e-9));
        assertThat(bpa.mass(frame.singleton("a"))).isCloseTo(0.5 / denominator, within(1e-9));
        assertThat(bpa.total()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    public void singleAlternativeFrameGivesCertainty() {
        Frame single = Frame.of("only");
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.of(new double[][] { { 1 } });

        MassFunction bpa = builder(new ConfidenceScaledMapping(0.8), ConsistencyPolicy.REJECT)
                .build("e1", "c1", single, m).getMassFunction();

        assertThat(bpa.mass(single.fullMask())).isCloseTo(1.0, within(1e-12));
    }

    @Test
    public void malformedMatrixCarriesIds() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.of(new double[][] { { 1, 2 }, { 0.5, 1 } });

        assertThatThrownBy(() -> builder(new ConfidenceScaledMapping(0.8), ConsistencyPolicy.REJECT).build("e7",
                "price", frame, m)).isInstanceOfSatisfying(MalformedMatrixException.class, e -> {
                    assertThat(e.getExpertId()).isEqualTo("e7");
                    assertThat(e.getCriterionId()).isEqualTo("price");
                });
    }

    @Test
    public void inconsistentMatrixIsRejected() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.of(CYCLIC);

        assertThatThrownBy(() -> builder(new ConfidenceScaledMapping(0.8), ConsistencyPolicy.REJECT).build("e2",
                "quality", frame, m)).isInstanceOfSatisfying(InconsistentJudgmentException.class, e -> {
                    assertThat(e.getExpertId()).isEqualTo("e2");
                    assertThat(e.getCriterionId()).isEqualTo("quality");
                    assertThat(e.getConsistencyRatio()).isGreaterThan(0.1);
                    assertThat(e.getThreshold()).isEqualTo(0.1);
                });
    }

    @Test
    public void inconsistentMatrixIsFlaggedUnderWarnPolicy() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.of(CYCLIC);

        BpaBuildResult result = builder(new ConfidenceScaledMapping(0.8), ConsistencyPolicy.WARN).build("e2",
                "quality", frame, m);

        assertThat(result.isConsistent()).isFalse();
        assertThat(result.getConsistencyRatio()).isGreaterThan(0.1);
        assertThat(result.getMassFunction().total()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    public void mappingRejectsOutOfRangeFactors() {
        assertThatThrownBy(() -> new ConfidenceScaledMapping(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ConfidenceScaledMapping(1.5)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DsAhpMapping(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void dsAhpGroupsNearlyEqualPriorities() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.fromPriorities(new double[] { 0.4, 0.4, 0.2 });

        MassFunction bpa = builder(new DsAhpMapping(1.0, 1e-6), ConsistencyPolicy.REJECT).build("e1", "c1", frame, m)
                .getMassFunction();
        double denominator = 0.6 + Math.sqrt(2);

        assertThat(bpa.focalElements()).containsExactlyInAnyOrder(frame.maskOf("a", "b"), frame.singleton("c"),
                frame.fullMask());
        assertThat(bpa.mass(frame.maskOf("a", "b"))).isCloseTo(0.4 / denominator, within(1e-9));
        assertThat(bpa.mass(frame.singleton("c"))).isCloseTo(0.2 / denominator, within(1e-9));
        assertThat(bpa.mass(frame.fullMask())).isCloseTo(Math.sqrt(2) / denominator, within(1e-9));
    }

    @Test
    public void dsAhpWithoutToleranceKeepsEqualPrioritiesApart() {
        PairwiseComparisonMatrix m = PairwiseComparisonMatrix.fromPriorities(new double[] { 0.4, 0.4, 0.2 });

        MassFunction bpa = builder(new DsAhpMapping(1.0), ConsistencyPolicy.REJECT).build("e1", "c1", frame, m)
                .getMassFunction();

        assertThat(bpa.focalCount()).isEqualTo(4);
        assertThat(bpa.mass(frame.maskOf("a", "b"))).isZero();
    }
}
