package edu.cwru.evidencefusion.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.ahp.PairwiseComparisonMatrix;
import edu.cwru.evidencefusion.analysis.AnalysisInput;
import edu.cwru.evidencefusion.analysis.Expert;

public class RandomCaseGeneratorTest {

    @Test
    public void generatesCompleteInput() {
        AnalysisInput input = new RandomCaseGenerator(7L, 0.4, 0.05).generate(4, 3, 2);

        assertThat(input.getFrame().getAlternatives()).containsExactly("A", "B", "C", "D");
        assertThat(input.getExperts()).extracting(Expert::getId).containsExactly("E1", "E2", "E3");
        assertThat(input.getCriteria()).hasSize(2);
        for (Expert expert : input.getExperts()) {
            assertThat(expert.getWeight()).isBetween(0.3, 1.0);
            assertThat(input.matrix(expert.getId(), "C1")).isPresent();
            assertThat(input.matrix(expert.getId(), "C2")).isPresent();
        }
    }

    @Test
    public void judgmentsAreReciprocal() {
        PairwiseComparisonMatrix m = new RandomCaseGenerator(1L, 0.0, 0.3).judgments(new double[] { 4, 2, 1 });

        assertThat(m.findDefect(3, 1e-9)).isEmpty();
        assertThat(m.get(1, 0) * m.get(0, 1)).isCloseTo(1.0, within(1e-12));
    }

    @Test
    public void noiselessJudgmentsAreConsistent() {
        PairwiseComparisonMatrix m = new RandomCaseGenerator(1L, 0.0, 0.0).judgments(new double[] { 4, 2, 1 });

        assertThat(m.get(0, 1)).isCloseTo(2.0, within(1e-12));
        assertThat(m.get(0, 2)).isCloseTo(4.0, within(1e-12));
    }

    @Test
    public void sameSeedSameInput() {
        AnalysisInput first = new RandomCaseGenerator(42L, 0.4, 0.05).generate(3, 2, 2);
        AnalysisInput second = new RandomCaseGenerator(42L, 0.4, 0.05).generate(3, 2, 2);

        assertThat(second.getExperts()).isEqualTo(first.getExperts());
        assertThat(second.matrix("E2", "C2")).isEqualTo(first.matrix("E2", "C2"));
    }

    @Test
    public void alternativeNames() {
        assertThat(RandomCaseGenerator.alternativeName(0)).isEqualTo("A");
        assertThat(RandomCaseGenerator.alternativeName(25)).isEqualTo("Z");
        assertThat(RandomCaseGenerator.alternativeName(26)).isEqualTo("A27");
    }
}
