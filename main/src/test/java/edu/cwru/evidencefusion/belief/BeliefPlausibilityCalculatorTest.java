package edu.cwru.evidencefusion.belief;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

public class BeliefPlausibilityCalculatorTest {

    private final Frame frame = Frame.of("a", "b", "c");

    // Bel/Pl: a [0.2, 0.6], b [0.3, 0.5], c [0.1, 0.5]
    private final MassFunction m = MassFunction.builder(frame).add(0.2, "a").add(0.3, "b").add(0.2, "a", "c")
            .add(0.1, "c").add(0.2, "a", "b", "c").build();

    private static List<String> names(List<RankedAlternative> ranking) {
        return ranking.stream().map(RankedAlternative::getAlternative).collect(Collectors.toList());
    }

    @Test
    public void intervalsInFrameOrder() {
        List<BeliefInterval> intervals = new BeliefPlausibilityCalculator().intervals(m);

        assertThat(intervals).extracting(BeliefInterval::getAlternative).containsExactly("a", "b", "c");
        assertThat(intervals.get(0).getBelief()).isCloseTo(0.2, within(1e-12));
        assertThat(intervals.get(0).getPlausibility()).isCloseTo(0.6, within(1e-12));
        assertThat(intervals.get(0).width()).isCloseTo(0.4, within(1e-12));
        assertThat(intervals.get(2).getPlausibility()).isCloseTo(0.5, within(1e-12));
        for (BeliefInterval interval : intervals)
            assertThat(interval.getBelief()).isLessThanOrEqualTo(interval.getPlausibility());
    }

    @Test
    public void equalScoresAreBrokenByBelief() {
        List<RankedAlternative> ranking = new BeliefPlausibilityCalculator().rank(m);

        assertThat(names(ranking)).containsExactly("b", "a", "c");
        assertThat(ranking.get(0).getRank()).isEqualTo(1);
        assertThat(ranking.get(0).getScore()).isCloseTo(0.4, within(1e-12));
        assertThat(ranking.get(1).getScore()).isCloseTo(0.4, within(1e-12));
    }

    @Test
    public void identicalIntervalsAreOrderedById() {
        Frame unordered = Frame.of("c", "a", "b");

        List<RankedAlternative> ranking = new BeliefPlausibilityCalculator().rank(MassFunction.vacuous(unordered));

        assertThat(names(ranking)).containsExactly("a", "b", "c");
    }

    @Test
    public void scalarizationsChangeTheOrder() {
        assertThat(names(new BeliefPlausibilityCalculator(RankingScalarization.belief()).rank(m)))
                .containsExactly("b", "a", "c");
        assertThat(names(new BeliefPlausibilityCalculator(RankingScalarization.plausibility()).rank(m)))
                .containsExactly("a", "b", "c");
    }

    @Test
    public void pessimismBlendsTheBounds() {
        BeliefInterval interval = new BeliefInterval("a", 0.2, 0.6);

        assertThat(RankingScalarization.pessimism(0.7).score(interval)).isCloseTo(0.32, within(1e-12));
        assertThat(RankingScalarization.midpoint().score(interval)).isCloseTo(0.4, within(1e-12));
        assertThat(RankingScalarization.pessimism(0.7).name()).isEqualTo("pessimism(0.7)");
    }
}
