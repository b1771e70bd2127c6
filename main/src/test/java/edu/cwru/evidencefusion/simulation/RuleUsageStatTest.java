package edu.cwru.evidencefusion.simulation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

import edu.cwru.evidencefusion.ahp.ConsistencyPolicy;
import edu.cwru.evidencefusion.analysis.AnalysisConfig;
import edu.cwru.evidencefusion.analysis.AnalysisInput;
import edu.cwru.evidencefusion.analysis.GroupDecisionAnalyzer;
import edu.cwru.evidencefusion.combination.RuleMode;

public class RuleUsageStatTest {

    private final AnalysisInput input = new RandomCaseGenerator(3L, 0.4, 0.05).generate(3, 3, 2);

    private static AnalysisConfig config(RuleMode mode) {
        return AnalysisConfig.builder().ruleMode(mode).consistencyPolicy(ConsistencyPolicy.WARN).build();
    }

    @Test
    public void countsEveryFoldStep() {
        RuleUsageStat stat = new RuleUsageStat(0.5);

        stat.record(new GroupDecisionAnalyzer(config(RuleMode.YAGER)).analyze(input));

        // two expert folds of two steps each, one criteria step
        assertThat(stat.getRuns()).isEqualTo(1);
        assertThat(stat.getYagerSteps()).isEqualTo(5);
        assertThat(stat.getDempsterSteps()).isZero();
        assertThat(stat.yagerShare()).isEqualTo(1.0);
        assertThat(stat.meanConflict()).isBetween(0.0, 1.0);
    }

    @Test
    public void mergesRuns() {
        RuleUsageStat yager = new RuleUsageStat(0.5);
        yager.record(new GroupDecisionAnalyzer(config(RuleMode.YAGER)).analyze(input));
        RuleUsageStat dempster = new RuleUsageStat(0.5);
        dempster.record(new GroupDecisionAnalyzer(config(RuleMode.DEMPSTER)).analyze(input));

        yager.mergeResults(dempster);

        assertThat(yager.getRuns()).isEqualTo(2);
        assertThat(yager.yagerShare()).isCloseTo(0.5, within(1e-12));
    }

    @Test
    public void printsOneCsvRow() {
        RuleUsageStat stat = new RuleUsageStat(0.3);
        stat.record(new GroupDecisionAnalyzer(config(RuleMode.ADAPTIVE)).analyze(input));
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);

        RuleUsageStat.outputHeader(out);
        stat.outputSummaryStat(out);

        String[] lines = bytes.toString(StandardCharsets.UTF_8).split("\\R");
        assertThat(lines).hasSize(2);
        assertThat(lines[1]).startsWith("0.3,1,");
        assertThat(lines[1].split(",")).hasSize(lines[0].split(",").length);
    }
}
