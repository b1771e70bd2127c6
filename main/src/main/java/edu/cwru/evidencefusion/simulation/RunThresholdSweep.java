package edu.cwru.evidencefusion.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import edu.cwru.evidencefusion.ahp.ConsistencyPolicy;
import edu.cwru.evidencefusion.analysis.AnalysisConfig;
import edu.cwru.evidencefusion.analysis.AnalysisInput;
import edu.cwru.evidencefusion.analysis.GroupDecisionAnalyzer;

/**
 * Runs random group decision problems for conflict thresholds 0.0, 0.1, ...,
 * 1.0 and prints one CSV row of rule usage per threshold to stdout.
 *
 * Arguments: alternatives experts criteria runs seed (all optional).
 */
public class RunThresholdSweep {

    private static final Logger logger = LoggerFactory.getLogger(RunThresholdSweep.class);

    public static void main(String[] args) {
        int alternatives = args.length > 0 ? Integer.parseInt(args[0]) : 4;
        int experts = args.length > 1 ? Integer.parseInt(args[1]) : 5;
        int criteria = args.length > 2 ? Integer.parseInt(args[2]) : 3;
        int runs = args.length > 3 ? Integer.parseInt(args[3]) : 100;
        long seed = args.length > 4 ? Long.parseLong(args[4]) : 42L;

        // judgments are noisy, accept them and let the trace flag them
        AnalysisConfig base = AnalysisConfig.load().toBuilder().consistencyPolicy(ConsistencyPolicy.WARN).build();
        logger.info("Sweeping thresholds: N = {}, experts = {}, criteria = {}, runs = {}, seed = {}", alternatives,
                experts, criteria, runs, seed);

        RuleUsageStat.outputHeader(System.out);
        for (int step = 0; step <= 10; step++) {
            double threshold = step / 10.0;
            GroupDecisionAnalyzer analyzer = new GroupDecisionAnalyzer(base.withConflictThreshold(threshold));
            // same seed per threshold so every threshold sees the same problems
            RandomCaseGenerator generator = new RandomCaseGenerator(seed, 0.4, 0.05);
            RuleUsageStat stat = new RuleUsageStat(threshold);
            for (int run = 0; run < runs; run++) {
                AnalysisInput input = generator.generate(alternatives, experts, criteria);
                stat.record(analyzer.analyze(input));
            }
            stat.outputSummaryStat(System.out);
        }
    }
}
