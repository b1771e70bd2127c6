package edu.cwru.evidencefusion.simulation;

import java.util.Random;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.ahp.PairwiseComparisonMatrix;
import edu.cwru.evidencefusion.analysis.AnalysisInput;
import edu.cwru.evidencefusion.mass.Frame;

/**
 * Seeded generator of synthetic group decision problems. Every criterion gets a
 * hidden "true" priority vector; each expert sees it through multiplicative
 * log-normal noise, and individual judgments may be further perturbed to make
 * the matrices mildly inconsistent.
 */
public class RandomCaseGenerator {

    private final Random random;
    private final double opinionNoise;
    private final double judgmentNoise;

    /**
     * @param seed
     * @param opinionNoise  spread of an expert's priorities around the hidden ones
     * @param judgmentNoise spread of each individual pairwise judgment
     */
    public RandomCaseGenerator(long seed, double opinionNoise, double judgmentNoise) {
        Preconditions.checkArgument(opinionNoise >= 0 && judgmentNoise >= 0, "noise must be >= 0");
        this.random = new Random(seed);
        this.opinionNoise = opinionNoise;
        this.judgmentNoise = judgmentNoise;
    }

    public static String alternativeName(int i) {
        return i < 26 ? String.valueOf((char) ('A' + i)) : "A" + (i + 1);
    }

    public AnalysisInput generate(int alternatives, int experts, int criteria) {
        Preconditions.checkArgument(alternatives >= 1 && alternatives <= Frame.MAX_ALTERNATIVES,
                "alternatives out of range: %s", alternatives);
        Preconditions.checkArgument(experts >= 1 && criteria >= 1, "need at least one expert and one criterion");
        String[] names = new String[alternatives];
        for (int i = 0; i < alternatives; i++)
            names[i] = alternativeName(i);

        AnalysisInput.Builder builder = AnalysisInput.builder().alternatives(names);
        for (int e = 0; e < experts; e++)
            builder.expert("E" + (e + 1), round(0.3 + 0.7 * random.nextDouble()));
        for (int c = 0; c < criteria; c++) {
            String criterion = "C" + (c + 1);
            builder.criterion(criterion, round(0.1 + 0.9 * random.nextDouble()));
            double[] truth = new double[alternatives];
            for (int i = 0; i < alternatives; i++)
                truth[i] = 1.0 + 8.0 * random.nextDouble();
            for (int e = 0; e < experts; e++) {
                double[] opinion = new double[alternatives];
                for (int i = 0; i < alternatives; i++)
                    opinion[i] = truth[i] * Math.exp(opinionNoise * random.nextGaussian());
                builder.matrix("E" + (e + 1), criterion, judgments(opinion));
            }
        }
        return builder.build();
    }

    /**
     * Reciprocal matrix from priorities, each upper entry perturbed and its
     * mirror set to the exact reciprocal.
     */
    PairwiseComparisonMatrix judgments(double[] priorities) {
        int n = priorities.length;
        double[][] values = new double[n][n];
        for (int i = 0; i < n; i++) {
            values[i][i] = 1.0;
            for (int j = i + 1; j < n; j++) {
                double v = priorities[i] / priorities[j] * Math.exp(judgmentNoise * random.nextGaussian());
                values[i][j] = v;
                values[j][i] = 1.0 / v;
            }
        }
        return PairwiseComparisonMatrix.of(values);
    }

    private static double round(double weight) {
        return Math.round(weight * 100) / 100.0;
    }
}
