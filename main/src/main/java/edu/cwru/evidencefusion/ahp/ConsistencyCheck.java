package edu.cwru.evidencefusion.ahp;

import com.google.common.base.Preconditions;

/**
 * Saaty's consistency ratio of a comparison matrix against its priority
 * vector: CR = CI / RI with CI = (λmax - n) / (n - 1).
 */
public final class ConsistencyCheck {

	/**
	 * Saaty's random consistency index for n = 1..15. Larger matrices reuse the
	 * last value.
	 */
	private static final double[] RANDOM_INDEX = { 0.0, 0.0, 0.58, 0.90, 1.12, 1.24, 1.32, 1.41, 1.45, 1.49, 1.51,
			1.48, 1.56, 1.57, 1.59 };

	private final double lambdaMax;
	private final double consistencyIndex;
	private final double consistencyRatio;

	private ConsistencyCheck(double lambdaMax, double consistencyIndex, double consistencyRatio) {
		this.lambdaMax = lambdaMax;
		this.consistencyIndex = consistencyIndex;
		this.consistencyRatio = consistencyRatio;
	}

	public static ConsistencyCheck evaluate(PairwiseComparisonMatrix matrix, double[] priorities) {
		int n = matrix.size();
		Preconditions.checkArgument(priorities.length == n, "priority vector has %s entries for a %sx%s matrix",
				priorities.length, n, n);
		double lambdaMax = lambdaMax(matrix, priorities);
		if (n <= 2)
			return new ConsistencyCheck(lambdaMax, 0.0, 0.0);
		// round-off can push λmax a hair below n on consistent matrices
		double ci = Math.max(0.0, (lambdaMax - n) / (n - 1));
		return new ConsistencyCheck(lambdaMax, ci, ci / randomIndex(n));
	}

	/**
	 * Estimate of the principal eigenvalue: mean over rows of (A·w)_i / w_i.
	 */
	public static double lambdaMax(PairwiseComparisonMatrix matrix, double[] w) {
		int n = matrix.size();
		double sum = 0.0;
		for (int i = 0; i < n; i++) {
			double aw = 0.0;
			for (int j = 0; j < n; j++)
				aw += matrix.get(i, j) * w[j];
			sum += aw / w[i];
		}
		return sum / n;
	}

	public static double randomIndex(int n) {
		Preconditions.checkArgument(n >= 1, "matrix size must be positive");
		return RANDOM_INDEX[Math.min(n, RANDOM_INDEX.length) - 1];
	}

	public double getLambdaMax() {
		return this.lambdaMax;
	}

	public double getConsistencyIndex() {
		return this.consistencyIndex;
	}

	public double getConsistencyRatio() {
		return this.consistencyRatio;
	}

	public boolean isAcceptable(double threshold) {
		return this.consistencyRatio <= threshold;
	}
}
