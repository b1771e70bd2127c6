package edu.cwru.evidencefusion.ahp;

import java.util.Arrays;

import edu.cwru.evidencefusion.utilities.Utility;

/**
 * Derivation of the priority vector of a pairwise comparison matrix. Both
 * methods return positive weights summing to 1 and agree exactly on
 * consistent matrices.
 */
public enum PriorityMethod {

	/**
	 * Principal right eigenvector, found by power iteration.
	 */
	EIGENVECTOR {
		@Override
		public double[] priorities(PairwiseComparisonMatrix matrix) {
			int n = matrix.size();
			double[] w = new double[n];
			Arrays.fill(w, 1.0 / n);
			for (int iteration = 0; iteration < MAX_ITERATIONS; iteration++) {
				double[] next = new double[n];
				double sum = 0.0;
				for (int i = 0; i < n; i++) {
					for (int j = 0; j < n; j++)
						next[i] += matrix.get(i, j) * w[j];
					sum += next[i];
				}
				double delta = 0.0;
				for (int i = 0; i < n; i++) {
					next[i] /= sum;
					delta = Math.max(delta, Math.abs(next[i] - w[i]));
				}
				w = next;
				if (delta < CONVERGENCE)
					break;
			}
			return w;
		}
	},

	/**
	 * Row geometric means, normalized to sum 1.
	 */
	GEOMETRIC_MEAN {
		@Override
		public double[] priorities(PairwiseComparisonMatrix matrix) {
			int n = matrix.size();
			double[] w = new double[n];
			for (int i = 0; i < n; i++)
				w[i] = Utility.geometricMean(matrix.row(i));
			return Utility.normalizeBySum(w);
		}
	};

	private static final int MAX_ITERATIONS = 1000;
	private static final double CONVERGENCE = 1e-13;

	/**
	 * @param matrix a well formed (square, positive, reciprocal) matrix
	 * @return priority weights, one per row, summing to 1
	 */
	public abstract double[] priorities(PairwiseComparisonMatrix matrix);
}
