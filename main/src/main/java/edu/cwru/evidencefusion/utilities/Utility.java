package edu.cwru.evidencefusion.utilities;

import java.util.Arrays;

import com.google.common.base.Preconditions;

/**
 * Utility functions for subset bitmasks and weight vectors.
 * 
 * @author Ben
 *
 */
public final class Utility {

	private Utility() {
	}

	/**
	 * Indices of the set bits of a subset mask, in ascending order.
	 * 
	 * @param mask
	 * @return indices of the members of the subset
	 */
	public static int[] bitIndices(int mask) {
		int[] ret = new int[Integer.bitCount(mask)];
		int counter = 0;
		for (int i = 0; i < Integer.SIZE; i++) {
			if ((mask & (1 << i)) != 0)
				ret[counter++] = i;
		}
		return ret;
	}

	/**
	 * Build a subset mask from member indices.
	 * 
	 * @param indices
	 * @return mask with bit i set for every index i
	 */
	public static int maskOf(int... indices) {
		int mask = 0;
		for (int i : indices) {
			Preconditions.checkArgument(i >= 0 && i < Integer.SIZE - 1, "index out of range: %s", i);
			mask |= (1 << i);
		}
		return mask;
	}

	public static boolean isSubset(int subset, int superset) {
		return (subset & ~superset) == 0;
	}

	public static boolean intersects(int a, int b) {
		return (a & b) != 0;
	}

	/**
	 * Divide every weight by the total. All weights must be non-negative and at
	 * least one positive.
	 * 
	 * @param weights
	 * @return weights summing to 1
	 */
	public static double[] normalizeBySum(double[] weights) {
		checkWeights(weights);
		double sum = Arrays.stream(weights).sum();
		return Arrays.stream(weights).map(w -> w / sum).toArray();
	}

	/**
	 * Divide every weight by the largest one, so the most important source
	 * keeps a factor of exactly 1.
	 * 
	 * @param weights
	 * @return weights with maximum 1
	 */
	public static double[] normalizeByMax(double[] weights) {
		checkWeights(weights);
		double max = Arrays.stream(weights).max().getAsDouble();
		return Arrays.stream(weights).map(w -> w / max).toArray();
	}

	/**
	 * Geometric mean computed in log space to avoid overflow on long rows.
	 */
	public static double geometricMean(double[] values) {
		Preconditions.checkArgument(values.length > 0, "empty values");
		double logSum = 0.0;
		for (double v : values) {
			Preconditions.checkArgument(v > 0, "geometric mean needs positive values, got %s", v);
			logSum += Math.log(v);
		}
		return Math.exp(logSum / values.length);
	}

	private static void checkWeights(double[] weights) {
		Preconditions.checkArgument(weights.length > 0, "no weights");
		boolean positive = false;
		for (double w : weights) {
			Preconditions.checkArgument(w >= 0 && Double.isFinite(w), "weight must be finite and >= 0, got %s", w);
			positive |= w > 0;
		}
		Preconditions.checkArgument(positive, "at least one weight must be positive");
	}
}
