package edu.cwru.evidencefusion.ahp;

import java.util.Arrays;
import java.util.Optional;

import com.google.common.base.Preconditions;

/**
 * One expert's relative preference ratios among the alternatives for one
 * criterion. Entry (i, j) states how strongly alternative i is preferred over
 * alternative j.
 *
 * The values are copied on construction and never exposed mutably. Structural
 * checks are made by {@link #findDefect(int, double)} so the caller can attach
 * its own context to the failure.
 */
public final class PairwiseComparisonMatrix {

	private final double[][] values;

	private PairwiseComparisonMatrix(double[][] values) {
		this.values = new double[values.length][];
		for (int i = 0; i < values.length; i++) {
			Preconditions.checkNotNull(values[i], "row %s is null", i);
			this.values[i] = values[i].clone();
		}
	}

	public static PairwiseComparisonMatrix of(double[][] values) {
		Preconditions.checkNotNull(values, "values");
		return new PairwiseComparisonMatrix(values);
	}

	/**
	 * Build a consistent matrix from a priority vector: entry (i, j) = w_i / w_j.
	 */
	public static PairwiseComparisonMatrix fromPriorities(double[] priorities) {
		int n = priorities.length;
		double[][] values = new double[n][n];
		for (int i = 0; i < n; i++) {
			Preconditions.checkArgument(priorities[i] > 0, "priorities must be positive");
			for (int j = 0; j < n; j++)
				values[i][j] = priorities[i] / priorities[j];
		}
		return new PairwiseComparisonMatrix(values);
	}

	public int size() {
		return this.values.length;
	}

	public double get(int i, int j) {
		return this.values[i][j];
	}

	public double[] row(int i) {
		return this.values[i].clone();
	}

	/**
	 * First structural defect of the matrix, if any: not square, wrong dimension,
	 * non-positive or non-finite entry, diagonal other than 1, or
	 * m[i][j] * m[j][i] farther than {@code tolerance} from 1.
	 *
	 * @param expectedSize      size of the frame
	 * @param tolerance         relative reciprocity tolerance
	 * @return description of the defect, empty when the matrix is well formed
	 */
	public Optional<String> findDefect(int expectedSize, double tolerance) {
		int n = this.values.length;
		if (n != expectedSize)
			return Optional.of("expected " + expectedSize + " rows, got " + n);
		for (int i = 0; i < n; i++) {
			if (this.values[i].length != n)
				return Optional.of("row " + i + " has " + this.values[i].length + " entries, expected " + n);
		}
		for (int i = 0; i < n; i++) {
			for (int j = 0; j < n; j++) {
				double v = this.values[i][j];
				if (!Double.isFinite(v) || v <= 0)
					return Optional.of("entry (" + i + "," + j + ") = " + v + " is not a positive number");
			}
		}
		for (int i = 0; i < n; i++) {
			if (Math.abs(this.values[i][i] - 1.0) > tolerance)
				return Optional.of("diagonal entry (" + i + "," + i + ") = " + this.values[i][i] + " is not 1");
		}
		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++) {
				double product = this.values[i][j] * this.values[j][i];
				if (Math.abs(product - 1.0) > tolerance)
					return Optional.of("entries (" + i + "," + j + ") and (" + j + "," + i
							+ ") are not reciprocal, product = " + product);
			}
		}
		return Optional.empty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof PairwiseComparisonMatrix))
			return false;
		return Arrays.deepEquals(this.values, ((PairwiseComparisonMatrix) o).values);
	}

	@Override
	public int hashCode() {
		return Arrays.deepHashCode(this.values);
	}

	@Override
	public String toString() {
		return Arrays.deepToString(this.values);
	}
}
