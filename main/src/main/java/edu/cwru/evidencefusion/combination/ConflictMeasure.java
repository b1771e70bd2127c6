package edu.cwru.evidencefusion.combination;

import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.MassFunction;
import edu.cwru.evidencefusion.utilities.Utility;

/**
 * Conflict between sources: the mass the conjunctive product of two
 * assignments places on pairs of disjoint focal elements.
 */
public final class ConflictMeasure {

	/**
	 * k at or above 1 - TOTAL_CONFLICT_TOLERANCE is treated as total conflict.
	 */
	public static final double TOTAL_CONFLICT_TOLERANCE = 1e-12;

	private ConflictMeasure() {
	}

	/**
	 * k = Σ m1(A) m2(B) over all focal pairs with A ∩ B = ∅, clamped to [0, 1].
	 */
	public static double conflict(MassFunction m1, MassFunction m2) {
		Preconditions.checkArgument(m1.getFrame().equals(m2.getFrame()), "assignments are over different frames");
		double k = 0.0;
		for (Map.Entry<Integer, Double> a : m1.asMap().entrySet()) {
			for (Map.Entry<Integer, Double> b : m2.asMap().entrySet()) {
				if (!Utility.intersects(a.getKey(), b.getKey()))
					k += a.getValue() * b.getValue();
			}
		}
		return Math.min(1.0, Math.max(0.0, k));
	}

	public static boolean isTotal(double conflict) {
		return conflict >= 1.0 - TOTAL_CONFLICT_TOLERANCE;
	}

	/**
	 * Mean conflict over all unordered pairs of a group of sources; 0 when there
	 * are fewer than two.
	 */
	public static double meanPairwiseConflict(List<MassFunction> group) {
		int n = group.size();
		if (n < 2)
			return 0.0;
		double sum = 0.0;
		for (int i = 0; i < n; i++) {
			for (int j = i + 1; j < n; j++)
				sum += conflict(group.get(i), group.get(j));
		}
		return sum / (n * (n - 1) / 2.0);
	}
}
