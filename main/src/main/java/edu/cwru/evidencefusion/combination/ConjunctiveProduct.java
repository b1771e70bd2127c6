package edu.cwru.evidencefusion.combination;

import java.util.Map;
import java.util.TreeMap;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Unnormalized conjunctive product of two assignments over the full cross
 * product of their focal elements. Shared by the Dempster and Yager rules.
 */
final class ConjunctiveProduct {

	private final TreeMap<Integer, Double> intersections = new TreeMap<>();
	private double conflict = 0.0;

	ConjunctiveProduct(MassFunction m1, MassFunction m2) {
		Preconditions.checkArgument(m1.getFrame().equals(m2.getFrame()), "assignments are over different frames");
		for (Map.Entry<Integer, Double> a : m1.asMap().entrySet()) {
			for (Map.Entry<Integer, Double> b : m2.asMap().entrySet()) {
				int intersection = a.getKey() & b.getKey();
				double product = a.getValue() * b.getValue();
				if (intersection == 0)
					this.conflict += product;
				else
					this.intersections.merge(intersection, product, Double::sum);
			}
		}
	}

	/**
	 * Masses of the non-empty intersections, not normalized.
	 */
	TreeMap<Integer, Double> intersections() {
		return new TreeMap<>(this.intersections);
	}

	double conflict() {
		return this.conflict;
	}

	/**
	 * Σ of the non-empty intersections, i.e. 1 - k computed without
	 * cancellation.
	 */
	double agreement() {
		double sum = 0.0;
		for (double mass : this.intersections.values())
			sum += mass;
		return sum;
	}
}
