package edu.cwru.evidencefusion.mass;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.math.DoubleMath;

import edu.cwru.evidencefusion.exceptions.InvalidMassAssignmentException;
import edu.cwru.evidencefusion.utilities.Utility;

/**
 * Basic probability assignment over the subsets of a {@link Frame}.
 *
 * Only focal elements (subsets with non-zero mass) are stored, keyed by their
 * bitmask, so the powerset of the frame is never materialized. Instances are
 * immutable; every combination produces a new instance.
 *
 * A normalized assignment gives no mass to the empty set. An unnormalized
 * assignment is the raw conjunctive product of two sources and may hold the
 * conflicting mass on the empty set (mask 0).
 */
public final class MassFunction {

	public static final double DEFAULT_TOLERANCE = 1e-9;

	private final Frame frame;
	private final ImmutableSortedMap<Integer, Double> masses;
	private final boolean normalized;

	private MassFunction(Frame frame, Map<Integer, Double> masses, boolean normalized) {
		this.frame = frame;
		this.normalized = normalized;
		this.masses = validate(frame, masses, normalized);
	}

	/**
	 * Normalized assignment. Fails when masses are negative, do not sum to one,
	 * or touch the empty set. Masses within tolerance of one are rescaled to sum
	 * to one.
	 *
	 * @param frame
	 * @param masses focal element mask to mass
	 * @return validated assignment
	 */
	public static MassFunction of(Frame frame, Map<Integer, Double> masses) {
		return new MassFunction(frame, masses, true);
	}

	/**
	 * Assignment that may put mass on the empty set. Total mass must still be
	 * one.
	 */
	public static MassFunction unnormalized(Frame frame, Map<Integer, Double> masses) {
		return new MassFunction(frame, masses, false);
	}

	/**
	 * Total ignorance: m(Θ) = 1.
	 */
	public static MassFunction vacuous(Frame frame) {
		return of(frame, Map.of(frame.fullMask(), 1.0));
	}

	/**
	 * All mass on a single subset.
	 */
	public static MassFunction categorical(Frame frame, int subset) {
		return of(frame, Map.of(subset, 1.0));
	}

	public static Builder builder(Frame frame) {
		return new Builder(frame);
	}

	private static ImmutableSortedMap<Integer, Double> validate(Frame frame, Map<Integer, Double> masses,
			boolean normalized) {
		Preconditions.checkNotNull(frame, "frame");
		Preconditions.checkNotNull(masses, "masses");
		TreeMap<Integer, Double> kept = new TreeMap<>();
		double total = 0.0;
		for (Map.Entry<Integer, Double> e : masses.entrySet()) {
			int mask = e.getKey();
			double mass = e.getValue();
			if (!frame.isSubsetOfFrame(mask))
				throw new InvalidMassAssignmentException("focal element " + mask + " is outside " + frame);
			if (!Double.isFinite(mass) || mass < -DEFAULT_TOLERANCE || mass > 1.0 + DEFAULT_TOLERANCE)
				throw new InvalidMassAssignmentException(
						"mass " + mass + " of " + frame.format(mask) + " is outside [0, 1]");
			if (mass <= 0.0)
				continue;
			if (mask == 0 && normalized && mass > DEFAULT_TOLERANCE)
				throw new InvalidMassAssignmentException("normalized assignment has mass " + mass + " on ∅");
			if (mask == 0 && normalized)
				continue;
			kept.put(mask, mass);
			total += mass;
		}
		if (!DoubleMath.fuzzyEquals(total, 1.0, DEFAULT_TOLERANCE))
			throw new InvalidMassAssignmentException("masses sum to " + total + ", expected 1");
		// stored masses sum to 1 up to rounding, so products of accepted
		// assignments stay within tolerance
		if (total != 1.0) {
			for (Map.Entry<Integer, Double> e : kept.entrySet())
				e.setValue(e.getValue() / total);
		}
		return ImmutableSortedMap.copyOf(kept);
	}

	public Frame getFrame() {
		return this.frame;
	}

	public boolean isNormalized() {
		return this.normalized;
	}

	/**
	 * Mass of exactly this subset, 0 if it is not focal.
	 */
	public double mass(int subset) {
		return this.masses.getOrDefault(subset, 0.0);
	}

	/**
	 * Mass held by the empty set, i.e. the unresolved conflict of an
	 * unnormalized product. Always 0 for normalized assignments.
	 */
	public double emptySetMass() {
		return mass(0);
	}

	public ImmutableSortedSet<Integer> focalElements() {
		return this.masses.keySet();
	}

	public ImmutableSortedMap<Integer, Double> asMap() {
		return this.masses;
	}

	public int focalCount() {
		return this.masses.size();
	}

	public double total() {
		double total = 0.0;
		for (double mass : this.masses.values())
			total += mass;
		return total;
	}

	/**
	 * Bel(B): sum of the masses of the non-empty focal elements contained in B.
	 */
	public double belief(int subset) {
		double bel = 0.0;
		for (Map.Entry<Integer, Double> e : this.masses.entrySet()) {
			int focal = e.getKey();
			if (focal != 0 && Utility.isSubset(focal, subset))
				bel += e.getValue();
		}
		return bel;
	}

	/**
	 * Pl(B): sum of the masses of the focal elements intersecting B.
	 */
	public double plausibility(int subset) {
		double pl = 0.0;
		for (Map.Entry<Integer, Double> e : this.masses.entrySet()) {
			if (Utility.intersects(e.getKey(), subset))
				pl += e.getValue();
		}
		return pl;
	}

	/**
	 * Same frame and every subset's mass within tolerance.
	 */
	public boolean fuzzyEquals(MassFunction other, double tolerance) {
		if (!this.frame.equals(other.frame))
			return false;
		for (int focal : ImmutableSortedSet.<Integer>naturalOrder().addAll(focalElements())
				.addAll(other.focalElements()).build()) {
			if (!DoubleMath.fuzzyEquals(mass(focal), other.mass(focal), tolerance))
				return false;
		}
		return true;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof MassFunction))
			return false;
		MassFunction that = (MassFunction) o;
		return this.normalized == that.normalized && this.frame.equals(that.frame)
				&& this.masses.equals(that.masses);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.frame, this.masses, this.normalized);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("m[");
		boolean first = true;
		for (Map.Entry<Integer, Double> e : this.masses.entrySet()) {
			if (!first)
				sb.append(", ");
			sb.append(this.frame.format(e.getKey())).append('=').append(String.format("%.6f", e.getValue()));
			first = false;
		}
		return sb.append(']').toString();
	}

	/**
	 * Accumulates masses per subset; repeated subsets are summed.
	 */
	public static final class Builder {
		private final Frame frame;
		private final TreeMap<Integer, Double> masses = new TreeMap<>();

		private Builder(Frame frame) {
			this.frame = Preconditions.checkNotNull(frame, "frame");
		}

		public Builder add(int subset, double mass) {
			this.masses.merge(subset, mass, Double::sum);
			return this;
		}

		public Builder add(double mass, String... members) {
			return add(this.frame.maskOf(members), mass);
		}

		public MassFunction build() {
			return MassFunction.of(this.frame, this.masses);
		}

		public MassFunction buildUnnormalized() {
			return MassFunction.unnormalized(this.frame, this.masses);
		}
	}
}
