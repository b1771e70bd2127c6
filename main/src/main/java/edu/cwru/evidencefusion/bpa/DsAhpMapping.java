package edu.cwru.evidencefusion.bpa;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Beynon's DS/AHP allocation. With d focal groups of alternatives, group
 * preference a_j and scale p:
 *
 * <pre>
 * m(s_j) = a_j * p / (Σ a_k * p + √d)
 * m(Θ)   = √d / (Σ a_k * p + √d)
 * </pre>
 *
 * With a grouping tolerance of 0 every alternative with positive priority is
 * its own group. Otherwise alternatives whose priorities lie within the
 * tolerance of the highest priority of their group are merged into one focal
 * element, and the group preference is the mean of their priorities.
 *
 * The more groups are discriminated, the more mass is left on Θ.
 */
public final class DsAhpMapping implements MassMapping {

	public static final String NAME = "ds-ahp";

	private final double scale;
	private final double groupingTolerance;

	public DsAhpMapping(double scale) {
		this(scale, 0.0);
	}

	public DsAhpMapping(double scale, double groupingTolerance) {
		Preconditions.checkArgument(scale > 0 && Double.isFinite(scale), "scale must be positive, got %s", scale);
		Preconditions.checkArgument(groupingTolerance >= 0 && groupingTolerance < 1,
				"grouping tolerance must be in [0, 1), got %s", groupingTolerance);
		this.scale = scale;
		this.groupingTolerance = groupingTolerance;
	}

	@Override
	public MassFunction map(Frame frame, double[] priorities) {
		Preconditions.checkArgument(priorities.length == frame.size(), "expected %s priorities, got %s", frame.size(),
				priorities.length);
		List<int[]> groups = groups(priorities);
		if (groups.isEmpty())
			return MassFunction.vacuous(frame);
		int d = groups.size();
		double[] preferences = new double[d];
		double weighted = 0.0;
		for (int g = 0; g < d; g++) {
			double sum = 0.0;
			for (int i : groups.get(g))
				sum += priorities[i];
			preferences[g] = sum / groups.get(g).length;
			weighted += preferences[g] * this.scale;
		}
		double denominator = weighted + Math.sqrt(d);
		MassFunction.Builder builder = MassFunction.builder(frame);
		for (int g = 0; g < d; g++) {
			int mask = 0;
			for (int i : groups.get(g))
				mask |= 1 << i;
			builder.add(mask, preferences[g] * this.scale / denominator);
		}
		builder.add(frame.fullMask(), Math.sqrt(d) / denominator);
		return builder.build();
	}

	/**
	 * Indices of the positive priorities, partitioned into groups by descending
	 * priority.
	 */
	private List<int[]> groups(double[] priorities) {
		List<Integer> order = IntStream.range(0, priorities.length).filter(i -> priorities[i] > 0).boxed()
				.sorted(Comparator.comparingDouble((Integer i) -> priorities[i]).reversed())
				.collect(Collectors.toList());
		List<int[]> ret = new ArrayList<>();
		List<Integer> current = new ArrayList<>();
		double head = 0.0;
		for (int i : order) {
			boolean split = this.groupingTolerance == 0 || head - priorities[i] > this.groupingTolerance;
			if (!current.isEmpty() && split) {
				ret.add(current.stream().mapToInt(Integer::intValue).toArray());
				current.clear();
			}
			if (current.isEmpty())
				head = priorities[i];
			current.add(i);
		}
		if (!current.isEmpty())
			ret.add(current.stream().mapToInt(Integer::intValue).toArray());
		return ret;
	}

	@Override
	public String name() {
		return NAME;
	}

	public double getScale() {
		return this.scale;
	}

	public double getGroupingTolerance() {
		return this.groupingTolerance;
	}

	@Override
	public String toString() {
		return NAME + "(" + this.scale + (this.groupingTolerance > 0 ? ", " + this.groupingTolerance : "") + ")";
	}
}
