package edu.cwru.evidencefusion.belief;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Belief and plausibility of every singleton alternative, and the ranking they
 * induce.
 */
public class BeliefPlausibilityCalculator {

	/**
	 * Scores are compared on this grid so round-off from different fold orders
	 * cannot separate alternatives that are equal in exact arithmetic.
	 */
	private static final double COMPARISON_GRID = 1e9;

	private final RankingScalarization scalarization;

	public BeliefPlausibilityCalculator() {
		this(RankingScalarization.midpoint());
	}

	public BeliefPlausibilityCalculator(RankingScalarization scalarization) {
		this.scalarization = Preconditions.checkNotNull(scalarization, "scalarization");
	}

	/**
	 * Intervals in frame order.
	 */
	public List<BeliefInterval> intervals(MassFunction m) {
		Preconditions.checkArgument(m.isNormalized(), "intervals need a normalized assignment");
		Frame frame = m.getFrame();
		List<BeliefInterval> ret = new ArrayList<>(frame.size());
		for (int i = 0; i < frame.size(); i++) {
			int singleton = 1 << i;
			ret.add(new BeliefInterval(frame.alternative(i), m.belief(singleton), m.plausibility(singleton)));
		}
		return ImmutableList.copyOf(ret);
	}

	/**
	 * Alternatives by score descending, then belief descending, then identifier.
	 */
	public List<RankedAlternative> rank(MassFunction m) {
		List<BeliefInterval> sorted = new ArrayList<>(intervals(m));
		sorted.sort(Comparator
				.comparingLong((BeliefInterval interval) -> onGrid(this.scalarization.score(interval))).reversed()
				.thenComparing(Comparator.comparingLong((BeliefInterval interval) -> onGrid(interval.getBelief()))
						.reversed())
				.thenComparing(BeliefInterval::getAlternative));
		List<RankedAlternative> ret = new ArrayList<>(sorted.size());
		for (int i = 0; i < sorted.size(); i++) {
			BeliefInterval interval = sorted.get(i);
			ret.add(new RankedAlternative(i + 1, interval, this.scalarization.score(interval)));
		}
		return ImmutableList.copyOf(ret);
	}

	public RankingScalarization getScalarization() {
		return this.scalarization;
	}

	private static long onGrid(double value) {
		return Math.round(value * COMPARISON_GRID);
	}
}
