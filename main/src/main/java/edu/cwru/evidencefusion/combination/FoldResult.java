package edu.cwru.evidencefusion.combination;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Outcome of folding a list of sources left to right.
 */
public final class FoldResult {

	private final MassFunction combined;
	private final ImmutableList<FoldStep> steps;

	public FoldResult(MassFunction combined, List<FoldStep> steps) {
		this.combined = combined;
		this.steps = ImmutableList.copyOf(steps);
	}

	public MassFunction getCombined() {
		return this.combined;
	}

	public ImmutableList<FoldStep> getSteps() {
		return this.steps;
	}

	public int countRule(RuleType rule) {
		int count = 0;
		for (FoldStep step : this.steps) {
			if (step.getRule() == rule)
				count++;
		}
		return count;
	}
}
