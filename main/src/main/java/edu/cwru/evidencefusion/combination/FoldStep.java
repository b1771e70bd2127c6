package edu.cwru.evidencefusion.combination;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * One pairwise combination of a fold: the running result absorbed the source
 * {@link #getSourceLabel()}, the conflict between the two was
 * {@link #getConflict()} and {@link #getRule()} was applied.
 */
public final class FoldStep {

	private final int index;
	private final String sourceLabel;
	private final double conflict;
	private final RuleType rule;
	private final MassFunction result;

	public FoldStep(int index, String sourceLabel, double conflict, RuleType rule, MassFunction result) {
		this.index = index;
		this.sourceLabel = sourceLabel;
		this.conflict = conflict;
		this.rule = rule;
		this.result = result;
	}

	/**
	 * 1-based position in the fold.
	 */
	public int getIndex() {
		return this.index;
	}

	public String getSourceLabel() {
		return this.sourceLabel;
	}

	public double getConflict() {
		return this.conflict;
	}

	public RuleType getRule() {
		return this.rule;
	}

	public MassFunction getResult() {
		return this.result;
	}

	@Override
	public String toString() {
		return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE).append("index", this.index)
				.append("source", this.sourceLabel).append("k", this.conflict).append("rule", this.rule)
				.append("result", this.result).toString();
	}
}
