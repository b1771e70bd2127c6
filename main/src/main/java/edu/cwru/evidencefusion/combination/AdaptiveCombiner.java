package edu.cwru.evidencefusion.combination;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Combines sources with Dempster's rule while they mostly agree and switches to
 * Yager's rule once their conflict reaches the threshold τ.
 *
 * Folding is strictly left to right and the rule is chosen again at every step
 * from the conflict between the running result and the next source. Because
 * the two rules do not associate with each other, the order of the input list
 * is part of the result.
 */
public class AdaptiveCombiner {

	private static final Logger logger = LoggerFactory.getLogger(AdaptiveCombiner.class);

	public static final double DEFAULT_THRESHOLD = 0.5;

	private final double threshold;
	private final RuleMode mode;

	public AdaptiveCombiner() {
		this(DEFAULT_THRESHOLD, RuleMode.ADAPTIVE);
	}

	public AdaptiveCombiner(double threshold, RuleMode mode) {
		Preconditions.checkArgument(threshold >= 0 && threshold <= 1, "conflict threshold must be in [0, 1], got %s",
				threshold);
		this.threshold = threshold;
		this.mode = Preconditions.checkNotNull(mode, "mode");
	}

	public double getThreshold() {
		return this.threshold;
	}

	public RuleMode getMode() {
		return this.mode;
	}

	/**
	 * Rule for a measured conflict. In adaptive mode total conflict always goes
	 * to Yager, whatever the threshold.
	 */
	public RuleType selectRule(double conflict) {
		switch (this.mode) {
		case DEMPSTER:
			return RuleType.DEMPSTER;
		case YAGER:
			return RuleType.YAGER;
		default:
			return conflict < this.threshold && !ConflictMeasure.isTotal(conflict) ? RuleType.DEMPSTER
					: RuleType.YAGER;
		}
	}

	public static CombinationRule rule(RuleType type) {
		return type == RuleType.DEMPSTER ? DempsterRule.INSTANCE : YagerRule.INSTANCE;
	}

	/**
	 * Combine two sources with the rule selected for their conflict. Throws
	 * TotalConflictException only in forced Dempster mode.
	 */
	public MassFunction combine(MassFunction m1, MassFunction m2) {
		return step(1, "", m1, m2).getResult();
	}

	FoldStep step(int index, String label, MassFunction running, MassFunction next) {
		double conflict = ConflictMeasure.conflict(running, next);
		RuleType type = selectRule(conflict);
		MassFunction result = rule(type).combine(running, next);
		logger.debug("fold step {} (+{}): k = {} -> {} : {}", index, label, String.format("%.6f", conflict), type,
				result);
		return new FoldStep(index, label, conflict, type, result);
	}

	/**
	 * Fold the sources left to right. A single source is returned unchanged with
	 * no steps.
	 *
	 * @param sources non-empty list, in fold order
	 * @return combined assignment and one step per absorbed source
	 */
	public FoldResult fold(List<LabelledMass> sources) {
		Preconditions.checkArgument(!sources.isEmpty(), "nothing to combine");
		MassFunction running = sources.get(0).getMassFunction();
		List<FoldStep> steps = new ArrayList<>();
		for (int i = 1; i < sources.size(); i++) {
			LabelledMass next = sources.get(i);
			FoldStep step = step(i, next.getLabel(), running, next.getMassFunction());
			steps.add(step);
			running = step.getResult();
		}
		return new FoldResult(running, steps);
	}
}
