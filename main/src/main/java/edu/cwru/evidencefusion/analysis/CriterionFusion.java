package edu.cwru.evidencefusion.analysis;

import java.util.List;

import com.google.common.collect.ImmutableList;

import edu.cwru.evidencefusion.combination.FoldResult;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Per-criterion stage of the analysis: the experts' evidence, how it was
 * folded, and the criterion assignment entering the cross-criteria fold.
 */
public final class CriterionFusion {

	private final String criterionId;
	private final ImmutableList<ExpertEvidence> evidence;
	private final double meanPairwiseConflict;
	private final FoldResult expertFold;
	private final double discountFactor;
	private final MassFunction discounted;

	CriterionFusion(String criterionId, List<ExpertEvidence> evidence, double meanPairwiseConflict,
			FoldResult expertFold, double discountFactor, MassFunction discounted) {
		this.criterionId = criterionId;
		this.evidence = ImmutableList.copyOf(evidence);
		this.meanPairwiseConflict = meanPairwiseConflict;
		this.expertFold = expertFold;
		this.discountFactor = discountFactor;
		this.discounted = discounted;
	}

	public String getCriterionId() {
		return this.criterionId;
	}

	/**
	 * In expert fold order.
	 */
	public ImmutableList<ExpertEvidence> getEvidence() {
		return this.evidence;
	}

	/**
	 * Mean conflict over all pairs of discounted expert assignments, independent
	 * of fold order.
	 */
	public double getMeanPairwiseConflict() {
		return this.meanPairwiseConflict;
	}

	public FoldResult getExpertFold() {
		return this.expertFold;
	}

	/**
	 * Group assignment of the experts for this criterion.
	 */
	public MassFunction getCombined() {
		return this.expertFold.getCombined();
	}

	public double getDiscountFactor() {
		return this.discountFactor;
	}

	/**
	 * {@link #getCombined()} discounted by the criterion's scaled weight.
	 */
	public MassFunction getDiscounted() {
		return this.discounted;
	}
}
