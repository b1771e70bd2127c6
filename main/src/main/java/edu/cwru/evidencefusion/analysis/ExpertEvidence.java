package edu.cwru.evidencefusion.analysis;

import java.util.Optional;

import edu.cwru.evidencefusion.bpa.BpaBuildResult;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * One expert's evidence on one criterion, before and after discounting.
 */
public final class ExpertEvidence {

	private final String expertId;
	private final String criterionId;
	private final BpaBuildResult build;
	private final MassFunction raw;
	private final double discountFactor;
	private final MassFunction discounted;

	ExpertEvidence(String expertId, String criterionId, BpaBuildResult build, MassFunction raw, double discountFactor,
			MassFunction discounted) {
		this.expertId = expertId;
		this.criterionId = criterionId;
		this.build = build;
		this.raw = raw;
		this.discountFactor = discountFactor;
		this.discounted = discounted;
	}

	public String getExpertId() {
		return this.expertId;
	}

	public String getCriterionId() {
		return this.criterionId;
	}

	/**
	 * Priorities and consistency of the matrix; empty when the expert gave no
	 * matrix for this criterion and was treated as totally ignorant.
	 */
	public Optional<BpaBuildResult> getBuild() {
		return Optional.ofNullable(this.build);
	}

	public boolean isMissing() {
		return this.build == null;
	}

	/**
	 * False for a matrix accepted despite exceeding the consistency threshold.
	 */
	public boolean isConsistent() {
		return this.build == null || this.build.isConsistent();
	}

	public MassFunction getRaw() {
		return this.raw;
	}

	public double getDiscountFactor() {
		return this.discountFactor;
	}

	public MassFunction getDiscounted() {
		return this.discounted;
	}
}
