package edu.cwru.evidencefusion.bpa;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.commons.lang3.builder.ToStringStyle;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Evidence derived from one expert's matrix for one criterion, with the
 * intermediate AHP quantities kept for inspection.
 */
public final class BpaBuildResult {

	private final String expertId;
	private final String criterionId;
	private final double[] priorities;
	private final double lambdaMax;
	private final double consistencyRatio;
	private final boolean consistent;
	private final MassFunction massFunction;

	public BpaBuildResult(String expertId, String criterionId, double[] priorities, double lambdaMax,
			double consistencyRatio, boolean consistent, MassFunction massFunction) {
		this.expertId = expertId;
		this.criterionId = criterionId;
		this.priorities = priorities.clone();
		this.lambdaMax = lambdaMax;
		this.consistencyRatio = consistencyRatio;
		this.consistent = consistent;
		this.massFunction = massFunction;
	}

	public String getExpertId() {
		return this.expertId;
	}

	public String getCriterionId() {
		return this.criterionId;
	}

	public double[] getPriorities() {
		return this.priorities.clone();
	}

	public double getLambdaMax() {
		return this.lambdaMax;
	}

	public double getConsistencyRatio() {
		return this.consistencyRatio;
	}

	/**
	 * False when the consistency ratio exceeded the threshold and the matrix was
	 * accepted anyway under a warning policy.
	 */
	public boolean isConsistent() {
		return this.consistent;
	}

	public MassFunction getMassFunction() {
		return this.massFunction;
	}

	@Override
	public String toString() {
		return new ToStringBuilder(this, ToStringStyle.SHORT_PREFIX_STYLE).append("expert", this.expertId)
				.append("criterion", this.criterionId).append("cr", this.consistencyRatio)
				.append("consistent", this.consistent).append("bpa", this.massFunction).toString();
	}
}
