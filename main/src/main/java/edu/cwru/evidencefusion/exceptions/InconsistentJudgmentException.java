package edu.cwru.evidencefusion.exceptions;

/**
 * The consistency ratio of a comparison matrix exceeds the accepted threshold.
 * Callers may re-ask the expert, drop the expert, or rerun with a warning
 * policy.
 */
public class InconsistentJudgmentException extends EvidenceFusionException {

	private static final long serialVersionUID = 1L;

	private final String expertId;
	private final String criterionId;
	private final double consistencyRatio;
	private final double threshold;

	public InconsistentJudgmentException(String expertId, String criterionId, double consistencyRatio,
			double threshold) {
		super(String.format("Inconsistent judgments (expert=%s, criterion=%s): CR = %.4f exceeds %.4f", expertId,
				criterionId, consistencyRatio, threshold));
		this.expertId = expertId;
		this.criterionId = criterionId;
		this.consistencyRatio = consistencyRatio;
		this.threshold = threshold;
	}

	public String getExpertId() {
		return this.expertId;
	}

	public String getCriterionId() {
		return this.criterionId;
	}

	public double getConsistencyRatio() {
		return this.consistencyRatio;
	}

	public double getThreshold() {
		return this.threshold;
	}
}
