package edu.cwru.evidencefusion.exceptions;

/**
 * A pairwise comparison matrix is not square, not of frame dimension, not
 * positive, or not reciprocal.
 */
public class MalformedMatrixException extends EvidenceFusionException {

	private static final long serialVersionUID = 1L;

	private final String expertId;
	private final String criterionId;

	public MalformedMatrixException(String expertId, String criterionId, String reason) {
		super("Malformed comparison matrix (expert=" + expertId + ", criterion=" + criterionId + "): " + reason);
		this.expertId = expertId;
		this.criterionId = criterionId;
	}

	public String getExpertId() {
		return this.expertId;
	}

	public String getCriterionId() {
		return this.criterionId;
	}
}
