package edu.cwru.evidencefusion.exceptions;

/**
 * Dempster's rule was forced on two sources whose focal elements never
 * intersect, so the normalization 1 / (1 - k) is undefined.
 */
public class TotalConflictException extends EvidenceFusionException {

	private static final long serialVersionUID = 1L;

	private final double conflict;

	public TotalConflictException(double conflict) {
		super("Total conflict (k = " + conflict + "): Dempster normalization is undefined");
		this.conflict = conflict;
	}

	public double getConflict() {
		return this.conflict;
	}
}
