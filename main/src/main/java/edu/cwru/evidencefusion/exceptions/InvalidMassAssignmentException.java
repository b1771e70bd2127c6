package edu.cwru.evidencefusion.exceptions;

/**
 * A mass assignment violates non-negativity or sum-to-one. Always fatal.
 */
public class InvalidMassAssignmentException extends EvidenceFusionException {

	private static final long serialVersionUID = 1L;

	public InvalidMassAssignmentException(String message) {
		super(message);
	}
}
