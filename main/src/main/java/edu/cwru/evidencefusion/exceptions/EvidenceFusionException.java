package edu.cwru.evidencefusion.exceptions;

/**
 * Base type of every failure raised by the fusion engine.
 */
public class EvidenceFusionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public EvidenceFusionException(String message) {
		super(message);
	}

	public EvidenceFusionException(String message, Throwable cause) {
		super(message, cause);
	}
}
