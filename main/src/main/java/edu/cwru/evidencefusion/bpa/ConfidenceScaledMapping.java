package edu.cwru.evidencefusion.bpa;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * m({a_i}) = c * w_i and m(Θ) = 1 - c, where c is the confidence the expert
 * places in the comparison as a whole.
 */
public final class ConfidenceScaledMapping implements MassMapping {

	public static final String NAME = "confidence";

	private final double confidence;

	public ConfidenceScaledMapping(double confidence) {
		Preconditions.checkArgument(confidence > 0 && confidence <= 1, "confidence must be in (0, 1], got %s",
				confidence);
		this.confidence = confidence;
	}

	@Override
	public MassFunction map(Frame frame, double[] priorities) {
		Preconditions.checkArgument(priorities.length == frame.size(), "expected %s priorities, got %s", frame.size(),
				priorities.length);
		MassFunction.Builder builder = MassFunction.builder(frame);
		for (int i = 0; i < priorities.length; i++)
			builder.add(1 << i, this.confidence * priorities[i]);
		builder.add(frame.fullMask(), 1.0 - this.confidence);
		return builder.build();
	}

	@Override
	public String name() {
		return NAME;
	}

	public double getConfidence() {
		return this.confidence;
	}

	@Override
	public String toString() {
		return NAME + "(" + this.confidence + ")";
	}
}
