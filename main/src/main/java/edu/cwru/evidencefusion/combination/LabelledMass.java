package edu.cwru.evidencefusion.combination;

import com.google.common.base.Preconditions;

import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * A source to be folded, tagged with the id reported in the fold trace.
 */
public final class LabelledMass {

	private final String label;
	private final MassFunction massFunction;

	public LabelledMass(String label, MassFunction massFunction) {
		this.label = Preconditions.checkNotNull(label, "label");
		this.massFunction = Preconditions.checkNotNull(massFunction, "massFunction");
	}

	public String getLabel() {
		return this.label;
	}

	public MassFunction getMassFunction() {
		return this.massFunction;
	}

	@Override
	public String toString() {
		return this.label + "=" + this.massFunction;
	}
}
