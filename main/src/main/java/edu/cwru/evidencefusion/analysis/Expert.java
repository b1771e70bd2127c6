package edu.cwru.evidencefusion.analysis;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

/**
 * A decision maker and the importance of their judgments.
 */
public final class Expert {

	private final String id;
	private final double weight;

	public Expert(String id, double weight) {
		Preconditions.checkArgument(StringUtils.isNotBlank(id), "expert id must not be blank");
		Preconditions.checkArgument(weight >= 0 && weight <= 1, "expert weight must be in [0, 1], got %s", weight);
		this.id = id;
		this.weight = weight;
	}

	public String getId() {
		return this.id;
	}

	public double getWeight() {
		return this.weight;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Expert))
			return false;
		Expert that = (Expert) o;
		return this.id.equals(that.id) && Double.compare(this.weight, that.weight) == 0;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.id, this.weight);
	}

	@Override
	public String toString() {
		return this.id + "(" + this.weight + ")";
	}
}
