package edu.cwru.evidencefusion.analysis;

import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;

/**
 * An evaluation criterion. Weights need not sum to 1; they are scaled before
 * the criteria are combined.
 */
public final class Criterion {

	private final String id;
	private final double weight;

	public Criterion(String id, double weight) {
		Preconditions.checkArgument(StringUtils.isNotBlank(id), "criterion id must not be blank");
		Preconditions.checkArgument(weight >= 0 && Double.isFinite(weight), "criterion weight must be >= 0, got %s",
				weight);
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
		if (!(o instanceof Criterion))
			return false;
		Criterion that = (Criterion) o;
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
