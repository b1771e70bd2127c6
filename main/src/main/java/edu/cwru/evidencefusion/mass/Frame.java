package edu.cwru.evidencefusion.mass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

import org.apache.commons.lang3.StringUtils;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import edu.cwru.evidencefusion.utilities.Utility;

/**
 * The frame of discernment: a fixed, ordered, non-empty set of alternatives.
 * Subsets of the frame are encoded as int bitmasks, bit i standing for the
 * i-th alternative.
 */
public final class Frame {

	public static final int MAX_ALTERNATIVES = Integer.SIZE - 1;

	private final ImmutableList<String> alternatives;
	private final ImmutableMap<String, Integer> index;

	private Frame(List<String> alternatives) {
		Preconditions.checkArgument(!alternatives.isEmpty(), "frame must contain at least one alternative");
		Preconditions.checkArgument(alternatives.size() <= MAX_ALTERNATIVES, "frame supports at most %s alternatives",
				MAX_ALTERNATIVES);
		ImmutableMap.Builder<String, Integer> builder = ImmutableMap.builder();
		for (int i = 0; i < alternatives.size(); i++) {
			String alternative = alternatives.get(i);
			Preconditions.checkArgument(StringUtils.isNotBlank(alternative), "blank alternative at position %s", i);
			builder.put(alternative, i);
		}
		// buildOrThrow rejects duplicate identifiers
		this.index = builder.buildOrThrow();
		this.alternatives = ImmutableList.copyOf(alternatives);
	}

	public static Frame of(String... alternatives) {
		return new Frame(ImmutableList.copyOf(alternatives));
	}

	public static Frame of(List<String> alternatives) {
		return new Frame(ImmutableList.copyOf(alternatives));
	}

	public ImmutableList<String> getAlternatives() {
		return this.alternatives;
	}

	public int size() {
		return this.alternatives.size();
	}

	/**
	 * Mask of the whole frame, Θ.
	 */
	public int fullMask() {
		return (1 << size()) - 1;
	}

	public boolean contains(String alternative) {
		return this.index.containsKey(alternative);
	}

	public int indexOf(String alternative) {
		Integer i = this.index.get(alternative);
		Preconditions.checkArgument(i != null, "unknown alternative: %s", alternative);
		return i;
	}

	public String alternative(int index) {
		return this.alternatives.get(index);
	}

	public int singleton(String alternative) {
		return 1 << indexOf(alternative);
	}

	public int maskOf(String... members) {
		int mask = 0;
		for (String member : members)
			mask |= singleton(member);
		return mask;
	}

	public int maskOf(Collection<String> members) {
		int mask = 0;
		for (String member : members)
			mask |= singleton(member);
		return mask;
	}

	public boolean isSubsetOfFrame(int mask) {
		return Utility.isSubset(mask, fullMask());
	}

	public List<String> members(int mask) {
		Preconditions.checkArgument(isSubsetOfFrame(mask), "mask %s is outside the frame", mask);
		List<String> ret = new ArrayList<>();
		for (int i : Utility.bitIndices(mask))
			ret.add(this.alternatives.get(i));
		return ret;
	}

	/**
	 * Human readable form of a subset: "Θ" for the whole frame, "∅" for the empty
	 * set, "{a,b}" otherwise.
	 */
	public String format(int mask) {
		if (mask == fullMask())
			return "Θ";
		if (mask == 0)
			return "∅";
		return "{" + String.join(",", members(mask)) + "}";
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Frame))
			return false;
		return this.alternatives.equals(((Frame) o).alternatives);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.alternatives);
	}

	@Override
	public String toString() {
		return "Θ" + this.alternatives;
	}
}
