package edu.cwru.evidencefusion.bpa;

import edu.cwru.evidencefusion.mass.Frame;
import edu.cwru.evidencefusion.mass.MassFunction;

/**
 * Strategy turning a priority vector over the alternatives into a basic
 * probability assignment. Implementations must return a normalized assignment
 * whose singleton masses are proportional to the priorities.
 */
public interface MassMapping {

	/**
	 * @param frame      the frame the priorities are indexed by
	 * @param priorities one non-negative weight per alternative, summing to 1
	 * @return normalized assignment
	 */
	MassFunction map(Frame frame, double[] priorities);

	/**
	 * Short identifier used in logs and configuration.
	 */
	String name();
}
