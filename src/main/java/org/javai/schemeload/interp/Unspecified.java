package org.javai.schemeload.interp;

/**
 * Markers for values that are not ordinary data.
 */
public enum Unspecified {

	/** Result of forms evaluated for effect, such as {@code define}, {@code set!} or {@code (void)}. */
	VOID,

	/** Value of a {@code letrec} binding before its initializer has run. */
	UNASSIGNED;

	@Override
	public String toString() {
		return this == VOID ? "#<void>" : "#<unassigned>";
	}
}
