package org.javai.schemeload.interp;

/**
 * A Scheme symbol. Symbols with the same name are equal.
 */
public record Symbol(String name) {

	@Override
	public String toString() {
		return name;
	}
}
