package org.javai.schemeload.interp;

import java.util.List;

/**
 * Anything callable from a script: builtins, host functions and closures.
 */
@FunctionalInterface
public interface Procedure {

	/**
	 * @param args the already evaluated arguments
	 * @return the result; never {@code null}, use {@link Unspecified#VOID} for no value
	 */
	Object apply(List<Object> args);
}
