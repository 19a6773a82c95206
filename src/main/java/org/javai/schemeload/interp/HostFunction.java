package org.javai.schemeload.interp;

import java.util.List;

/**
 * A function supplied by the host application and callable from scripts by name.
 * <p>
 * Host functions may throw anything; the interpreter reports the failure as a {@link SchemeError}
 * naming the function.
 */
@FunctionalInterface
public interface HostFunction {

	Object call(List<Object> args) throws Exception;
}
