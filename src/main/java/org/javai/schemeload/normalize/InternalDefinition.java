package org.javai.schemeload.normalize;

import java.util.List;
import org.javai.schemeload.sexpr.SExpr;

/**
 * A definition found directly inside a body.
 *
 * @param index position of the definition within the body
 * @param name the defined name
 * @param parameters parameter list of a function-shaped definition, {@code null} for a value definition
 * @param bodyForms the forms after the header: function body or value expressions
 */
public record InternalDefinition(int index, String name, List<SExpr> parameters, List<SExpr> bodyForms) {

	public InternalDefinition {
		parameters = parameters != null ? List.copyOf(parameters) : null;
		bodyForms = bodyForms != null ? List.copyOf(bodyForms) : List.of();
	}

	public boolean isFunction() {
		return parameters != null;
	}
}
