package org.javai.schemeload.sexpr;

import java.util.List;

/**
 * Visitor for traversing {@link SExpr} trees.
 *
 * @param <R> the return type of the visitor operations
 */
public interface SExprVisitor<R> {

	/**
	 * Visits an atom.
	 *
	 * @param text the raw atom text, string literals including their delimiters
	 * @return the result of visiting this node
	 */
	R visitAtom(String text);

	/**
	 * Visits a list.
	 *
	 * @param items the list items in source order
	 * @return the result of visiting this node
	 */
	R visitList(List<SExpr> items);
}
