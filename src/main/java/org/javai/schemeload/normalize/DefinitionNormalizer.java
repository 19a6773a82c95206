package org.javai.schemeload.normalize;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.javai.schemeload.sexpr.SExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites bodies whose internal definitions are interleaved with expressions into a single
 * {@code letrec} form, so that an evaluator requiring definitions to come first accepts them.
 * <p>
 * A body is the sequence of forms inside a function {@code define}, a {@code lambda}, a let-family
 * form or a {@code case-lambda} clause. When some definition of a body follows a plain expression,
 * the body becomes
 * <pre>
 * (letrec ((name1 value1) (name2 value2) ...) expr1 expr2 ...)
 * </pre>
 * Nested bodies are normalized on their own, whether or not the enclosing one was rewritten.
 * Quoted data is never touched; inside quasiquoted data only the unquoted parts are.
 */
public class DefinitionNormalizer {

	private static final Logger logger = LoggerFactory.getLogger(DefinitionNormalizer.class);

	static final String PLACEHOLDER = "void";

	private static final Set<String> LET_FORMS = Set.of("let", "let*", "letrec", "letrec*");

	/**
	 * Normalizes every body reachable from {@code expr}.
	 */
	public SExpr normalize(SExpr expr) {
		if (expr.isAtom() || expr.isEmptyList()) {
			return expr;
		}

		Optional<String> operator = expr.operator();
		if (operator.isPresent()) {
			String head = operator.get();
			switch (head) {
				case "quote" -> {
					return expr;
				}
				case "quasiquote" -> {
					return SExpr.form(head, normalizeTemplate(expr.tail(1), 1));
				}
				case "unquote", "unquote-splicing" -> {
					return SExpr.form(head, normalizeEach(expr.tail(1)));
				}
				case "define" -> {
					if (expr.size() >= 3) {
						return normalizeDefine(expr);
					}
				}
				case "lambda" -> {
					if (expr.size() >= 3) {
						List<SExpr> rebuilt = new ArrayList<>();
						rebuilt.add(expr.get(1));
						rebuilt.addAll(normalizeBody(expr.tail(2)));
						return SExpr.form(head, rebuilt);
					}
				}
				case "do" -> {
					if (expr.size() >= 3) {
						return normalizeDo(expr);
					}
				}
				case "case-lambda" -> {
					return normalizeCaseLambda(expr);
				}
				default -> {
					if (LET_FORMS.contains(head) && expr.size() >= 3) {
						return normalizeLet(head, expr);
					}
				}
			}
		}

		return SExpr.list(normalizeEach(expr.items()));
	}

	/**
	 * Normalizes one body. The result is either the body with its nested bodies normalized, or a
	 * single-element list holding the synthesized {@code letrec}.
	 */
	public List<SExpr> normalizeBody(List<SExpr> body) {
		if (body.isEmpty()) {
			return body;
		}

		List<InternalDefinition> definitions = new ArrayList<>();
		List<SExpr> expressions = new ArrayList<>();
		boolean expressionSeen = false;
		boolean compliant = true;

		for (int i = 0; i < body.size(); i++) {
			Optional<InternalDefinition> definition = classify(i, body.get(i));
			if (definition.isPresent()) {
				definitions.add(definition.get());
				if (expressionSeen) {
					compliant = false;
				}
			} else {
				expressions.add(body.get(i));
				expressionSeen = true;
			}
		}

		if (definitions.isEmpty() || compliant) {
			return normalizeEach(body);
		}

		if (logger.isDebugEnabled()) {
			logger.debug("Rewriting body with {} internal definition(s) after an expression into letrec: {}",
					definitions.size(), definitions.stream().map(InternalDefinition::name).toList());
		}

		List<SExpr> bindings = new ArrayList<>(definitions.size());
		for (InternalDefinition definition : definitions) {
			bindings.add(SExpr.list(SExpr.atom(definition.name()), bindingValue(definition)));
		}

		List<SExpr> letrecBody = normalizeEach(expressions);
		if (letrecBody.isEmpty()) {
			letrecBody = List.of(placeholder());
		}

		List<SExpr> letrec = new ArrayList<>();
		letrec.add(SExpr.list(bindings));
		letrec.addAll(letrecBody);
		return List.of(SExpr.form("letrec", letrec));
	}

	/**
	 * Recognizes {@code (define (name . params) body...)} and {@code (define name value...)}.
	 * Anything else, including curried or otherwise unusual headers, is a plain expression.
	 */
	static Optional<InternalDefinition> classify(int index, SExpr form) {
		if (!form.isList() || form.size() < 2 || !form.get(0).isSymbol("define")) {
			return Optional.empty();
		}
		SExpr header = form.get(1);
		if (header.isList() && !header.isEmptyList() && header.get(0).isSymbol()) {
			return Optional.of(new InternalDefinition(index, header.get(0).atom(), header.tail(1), form.tail(2)));
		}
		if (header.isSymbol()) {
			return Optional.of(new InternalDefinition(index, header.atom(), null, form.tail(2)));
		}
		return Optional.empty();
	}

	private SExpr bindingValue(InternalDefinition definition) {
		if (definition.isFunction()) {
			List<SExpr> lambda = new ArrayList<>();
			lambda.add(lambdaParameters(definition.parameters()));
			lambda.addAll(normalizeBody(definition.bodyForms()));
			return SExpr.form("lambda", lambda);
		}
		List<SExpr> values = definition.bodyForms();
		if (values.isEmpty()) {
			return placeholder();
		}
		if (values.size() == 1) {
			return normalize(values.get(0));
		}
		return SExpr.form("begin", normalizeEach(values));
	}

	// (f . args) takes the bare rest symbol: (lambda args ...)
	private static SExpr lambdaParameters(List<SExpr> parameters) {
		if (parameters.size() == 2 && parameters.get(0).isSymbol(".")) {
			return parameters.get(1);
		}
		return SExpr.list(parameters);
	}

	private SExpr normalizeDefine(SExpr expr) {
		SExpr header = expr.get(1);
		List<SExpr> rebuilt = new ArrayList<>();
		rebuilt.add(header);
		if (header.isList() && !header.isEmptyList()) {
			rebuilt.addAll(normalizeBody(expr.tail(2)));
		} else {
			rebuilt.addAll(normalizeEach(expr.tail(2)));
		}
		return SExpr.form("define", rebuilt);
	}

	private SExpr normalizeLet(String head, SExpr expr) {
		// named let: (let loop ((i 0)) body...)
		boolean named = expr.get(1).isSymbol();
		int bindingsIndex = named ? 2 : 1;
		if (expr.size() <= bindingsIndex) {
			return SExpr.list(normalizeEach(expr.items()));
		}

		List<SExpr> rebuilt = new ArrayList<>();
		if (named) {
			rebuilt.add(expr.get(1));
		}
		rebuilt.add(normalizeBindings(expr.get(bindingsIndex)));
		rebuilt.addAll(normalizeBody(expr.tail(bindingsIndex + 1)));
		return SExpr.form(head, rebuilt);
	}

	private SExpr normalizeBindings(SExpr bindings) {
		if (!bindings.isList()) {
			return bindings;
		}
		List<SExpr> result = new ArrayList<>(bindings.size());
		for (SExpr binding : bindings.items()) {
			if (binding.isList() && binding.size() >= 2) {
				List<SExpr> rebuilt = new ArrayList<>();
				rebuilt.add(binding.get(0));
				rebuilt.addAll(normalizeEach(binding.tail(1)));
				result.add(SExpr.list(rebuilt));
			} else {
				result.add(binding);
			}
		}
		return SExpr.list(result);
	}

	private SExpr normalizeDo(SExpr expr) {
		SExpr specs = expr.get(1);
		SExpr newSpecs = specs;
		if (specs.isList()) {
			List<SExpr> rebuilt = new ArrayList<>(specs.size());
			for (SExpr spec : specs.items()) {
				rebuilt.add(spec.isList() ? SExpr.list(normalizeEach(spec.items())) : spec);
			}
			newSpecs = SExpr.list(rebuilt);
		}
		SExpr test = expr.get(2);
		SExpr newTest = test.isList() ? SExpr.list(normalizeEach(test.items())) : normalize(test);

		List<SExpr> rebuilt = new ArrayList<>();
		rebuilt.add(newSpecs);
		rebuilt.add(newTest);
		rebuilt.addAll(normalizeEach(expr.tail(3)));
		return SExpr.form("do", rebuilt);
	}

	private SExpr normalizeCaseLambda(SExpr expr) {
		List<SExpr> clauses = new ArrayList<>();
		for (SExpr clause : expr.tail(1)) {
			if (clause.isList() && clause.size() >= 2) {
				List<SExpr> rebuilt = new ArrayList<>();
				rebuilt.add(clause.get(0));
				rebuilt.addAll(normalizeBody(clause.tail(1)));
				clauses.add(SExpr.list(rebuilt));
			} else {
				clauses.add(clause);
			}
		}
		return SExpr.form("case-lambda", clauses);
	}

	/**
	 * Walks quasiquoted data, normalizing only what {@code unquote} and {@code unquote-splicing}
	 * hand back to evaluation. Nested quasiquotes raise the depth; only an unquote that brings it
	 * back to zero escapes.
	 */
	private List<SExpr> normalizeTemplate(List<SExpr> items, int depth) {
		List<SExpr> result = new ArrayList<>(items.size());
		for (SExpr item : items) {
			if (item.isAtom() || item.isEmptyList()) {
				result.add(item);
			} else if (item.get(0).isSymbol("unquote") || item.get(0).isSymbol("unquote-splicing")) {
				List<SExpr> args = depth == 1 ? normalizeEach(item.tail(1)) : normalizeTemplate(item.tail(1), depth - 1);
				result.add(SExpr.form(item.get(0).atom(), args));
			} else if (item.get(0).isSymbol("quasiquote")) {
				result.add(SExpr.form("quasiquote", normalizeTemplate(item.tail(1), depth + 1)));
			} else {
				result.add(SExpr.list(normalizeTemplate(item.items(), depth)));
			}
		}
		return result;
	}

	private List<SExpr> normalizeEach(List<SExpr> forms) {
		List<SExpr> result = new ArrayList<>(forms.size());
		for (SExpr form : forms) {
			result.add(normalize(form));
		}
		return result;
	}

	private static SExpr placeholder() {
		return SExpr.list(SExpr.atom(PLACEHOLDER));
	}
}
