package org.javai.schemeload.load;

import java.util.List;
import org.javai.schemeload.normalize.DefinitionNormalizer;
import org.javai.schemeload.sexpr.SExpr;
import org.javai.schemeload.sexpr.SExprParseException;
import org.javai.schemeload.sexpr.SExprPrinter;
import org.javai.schemeload.sexpr.SExprReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites a complete program in one go, for evaluators that take whole files rather than
 * single forms.
 */
public final class ScriptPreprocessor {

	private static final Logger logger = LoggerFactory.getLogger(ScriptPreprocessor.class);

	static final String FOLD_CASE_DIRECTIVE = "#!fold-case";

	private final DefinitionNormalizer normalizer = new DefinitionNormalizer();
	private final boolean foldCase;

	public ScriptPreprocessor(boolean foldCase) {
		this.foldCase = foldCase;
	}

	/**
	 * Normalizes every top-level form of {@code code} and prints one form per line. With case
	 * folding on, the output starts with a {@code #!fold-case} directive. Text that does not parse
	 * is returned unchanged.
	 */
	public String preprocess(String code) {
		List<SExpr> forms;
		try {
			forms = SExprReader.parseAll(code, foldCase);
		} catch (SExprParseException e) {
			logger.warn("Preprocessing skipped, returning original code: {}", e.getMessage());
			return code;
		}

		StringBuilder sb = new StringBuilder();
		if (foldCase) {
			sb.append(FOLD_CASE_DIRECTIVE).append('\n');
		}
		for (SExpr form : forms) {
			sb.append(SExprPrinter.printCompact(normalizer.normalize(form))).append('\n');
		}
		return sb.toString();
	}
}
