package org.javai.schemeload.load;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.schemeload.config.InclusionMode;
import org.javai.schemeload.config.LoaderSettings;
import org.javai.schemeload.normalize.DefinitionNormalizer;
import org.javai.schemeload.sexpr.SExpr;
import org.javai.schemeload.sexpr.SExprParseException;
import org.javai.schemeload.sexpr.SExprPrinter;
import org.javai.schemeload.sexpr.SExprReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads script files form by form.
 * <p>
 * The whole file is read first; malformed text abandons the file before anything is evaluated.
 * Each top-level form is then handled in source order: inclusion forms go to the
 * {@link InclusionHandler}, every other form is normalized, printed and submitted to the
 * evaluator. A form that fails is recorded and the next form runs regardless, so one broken
 * definition never costs the rest of the file.
 * <p>
 * The loader keeps no per-load state, so an evaluator or inclusion handler may call back into it
 * while a load is in progress.
 */
public class ScriptLoader {

	private static final Logger logger = LoggerFactory.getLogger(ScriptLoader.class);

	static final String COMPAT_SOURCE = "<compat>";

	private final EvaluationGateway gateway;
	private final InclusionHandler inclusionHandler;
	private final DiagnosticSink sink;
	private final LoaderSettings settings;
	private final DefinitionNormalizer normalizer = new DefinitionNormalizer();

	public ScriptLoader(ScriptEvaluator evaluator, LoaderSettings settings) {
		this(evaluator, new FileInclusionHandler(settings), new LoggingDiagnosticSink(), settings);
	}

	public ScriptLoader(ScriptEvaluator evaluator, InclusionHandler inclusionHandler, DiagnosticSink sink,
			LoaderSettings settings) {
		this.gateway = new EvaluationGateway(Objects.requireNonNull(evaluator, "evaluator must not be null"));
		this.inclusionHandler = Objects.requireNonNull(inclusionHandler, "inclusionHandler must not be null");
		this.sink = Objects.requireNonNull(sink, "sink must not be null");
		this.settings = Objects.requireNonNull(settings, "settings must not be null");
	}

	public LoaderSettings settings() {
		return settings;
	}

	public InclusionHandler inclusionHandler() {
		return inclusionHandler;
	}

	/**
	 * Loads the files that registering inclusion forms named, through this loader.
	 */
	public List<LoadReport> loadRegistered() {
		return inclusionHandler.loadRegistered(this);
	}

	/**
	 * Loads a script file with definition normalization.
	 */
	public LoadReport loadFile(Path file) {
		logger.info("Loading script file: {}", file);
		String label = file.toString();
		String text;
		try {
			text = Files.readString(file, StandardCharsets.UTF_8);
		} catch (IOException e) {
			LoadReport.Builder report = LoadReport.builder(label);
			record(report, new LoadDiagnostic(label, LoadDiagnostic.Kind.READ, "", null,
					"Cannot read script file: " + FailureMessages.extract(e)), true);
			return complete(report);
		}
		return load(label, text, true);
	}

	/**
	 * Loads script text with definition normalization.
	 *
	 * @param file name used in diagnostics and for skip rules
	 */
	public LoadReport loadSource(String file, String text) {
		return load(file, text, true);
	}

	/**
	 * Loads the compatibility prelude without normalization. When the configured prelude file does
	 * not exist, the configured compatibility definitions are evaluated instead.
	 */
	public LoadReport loadPrelude() {
		if (settings.prelude() != null) {
			Path prelude = settings.includeDirectory().resolve(settings.prelude());
			if (Files.isRegularFile(prelude)) {
				logger.info("Loading compatibility prelude: {}", prelude);
				try {
					return load(prelude.toString(), Files.readString(prelude, StandardCharsets.UTF_8), false);
				} catch (IOException e) {
					LoadReport.Builder report = LoadReport.builder(prelude.toString());
					record(report, new LoadDiagnostic(prelude.toString(), LoadDiagnostic.Kind.READ, "", null,
							"Cannot read prelude: " + FailureMessages.extract(e)), true);
					return complete(report);
				}
			}
		}
		logger.info("No prelude found; defining {} compatibility form(s) inline", settings.compatDefinitions().size());
		return load(COMPAT_SOURCE, String.join("\n", settings.compatDefinitions()), false);
	}

	/**
	 * The text submitted to the evaluator for {@code form}: normalized and printed on one line.
	 * If normalization fails the form is printed unchanged.
	 */
	public String prepare(SExpr form) {
		try {
			return SExprPrinter.printCompact(normalizer.normalize(form));
		} catch (RuntimeException e) {
			logger.debug("Normalization failed, submitting form unchanged: {}", e.getMessage());
			return SExprPrinter.printCompact(form);
		}
	}

	private LoadReport load(String file, String text, boolean normalize) {
		long start = System.nanoTime();
		LoadReport.Builder report = LoadReport.builder(file);

		List<SExpr> forms;
		try {
			forms = SExprReader.parseAll(text, settings.foldCase());
		} catch (SExprParseException e) {
			record(report, new LoadDiagnostic(file, LoadDiagnostic.Kind.PARSE, "", null, e.getMessage()), true);
			return complete(report);
		}
		report.totalForms(forms.size());

		String fileName = baseName(file);
		for (SExpr form : forms) {
			Optional<String> operator = form.operator();
			if (operator.isPresent() && settings.isInclusionOperator(operator.get())) {
				include(file, operator.get(), form, report);
				continue;
			}
			Optional<String> skipped = skippedDefinition(fileName, form);
			if (skipped.isPresent()) {
				logger.debug("[{}] skipping top-level definition of {}", file, skipped.get());
				report.skipped();
				continue;
			}

			String formText = normalize ? prepare(form) : SExprPrinter.printCompact(form);
			EvaluationResult result = gateway.submit(formText);
			if (result instanceof EvaluationResult.Failure failure) {
				record(report, new LoadDiagnostic(file, LoadDiagnostic.Kind.EVALUATION,
						LoadDiagnostic.preview(formText, settings.previewLength()),
						operator.orElse(null), failure.message()), false);
			}
		}

		if (logger.isDebugEnabled()) {
			logger.debug("{} ms to load {}", (System.nanoTime() - start) / 1_000_000, file);
		}
		return complete(report);
	}

	private void include(String file, String operator, SExpr form, LoadReport.Builder report) {
		try {
			String fileName = inclusionFileName(operator, form);
			InclusionMode mode = settings.inclusionOperators().get(operator);
			inclusionHandler.include(new InclusionRequest(operator, fileName, mode, file), this);
		} catch (RuntimeException e) {
			record(report, new LoadDiagnostic(file, LoadDiagnostic.Kind.INCLUSION,
					LoadDiagnostic.preview(SExprPrinter.printCompact(form), settings.previewLength()),
					operator, FailureMessages.extract(e)), false);
		}
	}

	/**
	 * File name argument of an inclusion form: {@code "x.scm"}, {@code 'x.scm} and {@code x.scm} all
	 * name {@code x.scm}; any other argument is evaluated and its value used.
	 */
	private String inclusionFileName(String operator, SExpr form) {
		if (form.size() < 2) {
			throw new InclusionException(operator + ": missing filename");
		}
		SExpr argument = form.get(1);
		if (argument.isList() && argument.size() == 2 && argument.get(0).isSymbol("quote") && argument.get(1).isAtom()) {
			argument = argument.get(1);
		}
		if (argument.isAtom()) {
			return argument.isStringLiteral() ? argument.stringValue() : argument.atom();
		}

		EvaluationResult result = gateway.submit(prepare(argument));
		if (result instanceof EvaluationResult.Failure failure) {
			throw new InclusionException(operator + ": cannot compute filename: " + failure.message(), failure.error());
		}
		Object value = ((EvaluationResult.Success) result).value();
		if (value == null) {
			throw new InclusionException(operator + ": filename expression produced no value");
		}
		return unquote(String.valueOf(value));
	}

	private Optional<String> skippedDefinition(String fileName, SExpr form) {
		if (!form.isList() || form.size() < 2 || !form.get(0).isSymbol("define")) {
			return Optional.empty();
		}
		SExpr header = form.get(1);
		String name = header.isList() && !header.isEmptyList() ? header.get(0).atom() : header.atom();
		if (name != null && settings.isSkipped(fileName, name)) {
			return Optional.of(name);
		}
		return Optional.empty();
	}

	private void record(LoadReport.Builder report, LoadDiagnostic diagnostic, boolean abort) {
		if (abort) {
			report.abort(diagnostic);
		} else {
			report.failed(diagnostic);
		}
		sink.formFailed(diagnostic);
	}

	private LoadReport complete(LoadReport.Builder builder) {
		LoadReport report = builder.build();
		sink.loadCompleted(report);
		return report;
	}

	private static String unquote(String value) {
		if (value.length() > 2 && value.startsWith("\"") && value.endsWith("\"")) {
			return value.substring(1, value.length() - 1);
		}
		return value;
	}

	static String baseName(String file) {
		int slash = Math.max(file.lastIndexOf('/'), file.lastIndexOf('\\'));
		return slash >= 0 ? file.substring(slash + 1) : file;
	}
}
