package org.javai.schemeload.load;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link DiagnosticSink}: writes failures and the end-of-load summary to the log.
 * The summary repeats the diagnostic list at debug level. A load without failures only produces
 * a debug line.
 */
public class LoggingDiagnosticSink implements DiagnosticSink {

	private final Logger logger;

	public LoggingDiagnosticSink() {
		this(LoggerFactory.getLogger(ScriptLoader.class));
	}

	public LoggingDiagnosticSink(Logger logger) {
		this.logger = logger;
	}

	@Override
	public void formFailed(LoadDiagnostic diagnostic) {
		if (!logger.isWarnEnabled()) {
			return;
		}
		if (diagnostic.kind() == LoadDiagnostic.Kind.PARSE || diagnostic.kind() == LoadDiagnostic.Kind.READ) {
			logger.warn("[{}] {} error, nothing evaluated: {}", diagnostic.file(), describe(diagnostic.kind()),
					diagnostic.message());
			return;
		}
		logger.warn("[{}] {} error in ({}): {} | expression: {}",
				diagnostic.file(),
				describe(diagnostic.kind()),
				diagnostic.failingOperator() != null ? diagnostic.failingOperator() : "?",
				diagnostic.message(),
				diagnostic.formPreview());
	}

	@Override
	public void loadCompleted(LoadReport report) {
		if (!report.hasFailures()) {
			logger.debug("[{}] loaded {} form(s) cleanly", report.file(), report.totalForms());
			return;
		}
		if (!logger.isWarnEnabled()) {
			return;
		}
		if (report.aborted()) {
			logger.warn("[{}] load aborted: {}", report.file(), report.diagnostics().get(0).message());
			return;
		}
		logger.warn("[{}] {} of {} form(s) failed; failing operators={}",
				report.file(),
				report.failedForms(),
				report.totalForms(),
				report.distinctFailingOperators());
		if (logger.isDebugEnabled()) {
			for (LoadDiagnostic diagnostic : report.diagnostics()) {
				logger.debug("[{}]   {} ({}): {}", report.file(), describe(diagnostic.kind()),
						diagnostic.failingOperator() != null ? diagnostic.failingOperator() : "?", diagnostic.message());
			}
		}
	}

	private static String describe(LoadDiagnostic.Kind kind) {
		return switch (kind) {
			case PARSE -> "parse";
			case EVALUATION -> "evaluation";
			case INCLUSION -> "inclusion";
			case READ -> "read";
		};
	}
}
