package org.javai.schemeload.load;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.javai.schemeload.config.InclusionMode;
import org.javai.schemeload.config.LoaderSettings;
import org.javai.schemeload.env.EnvironmentStore;
import org.javai.schemeload.interp.SchemeInterpreter;
import org.javai.schemeload.sexpr.SExprReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

class ScriptLoaderTest {

	@TempDir
	Path scripts;

	private EnvironmentStore store;
	private SchemeInterpreter interpreter;
	private List<Object> shown;
	private InclusionHandler inclusionHandler;
	private DiagnosticSink sink;
	private ScriptLoader loader;

	@BeforeEach
	void setUp() {
		store = new EnvironmentStore();
		interpreter = new SchemeInterpreter(store, text -> { });
		shown = new ArrayList<>();
		interpreter.defineHostFunction("show", args -> {
			shown.add(args.get(0));
			return null;
		});
		inclusionHandler = mock(InclusionHandler.class);
		sink = mock(DiagnosticSink.class);
		loader = new ScriptLoader(interpreter, inclusionHandler, sink,
				LoaderSettings.defaults().withIncludeDirectory(scripts));
	}

	@Test
	void constructorRequiresCollaborators() {
		LoaderSettings settings = LoaderSettings.defaults();
		assertThatThrownBy(() -> new ScriptLoader(null, inclusionHandler, sink, settings))
				.isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> new ScriptLoader(interpreter, null, sink, settings))
				.isInstanceOf(NullPointerException.class);
		assertThatThrownBy(() -> new ScriptLoader(interpreter, inclusionHandler, null, settings))
				.isInstanceOf(NullPointerException.class);
	}

	@Test
	void interleavedInternalDefinitionRunsAfterNormalization() {
		LoadReport report = loader.loadSource("g.scm", """
				(define (g) (show 1) (define (h) (show 2)) (h))
				(g)
				""");

		assertThat(report.hasFailures()).isFalse();
		assertThat(shown).containsExactly(1L, 2L);
	}

	@Test
	void sameFormFailsWhenSubmittedUnnormalized() {
		interpreter.evaluate("(define (g) (show 1) (define (h) (show 2)) (h))");

		assertThatThrownBy(() -> interpreter.evaluate("(g)"))
				.hasMessageContaining("definition after expression");
	}

	@Test
	void mutuallyRecursiveInterleavedDefinitionsResolve() {
		LoadReport report = loader.loadSource("parity.scm", """
				(define (parity n)
				  (show 'start)
				  (define (ev? k) (if (= k 0) #t (od? (- k 1))))
				  (show 'middle)
				  (define (od? k) (if (= k 0) #f (ev? (- k 1))))
				  (ev? n))
				(define result (parity 7))
				""");

		assertThat(report.hasFailures()).isFalse();
		assertThat(store.lookup("result")).contains(false);
	}

	@Test
	void failingFormDoesNotStopTheOthers() {
		LoadReport report = loader.loadSource("isolation.scm", """
				(define a 1)
				(define b (car '()))
				(undefined-procedure a)
				(define c (+ a 1))
				""");

		assertThat(report.totalForms()).isEqualTo(4);
		assertThat(report.failedForms()).isEqualTo(2);
		assertThat(report.succeededForms()).isEqualTo(2);
		assertThat(report.aborted()).isFalse();
		assertThat(report.distinctFailingOperators()).containsExactly("define", "undefined-procedure");
		assertThat(store.lookup("c")).contains(2L);
		assertThat(store.isBound("b")).isFalse();

		LoadDiagnostic unbound = report.diagnostics().get(1);
		assertThat(unbound.kind()).isEqualTo(LoadDiagnostic.Kind.EVALUATION);
		assertThat(unbound.file()).isEqualTo("isolation.scm");
		assertThat(unbound.formPreview()).isEqualTo("(undefined-procedure a)");
		assertThat(unbound.message()).isEqualTo("unbound variable: undefined-procedure [symbol: undefined-procedure]");
		verify(sink, times(2)).formFailed(any());
		verify(sink).loadCompleted(report);
	}

	@Test
	void unterminatedListAbortsBeforeAnythingRuns() {
		LoadReport report = loader.loadSource("broken.scm", """
				(show 'first)
				(define (oops x)
				  (show x)
				""");

		assertThat(shown).isEmpty();
		assertThat(report.aborted()).isTrue();
		assertThat(report.totalForms()).isZero();
		assertThat(report.diagnostics()).singleElement().satisfies(d -> {
			assertThat(d.kind()).isEqualTo(LoadDiagnostic.Kind.PARSE);
			assertThat(d.message()).contains("Unmatched '('");
		});
	}

	@Test
	void previewIsTruncated() {
		ScriptLoader shortPreview = new ScriptLoader(interpreter, inclusionHandler, sink,
				LoaderSettings.defaults().withPreviewLength(12));

		LoadReport report = shortPreview.loadSource("long.scm", "(no-such-procedure \"a rather long argument\")");

		assertThat(report.diagnostics().get(0).formPreview()).isEqualTo("(no-such-pro...");
	}

	@Test
	void inclusionFormsGoToTheHandlerWithStrippedFileName() {
		loader.loadSource("main.scm", """
				(load "a.scm")
				(kern-load 'b.scm)
				(kern-include c.scm)
				""");

		ArgumentCaptor<InclusionRequest> requests = ArgumentCaptor.forClass(InclusionRequest.class);
		verify(inclusionHandler, times(3)).include(requests.capture(), any(ScriptLoader.class));
		assertThat(requests.getAllValues())
				.extracting(InclusionRequest::operator, InclusionRequest::fileName, InclusionRequest::mode)
				.containsExactly(
						tuple("load", "a.scm", InclusionMode.LOAD),
						tuple("kern-load", "b.scm", InclusionMode.LOAD),
						tuple("kern-include", "c.scm", InclusionMode.REGISTER));
		assertThat(requests.getAllValues()).allSatisfy(r -> assertThat(r.includingFile()).isEqualTo("main.scm"));
	}

	@Test
	void loadRegisteredDelegatesToTheInclusionHandler() {
		LoadReport later = LoadReport.builder("later.scm").totalForms(1).build();
		when(inclusionHandler.loadRegistered(loader)).thenReturn(List.of(later));

		assertThat(loader.loadRegistered()).containsExactly(later);
		verify(inclusionHandler).loadRegistered(loader);
	}

	@Test
	void computedFileNameIsEvaluated() {
		loader.loadSource("main.scm", "(define dir \"lib/\")\n(load (string-append dir \"x.scm\"))");

		ArgumentCaptor<InclusionRequest> request = ArgumentCaptor.forClass(InclusionRequest.class);
		verify(inclusionHandler).include(request.capture(), any());
		assertThat(request.getValue().fileName()).isEqualTo("lib/x.scm");
	}

	@Test
	void inclusionFailureIsRecordedAndLoadingContinues() {
		doThrow(new InclusionException("load: file not found: Scripts/missing.scm"))
				.when(inclusionHandler).include(any(), any());

		LoadReport report = loader.loadSource("main.scm", """
				(load "missing.scm")
				(define after 1)
				(load)
				""");

		assertThat(store.lookup("after")).contains(1L);
		assertThat(report.failedForms()).isEqualTo(2);
		assertThat(report.distinctFailingOperators()).containsExactly("load");
		assertThat(report.diagnostics()).extracting(LoadDiagnostic::kind)
				.containsOnly(LoadDiagnostic.Kind.INCLUSION);
		assertThat(report.diagnostics()).extracting(LoadDiagnostic::message)
				.containsExactly("load: file not found: Scripts/missing.scm", "load: missing filename");
	}

	@Test
	void skipRulesApplyToTheNamedFileOnly() {
		String text = "(define (load name) 'replaced)\n(define kept 1)";

		LoadReport skipped = loader.loadSource("Scripts/naz.scm", text);
		assertThat(skipped.skippedForms()).isEqualTo(1);
		assertThat(store.isBound("load")).isFalse();
		assertThat(store.lookup("kept")).contains(1L);

		LoadReport other = loader.loadSource("other.scm", text);
		assertThat(other.skippedForms()).isZero();
		assertThat(store.isBound("load")).isTrue();
	}

	@Test
	void unreadableFileYieldsReadDiagnostic() {
		LoadReport report = loader.loadFile(scripts.resolve("absent.scm"));

		assertThat(report.aborted()).isTrue();
		assertThat(report.diagnostics()).singleElement()
				.satisfies(d -> assertThat(d.kind()).isEqualTo(LoadDiagnostic.Kind.READ));
		verify(sink).formFailed(report.diagnostics().get(0));
	}

	@Test
	void loadsFileFromDisk() throws IOException {
		Path file = scripts.resolve("ok.scm");
		Files.writeString(file, "(define from-disk 'yes)");

		LoadReport report = loader.loadFile(file);

		assertThat(report.file()).isEqualTo(file.toString());
		assertThat(report.hasFailures()).isFalse();
		assertThat(store.isBound("from-disk")).isTrue();
	}

	@Test
	void preludeFileIsLoadedUnnormalized() throws IOException {
		Files.writeString(scripts.resolve("tinyscheme-compat.scm"),
				"(define (compat) (show 1) (define inner 2) inner)\n(define nil '())");

		LoadReport report = loader.loadPrelude();

		assertThat(report.hasFailures()).isFalse();
		assertThat(store.isBound("nil")).isTrue();
		assertThatThrownBy(() -> interpreter.evaluate("(compat)"))
				.hasMessageContaining("definition after expression");
	}

	@Test
	void compatDefinitionsReplaceAMissingPrelude() {
		LoadReport report = loader.loadPrelude();

		assertThat(report.file()).isEqualTo(ScriptLoader.COMPAT_SOURCE);
		assertThat(report.totalForms()).isEqualTo(4);
		assertThat(report.hasFailures()).isFalse();
		assertThat(store.lookup("t")).contains(true);
		assertThat(store.lookup("NIL")).contains(List.of());
	}

	@Test
	void foldCaseSettingLowercasesSymbols() {
		ScriptLoader folding = new ScriptLoader(interpreter, inclusionHandler, sink,
				LoaderSettings.defaults().withFoldCase(true));

		folding.loadSource("fold.scm", "(DEFINE Answer 42)");

		assertThat(store.lookup("answer")).contains(42L);
	}

	@Test
	void evaluatorThatNeverFailsSeesOneFormPerCall() throws Exception {
		ScriptEvaluator evaluator = mock(ScriptEvaluator.class);
		when(evaluator.evaluate(anyString())).thenReturn("ok");
		ScriptLoader counting = new ScriptLoader(evaluator, inclusionHandler, sink, LoaderSettings.defaults());

		counting.loadSource("two.scm", "(define a 1)\n\n(define (f)\n  (g) (define x 1) x)");

		verify(evaluator).evaluate("(define a 1)");
		verify(evaluator).evaluate("(define (f) (letrec ((x 1)) (g) x))");
		verify(sink, never()).formFailed(any());
	}

	@Test
	void prepareNormalizesAndPrintsOnOneLine() {
		assertThat(loader.prepare(SExprReader.parseOne("(define (f) (a) (define b 1) b)")))
				.isEqualTo("(define (f) (letrec ((b 1)) (a) b))");
		assertThat(loader.prepare(SExprReader.parseOne("(show\n  \"x\")"))).isEqualTo("(show \"x\")");
	}

	@Test
	void baseNameHandlesBothSeparators() {
		assertThat(ScriptLoader.baseName("Scripts/naz.scm")).isEqualTo("naz.scm");
		assertThat(ScriptLoader.baseName("C:\\game\\Scripts\\naz.scm")).isEqualTo("naz.scm");
		assertThat(ScriptLoader.baseName("naz.scm")).isEqualTo("naz.scm");
	}
}
