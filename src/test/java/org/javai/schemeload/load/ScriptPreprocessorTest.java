package org.javai.schemeload.load;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.logging.log4j.Level;
import org.javai.schemeload.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;

class ScriptPreprocessorTest {

	@Test
	void normalizesEveryFormOnItsOwnLine() {
		String result = new ScriptPreprocessor(false).preprocess("""
				(define (f)
				  (init)
				  (define x 1)
				  x)
				(f) ; call it
				""");

		assertThat(result).isEqualTo("(define (f) (letrec ((x 1)) (init) x))\n(f)\n");
	}

	@Test
	void foldingAddsDirectiveAndLowercases() {
		String result = new ScriptPreprocessor(true).preprocess("(Display \"Hi\")");

		assertThat(result).isEqualTo("#!fold-case\n(display \"Hi\")\n");
	}

	@Test
	void unparsableTextIsReturnedUnchangedWithWarning() {
		String broken = "(define (f) (g)";

		try (LogCaptorAppender log = LogCaptorAppender.create(ScriptPreprocessor.class, Level.WARN)) {
			assertThat(new ScriptPreprocessor(false).preprocess(broken)).isSameAs(broken);
			assertThat(log.messagesAt(Level.WARN)).singleElement()
					.satisfies(m -> assertThat(m).startsWith("Preprocessing skipped"));
		}
	}
}
