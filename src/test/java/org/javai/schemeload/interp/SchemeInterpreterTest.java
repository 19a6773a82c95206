package org.javai.schemeload.interp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.List;
import org.javai.schemeload.env.EnvironmentStore;
import org.javai.schemeload.load.FailureMessages;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class SchemeInterpreterTest {

	private EnvironmentStore store;
	private StringBuilder output;
	private SchemeInterpreter interpreter;

	@BeforeEach
	void setUp() {
		store = new EnvironmentStore();
		output = new StringBuilder();
		interpreter = new SchemeInterpreter(store, output::append);
	}

	private Object eval(String text) {
		return interpreter.evaluate(text);
	}

	@Test
	void evaluatesSelfEvaluatingAtoms() {
		assertThat(eval("42")).isEqualTo(42L);
		assertThat(eval("-1.5")).isEqualTo(-1.5);
		assertThat(eval("\"text\"")).isEqualTo("text");
		assertThat(eval("#t")).isEqualTo(true);
		assertThat(eval("#false")).isEqualTo(false);
		assertThat(eval("#\\space")).isEqualTo(' ');
	}

	@Test
	void topLevelDefinitionsLandInTheSharedStore() {
		eval("(define answer 42)");
		eval("(define (twice x) (* 2 x))");

		assertThat(store.lookup("answer")).contains(42L);
		assertThat(store.lookup("twice")).containsInstanceOf(Procedure.class);
		assertThat(eval("(twice answer)")).isEqualTo(84L);
	}

	@Test
	void arithmeticPromotesToDouble() {
		assertThat(eval("(+ 1 2 3)")).isEqualTo(6L);
		assertThat(eval("(+ 1 2.5)")).isEqualTo(3.5);
		assertThat(eval("(/ 6 3)")).isEqualTo(2L);
		assertThat(eval("(/ 1 2)")).isEqualTo(0.5);
		assertThat(eval("(- 5)")).isEqualTo(-5L);
		assertThat(eval("(modulo -7 3)")).isEqualTo(2L);
		assertThat(eval("(max 1 2.0)")).isEqualTo(2.0);
	}

	@Test
	void listOperations() {
		assertThat(eval("(cons 1 '(2 3))")).isEqualTo(List.of(1L, 2L, 3L));
		assertThat(eval("(car (cdr '(a b c)))")).isEqualTo(new Symbol("b"));
		assertThat(eval("(append '(1) '() '(2 3))")).isEqualTo(List.of(1L, 2L, 3L));
		assertThat(eval("(map (lambda (x y) (+ x y)) '(1 2) '(10 20))")).isEqualTo(List.of(11L, 22L));
		assertThat(eval("(apply + 1 '(2 3))")).isEqualTo(6L);
		assertThat(eval("(assq 'b '((a 1) (b 2)))")).isEqualTo(List.of(new Symbol("b"), 2L));
		assertThat(eval("(null? '())")).isEqualTo(true);
	}

	@Test
	void consOntoNonListIsRejected() {
		assertThatThrownBy(() -> eval("(cons 1 2)"))
				.isInstanceOf(SchemeError.class)
				.hasMessageContaining("cons: expected list");
	}

	@Test
	void quasiquoteWithUnquoteAndSplicing() {
		eval("(define xs '(2 3))");

		assertThat(SchemeValues.write(eval("`(1 ,(car xs) ,@xs end)"))).isEqualTo("(1 2 2 3 end)");
	}

	@Test
	void definitionsBeforeExpressionsAreAccepted() {
		eval("(define (f x) (define y 10) (define (g z) (+ z y)) (g x))");

		assertThat(eval("(f 5)")).isEqualTo(15L);
	}

	@Test
	void definitionAfterExpressionInBodyIsRejected() {
		eval("(define (f x) (display x) (define (g y) (* y 2)) (g x))");

		assertThatThrownBy(() -> eval("(f 3)"))
				.isInstanceOf(SchemeError.class)
				.hasMessage("definition after expression in body");
		assertThat(output.toString()).isEmpty();
	}

	@Test
	void letrecFormOfTheSameBodyRuns() {
		eval("(define (f x) (letrec ((g (lambda (y) (* y 2)))) (display x) (g x)))");

		assertThat(eval("(f 3)")).isEqualTo(6L);
	}

	@Test
	void definitionInExpressionContextIsRejected() {
		assertThatThrownBy(() -> eval("(define (f) (if #t (define x 1) 2))\n(f)"))
				.isInstanceOf(SchemeError.class)
				.hasMessageContaining("definition in expression context");
	}

	@Test
	void letrecSupportsMutualRecursion() {
		Object result = eval("""
				(letrec ((even? (lambda (n) (if (= n 0) #t (odd? (- n 1)))))
				         (odd? (lambda (n) (if (= n 0) #f (even? (- n 1))))))
				  (even? 1000))
				""");

		assertThat(result).isEqualTo(true);
	}

	@Test
	void letrecBindingUsedBeforeInitializationFails() {
		assertThatThrownBy(() -> eval("(letrec ((a b) (b 1)) a)"))
				.isInstanceOf(SchemeError.class)
				.hasMessageContaining("used before its definition: b");
	}

	@Test
	void namedLetLoopsInConstantStack() {
		assertThat(eval("(let loop ((i 0) (acc 0)) (if (= i 100000) acc (loop (+ i 1) (+ acc i))))"))
				.isEqualTo(4999950000L);
	}

	@Test
	void letStarAndDo() {
		assertThat(eval("(let* ((a 1) (b (+ a 1))) (* a b))")).isEqualTo(2L);
		assertThat(eval("(do ((i 0 (+ i 1)) (acc '() (cons i acc))) ((= i 3) acc))"))
				.isEqualTo(List.of(2L, 1L, 0L));
	}

	@Test
	void conditionals() {
		assertThat(eval("(cond ((assv 2 '((1 one) (2 two))) => cadr) (else 'none))")).isEqualTo(new Symbol("two"));
		assertThat(eval("(cond (#f 1) (else 2))")).isEqualTo(2L);
		assertThat(eval("(cond (#f 1))")).isEqualTo(Unspecified.VOID);
		assertThat(eval("(case (* 2 3) ((2 3 5 7) 'prime) ((1 4 6 8 9) 'composite))")).isEqualTo(new Symbol("composite"));
		assertThat(eval("(and 1 2 3)")).isEqualTo(3L);
		assertThat(eval("(or #f #f)")).isEqualTo(false);
		assertThat(eval("(when (> 2 1) 'yes)")).isEqualTo(new Symbol("yes"));
		assertThat(eval("(unless (> 2 1) 'yes)")).isEqualTo(Unspecified.VOID);
	}

	@Test
	void restParameters() {
		eval("(define (head-and-rest a . rest) (list a rest))");

		assertThat(SchemeValues.write(eval("(head-and-rest 1 2 3)"))).isEqualTo("(1 (2 3))");
		assertThat(SchemeValues.write(eval("((lambda args args) 1 2)"))).isEqualTo("(1 2)");
	}

	@Test
	void setUpdatesTheNearestBinding() {
		eval("(define counter 0)");
		eval("(define (bump!) (set! counter (+ counter 1)) counter)");
		eval("(bump!)");

		assertThat(eval("(bump!)")).isEqualTo(2L);
		assertThatThrownBy(() -> eval("(set! missing 1)"))
				.isInstanceOf(SchemeError.class)
				.hasMessageContaining("unbound variable: missing");
	}

	@Test
	void displayAndNewlineWriteToOutput() {
		eval("(display \"value: \") (display '(1 \"two\" #\\c)) (newline) (write \"q\")");

		assertThat(output).hasToString("value: (1 two c)\n\"q\"");
	}

	@Test
	void errorCarriesIrritantsAsDetail() {
		assertThatThrownBy(() -> eval("(error \"bad thing\" 'widget 42 \"x\")"))
				.isInstanceOfSatisfying(SchemeError.class, e -> {
					assertThat(e.getMessage()).isEqualTo("bad thing");
					assertThat(e.details()).containsEntry("irritants", "widget 42 \"x\"");
					assertThat(FailureMessages.extract(e)).isEqualTo("bad thing [irritants: widget 42 \"x\"]");
				});
	}

	@Test
	void unboundVariableNamesTheSymbol() {
		assertThatThrownBy(() -> eval("(undefined-thing 1)"))
				.isInstanceOfSatisfying(SchemeError.class, e -> {
					assertThat(e.getMessage()).isEqualTo("unbound variable: undefined-thing");
					assertThat(e.details()).containsEntry("symbol", "undefined-thing");
				});
	}

	@Test
	void callingANonProcedureFails() {
		assertThatThrownBy(() -> eval("(5 1)"))
				.isInstanceOf(SchemeError.class)
				.hasMessageContaining("non-procedure");
	}

	@Test
	void wrongArgumentCountNamesTheProcedure() {
		eval("(define (pair a b) (list a b))");

		assertThatThrownBy(() -> eval("(pair 1)"))
				.isInstanceOf(SchemeError.class)
				.hasMessage("pair: expected 2 argument(s), got 1");
	}

	@Test
	void hostFunctionsAreCallableAndTheirFailuresWrapped() {
		interpreter.defineHostFunction("host-add", args -> (Long) args.get(0) + (Long) args.get(1));
		interpreter.defineHostFunction("host-fail", args -> {
			throw new IOException("disk gone");
		});
		interpreter.defineHostFunction("host-nothing", args -> null);

		assertThat(eval("(host-add 2 3)")).isEqualTo(5L);
		assertThat(eval("(host-nothing)")).isEqualTo(Unspecified.VOID);
		assertThatThrownBy(() -> eval("(host-fail)"))
				.isInstanceOfSatisfying(SchemeError.class, e -> {
					assertThat(e).hasMessage("host-fail: disk gone");
					assertThat(e).hasCauseInstanceOf(IOException.class);
					assertThat(e.details()).containsEntry("host-function", "host-fail");
				});
	}

	@Test
	void hostFunctionsCanCallBackIntoScripts() {
		eval("(define (square x) (* x x))");
		interpreter.defineHostFunction("call-with-seven",
				args -> ((Procedure) args.get(0)).apply(List.of(7L)));

		assertThat(eval("(call-with-seven square)")).isEqualTo(49L);
	}

	@Test
	void runawayRecursionBecomesSchemeError() {
		eval("(define (deep n) (+ 1 (deep n)))");

		assertThatThrownBy(() -> eval("(deep 1)"))
				.isInstanceOf(SchemeError.class)
				.hasMessage("recursion too deep");
	}

	@Test
	void evaluatesSeveralFormsAndReturnsTheLastValue() {
		assertThat(eval("(define a 1) (define b 2) (+ a b)")).isEqualTo(3L);
		assertThat(eval("")).isEqualTo(Unspecified.VOID);
	}

	@Test
	void valuesPrintInReadableForm() {
		assertThat(SchemeValues.write(eval("(list 1 2.5 \"s\" #\\a #t 'sym)"))).isEqualTo("(1 2.5 \"s\" #\\a #t sym)");
		assertThat(SchemeValues.display(eval("(lambda (x) x)"))).isEqualTo("#<procedure lambda>");
		eval("(define (named) 1)");
		assertThat(SchemeValues.display(eval("named"))).isEqualTo("#<procedure named>");
	}
}
