package org.javai.configspace.io.grammar;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LexicalGrammar")
class LexicalGrammarTest {

	@Test
	@DisplayName("identifiers allow the documented punctuation but no brackets, braces, commas or whitespace")
	void identifiers() {
		assertThat(LexicalGrammar.isIdentifier("lr")).isTrue();
		assertThat(LexicalGrammar.isIdentifier("solver:max-iter")).isTrue();
		assertThat(LexicalGrammar.isIdentifier("a/b.c@d?e!f$g%h&i*j+k<l>m;n\\o")).isTrue();
		assertThat(LexicalGrammar.isIdentifier("a b")).isFalse();
		assertThat(LexicalGrammar.isIdentifier("a(b)")).isFalse();
		assertThat(LexicalGrammar.isIdentifier("a,b")).isFalse();
		assertThat(LexicalGrammar.isIdentifier("{a}")).isFalse();
		assertThat(LexicalGrammar.isIdentifier("")).isFalse();
		assertThat(LexicalGrammar.isIdentifier(null)).isFalse();
	}

	@Test
	@DisplayName("numbers cover integers, floats and exponent forms")
	void numbers() {
		assertThat(LexicalGrammar.isNumber("42")).isTrue();
		assertThat(LexicalGrammar.isNumber("-3")).isTrue();
		assertThat(LexicalGrammar.isNumber("+0.5")).isTrue();
		assertThat(LexicalGrammar.isNumber(".5")).isTrue();
		assertThat(LexicalGrammar.isNumber("1e-05")).isTrue();
		assertThat(LexicalGrammar.isNumber("2.5E+20")).isTrue();
		assertThat(LexicalGrammar.isNumber("1.")).isFalse();
		assertThat(LexicalGrammar.isNumber("e5")).isFalse();
		assertThat(LexicalGrammar.isNumberOrName("rbf")).isTrue();
	}

	@Test
	@DisplayName("choices split on commas with surrounding blanks removed")
	void splitChoices() {
		assertThat(LexicalGrammar.splitChoices("rbf, poly ,linear")).containsExactly("rbf", "poly", "linear");
	}

	@Test
	@DisplayName("composed fragments match whole lines only")
	void fullLineCapture() {
		Pattern pattern = LexicalGrammar.fullLine(LexicalGrammar.capture("name", LexicalGrammar.NAME)
				+ "\\s*=\\s*" + LexicalGrammar.capture("value", LexicalGrammar.NUMBER));

		Matcher matcher = pattern.matcher("alpha = 1e-3");
		assertThat(matcher.matches()).isTrue();
		assertThat(matcher.group("name")).isEqualTo("alpha");
		assertThat(matcher.group("value")).isEqualTo("1e-3");
		assertThat(pattern.matcher("alpha = 1e-3 extra").matches()).isFalse();
	}
}
