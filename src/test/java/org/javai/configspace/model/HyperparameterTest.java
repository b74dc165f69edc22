package org.javai.configspace.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("Hyperparameter")
class HyperparameterTest {

	@Nested
	@DisplayName("Continuous")
	class ContinuousTests {

		@Test
		@DisplayName("accepts a default on either bound")
		void acceptsDefaultOnBounds() {
			assertThat(Hyperparameter.Continuous.real("x", 0.0, 1.0, 0.0).defaultValue()).isEqualTo(0.0);
			assertThat(Hyperparameter.Continuous.real("x", 0.0, 1.0, 1.0).defaultValue()).isEqualTo(1.0);
		}

		@Test
		@DisplayName("rejects lower >= upper")
		void rejectsEmptyRange() {
			assertThatThrownBy(() -> Hyperparameter.Continuous.real("x", 1.0, 1.0, 1.0))
					.isInstanceOf(ValidationException.class)
					.hasMessageContaining("lower bound");
			assertThatThrownBy(() -> Hyperparameter.Continuous.real("x", 2.0, 1.0, 1.5))
					.isInstanceOf(ValidationException.class);
		}

		@Test
		@DisplayName("rejects a default outside the range")
		void rejectsDefaultOutsideRange() {
			assertThatThrownBy(() -> Hyperparameter.Continuous.integer("depth", 1, 10, 11))
					.isInstanceOf(ValidationException.class)
					.hasMessageContaining("outside");
		}

		@Test
		@DisplayName("integer parameters need integral bounds and default")
		void integerNeedsIntegralValues() {
			assertThatThrownBy(() -> new Hyperparameter.Continuous("n", 1.0, 10.0, 2.5, true, false, null))
					.isInstanceOf(ValidationException.class)
					.hasMessageContaining("integral");
		}

		@Test
		@DisplayName("log scale needs a positive lower bound")
		void logNeedsPositiveLower() {
			assertThatThrownBy(() -> Hyperparameter.Continuous.real("lr", 0.0, 1.0, 0.5).withLog(true))
					.isInstanceOf(ValidationException.class)
					.hasMessageContaining("positive lower bound");
		}

		@Test
		@DisplayName("quantization must be positive")
		void quantizationMustBePositive() {
			assertThatThrownBy(() -> Hyperparameter.Continuous.integer("n", 0, 100, 50).withQuantization(0.0))
					.isInstanceOf(ValidationException.class);
			assertThat(Hyperparameter.Continuous.integer("n", 0, 100, 50).withQuantization(5.0).hasQuantization())
					.isTrue();
		}

		@Test
		@DisplayName("legal values are numbers inside the range, integral for integer parameters")
		void legalValues() {
			Hyperparameter.Continuous depth = Hyperparameter.Continuous.integer("depth", 1, 10, 3);

			assertThat(depth.isLegalValue("4")).isTrue();
			assertThat(depth.isLegalValue("4.0")).isTrue();
			assertThat(depth.isLegalValue("4.5")).isFalse();
			assertThat(depth.isLegalValue("11")).isFalse();
			assertThat(depth.isLegalValue("deep")).isFalse();
		}

		@Test
		@DisplayName("values must be written in plain decimal or exponent notation")
		void legalValuesFollowNumberGrammar() {
			Hyperparameter.Continuous x = Hyperparameter.Continuous.real("x", 0.0, 10.0, 1.0);

			assertThat(x.isLegalValue("2")).isTrue();
			assertThat(x.isLegalValue("0.5e1")).isTrue();
			assertThat(x.isLegalValue(".5")).isTrue();
			assertThat(x.isLegalValue("2e0")).isTrue();
			assertThat(x.isLegalValue("2d")).isFalse();
			assertThat(x.isLegalValue("5f")).isFalse();
			assertThat(x.isLegalValue("0x1p1")).isFalse();
			assertThat(x.isLegalValue("Infinity")).isFalse();
		}

		@Test
		@DisplayName("rejects infinite bounds and defaults")
		void rejectsNonFiniteValues() {
			assertThatThrownBy(() -> Hyperparameter.Continuous.real("x", 0.0, Double.POSITIVE_INFINITY, 1.0))
					.isInstanceOf(ValidationException.class)
					.hasMessageContaining("non-finite");
			assertThatThrownBy(() -> Hyperparameter.Continuous.real("x", Double.NEGATIVE_INFINITY, 1.0, 0.0))
					.isInstanceOf(ValidationException.class);
			assertThatThrownBy(() -> Hyperparameter.Continuous.real("x", 0.0, 1.0, Double.NaN))
					.isInstanceOf(ValidationException.class);
		}
	}

	@Nested
	@DisplayName("Categorical")
	class CategoricalTests {

		@Test
		@DisplayName("of() uses the first choice as default")
		void ofUsesFirstChoice() {
			Hyperparameter.Categorical kernel = Hyperparameter.Categorical.of("kernel", List.of("rbf", "poly"));

			assertThat(kernel.defaultValue()).isEqualTo("rbf");
			assertThat(kernel.isLegalValue("poly")).isTrue();
			assertThat(kernel.isLegalValue("linear")).isFalse();
		}

		@Test
		@DisplayName("rejects repeated choices")
		void rejectsRepeatedChoices() {
			assertThatThrownBy(() -> Hyperparameter.Categorical.of("kernel", List.of("rbf", "rbf")))
					.isInstanceOf(ValidationException.class)
					.hasMessageContaining("more than once");
		}

		@Test
		@DisplayName("rejects a default that is not a choice")
		void rejectsUnknownDefault() {
			assertThatThrownBy(() -> new Hyperparameter.Categorical("kernel", List.of("rbf", "poly"), "linear"))
					.isInstanceOf(ValidationException.class);
		}

		@Test
		@DisplayName("rejects an empty choice list")
		void rejectsNoChoices() {
			assertThatThrownBy(() -> Hyperparameter.Categorical.of("kernel", List.of()))
					.isInstanceOf(ValidationException.class);
		}
	}

	@Test
	@DisplayName("names must be non-blank and free of whitespace")
	void namesAreChecked() {
		assertThatThrownBy(() -> new Hyperparameter.Constant(" ", "1")).isInstanceOf(ValidationException.class);
		assertThatThrownBy(() -> new Hyperparameter.Constant("a b", "1")).isInstanceOf(ValidationException.class);
		assertThat(new Hyperparameter.Constant("a(b)", "1").name()).isEqualTo("a(b)");
	}

	@Test
	@DisplayName("constant accepts only its own value")
	void constantLegalValue() {
		Hyperparameter.Constant seed = new Hyperparameter.Constant("seed", "42");

		assertThat(seed.isLegalValue("42")).isTrue();
		assertThat(seed.isLegalValue("43")).isFalse();
	}
}
