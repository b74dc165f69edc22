package org.javai.configspace.io.forbidden;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.javai.configspace.io.UnparsableForbiddenClauseException;
import org.javai.configspace.io.UnsupportedForbiddenOperatorException;
import org.javai.configspace.model.ConfigurationSpace;
import org.javai.configspace.model.ForbiddenClause;
import org.javai.configspace.model.Hyperparameter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ForbiddenClauseEngine")
class ForbiddenClauseEngineTest {

	private final ForbiddenClauseEngine engine = new ForbiddenClauseEngine();

	@Nested
	@DisplayName("Parsing")
	class ParsingTests {

		@Test
		@DisplayName("reads a conjunction of equalities")
		void readsEqualities() {
			ForbiddenClause.And clause = engine.parse(1, "{kernel=linear, degree = 5}");

			assertThat(clause.literals()).containsExactly(
					new ForbiddenClause.Equals("kernel", "linear"),
					new ForbiddenClause.Equals("degree", "5"));
		}

		@Test
		@DisplayName("reads a single equality as a one-element conjunction")
		void readsSingleEquality() {
			assertThat(engine.parse(1, "{a=1}").components()).containsExactly(new ForbiddenClause.Equals("a", "1"));
		}

		@Test
		@DisplayName("rejects operators other than =")
		void rejectsOtherOperators() {
			assertThatThrownBy(() -> engine.parse(4, "{a=1, b != 2}"))
					.isInstanceOf(UnsupportedForbiddenOperatorException.class)
					.satisfies(e -> {
						UnsupportedForbiddenOperatorException ex = (UnsupportedForbiddenOperatorException) e;
						assertThat(ex.operator()).isEqualTo("!=");
						assertThat(ex.lineNumber()).isEqualTo(4);
					});
			assertThatThrownBy(() -> engine.parse(4, "{a in 1}"))
					.isInstanceOf(UnsupportedForbiddenOperatorException.class);
			assertThatThrownBy(() -> engine.parse(4, "{a < 1}"))
					.isInstanceOf(UnsupportedForbiddenOperatorException.class);
			assertThatThrownBy(() -> engine.parse(4, "{a == 1}"))
					.isInstanceOf(UnsupportedForbiddenOperatorException.class);
		}

		@Test
		@DisplayName("rejects broken literals")
		void rejectsBrokenLiterals() {
			assertThatThrownBy(() -> engine.parse(2, "{a=}")).isInstanceOf(UnparsableForbiddenClauseException.class);
			assertThatThrownBy(() -> engine.parse(2, "{a=1 b=2}")).isInstanceOf(UnparsableForbiddenClauseException.class);
			assertThatThrownBy(() -> engine.parse(2, "{a=1} x")).isInstanceOf(UnparsableForbiddenClauseException.class);
			assertThatThrownBy(() -> engine.parse(2, "{}")).isInstanceOf(UnparsableForbiddenClauseException.class);
		}
	}

	@Nested
	@DisplayName("Expansion")
	class ExpansionTests {

		@Test
		@DisplayName("expands a membership into one conjunction per value")
		void expandsMembership() {
			ForbiddenClause clause = ForbiddenClause.And.of(
					new ForbiddenClause.In("a", List.of("1", "2")),
					new ForbiddenClause.Equals("b", "3"));

			List<String> rendered = engine.expand(clause).stream().map(engine::render).toList();

			assertThat(rendered).containsExactly("{a=1, b=3}", "{a=2, b=3}");
		}

		@Test
		@DisplayName("takes the Cartesian product of several memberships, memberships first")
		void expandsProduct() {
			ForbiddenClause clause = ForbiddenClause.And.of(
					new ForbiddenClause.Equals("c", "x"),
					new ForbiddenClause.In("a", List.of("1", "2")),
					new ForbiddenClause.In("b", List.of("3", "4")));

			List<String> rendered = engine.expand(clause).stream().map(engine::render).toList();

			assertThat(rendered).containsExactly(
					"{a=1, b=3, c=x}", "{a=1, b=4, c=x}", "{a=2, b=3, c=x}", "{a=2, b=4, c=x}");
		}

		@Test
		@DisplayName("leaves a clause of equalities unchanged")
		void keepsPlainClause() {
			ForbiddenClause clause = new ForbiddenClause.Equals("a", "1");

			assertThat(engine.expand(clause)).containsExactly(ForbiddenClause.And.of(clause));
		}

		@Test
		@DisplayName("renders all clauses of a space in clause order")
		void rendersSpace() {
			ConfigurationSpace space = new ConfigurationSpace();
			space.addHyperparameter(Hyperparameter.Categorical.of("a", List.of("1", "2")));
			space.addHyperparameter(Hyperparameter.Categorical.of("b", List.of("3", "4")));
			space.addForbiddenClause(ForbiddenClause.And.of(new ForbiddenClause.Equals("b", "4")));
			space.addForbiddenClause(new ForbiddenClause.In("a", List.of("2", "1")));

			assertThat(engine.renderAll(space)).containsExactly("{b=4}", "{a=2}", "{a=1}");
		}
	}
}
