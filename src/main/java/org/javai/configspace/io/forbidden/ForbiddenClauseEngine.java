package org.javai.configspace.io.forbidden;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.configspace.io.UnparsableForbiddenClauseException;
import org.javai.configspace.io.UnsupportedForbiddenOperatorException;
import org.javai.configspace.io.grammar.ClauseToken;
import org.javai.configspace.io.grammar.ClauseToken.TokenType;
import org.javai.configspace.io.grammar.ForbiddenClauseTokenizer;
import org.javai.configspace.model.ConfigurationSpace;
import org.javai.configspace.model.ForbiddenClause;
import org.javai.configspace.model.ForbiddenClauseVisitor;

/**
 * Reads forbidden-clause literals into conjunctions of equalities and, for writing, expands
 * membership atomics into the equivalent set of plain conjunctions.
 * <p>
 * Both dialects express a forbidden combination as {@code {name=value, name=value, ...}}: a
 * conjunction of equalities. {@link ForbiddenClause.In} therefore never reaches the text.
 */
public final class ForbiddenClauseEngine {

	private static final Set<String> OPERATOR_WORDS = Set.of("in", "<", ">");

	/**
	 * Parses one literal such as {@code {a=1, b=x}}.
	 *
	 * @throws UnsupportedForbiddenOperatorException if a triple uses anything but {@code =}
	 * @throws UnparsableForbiddenClauseException if the literal is structurally broken
	 */
	public ForbiddenClause.And parse(int lineNumber, String literal) {
		List<ClauseToken> tokens = new ForbiddenClauseTokenizer(literal, lineNumber).tokenize();
		TokenCursor cursor = new TokenCursor(tokens);

		expect(cursor, TokenType.LBRACE, lineNumber, literal, "expected '{'");
		List<ForbiddenClause> equalities = new ArrayList<>();
		while (true) {
			ClauseToken name = expect(cursor, TokenType.WORD, lineNumber, literal, "expected a hyperparameter name");
			ClauseToken operator = cursor.advance();
			if (!isOperator(operator)) {
				throw new UnparsableForbiddenClauseException(lineNumber, literal,
						"expected an operator after '" + name.value() + "', found " + operator);
			}
			if (!"=".equals(operator.value())) {
				throw new UnsupportedForbiddenOperatorException(lineNumber, literal, operator.value());
			}
			ClauseToken value = expect(cursor, TokenType.WORD, lineNumber, literal,
					"expected a value for '" + name.value() + "'");
			equalities.add(new ForbiddenClause.Equals(name.value(), value.value()));

			ClauseToken separator = cursor.advance();
			if (separator.isType(TokenType.RBRACE)) {
				break;
			}
			if (!separator.isType(TokenType.COMMA)) {
				throw new UnparsableForbiddenClauseException(lineNumber, literal,
						"expected ',' or '}' at position " + separator.position() + ", found " + separator);
			}
		}
		expect(cursor, TokenType.EOF, lineNumber, literal, "unexpected input after '}'");
		return new ForbiddenClause.And(equalities);
	}

	/**
	 * Expands a clause into conjunctions that contain only equalities.
	 * <p>
	 * A clause without membership atomics is returned as a single conjunction of its literals.
	 * Otherwise the Cartesian product of all membership value sets is taken; each combination
	 * yields one equality per membership atomic (in visit order) followed by all plain atomics.
	 */
	public List<ForbiddenClause.And> expand(ForbiddenClause clause) {
		List<ForbiddenClause.In> memberships = new ArrayList<>();
		List<ForbiddenClause> plain = new ArrayList<>();
		for (ForbiddenClause literal : clause.literals()) {
			literal.accept(new ForbiddenClauseVisitor<Void>() {
				@Override
				public Void visitEquals(ForbiddenClause.Equals equals) {
					plain.add(equals);
					return null;
				}

				@Override
				public Void visitIn(ForbiddenClause.In in) {
					memberships.add(in);
					return null;
				}

				@Override
				public Void visitAnd(ForbiddenClause.And conjunction) {
					throw new IllegalStateException("literals() never yields a conjunction");
				}
			});
		}
		if (memberships.isEmpty()) {
			return List.of(new ForbiddenClause.And(plain));
		}

		List<ForbiddenClause.And> expanded = new ArrayList<>();
		for (List<String> combination : cartesianProduct(memberships)) {
			List<ForbiddenClause> components = new ArrayList<>(memberships.size() + plain.size());
			for (int i = 0; i < memberships.size(); i++) {
				components.add(new ForbiddenClause.Equals(memberships.get(i).hyperparameter(), combination.get(i)));
			}
			components.addAll(plain);
			expanded.add(new ForbiddenClause.And(components));
		}
		return expanded;
	}

	/**
	 * Renders a conjunction of equalities as {@code {name=value, name=value}}.
	 */
	public String render(ForbiddenClause.And conjunction) {
		return conjunction.literals().stream()
				.map(literal -> literal.accept(RENDERER))
				.collect(Collectors.joining(", ", "{", "}"));
	}

	/**
	 * Expands and renders every forbidden clause of the space, in clause and expansion order.
	 */
	public List<String> renderAll(ConfigurationSpace space) {
		List<String> lines = new ArrayList<>();
		for (ForbiddenClause clause : space.forbiddenClauses()) {
			for (ForbiddenClause.And conjunction : expand(clause)) {
				lines.add(render(conjunction));
			}
		}
		return lines;
	}

	private static List<List<String>> cartesianProduct(List<ForbiddenClause.In> memberships) {
		List<List<String>> combinations = new ArrayList<>();
		combinations.add(List.of());
		for (ForbiddenClause.In membership : memberships) {
			List<List<String>> next = new ArrayList<>(combinations.size() * membership.values().size());
			for (List<String> prefix : combinations) {
				for (String value : membership.values()) {
					List<String> combination = new ArrayList<>(prefix);
					combination.add(value);
					next.add(combination);
				}
			}
			combinations = next;
		}
		return combinations;
	}

	private static boolean isOperator(ClauseToken token) {
		return token.isType(TokenType.OPERATOR)
				|| (token.isType(TokenType.WORD) && OPERATOR_WORDS.contains(token.value()));
	}

	private static ClauseToken expect(TokenCursor cursor, TokenType type, int lineNumber, String literal,
			String detail) {
		ClauseToken token = cursor.advance();
		if (!token.isType(type)) {
			throw new UnparsableForbiddenClauseException(lineNumber, literal,
					detail + " at position " + token.position() + ", found " + token);
		}
		return token;
	}

	private static final ForbiddenClauseVisitor<String> RENDERER = new ForbiddenClauseVisitor<>() {
		@Override
		public String visitEquals(ForbiddenClause.Equals clause) {
			return clause.hyperparameter() + "=" + clause.value();
		}

		@Override
		public String visitIn(ForbiddenClause.In clause) {
			throw new IllegalStateException("Membership clause on '" + clause.hyperparameter()
					+ "' must be expanded before rendering");
		}

		@Override
		public String visitAnd(ForbiddenClause.And conjunction) {
			throw new IllegalStateException("Nested conjunctions are flattened before rendering");
		}
	};

	/**
	 * Sequential read access to a token list that always ends with EOF.
	 */
	private static final class TokenCursor {
		private final List<ClauseToken> tokens;
		private int current = 0;

		private TokenCursor(List<ClauseToken> tokens) {
			this.tokens = tokens;
		}

		private ClauseToken advance() {
			ClauseToken token = tokens.get(current);
			if (current < tokens.size() - 1) {
				current++;
			}
			return token;
		}
	}
}
