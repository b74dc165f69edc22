package org.javai.configspace.model;

/**
 * Visitor over the closed set of {@link Hyperparameter} variants.
 *
 * @param <R> the result type
 */
public interface HyperparameterVisitor<R> {

	R visitContinuous(Hyperparameter.Continuous continuous);

	R visitCategorical(Hyperparameter.Categorical categorical);

	R visitConstant(Hyperparameter.Constant constant);
}
