package io.modelvalidator.core.spi;

import io.modelvalidator.core.model.EvaluationResult;

/**
 * Pluggable rule evaluator SPI. Implementations interpret a rule grammar (the default is {@link
 * io.modelvalidator.core.engine.rules.PipeRuleEvaluator}) and map field values to error messages.
 *
 * <p>The locale travels with each {@link EvaluationRequest}; implementations MUST NOT keep
 * per-call state, so a single instance can serve any number of validators.
 */
public interface RuleEvaluator {

    /**
     * Evaluates every field of the request's rule spec against the request's values.
     *
     * <p>For each field the rules run in declared order and the first failing rule ends that field's
     * evaluation, so a field carries at most one message per pass.
     *
     * @param request plain field values, rules, translated messages and the locale
     * @return the per-field errors, never null
     * @throws io.modelvalidator.core.error.RuleConfigurationException if a rule expression is
     *     malformed or names an unknown rule
     */
    EvaluationResult evaluate(EvaluationRequest request);
}
