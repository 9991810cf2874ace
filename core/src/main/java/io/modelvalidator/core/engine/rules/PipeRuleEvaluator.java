package io.modelvalidator.core.engine.rules;

import io.modelvalidator.core.error.UnknownRuleException;
import io.modelvalidator.core.model.EvaluationResult;
import io.modelvalidator.core.spi.EvaluationRequest;
import io.modelvalidator.core.spi.RuleEvaluator;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default {@link RuleEvaluator} for pipe-separated rule expressions such as {@code
 * required|email} or {@code date|required_without:age}.
 *
 * <p>Fields are evaluated in rule-spec order, rules in declared order; the first failing rule of a
 * field produces its only message. Messages come from the custom messages of the request (keyed
 * {@code rule.field} first, then {@code rule}) or from the built-in catalog for the request's
 * locale. Every rule of every field is checked for unknown names and malformed parameters before
 * any value is looked at, so configuration errors surface regardless of the model's content.
 *
 * <p>Stateless and thread-safe.
 */
public final class PipeRuleEvaluator implements RuleEvaluator {

    @Override
    public EvaluationResult evaluate(EvaluationRequest request) {
        Map<String, List<ParsedRule>> compiled = compile(request);
        MessageCatalog catalog = MessageCatalog.forLocale(request.locale());
        Map<String, List<String>> errors = new LinkedHashMap<>();

        compiled.forEach((field, rules) -> {
            Object value = RuleContext.lookup(request.values(), field);
            for (ParsedRule rule : rules) {
                BuiltInRule builtIn = BuiltInRule.byName(rule.name()).orElseThrow();
                if (!builtIn.implicit() && Values.isAbsent(value)) {
                    continue;
                }
                RuleContext ctx = new RuleContext(field, value, rule, rules, request);
                if (!builtIn.passes(ctx)) {
                    errors.put(field, List.of(message(builtIn, ctx, request, catalog)));
                    break;
                }
            }
        });
        return EvaluationResult.of(errors);
    }

    /** Parses every expression and validates rule names and parameters. */
    private static Map<String, List<ParsedRule>> compile(EvaluationRequest request) {
        Map<String, List<ParsedRule>> compiled = new LinkedHashMap<>();
        request.rules().asMap().forEach((field, expression) -> {
            List<ParsedRule> rules = new ArrayList<>();
            for (ParsedRule rule : RuleExpressionParser.parse(field, expression)) {
                BuiltInRule builtIn = BuiltInRule.byName(rule.name())
                        .orElseThrow(() -> new UnknownRuleException(
                                "Unknown validation rule '" + rule.name() + "' for field '" + field + "'",
                                field,
                                rule.token()));
                builtIn.checkParams(rule, field);
                rules.add(rule);
            }
            compiled.put(field, rules);
        });
        return compiled;
    }

    private static String message(
            BuiltInRule rule, RuleContext ctx, EvaluationRequest request, MessageCatalog catalog) {
        Map<String, String> custom = request.customMessages();
        String template = custom.get(rule.ruleName() + "." + ctx.field());
        if (template == null) {
            template = custom.get(rule.ruleName());
        }
        if (template == null) {
            template = catalog.template(rule.messageKey(ctx));
        }
        return MessageCatalog.format(
                template, BuiltInRule.withAttribute(rule.placeholders(ctx), ctx.displayName(ctx.field())));
    }
}
