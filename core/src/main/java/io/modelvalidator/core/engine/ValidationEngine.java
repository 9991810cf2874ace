package io.modelvalidator.core.engine;

import io.modelvalidator.core.engine.rules.PipeRuleEvaluator;
import io.modelvalidator.core.l10n.NoopLocalizationProvider;
import io.modelvalidator.core.model.EvaluationResult;
import io.modelvalidator.core.model.RuleSpec;
import io.modelvalidator.core.spi.EvaluationRequest;
import io.modelvalidator.core.spi.LocalizationProvider;
import io.modelvalidator.core.spi.RuleEvaluator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Runs one validation pass: normalizes the model, resolves the locale, translates message and
 * attribute-name keys, and delegates to the {@link RuleEvaluator}.
 *
 * <p>The locale is resolved per call and handed to the evaluator inside the request; nothing is
 * written to shared state, so one engine may serve many validators. Rule configuration errors
 * raised by the evaluator propagate unchanged.
 */
public final class ValidationEngine {

    /** Used when the localization provider reports no usable language. */
    static final Locale FALLBACK_LOCALE = Locale.ENGLISH;

    private final RuleEvaluator evaluator;

    /** Creates an engine backed by the default {@link PipeRuleEvaluator}. */
    public ValidationEngine() {
        this(new PipeRuleEvaluator());
    }

    public ValidationEngine(RuleEvaluator evaluator) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
    }

    public RuleEvaluator evaluator() {
        return evaluator;
    }

    /**
     * Evaluates the whole model against the rule spec.
     *
     * @param model the model in any representation accepted by {@link ModelSnapshots}, or {@code
     *     null}
     * @param rules the rule spec
     * @param customMessages selector → message key, translated before evaluation; may be null
     * @param attributeNames field → display-name key, translated before evaluation; may be null
     * @param localization localization adapter; {@code null} falls back to {@link
     *     NoopLocalizationProvider}
     * @return a fresh, immutable result
     */
    public EvaluationResult check(
            Object model,
            RuleSpec rules,
            Map<String, String> customMessages,
            Map<String, String> attributeNames,
            LocalizationProvider localization) {
        Objects.requireNonNull(rules, "rules must not be null");
        LocalizationProvider l10n = localization != null ? localization : NoopLocalizationProvider.INSTANCE;

        Locale locale = resolveLocale(l10n.language());
        EvaluationRequest request = new EvaluationRequest(
                ModelSnapshots.toFieldValues(model),
                rules,
                translateKeys(customMessages, l10n),
                translateKeys(attributeNames, l10n),
                locale);
        return evaluator.evaluate(request);
    }

    /**
     * Picks the evaluator locale from the first two characters of a language code. Codes shorter
     * than two characters resolve to {@link #FALLBACK_LOCALE}.
     */
    static Locale resolveLocale(String language) {
        if (language == null || language.length() < 2) {
            return FALLBACK_LOCALE;
        }
        return new Locale(language.substring(0, 2).toLowerCase(Locale.ROOT));
    }

    private static Map<String, String> translateKeys(Map<String, String> keys, LocalizationProvider l10n) {
        Map<String, String> translated = new LinkedHashMap<>();
        if (keys == null) {
            return translated;
        }
        keys.forEach((selector, key) -> {
            if (selector == null || key == null) {
                return;
            }
            String text = l10n.translate(key);
            translated.put(selector, text != null ? text : key);
        });
        return translated;
    }
}
