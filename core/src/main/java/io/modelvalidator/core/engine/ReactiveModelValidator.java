package io.modelvalidator.core.engine;

import io.modelvalidator.core.l10n.NoopLocalizationProvider;
import io.modelvalidator.core.model.EvaluationResult;
import io.modelvalidator.core.model.RuleSpec;
import io.modelvalidator.core.model.ValidationConfig;
import io.modelvalidator.core.spi.LocalizationProvider;
import io.modelvalidator.core.spi.Subscription;
import io.modelvalidator.core.spi.ValidationStateListener;
import io.modelvalidator.core.spi.ValidationStateListener.Trigger;
import io.modelvalidator.core.spi.ValidationStateListener.ValidationStateEvent;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ModelValidator} that keeps its state current while the model is mutated.
 *
 * <p>When the model is an {@link io.modelvalidator.core.spi.ObservableModel} and the config is not
 * manual, every qualifying mutation re-validates synchronously before the mutating call returns.
 * Each pass evaluates the whole model because rules such as {@code required_without} depend on
 * other fields.
 *
 * <p>Usable outside any UI context (e.g. from a store). Not thread-safe: confine an instance to
 * one thread.
 */
public final class ReactiveModelValidator implements ModelValidator, ModelBinding.Target {

    private static final Logger LOG = LoggerFactory.getLogger(ReactiveModelValidator.class);

    private final ValidationEngine engine;
    private final LocalizationProvider localization;
    private final Map<String, String> customErrors;
    private final Map<String, String> attributeNames;
    private final boolean manual;
    private final DirtyFieldLedger ledger = new DirtyFieldLedger();
    private final ModelBinding binding = new ModelBinding(this);
    private final List<ValidationStateListener> stateListeners = new CopyOnWriteArrayList<>();

    private RuleSpec rules;
    private Object model;
    private EvaluationResult lastResult = EvaluationResult.valid();

    /** Creates a validator without localization and with the default rule evaluator. */
    public ReactiveModelValidator(ValidationConfig config) {
        this(config, null);
    }

    /**
     * Creates a validator with the default rule evaluator.
     *
     * @param config rules, optional model and message keys
     * @param localization adapter to the application's i18n, or {@code null} for none
     */
    public ReactiveModelValidator(ValidationConfig config, LocalizationProvider localization) {
        this(config, localization, new ValidationEngine());
    }

    /**
     * Creates a validator and runs the initial validation pass.
     *
     * @throws io.modelvalidator.core.error.RuleConfigurationException if the rules cannot be
     *     evaluated
     */
    public ReactiveModelValidator(ValidationConfig config, LocalizationProvider localization, ValidationEngine engine) {
        Objects.requireNonNull(config, "config must not be null");
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.localization = localization != null ? localization : NoopLocalizationProvider.INSTANCE;
        this.customErrors = config.customErrors();
        this.attributeNames = config.attributeNames();
        this.manual = config.manual();
        this.rules = config.rules();
        if (config.model() != null) {
            try {
                setModel(config.model());
            } catch (RuntimeException e) {
                // the caller never receives a validator to close
                binding.unbind();
                throw e;
            }
        } else {
            // initial check against no model
            lastResult = check(Trigger.RESET, null);
        }
    }

    @Override
    public void setModel(Object model) {
        if (this.model == model) {
            return;
        }
        this.model = model;
        binding.bind(model, manual);
        reset();
    }

    @Override
    public Object getModel() {
        return model;
    }

    @Override
    public void setRules(RuleSpec rules) {
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
        LOG.info("Rules replaced: fields={}", rules.fields());
        reset();
    }

    @Override
    public RuleSpec getRules() {
        return rules;
    }

    @Override
    public void reset() {
        ledger.clear();
        EvaluationResult result = check(Trigger.RESET, null);
        apply(Trigger.RESET, null, result);
    }

    @Override
    public boolean validateField(String field) {
        Objects.requireNonNull(field, "field must not be null");
        EvaluationResult result = check(Trigger.FIELD, field);
        ledger.markDirty(field);
        apply(Trigger.FIELD, field, result);
        return !result.has(field);
    }

    @Override
    public boolean validateForm() {
        EvaluationResult result = check(Trigger.FORM, null);
        for (String field : result.fieldsWithErrors()) {
            ledger.markDirty(field);
        }
        apply(Trigger.FORM, null, result);
        return result.isValid();
    }

    @Override
    public Map<String, List<String>> errors() {
        return lastResult.errors();
    }

    @Override
    public int errorCount() {
        return lastResult.errorCount();
    }

    @Override
    public boolean isValid() {
        return errorCount() == 0;
    }

    @Override
    public EvaluationResult getLastResult() {
        return lastResult;
    }

    @Override
    public boolean showErrorsOnField(String field) {
        return ledger.has(field);
    }

    @Override
    public Set<String> fieldsThatMayShowErrors() {
        return ledger.view();
    }

    @Override
    public boolean isPristine() {
        return ledger.isEmpty();
    }

    /** Whether a mutation subscription is currently installed. */
    public boolean isObservingModel() {
        return binding.isSubscribed();
    }

    @Override
    public Subscription addStateListener(ValidationStateListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        stateListeners.add(listener);
        AtomicBoolean active = new AtomicBoolean(true);
        return () -> {
            if (active.compareAndSet(true, false)) {
                stateListeners.remove(listener);
            }
        };
    }

    @Override
    public void close() {
        binding.unbind();
    }

    private EvaluationResult check(Trigger trigger, String field) {
        long start = System.nanoTime();
        EvaluationResult result = engine.check(model, rules, customErrors, attributeNames, localization);
        if (LOG.isDebugEnabled()) {
            LOG.debug(
                    "validation.pass trigger={} field={} error_count={} duration_ms={}",
                    trigger.name().toLowerCase(Locale.ROOT),
                    field,
                    result.errorCount(),
                    (System.nanoTime() - start) / 1_000_000);
        }
        return result;
    }

    private void apply(Trigger trigger, String field, EvaluationResult result) {
        lastResult = result;
        if (stateListeners.isEmpty()) {
            return;
        }
        ValidationStateEvent event = new ValidationStateEvent(trigger, field, result, ledger.snapshot());
        for (ValidationStateListener listener : stateListeners) {
            try {
                listener.onValidated(event);
            } catch (Exception e) {
                LOG.warn("ValidationStateListener.onValidated failed", e);
            }
        }
    }

    @Override
    public String toString() {
        return "ReactiveModelValidator[fields=" + rules.fields() + ", errorCount=" + errorCount() + ", touched="
                + ledger.view() + "]";
    }
}
