package io.modelvalidator.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.modelvalidator.core.engine.rules.PipeRuleEvaluator;
import io.modelvalidator.core.error.RuleSyntaxException;
import io.modelvalidator.core.error.UnknownRuleException;
import io.modelvalidator.core.model.EvaluationResult;
import io.modelvalidator.core.model.ObservableMapModel;
import io.modelvalidator.core.model.RuleSpec;
import io.modelvalidator.core.model.ValidationConfig;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ReactiveModelValidator}. */
@DisplayName("ReactiveModelValidator")
class ReactiveModelValidatorTest {

    private static ReactiveModelValidator validator(Map<String, String> rules, Object model) {
        return new ReactiveModelValidator(
                ValidationConfig.builder().rules(rules).model(model).build());
    }

    private static Map<String, Object> mapOf(Object... keysAndValues) {
        Map<String, Object> map = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            map.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }

    /** Default evaluation, except that a {@code name} equal to {@code poison} fails the pass. */
    private static ValidationEngine engineFailingOn(String poison) {
        var rules = new PipeRuleEvaluator();
        return new ValidationEngine(request -> {
            if (poison.equals(request.value("name"))) {
                throw new UnknownRuleException("rule exploded", "name", poison);
            }
            return rules.evaluate(request);
        });
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("required name on empty string fails form validation")
        void requiredNameOnEmptyString() {
            var v = validator(Map.of("name", "required"), mapOf("name", ""));

            assertThat(v.validateForm()).isFalse();
            assertThat(v.errorCount()).isEqualTo(1);
            assertThat(v.errors().get("name")).contains("The name field is required.");
        }

        @Test
        @DisplayName("mutating a numeric field to text re-validates and shows the error")
        void mutationToNonNumericShowsError() {
            var model = ObservableMapModel.of("age", 12);
            var v = validator(Map.of("age", "numeric|max:99"), model);
            assertThat(v.isValid()).isTrue();

            model.put("age", "x");

            assertThat(v.isValid()).isFalse();
            assertThat(v.errors().get("age")).containsExactly("The age must be a number.");
            assertThat(v.showErrorsOnField("age")).isTrue();
        }

        @Test
        @DisplayName("required_without clears once the other field is set")
        void requiredWithoutClearsWhenOtherFieldSet() {
            var model = ObservableMapModel.of("age", null, "birthday", null);
            var v = validator(Map.of("birthday", "date|required_without:age"), model);

            assertThat(v.errors().get("birthday")).contains("The birthday field is required when age is empty.");

            model.put("age", 30);

            assertThat(v.errors()).doesNotContainKey("birthday");
            assertThat(v.isValid()).isTrue();
        }

        @Test
        @DisplayName("manual mode ignores mutations until validated explicitly")
        void manualModeWaitsForExplicitValidation() {
            var model = ObservableMapModel.of("name", "Tim");
            var v = new ReactiveModelValidator(ValidationConfig.builder()
                    .rules(Map.of("name", "required"))
                    .model(model)
                    .manual(true)
                    .build());

            model.put("name", "");

            assertThat(v.errorCount()).isZero();
            assertThat(v.isObservingModel()).isFalse();

            assertThat(v.validateField("name")).isFalse();
            assertThat(v.errorCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Touched fields")
    class TouchedFields {

        @Test
        void untouchedFieldsNeverShowErrors() {
            var v = validator(Map.of("name", "required", "email", "required|email"), mapOf("name", "", "email", ""));

            assertThat(v.errorCount()).isEqualTo(2);
            assertThat(v.showErrorsOnField("name")).isFalse();
            assertThat(v.showErrorsOnField("email")).isFalse();
            assertThat(v.isPristine()).isTrue();
        }

        @Test
        void validateFieldTouchesOnlyThatField() {
            var v = validator(Map.of("name", "required", "email", "required"), mapOf("name", "", "email", ""));

            assertThat(v.validateField("name")).isFalse();

            assertThat(v.fieldsThatMayShowErrors()).containsExactly("name");
            assertThat(v.showErrorsOnField("email")).isFalse();
            assertThat(v.errorCount()).isEqualTo(2);
            assertThat(v.isPristine()).isFalse();
        }

        @Test
        void validFieldIsTouchedToo() {
            var v = validator(Map.of("name", "required"), mapOf("name", "Tim"));

            assertThat(v.validateField("name")).isTrue();

            assertThat(v.showErrorsOnField("name")).isTrue();
            assertThat(v.errors()).isEmpty();
        }

        @Test
        void validateFormTouchesEveryFailingField() {
            var v = validator(
                    Map.of("a", "required", "b", "required", "c", "required"), mapOf("a", "", "b", null, "c", "ok"));

            assertThat(v.validateForm()).isFalse();

            assertThat(v.fieldsThatMayShowErrors()).containsExactlyInAnyOrder("a", "b");
            assertThat(v.showErrorsOnField("c")).isFalse();
        }

        @Test
        void fieldsThatMayShowErrorsIsReadOnly() {
            var v = validator(Map.of("name", "required"), mapOf("name", ""));
            v.validateForm();

            assertThatThrownBy(() -> v.fieldsThatMayShowErrors().add("other"))
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> v.fieldsThatMayShowErrors().clear())
                    .isInstanceOf(UnsupportedOperationException.class);
            assertThatThrownBy(() -> v.errors().remove("name")).isInstanceOf(UnsupportedOperationException.class);
            assertThat(v.showErrorsOnField("name")).isTrue();
        }
    }

    @Nested
    @DisplayName("Derived state")
    class DerivedState {

        @Test
        void satisfyingModelIsValid() {
            var v = validator(
                    Map.of("name", "required", "age", "numeric|max:99", "email", "email"),
                    mapOf("name", "Tim", "age", 12, "email", "tim@example.com"));

            assertThat(v.validateForm()).isTrue();
            assertThat(v.isValid()).isTrue();
            assertThat(v.errorCount()).isZero();
            assertThat(v.getLastResult()).isEqualTo(EvaluationResult.valid());
        }

        @Test
        void isValidTracksEveryPassNotOnlyFormValidation() {
            var model = ObservableMapModel.of("name", "Tim", "age", 12);
            var v = validator(Map.of("name", "required", "age", "numeric"), model);

            model.put("age", "twelve");
            assertThat(v.isValid()).isFalse();
            assertThat(v.errorCount()).isEqualTo(1);

            model.put("age", 12);
            assertThat(v.isValid()).isTrue();
        }

        @Test
        void fieldValidationEvaluatesWholeModel() {
            var model = ObservableMapModel.of("name", "", "age", 12);
            var v = validator(Map.of("name", "required", "age", "numeric"), model);

            model.put("age", 13);

            assertThat(v.errors()).containsOnlyKeys("name");
            assertThat(v.showErrorsOnField("name")).isFalse();
            assertThat(v.showErrorsOnField("age")).isTrue();
        }

        @Test
        void errorsMapIsFreshPerPass() {
            var model = ObservableMapModel.of("name", "");
            var v = validator(Map.of("name", "required"), model);
            var before = v.errors();

            model.put("name", "Tim");

            assertThat(before).containsKey("name");
            assertThat(v.errors()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        void withoutModelRequiredFieldsFail() {
            var v = validator(Map.of("name", "required"), null);

            assertThat(v.getModel()).isNull();
            assertThat(v.isValid()).isFalse();
            assertThat(v.validateField("name")).isFalse();
            assertThat(v.isObservingModel()).isFalse();
        }

        @Test
        void setModelClearsTouchedFieldsEvenWithIdenticalErrors() {
            var v = validator(Map.of("name", "required"), mapOf("name", ""));
            v.validateForm();
            assertThat(v.showErrorsOnField("name")).isTrue();

            v.setModel(mapOf("name", ""));

            assertThat(v.fieldsThatMayShowErrors()).isEmpty();
            assertThat(v.isPristine()).isTrue();
            assertThat(v.errorCount()).isEqualTo(1);
        }

        @Test
        void setModelWithSameInstanceKeepsState() {
            var model = mapOf("name", "");
            var v = validator(Map.of("name", "required"), model);
            v.validateForm();

            v.setModel(model);

            assertThat(v.showErrorsOnField("name")).isTrue();
        }

        @Test
        void setModelMovesSubscriptionToNewModel() {
            var first = ObservableMapModel.of("name", "Tim");
            var second = ObservableMapModel.of("name", "Ann");
            var v = validator(Map.of("name", "required"), first);

            v.setModel(second);
            first.put("name", "");

            assertThat(first.subscriberCount()).isZero();
            assertThat(second.subscriberCount()).isEqualTo(1);
            assertThat(v.isValid()).isTrue();
            assertThat(v.getModel()).isSameAs(second);

            second.put("name", "");
            assertThat(v.isValid()).isFalse();
        }

        @Test
        void resetIsIdempotent() {
            var model = ObservableMapModel.of("name", "", "age", "x");
            var v = validator(Map.of("name", "required", "age", "numeric"), model);
            v.validateForm();

            v.reset();
            var errorsAfterOnce = v.errors();
            var touchedAfterOnce = Set.copyOf(v.fieldsThatMayShowErrors());
            v.reset();

            assertThat(v.errors()).isEqualTo(errorsAfterOnce);
            assertThat(v.fieldsThatMayShowErrors()).isEqualTo(touchedAfterOnce).isEmpty();
            assertThat(v.errorCount()).isEqualTo(2);
        }

        @Test
        void setRulesResets() {
            var v = validator(Map.of("name", "required"), mapOf("name", "", "age", "x"));
            v.validateForm();

            v.setRules(RuleSpec.of(Map.of("age", "numeric")));

            assertThat(v.getRules().fields()).containsExactly("age");
            assertThat(v.errors()).containsOnlyKeys("age");
            assertThat(v.isPristine()).isTrue();
        }

        @Test
        void closeDetachesWithoutTouchingModel() {
            var model = ObservableMapModel.of("name", "Tim");
            var v = validator(Map.of("name", "required"), model);

            v.close();
            v.close();
            model.put("name", "");

            assertThat(model.subscriberCount()).isZero();
            assertThat(model.get("name")).isEqualTo("");
            assertThat(v.isValid()).isTrue();
        }

        @Test
        void bulkReplaceValidatesFormAndTouchesFailingFields() {
            var model = ObservableMapModel.of("name", "Tim", "email", "tim@example.com");
            var v = validator(Map.of("name", "required", "email", "email"), model);

            model.replaceAll(mapOf("name", "", "email", "not-an-email"));

            assertThat(v.fieldsThatMayShowErrors()).containsExactlyInAnyOrder("name", "email");
            assertThat(v.errorCount()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("Configuration errors")
    class ConfigurationErrors {

        @Test
        void constructorPropagatesMalformedRule() {
            var config = ValidationConfig.builder().rules(Map.of("age", "max:abc")).build();

            assertThatThrownBy(() -> new ReactiveModelValidator(config))
                    .isInstanceOf(RuleSyntaxException.class)
                    .hasMessageContaining("age");
        }

        @Test
        void failedConstructionLeavesModelUnobserved() {
            var model = ObservableMapModel.of("age", 12);
            var config = ValidationConfig.builder()
                    .rules(Map.of("age", "max:abc"))
                    .model(model)
                    .build();

            assertThatThrownBy(() -> new ReactiveModelValidator(config)).isInstanceOf(RuleSyntaxException.class);

            assertThat(model.subscriberCount()).isZero();
            model.put("age", 13);
            assertThat(model.get("age")).isEqualTo(13);
        }

        @Test
        void setModelClearsTouchedFieldsEvenWhenPassFails() {
            var v = new ReactiveModelValidator(
                    ValidationConfig.builder()
                            .rules(Map.of("name", "required"))
                            .model(mapOf("name", ""))
                            .build(),
                    null,
                    engineFailingOn("boom"));
            v.validateForm();
            assertThat(v.fieldsThatMayShowErrors()).containsExactly("name");
            var next = mapOf("name", "boom");

            assertThatThrownBy(() -> v.setModel(next)).isInstanceOf(UnknownRuleException.class);

            assertThat(v.getModel()).isSameAs(next);
            assertThat(v.fieldsThatMayShowErrors()).isEmpty();
            assertThat(v.isPristine()).isTrue();
        }

        @Test
        void setRulesClearsTouchedFieldsEvenWhenPassFails() {
            var v = validator(Map.of("name", "required"), mapOf("name", ""));
            v.validateForm();

            assertThatThrownBy(() -> v.setRules(RuleSpec.of(Map.of("name", "bogus"))))
                    .isInstanceOf(UnknownRuleException.class);

            assertThat(v.isPristine()).isTrue();
            assertThat(v.errors()).containsOnlyKeys("name");
        }

        @Test
        void setRulesPropagatesUnknownRule() {
            var v = validator(Map.of("name", "required"), mapOf("name", "Tim"));

            assertThatThrownBy(() -> v.setRules(RuleSpec.of(Map.of("name", "required|bogus"))))
                    .isInstanceOf(UnknownRuleException.class);
        }

        @Test
        void mutatingCallPropagatesEvaluatorFailure() {
            var engine = new ValidationEngine(request -> {
                if ("boom".equals(request.value("name"))) {
                    throw new UnknownRuleException("rule exploded", "name", "boom");
                }
                return EvaluationResult.valid();
            });
            var model = ObservableMapModel.of("name", "Tim");
            var v = new ReactiveModelValidator(
                    ValidationConfig.builder()
                            .rules(Map.of("name", "required"))
                            .model(model)
                            .build(),
                    null,
                    engine);

            assertThatThrownBy(() -> model.put("name", "boom")).isInstanceOf(UnknownRuleException.class);
            assertThat(v.isValid()).isTrue();
        }

        @Test
        void validateFormPropagatesMalformedRuleAddedLater() {
            var v = validator(Map.of("name", "required"), mapOf("name", "Tim"));

            assertThatThrownBy(() -> v.setRules(RuleSpec.of(Map.of("name", "between:1"))))
                    .isInstanceOf(RuleSyntaxException.class);
            assertThatThrownBy(v::validateForm).isInstanceOf(RuleSyntaxException.class);
            assertThat(v.getRules().rulesFor("name")).isEqualTo("between:1");
        }
    }
}
