package io.modelvalidator.core.engine.rules;

import io.modelvalidator.core.error.RuleSyntaxException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Arrays;
import java.util.Date;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Rules understood by {@link PipeRuleEvaluator}. Implicit rules run even when the value is absent;
 * all others pass on absent values.
 */
enum BuiltInRule {
    REQUIRED("required", true, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return !Values.isEmpty(ctx.value());
        }
    },
    REQUIRED_IF("required_if", true, 2, 2, false) {
        @Override
        boolean passes(RuleContext ctx) {
            boolean triggered = Values.asText(ctx.valueOf(ctx.param(0))).equals(ctx.param(1));
            return !triggered || !Values.isEmpty(ctx.value());
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("other", ctx.displayName(ctx.param(0)), "value", ctx.param(1));
        }
    },
    REQUIRED_UNLESS("required_unless", true, 2, 2, false) {
        @Override
        boolean passes(RuleContext ctx) {
            boolean exempt = Values.asText(ctx.valueOf(ctx.param(0))).equals(ctx.param(1));
            return exempt || !Values.isEmpty(ctx.value());
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("other", ctx.displayName(ctx.param(0)), "value", ctx.param(1));
        }
    },
    REQUIRED_WITH("required_with", true, 1, -1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            boolean anyPresent = ctx.params().stream().anyMatch(f -> !Values.isEmpty(ctx.valueOf(f)));
            return !anyPresent || !Values.isEmpty(ctx.value());
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("values", ctx.displayNamesOfParams());
        }
    },
    REQUIRED_WITHOUT("required_without", true, 1, -1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            boolean anyMissing = ctx.params().stream().anyMatch(f -> Values.isEmpty(ctx.valueOf(f)));
            return !anyMissing || !Values.isEmpty(ctx.value());
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("values", ctx.displayNamesOfParams());
        }
    },
    ACCEPTED("accepted", true, 0, 0, false) {
        private final Set<String> accepted = Set.of("on", "yes", "1", "true");

        @Override
        boolean passes(RuleContext ctx) {
            return ctx.value() != null && accepted.contains(Values.asText(ctx.value()).toLowerCase(Locale.ROOT));
        }
    },
    NUMERIC("numeric", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return Values.toNumber(ctx.value()) != null;
        }
    },
    INTEGER("integer", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            BigDecimal number = Values.toNumber(ctx.value());
            if (number == null) {
                return false;
            }
            if (ctx.value() instanceof CharSequence text) {
                return INTEGER_TEXT.matcher(text.toString().trim()).matches();
            }
            return number.stripTrailingZeros().scale() <= 0;
        }
    },
    STRING("string", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return ctx.value() instanceof CharSequence;
        }
    },
    BOOLEAN("boolean", false, 0, 0, false) {
        private final Set<String> booleans = Set.of("true", "false", "0", "1");

        @Override
        boolean passes(RuleContext ctx) {
            return ctx.value() instanceof Boolean || booleans.contains(Values.asText(ctx.value()));
        }
    },
    EMAIL("email", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return ctx.value() instanceof CharSequence text && EMAIL_PATTERN.matcher(text).matches();
        }
    },
    URL("url", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            if (!(ctx.value() instanceof CharSequence text)) {
                return false;
            }
            try {
                URI uri = new URI(text.toString());
                return uri.getScheme() != null
                        && Set.of("http", "https", "ftp").contains(uri.getScheme().toLowerCase(Locale.ROOT))
                        && uri.getHost() != null;
            } catch (URISyntaxException e) {
                return false;
            }
        }
    },
    DATE("date", false, 0, 0, false) {
        private final List<Function<String, TemporalAccessor>> parsers = List.of(
                LocalDate::parse, LocalDateTime::parse, OffsetDateTime::parse, ZonedDateTime::parse, Instant::parse);

        @Override
        boolean passes(RuleContext ctx) {
            Object value = ctx.value();
            if (value instanceof TemporalAccessor || value instanceof Date || value instanceof Number) {
                return true;
            }
            if (!(value instanceof CharSequence text)) {
                return false;
            }
            for (Function<String, TemporalAccessor> parser : parsers) {
                try {
                    parser.apply(text.toString().trim());
                    return true;
                } catch (DateTimeParseException e) {
                    // try the next format
                }
            }
            return false;
        }
    },
    ALPHA("alpha", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return ALPHA_PATTERN.matcher(Values.asText(ctx.value())).matches();
        }
    },
    ALPHA_NUM("alpha_num", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return ALPHA_NUM_PATTERN.matcher(Values.asText(ctx.value())).matches();
        }
    },
    ALPHA_DASH("alpha_dash", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return ALPHA_DASH_PATTERN.matcher(Values.asText(ctx.value())).matches();
        }
    },
    MIN("min", false, 1, 1, true) {
        @Override
        boolean passes(RuleContext ctx) {
            BigDecimal size = ctx.measure();
            return size != null && size.compareTo(ctx.numberParam(0)) >= 0;
        }

        @Override
        String messageKey(RuleContext ctx) {
            return "min." + ctx.sizeKind();
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("min", ctx.param(0));
        }
    },
    MAX("max", false, 1, 1, true) {
        @Override
        boolean passes(RuleContext ctx) {
            BigDecimal size = ctx.measure();
            return size != null && size.compareTo(ctx.numberParam(0)) <= 0;
        }

        @Override
        String messageKey(RuleContext ctx) {
            return "max." + ctx.sizeKind();
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("max", ctx.param(0));
        }
    },
    BETWEEN("between", false, 2, 2, true) {
        @Override
        boolean passes(RuleContext ctx) {
            BigDecimal size = ctx.measure();
            return size != null
                    && size.compareTo(ctx.numberParam(0)) >= 0
                    && size.compareTo(ctx.numberParam(1)) <= 0;
        }

        @Override
        String messageKey(RuleContext ctx) {
            return "between." + ctx.sizeKind();
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("min", ctx.param(0), "max", ctx.param(1));
        }
    },
    SIZE("size", false, 1, 1, true) {
        @Override
        boolean passes(RuleContext ctx) {
            BigDecimal size = ctx.measure();
            return size != null && size.compareTo(ctx.numberParam(0)) == 0;
        }

        @Override
        String messageKey(RuleContext ctx) {
            return "size." + ctx.sizeKind();
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("size", ctx.param(0));
        }
    },
    DIGITS("digits", false, 1, 1, true) {
        @Override
        boolean passes(RuleContext ctx) {
            String text = Values.asText(ctx.value()).trim();
            return DIGITS_PATTERN.matcher(text).matches()
                    && BigDecimal.valueOf(text.length()).compareTo(ctx.numberParam(0)) == 0;
        }

        @Override
        void checkParams(ParsedRule rule, String field) {
            super.checkParams(rule, field);
            if (!DIGITS_PATTERN.matcher(rule.param(0)).matches()
                    || new BigDecimal(rule.param(0)).signum() == 0) {
                throw new RuleSyntaxException(
                        "Rule 'digits' for field '" + field + "' expects a positive whole number, got '"
                                + rule.param(0) + "'",
                        field,
                        rule.token());
            }
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("digits", ctx.param(0));
        }
    },
    IN("in", false, 1, -1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return ctx.params().contains(Values.asText(ctx.value()));
        }
    },
    NOT_IN("not_in", false, 1, -1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return !ctx.params().contains(Values.asText(ctx.value()));
        }
    },
    REGEX("regex", false, 1, 1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return compileRegex(ctx.param(0)).matcher(Values.asText(ctx.value())).find();
        }

        @Override
        void checkParams(ParsedRule rule, String field) {
            super.checkParams(rule, field);
            try {
                compileRegex(rule.param(0));
            } catch (PatternSyntaxException e) {
                throw new RuleSyntaxException(
                        "Invalid regular expression in rule '" + rule.token() + "' for field '" + field + "': "
                                + e.getDescription(),
                        e,
                        field,
                        rule.token());
            }
        }
    },
    SAME("same", false, 1, 1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return Objects.equals(ctx.value(), ctx.valueOf(ctx.param(0)));
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("other", ctx.displayName(ctx.param(0)));
        }
    },
    DIFFERENT("different", false, 1, 1, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return !Objects.equals(ctx.value(), ctx.valueOf(ctx.param(0)));
        }

        @Override
        Map<String, String> placeholders(RuleContext ctx) {
            return Map.of("other", ctx.displayName(ctx.param(0)));
        }
    },
    CONFIRMED("confirmed", false, 0, 0, false) {
        @Override
        boolean passes(RuleContext ctx) {
            return Objects.equals(ctx.value(), ctx.valueOf(ctx.field() + "_confirmation"));
        }
    };

    private static final Pattern INTEGER_TEXT = Pattern.compile("[+-]?\\d+");
    private static final Pattern DIGITS_PATTERN = Pattern.compile("\\d+");
    private static final Pattern EMAIL_PATTERN = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");
    private static final Pattern ALPHA_PATTERN = Pattern.compile("^\\p{L}+$");
    private static final Pattern ALPHA_NUM_PATTERN = Pattern.compile("^[\\p{L}\\p{N}]+$");
    private static final Pattern ALPHA_DASH_PATTERN = Pattern.compile("^[\\p{L}\\p{N}_-]+$");
    private static final Map<String, BuiltInRule> BY_NAME =
            Arrays.stream(values()).collect(Collectors.toMap(r -> r.ruleName, Function.identity()));

    private final String ruleName;
    private final boolean implicit;
    private final int minParams;
    private final int maxParams;
    private final boolean numericParams;

    BuiltInRule(String ruleName, boolean implicit, int minParams, int maxParams, boolean numericParams) {
        this.ruleName = ruleName;
        this.implicit = implicit;
        this.minParams = minParams;
        this.maxParams = maxParams;
        this.numericParams = numericParams;
    }

    static Optional<BuiltInRule> byName(String name) {
        return Optional.ofNullable(BY_NAME.get(name));
    }

    String ruleName() {
        return ruleName;
    }

    /** Whether the rule runs even when the value is absent. */
    boolean implicit() {
        return implicit;
    }

    abstract boolean passes(RuleContext ctx);

    /** Key of the built-in message template. */
    String messageKey(RuleContext ctx) {
        return ruleName;
    }

    /** Rule-specific placeholders; {@code :attribute} is always provided by the evaluator. */
    Map<String, String> placeholders(RuleContext ctx) {
        return Map.of();
    }

    /**
     * Rejects parameter lists the rule cannot work with, independent of any value.
     *
     * @throws RuleSyntaxException on a wrong parameter count or a non-numeric size parameter
     */
    void checkParams(ParsedRule rule, String field) {
        int count = rule.params().size();
        if (count < minParams || (maxParams >= 0 && count > maxParams)) {
            String expected = maxParams < 0 ? "at least " + minParams : minParams == maxParams ? "exactly " + minParams
                    : minParams + " to " + maxParams;
            throw new RuleSyntaxException(
                    "Rule '" + ruleName + "' for field '" + field + "' expects " + expected + " parameter(s), got "
                            + count,
                    field,
                    rule.token());
        }
        for (String param : rule.params()) {
            if (param.isEmpty()) {
                throw new RuleSyntaxException(
                        "Empty parameter in rule '" + rule.token() + "' for field '" + field + "'", field, rule.token());
            }
            if (numericParams && Values.toNumber(param) == null) {
                throw new RuleSyntaxException(
                        "Rule '" + ruleName + "' for field '" + field + "' expects numeric parameters, got '" + param
                                + "'",
                        field,
                        rule.token());
            }
        }
    }

    /** Accepts both {@code pattern} and {@code /pattern/flags}; only the {@code i} flag is honoured. */
    static Pattern compileRegex(String source) {
        int last = source.lastIndexOf('/');
        if (source.length() > 1 && source.startsWith("/") && last > 0) {
            String flags = source.substring(last + 1);
            String body = source.substring(1, last);
            return Pattern.compile(body, flags.contains("i") ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0);
        }
        return Pattern.compile(source);
    }

    static Map<String, String> withAttribute(Map<String, String> placeholders, String attribute) {
        Map<String, String> all = new HashMap<>(placeholders);
        all.put("attribute", attribute);
        return all;
    }
}
