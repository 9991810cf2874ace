package io.modelvalidator.core.engine.rules;

import java.util.Locale;
import java.util.Map;
import java.util.ResourceBundle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Built-in message templates per locale, read from {@code messages*.properties} next to this
 * class. Locales without a bundle use the base (English) bundle rather than the JVM default.
 */
final class MessageCatalog {

    static final String BUNDLE = "io.modelvalidator.core.engine.rules.messages";
    static final String FALLBACK_KEY = "invalid";

    private static final Pattern PLACEHOLDER = Pattern.compile(":([a-z_]+)");
    private static final ResourceBundle.Control NO_FALLBACK =
            ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_PROPERTIES);

    private final ResourceBundle bundle;

    private MessageCatalog(ResourceBundle bundle) {
        this.bundle = bundle;
    }

    static MessageCatalog forLocale(Locale locale) {
        return new MessageCatalog(ResourceBundle.getBundle(BUNDLE, locale, MessageCatalog.class.getClassLoader(), NO_FALLBACK));
    }

    Locale locale() {
        return bundle.getLocale();
    }

    /** Template for the key, or the generic {@value #FALLBACK_KEY} template. */
    String template(String key) {
        return bundle.containsKey(key) ? bundle.getString(key) : bundle.getString(FALLBACK_KEY);
    }

    /** Replaces {@code :name} placeholders; unknown placeholders are left untouched. */
    static String format(String template, Map<String, String> placeholders) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String replacement = placeholders.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement != null ? replacement : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
