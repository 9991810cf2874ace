package io.modelvalidator.core.l10n;

import io.modelvalidator.core.spi.LocalizationProvider;
import java.util.Locale;

/**
 * Fallback provider used when no localization is configured: keys translate to themselves and the
 * language is the JVM default locale.
 */
public final class NoopLocalizationProvider implements LocalizationProvider {

    public static final NoopLocalizationProvider INSTANCE = new NoopLocalizationProvider();

    @Override
    public String translate(String key) {
        return key;
    }

    @Override
    public String language() {
        return Locale.getDefault().toLanguageTag();
    }
}
