package io.modelvalidator.core.l10n;

import io.modelvalidator.core.spi.LocalizationProvider;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.Objects;
import java.util.ResourceBundle;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LocalizationProvider} backed by a JDK {@link ResourceBundle}. The current locale is read
 * from a supplier on every call so applications can switch languages at runtime; bundle lookups
 * are memoized by the JDK bundle cache.
 *
 * <p>Unknown keys, and a missing bundle, translate to the key itself.
 */
public final class ResourceBundleLocalizationProvider implements LocalizationProvider {

    private static final Logger LOG = LoggerFactory.getLogger(ResourceBundleLocalizationProvider.class);

    private final String baseName;
    private final Supplier<Locale> localeSupplier;
    private final ClassLoader classLoader;

    /** Creates a provider pinned to a fixed locale. */
    public ResourceBundleLocalizationProvider(String baseName, Locale locale) {
        this(baseName, () -> locale);
        Objects.requireNonNull(locale, "locale must not be null");
    }

    /** Creates a provider that asks the supplier for the current locale on every call. */
    public ResourceBundleLocalizationProvider(String baseName, Supplier<Locale> localeSupplier) {
        this.baseName = Objects.requireNonNull(baseName, "baseName must not be null");
        this.localeSupplier = Objects.requireNonNull(localeSupplier, "localeSupplier must not be null");
        this.classLoader = Thread.currentThread().getContextClassLoader() != null
                ? Thread.currentThread().getContextClassLoader()
                : ResourceBundleLocalizationProvider.class.getClassLoader();
    }

    @Override
    public String translate(String key) {
        if (key == null) {
            return null;
        }
        ResourceBundle bundle = bundle();
        if (bundle == null || !bundle.containsKey(key)) {
            return key;
        }
        return bundle.getString(key);
    }

    @Override
    public String language() {
        return currentLocale().toLanguageTag();
    }

    private Locale currentLocale() {
        Locale locale = localeSupplier.get();
        return locale != null ? locale : Locale.getDefault();
    }

    private ResourceBundle bundle() {
        try {
            return ResourceBundle.getBundle(baseName, currentLocale(), classLoader);
        } catch (MissingResourceException e) {
            LOG.debug("Resource bundle not found: base_name={} locale={}", baseName, currentLocale());
            return null;
        }
    }
}
