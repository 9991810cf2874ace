package io.modelvalidator.core.spi;

/**
 * Adapter for a localization library. Used to translate custom error messages and attribute
 * names, and to pick the language of the evaluator's built-in messages.
 *
 * <p>The validator calls both methods on every validation pass without caching. Implementations
 * backed by expensive lookups should memoize on their own.
 */
public interface LocalizationProvider {

    /**
     * Translates the given key using the current language.
     *
     * @param key the key to translate
     * @return the translated message, or the key itself if unknown
     */
    String translate(String key);

    /**
     * Returns the current language code (e.g. {@code "de-AT"}). Only the first two characters are
     * used to select the evaluator's locale.
     */
    String language();
}
