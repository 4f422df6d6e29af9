package com.relalg.messages;

import com.relalg.translate.TranslatorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * Resolves message keys of errors and warnings to display text.
 *
 * <p>Messages live in the {@code messages} resource bundle and use named
 * placeholders such as {@code {name}}. The translator itself only ever deals
 * with keys and parameters.
 *
 * <p>The default locale is read from the {@code relalg.locale} system property
 * (a language tag such as {@code de}) and falls back to English.
 */
public final class Messages {
    private static final Logger logger = LoggerFactory.getLogger(Messages.class);

    /** System property naming the default display locale. */
    public static final String LOCALE_PROPERTY = "relalg.locale";

    // the JVM default locale must not win over the base bundle
    private static final ResourceBundle.Control NO_FALLBACK =
        ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_DEFAULT);

    private Messages() {} // Utility class

    /**
     * Resolves a message key for a locale and substitutes its parameters.
     *
     * <p>Unknown keys resolve to the key itself so that a missing translation
     * never hides the error it describes.
     *
     * @param key the message key
     * @param params the named parameters
     * @param locale the display locale
     * @return the resolved text
     */
    public static String format(String key, Map<String, ?> params, Locale locale) {
        String pattern;
        try {
            pattern = ResourceBundle.getBundle(TranslatorConfig.MESSAGE_BUNDLE, locale, NO_FALLBACK).getString(key);
        } catch (MissingResourceException e) {
            pattern = key;
        }
        String text = pattern;
        for (Map.Entry<String, ?> param : params.entrySet()) {
            text = text.replace("{" + param.getKey() + "}", String.valueOf(param.getValue()));
        }
        return text;
    }

    /**
     * Resolves a message key without parameters.
     *
     * @param key the message key
     * @param locale the display locale
     * @return the resolved text
     */
    public static String format(String key, Locale locale) {
        return format(key, Map.of(), locale);
    }

    /**
     * Returns the default display locale.
     *
     * <p>A malformed property value is logged and ignored, since this is called
     * while errors are being reported.
     *
     * @return the locale named by {@value #LOCALE_PROPERTY}, or English
     */
    public static Locale defaultLocale() {
        String value = System.getProperty(LOCALE_PROPERTY);
        try {
            return parseLocale(value);
        } catch (IllegalArgumentException e) {
            logger.warn("Ignoring {}={}: {}. Using English", LOCALE_PROPERTY, value, e.getMessage());
            return Locale.ENGLISH;
        }
    }

    /**
     * Parses a language tag (case-insensitive).
     *
     * @param value a tag such as "en" or "de", or null
     * @return the locale, English for null or blank values
     * @throws IllegalArgumentException if the value is not a well-formed language tag
     */
    public static Locale parseLocale(String value) {
        if (value == null || value.isBlank()) {
            return Locale.ENGLISH;
        }
        Locale locale = Locale.forLanguageTag(value.trim().toLowerCase(Locale.ROOT).replace('_', '-'));
        if (locale.getLanguage().isEmpty()) {
            throw new IllegalArgumentException(
                "Unknown locale: '%s'. Expected a language tag such as 'en' or 'de'".formatted(value));
        }
        return locale;
    }
}
