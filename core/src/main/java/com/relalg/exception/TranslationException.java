package com.relalg.exception;

import com.relalg.ast.CodeInfo;
import com.relalg.messages.Messages;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * User-facing error raised when a query cannot be translated, for example because
 * it references a relation that does not exist.
 *
 * <p>The exception does not carry display text. It carries a message key, the
 * parameters to substitute and the source position of the offending construct;
 * the text is resolved by {@link Messages} for whatever locale the caller shows
 * errors in:
 * <pre>
 *   try {
 *       LogicalPlan plan = new SqlAstTranslator(catalog).translate(root);
 *   } catch (TranslationException e) {
 *       showError(e.getLocalizedMessage(Locale.GERMAN), e.codeInfo());
 *   }
 * </pre>
 *
 * <p>A translation error always aborts the whole translation.
 */
public class TranslationException extends RuntimeException {

    private final String messageKey;
    private final Map<String, Object> params;
    private final CodeInfo codeInfo;

    /**
     * Creates a translation exception.
     *
     * @param messageKey the message key
     * @param params the named parameters of the message
     * @param codeInfo the source position of the offending construct (may be null)
     */
    public TranslationException(String messageKey, Map<String, Object> params, CodeInfo codeInfo) {
        super(describe(messageKey, params, codeInfo));
        this.messageKey = messageKey;
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.codeInfo = codeInfo;
    }

    /**
     * Creates a translation exception with a single parameter.
     *
     * @param messageKey the message key
     * @param param the parameter name
     * @param value the parameter value
     * @param codeInfo the source position of the offending construct (may be null)
     */
    public TranslationException(String messageKey, String param, Object value, CodeInfo codeInfo) {
        this(messageKey, Collections.singletonMap(param, value), codeInfo);
    }

    public String messageKey() {
        return messageKey;
    }

    public Map<String, Object> params() {
        return params;
    }

    /**
     * Returns the source position of the construct that caused the error.
     *
     * @return the code info, or null if the error is not tied to a position
     */
    public CodeInfo codeInfo() {
        return codeInfo;
    }

    /**
     * Returns the message resolved for a locale, without position information.
     *
     * @param locale the display locale
     * @return the resolved message
     */
    public String getLocalizedMessage(Locale locale) {
        return Messages.format(messageKey, params, locale);
    }

    @Override
    public String getLocalizedMessage() {
        return getLocalizedMessage(Messages.defaultLocale());
    }

    private static String describe(String messageKey, Map<String, Object> params, CodeInfo codeInfo) {
        String text = Messages.format(messageKey, params, Locale.ENGLISH);
        return codeInfo != null ? text + " (" + codeInfo + ")" : text;
    }
}
