package com.relalg.exception;

/**
 * Raised when the translator hits a state that well-formed parser output never
 * produces: an AST node without source position, an expression datatype that is
 * not implemented, or a translation stage that built no node.
 *
 * <p>These are defects in the parser or the translator, not problems with the
 * user's query, and are not meant to be caught and retried.
 */
public class InternalTranslationException extends IllegalStateException {

    public InternalTranslationException(String message) {
        super(message);
    }

    public InternalTranslationException(String message, Throwable cause) {
        super(message, cause);
    }
}
