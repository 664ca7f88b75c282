package com.williamcallahan.lawlens.service.retrieval;

/**
 * Signals that the document back end could not supply section content.
 *
 * <p>Callers recover by showing the un-expanded excerpt; this never reaches an HTTP client.</p>
 */
public class SectionRetrievalException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the retrieval failure
     */
    public SectionRetrievalException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the retrieval failure
     * @param cause underlying transport or decoding failure
     */
    public SectionRetrievalException(String message, Throwable cause) {
        super(message, cause);
    }
}
