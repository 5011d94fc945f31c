package com.legalgraph.exception;

/**
 * A corpus adapter that cannot be loaded. Always fatal: raised before any
 * document of the corpus is processed.
 */
public class CorpusConfigurationException extends CitationGraphException {

    public CorpusConfigurationException(String message) {
        super(message);
    }

    public CorpusConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
