package com.legalgraph.exception;

public class GraphStoreException extends CitationGraphException {

    public GraphStoreException(String message) {
        super(message);
    }

    public GraphStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
