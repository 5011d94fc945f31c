package com.legalgraph.exception;

public class CitationGraphException extends RuntimeException {

    public CitationGraphException(String message) {
        super(message);
    }

    public CitationGraphException(String message, Throwable cause) {
        super(message, cause);
    }
}
