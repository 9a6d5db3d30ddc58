package com.scanforge.infrastructure.parsing;

/**
 * Source text could not be tokenized or parsed.
 */
public class SourceParseException extends RuntimeException {

    private final int line;

    public SourceParseException(String message, int line) {
        super(message);
        this.line = line;
    }

    public SourceParseException(String message, int line, Throwable cause) {
        super(message, cause);
        this.line = line;
    }

    public int getLine() {
        return line;
    }

    /**
     * Message in the form {@code line 12: invalid syntax}.
     */
    public String describe() {
        return "line " + line + ": " + getMessage();
    }
}
