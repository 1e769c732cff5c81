package com.herzen.gradepipe.parser;

public class TableFormatException extends IllegalArgumentException {
    public TableFormatException(String source, int line, String message) {
        super(source + ":" + line + ": " + message);
    }
}
