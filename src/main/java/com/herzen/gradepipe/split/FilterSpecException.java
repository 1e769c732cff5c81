package com.herzen.gradepipe.split;

public class FilterSpecException extends IllegalArgumentException {
    public FilterSpecException(String spec, String problem) {
        super("Invalid cohort/term filter '" + spec + "': " + problem);
    }
}
