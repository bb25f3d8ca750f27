package com.dynascope.core.engine;

import java.util.List;

/**
 * Thrown when none of the inputs a diagnosis needs could be found. The message
 * names every missing input.
 */
public class MissingInputException extends RuntimeException {

    private final List<String> missing;

    public MissingInputException(String directory, List<String> missing) {
        super("Missing required input in " + directory + ": " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
