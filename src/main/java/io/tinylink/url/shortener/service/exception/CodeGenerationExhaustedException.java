package io.tinylink.url.shortener.service.exception;

/**
 * Every candidate code of one shorten request collided. Nothing was stored and the whole request can be retried.
 */
public class CodeGenerationExhaustedException extends RuntimeException {

    private final int attempts;

    public CodeGenerationExhaustedException(int attempts) {
        super("Unable to generate unique short code after " + attempts + " attempts");
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
