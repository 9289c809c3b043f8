package com.wellbridge.ai.llm;

/**
 * The generation provider did not produce usable output: transport error, timeout, empty
 * completion or a payload that did not parse.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
