package com.crossbridge.generator.codegen;

/**
 * Fatal generation error. Raised for output folders that cannot be created, for output paths
 * written twice or differing only by case, and for I/O failures while writing. Propagates
 * unhandled through the backends up to {@link GenerationOrchestrator}.
 */
public class GenerateException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public GenerateException(String message) {
        super(message);
    }

    public GenerateException(String message, Throwable cause) {
        super(message, cause);
    }
}
