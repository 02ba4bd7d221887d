package com.crossbridge.generator.codegen.render;

/**
 * Runs an action on every invocation except the first. Handy for separators.
 */
public final class SkipFirst {

    private boolean first = true;

    public void apply(Runnable action) {
        if (first) {
            first = false;
        } else {
            action.run();
        }
    }
}
