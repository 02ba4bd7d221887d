package com.crossbridge.generator.model;

/**
 * Special role of an option in a bit-flag enum.
 */
public enum SpecialFlag {
    /** The option with value 0. */
    NO_FLAGS,
    /** The option combining every ordinary option. */
    ALL_FLAGS
}
