package org.zwolang.model;

/**
 * Text shown to the rider at an offset from the start of its block.
 */
public record Message(Value.Duration timestamp, String text) {}
