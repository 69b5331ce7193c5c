package com.example.cmdpalette.commands;

/**
 * Capability check deciding whether a command is currently offered and runnable
 * (e.g. "only when signed in"). Evaluated on every listing, search and execution.
 */
@FunctionalInterface
public interface AvailabilityCondition {

    AvailabilityCondition ALWAYS = () -> true;

    boolean isAvailable();
}
