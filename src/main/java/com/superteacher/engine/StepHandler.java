package com.superteacher.engine;

/**
 * Handles one inbound message in one conversation step. Handlers change the
 * session only through the {@link Turn} they are given.
 */
@FunctionalInterface
public interface StepHandler {

    void handle(Turn turn);
}
