package com.cra.trace;

/**
 * Where the next event of a session chain goes.
 */
public record ChainTip(String hash, long nextSequence, boolean frozen) {
}
