package com.helia.domain;

/**
 * Completion state of a stored message.
 * PARTIAL marks an assistant reply whose stream ended early; its content is what the caller saw.
 */
public enum MessageState {
    FINAL,
    PARTIAL
}
