package com.openforge.devgauge.agent.event;

/**
 * Kinds of event pushed to a session's topic.
 *
 * Flow per request: TOKEN* → FINAL_ANSWER, or TOKEN* → ERROR.
 */
public enum EventType {

    /** One streamed fragment of model output. content = fragment. */
    TOKEN,

    /** The call finished. content = full text for chat turns; payload = structured result for skills. */
    FINAL_ANSWER,

    /** The call failed. content = message. */
    ERROR
}
