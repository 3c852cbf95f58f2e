package com.storymaker.backend.exception;

/**
 * The narrative could not be split into any scene. There is no text to fall back on, so this
 * propagates to the caller.
 */
public class StoryParseException extends RuntimeException {

    public StoryParseException(String message) {
        super(message);
    }
}
