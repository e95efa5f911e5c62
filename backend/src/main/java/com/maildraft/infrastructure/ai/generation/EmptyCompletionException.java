package com.maildraft.infrastructure.ai.generation;

/**
 * The service answered but the completion carried no content.
 */
public class EmptyCompletionException extends RuntimeException {

    public EmptyCompletionException(String message) {
        super(message);
    }
}
