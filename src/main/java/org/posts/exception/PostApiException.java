package org.posts.exception;

import org.springframework.http.HttpStatus;

/**
 * Base for every error that ends a request with a fixed status and a one-sentence message.
 */
public abstract class PostApiException extends RuntimeException {

    private final HttpStatus status;

    protected PostApiException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
