package org.posts.exception;

import org.springframework.http.HttpStatus;

public class PostValidationException extends PostApiException {

    public PostValidationException(String message) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, message);
    }
}
