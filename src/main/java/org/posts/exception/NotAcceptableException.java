package org.posts.exception;

import org.springframework.http.HttpStatus;

public class NotAcceptableException extends PostApiException {

    public static final String MESSAGE = "Request must accept application/json data";

    public NotAcceptableException() {
        super(HttpStatus.NOT_ACCEPTABLE, MESSAGE);
    }
}
