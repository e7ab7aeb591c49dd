package org.posts.exception;

import org.springframework.http.HttpStatus;

public class UnsupportedMediaTypeException extends PostApiException {

    public static final String MESSAGE = "Request must contain application/json data";

    public UnsupportedMediaTypeException() {
        super(HttpStatus.UNSUPPORTED_MEDIA_TYPE, MESSAGE);
    }
}
