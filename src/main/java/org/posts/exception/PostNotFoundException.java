package org.posts.exception;

import org.springframework.http.HttpStatus;

public class PostNotFoundException extends PostApiException {

    public PostNotFoundException(Object postId) {
        super(HttpStatus.NOT_FOUND, "Could not find post with id " + postId);
    }
}
