package org.posts.dto;

/**
 * Substring constraints for listing posts. A {@code null} field places no constraint.
 */
public record PostFilter(String titleLike, String bodyLike) {

    public boolean isEmpty() {
        return titleLike == null && bodyLike == null;
    }
}
