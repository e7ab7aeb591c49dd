package org.posts.dto;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.*;
import org.posts.model.Post;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonPropertyOrder({"id", "title", "body"})
public class PostDto {
    private Long id;
    private String title;
    private String body;

    public static PostDto fromEntity(Post post) {
        if (post == null) return null;
        return PostDto.builder()
                .id(post.getId())
                .title(post.getTitle())
                .body(post.getBody())
                .build();
    }
}
