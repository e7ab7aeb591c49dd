package org.posts.repo;

import org.junit.jupiter.api.Test;
import org.posts.model.Post;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class PostRepositoryTest {

    @Autowired
    private PostRepository postRepo;

    private Post save(String title, String body) {
        return postRepo.save(Post.builder().title(title).body(body).build());
    }

    private static List<String> titles(List<Post> posts) {
        return posts.stream().map(Post::getTitle).toList();
    }

    @Test
    void save_shouldAssignIncreasingIds() {
        Post a = save("A", "a");
        Post b = save("B", "b");

        assertThat(a.getId()).isNotNull();
        assertThat(b.getId()).isGreaterThan(a.getId());
    }

    @Test
    void findAllByOrderByIdAsc_shouldFollowInsertionOrder() {
        save("Example Post A", "Just a test");
        save("Example Post B", "Still a test");
        save("Example Post C", "Another test");

        assertThat(titles(postRepo.findAllByOrderByIdAsc()))
                .containsExactly("Example Post A", "Example Post B", "Example Post C");
    }

    @Test
    void containing_shouldFilterTitleBySubstring() {
        save("Post with bells", "Just a test");
        save("Post with whistles", "Still a test");
        save("Post with bells and whistles", "Another test");

        List<Post> result = postRepo.findByTitleContainingAndBodyContainingOrderByIdAsc("whistles", "");

        assertThat(titles(result)).containsExactly("Post with whistles", "Post with bells and whistles");
    }

    @Test
    void containing_shouldCombineTitleAndBody() {
        save("Post with bells", "No whistles");
        save("Post with whistles", "No bells");
        save("Post with bells and whistles", "Both bells and whistles");

        List<Post> result = postRepo.findByTitleContainingAndBodyContainingOrderByIdAsc("whistles", "bells");

        assertThat(titles(result)).containsExactly("Post with whistles", "Post with bells and whistles");
    }

    @Test
    void containing_shouldBeCaseSensitive() {
        save("Post with Whistles", "x");
        save("Post with whistles", "x");

        assertThat(titles(postRepo.findByTitleContainingAndBodyContainingOrderByIdAsc("whistles", "")))
                .containsExactly("Post with whistles");
    }

    @Test
    void containing_shouldMatchWildcardCharactersLiterally() {
        save("100% done", "x");
        save("nothing special", "x");
        save("snake_case", "x");
        save("snakeXcase", "x");

        assertThat(titles(postRepo.findByTitleContainingAndBodyContainingOrderByIdAsc("%", "")))
                .containsExactly("100% done");
        assertThat(titles(postRepo.findByTitleContainingAndBodyContainingOrderByIdAsc("e_c", "")))
                .containsExactly("snake_case");
    }
}
