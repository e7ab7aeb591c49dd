package org.posts.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.posts.dto.PostFilter;
import org.posts.model.Post;
import org.posts.repo.PostRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Persistence operations behind the post endpoints. Every method is one transaction.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PostService {

    private final PostRepository postRepo;

    /**
     * Posts matching the filter, oldest first (id ascending).
     */
    @Transactional(readOnly = true)
    public List<Post> list(PostFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return postRepo.findAllByOrderByIdAsc();
        }
        // "" est contenu dans toute chaîne : un paramètre absent ne filtre rien
        String title = filter.titleLike() == null ? "" : filter.titleLike();
        String body = filter.bodyLike() == null ? "" : filter.bodyLike();
        List<Post> posts = postRepo.findByTitleContainingAndBodyContainingOrderByIdAsc(title, body);
        log.debug("Filtered posts title_like={} body_like={} -> {} result(s)", filter.titleLike(), filter.bodyLike(), posts.size());
        return posts;
    }

    @Transactional(readOnly = true)
    public Optional<Post> get(Long id) {
        return postRepo.findById(id);
    }

    /**
     * Stores a new post; the database assigns its id.
     */
    @Transactional
    public Post insert(String title, String body) {
        Post saved = postRepo.save(Post.builder()
                .title(title)
                .body(body)
                .build());
        log.info("Created post {}", saved.getId());
        return saved;
    }

    /**
     * Hard delete.
     *
     * @return false when no post has this id
     */
    @Transactional
    public boolean delete(Long id) {
        if (!postRepo.existsById(id)) {
            return false;
        }
        postRepo.deleteById(id);
        log.info("Deleted post {}", id);
        return true;
    }
}
