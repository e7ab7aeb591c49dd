package org.posts.repo;

import org.posts.model.Post;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PostRepository extends JpaRepository<Post, Long> {

    List<Post> findAllByOrderByIdAsc();

    // Containing = LIKE '%x%' avec échappement de % et _ ; sensible à la casse
    List<Post> findByTitleContainingAndBodyContainingOrderByIdAsc(String title, String body);
}
