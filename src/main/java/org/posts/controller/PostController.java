package org.posts.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.posts.dto.PostDto;
import org.posts.dto.PostFilter;
import org.posts.exception.PostNotFoundException;
import org.posts.exception.PostValidationException;
import org.posts.model.Post;
import org.posts.negotiation.ContentNegotiator;
import org.posts.service.PostService;
import org.posts.validation.PostSchemaValidator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Map;

// Chaque endpoint : négociation -> validation -> persistance, dans cet ordre
@RestController
@RequestMapping("/posts")
@RequiredArgsConstructor
public class PostController {

    static final String INVALID_JSON = "Request body is not valid JSON";

    private final PostService postService;
    private final ContentNegotiator negotiator;
    private final PostSchemaValidator validator;
    private final ObjectMapper objectMapper;

    // --------------------------------------------------------------------
    // GET /posts?title_like=&body_like=
    @GetMapping
    public ResponseEntity<List<PostDto>> list(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
            @RequestParam(name = "title_like", required = false) String titleLike,
            @RequestParam(name = "body_like", required = false) String bodyLike) {
        negotiator.requireJsonAccept(accept);

        List<PostDto> posts = postService.list(new PostFilter(titleLike, bodyLike)).stream()
                .map(PostDto::fromEntity)
                .toList();
        return json(ResponseEntity.ok()).body(posts);
    }

    // --------------------------------------------------------------------
    // GET /posts/{id}
    @GetMapping("/{id}")
    public ResponseEntity<PostDto> get(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
            @PathVariable("id") String rawId) {
        negotiator.requireJsonAccept(accept);

        Long id = parseId(rawId);
        Post post = postService.get(id).orElseThrow(() -> new PostNotFoundException(id));
        return json(ResponseEntity.ok()).body(PostDto.fromEntity(post));
    }

    // --------------------------------------------------------------------
    // POST /posts  {"title": ..., "body": ...}
    @PostMapping
    public ResponseEntity<PostDto> create(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
            @RequestHeader(value = HttpHeaders.CONTENT_TYPE, required = false) String contentType,
            @RequestBody(required = false) String rawBody,
            UriComponentsBuilder uriBuilder) {
        negotiator.requireJsonAccept(accept);
        negotiator.requireJsonContent(contentType);

        JsonNode payload = parse(rawBody);
        validator.validate(payload);

        Post saved = postService.insert(payload.get("title").textValue(), payload.get("body").textValue());
        URI location = uriBuilder.path("/posts/{id}").buildAndExpand(saved.getId()).toUri();
        return json(ResponseEntity.created(location)).body(PostDto.fromEntity(saved));
    }

    // --------------------------------------------------------------------
    // DELETE /posts/{id}
    @DeleteMapping("/{id}")
    public ResponseEntity<Map<String, String>> delete(
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept,
            @PathVariable("id") String rawId) {
        negotiator.requireJsonAccept(accept);

        Long id = parseId(rawId);
        if (!postService.delete(id)) {
            throw new PostNotFoundException(id);
        }
        return json(ResponseEntity.ok()).body(Map.of("message", "Deleted post with id " + id));
    }

    // /posts/abc ou un id hors de la plage d'un long : même réponse qu'un post absent
    private static Long parseId(String rawId) {
        try {
            return Long.valueOf(rawId);
        } catch (NumberFormatException e) {
            throw new PostNotFoundException(rawId);
        }
    }

    private JsonNode parse(String rawBody) {
        if (rawBody == null || rawBody.isBlank()) {
            throw new PostValidationException(INVALID_JSON);
        }
        try {
            return objectMapper.readTree(rawBody);
        } catch (JsonProcessingException e) {
            throw new PostValidationException(INVALID_JSON);
        }
    }

    private static ResponseEntity.BodyBuilder json(ResponseEntity.BodyBuilder builder) {
        return builder.contentType(MediaType.APPLICATION_JSON);
    }
}
