package org.posts.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.posts.negotiation.ContentNegotiator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Turns every failure into {@code {"message": ...}} served as application/json.
 * The content type is set explicitly so the body is written even when the
 * client's Accept header excludes JSON.
 */
@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

    private final ContentNegotiator negotiator;

    @ExceptionHandler(PostApiException.class)
    public ResponseEntity<Map<String, String>> handlePostApiException(PostApiException e) {
        log.warn("Request rejected: {} | Message: {}", e.getStatus().value(), e.getMessage());
        return message(e.getStatus(), e.getMessage());
    }

    // Content-Type illisible : Spring échoue à la lecture du corps, avant le contrôleur.
    // L'Accept reste vérifié en premier.
    @ExceptionHandler(HttpMediaTypeNotSupportedException.class)
    public ResponseEntity<Map<String, String>> handleMediaTypeNotSupported(HttpMediaTypeNotSupportedException e,
                                                                           HttpServletRequest request) {
        try {
            negotiator.requireJsonAccept(request.getHeader(HttpHeaders.ACCEPT));
        } catch (NotAcceptableException notAcceptable) {
            return handlePostApiException(notAcceptable);
        }
        return handlePostApiException(new UnsupportedMediaTypeException());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, String>> handleException(Exception e) {
        // exceptions standard de Spring MVC (404 route inconnue, 405, ...) : on garde leur statut
        if (e instanceof ErrorResponse errorResponse) {
            HttpStatusCode status = errorResponse.getStatusCode();
            log.warn("Request rejected by Spring MVC: {} | {}", status.value(), e.getMessage());
            return ResponseEntity.status(status)
                    .headers(errorResponse.getHeaders())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(Map.of("message", describe(status, errorResponse.getBody().getDetail())));
        }
        log.error("Unexpected failure while handling request", e);
        return message(HttpStatus.INTERNAL_SERVER_ERROR, "Internal server error");
    }

    private static String describe(HttpStatusCode status, String detail) {
        if (detail != null && !detail.isBlank()) return detail;
        HttpStatus resolved = HttpStatus.resolve(status.value());
        return resolved != null ? resolved.getReasonPhrase() : "Request failed";
    }

    static ResponseEntity<Map<String, String>> message(HttpStatusCode status, String message) {
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("message", message));
    }
}
