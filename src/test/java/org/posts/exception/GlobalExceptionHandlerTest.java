package org.posts.exception;

import org.junit.jupiter.api.Test;
import org.posts.negotiation.ContentNegotiator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler(new ContentNegotiator());

    @Test
    void handlePostApiException_shouldUseExceptionStatusAndMessage() {
        ResponseEntity<Map<String, String>> response = handler.handlePostApiException(new PostNotFoundException(7L));

        assertThat(response.getStatusCode().value()).isEqualTo(404);
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(response.getBody()).containsExactly(Map.entry("message", "Could not find post with id 7"));
    }

    @Test
    void handlePostApiException_shouldMapEachErrorToItsStatus() {
        assertThat(handler.handlePostApiException(new NotAcceptableException()).getStatusCode().value()).isEqualTo(406);
        assertThat(handler.handlePostApiException(new UnsupportedMediaTypeException()).getStatusCode().value()).isEqualTo(415);
        assertThat(handler.handlePostApiException(new PostValidationException("x")).getStatusCode().value()).isEqualTo(422);
    }

    @Test
    void handleException_shouldHideInternalDetails() {
        ResponseEntity<Map<String, String>> response =
                handler.handleException(new IllegalStateException("connection pool exhausted"));

        assertThat(response.getStatusCode().value()).isEqualTo(500);
        assertThat(response.getBody()).containsEntry("message", "Internal server error");
    }

    @Test
    void handleException_shouldKeepSpringMvcStatusAndHeaders() {
        ResponseEntity<Map<String, String>> response =
                handler.handleException(new HttpRequestMethodNotSupportedException("PUT", List.of("GET", "DELETE")));

        assertThat(response.getStatusCode().value()).isEqualTo(405);
        assertThat(response.getHeaders().getFirst(HttpHeaders.ALLOW)).contains("GET");
        assertThat(response.getHeaders().getContentType()).isEqualTo(MediaType.APPLICATION_JSON);
        assertThat(response.getBody()).containsKey("message");
    }

    @Test
    void handleMediaTypeNotSupported_shouldAnswer415_whenJsonIsAccepted() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/posts");
        request.addHeader(HttpHeaders.ACCEPT, "application/json");

        ResponseEntity<Map<String, String>> response =
                handler.handleMediaTypeNotSupported(new HttpMediaTypeNotSupportedException("garbage"), request);

        assertThat(response.getStatusCode().value()).isEqualTo(415);
        assertThat(response.getBody()).containsEntry("message", "Request must contain application/json data");
    }

    @Test
    void handleMediaTypeNotSupported_shouldAnswer406_whenJsonIsNotAccepted() {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/posts");
        request.addHeader(HttpHeaders.ACCEPT, "application/xml");

        ResponseEntity<Map<String, String>> response =
                handler.handleMediaTypeNotSupported(new HttpMediaTypeNotSupportedException("garbage"), request);

        assertThat(response.getStatusCode().value()).isEqualTo(406);
        assertThat(response.getBody()).containsEntry("message", "Request must accept application/json data");
    }
}
