package org.posts.negotiation;

import org.posts.exception.NotAcceptableException;
import org.posts.exception.UnsupportedMediaTypeException;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Guard called first in every handler: the API only speaks application/json.
 * Accept is checked before Content-Type.
 */
@Component
public class ContentNegotiator {

    /**
     * Passes when the Accept header admits application/json. A missing header
     * means the client accepts anything.
     *
     * @throws NotAcceptableException otherwise, or when the header cannot be parsed
     */
    public void requireJsonAccept(String acceptHeader) {
        if (acceptHeader == null || acceptHeader.isBlank()) return;

        List<MediaType> accepted;
        try {
            accepted = MediaType.parseMediaTypes(acceptHeader);
        } catch (InvalidMediaTypeException e) {
            throw new NotAcceptableException();
        }

        for (MediaType range : accepted) {
            if (range.includes(MediaType.APPLICATION_JSON) && range.getQualityValue() > 0.0) {
                return;
            }
        }
        throw new NotAcceptableException();
    }

    /**
     * Passes when the request body is declared as application/json (parameters such as charset ignored).
     *
     * @throws UnsupportedMediaTypeException for a missing, unparsable or different type
     */
    public void requireJsonContent(String contentTypeHeader) {
        if (contentTypeHeader == null || contentTypeHeader.isBlank()) {
            throw new UnsupportedMediaTypeException();
        }

        MediaType contentType;
        try {
            contentType = MediaType.parseMediaType(contentTypeHeader);
        } catch (InvalidMediaTypeException e) {
            throw new UnsupportedMediaTypeException();
        }

        if (!MediaType.APPLICATION_JSON.equalsTypeAndSubtype(contentType)) {
            throw new UnsupportedMediaTypeException();
        }
    }
}
