package org.starfield.align.client.response;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.HttpStatus;
import org.apache.http.StatusLine;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.entity.ContentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base class containing common response handling methods.
 */
class BaseResponseHandler {

    static final Set<Integer> OK = new HashSet<>(Collections.singletonList(HttpStatus.SC_OK));

    private final String requestContext;

    /**
     * @param  requestContext  context (e.g. "GET http://host/index.php?page=2") for use in error messages.
     */
    BaseResponseHandler(final String requestContext) {
        this.requestContext = requestContext;
    }

    String getRequestContext() {
        return requestContext;
    }

    /**
     * @return the entity content decoded with the entity's charset (UTF-8 if none is specified)
     *         or null if there is no entity.
     *
     * @throws IOException
     *   if the entity content cannot be read.
     */
    String getResponseBodyText(final HttpEntity entity)
            throws IOException {

        String text = null;
        if (entity != null) {
            Charset charset = null;
            final ContentType contentType = ContentType.get(entity);
            if (contentType != null) {
                charset = contentType.getCharset();
            }
            text = IOUtils.toString(entity.getContent(), charset == null ? StandardCharsets.UTF_8 : charset);
        }
        return text;
    }

    /**
     * Validates the response status code.
     *
     * @param  response          HTTP response to check.
     * @param  validStatusCodes  acceptable status codes.
     *
     * @return response entity if it is valid.
     *
     * @throws IOException
     *   if the status code is not valid.
     */
    HttpEntity getValidatedResponseEntity(final HttpResponse response,
                                          final Set<Integer> validStatusCodes)
            throws IOException {

        final StatusLine statusLine = response.getStatusLine();
        final int statusCode = statusLine.getStatusCode();
        final HttpEntity entity = response.getEntity();

        if (! validStatusCodes.contains(statusCode)) {
            String responseBodyText = null;
            try {
                responseBodyText = getResponseBodyText(entity);
            } catch (final Throwable t) {
                LOG.warn("failed to read entity content for error response, ignoring read failure", t);
            }
            throw new ClientProtocolException("HTTP status " + statusCode + " with body\n\n  " + responseBodyText +
                                              "\n\nreturned for\n\n  " + requestContext + "\n");
        }

        return entity;
    }

    private static final Logger LOG = LoggerFactory.getLogger(BaseResponseHandler.class);
}
