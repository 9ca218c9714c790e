package org.starfield.align.client.response;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

import org.apache.commons.io.IOUtils;
import org.apache.http.HttpEntity;
import org.apache.http.HttpResponse;
import org.apache.http.client.ClientProtocolException;
import org.apache.http.client.ResponseHandler;

/**
 * Writes response content stream to a file.
 * Content is first written to a sibling temporary file so that partial downloads never appear under
 * the target name.
 */
public class FileResponseHandler
        extends BaseResponseHandler
        implements ResponseHandler<File> {

    private final File file;

    /**
     * @param  requestContext  context (e.g. "GET http://host/data/image.jpg") for use in error messages.
     * @param  file            file to which response should be written.
     */
    public FileResponseHandler(final String requestContext,
                               final File file) {
        super(requestContext);
        this.file = file;
    }

    @Override
    public File handleResponse(final HttpResponse response)
            throws IOException {

        final HttpEntity entity = getValidatedResponseEntity(response, OK);
        if (entity == null) {
            throw new ClientProtocolException("no content returned for " + getRequestContext());
        }

        final File partialFile = new File(file.getAbsolutePath() + ".part");
        try (final InputStream in = entity.getContent();
             final OutputStream out = new FileOutputStream(partialFile)) {
            IOUtils.copyLarge(in, out);
        }
        Files.move(partialFile.toPath(), file.toPath(), StandardCopyOption.REPLACE_EXISTING);

        return file;
    }
}
