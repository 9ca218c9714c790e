package org.starfield.align.client.source;

import java.io.File;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClientBuilder;
import org.starfield.align.client.parameter.ArchiveParameters;
import org.starfield.align.client.request.RequestThrottle;
import org.starfield.align.client.request.WaitingRetryHandler;
import org.starfield.align.client.response.FileResponseHandler;
import org.starfield.align.client.response.TextResponseHandler;
import org.starfield.alignment.FetchFailureException;
import org.starfield.alignment.image.Frame;
import org.starfield.alignment.image.FrameFiles;
import org.starfield.alignment.pipeline.FrameLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Frames published by a remote image archive, cached locally.
 *
 * The archive's thumbnail index pages are merged into a local {@link MetadataCatalog}.
 * Images missing from the cache directory are downloaded by their loaders, so downloads run in the
 * alignment workers and a failed download only skips its frame.
 * Every request goes through the shared {@link RequestThrottle}.
 */
public class ArchiveFrameSource
        implements FrameSource {

    private final String archiveUrl;
    private final File cacheDirectory;
    private final boolean updateMetadata;
    private final boolean downloadMissing;
    private final RequestThrottle throttle;
    private final CloseableHttpClient httpClient;
    private final ThumbnailPageParser pageParser;

    public ArchiveFrameSource(final ArchiveParameters parameters) {
        this(parameters.getNormalizedArchiveUrl(),
             new File(parameters.cacheDirectory).getAbsoluteFile(),
             parameters.updateMetadata,
             parameters.downloadMissing,
             new RequestThrottle(parameters.requestIntervalMilliseconds, parameters.maxRequests),
             HttpClientBuilder.create().setRetryHandler(new WaitingRetryHandler()).build());
    }

    /**
     * @param  archiveUrl       base URL of the archive (with trailing slash).
     * @param  cacheDirectory   directory for the catalog and downloaded images.
     * @param  updateMetadata   indicates whether index pages should be read to update the catalog.
     * @param  downloadMissing  indicates whether images missing from the cache should be downloaded.
     * @param  throttle         limits requests to the archive.
     * @param  httpClient       client for all archive requests (closed by {@link #close()}).
     */
    public ArchiveFrameSource(final String archiveUrl,
                              final File cacheDirectory,
                              final boolean updateMetadata,
                              final boolean downloadMissing,
                              final RequestThrottle throttle,
                              final CloseableHttpClient httpClient) {
        this.archiveUrl = archiveUrl;
        this.cacheDirectory = cacheDirectory;
        this.updateMetadata = updateMetadata;
        this.downloadMissing = downloadMissing;
        this.throttle = throttle;
        this.httpClient = httpClient;
        this.pageParser = new ThumbnailPageParser(archiveUrl);
    }

    @Override
    public List<FrameLoader> fetch(final TimeRange range)
            throws IOException {

        LOG.info("fetch: entry, range {}, archiveUrl {}, cacheDirectory {}", range, archiveUrl, cacheDirectory);

        final MetadataCatalog catalog = new MetadataCatalog(cacheDirectory);
        if (updateMetadata) {
            catalog.update(this::readPage);
            catalog.save();
        }

        final List<FrameMetadata> selectedEntries = new ArrayList<>();
        for (final FrameMetadata entry : catalog.getEntries()) {
            if (range.contains(entry.getInstant())) {
                selectedEntries.add(entry);
            }
        }
        selectedEntries.sort(Comparator.comparingLong(FrameMetadata::getTimestamp));

        final List<FrameLoader> loaders = new ArrayList<>(selectedEntries.size());
        int missingCount = 0;
        for (final FrameMetadata entry : selectedEntries) {
            final File imageFile = new File(cacheDirectory, entry.getImagePath());
            if (! imageFile.exists()) {
                missingCount++;
            }
            loaders.add(new CachedImageLoader(entry, imageFile));
        }

        LOG.info("fetch: exit, returning {} loaders, {} images are not cached yet", loaders.size(), missingCount);

        return loaders;
    }

    /**
     * @return entries on the specified index page or null if the page does not exist.
     */
    List<FrameMetadata> readPage(final int pageNumber)
            throws IOException {

        final String pageUrl = archiveUrl + "index.php?page=" + pageNumber;
        LOG.info("readPage: fetching {}", pageUrl);

        acquireRequest();
        final String pageText = httpClient.execute(new HttpGet(pageUrl), new TextResponseHandler("GET " + pageUrl));

        try {
            return pageText == null ? null : pageParser.parsePage(pageText);
        } catch (final IllegalArgumentException e) {
            throw new IOException("failed to parse " + pageUrl, e);
        }
    }

    void download(final FrameMetadata entry,
                  final File imageFile)
            throws IOException {

        final File parentDirectory = imageFile.getParentFile();
        if ((! parentDirectory.exists()) && (! parentDirectory.mkdirs()) && (! parentDirectory.exists())) {
            throw new IOException("failed to create " + parentDirectory.getAbsolutePath());
        }

        LOG.info("download: downloading {} to {}", entry.getUrl(), imageFile.getAbsolutePath());

        acquireRequest();
        httpClient.execute(new HttpGet(entry.getUrl()), new FileResponseHandler("GET " + entry.getUrl(), imageFile));
    }

    private void acquireRequest()
            throws IOException {
        try {
            throttle.acquire();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while waiting to send archive request");
        }
    }

    @Override
    public void close()
            throws IOException {
        httpClient.close();
    }

    /**
     * Loads a frame from the cache, downloading it first when it is missing.
     */
    private class CachedImageLoader
            implements FrameLoader {

        private final FrameMetadata entry;
        private final File imageFile;

        CachedImageLoader(final FrameMetadata entry,
                          final File imageFile) {
            this.entry = entry;
            this.imageFile = imageFile;
        }

        @Override
        public Instant getTimestamp() {
            return entry.getInstant();
        }

        @Override
        public Frame load()
                throws FetchFailureException {

            try {
                if (! imageFile.exists()) {
                    if (! downloadMissing) {
                        throw new FetchFailureException("image " + imageFile.getAbsolutePath() +
                                                        " has not been downloaded");
                    }
                    download(entry, imageFile);
                }
                return FrameFiles.open(imageFile, entry.getInstant());
            } catch (final IOException | IllegalStateException e) {
                throw new FetchFailureException("failed to fetch " + entry.getUrl() + ": " + e.getMessage(), e);
            }
        }

        @Override
        public String toString() {
            return String.valueOf(entry);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(ArchiveFrameSource.class);
}
