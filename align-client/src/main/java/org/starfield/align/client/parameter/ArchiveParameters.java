package org.starfield.align.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for acquiring frames from a remote image archive.
 */
public class ArchiveParameters
        implements Serializable {

    @Parameter(
            names = "--archiveUrl",
            description = "Base URL of the image archive (thumbnail index pages are <archiveUrl>index.php?page=<n>)")
    public String archiveUrl;

    @Parameter(
            names = "--cacheDirectory",
            description = "Directory for downloaded images and the metadata.json catalog")
    public String cacheDirectory;

    @Parameter(
            names = "--updateMetadata",
            description = "Fetch index pages for entries newer than the cached catalog before aligning",
            arity = 1)
    public boolean updateMetadata = true;

    @Parameter(
            names = "--downloadMissing",
            description = "Download images that are missing from the cache (otherwise missing images are skipped)",
            arity = 1)
    public boolean downloadMissing = true;

    @Parameter(
            names = "--requestIntervalMilliseconds",
            description = "Minimum time between archive requests")
    public Long requestIntervalMilliseconds;

    @Parameter(
            names = "--maxRequests",
            description = "Maximum number of archive requests per run")
    public Integer maxRequests;

    public boolean isDefined() {
        return archiveUrl != null;
    }

    public void setDefaults() {
        if (requestIntervalMilliseconds == null) {
            requestIntervalMilliseconds = 1000L;
        }
        if (maxRequests == null) {
            maxRequests = 1000;
        }
    }

    public void validateAndSetDefaults()
            throws IllegalArgumentException {

        setDefaults();

        if (cacheDirectory == null) {
            throw new IllegalArgumentException("--cacheDirectory must be specified with --archiveUrl");
        }
        if (requestIntervalMilliseconds < 0) {
            throw new IllegalArgumentException("requestIntervalMilliseconds must not be negative");
        }
        if (maxRequests < 1) {
            throw new IllegalArgumentException("maxRequests must be at least 1");
        }
    }

    /**
     * @return archive URL with a trailing slash.
     */
    public String getNormalizedArchiveUrl() {
        return archiveUrl.endsWith("/") ? archiveUrl : archiveUrl + "/";
    }

}
