package org.starfield.align.client.source;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.starfield.alignment.json.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locally cached archive catalog, stored as a JSON array of {@link FrameMetadata} ordered newest first.
 */
public class MetadataCatalog {

    /**
     * Reads one archive index page.
     */
    public interface PageReader {

        /**
         * @param  pageNumber  one-based page number.
         *
         * @return entries on the page (newest first) or null if the page does not exist.
         *
         * @throws IOException
         *   if the page cannot be read.
         */
        List<FrameMetadata> readPage(int pageNumber) throws IOException;
    }

    public static final String CATALOG_FILE_NAME = "metadata.json";

    private final File catalogFile;
    private final List<FrameMetadata> entries;

    /**
     * Loads the catalog in the specified cache directory (an empty catalog if no file exists yet).
     *
     * @throws IOException
     *   if an existing catalog file cannot be read.
     */
    public MetadataCatalog(final File cacheDirectory)
            throws IOException {

        this.catalogFile = new File(cacheDirectory, CATALOG_FILE_NAME);
        this.entries = new ArrayList<>();

        if (catalogFile.exists()) {
            try (final Reader reader = Files.newBufferedReader(catalogFile.toPath(), StandardCharsets.UTF_8)) {
                entries.addAll(JSON_HELPER.fromJsonArray(reader));
            } catch (final IllegalArgumentException e) {
                throw new IOException("failed to parse " + catalogFile.getAbsolutePath(), e);
            }
            LOG.info("MetadataCatalog: loaded {} entries from {}", entries.size(), catalogFile.getAbsolutePath());
        }
    }

    public File getCatalogFile() {
        return catalogFile;
    }

    /**
     * @return copy of the catalog entries, newest first.
     */
    public List<FrameMetadata> getEntries() {
        return new ArrayList<>(entries);
    }

    /**
     * Reads pages (newest entries first) until the first entry that is already in the catalog (or the last page)
     * is reached and adds the new entries to the front of the catalog.
     *
     * @return number of new entries.
     *
     * @throws IOException
     *   if a page cannot be read.
     */
    public int update(final PageReader pageReader)
            throws IOException {

        final Long newestKnownTimestamp = entries.isEmpty() ? null : entries.get(0).getTimestamp();

        final List<FrameMetadata> updates = new ArrayList<>();
        boolean reachedKnownEntry = false;
        for (int pageNumber = 1; ! reachedKnownEntry; pageNumber++) {

            final List<FrameMetadata> pageEntries = pageReader.readPage(pageNumber);
            if (pageEntries == null) {
                break;
            }

            for (final FrameMetadata entry : pageEntries) {
                if ((newestKnownTimestamp != null) && (entry.getTimestamp() == newestKnownTimestamp)) {
                    reachedKnownEntry = true;
                    break;
                }
                updates.add(entry);
            }
        }

        entries.addAll(0, updates);

        LOG.info("update: found {} new entries, catalog now has {} entries", updates.size(), entries.size());

        return updates.size();
    }

    /**
     * Writes the catalog (to a temporary file that then replaces the catalog file).
     */
    public void save()
            throws IOException {

        final File parentDirectory = catalogFile.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists()) && (! parentDirectory.mkdirs())) {
            throw new IOException("failed to create " + parentDirectory.getAbsolutePath());
        }

        final File tempFile = new File(catalogFile.getAbsolutePath() + ".tmp");
        try (final Writer writer = Files.newBufferedWriter(tempFile.toPath(), StandardCharsets.UTF_8)) {
            writer.write(JSON_HELPER.toJsonArray(entries));
        }
        Files.move(tempFile.toPath(), catalogFile.toPath(), StandardCopyOption.REPLACE_EXISTING);

        LOG.info("save: wrote {} entries to {}", entries.size(), catalogFile.getAbsolutePath());
    }

    private static final JsonUtils.Helper<FrameMetadata> JSON_HELPER = new JsonUtils.Helper<>(FrameMetadata.class);

    private static final Logger LOG = LoggerFactory.getLogger(MetadataCatalog.class);
}
