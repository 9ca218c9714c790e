package org.starfield.alignment.image;

import ij.ImagePlus;
import ij.io.Opener;
import ij.io.TiffEncoder;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.time.Instant;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes frames as image files.
 */
public class FrameFiles {

    public static final String JPEG_FORMAT = "jpg";
    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    private FrameFiles() {
    }

    /**
     * Opens an image file with ImageJ.
     *
     * @param  file       image file (any format ImageJ's {@link Opener} supports).
     * @param  timestamp  acquisition time to assign to the frame.
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static Frame open(final File file,
                             final Instant timestamp)
            throws IOException {

        if (! file.isFile()) {
            throw new IOException(file.getAbsolutePath() + " does not exist");
        }

        final ImagePlus imagePlus = new Opener().openImage(file.getAbsolutePath());
        if (imagePlus == null) {
            throw new IOException("failed to decode " + file.getAbsolutePath());
        }

        return Frame.fromImageProcessor(imagePlus.getProcessor(), timestamp);
    }

    /**
     * Saves a frame in the format indicated by the file's extension.
     * Tiff files keep 32-bit float intensities, other formats are clamped to 8-bit.
     *
     * @throws IOException
     *   if no writer exists for the format or the file cannot be written.
     */
    public static void save(final Frame frame,
                            final File file,
                            final float jpegQuality)
            throws IOException {

        final String path = file.getAbsolutePath();
        final String format = path.substring(path.lastIndexOf('.') + 1).toLowerCase();

        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if ((! parentDirectory.mkdirs()) && (! parentDirectory.exists())) {
                throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
            }
        }

        if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {

            final ImagePlus imagePlus = new ImagePlus("", frame.toImageProcessor());
            try (final FileOutputStream outputStream = new FileOutputStream(file)) {
                new TiffEncoder(imagePlus.getFileInfo()).write(outputStream);
            }

        } else {

            final ImageProcessor processor = frame.toImageProcessor();
            final BufferedImage image;
            if (processor instanceof ColorProcessor) {
                image = processor.getBufferedImage();
            } else {
                image = processor.convertToByteProcessor(false).getBufferedImage();
            }
            writeImage(image, format, jpegQuality, file);

        }

        LOG.debug("save: exit, saved {}", path);
    }

    private static void writeImage(final BufferedImage image,
                                   final String format,
                                   final float jpegQuality,
                                   final File file)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);
        if ((writersForFormat == null) || (! writersForFormat.hasNext())) {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }

        final ImageWriter writer = writersForFormat.next();
        try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
            writer.setOutput(outputStream);
            if (JPEG_FORMAT.equals(format) || "jpeg".equals(format)) {
                final ImageWriteParam param = writer.getDefaultWriteParam();
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(jpegQuality);
                writer.write(null, new IIOImage(image, null, null), param);
            } else {
                writer.write(image);
            }
        } finally {
            writer.dispose();
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(FrameFiles.class);
}
