package org.janelia.dwiproc.util;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Shared file management utilities.
 */
public class FileUtil {

    public static final FileUtil DEFAULT_INSTANCE = new FileUtil();

    private final int bufferSize;

    public FileUtil() {
        this(DEFAULT_BUFFER_SIZE);
    }

    public FileUtil(final int bufferSize) {
        this.bufferSize = bufferSize;
    }

    /**
     * @return buffered stream for the specified file, transparently decompressing ".gz" files.
     */
    public InputStream getExtensionBasedInputStream(final String fullPathName)
            throws IOException {

        final InputStream inputStream = new BufferedInputStream(new FileInputStream(fullPathName), bufferSize);

        if (fullPathName.endsWith(".gz")) {
            return new GZIPInputStream(inputStream, bufferSize);
        }

        return inputStream;
    }

    /**
     * @return buffered stream for the specified file, transparently compressing ".gz" files.
     */
    public OutputStream getExtensionBasedOutputStream(final String fullPathName)
            throws IOException {

        final OutputStream outputStream = new BufferedOutputStream(new FileOutputStream(fullPathName), bufferSize);

        if (fullPathName.endsWith(".gz")) {
            return new GZIPOutputStream(outputStream, bufferSize);
        }

        return outputStream;
    }

    public Reader getExtensionBasedReader(final String fullPathName)
            throws IOException {
        return new InputStreamReader(getExtensionBasedInputStream(fullPathName), StandardCharsets.UTF_8);
    }

    public Writer getExtensionBasedWriter(final String fullPathName)
            throws IOException {
        return new OutputStreamWriter(getExtensionBasedOutputStream(fullPathName), StandardCharsets.UTF_8);
    }

    public static void ensureWritableDirectory(final File directory) {
        // try twice to work around concurrent access issues
        if (! directory.exists()) {
            if (! directory.mkdirs()) {
                if (! directory.exists()) {
                    // last try
                    if (! directory.mkdirs()) {
                        if (! directory.exists()) {
                            throw new IllegalArgumentException("failed to create " + directory);
                        }
                    }
                }
            }
        }
        if (! directory.canWrite()) {
            throw new IllegalArgumentException("not allowed to write to " + directory);
        }
    }

    public static boolean deleteRecursive(final File file) {

        boolean deleteSuccessful = true;

        if (file.isDirectory()){
            final File[] files = file.listFiles();
            if (files != null) {
                for (final File f : files) {
                    deleteSuccessful = deleteSuccessful && deleteRecursive(f);
                }
            }
        }

        if (file.delete()) {
            LOG.debug("deleted {}", file.getAbsolutePath());
        } else {
            LOG.warn("failed to delete {}", file.getAbsolutePath());
            deleteSuccessful = false;
        }

        return deleteSuccessful;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileUtil.class);

    private static final int DEFAULT_BUFFER_SIZE = 65536;
}
