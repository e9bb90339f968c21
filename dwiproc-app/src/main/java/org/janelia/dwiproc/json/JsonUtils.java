package org.janelia.dwiproc.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;

import org.janelia.dwiproc.util.FileUtil;

/**
 * Utilities for working with JSON data (parameter dumps and BIDS sidecar files).
 */
public class JsonUtils {

    public static DefaultPrettyPrinter getArraysOnNewLinePrettyPrinter() {
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }

    public static final ObjectMapper FAST_MAPPER = new ObjectMapper().
            setSerializationInclusion(JsonInclude.Include.NON_NULL).
            setVisibility(PropertyAccessor.FIELD, JsonAutoDetect.Visibility.ANY).
            setVisibility(PropertyAccessor.GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.IS_GETTER, JsonAutoDetect.Visibility.NONE).
            setVisibility(PropertyAccessor.SETTER, JsonAutoDetect.Visibility.NONE).
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public static final ObjectMapper MAPPER = FAST_MAPPER.copy().
            setDefaultPrettyPrinter(getArraysOnNewLinePrettyPrinter()).
            enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * @param  path  path of a (possibly gzipped) JSON file.
     *
     * @return tree representation of the file's contents.
     *
     * @throws IOException
     *   if the file cannot be read or parsed.
     */
    public static JsonNode loadTree(final Path path)
            throws IOException {
        try (final Reader reader = FileUtil.DEFAULT_INSTANCE.getExtensionBasedReader(path.toString())) {
            return MAPPER.readTree(reader);
        } catch (final IOException e) {
            throw new IOException("failed to parse JSON from " + path, e);
        }
    }

    /**
     * @return JSON representation of the specified value (for logging).
     *
     * @throws IllegalArgumentException
     *   if the value cannot be serialized.
     */
    public static String toJson(final Object value)
            throws IllegalArgumentException {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (final IOException e) {
            throw new IllegalArgumentException(e);
        }
    }

}
