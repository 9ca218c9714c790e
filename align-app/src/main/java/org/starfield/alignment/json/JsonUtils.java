package org.starfield.alignment.json;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.type.CollectionType;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.List;

/**
 * Utilities for working with JSON data (parameter files, catalogs and run reports).
 * Mappers work on fields so that public JCommander parameter fields serialize directly.
 */
public class JsonUtils {

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

    public static final ObjectMapper STRICT_MAPPER = FAST_MAPPER.copy().
            configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);

    public static DefaultPrettyPrinter getArraysOnNewLinePrettyPrinter() {
        final DefaultPrettyPrinter printer = new DefaultPrettyPrinter();
        printer.indentArraysWith(DefaultIndenter.SYSTEM_LINEFEED_INSTANCE);
        return printer;
    }

    /**
     * Typed (de)serialization helper that converts Jackson I/O failures into
     * {@link IllegalArgumentException}s.
     */
    public static class Helper<T> {

        private final ObjectMapper mapper;
        private final Class<T> valueType;
        private final CollectionType collectionType;

        public Helper(final Class<T> valueType) {
            this(MAPPER, valueType);
        }

        public Helper(final ObjectMapper mapper,
                      final Class<T> valueType) {
            this.mapper = mapper;
            this.valueType = valueType;
            this.collectionType = this.mapper.getTypeFactory().constructCollectionType(List.class, valueType);
        }

        public String toJson(final T value)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(value);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public void toJson(final T value,
                           final Writer writer)
                throws IOException {
            mapper.writeValue(writer, value);
        }

        public T fromJson(final String json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public T fromJson(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, valueType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public String toJsonArray(final List<T> values)
                throws IllegalArgumentException {
            try {
                return mapper.writeValueAsString(values);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

        public List<T> fromJsonArray(final Reader json)
                throws IllegalArgumentException {
            try {
                return mapper.readValue(json, collectionType);
            } catch (final IOException e) {
                throw new IllegalArgumentException(e);
            }
        }

    }

}
