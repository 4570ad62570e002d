package com.alninja.billing.common.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import javax.annotation.Nullable;
import java.io.IOException;

public abstract class JsonHelper {

    private static final ObjectMapper JSON = CustomJsonObjectMapperFactory.build();

    public static ObjectMapper getMapper() {
        return JSON;
    }

    public static String asJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            // Only thrown if the value itself cannot be serialized, which is a programming error.
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static byte[] asUtf8Bytes(Object value) {
        try {
            return JSON.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static <T> T fromJson(String string, Class<T> valueType) {
        try {
            return JSON.readValue(string, valueType);
        } catch (IOException e) {
            // Must be malformed JSON.  Other kinds of I/O errors don't get thrown when reading from a string.
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static <T> T fromJson(String string, TypeReference<T> reference) {
        try {
            return JSON.readValue(string, reference);
        } catch (IOException e) {
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static <T> T fromUtf8Bytes(byte[] bytes, Class<T> valueType) {
        try {
            return JSON.readValue(bytes, valueType);
        } catch (IOException e) {
            // Must be malformed JSON.  Other kinds of I/O errors don't get thrown when reading from bytes.
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    public static <T> T fromUtf8Bytes(byte[] bytes, TypeReference<T> reference) {
        try {
            return JSON.readValue(bytes, reference);
        } catch (IOException e) {
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    /**
     * Parses a stored document.  A missing or empty document yields {@code defaultValue}, which is returned as a
     * copy so callers may mutate the result freely.
     */
    public static JsonNode readTree(@Nullable byte[] bytes, JsonNode defaultValue) {
        if (bytes == null || bytes.length == 0) {
            return defaultValue.deepCopy();
        }
        try {
            JsonNode node = JSON.readTree(bytes);
            return node == null || node.isNull() || node.isMissingNode() ? defaultValue.deepCopy() : node;
        } catch (IOException e) {
            throw new IllegalArgumentException(e.toString(), e);
        }
    }

    /** Convert from one pojo format to another pojo format. */
    public static <T> T convert(Object source, Class<T> destType) {
        return JSON.convertValue(source, destType);
    }

    /** Convert from one pojo format to another pojo format. */
    public static <T> T convert(Object source, TypeReference<T> destType) {
        return JSON.convertValue(source, destType);
    }

    public static JsonNode toTree(Object value) {
        return JSON.valueToTree(value);
    }

    public static ObjectNode newObject() {
        return JsonNodeFactory.instance.objectNode();
    }

    public static ArrayNode newArray() {
        return JsonNodeFactory.instance.arrayNode();
    }
}
