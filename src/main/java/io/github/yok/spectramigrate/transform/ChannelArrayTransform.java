package io.github.yok.spectramigrate.transform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.sql.Array;
import java.sql.SQLException;
import java.util.Collection;
import org.apache.commons.lang3.StringUtils;

/**
 * Normalizes a spectrum channel array to {@code Double[]}.
 *
 * <p>
 * Accepted representations:
 * </p>
 * <ul>
 * <li>JSON text such as {@code "[12, 40, 7]"}</li>
 * <li>JSON text stored as a UTF-8 BLOB ({@code byte[]})</li>
 * <li>native arrays: {@link Array}, {@code double[]}, {@code int[]}, {@code long[]},
 * {@code Number[]}, or a {@link Collection} of numbers</li>
 * </ul>
 *
 * <p>
 * {@code null}, blank text and the JSON literal {@code null} map to {@code null}. Anything else,
 * including JSON that is not a flat array of numbers, raises {@link RowTransformException}.
 * </p>
 */
public class ChannelArrayTransform implements ColumnTransform {

    private final ObjectMapper objectMapper;

    /**
     * Creates the transform with a default {@link ObjectMapper}.
     */
    public ChannelArrayTransform() {
        this(new ObjectMapper());
    }

    /**
     * Creates the transform.
     *
     * @param objectMapper mapper used to read JSON text
     */
    public ChannelArrayTransform(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public Object apply(Object value) throws RowTransformException {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            return parseJson((String) value);
        }
        if (value instanceof byte[]) {
            return parseJson(new String((byte[]) value, StandardCharsets.UTF_8));
        }
        if (value instanceof Array) {
            try {
                return fromNative(((Array) value).getArray());
            } catch (SQLException e) {
                throw new RowTransformException("Cannot read native channel array", e);
            }
        }
        return fromNative(value);
    }

    private Double[] parseJson(String text) throws RowTransformException {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RowTransformException(
                    "Channels are not valid JSON: " + StringUtils.abbreviate(text, 40), e);
        }
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new RowTransformException(
                    "Channels JSON is not an array: " + StringUtils.abbreviate(text, 40));
        }
        Double[] channels = new Double[node.size()];
        for (int i = 0; i < node.size(); i++) {
            JsonNode element = node.get(i);
            if (element.isNull()) {
                channels[i] = null;
            } else if (element.isNumber()) {
                channels[i] = element.doubleValue();
            } else {
                throw new RowTransformException(
                        "Channel " + i + " is not a number: " + element.toString());
            }
        }
        return channels;
    }

    private Double[] fromNative(Object value) throws RowTransformException {
        if (value instanceof Double[]) {
            return (Double[]) value;
        }
        if (value instanceof double[]) {
            double[] src = (double[]) value;
            Double[] channels = new Double[src.length];
            for (int i = 0; i < src.length; i++) {
                channels[i] = src[i];
            }
            return channels;
        }
        if (value instanceof int[]) {
            int[] src = (int[]) value;
            Double[] channels = new Double[src.length];
            for (int i = 0; i < src.length; i++) {
                channels[i] = (double) src[i];
            }
            return channels;
        }
        if (value instanceof long[]) {
            long[] src = (long[]) value;
            Double[] channels = new Double[src.length];
            for (int i = 0; i < src.length; i++) {
                channels[i] = (double) src[i];
            }
            return channels;
        }
        if (value instanceof Object[]) {
            return fromElements((Object[]) value);
        }
        if (value instanceof Collection) {
            return fromElements(((Collection<?>) value).toArray());
        }
        throw new RowTransformException(
                "Unsupported channel representation: " + value.getClass().getName());
    }

    private Double[] fromElements(Object[] elements) throws RowTransformException {
        Double[] channels = new Double[elements.length];
        for (int i = 0; i < elements.length; i++) {
            Object element = elements[i];
            if (element == null) {
                channels[i] = null;
            } else if (element instanceof Number) {
                channels[i] = ((Number) element).doubleValue();
            } else {
                throw new RowTransformException(
                        "Channel " + i + " is not a number: " + element);
            }
        }
        return channels;
    }
}
