package com.vendoretl;

import com.fasterxml.jackson.databind.JsonNode;
import com.vendoretl.error.ErrorKind;
import com.vendoretl.error.TransformException;
import com.vendoretl.model.VendorRow;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Maps a raw vendor JSON object onto a {@link VendorRow}.
 *
 * <p>Identity fields are strict: if they are absent or of the wrong type the record is rejected
 * with a {@link TransformException}. Every other field is read leniently and becomes {@code null}
 * when it is missing or unusable. Numbers may arrive as JSON numbers or as numeric strings.
 * No other exception type ever escapes {@link #transform}.
 */
public class VendorRecordTransformer {

    public VendorRow transform(JsonNode raw, String cityId, Instant fetchedAt) {
        if (raw == null || !raw.isObject()) {
            throw new TransformException(ErrorKind.TRANSFORM_MALFORMED_VALUE,
                    "Vendor record is not a JSON object: " + (raw == null ? "null" : raw.getNodeType()));
        }

        return VendorRow.builder()
                .vendorId(vendorId(raw))
                .name(name(raw))
                .cityId(cityId)
                .rating(lenientDouble(raw.get("rating")))
                .deliveryFee(lenientDouble(firstPresent(raw, "minimum_delivery_fee", "delivery_fee")))
                .categories(categories(firstPresent(raw, "cuisines", "categories")))
                .latitude(lenientDouble(raw.get("latitude")))
                .longitude(lenientDouble(raw.get("longitude")))
                .fetchedAt(fetchedAt)
                .extractionStartedAt(fetchedAt)
                .extractionCompletedAt(fetchedAt)
                .build();
    }

    private static String vendorId(JsonNode raw) {
        JsonNode id = firstPresent(raw, "code", "id");
        if (id == null) {
            throw new TransformException(ErrorKind.TRANSFORM_MISSING_REQUIRED_FIELD, "Vendor record has no code/id");
        }
        if (id.isTextual()) {
            String text = id.asText().trim();
            if (text.isEmpty()) {
                throw new TransformException(ErrorKind.TRANSFORM_MALFORMED_VALUE, "Vendor id is blank");
            }
            return text;
        }
        if (id.isIntegralNumber()) {
            return id.asText();
        }
        throw new TransformException(ErrorKind.TRANSFORM_MISSING_REQUIRED_FIELD,
                "Vendor id has unsupported type " + id.getNodeType());
    }

    private static String name(JsonNode raw) {
        JsonNode name = raw.get("name");
        if (name == null || !name.isTextual()) {
            throw new TransformException(ErrorKind.TRANSFORM_MISSING_REQUIRED_FIELD,
                    "Vendor " + describeId(raw) + " has no textual name");
        }
        String text = name.asText().trim();
        if (text.isEmpty()) {
            throw new TransformException(ErrorKind.TRANSFORM_MALFORMED_VALUE, "Vendor " + describeId(raw) + " has a blank name");
        }
        return text;
    }

    /**
     * Accepts cuisine objects ({@code {"name": "Pizza"}}) or plain strings; other elements are skipped.
     */
    private static List<String> categories(JsonNode node) {
        if (node == null || !node.isArray()) {
            return null;
        }
        List<String> names = new ArrayList<>(node.size());
        for (JsonNode element : node) {
            JsonNode value = element.isObject() ? element.get("name") : element;
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                names.add(value.asText().trim());
            }
        }
        return names;
    }

    static Double lenientDouble(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        double value;
        if (node.isNumber()) {
            value = node.doubleValue();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        } else {
            return null;
        }
        return Double.isFinite(value) ? value : null;
    }

    private static JsonNode firstPresent(JsonNode raw, String... fields) {
        for (String field : fields) {
            JsonNode value = raw.get(field);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static String describeId(JsonNode raw) {
        JsonNode id = firstPresent(raw, "code", "id");
        return id == null ? "<unknown>" : id.asText();
    }
}
