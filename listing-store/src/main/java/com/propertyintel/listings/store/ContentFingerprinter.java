package com.propertyintel.listings.store;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.propertyintel.listings.model.VolatileFields;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Stable SHA-256 digest over the volatile fields of an observation.
 *
 * Canonical form:
 *  - fields in a fixed order, one "name=value" line each
 *  - strings trimmed, blank treated as null
 *  - numbers compared by value (1500 == 1500.0 == 1500.00)
 *  - details rendered as JSON with keys sorted at every level and null entries dropped
 *
 * Accidental collisions are accepted; this is deduplication, not change auditing.
 */
public class ContentFingerprinter {

    private static final String NULL_MARKER = "\u0000";

    private final ObjectMapper mapper;

    public ContentFingerprinter(ObjectMapper objectMapper) {
        this.mapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false)
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public String fingerprint(VolatileFields fields) {
        StringBuilder canonical = new StringBuilder(256);
        append(canonical, "status", text(fields.getStatus()));
        append(canonical, "price", number(fields.getPrice()));
        append(canonical, "floor_area", number(fields.getFloorArea()));
        append(canonical, "plot_area", number(fields.getPlotArea()));
        append(canonical, "number_of_rooms", number(fields.getNumberOfRooms()));
        append(canonical, "number_of_bedrooms", number(fields.getNumberOfBedrooms()));
        append(canonical, "energy_label", text(fields.getEnergyLabel()));
        append(canonical, "details", canonicalDetailsJson(fields.getDetails()));
        return sha256(canonical.toString());
    }

    /**
     * The JSON written to {@code details_json}: same canonical form the digest uses,
     * or null for an empty payload.
     */
    public String canonicalDetailsJson(Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        Object canonical = canonicalize(mapper.valueToTree(details));
        if (canonical instanceof Map<?, ?> map && map.isEmpty()) {
            return null;
        }
        try {
            return mapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Details payload is not serialisable: " + e.getMessage(), e);
        }
    }

    // ── Canonicalisation ─────────────────────────────────────────────────────

    private Object canonicalize(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isObject()) {
            Map<String, Object> sorted = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fieldsIt = node.fields();
            while (fieldsIt.hasNext()) {
                Map.Entry<String, JsonNode> entry = fieldsIt.next();
                Object value = canonicalize(entry.getValue());
                if (value != null) {
                    sorted.put(entry.getKey(), value);
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            List<Object> items = new ArrayList<>(node.size());
            for (JsonNode item : node) {
                items.add(canonicalize(item));
            }
            return items;
        }
        if (node.isNumber()) {
            return strip(node.decimalValue());
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        return text(node.asText());
    }

    private static void append(StringBuilder sb, String name, String value) {
        sb.append(name).append('=').append(value == null ? NULL_MARKER : value).append('\n');
    }

    private static String text(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String number(Number value) {
        if (value == null) {
            return null;
        }
        BigDecimal decimal = value instanceof BigDecimal bd ? bd : new BigDecimal(value.toString());
        return strip(decimal).toPlainString();
    }

    private static BigDecimal strip(BigDecimal value) {
        return value.signum() == 0 ? BigDecimal.ZERO : value.stripTrailingZeros();
    }

    private static String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
