package com.codexwatch.store;

import com.codexwatch.error.CorruptStateException;
import com.codexwatch.model.Checkpoint;
import com.codexwatch.model.LaneKind;
import com.codexwatch.model.LaneState;
import com.codexwatch.model.Timestamps;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.TreeSet;

/**
 * Reads and writes the persisted checkpoint record.
 *
 * <pre>
 * {
 *   "last_merged_at" : "2026-02-17T09:00:00Z",
 *   "processed_pr_ids" : [ 101, 102 ],
 *   "last_release_published_at" : null,
 *   "processed_release_ids" : [ ]
 * }
 * </pre>
 *
 * Missing lane fields read as an empty lane. Ids are written sorted and
 * without duplicates.
 */
public final class CheckpointCodec {

    private final ObjectMapper objectMapper;

    public CheckpointCodec() {
        this.objectMapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    public byte[] encode(Checkpoint checkpoint) {
        ObjectNode root = objectMapper.createObjectNode();
        for (LaneKind kind : LaneKind.values()) {
            LaneState lane = checkpoint.lane(kind);
            if (lane.hasWatermark()) {
                root.put(kind.watermarkField(), Timestamps.format(lane.watermark()));
            } else {
                root.putNull(kind.watermarkField());
            }
            ArrayNode ids = root.putArray(kind.seenIdsField());
            lane.seenIds().forEach(ids::add);
        }
        try {
            String json = objectMapper.writeValueAsString(root);
            return (json + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize checkpoint", e);
        }
    }

    /**
     * @param source where the payload came from, used in error messages
     * @throws CorruptStateException if the payload is not a valid checkpoint record
     */
    public Checkpoint decode(byte[] payload, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (IOException e) {
            throw new CorruptStateException("Invalid JSON in checkpoint: " + source, e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptStateException("Checkpoint must contain a JSON object: " + source);
        }

        Checkpoint checkpoint = Checkpoint.empty();
        for (LaneKind kind : LaneKind.values()) {
            checkpoint = checkpoint.withLane(kind, decodeLane(root, kind, source));
        }
        return checkpoint;
    }

    private static LaneState decodeLane(JsonNode root, LaneKind kind, String source) {
        Instant watermark = decodeWatermark(root.get(kind.watermarkField()), kind, source);
        TreeSet<Long> ids = decodeIds(root.get(kind.seenIdsField()), kind, source);

        if (watermark == null && !ids.isEmpty()) {
            throw new CorruptStateException(
                    kind.seenIdsField() + " must be empty while " + kind.watermarkField()
                            + " is null: " + source);
        }
        return new LaneState(watermark, ids);
    }

    private static Instant decodeWatermark(JsonNode node, LaneKind kind, String source) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new CorruptStateException(
                    kind.watermarkField() + " must be an ISO8601 string or null: " + source);
        }
        try {
            return Timestamps.parseUtc(node.asText());
        } catch (DateTimeParseException e) {
            throw new CorruptStateException(
                    "Invalid ISO8601 datetime in " + kind.watermarkField() + ": '"
                            + node.asText() + "' (" + source + ")", e);
        }
    }

    private static TreeSet<Long> decodeIds(JsonNode node, LaneKind kind, String source) {
        TreeSet<Long> ids = new TreeSet<>();
        if (node == null) {
            return ids;
        }
        if (!node.isArray()) {
            throw new CorruptStateException(kind.seenIdsField() + " must be a list: " + source);
        }
        for (JsonNode element : node) {
            ids.add(decodeId(element, kind, source));
        }
        return ids;
    }

    private static long decodeId(JsonNode element, LaneKind kind, String source) {
        if (element.isIntegralNumber() && element.canConvertToLong()) {
            return element.longValue();
        }
        if (element.isTextual()) {
            try {
                return Long.parseLong(element.asText().strip());
            } catch (NumberFormatException e) {
                throw new CorruptStateException(
                        kind.seenIdsField() + " must contain integers: " + source, e);
            }
        }
        throw new CorruptStateException(kind.seenIdsField() + " must contain integers: " + source);
    }
}
