package com.streamfirst.canvas.sync.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.streamfirst.canvas.sync.domain.*;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.streamfirst.canvas.sync.application.SyncTables.*;

/**
 * Translates between typed sync records and the JSON-compatible column maps stored remotely.
 * Decoding is also validation: a row or payload that does not fit its schema is reported as
 * {@link SyncErrorKind#MALFORMED_PAYLOAD} and never partially applied.
 */
public class PayloadCodec {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public PayloadCodec() {
        this(new ObjectMapper());
    }

    public PayloadCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Parses a JSON document, e.g. a legacy local-storage blob.
     */
    public JsonNode parse(String json) throws JsonProcessingException {
        return mapper.readTree(json);
    }

    // ---------------------------------------------------------------- payloads

    /**
     * Encodes a payload into the value stored in the {@code data} column.
     */
    public Object encode(SyncPayload payload) {
        return switch (payload.dataType()) {
            case TABS -> encodeTabs((TabsPayload) payload);
            case LAYOUT -> encodeLayout((LayoutPayload) payload);
            case SETTINGS -> new LinkedHashMap<>(((SettingsPayload) payload).values());
            case EXPANDED_ITEMS -> new ArrayList<>(((ExpandedItemsPayload) payload).itemIds());
        };
    }

    private static List<Map<String, Object>> encodeTabs(TabsPayload payload) {
        List<Map<String, Object>> tabs = new ArrayList<>();
        for (Tab tab : payload.tabs()) {
            Map<String, Object> encoded = new LinkedHashMap<>();
            encoded.put("id", tab.id());
            if (tab.title() != null) {
                encoded.put("title", tab.title());
            }
            tab.attributes().forEach(encoded::putIfAbsent);
            tabs.add(encoded);
        }
        return tabs;
    }

    private static Map<String, Object> encodeLayout(LayoutPayload layout) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        encoded.put("layoutMode", layout.mode().wireName());
        encoded.put("gridModeState", new LinkedHashMap<>(layout.gridModeState()));
        return encoded;
    }

    /**
     * Decodes and validates the {@code data} column of a row with the given data type.
     */
    public Result<SyncPayload> decode(DataType dataType, Object data) {
        if (data == null) {
            return Result.failure(SyncErrorKind.MALFORMED_PAYLOAD, "No data for " + dataType.wireName());
        }
        JsonNode node;
        try {
            node = data instanceof JsonNode json ? json : mapper.valueToTree(data);
        } catch (IllegalArgumentException e) {
            return Result.failure(SyncErrorKind.MALFORMED_PAYLOAD,
                "Data for " + dataType.wireName() + " is not JSON: " + e.getMessage());
        }
        try {
            return Result.success(decodeNode(dataType, node));
        } catch (MalformedException e) {
            return Result.failure(SyncErrorKind.MALFORMED_PAYLOAD,
                "Invalid " + dataType.wireName() + " payload: " + e.getMessage());
        }
    }

    private SyncPayload decodeNode(DataType dataType, JsonNode node) {
        return switch (dataType) {
            case TABS -> decodeTabs(node);
            case LAYOUT -> decodeLayout(node);
            case SETTINGS -> {
                requireObject(node, "settings");
                yield new SettingsPayload(toMap(node));
            }
            case EXPANDED_ITEMS -> decodeExpandedItems(node);
        };
    }

    private LayoutPayload decodeLayout(JsonNode node) {
        requireObject(node, "layout");
        String mode = optionalText(node, "layoutMode");
        LayoutMode layoutMode = LayoutMode.fromWireName(mode)
            .orElseThrow(() -> new MalformedException("unknown layoutMode '" + mode + "'"));
        return new LayoutPayload(layoutMode, optionalObject(node, "gridModeState"));
    }

    private static ExpandedItemsPayload decodeExpandedItems(JsonNode node) {
        requireArray(node, "expanded items");
        List<String> ids = new ArrayList<>();
        for (JsonNode element : node) {
            if (!element.isTextual()) {
                throw new MalformedException("expanded item ids must be strings");
            }
            ids.add(element.asText());
        }
        return new ExpandedItemsPayload(ids);
    }

    private TabsPayload decodeTabs(JsonNode node) {
        requireArray(node, "tabs");
        List<Tab> tabs = new ArrayList<>();
        for (JsonNode element : node) {
            requireObject(element, "tab");
            JsonNode id = element.get("id");
            if (id == null || !id.isTextual() || id.asText().isBlank()) {
                throw new MalformedException("every tab needs a string id");
            }
            Map<String, Object> attributes = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = element.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getKey().equals("id") && !field.getKey().equals("title")) {
                    attributes.put(field.getKey(), mapper.convertValue(field.getValue(), Object.class));
                }
            }
            tabs.add(new Tab(id.asText(), optionalText(element, "title"), attributes));
        }
        return new TabsPayload(tabs);
    }

    // ---------------------------------------------------------------- canvas rows

    public Map<String, Object> toRow(SyncRecord record) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(USER_ID, record.getOwnerId().value());
        row.put(DATA_TYPE, record.getDataType().wireName());
        row.put(DATA, encode(record.getPayload()));
        row.put(DEVICE_ID, record.getDeviceId().value());
        row.put(UPDATED_AT, record.getUpdatedAt().toString());
        return row;
    }

    public Result<SyncRecord> fromRow(Map<String, Object> row) {
        try {
            OwnerId ownerId = new OwnerId(requireText(row, USER_ID));
            String wireType = requireText(row, DATA_TYPE);
            DataType dataType = DataType.fromWireName(wireType)
                .orElseThrow(() -> new MalformedException("unknown data_type '" + wireType + "'"));
            DeviceId deviceId = new DeviceId(requireText(row, DEVICE_ID));
            Instant updatedAt = parseInstant(row.get(UPDATED_AT));
            return decode(dataType, row.get(DATA))
                .map(payload -> new SyncRecord(ownerId, payload, deviceId, updatedAt));
        } catch (MalformedException | IllegalArgumentException e) {
            return Result.failure(SyncErrorKind.MALFORMED_PAYLOAD, "Invalid canvas row: " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------- preference rows

    /**
     * Builds the column map for a partial preferences upsert. Only fields present in the update are
     * included, so the upsert leaves the other columns untouched.
     */
    public Map<String, Object> toPreferencesRow(
            OwnerId ownerId, PreferencesUpdate update, DeviceId deviceId, Instant updatedAt) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(USER_ID, ownerId.value());
        if (update.getLayoutMode() != null) {
            row.put(LAYOUT_MODE, update.getLayoutMode().wireName());
        }
        if (update.getNewTabBehavior() != null) {
            row.put(NEW_TAB_BEHAVIOR, update.getNewTabBehavior());
        }
        if (update.getStartupBehavior() != null) {
            row.put(STARTUP_BEHAVIOR, update.getStartupBehavior());
        }
        if (update.getGridModeState() != null) {
            row.put(GRID_MODE_STATE, new LinkedHashMap<>(update.getGridModeState()));
        }
        if (update.getUiSettings() != null && !update.getUiSettings().isEmpty()) {
            row.put(UI_SETTINGS, encodeUiSettings(update.getUiSettings()));
        }
        row.put(DEVICE_ID, deviceId.value());
        row.put(UPDATED_AT, updatedAt.toString());
        return row;
    }

    public Result<PreferenceRecord> fromPreferencesRow(Map<String, Object> row) {
        try {
            JsonNode node = mapper.valueToTree(row);
            OwnerId ownerId = new OwnerId(requireText(row, USER_ID));
            String mode = optionalText(node, LAYOUT_MODE);
            LayoutMode layoutMode = mode == null ? null : LayoutMode.fromWireName(mode)
                .orElseThrow(() -> new MalformedException("unknown layout_mode '" + mode + "'"));
            String deviceId = optionalText(node, DEVICE_ID);
            JsonNode ui = node.get(UI_SETTINGS);

            return Result.success(PreferenceRecord.builder()
                .ownerId(ownerId)
                .layoutMode(layoutMode)
                .newTabBehavior(optionalText(node, NEW_TAB_BEHAVIOR))
                .startupBehavior(optionalText(node, STARTUP_BEHAVIOR))
                .gridModeState(node.hasNonNull(GRID_MODE_STATE) ? optionalObject(node, GRID_MODE_STATE) : null)
                .uiSettings(ui == null || ui.isNull() ? UiSettings.empty() : decodeUiSettings(ui))
                .deviceId(deviceId == null || deviceId.isBlank() ? null : new DeviceId(deviceId))
                .updatedAt(parseInstant(row.get(UPDATED_AT)))
                .build());
        } catch (MalformedException | IllegalArgumentException e) {
            return Result.failure(SyncErrorKind.MALFORMED_PAYLOAD, "Invalid preferences row: " + e.getMessage());
        }
    }

    /**
     * Reads UI toggle flags from the camel-case object used both remotely and in the legacy blob.
     */
    public UiSettings decodeUiSettings(JsonNode node) {
        requireObject(node, UI_SETTINGS);
        return UiSettings.builder()
            .secondLeftSidebarOpen(optionalBoolean(node, "isSecondLeftSidebarOpen"))
            .activeSecondaryPanel(optionalText(node, "activeSecondaryPanel"))
            .pointerFrameEnabled(optionalBoolean(node, "pointerFrameEnabled"))
            .audioTrackerEnabled(optionalBoolean(node, "audioTrackerEnabled"))
            .mouseTrackerEnabled(optionalBoolean(node, "mouseTrackerEnabled"))
            .virtualizerMode(optionalBoolean(node, "virtualizerMode"))
            .visualizerMode(optionalText(node, "visualizerMode"))
            .build();
    }

    private static Map<String, Object> encodeUiSettings(UiSettings ui) {
        Map<String, Object> encoded = new LinkedHashMap<>();
        putIfSet(encoded, "isSecondLeftSidebarOpen", ui.getSecondLeftSidebarOpen());
        putIfSet(encoded, "activeSecondaryPanel", ui.getActiveSecondaryPanel());
        putIfSet(encoded, "pointerFrameEnabled", ui.getPointerFrameEnabled());
        putIfSet(encoded, "audioTrackerEnabled", ui.getAudioTrackerEnabled());
        putIfSet(encoded, "mouseTrackerEnabled", ui.getMouseTrackerEnabled());
        putIfSet(encoded, "virtualizerMode", ui.getVirtualizerMode());
        putIfSet(encoded, "visualizerMode", ui.getVisualizerMode());
        return encoded;
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Converts an optional JSON object field to a map; absent or null yields an empty map.
     */
    public Map<String, Object> optionalObject(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Map.of();
        }
        requireObject(value, field);
        return toMap(value);
    }

    private Map<String, Object> toMap(JsonNode node) {
        return mapper.convertValue(node, MAP_TYPE);
    }

    private static void putIfSet(Map<String, Object> target, String key, Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }

    private static String requireText(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (!(value instanceof String text) || text.isBlank()) {
            throw new MalformedException("column " + column + " must be a non-empty string");
        }
        return text;
    }

    static String optionalText(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new MalformedException(field + " must be a string");
        }
        return value.asText();
    }

    static Boolean optionalBoolean(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isBoolean()) {
            throw new MalformedException(field + " must be a boolean");
        }
        return value.asBoolean();
    }

    private static void requireObject(JsonNode node, String what) {
        if (node == null || !node.isObject()) {
            throw new MalformedException(what + " must be an object");
        }
    }

    private static void requireArray(JsonNode node, String what) {
        if (node == null || !node.isArray()) {
            throw new MalformedException(what + " must be an array");
        }
    }

    private static Instant parseInstant(Object value) {
        if (value == null) {
            return Instant.EPOCH;
        }
        String text = String.valueOf(value);
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            // Postgres renders timestamptz with an offset rather than 'Z'
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException offsetFailure) {
                throw new MalformedException("updated_at '" + value + "' is not an ISO-8601 timestamp");
            }
        }
    }

    /**
     * Signals a schema violation while decoding; always converted to a {@link Result} failure.
     */
    static final class MalformedException extends RuntimeException {
        MalformedException(String message) {
            super(message);
        }
    }
}
