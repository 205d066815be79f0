package com.questrail.interactions.transport.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.interactions.api.FieldType;
import com.questrail.interactions.api.Interaction;
import com.questrail.interactions.api.InteractionKind;
import com.questrail.interactions.api.InteractionResponse;
import com.questrail.interactions.api.SubmittedField;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * InteractionJsonCodec
 * =============================================================================
 * Maps the platform's JSON interaction payloads to {@link Interaction} and
 * {@link InteractionResponse} to JSON.
 *
 * <h2>Inbound</h2>
 * <pre>
 * {"id":"…","type":3|5,"user":{"id":"…"} | "member":{"user":{"id":"…"}},
 *  "created_at":"…"?,
 *  "data":{"custom_id":"…","components":[{"type":1,"components":[…]}]}}
 * </pre>
 * Type 1 is a ping. Without {@code created_at} the creation time is read from
 * the snowflake id. Select values are joined with {@code ','}.
 *
 * <h2>Outbound</h2>
 * {@code {"type":<code>,"data":{"content":"…","flags":64}}}; flag 64 marks an
 * ephemeral message.
 */
public final class InteractionJsonCodec
{
    public static final int TYPE_PING = 1;
    public static final int TYPE_COMPONENT = 3;
    public static final int TYPE_MODAL_SUBMIT = 5;

    public static final int RESPONSE_PONG = 1;
    public static final int RESPONSE_MODAL = 9;

    public static final int FLAG_EPHEMERAL = 1 << 6;

    private static final int COMPONENT_ACTION_ROW = 1;
    private static final int COMPONENT_STRING_SELECT = 3;
    private static final int COMPONENT_TEXT_INPUT = 4;
    private static final int TEXT_INPUT_SHORT = 1;

    private static final long SNOWFLAKE_EPOCH_MILLIS = 1420070400000L;

    private final ObjectMapper mapper;

    public InteractionJsonCodec() {
        this(new ObjectMapper());
    }

    public InteractionJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public JsonNode parse(byte[] body) {
        try {
            JsonNode node = mapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new InteractionCodecException("Interaction payload must be a JSON object");
            }
            return node;
        } catch (IOException e) {
            throw new InteractionCodecException("Malformed interaction payload", e);
        }
    }

    public boolean isPing(JsonNode payload) {
        return payload.path("type").asInt() == TYPE_PING;
    }

    public Interaction toInteraction(JsonNode payload)
    {
        int type = payload.path("type").asInt(-1);
        InteractionKind kind = switch (type) {
            case TYPE_COMPONENT -> InteractionKind.COMPONENT;
            case TYPE_MODAL_SUBMIT -> InteractionKind.MODAL;
            default -> throw new InteractionCodecException("Unsupported interaction type " + type);
        };

        String id = requireText(payload, "id");
        JsonNode data = payload.path("data");
        String customId = requireText(data, "custom_id");

        JsonNode user = payload.path("member").path("user");
        if (user.isMissingNode()) {
            user = payload.path("user");
        }
        String userId = requireText(user, "id");

        Map<String, SubmittedField> fields = kind == InteractionKind.MODAL
            ? readFields(data.path("components"))
            : Map.of();

        return new Interaction(id, kind, customId, userId, createdAt(payload, id), fields);
    }

    public byte[] encode(InteractionResponse response) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode data = mapper.createObjectNode();

        if (response instanceof InteractionResponse.Message message) {
            root.put("type", message.type().code());
            data.put("content", message.content());
            if (message.ephemeral()) {
                data.put("flags", FLAG_EPHEMERAL);
            }
        } else if (response instanceof InteractionResponse.Deferred deferred) {
            root.put("type", deferred.type().code());
            if (deferred.ephemeral()) {
                data.put("flags", FLAG_EPHEMERAL);
            }
        } else if (response instanceof InteractionResponse.ModalPrompt prompt) {
            root.put("type", RESPONSE_MODAL);
            data.put("title", prompt.title());
            data.put("custom_id", prompt.customId());
            ArrayNode rows = data.putArray("components");
            for (InteractionResponse.PromptField field : prompt.fields()) {
                ObjectNode row = rows.addObject();
                row.put("type", COMPONENT_ACTION_ROW);
                ObjectNode component = row.putArray("components").addObject();
                component.put("type", field.type() == FieldType.TEXT_INPUT ? COMPONENT_TEXT_INPUT : COMPONENT_STRING_SELECT);
                component.put("custom_id", field.customId());
                component.put("label", field.label());
                if (field.type() == FieldType.TEXT_INPUT) {
                    component.put("style", TEXT_INPUT_SHORT);
                }
                component.put("required", field.required());
            }
        }

        if (!data.isEmpty()) {
            root.set("data", data);
        }
        return write(root);
    }

    public byte[] pong() {
        ObjectNode root = mapper.createObjectNode();
        root.put("type", RESPONSE_PONG);
        return write(root);
    }

    private Map<String, SubmittedField> readFields(JsonNode rows)
    {
        Map<String, SubmittedField> fields = new LinkedHashMap<>();
        for (JsonNode row : rows) {
            JsonNode components = row.has("components") ? row.path("components") : mapper.createArrayNode().add(row);
            for (JsonNode component : components) {
                String customId = requireText(component, "custom_id");
                int componentType = component.path("type").asInt();
                if (componentType == COMPONENT_TEXT_INPUT) {
                    fields.put(customId, new SubmittedField(FieldType.TEXT_INPUT, component.path("value").asText("")));
                } else if (componentType == COMPONENT_STRING_SELECT) {
                    StringBuilder joined = new StringBuilder();
                    for (JsonNode value : component.path("values")) {
                        if (joined.length() > 0) {
                            joined.append(',');
                        }
                        joined.append(value.asText());
                    }
                    fields.put(customId, new SubmittedField(FieldType.STRING_SELECT, joined.toString()));
                } else {
                    throw new InteractionCodecException("Unsupported modal component type " + componentType);
                }
            }
        }
        return fields;
    }

    private static Instant createdAt(JsonNode payload, String id)
    {
        JsonNode createdAt = payload.get("created_at");
        if (createdAt != null && createdAt.isTextual()) {
            try {
                return Instant.parse(createdAt.asText());
            } catch (DateTimeParseException e) {
                throw new InteractionCodecException("Invalid created_at '" + createdAt.asText() + "'", e);
            }
        }
        try {
            long snowflake = Long.parseUnsignedLong(id);
            return Instant.ofEpochMilli((snowflake >>> 22) + SNOWFLAKE_EPOCH_MILLIS);
        } catch (NumberFormatException e) {
            throw new InteractionCodecException("Interaction id '" + id + "' is not a snowflake and no created_at was given", e);
        }
    }

    private static String requireText(JsonNode node, String field)
    {
        JsonNode value = node.get(field);
        if (value == null || !value.isValueNode() || value.isNull()) {
            throw new InteractionCodecException("Missing '" + field + "' in interaction payload");
        }
        return value.asText();
    }

    private byte[] write(JsonNode node)
    {
        try {
            return mapper.writeValueAsBytes(node);
        } catch (JsonProcessingException e) {
            throw new InteractionCodecException("Failed to encode response", e);
        }
    }
}
