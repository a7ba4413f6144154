package com.ryuqq.icnp.core.message;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.model.Actor;
import com.ryuqq.icnp.core.model.ActorRole;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * 타입이 확인된 JSON 필드 읽기/쓰기 헬퍼.
 *
 * <p>모든 읽기 메서드는 형식 오류 시 필드 경로를 담은 {@link IllegalArgumentException}을 던지며,
 * 코덱이 이를 {@code invalid_intent}로 변환합니다.</p>
 */
final class JsonFields {

    private JsonFields() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static ObjectNode requireObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("field '" + field + "' must be an object");
        }
        return (ObjectNode) node;
    }

    static ObjectNode optionalObject(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw new IllegalArgumentException("field '" + field + "' must be an object");
        }
        return (ObjectNode) node;
    }

    static ArrayNode optionalArray(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException("field '" + field + "' must be an array");
        }
        return (ArrayNode) node;
    }

    static String requireText(JsonNode parent, String field) {
        String value = optionalText(parent, field);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("field '" + field + "' is required");
        }
        return value;
    }

    static String optionalText(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw new IllegalArgumentException("field '" + field + "' must be a string");
        }
        return node.textValue();
    }

    static boolean optionalBoolean(JsonNode parent, String field, boolean defaultValue) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return defaultValue;
        }
        if (!node.isBoolean()) {
            throw new IllegalArgumentException("field '" + field + "' must be a boolean");
        }
        return node.booleanValue();
    }

    static Integer optionalInt(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isIntegralNumber() || !node.canConvertToInt()) {
            throw new IllegalArgumentException("field '" + field + "' must be an integer");
        }
        return node.intValue();
    }

    static Double optionalDouble(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isNumber()) {
            throw new IllegalArgumentException("field '" + field + "' must be a number");
        }
        return node.doubleValue();
    }

    static Instant requireTimestamp(JsonNode parent, String field) {
        return ProtocolJson.parseTimestamp(requireText(parent, field));
    }

    static Instant optionalTimestamp(JsonNode parent, String field) {
        String text = optionalText(parent, field);
        return text == null ? null : ProtocolJson.parseTimestamp(text);
    }

    static List<String> optionalTextList(JsonNode parent, String field) {
        ArrayNode array = optionalArray(parent, field);
        List<String> values = new ArrayList<>();
        if (array == null) {
            return values;
        }
        for (JsonNode element : array) {
            if (!element.isTextual()) {
                throw new IllegalArgumentException("field '" + field + "' must contain only strings");
            }
            values.add(element.textValue());
        }
        return values;
    }

    static Actor readActor(JsonNode node, String field) {
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("field '" + field + "' must be an object");
        }
        String id = requireText(node, "id");
        String roleName = requireText(node, "role");
        ActorRole role = ActorRole.fromWire(roleName)
            .orElseThrow(() -> new IllegalArgumentException("field '" + field + ".role' has unknown value: " + roleName));
        return new Actor(id, role, optionalText(node, "display_name"));
    }

    static ObjectNode writeActor(Actor actor) {
        ObjectNode node = ProtocolJson.objectNode();
        node.put("id", actor.id());
        node.put("role", actor.role().wireName());
        if (actor.displayName() != null) {
            node.put("display_name", actor.displayName());
        }
        return node;
    }

    static void putTimestamp(ObjectNode node, String field, Instant instant) {
        if (instant != null) {
            node.set(field, ProtocolJson.timestamp(instant));
        }
    }

    static void putIfNotNull(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
