package com.ryuqq.icnp.adapter.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.message.ProtocolJson;
import com.ryuqq.icnp.core.spi.Canonicalizer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Jackson 기반 정규 JSON.
 *
 * <p>객체 키를 사전순으로 정렬하고 공백 없이 UTF-8로 기록합니다. 배열 순서와 숫자 표기는
 * 입력 그대로 유지하며, NaN/Infinity는 거부합니다.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class JacksonCanonicalizer implements Canonicalizer {

    private final ObjectMapper mapper;

    public JacksonCanonicalizer() {
        this(ProtocolJson.mapper());
    }

    public JacksonCanonicalizer(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    @Override
    public byte[] canonicalize(JsonNode json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        try {
            return mapper.writeValueAsBytes(sorted(json));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to write canonical JSON", e);
        }
    }

    private JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> iterator = node.fieldNames();
            iterator.forEachRemaining(names::add);
            names.sort(String::compareTo);
            ObjectNode copy = mapper.createObjectNode();
            for (String name : names) {
                copy.set(name, sorted(node.get(name)));
            }
            return copy;
        }
        if (node.isArray()) {
            ArrayNode copy = mapper.createArrayNode();
            for (JsonNode element : node) {
                copy.add(sorted(element));
            }
            return copy;
        }
        if (node.isFloatingPointNumber() && !node.isBigDecimal() && !Double.isFinite(node.doubleValue())) {
            throw new IllegalArgumentException("non-finite number cannot be canonicalized: " + node.asText());
        }
        return node;
    }
}
