package com.ryuqq.icnp.core.message;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.cfg.JsonNodeFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * 프로토콜 JSON 공용 설정.
 *
 * <p><strong>설정:</strong></p>
 * <ul>
 *   <li>JavaTimeModule 등록, 날짜는 ISO-8601 문자열로 기록</li>
 *   <li>소수는 BigDecimal로 읽고 trailing zero를 보존 (불투명 필드의 숫자 표기 유지)</li>
 *   <li>알 수 없는 필드는 무시</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public final class ProtocolJson {

    private static final ObjectMapper MAPPER = createMapper();

    private ProtocolJson() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.configure(JsonNodeFeature.STRIP_TRAILING_BIGDECIMAL_ZEROES, false);
        return mapper;
    }

    /**
     * 공용 ObjectMapper 조회.
     *
     * @return 스레드 안전한 ObjectMapper
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static ObjectNode objectNode() {
        return MAPPER.createObjectNode();
    }

    /**
     * JSON 문자열을 객체 노드로 파싱.
     *
     * @param json JSON 문자열
     * @return 파싱된 객체
     * @throws IllegalArgumentException JSON이 아니거나 최상위가 객체가 아닌 경우
     */
    public static ObjectNode parseObject(String json) {
        if (json == null) {
            throw new IllegalArgumentException("json cannot be null");
        }
        try {
            JsonNode node = MAPPER.readTree(json);
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException("JSON document is not an object");
            }
            return (ObjectNode) node;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * JSON 노드를 문자열로 직렬화.
     *
     * @param node JSON 노드
     * @return 압축 JSON 문자열
     */
    public static String write(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize JSON node", e);
        }
    }

    /**
     * Instant를 RFC 3339(UTC, 'Z') 문자열 노드로 변환.
     *
     * @param instant 시각
     * @return 문자열 노드
     */
    public static JsonNode timestamp(Instant instant) {
        return MAPPER.valueToTree(instant);
    }

    /**
     * RFC 3339 문자열을 Instant로 변환.
     *
     * @param text 시각 문자열 (오프셋 필수)
     * @return Instant
     * @throws IllegalArgumentException RFC 3339 형식이 아닌 경우
     */
    public static Instant parseTimestamp(String text) {
        if (text == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        try {
            return OffsetDateTime.parse(text, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("timestamp is not RFC 3339: " + text, e);
        }
    }
}
