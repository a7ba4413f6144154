package com.ryuqq.icnp.adapter.crypto;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.message.ProtocolJson;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * JacksonCanonicalizer 테스트.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class JacksonCanonicalizerTest {

    private final JacksonCanonicalizer canonicalizer = new JacksonCanonicalizer();

    private String canonical(String json) {
        return new String(canonicalizer.canonicalize(ProtocolJson.parseObject(json)), StandardCharsets.UTF_8);
    }

    @Test
    void canonicalize_SortsKeysRecursivelyWithoutWhitespace() {
        String result = canonical("""
            { "b": 1, "a": { "z": true, "y": [ {"d": null, "c": "x"} ] } }
            """);

        assertThat(result).isEqualTo("{\"a\":{\"y\":[{\"c\":\"x\",\"d\":null}],\"z\":true},\"b\":1}");
    }

    @Test
    void canonicalize_KeyOrderDoesNotChangeBytes() {
        assertThat(canonical("{\"x\":1,\"y\":2}")).isEqualTo(canonical("{\"y\":2,\"x\":1}"));
    }

    @Test
    void canonicalize_KeepsArrayOrder() {
        assertThat(canonical("{\"a\":[3,1,2]}")).isEqualTo("{\"a\":[3,1,2]}");
    }

    @Test
    void canonicalize_WritesNonAsciiAsUtf8() {
        byte[] bytes = canonicalizer.canonicalize(ProtocolJson.parseObject("{\"goal\":\"요약\"}"));

        assertThat(bytes).isEqualTo("{\"goal\":\"요약\"}".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void canonicalize_NonFiniteNumber_ThrowsException() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("x", Double.NaN);

        assertThatThrownBy(() -> canonicalizer.canonicalize(node))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("non-finite");
    }

    @Test
    void canonicalize_DoesNotMutateInput() {
        ObjectNode node = ProtocolJson.parseObject("{\"b\":1,\"a\":2}");

        canonicalizer.canonicalize(node);

        assertThat(node.fieldNames().next()).isEqualTo("b");
    }
}
