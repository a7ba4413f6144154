package com.ryuqq.icnp.core.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 메시지 발신자/수신자의 역할.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum ActorRole {

    ORCHESTRATOR("orchestrator"),
    AGENT("agent"),
    TOOL("tool"),
    SERVICE("service"),
    USER("user");

    private final String wireName;

    ActorRole(String wireName) {
        this.wireName = wireName;
    }

    /**
     * 와이어 포맷 이름 조회.
     *
     * @return 소문자 역할 이름 (예: "agent")
     */
    public String wireName() {
        return wireName;
    }

    /**
     * 와이어 포맷 이름으로 역할 조회.
     *
     * @param wireName 역할 이름
     * @return 일치하는 역할, 없으면 empty
     */
    public static Optional<ActorRole> fromWire(String wireName) {
        return Arrays.stream(values())
            .filter(role -> role.wireName.equals(wireName))
            .findFirst();
    }
}
