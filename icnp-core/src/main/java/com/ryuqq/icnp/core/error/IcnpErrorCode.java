package com.ryuqq.icnp.core.error;

import java.util.Arrays;
import java.util.Optional;

/**
 * ICNP 오류 분류 체계.
 *
 * <p>모든 프로토콜 오류는 아래 여섯 가지 코드 중 하나로 보고됩니다.</p>
 * <ul>
 *   <li>ICNP-001 invalid_intent: 구조/인과 관계 검증 실패, 잘못된 의도</li>
 *   <li>ICNP-002 capability_mismatch: 계약이 공개된 능력과 맞지 않음</li>
 *   <li>ICNP-003 constraints_unsatisfiable: 의도 제약과 계약이 양립 불가</li>
 *   <li>ICNP-004 unauthorised_action: 권한 없는 행위, 승인 누락, 한도 초과, 재전송</li>
 *   <li>ICNP-005 token_invalid: 토큰 부재/만료/서명 불일치/폐기/바인딩 불일치</li>
 *   <li>ICNP-006 internal_error: 예기치 않은 실패, 협력자 타임아웃</li>
 * </ul>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum IcnpErrorCode {

    INVALID_INTENT("ICNP-001", "invalid_intent"),
    CAPABILITY_MISMATCH("ICNP-002", "capability_mismatch"),
    CONSTRAINTS_UNSATISFIABLE("ICNP-003", "constraints_unsatisfiable"),
    UNAUTHORISED_ACTION("ICNP-004", "unauthorised_action"),
    TOKEN_INVALID("ICNP-005", "token_invalid"),
    INTERNAL_ERROR("ICNP-006", "internal_error");

    private final String code;
    private final String wireName;

    IcnpErrorCode(String code, String wireName) {
        this.code = code;
        this.wireName = wireName;
    }

    /**
     * 오류 코드 조회.
     *
     * @return "ICNP-00x" 형식 코드
     */
    public String code() {
        return code;
    }

    /**
     * 오류 이름 조회.
     *
     * @return snake_case 오류 이름
     */
    public String wireName() {
        return wireName;
    }

    /**
     * "ICNP-00x" 코드로 조회.
     *
     * @param code 오류 코드
     * @return 일치하는 오류 코드, 없으면 empty
     */
    public static Optional<IcnpErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(value -> value.code.equals(code))
            .findFirst();
    }
}
