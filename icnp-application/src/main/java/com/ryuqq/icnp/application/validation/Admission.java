package com.ryuqq.icnp.application.validation;

/**
 * 세션 수준 메시지 수용 결과.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public enum Admission {

    /** 처음 본 메시지. 처리 대상. */
    ACCEPTED,

    /** 이미 처리한 message_id. 아무 것도 하지 않고 성공으로 취급. */
    DUPLICATE
}
