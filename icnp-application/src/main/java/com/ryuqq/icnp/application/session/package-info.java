/**
 * 세션 저장소와 세션 상태.
 *
 * <p>세션마다 하나의 쓰기 락이 있고, 모든 변경은 {@link com.ryuqq.icnp.application.session.SessionStore#withSession}
 * 안에서 일어납니다.</p>
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.session;
