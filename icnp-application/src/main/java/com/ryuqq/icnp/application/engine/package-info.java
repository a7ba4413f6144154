/**
 * 협상 엔진: 인바운드 엔벨로프 처리, 송신 엔벨로프 생성, 컴포넌트 조립.
 *
 * @since 1.0.0
 * @author ICNP Team
 */
package com.ryuqq.icnp.application.engine;
