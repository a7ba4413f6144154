package com.ryuqq.icnp.core.intent;

import java.util.List;

/**
 * 세션 개시자가 선언한 의도.
 *
 * <p>세션당 한 번 기록되며 이후 변경할 수 없습니다. 이 record는 수신한 내용을
 * 그대로 담으며, goal 누락 같은 프로토콜 규칙 검증은 IntentRegistry가 수행합니다.</p>
 *
 * @param goal 목표 (검증 전에는 null 가능)
 * @param requestedActions 요청 행위 목록
 * @param expectedOutputs 기대 산출물 목록
 * @param constraints 제약 조건
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public record Intent(
    String goal,
    List<RequestedAction> requestedActions,
    List<String> expectedOutputs,
    IntentConstraints constraints
) {

    public Intent {
        requestedActions = requestedActions == null ? List.of() : List.copyOf(requestedActions);
        expectedOutputs = expectedOutputs == null ? List.of() : List.copyOf(expectedOutputs);
        if (constraints == null) {
            constraints = IntentConstraints.defaults();
        }
    }

    /**
     * 요청 행위 목록에 포함되어 있는지 확인.
     *
     * @param action 행위 이름
     * @return 요청된 행위이면 true
     */
    public boolean requests(String action) {
        return requestedActions.stream().anyMatch(requested -> requested.action().equals(action));
    }
}
