package com.ryuqq.icnp.testkit.contract;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.ryuqq.icnp.core.execution.ExecutionRequest;
import com.ryuqq.icnp.core.executor.ActionExecutor;
import com.ryuqq.icnp.core.message.ProtocolJson;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * ActionExecutor test double that records every request it performs.
 *
 * <p>Returns {@code {"performed": <action>}} unless a failure has been set with
 * {@link #failWith(RuntimeException)}.</p>
 *
 * @author ICNP Team
 * @since 1.0.0
 */
public class RecordingActionExecutor implements ActionExecutor {

    private final List<ExecutionRequest> performed = new CopyOnWriteArrayList<>();
    private volatile RuntimeException failure;

    @Override
    public ObjectNode perform(ExecutionRequest request) {
        performed.add(request);
        RuntimeException current = failure;
        if (current != null) {
            throw current;
        }
        ObjectNode output = ProtocolJson.objectNode();
        output.put("performed", request.action());
        return output;
    }

    /**
     * Makes every following call throw the given exception.
     *
     * @param failure exception to throw, or null to succeed again
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public List<ExecutionRequest> performed() {
        return List.copyOf(performed);
    }

    /**
     * Actions performed, in call order.
     *
     * @return action names
     */
    public List<String> performedActions() {
        return performed.stream().map(ExecutionRequest::action).toList();
    }

    public void clear() {
        performed.clear();
        failure = null;
    }
}
