package com.demoAuto.salesAgent.orchestrator.model;

import com.demoAuto.salesAgent.gateway.model.RequestContext;
import lombok.Getter;
import lombok.Setter;

/**
 * Pipeline state - holds the data produced as one message moves through the orchestrator.
 *
 * Created per request and discarded with it. The stage only moves forward.
 */
@Getter
public class PipelineState {

    private final RequestContext requestContext;

    private final String history;

    private PipelineStage stage = PipelineStage.START;

    @Setter
    private Intent intent;

    @Setter
    private HandlerResponse handlerResponse;

    @Setter
    private PipelineResult result;

    public PipelineState(RequestContext requestContext, String history) {
        this.requestContext = requestContext;
        this.history = history == null ? "" : history;
    }

    /**
     * Moves to {@code next}.
     *
     * @throws IllegalStateException if {@code next} is not after the current stage
     */
    public void advanceTo(PipelineStage next) {
        if (next.ordinal() <= stage.ordinal()) {
            throw new IllegalStateException("Illegal pipeline transition " + stage + " -> " + next);
        }
        stage = next;
    }

    public String getCorrelationId() {
        return requestContext.getCorrelationId();
    }

    public String getMessageText() {
        return requestContext.getMessageText();
    }
}
