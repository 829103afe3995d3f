package com.setupbrain.event;

import com.setupbrain.domain.model.DecisionRecord;
import org.springframework.context.ApplicationEvent;

/**
 * Published by the {@code DecisionLogger} each time a decision is logged.
 *
 * <p>Carries the {@link DecisionRecord} domain model, not the JPA entity.
 */
public class DecisionLogEvent extends ApplicationEvent {

    private final DecisionRecord decisionRecord;

    public DecisionLogEvent(Object source, DecisionRecord decisionRecord) {
        super(source);
        this.decisionRecord = decisionRecord;
    }

    public DecisionRecord getDecisionRecord() {
        return decisionRecord;
    }
}
