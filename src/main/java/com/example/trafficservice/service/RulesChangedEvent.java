package com.example.trafficservice.service;

import org.springframework.context.ApplicationEvent;

/**
 * Published by the rule store after a mutation has been committed.
 */
public class RulesChangedEvent extends ApplicationEvent {

    private final String change;

    public RulesChangedEvent(Object source, String change) {
        super(source);
        this.change = change;
    }

    public String getChange() {
        return change;
    }
}
