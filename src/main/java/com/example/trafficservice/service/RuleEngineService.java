package com.example.trafficservice.service;

import com.example.trafficservice.config.RuleStoreProperties;
import com.example.trafficservice.model.ExchangeProbe;
import com.example.trafficservice.model.RawExchange;
import com.example.trafficservice.model.RuleDecision;
import com.example.trafficservice.model.RuleState;
import com.example.trafficservice.rule.ExchangeAttributes;
import com.example.trafficservice.rule.RuleSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Evaluates exchanges against the active {@link RuleSnapshot}.
 *
 * <p>Evaluation dereferences the active snapshot once and never takes a lock. Reloads are
 * serialized; a reload compiles a complete snapshot from the store and swaps it in only once
 * compilation succeeded, so evaluations see either the previous rule set or the new one.</p>
 */
@Service
@Slf4j
public class RuleEngineService {

    private final RuleStoreService ruleStore;
    private final RuleStoreProperties properties;

    private final AtomicReference<RuleSnapshot> active = new AtomicReference<>(RuleSnapshot.empty());
    private final ReentrantLock reloadLock = new ReentrantLock();

    public RuleEngineService(RuleStoreService ruleStore, RuleStoreProperties properties) {
        this.ruleStore = ruleStore;
        this.properties = properties;
    }

    @PostConstruct
    public void init() {
        reload();
    }

    /**
     * @return true if the exchange should be kept
     */
    public boolean evaluate(RawExchange exchange) {
        return active.get().evaluate(exchange);
    }

    public RuleDecision explain(RawExchange exchange) {
        return active.get().explain(exchange);
    }

    /**
     * Dry-run an exchange description against the active rules.
     */
    public RuleDecision explain(ExchangeProbe probe) {
        return active.get().explain(ExchangeAttributes.of(probe));
    }

    /**
     * The active snapshot, for callers that must evaluate a whole batch against one rule set.
     */
    public RuleSnapshot snapshot() {
        return active.get();
    }

    /**
     * Re-read the store and publish a new snapshot.
     */
    public RuleSnapshot reload() {
        reloadLock.lock();
        try {
            RuleState state = ruleStore.currentState();
            RuleSnapshot next = RuleSnapshot.compile(
                active.get().getVersion() + 1, state.getFilterRules(), state.getHostRules());
            active.set(next);
            log.info("Rule snapshot v{} active: {}/{} filter rules and {}/{} host rules enabled",
                next.getVersion(),
                next.info().getEnabledFilterRules(), next.info().getTotalFilterRules(),
                next.info().getEnabledHostRules(), next.info().getTotalHostRules());
            return next;
        } finally {
            reloadLock.unlock();
        }
    }

    @EventListener
    public void onRulesChanged(RulesChangedEvent event) {
        if (properties.isAutoReload()) {
            log.debug("Reloading rules after change: {}", event.getChange());
            reload();
        }
    }
}
