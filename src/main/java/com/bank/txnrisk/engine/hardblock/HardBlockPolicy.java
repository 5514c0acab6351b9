package com.bank.txnrisk.engine.hardblock;

import com.bank.txnrisk.config.MetricsConfig;
import com.bank.txnrisk.model.NormalizedTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Registry of hard-block predicates keyed by name, evaluated in name order.
 * Kept apart from scoring: the aggregator only sees which names fired.
 */
@Component
public class HardBlockPolicy {

    private static final Logger log = LoggerFactory.getLogger(HardBlockPolicy.class);

    private final Map<String, Predicate<NormalizedTransaction>> predicates;
    private final MetricsConfig metricsConfig;

    public HardBlockPolicy(List<HardBlockRule> rules, MetricsConfig metricsConfig) {
        this.metricsConfig = metricsConfig;
        Map<String, Predicate<NormalizedTransaction>> byName = new LinkedHashMap<>();
        rules.stream()
                .sorted(Comparator.comparing(HardBlockRule::getName))
                .forEach(rule -> {
                    if (byName.put(rule.getName(), rule::matches) != null) {
                        throw new IllegalStateException("Duplicate hard block name: " + rule.getName());
                    }
                    log.info("Registered hard block: {} -> {}", rule.getName(), rule.getClass().getSimpleName());
                });
        this.predicates = Collections.unmodifiableMap(byName);
    }

    /**
     * @return names of the hard blocks that match, empty if the transaction may be scored normally
     */
    public List<String> evaluate(NormalizedTransaction txn) {
        List<String> matched = new ArrayList<>();
        predicates.forEach((name, predicate) -> {
            if (predicate.test(txn)) {
                matched.add(name);
                metricsConfig.recordHardBlock(name);
            }
        });
        return matched;
    }

    public Set<String> getNames() {
        return predicates.keySet();
    }
}
