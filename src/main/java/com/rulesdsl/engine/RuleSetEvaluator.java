package com.rulesdsl.engine;

import com.rulesdsl.core.EvaluationContext;
import com.rulesdsl.exception.RulesException;
import com.rulesdsl.store.RuleStore;
import com.rulesdsl.store.StoredRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Evaluates every active rule of a product against one context, one task per rule.
 * Rules share nothing but the immutable context, so the tasks run independently.
 */
public class RuleSetEvaluator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuleSetEvaluator.class);

    static final Comparator<RuleOutcome> OUTCOME_ORDER =
            Comparator.comparingInt(RuleOutcome::priority).reversed()
                    .thenComparing(RuleOutcome::ruleName, Comparator.nullsLast(Comparator.naturalOrder()));

    private final RuleEngine engine;
    private final RuleStore store;
    private final ExecutorService workers;

    public RuleSetEvaluator(RuleEngine engine, RuleStore store, int threads) {
        if (threads <= 0) {
            throw new IllegalArgumentException("threads must be positive: " + threads);
        }
        this.engine = engine;
        this.store = store;
        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r);
            t.setName("rule-evaluator-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("RuleSetEvaluator initialized with {} threads", threads);
    }

    /**
     * Evaluate the active rules stored for a product.
     */
    public RuleSetResult evaluate(String productId, EvaluationContext context) {
        return evaluate(store.findByProduct(productId), context);
    }

    /**
     * Evaluate the given rules, skipping those that are not active or have no logic.
     */
    public RuleSetResult evaluate(List<StoredRule> rules, EvaluationContext context) {
        List<StoredRule> active = rules.stream().filter(StoredRule::isActive).filter(this::hasLogic).toList();

        List<Future<RuleOutcome>> futures = new ArrayList<>(active.size());
        for (StoredRule rule : active) {
            futures.add(workers.submit(() -> new RuleOutcome(
                    rule.id(), rule.name(), rule.priority(), engine.evaluate(rule.logic(), context))));
        }

        List<RuleOutcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (Future<RuleOutcome> future : futures) {
                outcomes.add(future.get());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new RulesException("Interrupted while evaluating rules", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            throw new RulesException("Rule evaluation failed: " + e.getCause().getMessage(), e.getCause());
        }

        outcomes.sort(OUTCOME_ORDER);
        RuleSetResult result = RuleSetResult.of(outcomes);
        log.debug("Evaluated {} of {} rules: blocked={}, messages={}",
                active.size(), rules.size(), result.blocked(), result.messages().size());
        return result;
    }

    private boolean hasLogic(StoredRule rule) {
        if (rule.logic() == null) {
            log.warn("Skipping rule {} '{}': no logic stored", rule.id(), rule.name());
            return false;
        }
        return true;
    }

    public void shutdown() {
        log.info("Shutting down RuleSetEvaluator");
        workers.shutdown();
    }

    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return workers.awaitTermination(timeout, unit);
    }

    @Override
    public void close() {
        shutdown();
    }
}
