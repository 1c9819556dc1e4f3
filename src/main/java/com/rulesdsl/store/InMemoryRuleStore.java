package com.rulesdsl.store;

import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.RuleStatus;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import com.rulesdsl.exception.RuleNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory rule store.
 * Every revision is kept as its JSON document and read back through the codec.
 */
public class InMemoryRuleStore implements RuleStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRuleStore.class);

    private final RuleLogicCodec codec;
    private final Clock clock;
    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> order = new CopyOnWriteArrayList<>();

    public InMemoryRuleStore() {
        this(new RuleLogicCodec(), Clock.systemUTC());
    }

    public InMemoryRuleStore(RuleLogicCodec codec, Clock clock) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.clock = Objects.requireNonNull(clock, "clock");
        log.info("InMemoryRuleStore initialized");
    }

    @Override
    public String saveRule(String productId, RuleDraft draft) {
        Objects.requireNonNull(productId, "productId");
        Objects.requireNonNull(draft, "draft");

        RuleDraft normalized = new RuleDraft(draft.name(), draft.ruleType(), draft.ruleCategory(),
                draft.targetId(), draft.status() != null ? draft.status() : RuleStatus.ACTIVE,
                draft.proprietary(), draft.priority(), draft.reference(), draft.sourceText(),
                draft.conditionText(), draft.outcomeText(), draft.logic());

        String id = UUID.randomUUID().toString();
        Instant now = clock.instant();
        Entry entry = new Entry(id, productId, AiMetadata.generatedFrom(draft.sourceText()), now);
        entry.append(codec.writeDraft(normalized), entry.ai.get(), now);

        entries.put(id, entry);
        order.add(id);
        log.info("Saved rule {} '{}' for product {}", id, draft.name(), productId);
        return id;
    }

    @Override
    public StoredRule updateRuleLogic(String ruleId, RuleLogic logic, String conditionText, String outcomeText) {
        Objects.requireNonNull(logic, "logic");
        Entry entry = entries.get(ruleId);
        if (entry == null) {
            throw new RuleNotFoundException(ruleId);
        }

        synchronized (entry) {
            RuleDraft current = codec.readDraft(entry.latest());
            RuleDraft updated = current.withLogic(logic, conditionText, outcomeText);
            entry.append(codec.writeDraft(updated), entry.ai.get().refined(), clock.instant());
        }

        StoredRule stored = toStoredRule(entry);
        log.info("Updated logic of rule {} (refinement {})", ruleId, stored.ai().refinementCount());
        return stored;
    }

    @Override
    public Optional<StoredRule> findById(String ruleId) {
        if (ruleId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entries.get(ruleId)).map(this::toStoredRule);
    }

    @Override
    public List<StoredRule> findByProduct(String productId) {
        return order.stream()
                .map(entries::get)
                .filter(e -> e.productId.equals(productId))
                .map(this::toStoredRule)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Get the number of stored revisions of a rule, for auditing.
     */
    public int revisionCount(String ruleId) {
        Entry entry = entries.get(ruleId);
        return entry == null ? 0 : entry.size();
    }

    private StoredRule toStoredRule(Entry entry) {
        synchronized (entry) {
            return new StoredRule(entry.id, entry.productId, codec.readDraft(entry.latest()),
                    entry.ai.get(), entry.createdAt, entry.updatedAt);
        }
    }

    private static final class Entry {
        private final String id;
        private final String productId;
        private final Instant createdAt;
        private final List<String> revisions = new ArrayList<>();
        private final AtomicReference<AiMetadata> ai;
        private volatile Instant updatedAt;

        private Entry(String id, String productId, AiMetadata ai, Instant createdAt) {
            this.id = id;
            this.productId = productId;
            this.ai = new AtomicReference<>(ai);
            this.createdAt = createdAt;
            this.updatedAt = createdAt;
        }

        private synchronized void append(String json, AiMetadata metadata, Instant at) {
            revisions.add(json);
            ai.set(metadata);
            updatedAt = at;
        }

        private synchronized String latest() {
            return revisions.get(revisions.size() - 1);
        }

        private synchronized int size() {
            return revisions.size();
        }
    }
}
