package com.rulesdsl.store;

import com.rulesdsl.dsl.Action;
import com.rulesdsl.dsl.Condition;
import com.rulesdsl.dsl.ConditionGroup;
import com.rulesdsl.dsl.MessageSeverity;
import com.rulesdsl.dsl.RuleCategory;
import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.RuleLogic;
import com.rulesdsl.dsl.RuleStatus;
import com.rulesdsl.dsl.RuleType;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import com.rulesdsl.exception.RuleNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for InMemoryRuleStore.
 */
class InMemoryRuleStoreTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private InMemoryRuleStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        store = new InMemoryRuleStore(new RuleLogicCodec(), clock);
    }

    @Test
    @DisplayName("Saved rules get an id and AI defaults")
    void saveDefaults() {
        String id = store.saveRule("bop", draft("Coastal", null));

        StoredRule rule = store.findById(id).orElseThrow();
        assertEquals("bop", rule.productId());
        assertEquals(RuleStatus.ACTIVE, rule.draft().status());
        assertEquals(0, rule.priority());
        assertTrue(rule.ai().generated());
        assertEquals(85, rule.ai().confidence());
        assertEquals(0, rule.ai().refinementCount());
        assertEquals("decline coastal risks", rule.ai().originalText());
        assertEquals(T0, rule.createdAt());
        assertEquals(T0, rule.updatedAt());
    }

    @Test
    @DisplayName("Stored logic reads back equal to what was saved")
    void roundTrip() {
        RuleDraft draft = draft("Coastal", RuleStatus.DRAFT);
        String id = store.saveRule("bop", draft);

        StoredRule rule = store.findById(id).orElseThrow();
        assertEquals(draft.logic(), rule.logic());
        assertEquals(RuleStatus.DRAFT, rule.draft().status());
        assertFalse(rule.isActive());
    }

    @Test
    @DisplayName("Updating logic bumps the refinement count and keeps a revision")
    void updateLogic() {
        String id = store.saveRule("bop", draft("Coastal", null));
        clock.advance(Duration.ofMinutes(5));
        RuleLogic revised = RuleLogic.of(
                ConditionGroup.and(Condition.in("location.state", List.of("FL", "LA", "TX"))),
                List.of(Action.addMessage("Refer coastal risks", MessageSeverity.WARNING)));

        StoredRule updated = store.updateRuleLogic(id, revised, "State is coastal", "Refer");

        assertEquals(1, updated.ai().refinementCount());
        assertEquals(revised, updated.logic());
        assertEquals("State is coastal", updated.draft().conditionText());
        assertEquals("Coastal", updated.name());
        assertEquals(T0, updated.createdAt());
        assertEquals(T0.plus(Duration.ofMinutes(5)), updated.updatedAt());
        assertEquals(2, store.revisionCount(id));

        store.updateRuleLogic(id, revised, "again", "again");
        assertEquals(2, store.findById(id).orElseThrow().ai().refinementCount());
    }

    @Test
    @DisplayName("Updating an unknown rule fails")
    void updateUnknown() {
        RuleLogic logic = draft("x", null).logic();

        RuleNotFoundException e = assertThrows(RuleNotFoundException.class,
                () -> store.updateRuleLogic("missing", logic, "", ""));
        assertEquals("missing", e.getRuleId());
    }

    @Test
    @DisplayName("Rules are listed per product in save order")
    void findByProduct() {
        String a = store.saveRule("bop", draft("A", null));
        store.saveRule("auto", draft("B", null));
        String c = store.saveRule("bop", draft("C", null));

        assertEquals(List.of(a, c), store.findByProduct("bop").stream().map(StoredRule::id).toList());
        assertTrue(store.findByProduct("umbrella").isEmpty());
        assertTrue(store.findById("missing").isEmpty());
        assertTrue(store.findById(null).isEmpty());
    }

    private static RuleDraft draft(String name, RuleStatus status) {
        RuleLogic logic = RuleLogic.of(
                ConditionGroup.and(Condition.in("location.state", List.of("FL", "LA"))),
                List.of(Action.block("coverage", "Coastal risks are declined")));
        return new RuleDraft(name, RuleType.PRODUCT, RuleCategory.ELIGIBILITY, null, status, false, 0, null,
                "decline coastal risks", "State is FL or LA", "Decline", logic);
    }

    private static final class MutableClock extends Clock {
        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
