package org.legalis.verification;

import org.apache.commons.lang3.tuple.Pair;
import org.legalis.core.ComparisonOp;
import org.legalis.expressions.conditions.AgeCondition;
import org.legalis.expressions.conditions.HasAttributeCondition;
import org.legalis.statute.model.Effect;
import org.legalis.statute.model.EffectType;
import org.legalis.statute.model.Statute;
import org.legalis.symbolic.SmtVerifier;
import org.legalis.symbolic.SolverStatus;
import org.legalis.symbolic.SolverUnknownException;
import org.legalis.symbolic.StubSolverSession;
import org.legalis.symbolic.VerifierException;
import org.legalis.symbolic.VerifierSettings;
import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class StatuteConsistencyCheckerTest {

    private SmtVerifier verifier;
    private StatuteConsistencyChecker checker;

    private Statute adultVote;
    private Statute minorBan;
    private Statute impossible;
    private Statute seniorRevoke;
    private Statute unconditional;

    @BeforeAll
    void setUp() {
        verifier = SmtVerifier.create();
        checker = new StatuteConsistencyChecker(verifier);

        adultVote = Statute.builder().id("adult-vote")
                .precondition(AgeCondition.of(ComparisonOp.GE, 18))
                .effect(Effect.of(EffectType.GRANT, "voting rights"))
                .build();
        minorBan = Statute.builder().id("minor-ban")
                .precondition(AgeCondition.of(ComparisonOp.LT, 18))
                .effect(Effect.of(EffectType.REVOKE, "voting rights"))
                .build();
        impossible = Statute.builder().id("impossible")
                .precondition(AgeCondition.of(ComparisonOp.GE, 65))
                .precondition(AgeCondition.of(ComparisonOp.LT, 18))
                .effect(Effect.of(EffectType.GRANT, "pension"))
                .build();
        seniorRevoke = Statute.builder().id("senior-revoke")
                .precondition(AgeCondition.of(ComparisonOp.GE, 65))
                .effect(Effect.of(EffectType.REVOKE, "voting rights"))
                .build();
        unconditional = Statute.builder().id("registration")
                .effect(Effect.of(EffectType.OBLIGATION, "register address"))
                .build();
    }

    @AfterAll
    void tearDown() {
        if (verifier != null) {
            verifier.close();
        }
    }

    @Test
    @DisplayName("前提条件不可满足的法规是死法规，无前提条件的法规不是")
    void testFindDeadStatutes() throws VerifierException {
        assertEquals(List.of("impossible"),
                checker.findDeadStatutes(List.of(adultVote, impossible, unconditional)));
    }

    @Test
    @DisplayName("跨法规的前提矛盾，死法规不参与")
    void testFindContradictoryPairs() throws VerifierException {
        List<Pair<String, String>> pairs = checker.findContradictoryPairs(
                List.of(adultVote, minorBan, impossible, seniorRevoke, unconditional));
        assertEquals(List.of(Pair.of("adult-vote", "minor-ban"), Pair.of("minor-ban", "senior-revoke")), pairs);
    }

    @Test
    @DisplayName("可以同时适用且效果冲突的法规对")
    void testFindEffectConflicts() throws VerifierException {
        Statute prohibition = Statute.builder().id("no-registration")
                .precondition(HasAttributeCondition.of("diplomat"))
                .effect(Effect.of(EffectType.PROHIBITION, "register address"))
                .build();
        List<Pair<String, String>> conflicts = checker.findEffectConflicts(
                List.of(adultVote, minorBan, seniorRevoke, unconditional, prohibition));
        assertEquals(List.of(Pair.of("adult-vote", "senior-revoke"), Pair.of("registration", "no-registration")),
                conflicts);
    }

    @Test
    @DisplayName("被其他前提条件蕴含的前提条件是冗余的，等价条件只报告后一个")
    void testFindRedundantPreconditions() throws VerifierException {
        Statute redundant = Statute.builder().id("drinking")
                .precondition(AgeCondition.of(ComparisonOp.GE, 18))
                .precondition(AgeCondition.of(ComparisonOp.GE, 21))
                .precondition(HasAttributeCondition.of("id-card"))
                .effect(Effect.of(EffectType.GRANT, "purchase alcohol"))
                .build();
        Statute duplicated = Statute.builder().id("twice")
                .precondition(AgeCondition.of(ComparisonOp.GE, 18))
                .precondition(AgeCondition.of(ComparisonOp.GT, 17))
                .effect(Effect.of(EffectType.GRANT, "x"))
                .build();
        assertAll(
                () -> assertEquals(List.of(0), checker.findRedundantPreconditions(redundant)),
                () -> assertEquals(List.of(1), checker.findRedundantPreconditions(duplicated)),
                () -> assertEquals(List.of(), checker.findRedundantPreconditions(adultVote))
        );
    }

    @Test
    @DisplayName("check 汇总全部问题")
    void testCheck_Report() throws VerifierException {
        ConsistencyReport report = checker.check(List.of(adultVote, minorBan, impossible, seniorRevoke));
        assertAll(
                () -> assertFalse(report.isConsistent()),
                () -> assertEquals(1, report.issuesOf(ConsistencyIssue.Kind.DEAD_STATUTE).size()),
                () -> assertEquals(2, report.issuesOf(ConsistencyIssue.Kind.CONTRADICTORY_PRECONDITIONS).size()),
                () -> assertEquals(List.of("adult-vote", "senior-revoke"),
                        report.issuesOf(ConsistencyIssue.Kind.EFFECT_CONFLICT).get(0).getStatuteIds()),
                () -> assertTrue(report.issuesOf(ConsistencyIssue.Kind.REDUNDANT_PRECONDITION).isEmpty())
        );
    }

    @Test
    @DisplayName("只有冗余条件的语料仍然是一致的")
    void testCheck_RedundancyIsNotFatal() throws VerifierException {
        Statute redundant = Statute.builder().id("drinking")
                .precondition(AgeCondition.of(ComparisonOp.GE, 18))
                .precondition(AgeCondition.of(ComparisonOp.GE, 21))
                .effect(Effect.of(EffectType.GRANT, "purchase alcohol"))
                .build();
        ConsistencyReport report = checker.check(List.of(redundant));
        assertTrue(report.isConsistent());
        assertEquals(1, report.getIssues().size());
    }

    @Test
    @DisplayName("求解器超时不会被当作没有问题")
    void testUnknownPropagates() {
        VerifierSettings tight = VerifierSettings.builder().timeoutMillis(1).build();
        try (SmtVerifier stubbed = new SmtVerifier(tight, (ctx, settings) -> new StubSolverSession(SolverStatus.UNKNOWN, "timeout"))) {
            StatuteConsistencyChecker local = new StatuteConsistencyChecker(stubbed);
            assertThrows(SolverUnknownException.class, () -> local.findDeadStatutes(List.of(adultVote)));
            assertThrows(SolverUnknownException.class, () -> local.check(List.of(adultVote, minorBan)));
        }
    }
}
