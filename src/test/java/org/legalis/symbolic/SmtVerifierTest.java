package org.legalis.symbolic;

import org.legalis.core.ComparisonOp;
import org.legalis.core.DurationUnit;
import org.legalis.core.RegionType;
import org.legalis.core.RelationshipType;
import org.legalis.expressions.conditions.AgeCondition;
import org.legalis.expressions.conditions.AndCondition;
import org.legalis.expressions.conditions.AttributeEqualsCondition;
import org.legalis.expressions.conditions.Condition;
import org.legalis.expressions.conditions.CustomCondition;
import org.legalis.expressions.conditions.DateRangeCondition;
import org.legalis.expressions.conditions.DurationCondition;
import org.legalis.expressions.conditions.EntityRelationshipCondition;
import org.legalis.expressions.conditions.GeographicCondition;
import org.legalis.expressions.conditions.HasAttributeCondition;
import org.legalis.expressions.conditions.IncomeCondition;
import org.legalis.expressions.conditions.NotCondition;
import org.legalis.expressions.conditions.OrCondition;
import org.legalis.expressions.conditions.PatternCondition;
import org.legalis.expressions.conditions.PercentageCondition;
import org.legalis.expressions.conditions.SetMembershipCondition;
import org.junit.jupiter.api.*;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class SmtVerifierTest {

    private SmtVerifier verifier;

    private static AgeCondition age(ComparisonOp op, int value) {
        return AgeCondition.of(op, value);
    }

    private static IncomeCondition income(ComparisonOp op, long value) {
        return IncomeCondition.of(op, value);
    }

    /** 翻译器不认识的外部条件 */
    private static final class ForeignCondition extends Condition {
        @Override
        public boolean equals(Object o) {
            return o instanceof ForeignCondition;
        }

        @Override
        public int hashCode() {
            return 42;
        }

        @Override
        public String toString() {
            return "foreign";
        }
    }

    @BeforeAll
    void setUp() {
        verifier = SmtVerifier.create();
    }

    @AfterAll
    void tearDown() {
        if (verifier != null) {
            verifier.close();
        }
    }

    @Nested
    @DisplayName("基本判定 (Basic Decisions)")
    class BasicDecisionTests {

        @Test
        @DisplayName("age >= 18 可满足")
        void testIsSatisfiable_Adult() throws VerifierException {
            assertTrue(verifier.isSatisfiable(age(ComparisonOp.GE, 18)));
        }

        @Test
        @DisplayName("age >= 18 与 age < 18 矛盾，与 age < 65 不矛盾")
        void testContradict() throws VerifierException {
            assertAll(
                    () -> assertTrue(verifier.contradict(age(ComparisonOp.GE, 18), age(ComparisonOp.LT, 18))),
                    () -> assertFalse(verifier.contradict(age(ComparisonOp.GE, 18), age(ComparisonOp.LT, 65)))
            );
        }

        @Test
        @DisplayName("age >= 21 蕴含 age >= 18，反之不成立且反例落在 [18, 20]")
        void testImplies_WithCounterexample() throws VerifierException {
            assertTrue(verifier.implies(age(ComparisonOp.GE, 21), age(ComparisonOp.GE, 18)));
            assertFalse(verifier.implies(age(ComparisonOp.GE, 18), age(ComparisonOp.GE, 21)));

            Optional<SatModel> counterexample =
                    verifier.implicationCounterexample(age(ComparisonOp.GE, 18), age(ComparisonOp.GE, 21));
            assertTrue(counterexample.isPresent());
            long value = counterexample.get().get("age").orElseThrow();
            assertTrue(value >= 18 && value <= 20, "counterexample age should be in [18, 20] but was " + value);
        }

        @Test
        @DisplayName("age >= 18 OR age < 18 是永真式")
        void testIsTautology_ExcludedMiddle() throws VerifierException {
            assertTrue(verifier.isTautology(OrCondition.of(age(ComparisonOp.GE, 18), age(ComparisonOp.LT, 18))));
            assertFalse(verifier.isTautology(age(ComparisonOp.GE, 18)));
        }

        @Test
        @DisplayName("非永真式给出使其不成立的反例")
        void testTautologyCounterexample() throws VerifierException {
            Optional<SatModel> counterexample = verifier.tautologyCounterexample(age(ComparisonOp.GE, 18));
            assertTrue(counterexample.isPresent());
            assertTrue(counterexample.get().get("age").orElseThrow() < 18);
        }

        @Test
        @DisplayName("getModel(age >= 18 AND income < 30000) 满足两个约束")
        void testGetModel() throws VerifierException {
            Optional<SatModel> model = verifier.getModel(
                    AndCondition.of(age(ComparisonOp.GE, 18), income(ComparisonOp.LT, 30000)));
            assertTrue(model.isPresent());
            SatModel m = model.get();
            assertAll(
                    () -> assertTrue(m.get("age").orElseThrow() >= 18),
                    () -> assertTrue(m.get("income").orElseThrow() < 30000)
            );
        }

        @Test
        @DisplayName("不可满足的条件没有模型")
        void testGetModel_Unsat() throws VerifierException {
            assertEquals(Optional.empty(),
                    verifier.getModel(AndCondition.of(age(ComparisonOp.GE, 18), age(ComparisonOp.LT, 10))));
        }

        @Test
        @DisplayName("check 返回三值结果")
        void testCheck() throws VerifierException {
            VerificationResult sat = verifier.check(age(ComparisonOp.EQ, 30));
            VerificationResult unsat = verifier.check(AndCondition.of(age(ComparisonOp.EQ, 30), age(ComparisonOp.NE, 30)));
            assertAll(
                    () -> assertTrue(sat.isSatisfiable()),
                    () -> assertEquals(Optional.of(30L), sat.getModel().orElseThrow().get("age")),
                    () -> assertTrue(unsat.isUnsatisfiable()),
                    () -> assertTrue(unsat.getModel().isEmpty())
            );
        }

        @Test
        @DisplayName("equivalent 比较两个方向的蕴含")
        void testEquivalent() throws VerifierException {
            assertTrue(verifier.equivalent(age(ComparisonOp.GT, 17), age(ComparisonOp.GE, 18)));
            assertFalse(verifier.equivalent(age(ComparisonOp.GT, 18), age(ComparisonOp.GE, 18)));
        }
    }

    @Nested
    @DisplayName("翻译语义 (Translation Semantics)")
    class TranslationTests {

        @Test
        @DisplayName("不同法规中的同名属性共享变量")
        void testVariableIdentityAcrossConditions() throws VerifierException {
            Condition first = AndCondition.of(age(ComparisonOp.GE, 18), HasAttributeCondition.of("license"));
            Condition second = NotCondition.of(HasAttributeCondition.of("license"));
            assertTrue(verifier.contradict(first, second));
        }

        @Test
        @DisplayName("不同的属性值永远不相等，模型可以还原属性值")
        void testAttributeEquals_Interning() throws VerifierException {
            AttributeEqualsCondition jp = AttributeEqualsCondition.of("citizenship", "JP");
            AttributeEqualsCondition us = AttributeEqualsCondition.of("citizenship", "US");
            assertTrue(verifier.contradict(jp, us));
            assertFalse(verifier.contradict(jp, AttributeEqualsCondition.of("citizenship", "JP")));

            SatModel model = verifier.getModel(jp).orElseThrow();
            assertEquals(Optional.of("JP"), model.decodedAttribute("citizenship"));
        }

        @Test
        @DisplayName("集合成员：空集恒假，其否定恒真")
        void testSetMembership() throws VerifierException {
            SetMembershipCondition eu = SetMembershipCondition.in("citizenship", List.of("FR", "DE"));
            assertAll(
                    () -> assertTrue(verifier.implies(AttributeEqualsCondition.of("citizenship", "FR"), eu)),
                    () -> assertTrue(verifier.contradict(eu, AttributeEqualsCondition.of("citizenship", "JP"))),
                    () -> assertTrue(verifier.contradict(eu, SetMembershipCondition.notIn("citizenship", List.of("FR", "DE")))),
                    () -> assertFalse(verifier.isSatisfiable(SetMembershipCondition.in("citizenship", List.of()))),
                    () -> assertTrue(verifier.isTautology(SetMembershipCondition.notIn("citizenship", List.of())))
            );
        }

        @Test
        @DisplayName("日期区间按天比较，无界区间恒真")
        void testDateRange() throws VerifierException {
            DateRangeCondition year2020 = DateRangeCondition.of(LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31));
            assertAll(
                    () -> assertTrue(verifier.contradict(year2020, DateRangeCondition.from(LocalDate.of(2021, 1, 1)))),
                    () -> assertFalse(verifier.contradict(year2020, DateRangeCondition.until(LocalDate.of(2020, 12, 31)))),
                    () -> assertTrue(verifier.implies(year2020, DateRangeCondition.from(LocalDate.of(2019, 6, 1)))),
                    () -> assertTrue(verifier.isTautology(DateRangeCondition.of(null, null)))
            );
        }

        @Test
        @DisplayName("期间：年与月、周与天精确换算，天与月之间互不影响")
        void testDurationEncoding() throws VerifierException {
            assertAll(
                    () -> assertTrue(verifier.equivalent(
                            DurationCondition.of(ComparisonOp.GE, 2, DurationUnit.YEARS),
                            DurationCondition.of(ComparisonOp.GE, 24, DurationUnit.MONTHS))),
                    () -> assertTrue(verifier.equivalent(
                            DurationCondition.of(ComparisonOp.EQ, 1, DurationUnit.WEEKS),
                            DurationCondition.of(ComparisonOp.EQ, 7, DurationUnit.DAYS))),
                    () -> assertFalse(verifier.implies(
                            DurationCondition.of(ComparisonOp.GE, 400, DurationUnit.DAYS),
                            DurationCondition.of(ComparisonOp.GE, 1, DurationUnit.MONTHS)))
            );
        }

        @Test
        @DisplayName("百分比按上下文区分变量")
        void testPercentageContexts() throws VerifierException {
            PercentageCondition ownership = PercentageCondition.of(ComparisonOp.GE, 25, "ownership");
            assertTrue(verifier.contradict(ownership, PercentageCondition.of(ComparisonOp.LT, 25, "ownership")));
            assertFalse(verifier.contradict(ownership, PercentageCondition.of(ComparisonOp.LT, 25, "tax")));
        }

        @Test
        @DisplayName("不透明原子：字段相同即同一原子")
        void testOpaqueAtoms() throws VerifierException {
            GeographicCondition tokyo = GeographicCondition.of(RegionType.CITY, "Tokyo");
            EntityRelationshipCondition spouse = EntityRelationshipCondition.of(RelationshipType.SPOUSE, "p-1");
            PatternCondition postal = PatternCondition.matches("postal_code", "1[0-9]{2}-.*");
            assertAll(
                    () -> assertTrue(verifier.contradict(tokyo, tokyo.negate())),
                    () -> assertFalse(verifier.contradict(tokyo, GeographicCondition.of(RegionType.CITY, "Osaka").negate())),
                    () -> assertTrue(verifier.contradict(spouse, spouse.negate())),
                    () -> assertFalse(verifier.contradict(spouse, EntityRelationshipCondition.any(RelationshipType.SPOUSE).negate())),
                    () -> assertTrue(verifier.contradict(postal, PatternCondition.notMatches("postal_code", "1[0-9]{2}-.*"))),
                    () -> assertTrue(verifier.contradict(CustomCondition.of("good standing"),
                            CustomCondition.of("good standing").negate()))
            );
        }

        @Test
        @DisplayName("任意对象的关系与对象 id 恰为 \"any\" 的关系是不同原子")
        void testRelationshipAnyTarget_DistinctFromLiteralAny() throws VerifierException {
            EntityRelationshipCondition literalAny = EntityRelationshipCondition.of(RelationshipType.SPOUSE, "any");
            EntityRelationshipCondition anyTarget = EntityRelationshipCondition.any(RelationshipType.SPOUSE);
            assertAll(
                    () -> assertFalse(verifier.contradict(literalAny, NotCondition.of(anyTarget))),
                    () -> assertTrue(verifier.contradict(anyTarget, NotCondition.of(anyTarget))),
                    () -> assertNotEquals(ConditionTranslator.relationshipAtom(literalAny),
                            ConditionTranslator.relationshipAtom(anyTarget))
            );
        }

        @Test
        @DisplayName("属性名或模式中含 ':' 时模式原子仍然互不相同")
        void testPatternWithColons_DistinctAtoms() throws VerifierException {
            PatternCondition first = PatternCondition.matches("a:b", "c");
            PatternCondition second = PatternCondition.matches("a", "b:c");
            assertAll(
                    () -> assertFalse(verifier.contradict(first, PatternCondition.notMatches("a", "b:c"))),
                    () -> assertTrue(verifier.contradict(first, PatternCondition.notMatches("a:b", "c"))),
                    () -> assertNotEquals(ConditionTranslator.patternAtom(first), ConditionTranslator.patternAtom(second))
            );
        }

        @Test
        @DisplayName("NE 编码为等式的否定")
        void testNotEquals() throws VerifierException {
            assertTrue(verifier.contradict(age(ComparisonOp.NE, 18), age(ComparisonOp.EQ, 18)));
            assertFalse(verifier.contradict(age(ComparisonOp.NE, 18), age(ComparisonOp.EQ, 19)));
        }

        @Test
        @DisplayName("未知的条件类型应以 UnsupportedConditionException 失败")
        void testUnsupportedCondition_FailsClosed() {
            ForeignCondition foreign = new ForeignCondition();
            UnsupportedConditionException e = assertThrows(UnsupportedConditionException.class,
                    () -> verifier.isSatisfiable(AndCondition.of(age(ComparisonOp.GE, 18), foreign)));
            assertSame(foreign, e.getCondition());
            assertThrows(UnsupportedConditionException.class, () -> verifier.check(foreign));
        }

        @Test
        @DisplayName("同一条件判定两次结果相同")
        void testDeterminism() throws VerifierException {
            Condition condition = OrCondition.of(age(ComparisonOp.LT, 5), income(ComparisonOp.GT, 100));
            assertEquals(verifier.isSatisfiable(condition), verifier.isSatisfiable(condition));
            assertEquals(verifier.isTautology(condition), verifier.isTautology(condition));
        }
    }

    @Nested
    @DisplayName("Unsat core 与化简 (Unsat Core and Simplification)")
    class CoreAndSimplifyTests {

        @Test
        @DisplayName("unsat core 包含互相矛盾的条件")
        void testFindUnsatCore() throws VerifierException {
            List<Condition> conditions = List.of(
                    age(ComparisonOp.GE, 18),
                    income(ComparisonOp.LT, 100),
                    age(ComparisonOp.LT, 10));
            List<Integer> core = verifier.findUnsatCore(conditions);
            assertTrue(core.containsAll(List.of(0, 2)), "core should contain both age bounds: " + core);
        }

        @Test
        @DisplayName("可满足或空的条件列表没有 unsat core")
        void testFindUnsatCore_InvalidInput() {
            assertAll(
                    () -> assertThrows(IllegalArgumentException.class,
                            () -> verifier.findUnsatCore(List.of(age(ComparisonOp.GE, 18)))),
                    () -> assertThrows(IllegalArgumentException.class, () -> verifier.findUnsatCore(List.of()))
            );
        }

        @Test
        @DisplayName("explainUnsat 列出 core 中的条件")
        void testExplainUnsat() throws VerifierException {
            String explanation = verifier.explainUnsat(List.of(age(ComparisonOp.GE, 18), age(ComparisonOp.LT, 18)));
            assertAll(
                    () -> assertTrue(explanation.contains("Total conditions: 2")),
                    () -> assertTrue(explanation.contains("[0] age >= 18")),
                    () -> assertTrue(explanation.contains("[1] age < 18"))
            );
        }

        @Test
        @DisplayName("消去双重否定")
        void testSimplify_DoubleNegation() throws VerifierException {
            SimplificationResult result = verifier.simplify(NotCondition.of(NotCondition.of(age(ComparisonOp.GE, 18))));
            assertTrue(result.isChanged());
            assertEquals(age(ComparisonOp.GE, 18), result.getCondition());
        }

        @Test
        @DisplayName("AND 保留较强的一侧，OR 保留较弱的一侧")
        void testSimplify_ImpliedOperands() throws VerifierException {
            Condition stronger = age(ComparisonOp.GE, 21);
            Condition weaker = age(ComparisonOp.GE, 18);
            assertAll(
                    () -> assertEquals(stronger, verifier.simplify(AndCondition.of(weaker, stronger)).getCondition()),
                    () -> assertEquals(weaker, verifier.simplify(OrCondition.of(stronger, weaker)).getCondition())
            );
        }

        @Test
        @DisplayName("互不蕴含的条件保持不变")
        void testSimplify_Unchanged() throws VerifierException {
            Condition condition = AndCondition.of(age(ComparisonOp.GE, 18), income(ComparisonOp.LT, 10));
            SimplificationResult result = verifier.simplify(condition);
            assertFalse(result.isChanged());
            assertSame(condition, result.getCondition());
        }
    }

    @Nested
    @DisplayName("会话管理 (Session Lifecycle)")
    class LifecycleTests {

        @Test
        @DisplayName("关闭后的查询应抛出 IllegalStateException")
        void testQueryAfterClose_ShouldThrow() {
            SmtVerifier local = SmtVerifier.create(VerifierSettings.builder().timeoutMillis(2000).build());
            local.close();
            assertTrue(local.isClosed());
            assertThrows(IllegalStateException.class, () -> local.isSatisfiable(age(ComparisonOp.GE, 18)));
            assertDoesNotThrow(local::close, "close should be idempotent");
        }

        @Test
        @DisplayName("模型包含会话中注册过的所有整数变量")
        void testModelCoversAllRegisteredIntegers() throws VerifierException {
            try (SmtVerifier local = SmtVerifier.create()) {
                local.isSatisfiable(income(ComparisonOp.GT, 10));
                SatModel model = local.getModel(age(ComparisonOp.EQ, 40)).orElseThrow();
                assertEquals(List.of("income", "age"), List.copyOf(model.asMap().keySet()));
                assertEquals(List.of("income", "age"), local.getRegistry().getIntVariableNames());
            }
        }

        @Test
        @DisplayName("非法的配置应被拒绝")
        void testInvalidSettings() {
            assertThrows(IllegalArgumentException.class, () -> VerifierSettings.builder().timeoutMillis(0).build());
            VerifierSettings defaults = VerifierSettings.defaults();
            assertAll(
                    () -> assertEquals(VerifierSettings.DEFAULT_TIMEOUT_MILLIS, defaults.getTimeoutMillis()),
                    () -> assertEquals("QF_LIA", defaults.getLogic()),
                    () -> assertTrue(defaults.isModelCompletion())
            );
        }
    }
}
