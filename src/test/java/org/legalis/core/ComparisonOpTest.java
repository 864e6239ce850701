package org.legalis.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ComparisonOpTest {

    @Nested
    @DisplayName("取反与翻转 (Negate and Flip)")
    class NegateAndFlipTests {

        @Test
        @DisplayName("取反两次回到原运算符")
        void testNegate_IsInvolution() {
            for (ComparisonOp op : ComparisonOp.values()) {
                assertEquals(op, op.negate().negate(), "negate should be an involution for " + op);
            }
        }

        @Test
        @DisplayName("取反后的运算符对任意整数给出相反结果")
        void testNegate_GivesOppositeResult() {
            long[] samples = {-3, 0, 17, 18, 19};
            for (ComparisonOp op : ComparisonOp.values()) {
                for (long left : samples) {
                    assertNotEquals(op.test(left, 18), op.negate().test(left, 18),
                            op + " and " + op.negate() + " must disagree at " + left);
                }
            }
        }

        @Test
        @DisplayName("翻转等价于交换操作数 (a < b  <=>  b > a)")
        void testFlip_SwapsOperands() {
            for (ComparisonOp op : ComparisonOp.values()) {
                assertAll("flip of " + op,
                        () -> assertEquals(op.test(3, 5), op.flip().test(5, 3)),
                        () -> assertEquals(op.test(5, 5), op.flip().test(5, 5)),
                        () -> assertEquals(op.test(7, 5), op.flip().test(5, 7))
                );
            }
        }
    }

    @Nested
    @DisplayName("符号解析 (Symbol Parsing)")
    class ParsingTests {

        @Test
        @DisplayName("每个运算符的符号都能解析回自身")
        void testFromSymbol_RoundTrip() {
            for (ComparisonOp op : ComparisonOp.values()) {
                assertEquals(op, ComparisonOp.fromSymbol(op.getSymbol()));
            }
        }

        @Test
        @DisplayName("单个等号是 EQ 的别名")
        void testFromSymbol_SingleEqualsIsEq() {
            assertEquals(ComparisonOp.EQ, ComparisonOp.fromSymbol("="));
        }

        @Test
        @DisplayName("未知符号应抛出异常")
        void testFromSymbol_Unknown_ShouldThrow() {
            IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                    () -> ComparisonOp.fromSymbol("=>"));
            assertTrue(e.getMessage().contains("=>"));
        }
    }

    @Test
    @DisplayName("期间单位换算到基准单位")
    void testDurationUnit_ToBaseUnit() {
        assertAll(
                () -> assertEquals(14, DurationUnit.WEEKS.toBaseUnit(2)),
                () -> assertEquals(24, DurationUnit.YEARS.toBaseUnit(2)),
                () -> assertTrue(DurationUnit.MONTHS.isMonthBased()),
                () -> assertFalse(DurationUnit.DAYS.isMonthBased()),
                () -> assertThrows(ArithmeticException.class, () -> DurationUnit.YEARS.toBaseUnit(Long.MAX_VALUE))
        );
    }
}
