package org.legalis.core;

/**
 * 期间条件的时间单位。
 * 天/周归一化到天，月/年归一化到月，两组之间不做换算（换算不精确）。
 */
public enum DurationUnit {

    DAYS(1, false),
    WEEKS(7, false),
    MONTHS(1, true),
    YEARS(12, true);

    private final int factor;
    private final boolean monthBased;

    DurationUnit(int factor, boolean monthBased) {
        this.factor = factor;
        this.monthBased = monthBased;
    }

    /**
     * 是否以月为基准单位 (MONTHS, YEARS)。
     */
    public boolean isMonthBased() {
        return monthBased;
    }

    /**
     * 将数值转换为基准单位（天或月）。
     * @throws ArithmeticException 如果结果溢出 long。
     */
    public long toBaseUnit(long value) {
        return Math.multiplyExact(value, factor);
    }
}
