package org.legalis.symbolic;

import lombok.Builder;
import lombok.Getter;

/**
 * 验证会话的配置，创建后不可变。
 * 未设置的字段取默认值：超时 10 秒，逻辑 QF_LIA，开启模型补全。
 */
@Getter
public final class VerifierSettings {

    public static final int DEFAULT_TIMEOUT_MILLIS = 10_000;
    public static final String DEFAULT_LOGIC = "QF_LIA";

    private final int timeoutMillis;
    private final String logic;
    // 为 true 时，未被约束的已注册整数变量在模型中也会得到一个值
    private final boolean modelCompletion;

    @Builder
    private VerifierSettings(Integer timeoutMillis, String logic, Boolean modelCompletion) {
        this.timeoutMillis = timeoutMillis == null ? DEFAULT_TIMEOUT_MILLIS : timeoutMillis;
        if (this.timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be positive, got " + this.timeoutMillis);
        }
        this.logic = logic == null ? DEFAULT_LOGIC : logic;
        this.modelCompletion = modelCompletion == null || modelCompletion;
    }

    public static VerifierSettings defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return "VerifierSettings{timeoutMillis=" + timeoutMillis + ", logic=" + logic
                + ", modelCompletion=" + modelCompletion + "}";
    }
}
