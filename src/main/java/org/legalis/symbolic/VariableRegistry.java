package org.legalis.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.IntExpr;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * 负责管理语义属性名到 Z3 变量的映射。
 * 同一会话中同名属性总是得到同一个 Z3 变量，所以彼此独立编写的条件可以放在一起推理。
 * 同时维护每个属性键的字符串值驻留表（值 -> 0,1,2...，按首次出现的顺序），保证不同的值得到不同的编码。
 * 该对象由一个 SmtVerifier 独占，不是线程安全的。
 * @author Ayalyt
 */
public class VariableRegistry {

    private static final Logger logger = LoggerFactory.getLogger(VariableRegistry.class);

    @Getter
    private final Context ctx;
    private final Map<String, IntExpr> intVars;
    private final Map<String, BoolExpr> boolVars;
    private final Map<String, Map<String, Long>> valueCodes;
    private final Map<String, List<String>> codeValues;

    public VariableRegistry(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.intVars = new LinkedHashMap<>();
        this.boolVars = new LinkedHashMap<>();
        this.valueCodes = new HashMap<>();
        this.codeValues = new HashMap<>();
    }

    /**
     * 获取指定名字的整数变量，不存在则创建并缓存。
     * @param name 变量名。
     * @return 对应的 Z3 IntExpr。
     * @throws IllegalStateException 如果该名字已注册为布尔变量。
     */
    public IntExpr getOrCreateInt(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null.");
        if (boolVars.containsKey(name)) {
            logger.error("VariableRegistry: {} 已注册为布尔变量，不能再作为整数变量使用", name);
            throw new IllegalStateException("Variable '" + name + "' is already registered as Bool, not Int");
        }
        return intVars.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 整数变量: {}", n);
            return ctx.mkIntConst(n);
        });
    }

    /**
     * 获取指定名字的布尔变量，不存在则创建并缓存。
     * @throws IllegalStateException 如果该名字已注册为整数变量。
     */
    public BoolExpr getOrCreateBool(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null.");
        if (intVars.containsKey(name)) {
            logger.error("VariableRegistry: {} 已注册为整数变量，不能再作为布尔变量使用", name);
            throw new IllegalStateException("Variable '" + name + "' is already registered as Int, not Bool");
        }
        return boolVars.computeIfAbsent(name, n -> {
            logger.debug("创建 Z3 布尔变量: {}", n);
            return ctx.mkBoolConst(n);
        });
    }

    /**
     * 返回 value 在属性 key 下的编码，首次出现时分配下一个编码。
     */
    public long internValue(String key, String value) {
        Objects.requireNonNull(key, "Attribute key cannot be null.");
        Objects.requireNonNull(value, "Attribute value cannot be null.");
        Map<String, Long> codes = valueCodes.computeIfAbsent(key, k -> new HashMap<>());
        Long code = codes.get(value);
        if (code == null) {
            List<String> values = codeValues.computeIfAbsent(key, k -> new ArrayList<>());
            code = (long) values.size();
            values.add(value);
            codes.put(value, code);
            logger.debug("驻留属性值: {}[{}] = {}", key, value, code);
        }
        return code;
    }

    /**
     * 把编码还原为属性值。编码未分配过则为空。
     */
    public Optional<String> decodeValue(String key, long code) {
        List<String> values = codeValues.get(key);
        if (values == null || code < 0 || code >= values.size()) {
            return Optional.empty();
        }
        return Optional.of(values.get((int) code));
    }

    public Optional<IntExpr> findInt(String name) {
        return Optional.ofNullable(intVars.get(name));
    }

    public boolean contains(String name) {
        return intVars.containsKey(name) || boolVars.containsKey(name);
    }

    /**
     * 整数变量名，按注册顺序。
     */
    public List<String> getIntVariableNames() {
        return List.copyOf(intVars.keySet());
    }

    public Set<String> getBoolVariableNames() {
        return Collections.unmodifiableSet(boolVars.keySet());
    }

    public int size() {
        return intVars.size() + boolVars.size();
    }

    /**
     * 当前驻留表的不可变快照，键为属性名，值为按编码排列的属性值。
     */
    Map<String, List<String>> snapshotInternedValues() {
        Map<String, List<String>> copy = new HashMap<>();
        codeValues.forEach((key, values) -> copy.put(key, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
