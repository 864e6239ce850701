package org.legalis.symbolic;

/**
 * 验证查询失败（不是答案，而是无法给出答案）的公共父类。
 */
public class VerifierException extends Exception {

    public VerifierException(String message) {
        super(message);
    }

    public VerifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
