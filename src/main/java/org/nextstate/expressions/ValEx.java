package org.nextstate.expressions;

import lombok.Getter;

import java.math.BigInteger;
import java.util.Objects;

/**
 * 常量节点：布尔值或整数。
 */
@Getter
public final class ValEx extends TlaEx {

    private final Object value;

    private ValEx(Object value) {
        this.value = Objects.requireNonNull(value, "Value cannot be null.");
    }

    public static ValEx ofBool(boolean value) {
        return new ValEx(value);
    }

    public static ValEx ofInt(long value) {
        return new ValEx(BigInteger.valueOf(value));
    }

    public boolean isBool() {
        return value instanceof Boolean;
    }

    @Override
    public String toString() {
        if (isBool()) {
            return ((Boolean) value) ? "TRUE" : "FALSE";
        }
        return value.toString();
    }
}
