package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Amount of money in a given ISO currency code, e.g. {@code 5$usd}.
 */
public final class CurrencyValue extends Value {

    private final double value;
    private final String code;

    public CurrencyValue(SourceRange location, double value, String code) {
        super(location);
        this.value = value;
        this.code = Objects.requireNonNull(code, "code must not be null").toLowerCase(Locale.ROOT);
    }

    public CurrencyValue(double value, String code) {
        this(null, value, code);
    }

    public double value() {
        return value;
    }

    public String code() {
        return code;
    }

    @Override
    public Type getType() {
        return PrimitiveType.CURRENCY;
    }

    @Override
    public Object toJS() {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("value", value);
        result.put("code", code);
        return result;
    }

    @Override
    public CurrencyValue clone() {
        return new CurrencyValue(location, value, code);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitCurrencyValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        return SourceFormat.number(value) + "$" + code;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CurrencyValue)) return false;
        CurrencyValue that = (CurrencyValue) obj;
        return Double.compare(value, that.value) == 0 && code.equals(that.code);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, code);
    }

    @Override
    public String toString() {
        return "Currency(" + SourceFormat.number(value) + ", " + code + ")";
    }
}
