package com.vfmt.ast.expr;

import com.vfmt.ast.ExprVisitor;
import com.vfmt.ast.SourceLocation;

import java.util.List;

/**
 * 字符串插值 {@code 'Hello, $name! ${x:5.2f}'}
 *
 * <p>vals 比 exprs 多一项：vals[i] 之后紧跟 exprs[i]。formats[i] 为格式说明（不含冒号），可为空。</p>
 */
public class StringInterpolation extends Expression {
    private final List<String> vals;
    private final List<Expression> exprs;
    private final List<String> formats;

    public StringInterpolation(SourceLocation location, List<String> vals, List<Expression> exprs,
                               List<String> formats) {
        super(location);
        this.vals = vals;
        this.exprs = exprs;
        this.formats = formats;
    }

    public List<String> getVals() {
        return orEmpty(vals);
    }

    public List<Expression> getExprs() {
        return orEmpty(exprs);
    }

    /** 第 i 个插值的格式说明，没有时返回空串 */
    public String getFormat(int i) {
        List<String> fmts = orEmpty(formats);
        if (i < fmts.size() && fmts.get(i) != null) {
            return fmts.get(i);
        }
        return "";
    }

    @Override
    public <R, C> R accept(ExprVisitor<R, C> visitor, C context) {
        return visitor.visitStringInterpolation(this, context);
    }
}
