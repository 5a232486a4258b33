package com.vfmt.ast.decl;

import com.vfmt.ast.SourceLocation;
import com.vfmt.ast.StmtVisitor;
import com.vfmt.ast.stmt.Statement;
import com.vfmt.ast.type.FnSignature;

import java.util.List;

/**
 * 函数 / 方法声明
 */
public class FnDecl extends Statement {
    private final List<String> attrs;
    private final FnSignature signature;
    private final List<Statement> body;
    private final boolean noBody;  // C 函数声明等没有函数体

    public FnDecl(SourceLocation location, List<String> attrs, FnSignature signature,
                  List<Statement> body, boolean noBody) {
        super(location);
        this.attrs = attrs;
        this.signature = signature;
        this.body = body;
        this.noBody = noBody;
    }

    public List<String> getAttrs() {
        return orEmpty(attrs);
    }

    public FnSignature getSignature() {
        return signature;
    }

    public List<Statement> getBody() {
        return orEmpty(body);
    }

    public boolean hasBody() {
        return !noBody;
    }

    @Override
    public <R, C> R accept(StmtVisitor<R, C> visitor, C context) {
        return visitor.visitFnDecl(this, context);
    }
}
