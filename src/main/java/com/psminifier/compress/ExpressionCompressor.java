package com.psminifier.compress;

import com.psminifier.ast.Expression;
import com.psminifier.ast.ExpressionVisitor;
import org.eclipse.collections.api.list.MutableList;

import java.util.Optional;

public class ExpressionCompressor implements ExpressionVisitor<String> {

    private final CompressionSession session;
    private final StatementCompressor statements;

    ExpressionCompressor(CompressionSession session, StatementCompressor statements) {
        this.session = session;
        this.statements = statements;
    }

    public String compress(Expression expression) {
        session.enter(expression);
        try {
            return expression.accept(this);
        } finally {
            session.exit();
        }
    }

    // for barewords that are data rather than command names
    public String compressLiteral(Expression expression) {
        return expression instanceof Expression.Constant constant ? constant.text() : compress(expression);
    }

    @Override
    public String visitBinary(Expression.Binary expression) {
        return Tokens.join(compress(expression.left()), expression.operator().trim(), compress(expression.right()));
    }

    @Override
    public String visitUnary(Expression.Unary expression) {
        String operand = compress(expression.operand());
        String operator = expression.operator().trim();
        return expression.postfix() ? Tokens.join(operand, operator) : Tokens.join(operator, operand);
    }

    @Override
    public String visitMember(Expression.Member expression) {
        StringBuilder sb = new StringBuilder(compress(expression.target()))
                .append(expression.isStatic() ? "::" : ".")
                .append(compressLiteral(expression.member()));
        if (expression.invoke()) {
            sb.append('(').append(expression.arguments().collect(this::compress).makeString(",")).append(')');
        }
        return sb.toString();
    }

    /**
     * Copies the string left to right, replacing each nested expression with its compressed form.
     * Offsets are taken from the original text; a nested expression that is not found where it was
     * recorded is searched for from the current position, skipping escaped occurrences, and left as
     * written if it is not there.
     */
    @Override
    public String visitExpandableString(Expression.ExpandableString expression) {
        String text = expression.text();
        if (expression.nested().isEmpty()) {
            return text;
        }
        MutableList<Expression.NestedExpression> ordered =
                expression.nested().toSortedListBy(Expression.NestedExpression::offset);
        StringBuilder sb = new StringBuilder(text.length());
        int cursor = 0;
        for (Expression.NestedExpression nested : ordered) {
            String original = nested.expression().text();
            int start = locate(text, original, nested.offset(), cursor);
            if (start < 0) {
                continue;
            }
            sb.append(text, cursor, start).append(compress(nested.expression()));
            cursor = start + original.length();
        }
        return sb.append(text, cursor, text.length()).toString();
    }

    private static int locate(String text, String original, int offset, int cursor) {
        if (original.isEmpty()) {
            return -1;
        }
        if (offset >= cursor && text.startsWith(original, offset)) {
            return offset;
        }
        int start = text.indexOf(original, cursor);
        while (start >= 0 && isEscaped(text, start)) {
            start = text.indexOf(original, start + 1);
        }
        return start;
    }

    // an odd run of backticks escapes the character after it
    private static boolean isEscaped(String text, int index) {
        int ticks = 0;
        for (int i = index - 1; i >= 0 && text.charAt(i) == '`'; i--) {
            ticks++;
        }
        return ticks % 2 == 1;
    }

    @Override
    public String visitIndex(Expression.Index expression) {
        return compress(expression.target()) + "[" + compress(expression.index()) + "]";
    }

    @Override
    public String visitVariable(Expression.Variable expression) {
        Optional<String> shortName = session.variables().lookup(expression.name());
        if (shortName.isEmpty()) {
            return expression.text();
        }
        String sigil = expression.splatted() ? "@" : "$";
        return expression.braced() ? sigil + "{" + shortName.get() + "}" : sigil + shortName.get();
    }

    @Override
    public String visitScriptBlock(Expression.ScriptBlockExpression expression) {
        return "{" + statements.compressBody(expression.body()) + "}";
    }

    @Override
    public String visitParen(Expression.Paren expression) {
        return "(" + statements.compress(expression.pipeline()) + ")";
    }

    @Override
    public String visitArrayExpression(Expression.ArrayExpression expression) {
        return "@(" + statements.compressAll(expression.statements()) + ")";
    }

    @Override
    public String visitSubExpression(Expression.SubExpression expression) {
        return "$(" + statements.compressAll(expression.statements()) + ")";
    }

    @Override
    public String visitConvert(Expression.Convert expression) {
        return "[" + Tokens.typeName(expression.typeName()) + "]" + compress(expression.child());
    }

    @Override
    public String visitTypeLiteral(Expression.TypeLiteral expression) {
        return "[" + Tokens.typeName(expression.typeName()) + "]";
    }

    @Override
    public String visitHashtable(Expression.Hashtable expression) {
        return "@{" + expression.pairs()
                .collect(pair -> compressLiteral(pair.key()) + "=" + statements.compress(pair.value()))
                .makeString(";") + "}";
    }

    @Override
    public String visitConstant(Expression.Constant expression) {
        return expression.bareword() ? session.aliases().resolve(expression.text()) : expression.text();
    }

    @Override
    public String visitArrayLiteral(Expression.ArrayLiteral expression) {
        return expression.elements().collect(this::compressLiteral).makeString(",");
    }

    @Override
    public String visitCommandParameter(Expression.CommandParameter expression) {
        String name = expression.name().startsWith("-") ? expression.name() : "-" + expression.name();
        return expression.argument() != null ? name + ":" + compressLiteral(expression.argument()) : name;
    }

    @Override
    public String visitOpaque(Expression.Opaque expression) {
        return expression.text();
    }
}
