package com.psminifier.ast;

import org.eclipse.collections.api.list.MutableList;

public sealed interface Expression extends SyntaxNode {

    <R> R accept(ExpressionVisitor<R> visitor);

    record Binary(String text, Expression left, String operator, Expression right) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    record Unary(String text, String operator, Expression operand, boolean postfix) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    record Member(String text,
                  Expression target,
                  Expression member,
                  boolean invoke,
                  boolean isStatic,
                  MutableList<Expression> arguments) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitMember(this);
        }
    }

    /**
     * A double-quoted string. Offsets of nested expressions are relative to {@code text}.
     */
    record ExpandableString(String text, MutableList<NestedExpression> nested) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitExpandableString(this);
        }
    }

    record NestedExpression(Expression expression, int offset, int length) {}

    record Index(String text, Expression target, Expression index) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIndex(this);
        }
    }

    /**
     * {@code name} carries any scope qualifier ({@code env:Path}) but no sigil or braces.
     */
    record Variable(String text, String name, boolean splatted) implements Expression {
        public boolean braced() {
            return text.startsWith("${");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVariable(this);
        }
    }

    record ScriptBlockExpression(String text, ScriptBody body) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitScriptBlock(this);
        }
    }

    record Paren(String text, Statement pipeline) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitParen(this);
        }
    }

    record ArrayExpression(String text, MutableList<Statement> statements) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitArrayExpression(this);
        }
    }

    record SubExpression(String text, MutableList<Statement> statements) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitSubExpression(this);
        }
    }

    record Convert(String text, String typeName, Expression child) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitConvert(this);
        }
    }

    record TypeLiteral(String text, String typeName) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitTypeLiteral(this);
        }
    }

    /**
     * {@code ordered} is informational; {@code [ordered]} itself is emitted by the enclosing {@link Convert}.
     */
    record Hashtable(String text, boolean ordered, MutableList<KeyValue> pairs) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitHashtable(this);
        }
    }

    record KeyValue(Expression key, Statement value) {}

    record Constant(String text, boolean bareword) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }
    }

    record ArrayLiteral(String text, MutableList<Expression> elements) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitArrayLiteral(this);
        }
    }

    record CommandParameter(String text, String name, Expression argument) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitCommandParameter(this);
        }
    }

    record Opaque(String text) implements Expression {
        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitOpaque(this);
        }
    }
}
