package com.psminifier.ast;

public interface ExpressionVisitor<R> {
    R visitBinary(Expression.Binary expression);
    R visitUnary(Expression.Unary expression);
    R visitMember(Expression.Member expression);
    R visitExpandableString(Expression.ExpandableString expression);
    R visitIndex(Expression.Index expression);
    R visitVariable(Expression.Variable expression);
    R visitScriptBlock(Expression.ScriptBlockExpression expression);
    R visitParen(Expression.Paren expression);
    R visitArrayExpression(Expression.ArrayExpression expression);
    R visitSubExpression(Expression.SubExpression expression);
    R visitConvert(Expression.Convert expression);
    R visitTypeLiteral(Expression.TypeLiteral expression);
    R visitHashtable(Expression.Hashtable expression);
    R visitConstant(Expression.Constant expression);
    R visitArrayLiteral(Expression.ArrayLiteral expression);
    R visitCommandParameter(Expression.CommandParameter expression);
    R visitOpaque(Expression.Opaque expression);
}
