package com.psminifier.ast;

public interface StatementVisitor<R> {
    R visitIf(Statement.If statement);
    R visitLoop(Statement.Loop statement);
    R visitAssignment(Statement.Assignment statement);
    R visitPipeline(Statement.Pipeline statement);
    R visitCommand(Statement.Command statement);
    R visitCommandExpression(Statement.CommandExpression statement);
    R visitTryCatchFinally(Statement.TryCatchFinally statement);
    R visitFunctionDefinition(Statement.FunctionDefinition statement);
    R visitSwitch(Statement.Switch statement);
    R visitFlow(Statement.Flow statement);
    R visitOpaque(Statement.Opaque statement);
}
