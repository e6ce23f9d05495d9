package com.psminifier.ast;

import org.eclipse.collections.api.list.MutableList;

public sealed interface Statement extends SyntaxNode {

    <R> R accept(StatementVisitor<R> visitor);

    record If(String text, MutableList<IfClause> clauses, MutableList<Statement> elseBody) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    record IfClause(Statement condition, MutableList<Statement> body) {}

    /**
     * Any loop. {@code variable} is set for foreach only; {@code initializer} and
     * {@code iterator} for the three-part for loop only.
     */
    record Loop(String text,
                LoopKind kind,
                String label,
                Expression variable,
                Statement initializer,
                Statement condition,
                Statement iterator,
                MutableList<Statement> body) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitLoop(this);
        }
    }

    record Assignment(String text, Expression target, String operator, Statement value) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitAssignment(this);
        }
    }

    record Pipeline(String text, MutableList<Statement> elements) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitPipeline(this);
        }
    }

    record Command(String text,
                   String invocationOperator,
                   MutableList<Expression> elements,
                   MutableList<Redirection> redirections) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitCommand(this);
        }
    }

    // 2>&1 has no target; > $path does
    record Redirection(String operator, Expression target) {}

    record CommandExpression(String text, Expression expression) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitCommandExpression(this);
        }
    }

    record TryCatchFinally(String text,
                           MutableList<Statement> body,
                           MutableList<CatchClause> catches,
                           MutableList<Statement> finallyBody) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitTryCatchFinally(this);
        }
    }

    record CatchClause(MutableList<String> types, MutableList<Statement> body) {}

    record FunctionDefinition(String text,
                              FunctionKind kind,
                              String name,
                              MutableList<ScriptBody.Parameter> parameters,
                              ScriptBody body) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitFunctionDefinition(this);
        }
    }

    record Switch(String text,
                  String label,
                  MutableList<String> flags,
                  Statement condition,
                  MutableList<SwitchClause> clauses,
                  MutableList<Statement> defaultBody) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitSwitch(this);
        }
    }

    record SwitchClause(Expression condition, MutableList<Statement> body) {}

    record Flow(String text, String keyword, Statement pipeline, Expression label) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitFlow(this);
        }
    }

    record Opaque(String text) implements Statement {
        @Override
        public <R> R accept(StatementVisitor<R> visitor) {
            return visitor.visitOpaque(this);
        }
    }
}
