package com.psminifier.compress;

import com.psminifier.ast.Expression;
import com.psminifier.ast.LoopKind;
import com.psminifier.ast.ScriptBody;
import com.psminifier.ast.Statement;
import com.psminifier.ast.StatementVisitor;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Re-serializes statements and script bodies in their shortest form.
 * Statement lists are joined with {@code ;} and blocks carry no whitespace.
 */
public class StatementCompressor implements StatementVisitor<String> {

    private final CompressionSession session;
    private final ExpressionCompressor expressions;

    StatementCompressor(CompressionSession session) {
        this.session = session;
        this.expressions = new ExpressionCompressor(session, this);
    }

    public ExpressionCompressor expressions() {
        return expressions;
    }

    public String compress(Statement statement) {
        session.enter(statement);
        try {
            return statement.accept(this);
        } finally {
            session.exit();
        }
    }

    public String compressAll(MutableList<Statement> statements) {
        return statements.collect(this::compress).makeString(";");
    }

    // a lone end block is emitted as a plain body
    public String compressBody(ScriptBody body) {
        StringBuilder sb = new StringBuilder();
        if (!body.usings().isEmpty()) {
            sb.append(body.usings().collect(String::trim).makeString(";")).append(';');
        }

        ScriptBody.ParamBlock paramBlock = body.paramBlock();
        MutableList<ScriptBody.Parameter> parameters =
                paramBlock != null ? paramBlock.parameters() : Lists.mutable.empty();
        session.variables().enterScope(parameters.collect(ScriptBody.Parameter::name));
        try {
            if (paramBlock != null) {
                paramBlock.attributes().each(attribute -> sb.append(attribute.trim()));
                sb.append("param(").append(compressParameters(parameters)).append(')');
            }

            boolean named = appendNamedBlock(sb, "dynamicParam", body.dynamicParam());
            named |= appendNamedBlock(sb, "begin", body.begin());
            named |= appendNamedBlock(sb, "process", body.process());

            if (!named) {
                sb.append(compressAll(body.end()));
            } else if (!body.end().isEmpty()) {
                sb.append("end{").append(compressAll(body.end())).append('}');
            }
        } finally {
            session.variables().exitScope();
        }
        return sb.toString();
    }

    private boolean appendNamedBlock(StringBuilder sb, String name, MutableList<Statement> statements) {
        if (statements.isEmpty()) {
            return false;
        }
        sb.append(name).append('{').append(compressAll(statements)).append('}');
        return true;
    }

    private String compressParameters(MutableList<ScriptBody.Parameter> parameters) {
        return parameters.collect(parameter -> {
            StringBuilder sb = new StringBuilder();
            parameter.attributes().each(attribute -> sb.append(attribute.trim()));
            sb.append('$').append(parameter.name());
            if (parameter.defaultValue() != null) {
                sb.append('=').append(expressions.compress(parameter.defaultValue()));
            }
            return sb.toString();
        }).makeString(",");
    }

    private String block(MutableList<Statement> statements) {
        return "{" + compressAll(statements) + "}";
    }

    private String optional(Statement statement) {
        return statement != null ? compress(statement) : "";
    }

    @Override
    public String visitIf(Statement.If statement) {
        if (statement.clauses().isEmpty()) {
            return statement.text();
        }
        StringBuilder sb = new StringBuilder();
        statement.clauses().forEachWithIndex((clause, i) -> sb
                .append(i == 0 ? "if(" : "elseif(")
                .append(compress(clause.condition()))
                .append(')')
                .append(block(clause.body())));
        if (statement.elseBody() != null) {
            sb.append("else").append(block(statement.elseBody()));
        }
        return sb.toString();
    }

    @Override
    public String visitLoop(Statement.Loop statement) {
        StringBuilder sb = new StringBuilder();
        if (statement.label() != null && !statement.label().isBlank()) {
            sb.append(':').append(statement.label()).append(' ');
        }
        switch (statement.kind()) {
            case FOR_EACH -> sb.append("foreach(")
                    .append(expressions.compress(statement.variable()))
                    .append(" in ")
                    .append(compress(statement.condition()))
                    .append(')');
            case FOR -> sb.append("for(")
                    .append(optional(statement.initializer())).append(';')
                    .append(optional(statement.condition())).append(';')
                    .append(optional(statement.iterator())).append(')');
            case WHILE -> sb.append("while(").append(compress(statement.condition())).append(')');
            case DO_WHILE, DO_UNTIL -> sb.append("do");
        }
        sb.append(block(statement.body()));
        if (statement.kind() == LoopKind.DO_WHILE) {
            sb.append("while(").append(compress(statement.condition())).append(')');
        } else if (statement.kind() == LoopKind.DO_UNTIL) {
            sb.append("until(").append(compress(statement.condition())).append(')');
        }
        return sb.toString();
    }

    /**
     * A plain {@code =} to a simple variable registers a short name. The value is compressed
     * first, so a read of the same variable on the right still refers to the original. Compound
     * operators such as {@code +=} only reuse names that are already registered.
     */
    @Override
    public String visitAssignment(Statement.Assignment statement) {
        if (statement.value() == null) {
            throw new CompressionException("Assignment '" + Tokens.abbreviate(statement.text())
                    + "' has no statement on its right-hand side");
        }
        String value = compress(statement.value());
        String operator = statement.operator().trim();
        Expression target = statement.target();
        String left;
        if ("=".equals(operator)
                && target instanceof Expression.Variable variable
                && !variable.splatted()
                && session.variables().isRenamable(variable.name())) {
            left = "$" + session.variables().assign(variable.name());
        } else {
            left = expressions.compress(target);
        }
        return left + operator + value;
    }

    @Override
    public String visitPipeline(Statement.Pipeline statement) {
        if (statement.elements().isEmpty()) {
            return statement.text();
        }
        return statement.elements().collect(this::compress).makeString("|");
    }

    // only the command name is aliased
    @Override
    public String visitCommand(Statement.Command statement) {
        if (statement.elements().isEmpty()) {
            return statement.text();
        }
        MutableList<String> parts = Lists.mutable.empty();
        statement.elements().forEachWithIndex((element, i) ->
                parts.add(i == 0 ? expressions.compress(element) : expressions.compressLiteral(element)));
        statement.redirections().each(redirection -> parts.add(redirection.operator().trim()
                + (redirection.target() != null ? expressions.compressLiteral(redirection.target()) : "")));

        String command = parts.makeString(" ");
        String operator = statement.invocationOperator();
        if (operator == null || operator.isBlank()) {
            return command;
        }
        // ". $x" must keep its space or it reads as a member access
        return "&".equals(operator.trim()) ? "&" + command : operator.trim() + " " + command;
    }

    @Override
    public String visitCommandExpression(Statement.CommandExpression statement) {
        return statement.expression() != null ? expressions.compress(statement.expression()) : statement.text();
    }

    @Override
    public String visitTryCatchFinally(Statement.TryCatchFinally statement) {
        StringBuilder sb = new StringBuilder("try").append(block(statement.body()));
        statement.catches().each(clause -> {
            sb.append("catch");
            if (!clause.types().isEmpty()) {
                sb.append(' ').append(clause.types().collect(type -> "[" + Tokens.typeName(type) + "]").makeString(","));
            }
            sb.append(block(clause.body()));
        });
        if (statement.finallyBody() != null) {
            sb.append("finally").append(block(statement.finallyBody()));
        }
        return sb.toString();
    }

    @Override
    public String visitFunctionDefinition(Statement.FunctionDefinition statement) {
        StringBuilder sb = new StringBuilder(statement.kind().keyword()).append(' ').append(statement.name().trim());
        MutableList<ScriptBody.Parameter> parameters = statement.parameters();
        boolean inline = parameters != null && !parameters.isEmpty();
        session.variables().enterScope(inline ? parameters.collect(ScriptBody.Parameter::name) : Lists.mutable.empty());
        try {
            if (inline) {
                sb.append('(').append(compressParameters(parameters)).append(')');
            }
            sb.append('{').append(compressBody(statement.body())).append('}');
        } finally {
            session.variables().exitScope();
        }
        return sb.toString();
    }

    @Override
    public String visitSwitch(Statement.Switch statement) {
        StringBuilder sb = new StringBuilder();
        if (statement.label() != null && !statement.label().isBlank()) {
            sb.append(':').append(statement.label()).append(' ');
        }
        sb.append("switch");
        // "switch-regex" would read as a command name
        statement.flags().each(flag -> sb.append(' ').append(flag.startsWith("-") ? flag : "-" + flag));
        sb.append('(').append(compress(statement.condition())).append("){");

        MutableList<String> clauses = statement.clauses().collect(clause ->
                expressions.compressLiteral(clause.condition()) + block(clause.body()));
        if (statement.defaultBody() != null) {
            clauses.add("default" + block(statement.defaultBody()));
        }
        return sb.append(clauses.makeString(";")).append('}').toString();
    }

    @Override
    public String visitFlow(Statement.Flow statement) {
        if (statement.pipeline() != null) {
            return statement.keyword() + " " + compress(statement.pipeline());
        }
        if (statement.label() != null) {
            return statement.keyword() + " " + expressions.compressLiteral(statement.label());
        }
        return statement.keyword();
    }

    @Override
    public String visitOpaque(Statement.Opaque statement) {
        return statement.text();
    }
}
