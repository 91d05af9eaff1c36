package org.refactor.codeblock.parser;

import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Position;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import org.refactor.codeblock.analysis.SyntheticNames;
import org.refactor.codeblock.ast.Assignment;
import org.refactor.codeblock.ast.AstNode;
import org.refactor.codeblock.ast.FunctionDefinition;
import org.refactor.codeblock.ast.Identifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 用 JavaParser 解析代码块语言。
 * <p>
 * 每条语句是一个 Java 表达式；{@code def f(a, b) { ... }} 定义函数，函数体内的 {@code return x}
 * （或 {@code return = x}）等价于对 {@code return} 赋值。不是赋值的顶层语句会被改写为 {@code tempXXXXXXXX=语句}，
 * 改写后的代码通过 {@link ParsedBlock#source()} 返回。
 */
public class JavaParserCodeParser implements CodeParser {

    private static final Pattern DEF_HEADER = Pattern.compile("^def\\s+([A-Za-z_$][\\w$]*)\\s*\\(([^)]*)\\)\\s*\\{");
    private static final Pattern RETURN = Pattern.compile("^return\\b");
    private static final Pattern RETURN_ASSIGN = Pattern.compile("^return\\s*=(?!=)");
    private static final Pattern NAME = Pattern.compile("[A-Za-z_$][\\w$]*");

    private final JavaParser javaParser;
    private final Supplier<String> syntheticNames;

    public JavaParserCodeParser() {
        this(SyntheticNames::randomName);
    }

    public JavaParserCodeParser(Supplier<String> syntheticNames) {
        this.javaParser = new JavaParser(new ParserConfiguration());
        this.syntheticNames = syntheticNames;
    }

    @Override
    public ParsedBlock parse(String code) {
        Session session = new Session(code == null ? "" : code);
        List<AstNode> nodes = new ArrayList<>();
        for (StatementSplitter.Chunk chunk : session.splitter.split(0, session.source.length())) {
            AstNode node = parseChunk(session, chunk, false);
            if (node != null) {
                nodes.add(node);
            }
        }
        if (!session.diagnostics.isEmpty()) {
            return ParsedBlock.failure(session.diagnostics);
        }
        return ParsedBlock.success(nodes, FreeIdentifierCollector.collect(nodes), session.rewritten());
    }

    private AstNode parseChunk(Session session, StatementSplitter.Chunk chunk, boolean inBody) {
        Matcher def = DEF_HEADER.matcher(chunk.text());
        if (def.find()) {
            return parseFunction(session, chunk, def);
        }
        if (inBody && RETURN.matcher(chunk.text()).find()) {
            return parseReturn(session, chunk);
        }
        return parseExpressionStatement(session, chunk);
    }

    private AstNode parseFunction(Session session, StatementSplitter.Chunk chunk, Matcher header) {
        int line = session.positions.line(chunk.offset());
        List<String> parameters = new ArrayList<>();
        String rawParameters = header.group(2);
        if (!rawParameters.isBlank()) {
            for (String p : rawParameters.split(",")) {
                String name = p.trim();
                if (!NAME.matcher(name).matches()) {
                    session.diagnostics.add(new Diagnostic("Invalid parameter name '" + name + "'", line,
                            session.positions.column(chunk.offset())));
                }
                parameters.add(name);
            }
        }

        int bodyStart = chunk.offset() + header.end();
        int bodyEnd = chunk.endOffset();
        if (chunk.text().charAt(chunk.text().length() - 1) != '}') {
            session.error("Missing '}' after function body", chunk.endOffset());
            return null;
        }
        List<AstNode> body = new ArrayList<>();
        for (StatementSplitter.Chunk sub : session.splitter.split(bodyStart, bodyEnd)) {
            AstNode node = parseChunk(session, sub, true);
            if (node != null) {
                body.add(node);
            }
        }
        int endLine = session.positions.line(bodyEnd);
        return new FunctionDefinition(header.group(1), parameters, body, line, endLine, endLine);
    }

    private AstNode parseReturn(Session session, StatementSplitter.Chunk chunk) {
        int line = session.positions.line(chunk.offset());
        int column = session.positions.column(chunk.offset());
        ExpressionConverter converter = new ExpressionConverter(line, column, 0, session.diagnostics);

        // return = x 与 return x 等价；把 '=' 换成空格，列号保持不变
        String text = chunk.text();
        Matcher assign = RETURN_ASSIGN.matcher(text);
        if (assign.find()) {
            text = text.substring(0, assign.end() - 1) + " " + text.substring(assign.end());
        }
        ParseResult<Statement> result = javaParser.parseStatement(text + ";");
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            report(session, result.getProblems(), converter);
            return null;
        }
        Statement statement = result.getResult().get();
        if (!(statement instanceof ReturnStmt returnStmt) || returnStmt.getExpression().isEmpty()) {
            session.diagnostics.add(new Diagnostic("A return statement needs a value", line, column));
            return null;
        }
        Identifier target = new Identifier("return", line, column);
        return new Assignment(target, converter.convert(returnStmt.getExpression().get()), line,
                converter.endLine(statement));
    }

    private AstNode parseExpressionStatement(Session session, StatementSplitter.Chunk chunk) {
        int line = session.positions.line(chunk.offset());
        int column = session.positions.column(chunk.offset());

        ParseResult<Expression> result = javaParser.parseExpression(chunk.text());
        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            report(session, result.getProblems(), new ExpressionConverter(line, column, 0, session.diagnostics));
            return null;
        }
        Expression expression = result.getResult().get();
        if (expression instanceof AssignExpr assign && assign.getOperator() == AssignExpr.Operator.ASSIGN
                && assign.getTarget().isNameExpr()) {
            return new ExpressionConverter(line, column, 0, session.diagnostics).convert(expression);
        }

        // 非赋值语句：前面插入合成临时变量
        String temp = syntheticNames.get();
        String prefix = SyntheticNames.assignmentPrefix(temp);
        session.insertions.put(chunk.offset(), prefix);
        ExpressionConverter converter = new ExpressionConverter(line, column, prefix.length(), session.diagnostics);
        AstNode value = converter.convert(expression);
        return new Assignment(new Identifier(temp, line, column), value, line, converter.endLine(expression));
    }

    private static void report(Session session, List<Problem> problems, ExpressionConverter converter) {
        if (problems.isEmpty()) {
            session.diagnostics.add(new Diagnostic("Cannot parse statement"));
            return;
        }
        for (Problem p : problems) {
            Optional<Position> position = p.getLocation()
                    .flatMap(l -> l.getBegin().getRange())
                    .map(r -> r.begin);
            session.diagnostics.add(new Diagnostic(p.getMessage(),
                    position.map(converter::line).orElse(-1),
                    position.map(converter::column).orElse(-1)));
        }
    }

    /**
     * 一次 parse 调用的状态
     */
    private static class Session {
        final String source;
        final SourcePositions positions;
        final List<Diagnostic> diagnostics = new ArrayList<>();
        final StatementSplitter splitter;
        final Map<Integer, String> insertions = new TreeMap<>();

        Session(String source) {
            this.source = source;
            this.positions = new SourcePositions(source);
            this.splitter = new StatementSplitter(source, positions, diagnostics);
        }

        void error(String message, int offset) {
            diagnostics.add(new Diagnostic(message, positions.line(offset), positions.column(offset)));
        }

        String rewritten() {
            StringBuilder sb = new StringBuilder(source.length());
            int last = 0;
            for (Map.Entry<Integer, String> insertion : insertions.entrySet()) {
                sb.append(source, last, insertion.getKey()).append(insertion.getValue());
                last = insertion.getKey();
            }
            return sb.append(source.substring(last)).toString();
        }
    }
}
