package org.surn.compiler.frontend.parser;

import org.surn.compiler.diagnostics.CompilerLogger;
import org.surn.compiler.frontend.context.Context;
import org.surn.compiler.frontend.lexer.Keyword;
import org.surn.compiler.frontend.lexer.TextRange;
import org.surn.compiler.frontend.lexer.Token;
import org.surn.compiler.frontend.lexer.TokenType;
import org.surn.compiler.frontend.parser.ast.ArrayExpression;
import org.surn.compiler.frontend.parser.ast.AstBody;
import org.surn.compiler.frontend.parser.ast.BlockStatement;
import org.surn.compiler.frontend.parser.ast.CallExpression;
import org.surn.compiler.frontend.parser.ast.ClassBody;
import org.surn.compiler.frontend.parser.ast.ClassDeclaration;
import org.surn.compiler.frontend.parser.ast.ClassMember;
import org.surn.compiler.frontend.parser.ast.ClassProperty;
import org.surn.compiler.frontend.parser.ast.ClassStatement;
import org.surn.compiler.frontend.parser.ast.ConstStatement;
import org.surn.compiler.frontend.parser.ast.EndOfLineExpression;
import org.surn.compiler.frontend.parser.ast.Expression;
import org.surn.compiler.frontend.parser.ast.Function;
import org.surn.compiler.frontend.parser.ast.FunctionInput;
import org.surn.compiler.frontend.parser.ast.FunctionStatement;
import org.surn.compiler.frontend.parser.ast.ImportStatement;
import org.surn.compiler.frontend.parser.ast.LiteralExpression;
import org.surn.compiler.frontend.parser.ast.LiteralKind;
import org.surn.compiler.frontend.parser.ast.MemberExpression;
import org.surn.compiler.frontend.parser.ast.MemberLookup;
import org.surn.compiler.frontend.parser.ast.Namespace;
import org.surn.compiler.frontend.parser.ast.NamespaceStatement;
import org.surn.compiler.frontend.parser.ast.NewExpression;
import org.surn.compiler.frontend.parser.ast.Node;
import org.surn.compiler.frontend.parser.ast.ObjectExpression;
import org.surn.compiler.frontend.parser.ast.ObjectProperty;
import org.surn.compiler.frontend.parser.ast.Operator;
import org.surn.compiler.frontend.parser.ast.Path;
import org.surn.compiler.frontend.parser.ast.ReturnStatement;
import org.surn.compiler.frontend.parser.ast.Statement;
import org.surn.compiler.frontend.parser.ast.StatementExpression;
import org.surn.compiler.frontend.parser.ast.StaticStatement;
import org.surn.compiler.frontend.parser.ast.TypeDefStatement;
import org.surn.compiler.frontend.parser.ast.VarStatement;
import org.surn.compiler.frontend.parser.ast.Variable;
import org.surn.compiler.frontend.parser.ast.Visibility;
import org.surn.compiler.frontend.parser.types.TypeDefinition;
import org.surn.compiler.frontend.parser.types.TypeKind;
import org.surn.compiler.frontend.parser.types.TypeParam;
import org.surn.compiler.frontend.parser.types.UnionType;
import org.surn.compiler.frontend.stream.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The recursive-descent parser. It consumes a {@link TokenStream} and produces an {@link AstBody}.
 * <p>
 * Every production looks at upcoming tokens without consuming them until it is sure the construct
 * is its own. From then on the production is committed: a missing continuation is a hard
 * {@link ParserException}, and no sibling production is tried. Productions are therefore tried in
 * a fixed priority order:
 * <ul>
 *     <li>statements: namespace, static, variable, function, class, type alias, import</li>
 *     <li>operands: statement, call, member, new, array, object, literal</li>
 * </ul>
 * Binary operators following an operand are attached by the configured {@link OperatorPolicy}.
 * <p>
 * A generator parses a single token stream; create a new one per file.
 */
public class AstGenerator implements ExpressionContext {

    private static final Predicate<Token> TRIVIA = Token::isTrivia;
    static final String NESTING_TOO_DEEP = "Expression nesting too deep.";

    private final Context context;
    private final OperatorPolicy operatorPolicy;
    private final AstBody body = new AstBody();
    private TokenStream tokens;
    private int sourceLength;
    private int pendingOperatorTokens;

    /**
     * Creates a generator using the right-recursive operator handling of the language.
     * @param context The context of the file being parsed, used for node ids.
     */
    public AstGenerator(Context context) {
        this(context, new RightRecursiveOperatorPolicy());
    }

    /**
     * Creates a generator.
     * @param context The context of the file being parsed, used for node ids.
     * @param operatorPolicy How trailing binary operators are attached.
     */
    public AstGenerator(Context context, OperatorPolicy operatorPolicy) {
        this.context = context;
        this.operatorPolicy = operatorPolicy;
    }

    /**
     * Parses the entire token stream. The source is taken to end with the last token.
     * @param stream The tokens of one file.
     * @return The parsed body, together with the error that stopped parsing if there was one.
     */
    public ParseResult generate(TokenStream stream) {
        List<Token> items = stream.items();
        return generate(stream, items.isEmpty() ? 0 : items.get(items.size() - 1).range().end());
    }

    /**
     * Parses the entire token stream.
     * @param stream The tokens of one file.
     * @param sourceLength The length of the tokenized source, the end of every "unexpected end" range.
     * @return The parsed body, together with the error that stopped parsing if there was one.
     */
    public ParseResult generate(TokenStream stream, int sourceLength) {
        this.tokens = stream;
        this.sourceLength = sourceLength;

        try {
            while (true) {
                skipTrivia();
                if (tokens.isEof()) {
                    break;
                }
                parseTopLevel();
            }
        } catch (ParserException e) {
            CompilerLogger.debug("Parsing " + context.getOrigin().getName() + " stopped: " + e.getError());
            return ParseResult.failure(body, e.getError());
        } catch (StackOverflowError e) {
            ParseError error = new ParseError(NESTING_TOO_DEEP, "Nesting limit reached here.", nestingRange());
            CompilerLogger.debug("Parsing " + context.getOrigin().getName() + " stopped: " + error);
            return ParseResult.failure(body, error);
        }
        return ParseResult.success(body);
    }

    private void parseTopLevel() throws ParserException {
        Token first = tokens.first().orElseThrow();
        int start = first.range().start();

        Optional<Statement> statement = parseStatement();
        if (statement.isPresent()) {
            match(TokenType.STATEMENT_END);
            body.push(new Node(statement.get(), rangeFrom(start)));
            return;
        }

        Optional<Expression> expression = parseExpression();
        if (expression.isPresent()) {
            match(TokenType.STATEMENT_END);
            body.push(new Node(expression.get(), rangeFrom(start)));
            return;
        }

        throw error("Missing a valid statement or expression in global scope.",
                "Unexpected token: " + describe(first), first.range());
    }

    // Statements

    /**
     * Tries every statement production in priority order.
     * @return The parsed statement, or empty if no statement starts here.
     * @throws ParserException if a statement production committed and failed.
     */
    Optional<Statement> parseStatement() throws ParserException {
        Optional<Statement> statement = parseNamespace();
        if (statement.isPresent()) return statement;

        statement = parseStatic();
        if (statement.isPresent()) return statement;

        statement = parseVariable();
        if (statement.isPresent()) return statement;

        Optional<Function> function = parseFunction();
        if (function.isPresent()) return Optional.of(new FunctionStatement(function.get()));

        statement = parseClass();
        if (statement.isPresent()) return statement;

        statement = parseTypeAlias();
        if (statement.isPresent()) return statement;

        return parseImport().map(ImportStatement::new);
    }

    private Optional<Statement> parseNamespace() throws ParserException {
        if (!matchKeyword(Keyword.NAMESPACE)) {
            return Optional.empty();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a namespace name.", null);
        Path path = parsePathAfter(name);

        if (match(TokenType.STATEMENT_END)) {
            return Optional.of(new NamespaceStatement(new Namespace(path, null)));
        }
        if (check(TokenType.LEFT_BRACE)) {
            BlockStatement block = parseBlock().orElseThrow();
            consume(TokenType.STATEMENT_END, "A semi-colon was expected.", "A namespace body must be followed by a semi-colon.");
            return Optional.of(new NamespaceStatement(new Namespace(path, block)));
        }
        throw errorAtNext("Unable to parse namespace path.", "Expected a semi-colon or a namespace body.");
    }

    private Optional<Statement> parseStatic() throws ParserException {
        Optional<TokenStream.Match> head = tokens.findAfter(t -> !t.isTrivia(), TRIVIA);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        Token first = head.get().token();
        Visibility visibility = Visibility.PRIVATE;
        int keywordDistance;

        if (isVisibilityKeyword(first)) {
            Optional<TokenStream.Match> next = tokens.findAfterNth(head.get().distance() + 1, t -> !t.isTrivia(), TRIVIA);
            if (next.isEmpty() || !next.get().token().isKeyword(Keyword.STATIC)) {
                return Optional.empty();
            }
            visibility = Visibility.fromKeyword(first.keyword()).orElseThrow();
            keywordDistance = next.get().distance();
        } else if (first.isKeyword(Keyword.STATIC)) {
            keywordDistance = head.get().distance();
        } else {
            return Optional.empty();
        }

        tokens.advance(keywordDistance + 1);
        Optional<Statement> inner = parseStatement();
        if (inner.isEmpty()) {
            throw errorAtNext("Expected a statement after a static keyword, but found none.", "A statement was expected here.");
        }
        return Optional.of(new StaticStatement(visibility, inner.get()));
    }

    private Optional<Statement> parseVariable() throws ParserException {
        Optional<TokenStream.Match> head = tokens.findAfter(t -> !t.isTrivia(), TRIVIA);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        Token first = head.get().token();
        Visibility visibility = Visibility.PRIVATE;
        TokenStream.Match declaration;

        if (isVisibilityKeyword(first)) {
            Optional<TokenStream.Match> next = tokens.findAfterNth(head.get().distance() + 1, t -> !t.isTrivia(), TRIVIA);
            if (next.isEmpty() || !isDeclarationKeyword(next.get().token())) {
                return Optional.empty();
            }
            visibility = Visibility.fromKeyword(first.keyword()).orElseThrow();
            declaration = next.get();
        } else if (isDeclarationKeyword(first)) {
            declaration = head.get();
        } else {
            return Optional.empty();
        }

        tokens.advance(declaration.distance() + 1);
        boolean constant = declaration.token().isKeyword(Keyword.CONST);

        Token name = consume(TokenType.IDENTIFIER, "A name must follow a variable declaration.", null);
        TypeKind type = null;
        if (match(TokenType.COLON)) {
            type = requireType("Expected type statement to follow a variable declaration with a colon.",
                    "A type statement is expected here.");
        }
        Expression assignment = null;
        if (matchOperator("=")) {
            assignment = requireExpression("Expected an expression to follow a variable declaration.",
                    "An expression is expected here.");
        }
        consume(TokenType.STATEMENT_END, "Expected a semicolon to follow a variable declaration.", "A semicolon is expected here.");

        Variable variable = new Variable(name.value(), type, visibility, assignment);
        return Optional.of(constant ? new ConstStatement(variable) : new VarStatement(variable));
    }

    private Optional<Function> parseFunction() throws ParserException {
        if (!matchKeyword(Keyword.FUNCTION)) {
            return Optional.empty();
        }
        Visibility visibility = parseVisibility().orElse(Visibility.PUBLIC);
        String name = matchToken(TokenType.IDENTIFIER).map(Token::value).orElse(null);

        consume(TokenType.LEFT_PARENTHESIS, "Expected a function input list to follow a function declaration.",
                "A function input list is expected here.");
        List<FunctionInput> inputs = new ArrayList<>();
        while (true) {
            skipTriviaOrFail("Function declaration arguments must be closed.");
            if (match(TokenType.RIGHT_PARENTHESIS)) {
                break;
            }
            Token parameter = consume(TokenType.IDENTIFIER, "Expected a function parameter name but none was found.",
                    "A name is expected here.");
            consume(TokenType.COLON, "Expected a type statement after a function argument declaration.",
                    "A colon is expected here.");
            TypeKind type = requireType("Expected a type statement to follow a function declaration argument.",
                    "A type statement is expected here.");
            inputs.add(new FunctionInput(parameter.value(), type));
            match(TokenType.COMMA);
        }

        TypeKind returnType = null;
        if (match(TokenType.COLON)) {
            returnType = requireType("Expected a return type statement to follow a function declaration.",
                    "A return type is expected here.");
        }

        if (!check(TokenType.LEFT_BRACE)) {
            throw errorAtNext("Expected a block to follow a function declaration.", "A block is expected here.");
        }
        BlockStatement block = parseBlock().orElseThrow();
        return Optional.of(new Function(name, inputs, returnType, block, visibility, context.nextLocalId()));
    }

    private Optional<Statement> parseClass() throws ParserException {
        if (!matchKeyword(Keyword.CLASS)) {
            return Optional.empty();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a class name but none was found.", null);

        String superclass = null;
        if (matchKeyword(Keyword.EXTENDS)) {
            superclass = consume(TokenType.IDENTIFIER, "Expected a class name to extend but none was found.", null).value();
        }

        List<String> interfaces = null;
        if (matchKeyword(Keyword.IMPLEMENTS)) {
            interfaces = new ArrayList<>();
            interfaces.add(consume(TokenType.IDENTIFIER, "Expected a class name to implement but none was found.", null).value());
            while (match(TokenType.COMMA)) {
                interfaces.add(consume(TokenType.IDENTIFIER,
                        "Expected a class name or interface to implement but none was found.", null).value());
            }
        }

        consume(TokenType.LEFT_BRACE, "Expected a class body to follow a class declaration.", "A left brace is expected here.");
        ClassBody classBody = parseClassBody();
        return Optional.of(new ClassStatement(
                new ClassDeclaration(name.value(), superclass, interfaces, classBody, context.nextLocalId())));
    }

    private ClassBody parseClassBody() throws ParserException {
        List<ClassProperty> properties = new ArrayList<>();
        List<Function> methods = new ArrayList<>();
        List<ClassMember> other = new ArrayList<>();

        while (true) {
            skipTriviaOrFail("Expected a right brace to close the class body, found none.");
            if (match(TokenType.RIGHT_BRACE)) {
                break;
            }

            Optional<ClassProperty> property = parseClassProperty(Visibility.PRIVATE);
            if (property.isPresent()) {
                properties.add(property.get());
                continue;
            }
            Optional<Function> method = parseFunction();
            if (method.isPresent()) {
                methods.add(method.get());
                continue;
            }
            Optional<ClassMember> member = parseClassAllowedStatement();
            if (member.isEmpty()) {
                Token unexpected = tokens.first().orElseThrow();
                throw error("Classes must contain a property, method, import or macro.",
                        "Unexpected token: " + describe(unexpected) + " inside class body.", unexpected.range());
            }
            if (member.get() instanceof ClassMember.Property p) {
                properties.add(p.property());
            } else if (member.get() instanceof ClassMember.Method m) {
                methods.add(m.method());
            } else {
                other.add(member.get());
            }
        }
        return new ClassBody(properties, methods, other);
    }

    private Optional<ClassProperty> parseClassProperty(Visibility visibility) throws ParserException {
        Optional<Token> name = matchToken(TokenType.IDENTIFIER);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        TypeKind type = null;
        if (match(TokenType.COLON)) {
            type = requireType("Expected a type statement to follow a property declaration.", "A type statement is expected here.");
        }
        Expression assignment = null;
        if (matchOperator("=")) {
            assignment = requireExpression("Expected an expression to follow a property declaration.",
                    "An expression is expected here.");
        }
        consume(TokenType.STATEMENT_END, "Expected a semicolon to follow a property declaration.", "A semicolon is expected here.");
        return Optional.of(new ClassProperty(name.get().value(), visibility, type, assignment));
    }

    private Optional<ClassMember> parseClassAllowedStatement() throws ParserException {
        Optional<Path> imported = parseImport();
        if (imported.isPresent()) {
            return Optional.of(new ClassMember.Import(imported.get()));
        }

        Optional<Visibility> visibility = parseVisibility();
        boolean isStatic = matchKeyword(Keyword.STATIC);
        if (visibility.isEmpty() && !isStatic) {
            return Optional.empty();
        }
        Visibility effective = visibility.orElse(Visibility.PRIVATE);

        ClassMember member;
        Optional<ClassProperty> property = parseClassProperty(effective);
        if (property.isPresent()) {
            member = new ClassMember.Property(property.get());
        } else {
            Optional<Function> method = parseFunction();
            if (method.isEmpty()) {
                throw errorAtNext("Expected a property or function declaration but none was found.", null);
            }
            member = new ClassMember.Method(method.get().withVisibility(effective));
        }
        return Optional.of(isStatic ? new ClassMember.Static(effective, member) : member);
    }

    private Optional<Statement> parseTypeAlias() throws ParserException {
        if (!matchKeyword(Keyword.TYPE)) {
            return Optional.empty();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a type name to follow a type declaration.", null);
        List<TypeParam> params = parseGenerics();
        if (!matchOperator("=")) {
            throw errorAtNext("Expected an assignment to follow a type declaration.", "An '=' is expected here.");
        }
        TypeKind kind = requireType("Expected a type to follow a type declaration.", "A type is expected here.");
        consume(TokenType.STATEMENT_END, "Expected a semicolon to follow a type declaration.", "A semicolon is expected here.");
        return Optional.of(new TypeDefStatement(new TypeDefinition(name.value(), params, kind)));
    }

    private Optional<Path> parseImport() throws ParserException {
        if (!matchKeyword(Keyword.USE)) {
            return Optional.empty();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a module path to follow a use statement.", null);
        Path path = parsePathAfter(name);
        consume(TokenType.STATEMENT_END, "Expected a semicolon to follow a use statement.", "A semicolon is expected here.");
        return Optional.of(path);
    }

    private Path parsePathAfter(Token name) throws ParserException {
        List<String> parts = new ArrayList<>();
        while (match(TokenType.BACKSLASH)) {
            parts.add(consume(TokenType.IDENTIFIER, "Expected identifier after backslash.", null).value());
        }
        return Path.of(name.value(), parts);
    }

    /**
     * Parses a braced block. Inside, {@code ;} becomes an {@link EndOfLineExpression} and
     * {@code return} a wrapped {@link ReturnStatement}.
     */
    private Optional<BlockStatement> parseBlock() throws ParserException {
        if (!match(TokenType.LEFT_BRACE)) {
            return Optional.empty();
        }
        List<Expression> expressions = new ArrayList<>();
        while (true) {
            skipTriviaOrFail("Block must be closed.");
            if (match(TokenType.RIGHT_BRACE)) {
                break;
            }
            if (match(TokenType.STATEMENT_END)) {
                expressions.add(new EndOfLineExpression());
                continue;
            }
            if (matchKeyword(Keyword.RETURN)) {
                Expression value = parseExpression().orElse(null);
                consume(TokenType.STATEMENT_END, "Expected a semicolon to follow a return statement.", "A semicolon is expected here.");
                expressions.add(new StatementExpression(new ReturnStatement(value)));
                continue;
            }
            Optional<Expression> expression = parseExpression();
            if (expression.isEmpty()) {
                throw errorAtNext("Expected a statement to follow a block.", "A statement is expected here.");
            }
            expressions.add(expression.get());
        }
        return Optional.of(new BlockStatement(expressions));
    }

    private Optional<Visibility> parseVisibility() {
        Optional<Token> modifier = matchToken(this::isVisibilityKeyword);
        return modifier.flatMap(token -> Visibility.fromKeyword(token.keyword()));
    }

    // Types

    private Optional<TypeKind> parseType() throws ParserException {
        if (!check(TokenType.IDENTIFIER)) {
            return Optional.empty();
        }
        List<TypeKind> members = new ArrayList<>();
        members.add(parseNamedType());
        while (matchOperator("|")) {
            if (!check(TokenType.IDENTIFIER)) {
                throw errorAtNext("Expected a type reference to follow a union type.", "A type reference is expected here.");
            }
            members.add(parseNamedType());
        }
        return Optional.of(members.size() == 1 ? members.get(0) : new UnionType(members));
    }

    private TypeKind parseNamedType() throws ParserException {
        Token name = consume(TokenType.IDENTIFIER, "Expected a type name.", null);
        return TypeKind.named(name.value(), parseGenerics());
    }

    private List<TypeParam> parseGenerics() throws ParserException {
        if (!matchOperator("<")) {
            return List.of();
        }
        List<TypeParam> params = new ArrayList<>();
        while (true) {
            params.add(TypeParam.of(requireType("Expected a type parameter to follow a typed parameter list.",
                    "A type parameter is expected here.")));
            if (matchOperator(">")) {
                return params;
            }
            consume(TokenType.COMMA, "Expected a type parameter list to be closed.", "A comma or '>' is expected here.");
        }
    }

    private TypeKind requireType(String message, String label) throws ParserException {
        skipTriviaOrFail(message);
        Optional<TypeKind> type = parseType();
        if (type.isEmpty()) {
            throw errorAtNext(message, label);
        }
        return type.get();
    }

    // Expressions

    /**
     * Parses an operand and every operator attached to it.
     * @return The expression, or empty if no expression starts here.
     * @throws ParserException if a production committed and failed.
     */
    Optional<Expression> parseExpression() throws ParserException {
        Optional<Expression> operand = parseOperandIfPresent();
        if (operand.isEmpty()) {
            return operand;
        }
        return Optional.of(operatorPolicy.attachOperators(operand.get(), this));
    }

    private Optional<Expression> parseOperandIfPresent() throws ParserException {
        Optional<Statement> statement = parseStatement();
        if (statement.isPresent()) return Optional.of(new StatementExpression(statement.get()));

        Optional<Expression> expression = parseCall();
        if (expression.isPresent()) return expression;

        expression = parseMember();
        if (expression.isPresent()) return expression;

        expression = parseNew();
        if (expression.isPresent()) return expression;

        expression = parseArray();
        if (expression.isPresent()) return expression;

        expression = parseObject();
        if (expression.isPresent()) return expression;

        return parseLiteral();
    }

    private Optional<Expression> parseCall() throws ParserException {
        Optional<TokenStream.Match> name = identifierFollowedBy(TokenType.LEFT_PARENTHESIS);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        tokens.advance(name.get().distance() + 2);
        List<Expression> arguments = parseArguments();
        return Optional.of(new CallExpression(name.get().token().value(), arguments));
    }

    private Optional<Expression> parseMember() throws ParserException {
        Optional<TokenStream.Match> origin = identifierFollowedBy(TokenType.ACCESSOR);
        if (origin.isEmpty()) {
            return Optional.empty();
        }
        Token accessor = tokens.nth(origin.get().distance() + 1).orElseThrow();
        tokens.advance(origin.get().distance() + 2);
        MemberLookup lookup = "::".equals(accessor.value()) ? MemberLookup.STATIC : MemberLookup.DYNAMIC;
        Expression member = requireExpression("Expected an expression to follow a property member.",
                "An expression was expected here.");
        return Optional.of(new MemberExpression(origin.get().token().value(), lookup, member));
    }

    private Optional<Expression> parseNew() throws ParserException {
        if (!matchKeyword(Keyword.NEW)) {
            return Optional.empty();
        }
        Token name = consume(TokenType.IDENTIFIER, "Expected a name to follow a new expression.", "A name was expected here.");
        consume(TokenType.LEFT_PARENTHESIS, "Expected a function call inputs to follow a new expression.",
                "Function inputs expected here.");
        return Optional.of(new NewExpression(name.value(), parseArguments()));
    }

    /**
     * Parses call arguments up to and including the closing parenthesis. The opening one is already consumed.
     */
    private List<Expression> parseArguments() throws ParserException {
        List<Expression> arguments = new ArrayList<>();
        while (true) {
            skipTriviaOrFail("Function arguments must be closed.");
            if (match(TokenType.RIGHT_PARENTHESIS)) {
                return arguments;
            }
            arguments.add(requireExpression("Expected an expression to follow a function input.",
                    "An expression is expected here."));
            if (!match(TokenType.COMMA) && !check(TokenType.RIGHT_PARENTHESIS)) {
                skipTriviaOrFail("Function arguments must be closed.");
                throw errorAtNext("Expected a comma to follow a function input.", "A comma is expected here.");
            }
        }
    }

    private Optional<Expression> parseArray() throws ParserException {
        if (!match(TokenType.LEFT_BRACKET)) {
            return Optional.empty();
        }
        List<Expression> values = new ArrayList<>();
        while (true) {
            skipTriviaOrFail("Array must be closed.");
            if (match(TokenType.RIGHT_BRACKET)) {
                return Optional.of(new ArrayExpression(values, null));
            }
            values.add(requireExpression("Expected an expression to follow an array element.", "An expression is expected here."));
            if (!match(TokenType.COMMA) && !check(TokenType.RIGHT_BRACKET)) {
                skipTriviaOrFail("Array must be closed.");
                throw errorAtNext("A comma is required to separate array elements.", "A comma is expected here.");
            }
        }
    }

    private Optional<Expression> parseObject() throws ParserException {
        if (!match(TokenType.LEFT_BRACE)) {
            return Optional.empty();
        }
        List<ObjectProperty> properties = new ArrayList<>();
        while (true) {
            skipTriviaOrFail("Object body must be closed.");
            if (match(TokenType.RIGHT_BRACE)) {
                return Optional.of(new ObjectExpression(properties, null));
            }
            Token name = consume(TokenType.IDENTIFIER, "Expected an object property to follow an object element.",
                    "An object property was expected here.");
            consume(TokenType.COLON, "Expected a colon to follow a property name.", null);
            Expression value = requireExpression("Expected an expression to follow a property.", "An expression was expected here.");
            properties.add(new ObjectProperty(name.value(), value));
            if (!match(TokenType.COMMA) && !check(TokenType.RIGHT_BRACE)) {
                skipTriviaOrFail("Object body must be closed.");
                throw errorAtNext("Expected a right brace to close an object body.", "A right brace was expected here.");
            }
        }
    }

    private Optional<Expression> parseLiteral() {
        Optional<Token> token = matchToken(t -> t.is(TokenType.IDENTIFIER) || t.is(TokenType.NUMBER)
                || t.is(TokenType.STRING_LITERAL) || t.is(TokenType.BOOLEAN));
        return token.map(t -> LiteralExpression.of(t.value(), literalKind(t.type())));
    }

    private static LiteralKind literalKind(TokenType type) {
        switch (type) {
            case NUMBER: return LiteralKind.NUMBER;
            case STRING_LITERAL: return LiteralKind.STRING;
            case BOOLEAN: return LiteralKind.BOOLEAN;
            default: return LiteralKind.IDENTIFIER;
        }
    }

    private Expression requireExpression(String message, String label) throws ParserException {
        skipTriviaOrFail(message);
        Optional<Expression> expression = parseExpression();
        if (expression.isEmpty()) {
            throw errorAtNext(message, label);
        }
        return expression.get();
    }

    // ExpressionContext

    @Override
    public Optional<Operator> nextOperator() {
        pendingOperatorTokens = 0;
        Optional<TokenStream.Match> head = tokens.findAfter(t -> t.is(TokenType.OPERATOR), TRIVIA);
        if (head.isEmpty()) {
            return Optional.empty();
        }
        int distance = head.get().distance();
        Token first = head.get().token();
        if (isWordOperator(first)) {
            pendingOperatorTokens = distance + 1;
            return Operator.fromSymbol(first.value());
        }

        // Glue directly adjacent operator characters, then take the longest known prefix.
        List<Token> run = new ArrayList<>();
        run.add(first);
        Optional<Token> next = tokens.nth(distance + run.size());
        while (next.isPresent() && next.get().is(TokenType.OPERATOR) && !isWordOperator(next.get())
                && next.get().range().start() == run.get(run.size() - 1).range().end()) {
            run.add(next.get());
            next = tokens.nth(distance + run.size());
        }
        for (int length = run.size(); length > 0; length--) {
            StringBuilder symbol = new StringBuilder();
            for (int i = 0; i < length; i++) {
                symbol.append(run.get(i).value());
            }
            Optional<Operator> operator = Operator.fromSymbol(symbol.toString());
            if (operator.isPresent()) {
                pendingOperatorTokens = distance + length;
                return operator;
            }
        }
        return Optional.empty();
    }

    @Override
    public void consumeOperator() {
        tokens.advance(pendingOperatorTokens);
        pendingOperatorTokens = 0;
    }

    @Override
    public Expression parseOperand() throws ParserException {
        skipTriviaOrFail("Expected an expression to follow an operation.");
        Optional<Expression> operand = parseOperandIfPresent();
        if (operand.isEmpty()) {
            throw errorAtNext("Expected an expression to follow an operation.", "An expression is expected here.");
        }
        return operand.get();
    }

    @Override
    public Expression parseRequiredExpression() throws ParserException {
        return requireExpression("Expected an expression to follow an operation.", "An expression is expected here.");
    }

    // Token helpers

    private void skipTrivia() {
        tokens.peekUntil(t -> !t.isTrivia());
    }

    /**
     * Skips whitespace and comments inside a construct that must continue.
     * @throws ParserException with the given message if the tokens run out.
     */
    private void skipTriviaOrFail(String message) throws ParserException {
        TextRange exhausted = exhaustedRange();
        if (tokens.peekUntil(t -> !t.isTrivia()).isEmpty()) {
            throw error(message, null, exhausted);
        }
    }

    private Optional<Token> nextSignificant() {
        return tokens.findAfter(t -> !t.isTrivia(), TRIVIA).map(TokenStream.Match::token);
    }

    private boolean check(TokenType type) {
        return nextSignificant().filter(t -> t.is(type)).isPresent();
    }

    private boolean match(TokenType type) {
        return matchToken(type).isPresent();
    }

    private Optional<Token> matchToken(TokenType type) {
        return matchToken(t -> t.is(type));
    }

    /**
     * Consumes leading whitespace and the next significant token, but only if that token matches.
     */
    private Optional<Token> matchToken(Predicate<Token> predicate) {
        Optional<TokenStream.Match> found = tokens.findAfter(predicate, TRIVIA);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        tokens.advance(found.get().distance() + 1);
        return Optional.of(found.get().token());
    }

    private boolean matchKeyword(Keyword keyword) {
        return matchToken(t -> t.isKeyword(keyword)).isPresent();
    }

    private boolean matchOperator(String symbol) {
        return matchToken(t -> t.is(TokenType.OPERATOR) && symbol.equals(t.value())).isPresent();
    }

    private Token consume(TokenType type, String message, String label) throws ParserException {
        skipTriviaOrFail(message);
        Optional<Token> token = tokens.peekIf(t -> t.is(type));
        if (token.isEmpty()) {
            throw errorAtNext(message, label);
        }
        return token.get();
    }

    /**
     * Finds an identifier that is immediately followed, without whitespace, by a token of the given type.
     */
    private Optional<TokenStream.Match> identifierFollowedBy(TokenType follower) {
        Optional<TokenStream.Match> name = tokens.findAfter(t -> t.is(TokenType.IDENTIFIER), TRIVIA);
        if (name.isEmpty() || tokens.nthIf(name.get().distance() + 1, t -> t.is(follower)).isEmpty()) {
            return Optional.empty();
        }
        return name;
    }

    private boolean isVisibilityKeyword(Token token) {
        return token.is(TokenType.KEYWORD) && token.keyword().isVisibility();
    }

    private static boolean isDeclarationKeyword(Token token) {
        return token.isKeyword(Keyword.VAR) || token.isKeyword(Keyword.CONST);
    }

    private static boolean isWordOperator(Token token) {
        return "and".equals(token.value()) || "or".equals(token.value());
    }

    // Errors

    private TextRange rangeFrom(int start) {
        int end = tokens.previous().map(t -> t.range().end()).orElse(start);
        return new TextRange(start, Math.max(start, end));
    }

    /**
     * The range reported when input runs out inside a construct: from the next remaining token,
     * or the last consumed one, to the end of the source.
     */
    private TextRange exhaustedRange() {
        int start = tokens.first()
                .or(tokens::previous)
                .map(t -> t.range().start())
                .orElse(0);
        return new TextRange(start, Math.max(start, sourceLength));
    }

    /**
     * The token the parser stood on when the call stack ran out.
     */
    private TextRange nestingRange() {
        return tokens.first().or(tokens::previous).map(Token::range).orElseGet(this::exhaustedRange);
    }

    private ParserException errorAtNext(String message, String label) {
        Optional<Token> next = nextSignificant();
        if (next.isEmpty()) {
            return error(message, label, exhaustedRange());
        }
        String inline = label != null ? label : "Unexpected token: " + describe(next.get());
        return error(message, inline, next.get().range());
    }

    private static ParserException error(String message, String label, TextRange range) {
        return new ParserException(new ParseError(message, label, range));
    }

    private static String describe(Token token) {
        String text = token.text();
        return text.isEmpty() ? token.type().name() : token.type().name() + " \"" + text + "\"";
    }
}
