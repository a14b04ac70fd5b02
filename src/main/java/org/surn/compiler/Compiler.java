package org.surn.compiler;

import org.surn.compiler.api.CompilationException;
import org.surn.compiler.api.CompilerOptions;
import org.surn.compiler.api.ICompiler;
import org.surn.compiler.diagnostics.CompilerLogger;
import org.surn.compiler.diagnostics.DiagnosticsEngine;
import org.surn.compiler.diagnostics.Report;
import org.surn.compiler.diagnostics.ReportKind;
import org.surn.compiler.diagnostics.SourceBuffer;
import org.surn.compiler.frontend.context.Context;
import org.surn.compiler.frontend.context.ContextStore;
import org.surn.compiler.frontend.context.SourceOrigin;
import org.surn.compiler.frontend.lexer.LexicalError;
import org.surn.compiler.frontend.lexer.TokenizeResult;
import org.surn.compiler.frontend.lexer.Tokenizer;
import org.surn.compiler.frontend.lexer.analysis.TokenAnalyzer;
import org.surn.compiler.frontend.parser.AstGenerator;
import org.surn.compiler.frontend.parser.ParseError;
import org.surn.compiler.frontend.parser.ParseResult;
import org.surn.compiler.frontend.parser.ast.AstBody;
import org.surn.compiler.frontend.stream.TokenStream;
import org.surn.compiler.util.AstPrinter;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * The compiler front end. It runs a source through tokenizing, token analysis and parsing,
 * collects every problem in its {@link DiagnosticsEngine} and returns the parsed tree.
 * It is not thread-safe.
 */
public class Compiler implements ICompiler {

    private final CompilerOptions options;
    private final DiagnosticsEngine diagnostics = new DiagnosticsEngine();
    private final ContextStore contexts = new ContextStore();

    public Compiler() {
        this(CompilerOptions.defaults());
    }

    /**
     * @param options The switches of this compiler.
     */
    public Compiler(CompilerOptions options) {
        this.options = options;
    }

    @Override
    public ParseResult parseScript(String name, String source) {
        return run(SourceOrigin.ofVirtual(name, source), source).result();
    }

    @Override
    public ParseResult parseFile(Path path) throws IOException {
        SourceOrigin origin = SourceOrigin.ofFile(path);
        return run(origin, origin.getContents()).result();
    }

    /**
     * {@inheritDoc}
     * <p>
     * Lexical errors fail the call even when the parser recovered from them; the message is the
     * report of the syntax error if there is one, otherwise of the first lexical error.
     */
    @Override
    public AstBody parseOrThrow(String name, String source) throws CompilationException {
        SourceOrigin origin = SourceOrigin.ofVirtual(name, source);
        Outcome outcome = run(origin, source);

        if (outcome.result().getError().isPresent()) {
            throw new CompilationException(Report.fromParseError(outcome.result().error(), origin, source).render());
        }
        if (!outcome.lexicalErrors().isEmpty()) {
            LexicalError first = outcome.lexicalErrors().get(0);
            Report report = new Report()
                    .setName(name)
                    .setKind(ReportKind.ERROR)
                    .setCode(Report.LEXICAL_ERROR)
                    .setMessage(first.message())
                    .setSource(source)
                    .makeSnippet(first.range(), first.message(), null);
            throw new CompilationException(report.render());
        }
        return outcome.result().body();
    }

    @Override
    public DiagnosticsEngine getDiagnostics() {
        return diagnostics;
    }

    public CompilerOptions getOptions() {
        return options;
    }

    /**
     * @return The contexts of files currently being compiled; empty between calls.
     */
    public ContextStore getContextStore() {
        return contexts;
    }

    private Outcome run(SourceOrigin origin, String source) {
        CompilerLogger.setLevel(options.verbosity());
        String name = origin.getName();
        Context context = contexts.create(origin);
        CompilerLogger.debug("Compiler: " + name + " (context " + context.getId().value() + ")");

        try {
            // Phase 1: Lexical Analysis
            TokenizeResult lexed = new Tokenizer(source).scanTokens();
            for (LexicalError error : lexed.errors()) {
                diagnostics.reportError(error.message(), name, error.position().line(), error.range());
            }
            CompilerLogger.trace("Tokens: " + lexed.tokens().size());

            // Phase 2: Token analysis
            if (options.semanticChecks()) {
                int findings = new TokenAnalyzer(diagnostics, name).analyze(lexed.tokens());
                if (findings > 0) {
                    CompilerLogger.debug("Token analysis of " + name + " reported " + findings + " finding(s).");
                }
            }

            // Phase 3: Parsing (builds AST)
            AstGenerator generator = new AstGenerator(context, options.operatorPolicy().create());
            ParseResult result = generator.generate(new TokenStream(lexed.tokens()), source.length());
            if (result.getError().isPresent()) {
                ParseError error = result.error();
                int line = new SourceBuffer(source).getLineAt(error.range().start()).lineNumber();
                diagnostics.reportError(error.message(), name, line, error.range());
            }

            CompilerLogger.info("Parsed " + name + ": " + result.body().size() + " top-level node(s)"
                    + (result.isSuccess() ? "" : ", stopped by a syntax error") + ".");
            if (options.dumpAst()) {
                CompilerLogger.debug("AST of " + name + ":\n" + AstPrinter.print(result.body()));
            }
            return new Outcome(result, lexed.errors());
        } finally {
            contexts.remove(context.getId());
        }
    }

    private record Outcome(ParseResult result, List<LexicalError> lexicalErrors) {
    }
}
