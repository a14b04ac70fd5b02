package org.surn.compiler.cli;

import com.typesafe.config.ConfigException;
import org.surn.compiler.Compiler;
import org.surn.compiler.api.CompilerOptions;
import org.surn.compiler.diagnostics.Diagnostic;
import org.surn.compiler.diagnostics.Report;
import org.surn.compiler.frontend.context.SourceOrigin;
import org.surn.compiler.frontend.parser.OperatorPolicy;
import org.surn.compiler.frontend.parser.ParseResult;
import org.surn.compiler.util.AstPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "parse", description = "Parses a Surn source file and reports syntax errors.")
public class ParseCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(ParseCommand.class);

    @Parameters(index = "0", description = "The source file to parse.")
    private Path file;

    @Option(names = {"--dump-ast"}, description = "Print the parsed tree as S-expressions.")
    private boolean dumpAst;

    @Option(names = {"--precedence"}, description = "Attach binary operators by precedence instead of right to left.")
    private boolean precedence;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        CompilerOptions options;
        try {
            options = CompilerOptions.fromConfig(parent.getConfig());
        } catch (ConfigException e) {
            err.println("Failed to load configuration: " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }
        if (precedence) {
            options = options.withOperatorPolicy(OperatorPolicy.Kind.PRECEDENCE);
        }

        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            err.println("Unable to read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        Compiler compiler = new Compiler(options);
        ParseResult result = compiler.parseScript(file.toString(), source);

        for (Diagnostic diagnostic : compiler.getDiagnostics().getDiagnostics()) {
            if (diagnostic.type() != Diagnostic.Type.ERROR) {
                err.println(diagnostic);
            }
        }

        if (result.getError().isPresent()) {
            err.println(Report.fromParseError(result.error(), SourceOrigin.ofFile(file), source).render());
            err.flush();
            return CommandLineInterface.EXIT_PARSE_ERROR;
        }
        if (compiler.getDiagnostics().hasErrors()) {
            err.println(compiler.getDiagnostics().summary());
            err.flush();
            return CommandLineInterface.EXIT_PARSE_ERROR;
        }

        if (dumpAst || options.dumpAst()) {
            out.println(AstPrinter.print(result.body()));
        }
        LOG.info("Parsed {} top-level node(s) from {}", result.body().size(), file);
        out.flush();
        return 0;
    }
}
