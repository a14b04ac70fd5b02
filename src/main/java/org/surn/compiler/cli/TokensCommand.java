package org.surn.compiler.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.surn.compiler.frontend.lexer.LexicalError;
import org.surn.compiler.frontend.lexer.Token;
import org.surn.compiler.frontend.lexer.TokenizeResult;
import org.surn.compiler.frontend.lexer.Tokenizer;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Tokenizes a Surn source file and prints the tokens as JSON.")
public class TokensCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "The source file to tokenize.")
    private Path file;

    @Option(names = {"--skip-trivia"}, description = "Leave whitespace and comment tokens out of the output.")
    private boolean skipTrivia;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        String source;
        try {
            source = Files.readString(file);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Unable to read " + file + ": " + e.getMessage());
            return CommandLineInterface.EXIT_IO_ERROR;
        }

        TokenizeResult result = new Tokenizer(source).scanTokens();
        JsonObject root = new JsonObject();
        JsonArray tokens = new JsonArray();
        for (Token token : result.tokens()) {
            if (skipTrivia && token.isTrivia()) {
                continue;
            }
            tokens.add(toJson(token));
        }
        root.add("tokens", tokens);

        JsonArray errors = new JsonArray();
        for (LexicalError error : result.errors()) {
            JsonObject json = new JsonObject();
            json.addProperty("kind", error.kind().name());
            json.addProperty("message", error.message());
            json.addProperty("start", error.range().start());
            json.addProperty("end", error.range().end());
            errors.add(json);
        }
        root.add("errors", errors);

        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        PrintWriter out = spec.commandLine().getOut();
        out.println(gson.toJson(root));
        out.flush();
        return result.hasErrors() ? CommandLineInterface.EXIT_PARSE_ERROR : 0;
    }

    static JsonObject toJson(Token token) {
        JsonObject json = new JsonObject();
        json.addProperty("type", token.type().name());
        if (token.keyword() != null) {
            json.addProperty("keyword", token.keyword().text());
        }
        if (token.value() != null) {
            json.addProperty("value", token.value());
        }
        json.addProperty("start", token.range().start());
        json.addProperty("end", token.range().end());
        json.addProperty("line", token.position().line());
        json.addProperty("column", token.position().column());
        return json;
    }
}
