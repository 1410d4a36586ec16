package org.stencil.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stencil.cli.CommandLineInterface;
import org.stencil.template.api.MalformedTemplateException;
import org.stencil.template.frontend.lexer.DelimiterPair;
import org.stencil.template.frontend.lexer.TemplateReconstructor;
import org.stencil.template.frontend.lexer.Token;
import org.stencil.template.frontend.lexer.Tokenizer;
import org.stencil.template.frontend.lexer.TokenizerOptions;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokenize", description = "Scans a template file and prints its token stream.")
public class TokenizeCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TokenizeCommand.class);
    private static final String TOKENIZER_CONFIG_PATH = "stencil.tokenizer";

    /** Output formats of the token stream. */
    public enum Format { JSON, TABLE }

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the template file.")
    private File file;

    @Option(names = {"-d", "--delimiters"}, description = "Initial delimiters as 'OPEN CLOSE', e.g. '<% %>'.")
    private String delimiters;

    @Option(names = "--gettext", description = "Recognize translation tags ({{_ ...}}, {{ngettext ...}}).")
    private Boolean gettext;

    @Option(names = "--format", defaultValue = "JSON", description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE}).")
    private Format format;

    @Option(names = "--reconstruct", description = "Print the template reconstructed from the tokens instead of the tokens.")
    private boolean reconstruct;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        TokenizerOptions options;
        try {
            options = resolveOptions(parent.getConfig());
        } catch (IllegalArgumentException e) {
            spec.commandLine().getErr().println("Invalid tokenizer options: " + e.getMessage());
            return 2;
        }

        String source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        Tokenizer tokenizer = new Tokenizer(options);
        List<Token> tokens;
        try {
            tokens = tokenizer.scan(source);
        } catch (MalformedTemplateException e) {
            LOG.debug("Tokenizing {} failed with {}", file, e.getErrorCode());
            spec.commandLine().getErr().println(file.getName() + ": " + e.getMessage());
            return 1;
        }

        PrintWriter out = spec.commandLine().getOut();
        if (reconstruct) {
            DelimiterPair initial = options.delimiters() != null
                    ? DelimiterPair.parse(options.delimiters())
                    : new DelimiterPair();
            out.print(TemplateReconstructor.reconstruct(tokens, initial));
        } else if (format == Format.TABLE) {
            printTable(tokens, out);
        } else {
            Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
            out.println(gson.toJson(tokens));
        }
        out.flush();
        return 0;
    }

    private TokenizerOptions resolveOptions(Config config) {
        TokenizerOptions configured = config.hasPath(TOKENIZER_CONFIG_PATH)
                ? TokenizerOptions.fromConfig(config.getConfig(TOKENIZER_CONFIG_PATH))
                : TokenizerOptions.DEFAULTS;
        return new TokenizerOptions(
                gettext != null ? gettext : configured.enableGettext(),
                delimiters != null ? delimiters : configured.delimiters());
    }

    private void printTable(List<Token> tokens, PrintWriter out) {
        for (Token token : tokens) {
            if (!token.isTag()) {
                out.printf("%-20s %s%n", token.kind(), gsonQuote(token.value()));
                continue;
            }
            StringBuilder line = new StringBuilder(String.format("%-20s %s", token.kind(), token.name()));
            if (token.args() != null && !token.args().isEmpty()) line.append(" args=").append(gsonQuote(token.args()));
            if (token.indent() != null) line.append(" indent=").append(gsonQuote(token.indent()));
            line.append(" @").append(token.sourceIndex());
            out.println(line);
        }
    }

    private static String gsonQuote(String text) {
        return new Gson().toJson(text);
    }
}
