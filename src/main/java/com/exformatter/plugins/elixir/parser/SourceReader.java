package com.exformatter.plugins.elixir.parser;

import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.exformatter.plugins.elixir.ast.Quoted;
import com.exformatter.util.LoggerUtil;

/**
 * Reads Elixir source into its quoted form, keeping the comments aside.
 */
public final class SourceReader {
    private static final Logger logger = LoggerUtil.getLogger(SourceReader.class);

    private SourceReader() {
    }

    /**
     * @param file the file name used in log messages
     * @param startLine the line number of the first line of {@code source}
     * @throws ParseException when {@code source} is not valid Elixir
     */
    public static ParsedSource read(String source, String file, int startLine) throws ParseException {
        Tokenizer tokenizer = new Tokenizer(source, startLine);
        List<Token> tokens = tokenizer.tokenize();
        if (logger.isLoggable(Level.FINEST)) {
            logger.finest(file + ": " + tokens.size() + " tokens, " + tokenizer.getComments().size() + " comments");
        }

        Quoted forms = new Parser(tokens).parseFile();
        return new ParsedSource(forms, tokenizer.getComments());
    }
}
