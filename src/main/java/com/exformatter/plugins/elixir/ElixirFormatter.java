package com.exformatter.plugins.elixir;

import java.util.List;

import com.exformatter.algebra.Doc;
import com.exformatter.algebra.DocRenderer;
import com.exformatter.plugins.elixir.format.Comment;
import com.exformatter.plugins.elixir.format.ExpressionTranslator;
import com.exformatter.plugins.elixir.format.FormatterState;
import com.exformatter.plugins.elixir.parser.ParseException;
import com.exformatter.plugins.elixir.parser.ParsedSource;
import com.exformatter.plugins.elixir.parser.SourceReader;

/**
 * Formats Elixir source code.
 * <p>
 * The source is read into its quoted form with comments kept aside, the
 * quoted form is translated into a document with the comments put back, and
 * the document is rendered at the configured line length.
 */
public final class ElixirFormatter {

    /** A translated source and the deprecated calls renamed on the way. */
    public record Translation(Doc doc, List<FormatterState.Rename> renames) {
    }

    private ElixirFormatter() {
    }

    public static Translation translate(String source, FormatOptions options) throws ParseException {
        ParsedSource parsed = SourceReader.read(source, options.getFile(), options.getLine());

        FormatterState state = new FormatterState(
                Comment.gather(parsed.comments()),
                options.getLocalsWithoutParens(),
                options.getRenameDeprecatedAt());
        Doc doc = new ExpressionTranslator(state).translate(parsed.forms());
        return new Translation(doc, state.getRenames());
    }

    public static Doc toAlgebra(String source, FormatOptions options) throws ParseException {
        return translate(source, options).doc();
    }

    public static String format(String source, FormatOptions options) throws ParseException {
        return DocRenderer.render(toAlgebra(source, options), options.getLineLength());
    }

    /** Formats the contents of a file, which always end with a newline. */
    public static String formatFile(String source, FormatOptions options) throws ParseException {
        return format(source, options) + "\n";
    }
}
