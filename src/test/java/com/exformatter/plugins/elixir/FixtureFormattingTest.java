package com.exformatter.plugins.elixir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.exformatter.plugins.elixir.parser.ParseException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Already formatted files under {@code src/test/resources/fixtures} must come
 * out unchanged.
 */
class FixtureFormattingTest {
    private static final Path FIXTURES = Path.of("src/test/resources/fixtures");

    @ParameterizedTest
    @ValueSource(strings = {
            "statements.ex", "containers.exs", "strings.ex", "captures.exs",
            "maps.exs", "clauses.ex", "operators.exs"
    })
    void formatted_fixture_is_a_fixed_point(String fileName) throws IOException, ParseException {
        String content = Files.readString(FIXTURES.resolve(fileName));
        FormatOptions options = FormatOptions.builder().file(fileName).build();

        assertThat(ElixirFormatter.formatFile(content, options)).isEqualTo(content);
        assertThat(Equivalence.check(content, ElixirFormatter.formatFile(content, options))).isEmpty();
    }
}
