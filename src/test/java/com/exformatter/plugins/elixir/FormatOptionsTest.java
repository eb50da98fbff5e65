package com.exformatter.plugins.elixir;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.exformatter.util.Version;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FormatOptionsTest {

    @Test
    void defaults() {
        FormatOptions options = FormatOptions.defaults();

        assertThat(options.getLineLength()).isEqualTo(98);
        assertThat(options.getFile()).isEqualTo("nofile");
        assertThat(options.getLine()).isEqualTo(1);
        assertThat(options.getLocalsWithoutParens()).isEmpty();
        assertThat(options.getRenameDeprecatedAt()).isNull();
    }

    @Test
    void locals_must_be_name_and_arity() {
        assertThat(FormatOptions.builder().localsWithoutParens(List.of("plug/1", "field/*", "ok?/0")).build()
                .getLocalsWithoutParens()).containsExactlyInAnyOrder("plug/1", "field/*", "ok?/0");

        assertThatThrownBy(() -> FormatOptions.builder().localsWithoutParens(List.of("Foo")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("invalid entry \"Foo\" given to localsWithoutParens");
    }

    @Test
    void line_length_must_be_positive() {
        assertThatThrownBy(() -> FormatOptions.builder().lineLength(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invalid line length 0");
    }

    @Test
    void rename_version_is_parsed() {
        FormatOptions options = FormatOptions.builder().renameDeprecatedAt("1.6.0").build();

        assertThat(options.getRenameDeprecatedAt()).isEqualTo(new Version(1, 6, 0));
        assertThatThrownBy(() -> FormatOptions.builder().renameDeprecatedAt("1.6"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("invalid version \"1.6\" given to renameDeprecatedAt")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void to_builder_copies_every_option() {
        FormatOptions options = FormatOptions.builder()
                .lineLength(40)
                .localsWithoutParens(List.of("plug/1"))
                .renameDeprecatedAt("1.6.0")
                .build();

        FormatOptions copy = options.toBuilder().file("lib/a.ex").build();

        assertThat(copy.getFile()).isEqualTo("lib/a.ex");
        assertThat(copy.getLineLength()).isEqualTo(40);
        assertThat(copy.getLocalsWithoutParens()).containsExactly("plug/1");
        assertThat(copy.getRenameDeprecatedAt()).isEqualTo(options.getRenameDeprecatedAt());
        assertThat(options.getFile()).isEqualTo("nofile");
    }
}
