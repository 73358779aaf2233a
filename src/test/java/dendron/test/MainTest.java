// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import dendron.cli.Main;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

final class MainTest {
    @BeforeEach
    void writeDocument() throws IOException {
        document = directory.resolve("doc.xml");
        Files.writeString(document, "<a x=\"1\"><b>hello</b></a>", StandardCharsets.UTF_8);
    }

    @Test
    void wrongArgumentCountPrintsUsage() {
        assertThat(run()).isEqualTo(64);
        assertThat(err()).contains("Usage");
        assertThat(run("1", "2", "3")).isEqualTo(64);
    }

    @Test
    void dumpsWholeTree() {
        assertThat(run(document.toString())).isEqualTo(0);
        assertThat(out()).isEqualTo("<a {x=1}></a>\n  <b>hello</b>\n");
    }

    @Test
    void dumpsElementsAtPath() {
        assertThat(run(document.toString(), "a.b")).isEqualTo(0);
        assertThat(out()).isEqualTo("<b>hello</b>\n");
    }

    @Test
    void reportsPathWithoutMatches() {
        assertThat(run(document.toString(), "a.c")).isEqualTo(2);
        assertThat(out()).isEmpty();
        assertThat(err()).contains("a.c");
    }

    @Test
    void reportsMalformedFile() throws IOException {
        Files.writeString(document, "<a><b></a>", StandardCharsets.UTF_8);
        assertThat(run(document.toString())).isEqualTo(1);
        assertThat(out()).isEmpty();
        assertThat(err())
            .contains("MarkupSyntaxErrorCondition")
            .contains("Parsing file " + document)
            .contains("Unwinding to restart abort-process.");
    }

    @Test
    void reportsMissingFile() {
        assertThat(run(directory.resolve("missing.xml").toString())).isEqualTo(1);
        assertThat(err()).contains("IOExceptionCondition");
    }

    private int run(final String... args) {
        return Main.run(
            args,
            new PrintStream(outBytes, true, StandardCharsets.UTF_8),
            new PrintStream(errBytes, true, StandardCharsets.UTF_8)
        );
    }

    private String out() {
        return outBytes.toString(StandardCharsets.UTF_8);
    }

    private String err() {
        return errBytes.toString(StandardCharsets.UTF_8);
    }

    @TempDir
    Path directory;

    private Path document;
    private final ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
    private final ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
}
