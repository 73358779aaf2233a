// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import dendron.reader.ElementHandler;
import dendron.reader.MarkupSyntaxErrorCondition;
import dendron.reader.SaxTokenizer;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.entry;
import org.junit.jupiter.api.Test;

final class SaxTokenizerTest {
    @Test
    void eventsFollowDocumentOrder() {
        final var events = tokenize(new SaxTokenizer(), "<a><b>1</b><c/></a>");
        assertThat(events).containsExactly("start a", "start b", "end b [1]", "start c", "end c []", "end a []");
    }

    @Test
    void textIsDirectTextOnly() {
        final var events = tokenize(new SaxTokenizer(), "<p>Hello <b>bold</b> world</p>");
        assertThat(events).containsExactly("start p", "start b", "end b [bold]", "end p [Hello  world]");
    }

    @Test
    void whitespaceIsTrimmedByDefault() {
        final var events = tokenize(new SaxTokenizer(), "<a>\n  <b>  x  </b>\n</a>");
        assertThat(events).containsExactly("start a", "start b", "end b [x]", "end a []");
    }

    @Test
    void whitespaceCanBePreserved() {
        final var events = tokenize(new SaxTokenizer(SaxTokenizer.WhitespaceMode.PRESERVE), "<a> <b> x </b>\n</a>");
        assertThat(events).containsExactly("start a", "start b", "end b [ x ]", "end a [ \n]");
    }

    @Test
    void entitiesAndCharacterDataAreDecoded() {
        final var events = tokenize(new SaxTokenizer(), "<a>&lt;x&gt; &amp; <![CDATA[<raw>]]></a>");
        assertThat(events).containsExactly("start a", "end a [<x> & <raw>]");
    }

    @Test
    void namesAreReportedAsWritten() {
        final var handler = new RecordingHandler();
        final var tokenizer = new SaxTokenizer();
        tokenizer.tokenize(bytes("<ns:a xmlns:ns=\"urn:x\" ns:z=\"1\" b=\"2\" a=\"3\"/>"), handler);
        assertThat(tokenizer.error()).isNull();
        assertThat(handler.events).containsExactly("start ns:a", "end ns:a []");
        assertThat(handler.attributes).singleElement().satisfies(attributes -> assertThat(attributes)
            .containsExactly(entry("xmlns:ns", "urn:x"), entry("ns:z", "1"), entry("b", "2"), entry("a", "3")));
    }

    @Test
    void malformedInputIsReportedWithLocation() {
        final var tokenizer = new SaxTokenizer();
        final var handler = new RecordingHandler();
        tokenizer.tokenize(bytes("<a>\n<b></a>"), handler);
        assertThat(handler.events).startsWith("start a", "start b");
        assertThat(tokenizer.error()).isInstanceOfSatisfying(MarkupSyntaxErrorCondition.class, error -> {
            assertThat(error.sourceLocation()).isNotNull();
            assertThat(error.sourceLocation().lineNumber()).isEqualTo(2);
        });
    }

    @Test
    void emptyInputProducesNoEventsAndNoError() {
        final var tokenizer = new SaxTokenizer();
        final var handler = new RecordingHandler();
        tokenizer.tokenize(new byte[0], handler);
        assertThat(handler.events).isEmpty();
        assertThat(tokenizer.error()).isNull();
    }

    @Test
    void errorIsResetOnReuse() {
        final var tokenizer = new SaxTokenizer();
        tokenizer.tokenize(bytes("<a>"), new RecordingHandler());
        assertThat(tokenizer.error()).isNotNull();
        tokenizer.tokenize(bytes("<a/>"), new RecordingHandler());
        assertThat(tokenizer.error()).isNull();
    }

    @Test
    void externalEntitiesAreNotLoaded() {
        final var tokenizer = new SaxTokenizer();
        final var handler = new RecordingHandler();
        tokenizer.tokenize(bytes("""
            <!DOCTYPE a [<!ENTITY secret SYSTEM "file:///etc/hostname">]>
            <a>&secret;</a>
            """), handler);
        // Refusing the document outright is fine too.
        if (tokenizer.error() == null) {
            assertThat(handler.events).containsExactly("start a", "end a []");
        }
    }

    private static List<String> tokenize(final SaxTokenizer tokenizer, final String markup) {
        final var handler = new RecordingHandler();
        tokenizer.tokenize(bytes(markup), handler);
        assertThat(tokenizer.error()).isNull();
        return handler.events;
    }

    private static byte[] bytes(final String markup) {
        return markup.getBytes(StandardCharsets.UTF_8);
    }

    private static final class RecordingHandler implements ElementHandler {
        @Override
        public void startElement(final String name, final Map<String, String> attributes) {
            events.add("start " + name);
            this.attributes.add(attributes);
        }

        @Override
        public void endElement(final String name, final String text) {
            events.add("end " + name + " [" + text + "]");
        }

        private final List<String> events = new ArrayList<>();
        private final List<Map<String, String>> attributes = new ArrayList<>();
    }
}
