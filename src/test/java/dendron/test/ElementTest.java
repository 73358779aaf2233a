// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.test;

import java.util.LinkedHashMap;
import java.util.Map;
import dendron.dom.Element;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import org.junit.jupiter.api.Test;

final class ElementTest {
    @Test
    void textOnlyElementIsLeaf() {
        final var element = Trees.build(builder -> {
            builder.startElement("a", Map.of());
            builder.endElement("a", "hi");
        });
        assertThat(element).isInstanceOf(Element.Leaf.class);
        assertThat(element.name()).isEqualTo("a");
        assertThat(element.text()).isEqualTo("hi");
        assertThat(element.attributes()).isNull();
        assertThat(element.children()).isNull();
    }

    @Test
    void childrenOnlyElementIsList() {
        final var element = Trees.build(builder -> {
            builder.startElement("a", Map.of());
            builder.startElement("b", Map.of());
            builder.endElement("b", "1");
            builder.startElement("c", Map.of());
            builder.endElement("c", "2");
            builder.endElement("a", "");
        });
        assertThat(element).isInstanceOf(Element.List.class);
        assertThat(element.text()).isNull();
        assertThat(element.attributes()).isNull();
        assertThat(element.children()).extracting(Element::name).containsExactly("b", "c");
    }

    @Test
    void attributesOnlyElementIsEmpty() {
        final var element = Trees.build(builder -> {
            builder.startElement("a", Map.of("x", "1"));
            builder.endElement("a", "");
        });
        assertThat(element).isInstanceOf(Element.Empty.class);
        assertThat(element.attributes()).containsExactly(entry("x", "1"));
        assertThat(element.text()).isNull();
        assertThat(element.children()).isNull();
    }

    @Test
    void textAndChildrenElementIsGeneral() {
        final var element = Trees.build(builder -> {
            builder.startElement("a", Map.of());
            builder.startElement("b", Map.of());
            builder.endElement("b", "inner");
            builder.endElement("a", "outer");
        });
        assertThat(element).isInstanceOf(Element.General.class);
        assertThat(element.text()).isEqualTo("outer");
        assertThat(element.attributes()).isNull();
        assertThat(element.children()).singleElement().satisfies(child -> {
            assertThat(child.name()).isEqualTo("b");
            assertThat(child.text()).isEqualTo("inner");
        });
    }

    @Test
    void elementWithEverythingIsGeneral() {
        final var element = Trees.build(builder -> {
            builder.startElement("a", Map.of("x", "1"));
            builder.startElement("b", Map.of());
            builder.endElement("b", "");
            builder.endElement("a", "text");
        });
        assertThat(element).isInstanceOf(Element.General.class);
        assertThat(element.text()).isEqualTo("text");
        assertThat(element.attributes()).containsExactly(entry("x", "1"));
        assertThat(element.children()).hasSize(1);
    }

    @Test
    void elementWithNothingIsGeneralWithAllPartsAbsent() {
        final var element = Trees.build(builder -> {
            builder.startElement("br", Map.of());
            builder.endElement("br", "");
        });
        assertThat(element).isInstanceOf(Element.General.class);
        assertThat(element.text()).isNull();
        assertThat(element.attributes()).isNull();
        assertThat(element.children()).isNull();
    }

    @Test
    void attributesAndTextElementIsGeneral() {
        final var element = Trees.build(builder -> {
            builder.startElement("a", Map.of("href", "/"));
            builder.endElement("a", "home");
        });
        assertThat(element).isInstanceOf(Element.General.class);
        assertThat(element.text()).isEqualTo("home");
        assertThat(element.attribute("href")).isEqualTo("/");
        assertThat(element.attribute("title")).isNull();
        assertThat(element.children()).isNull();
    }

    @Test
    void attributesKeepSourceOrderAndAreCopied() {
        final var attributes = new LinkedHashMap<String, String>();
        attributes.put("z", "1");
        attributes.put("a", "2");
        attributes.put("m", "3");
        final var element = Trees.build(builder -> {
            builder.startElement("e", attributes);
            builder.endElement("e", "");
        });
        attributes.put("late", "4");
        assertThat(element.attributes()).containsExactly(entry("z", "1"), entry("a", "2"), entry("m", "3"));
    }

    @Test
    void partsAreUnmodifiable() {
        final var element = Trees.parse("<a x=\"1\"><b/><c>text</c></a>");
        final var attributes = element.attributes();
        final var children = element.children();
        assertThat(attributes).isNotNull();
        assertThat(children).isNotNull();
        assertThatThrownBy(() -> attributes.put("y", "2")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> children.remove(0)).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void childIndexingIsBoundsChecked() {
        final var element = Trees.parse("<a><b/><c/></a>");
        assertThat(element.child(0)).extracting(Element::name).isEqualTo("b");
        assertThat(element.child(1)).extracting(Element::name).isEqualTo("c");
        assertThat(element.child(2)).isNull();
        assertThat(element.child(-1)).isNull();
    }

    @Test
    void childIndexingWithoutChildrenFindsNothing() {
        final var element = Trees.parse("<a>text</a>");
        assertThat(element.child(0)).isNull();
    }

    @Test
    void stringIndexingResolvesPath() {
        final var element = Trees.parse("<a><b><c>deep</c></b></a>");
        assertThat(element.get("a.b.c")).isSameAs(element.elementAtPath("a.b.c"));
        assertThat(element.get("b.c")).extracting(Element::text).isEqualTo("deep");
        assertThat(element.get("x")).isNull();
    }

    @Test
    void debugDumpListsElementsByDepth() {
        final var element = Trees.parse("<a x=\"1\"><b>hello</b><c><d>line\nbreak</d></c></a>");
        assertThat(element).hasToString("""
            <a {x=1}></a>
              <b>hello</b>
              <c></c>
                <d>line\\nbreak</d>
            """);
    }
}
