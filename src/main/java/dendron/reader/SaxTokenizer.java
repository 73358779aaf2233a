// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package dendron.reader;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.xml.XMLConstants;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParser;
import javax.xml.parsers.SAXParserFactory;
import dendron.util.annotation.Nullable;
import dendron.util.condition.Condition;
import dendron.util.condition.exception.IOExceptionCondition;
import dendron.util.condition.exception.ParserConfigurationExceptionCondition;
import org.xml.sax.Attributes;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

/**
 * The default {@link Tokenizer}, built on the JDK's SAX parser.
 * <p>
 * The parser is namespace-unaware: element and attribute names are reported exactly as written, prefixes included.
 * External entities and external DTDs are never loaded.
 * <p>
 * An input with no bytes at all is treated as an empty event stream rather than a syntax error.
 */
public final class SaxTokenizer implements Tokenizer {
    /**
     * Initializes a new tokenizer that trims the text of each element.
     */
    public SaxTokenizer() {
        this(WhitespaceMode.TRIM);
    }

    /**
     * Initializes a new tokenizer with the given whitespace handling.
     */
    public SaxTokenizer(final WhitespaceMode whitespaceMode) {
        this.whitespaceMode = whitespaceMode;
    }

    @Override
    public void tokenize(final byte[] input, final ElementHandler handler) {
        error = null;
        if (input.length == 0) {
            return;
        }
        final SAXParser parser;
        try {
            parser = newParserFactory().newSAXParser();
        } catch (final ParserConfigurationException e) {
            error = new ParserConfigurationExceptionCondition(e);
            return;
        } catch (final SAXException e) {
            error = new MarkupSyntaxErrorCondition("Unsupported SAX parser feature: " + e.getMessage(), null);
            return;
        }
        try {
            parser.parse(new ByteArrayInputStream(input), new EventAdapter(handler, whitespaceMode));
        } catch (final SAXParseException e) {
            error = new MarkupSyntaxErrorCondition(
                String.valueOf(e.getMessage()),
                new SourceLocation(e.getLineNumber(), e.getColumnNumber())
            );
        } catch (final SAXException e) {
            error = new MarkupSyntaxErrorCondition(String.valueOf(e.getMessage()), null);
        } catch (final IOException e) {
            error = new IOExceptionCondition(e);
        }
    }

    @Override
    public @Nullable Condition error() {
        return error;
    }

    private static SAXParserFactory newParserFactory() throws ParserConfigurationException, SAXException {
        final var factory = SAXParserFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setValidating(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return factory;
    }

    private final WhitespaceMode whitespaceMode;
    private @Nullable Condition error = null;

    /**
     * How the text accumulated for an element is passed on.
     */
    public enum WhitespaceMode {
        /**
         * Leading and trailing whitespace is removed, so that indentation between child elements doesn't count as
         * text content.
         */
        TRIM,
        /**
         * Text is passed on exactly as found in the source.
         */
        PRESERVE;

        String apply(final String text) {
            return (this == TRIM) ? text.strip() : text;
        }
    }

    private static final class EventAdapter extends DefaultHandler {
        private EventAdapter(final ElementHandler handler, final WhitespaceMode whitespaceMode) {
            this.handler = handler;
            this.whitespaceMode = whitespaceMode;
        }

        @Override
        public void startElement(
            final String uri,
            final String localName,
            final String qualifiedName,
            final Attributes attributes
        ) {
            texts.push(new StringBuilder());
            handler.startElement(qualifiedName, toMap(attributes));
        }

        @Override
        public void endElement(final String uri, final String localName, final String qualifiedName) {
            final var text = texts.pop();
            handler.endElement(qualifiedName, whitespaceMode.apply(text.toString()));
        }

        @Override
        public void characters(final char[] characters, final int start, final int length) {
            final var text = texts.peek();
            if (text != null) {
                text.append(characters, start, length);
            }
        }

        private static Map<String, String> toMap(final Attributes attributes) {
            final var length = attributes.getLength();
            if (length == 0) {
                return Collections.emptyMap();
            }
            final var result = new LinkedHashMap<String, String>(length * 2);
            for (int i = 0; i < length; i += 1) {
                result.put(attributes.getQName(i), attributes.getValue(i));
            }
            return result;
        }

        private final ElementHandler handler;
        private final WhitespaceMode whitespaceMode;
        private final ArrayDeque<StringBuilder> texts = new ArrayDeque<>();
    }
}
