package org.learningjava.hpes.infrastructure.adapter.out.grammar;

import org.learningjava.hpes.application.port.GrammarParserPort;
import org.learningjava.hpes.domain.model.parse.ParseBudget;
import org.learningjava.hpes.domain.model.parse.ParseReport;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Well-formedness check on the JDK parser. Document type declarations are refused
 * outright, so no entity is ever expanded or fetched.
 */
@Component
public class XmlGrammarAdapter implements GrammarParserPort {

    public static final String GRAMMAR_ID = "xml";

    private final DocumentBuilderFactory factory;

    public XmlGrammarAdapter() {
        try {
            factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setNamespaceAware(true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    @Override
    public String grammarId() {
        return GRAMMAR_ID;
    }

    @Override
    public ParseReport parse(String source, ParseBudget budget) {
        budget.checkpoint();
        try {
            DocumentBuilder builder;
            synchronized (factory) {
                builder = factory.newDocumentBuilder();
            }
            builder.setErrorHandler(new FailingErrorHandler());
            Document doc = builder.parse(new InputSource(new StringReader(source)));
            return ParseReport.clean(GRAMMAR_ID, doc.getElementsByTagName("*").getLength());
        } catch (SAXParseException e) {
            return ParseReport.failed(GRAMMAR_ID,
                    "line " + e.getLineNumber() + ":" + e.getColumnNumber() + " " + e.getMessage());
        } catch (SAXException | IOException e) {
            return ParseReport.failed(GRAMMAR_ID, String.valueOf(e.getMessage()));
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("Cannot create XML parser", e);
        }
    }

    private static final class FailingErrorHandler implements ErrorHandler {
        @Override
        public void warning(SAXParseException exception) {
            // warnings do not affect well-formedness
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
