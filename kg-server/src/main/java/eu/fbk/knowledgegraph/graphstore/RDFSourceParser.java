package eu.fbk.knowledgegraph.graphstore;

import java.io.IOException;
import java.io.StringReader;
import java.util.List;

import com.google.common.collect.Lists;

import org.openrdf.model.Statement;
import org.openrdf.rio.ParserConfig;
import org.openrdf.rio.RDFFormat;
import org.openrdf.rio.RDFHandlerException;
import org.openrdf.rio.RDFParseException;
import org.openrdf.rio.RDFParser;
import org.openrdf.rio.Rio;
import org.openrdf.rio.helpers.BasicParserSettings;
import org.openrdf.rio.helpers.StatementCollector;
import org.openrdf.rio.helpers.XMLParserSettings;

import eu.fbk.knowledgegraph.SourceParseException;
import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.source.ModelFormat;

/**
 * Parses the text of a definition into statements.
 * <p>
 * The SKOS profile is read as Turtle, the RDFS profile as RDF/XML. Statements are collected in a
 * private buffer, so that a syntax error anywhere in the text leaves the caller with nothing.
 * Blank node identifiers are never preserved, hence blank nodes of distinct sources never clash.
 * </p>
 */
public final class RDFSourceParser {

    private RDFSourceParser() {
    }

    public static RDFFormat getRDFFormat(final ModelFormat format) {
        return format == ModelFormat.SKOS ? RDFFormat.TURTLE : RDFFormat.RDFXML;
    }

    /**
     * Parses the supplied text.
     * 
     * @param source
     *            a label identifying the text in error messages, used also as base IRI
     * @param text
     *            the text to parse
     * @param format
     *            the serialization profile of the text
     * @return the parsed statements, in document order
     * @throws SourceParseException
     *             if the text is not valid in the format specified
     */
    public static List<Statement> parse(final String source, final String text,
            final ModelFormat format) throws SourceParseException {

        final RDFFormat rdfFormat = getRDFFormat(format);
        final RDFParser parser = Rio.createParser(rdfFormat);
        parser.setValueFactory(Data.getValueFactory());

        final ParserConfig config = parser.getParserConfig();
        config.set(BasicParserSettings.FAIL_ON_UNKNOWN_DATATYPES, false);
        config.set(BasicParserSettings.FAIL_ON_UNKNOWN_LANGUAGES, false);
        config.set(BasicParserSettings.VERIFY_DATATYPE_VALUES, false);
        config.set(BasicParserSettings.PRESERVE_BNODE_IDS, false);
        if (rdfFormat.equals(RDFFormat.RDFXML)) {
            config.set(XMLParserSettings.FAIL_ON_NON_STANDARD_ATTRIBUTES, false);
            config.set(XMLParserSettings.FAIL_ON_SAX_NON_FATAL_ERRORS, false);
        }

        final List<Statement> statements = Lists.newArrayList();
        parser.setRDFHandler(new StatementCollector(statements));

        try {
            parser.parse(new StringReader(text), source);
        } catch (final RDFParseException ex) {
            throw new SourceParseException(source, rdfFormat.getName() + " syntax error at line "
                    + ex.getLineNumber() + ": " + ex.getMessage(), ex);
        } catch (final RDFHandlerException | IOException ex) {
            throw new SourceParseException(source, ex.getMessage(), ex);
        } catch (final RuntimeException ex) {
            // Rio may report some malformed input through unchecked exceptions
            throw new SourceParseException(source, String.valueOf(ex.getMessage()), ex);
        }
        return statements;
    }

}
