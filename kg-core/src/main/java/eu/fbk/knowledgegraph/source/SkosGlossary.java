package eu.fbk.knowledgegraph.source;

import java.util.List;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;
import com.google.common.net.UrlEscapers;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.vocabulary.RDF;
import org.openrdf.model.vocabulary.RDFS;

import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.vocabulary.KG;
import eu.fbk.knowledgegraph.vocabulary.SKOS;

/**
 * Builds the SKOS rendering of a business glossary.
 * <p>
 * The glossary becomes a {@code skos:ConceptScheme} identified by {@code urn:glossary:<name>};
 * each term becomes a {@code skos:Concept} identified by {@code urn:glossary:<name>:<id>}, with
 * its name as {@code skos:prefLabel}, its definition as {@code skos:definition} and its parent
 * term, if any, as {@code skos:broader}.
 * </p>
 */
public final class SkosGlossary {

    private final String name;

    private final URI scheme;

    private final List<Statement> statements;

    private SkosGlossary(final String name, @Nullable final String description) {
        this.name = Preconditions.checkNotNull(name);
        this.scheme = Data.getValueFactory().createURI(KG.GLOSSARY_PREFIX + escape(name));
        this.statements = Lists.newArrayList();
        final ValueFactory vf = Data.getValueFactory();
        this.statements.add(vf.createStatement(this.scheme, RDF.TYPE, SKOS.CONCEPT_SCHEME));
        this.statements.add(vf.createStatement(this.scheme, RDFS.LABEL, vf.createLiteral(name)));
        if (description != null) {
            this.statements.add(vf.createStatement(this.scheme, RDFS.COMMENT,
                    vf.createLiteral(description)));
        }
    }

    public static SkosGlossary builder(final String name, @Nullable final String description) {
        return new SkosGlossary(name, description);
    }

    public SkosGlossary term(final String id, final String termName,
            @Nullable final String definition, @Nullable final String parentId) {
        Preconditions.checkNotNull(termName);
        final ValueFactory vf = Data.getValueFactory();
        final URI term = termURI(id);
        this.statements.add(vf.createStatement(term, RDF.TYPE, SKOS.CONCEPT));
        this.statements.add(vf.createStatement(term, SKOS.IN_SCHEME, this.scheme));
        this.statements.add(vf.createStatement(term, SKOS.PREF_LABEL, vf.createLiteral(termName)));
        if (definition != null) {
            this.statements.add(vf.createStatement(term, SKOS.DEFINITION,
                    vf.createLiteral(definition)));
        }
        if (parentId != null) {
            this.statements.add(vf.createStatement(term, SKOS.BROADER, termURI(parentId)));
        }
        return this;
    }

    public URI termURI(final String id) {
        Preconditions.checkArgument(!id.isEmpty(), "Empty term id");
        return Data.getValueFactory().createURI(this.scheme.stringValue() + ":" + escape(id));
    }

    public Glossary build() {
        return new Glossary(this.name, this.statements);
    }

    private static String escape(final String string) {
        return UrlEscapers.urlPathSegmentEscaper().escape(string);
    }

}
