package eu.fbk.knowledgegraph.graphstore;

import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.net.UrlEscapers;

import org.openrdf.model.Statement;
import org.openrdf.model.URI;

import eu.fbk.knowledgegraph.data.Data;
import eu.fbk.knowledgegraph.source.SourceKind;

/**
 * A named subgraph holding the statements loaded from one source item.
 * <p>
 * A {@code Context} is created by a rebuild pass for each source item parsed successfully and is
 * never modified afterwards: a later rebuild replaces it as a whole. Its key is unique within a
 * {@link GraphStore} generation and has the URN scheme of its {@link SourceKind}. Statements are
 * kept in load order, without duplicates and without context information.
 * </p>
 */
public final class Context {

    private final String key;

    private final SourceKind sourceKind;

    @Nullable
    private final String format;

    private final Set<Statement> statements;

    private final URI uri;

    public Context(final String key, final SourceKind sourceKind, @Nullable final String format,
            final Iterable<? extends Statement> statements) {
        Preconditions.checkArgument(SourceKind.forKey(key) == sourceKind,
                "Key %s does not match source kind %s", key, sourceKind);
        this.key = key;
        this.sourceKind = sourceKind;
        this.format = format;
        this.statements = ImmutableSet.copyOf(statements);
        this.uri = Data.getValueFactory().createURI(
                UrlEscapers.urlFragmentEscaper().escape(key));
    }

    public String getKey() {
        return this.key;
    }

    public SourceKind getSourceKind() {
        return this.sourceKind;
    }

    /**
     * Returns the human name of the context, i.e., its key without the scheme prefix.
     * 
     * @return the display name
     */
    public String getName() {
        return SourceKind.nameOf(this.key);
    }

    /**
     * Returns the format the context was loaded from: the file extension for files, the
     * serialization profile for stored definitions, null for derived statements.
     * 
     * @return the format, possibly null
     */
    @Nullable
    public String getFormat() {
        return this.format;
    }

    public Set<Statement> getStatements() {
        return this.statements;
    }

    public int size() {
        return this.statements.size();
    }

    /**
     * Returns the IRI naming this context in the SPARQL dataset, i.e., the key with characters
     * not allowed in IRIs escaped.
     * 
     * @return the context URI
     */
    public URI getURI() {
        return this.uri;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("key", this.key)
                .add("kind", this.sourceKind).add("statements", this.statements.size())
                .toString();
    }

}
