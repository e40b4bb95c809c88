package eu.fbk.knowledgegraph.source;

import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.openrdf.model.Statement;

/**
 * The statements extracted from a business glossary, loaded in their own graph context.
 */
public final class Glossary {

    private final String name;

    private final List<Statement> statements;

    public Glossary(final String name, final Iterable<? extends Statement> statements) {
        this.name = Preconditions.checkNotNull(name);
        this.statements = ImmutableList.copyOf(statements);
    }

    public String getName() {
        return this.name;
    }

    public List<Statement> getStatements() {
        return this.statements;
    }

    @Override
    public String toString() {
        return "Glossary " + this.name + " (" + this.statements.size() + " statements)";
    }

}
