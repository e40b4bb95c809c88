package eu.fbk.knowledgegraph.graphstore;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ListMultimap;

import org.openrdf.model.Resource;
import org.openrdf.model.Statement;
import org.openrdf.model.URI;
import org.openrdf.model.Value;
import org.openrdf.repository.Repository;
import org.openrdf.repository.RepositoryConnection;
import org.openrdf.repository.RepositoryException;
import org.openrdf.repository.sail.SailRepository;
import org.openrdf.sail.memory.MemoryStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable generation of the knowledge graph.
 * <p>
 * A {@code GraphStore} owns a set of {@link Context}s with unique keys and exposes their union,
 * i.e., the concatenation of their statements (a statement loaded in two contexts appears twice).
 * Lookup indexes by subject, predicate and object are computed at construction time. A Sesame
 * in-memory repository holding each context as a named graph is created on first use and backs
 * SPARQL evaluation; its default graph is the union of all contexts.
 * </p>
 * <p>
 * Instances are never modified after construction, so they can be read concurrently without
 * locking. A rebuild produces a new instance instead.
 * </p>
 */
public final class GraphStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraphStore.class);

    private final long generation;

    private final Map<String, Context> contexts;

    private final List<Statement> statements;

    private final ListMultimap<Resource, Statement> subjectIndex;

    private final ListMultimap<URI, Statement> predicateIndex;

    private final ListMultimap<Value, Statement> objectIndex;

    @Nullable
    private Repository repository;

    private boolean closed;

    /**
     * Creates a new generation with the contexts specified.
     * 
     * @param generation
     *            the generation number, not negative
     * @param contexts
     *            the contexts, whose keys must be unique; their order is preserved
     * @throws IllegalArgumentException
     *             if two contexts share the same key
     */
    public GraphStore(final long generation, final Iterable<Context> contexts) {
        Preconditions.checkArgument(generation >= 0);

        final ImmutableMap.Builder<String, Context> contextBuilder = ImmutableMap.builder();
        final ImmutableList.Builder<Statement> statementBuilder = ImmutableList.builder();
        final ImmutableListMultimap.Builder<Resource, Statement> subjectBuilder;
        final ImmutableListMultimap.Builder<URI, Statement> predicateBuilder;
        final ImmutableListMultimap.Builder<Value, Statement> objectBuilder;
        subjectBuilder = ImmutableListMultimap.builder();
        predicateBuilder = ImmutableListMultimap.builder();
        objectBuilder = ImmutableListMultimap.builder();

        for (final Context context : contexts) {
            contextBuilder.put(context.getKey(), context);
            for (final Statement statement : context.getStatements()) {
                statementBuilder.add(statement);
                subjectBuilder.put(statement.getSubject(), statement);
                predicateBuilder.put(statement.getPredicate(), statement);
                objectBuilder.put(statement.getObject(), statement);
            }
        }

        this.generation = generation;
        this.contexts = buildContextMap(contextBuilder);
        this.statements = statementBuilder.build();
        this.subjectIndex = subjectBuilder.build();
        this.predicateIndex = predicateBuilder.build();
        this.objectIndex = objectBuilder.build();
    }

    /**
     * Returns an empty generation, numbered zero.
     * 
     * @return an empty store
     */
    public static GraphStore empty() {
        return new GraphStore(0, ImmutableList.<Context>of());
    }

    private static Map<String, Context> buildContextMap(
            final ImmutableMap.Builder<String, Context> builder) {
        try {
            return builder.build();
        } catch (final IllegalArgumentException ex) {
            throw new IllegalArgumentException("Duplicate context keys", ex);
        }
    }

    public long getGeneration() {
        return this.generation;
    }

    /**
     * Returns the contexts of this generation indexed by key, in load order.
     * 
     * @return an immutable map
     */
    public Map<String, Context> getContexts() {
        return this.contexts;
    }

    @Nullable
    public Context getContext(final String key) {
        return this.contexts.get(key);
    }

    /**
     * Returns the statements of all the contexts, in load order.
     * 
     * @return the union graph, as an immutable list
     */
    public List<Statement> getStatements() {
        return this.statements;
    }

    public int size() {
        return this.statements.size();
    }

    public List<Statement> getStatementsWithSubject(final Resource subject) {
        return this.subjectIndex.get(subject);
    }

    public List<Statement> getStatementsWithPredicate(final URI predicate) {
        return this.predicateIndex.get(predicate);
    }

    public List<Statement> getStatementsWithObject(final Value object) {
        return this.objectIndex.get(object);
    }

    /**
     * Returns true if the supplied value is an IRI used as predicate somewhere in the graph.
     * 
     * @param value
     *            the value to test
     * @return true if the value is a property
     */
    public boolean isPredicate(final Value value) {
        return value instanceof URI && this.predicateIndex.containsKey(value);
    }

    /**
     * Returns the Sesame repository holding this generation, creating and loading it on first
     * call.
     * 
     * @return the initialized repository
     * @throws RepositoryException
     *             if the repository cannot be created or loaded
     * @throws IllegalStateException
     *             if the store has been closed
     */
    public synchronized Repository getRepository() throws RepositoryException {
        Preconditions.checkState(!this.closed, "GraphStore generation %s closed",
                this.generation);
        if (this.repository == null) {
            final long ts = System.currentTimeMillis();
            final Repository repository = new SailRepository(new MemoryStore());
            repository.initialize();
            try {
                load(repository, this.contexts.values());
            } catch (final RepositoryException ex) {
                shutDown(repository);
                throw ex;
            }
            this.repository = repository;
            LOGGER.debug("Repository for generation {} loaded with {} statements in {} ms",
                    this.generation, this.statements.size(), System.currentTimeMillis() - ts);
        }
        return this.repository;
    }

    private static void load(final Repository repository, final Collection<Context> contexts)
            throws RepositoryException {
        final RepositoryConnection connection = repository.getConnection();
        try {
            connection.begin();
            for (final Context context : contexts) {
                connection.add(context.getStatements(), context.getURI());
            }
            connection.commit();
        } catch (final RepositoryException ex) {
            connection.rollback();
            throw ex;
        } finally {
            connection.close();
        }
    }

    /**
     * Releases the repository possibly created for this generation. Indexes remain usable.
     */
    public synchronized void close() {
        this.closed = true;
        if (this.repository != null) {
            shutDown(this.repository);
            this.repository = null;
        }
    }

    private static void shutDown(final Repository repository) {
        try {
            repository.shutDown();
        } catch (final RepositoryException ex) {
            LOGGER.error("Failed to shutdown Sesame repository", ex);
        }
    }

    @Override
    public String toString() {
        return "GraphStore generation " + this.generation + " (" + this.contexts.size()
                + " contexts, " + this.statements.size() + " statements)";
    }

}
