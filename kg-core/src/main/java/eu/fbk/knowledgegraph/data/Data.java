package eu.fbk.knowledgegraph.data;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ListeningExecutorService;

import org.openrdf.model.URI;
import org.openrdf.model.ValueFactory;
import org.openrdf.model.impl.ValueFactoryImpl;

import eu.fbk.knowledgegraph.internal.Util;

/**
 * Helper functions and singletons shared by the knowledge graph components.
 * <p>
 * This class provides:
 * </p>
 * <ul>
 * <li>the {@code ValueFactory} used to create RDF terms ({@link #getValueFactory()});</li>
 * <li>the executor running query evaluations ({@link #getExecutor()}), created on demand with
 * the number of threads given by system property {@code knowledgegraph.threadCount};</li>
 * <li>IRI helpers ({@link #localName(String)}, {@link #parseURI(String)}).</li>
 * </ul>
 */
public final class Data {

    private static final ValueFactory VALUE_FACTORY = ValueFactoryImpl.getInstance();

    private static final Object EXECUTOR_LOCK = new Object();

    @Nullable
    private static ListeningExecutorService executor;

    private Data() {
    }

    /**
     * Returns the {@code ValueFactory} used to create {@code URI}s, {@code BNode}s,
     * {@code Literal}s and {@code Statement}s.
     * 
     * @return a singleton {@code ValueFactory}
     */
    public static ValueFactory getValueFactory() {
        return VALUE_FACTORY;
    }

    /**
     * Returns the executor shared by the knowledge graph components. If no executor is setup
     * using {@link #setExecutor(ListeningExecutorService)}, a daemon executor is created with the
     * thread count given by system property {@code knowledgegraph.threadCount} (default 4).
     * 
     * @return the shared executor
     */
    public static ListeningExecutorService getExecutor() {
        synchronized (EXECUTOR_LOCK) {
            if (executor == null) {
                final String threadName = MoreObjects.firstNonNull(
                        System.getProperty("knowledgegraph.threadName"), "kg-worker-%02d");
                int threadCount = 4;
                final String property = System.getProperty("knowledgegraph.threadCount");
                if (property != null) {
                    try {
                        threadCount = Integer.parseInt(property.trim());
                    } catch (final NumberFormatException ex) {
                        throw new IllegalArgumentException(
                                "Invalid knowledgegraph.threadCount: " + property, ex);
                    }
                }
                executor = Util.newExecutor(threadCount, threadName, true);
            }
            return executor;
        }
    }

    /**
     * Setup the executor shared by the knowledge graph components. A previously auto-created
     * executor is shut down.
     * 
     * @param newExecutor
     *            the new executor
     */
    public static void setExecutor(final ListeningExecutorService newExecutor) {
        Preconditions.checkNotNull(newExecutor);
        ListeningExecutorService executorToShutdown;
        synchronized (EXECUTOR_LOCK) {
            executorToShutdown = executor;
            executor = newExecutor;
        }
        if (executorToShutdown != null && executorToShutdown != newExecutor) {
            executorToShutdown.shutdown();
        }
    }

    /**
     * Returns the local name of an IRI string, i.e., the part after the last '#', '/' or ':'.
     * The whole string is returned if none of these separators is found or the local name would
     * be empty.
     * 
     * @param iri
     *            the IRI string
     * @return the local name
     */
    public static String localName(final String iri) {
        int index = iri.lastIndexOf('#');
        if (index < 0) {
            index = iri.lastIndexOf('/');
        }
        if (index < 0) {
            index = iri.lastIndexOf(':');
        }
        return index < 0 || index == iri.length() - 1 ? iri : iri.substring(index + 1);
    }

    /**
     * Creates a URI for the supplied string, throwing a {@link ParseException} if it does not
     * denote an absolute IRI.
     * 
     * @param string
     *            the IRI string
     * @return the created URI
     * @throws ParseException
     *             if the string is not an absolute IRI
     */
    public static URI parseURI(final String string) throws ParseException {
        Preconditions.checkNotNull(string);
        final String trimmed = string.trim();
        final int colon = trimmed.indexOf(':');
        if (colon <= 0 || trimmed.isEmpty() || containsInvalidChars(trimmed)) {
            throw new ParseException(string, "Not an absolute IRI");
        }
        for (int i = 0; i < colon; ++i) {
            final char c = trimmed.charAt(i);
            final boolean valid = Character.isLetter(c) || i > 0
                    && (Character.isDigit(c) || c == '+' || c == '-' || c == '.');
            if (!valid) {
                throw new ParseException(string, "Invalid IRI scheme");
            }
        }
        return VALUE_FACTORY.createURI(trimmed);
    }

    private static boolean containsInvalidChars(final String string) {
        for (int i = 0; i < string.length(); ++i) {
            final char c = string.charAt(i);
            if (c <= ' ' || c == '<' || c == '>' || c == '"' || c == '{' || c == '}'
                    || c == '|' || c == '\\' || c == '^' || c == '`') {
                return true;
            }
        }
        return false;
    }

}
