package eu.fbk.knowledgegraph.server;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.knowledgegraph.internal.Util;

/**
 * The tunable limits of a {@link MemoryKnowledgeGraph}.
 * <p>
 * Settings are usually obtained via {@link #load()}, which reads resource
 * {@code knowledgegraph.properties} from the classpath and then applies the Java system
 * properties with the same names. Settings not specified anywhere take their default value.
 * </p>
 */
public final class KnowledgeGraphConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(KnowledgeGraphConfig.class);

    public static final String RESOURCE = "knowledgegraph.properties";

    public static final String DEFAULT_MAX_RESULTS = "knowledgegraph.query.defaultMaxResults";

    public static final String MAX_RESULTS = "knowledgegraph.query.maxResults";

    public static final String TIMEOUT = "knowledgegraph.query.timeout";

    public static final String NEIGHBORS_LIMIT = "knowledgegraph.neighbors.limit";

    public static final String PREFIX_LIMIT = "knowledgegraph.prefix.limit";

    public static final String SEARCH_LIMIT = "knowledgegraph.search.limit";

    private static final int DEFAULT_DEFAULT_MAX_RESULTS = 1000;

    private static final int DEFAULT_MAX_MAX_RESULTS = 10000;

    private static final long DEFAULT_TIMEOUT = 30000L;

    private static final int DEFAULT_NEIGHBORS_LIMIT = 200;

    private static final int DEFAULT_PREFIX_LIMIT = 20;

    private static final int DEFAULT_SEARCH_LIMIT = 50;

    private final int defaultMaxResults;

    private final int maxResults;

    private final long timeout;

    private final int neighborsLimit;

    private final int prefixLimit;

    private final int searchLimit;

    private KnowledgeGraphConfig(final Builder builder) {
        this.defaultMaxResults = positive(MoreObjects.firstNonNull(builder.defaultMaxResults,
                DEFAULT_DEFAULT_MAX_RESULTS), DEFAULT_MAX_RESULTS);
        this.maxResults = positive(MoreObjects.firstNonNull(builder.maxResults,
                DEFAULT_MAX_MAX_RESULTS), MAX_RESULTS);
        this.timeout = positive(MoreObjects.firstNonNull(builder.timeout, DEFAULT_TIMEOUT),
                TIMEOUT);
        this.neighborsLimit = positive(MoreObjects.firstNonNull(builder.neighborsLimit,
                DEFAULT_NEIGHBORS_LIMIT), NEIGHBORS_LIMIT);
        this.prefixLimit = positive(MoreObjects.firstNonNull(builder.prefixLimit,
                DEFAULT_PREFIX_LIMIT), PREFIX_LIMIT);
        this.searchLimit = positive(MoreObjects.firstNonNull(builder.searchLimit,
                DEFAULT_SEARCH_LIMIT), SEARCH_LIMIT);
    }

    private static <T extends Number> T positive(final T value, final String name) {
        Preconditions.checkArgument(value.longValue() > 0, "Invalid %s: %s", name, value);
        return value;
    }

    /**
     * Returns the configuration with all settings at their default value.
     * 
     * @return the default configuration
     */
    public static KnowledgeGraphConfig defaults() {
        return builder().build();
    }

    /**
     * Loads the configuration from the classpath resource {@value #RESOURCE}, if any, and from
     * system properties, the latter taking precedence.
     * 
     * @return the loaded configuration
     * @throws IllegalArgumentException
     *             if some setting has an invalid value
     */
    public static KnowledgeGraphConfig load() {
        final Builder builder = builder();
        final URL url = Util.getURL(RESOURCE);
        if (url != null) {
            final Properties properties = new Properties();
            try {
                final InputStream stream = url.openStream();
                try {
                    properties.load(stream);
                } finally {
                    stream.close();
                }
            } catch (final IOException ex) {
                LOGGER.warn("Cannot read " + url + ", ignoring it", ex);
            }
            builder.properties(properties);
        }
        return builder.properties(System.getProperties()).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the number of rows returned by a query when the caller does not specify a limit.
     * 
     * @return the default query row limit
     */
    public int getDefaultMaxResults() {
        return this.defaultMaxResults;
    }

    /**
     * Returns the maximum number of rows ever returned by a query.
     * 
     * @return the row limit cap
     */
    public int getMaxResults() {
        return this.maxResults;
    }

    /**
     * Returns the query timeout applied when the caller does not specify one.
     * 
     * @return the timeout, in milliseconds
     */
    public long getTimeout() {
        return this.timeout;
    }

    public int getNeighborsLimit() {
        return this.neighborsLimit;
    }

    public int getPrefixLimit() {
        return this.prefixLimit;
    }

    public int getSearchLimit() {
        return this.searchLimit;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("defaultMaxResults", this.defaultMaxResults)
                .add("maxResults", this.maxResults).add("timeout", this.timeout)
                .add("neighborsLimit", this.neighborsLimit).add("prefixLimit", this.prefixLimit)
                .add("searchLimit", this.searchLimit).toString();
    }

    public static final class Builder {

        @Nullable
        private Integer defaultMaxResults;

        @Nullable
        private Integer maxResults;

        @Nullable
        private Long timeout;

        @Nullable
        private Integer neighborsLimit;

        @Nullable
        private Integer prefixLimit;

        @Nullable
        private Integer searchLimit;

        Builder() {
        }

        public Builder defaultMaxResults(@Nullable final Integer defaultMaxResults) {
            this.defaultMaxResults = defaultMaxResults;
            return this;
        }

        public Builder maxResults(@Nullable final Integer maxResults) {
            this.maxResults = maxResults;
            return this;
        }

        public Builder timeout(@Nullable final Long timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder neighborsLimit(@Nullable final Integer neighborsLimit) {
            this.neighborsLimit = neighborsLimit;
            return this;
        }

        public Builder prefixLimit(@Nullable final Integer prefixLimit) {
            this.prefixLimit = prefixLimit;
            return this;
        }

        public Builder searchLimit(@Nullable final Integer searchLimit) {
            this.searchLimit = searchLimit;
            return this;
        }

        /**
         * Applies the settings found in the supplied properties, leaving the others unchanged.
         * 
         * @param properties
         *            the properties to read
         * @return this builder, for call chaining
         * @throws IllegalArgumentException
         *             if a setting is not a number
         */
        public Builder properties(final Properties properties) {
            this.defaultMaxResults = or(getInteger(properties, DEFAULT_MAX_RESULTS),
                    this.defaultMaxResults);
            this.maxResults = or(getInteger(properties, MAX_RESULTS), this.maxResults);
            final Integer timeout = getInteger(properties, TIMEOUT);
            this.timeout = timeout != null ? Long.valueOf(timeout) : this.timeout;
            this.neighborsLimit = or(getInteger(properties, NEIGHBORS_LIMIT),
                    this.neighborsLimit);
            this.prefixLimit = or(getInteger(properties, PREFIX_LIMIT), this.prefixLimit);
            this.searchLimit = or(getInteger(properties, SEARCH_LIMIT), this.searchLimit);
            return this;
        }

        @Nullable
        private static Integer or(@Nullable final Integer value, @Nullable final Integer current) {
            return value != null ? value : current;
        }

        @Nullable
        private static Integer getInteger(final Properties properties, final String name) {
            final String value = properties.getProperty(name);
            if (value == null || value.trim().isEmpty()) {
                return null;
            }
            try {
                return Integer.valueOf(value.trim());
            } catch (final NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid " + name + ": " + value, ex);
            }
        }

        public KnowledgeGraphConfig build() {
            return new KnowledgeGraphConfig(this);
        }

    }

}
