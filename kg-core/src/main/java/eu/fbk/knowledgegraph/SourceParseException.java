package eu.fbk.knowledgegraph;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

/**
 * Signals that a single source item (definition file, stored definition, schema, glossary or
 * entity link) could not be read or parsed.
 * <p>
 * This exception never aborts a rebuild: the failing item is logged and skipped, and the other
 * items are loaded normally.
 * </p>
 */
public class SourceParseException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String source;

    public SourceParseException(final String source, final String message,
            @Nullable final Throwable cause) {
        super("Cannot load " + source + ": " + message, cause);
        this.source = Preconditions.checkNotNull(source);
    }

    /**
     * Returns a description of the failed source item (typically its context key).
     * 
     * @return the source description
     */
    public String getSource() {
        return this.source;
    }

}
