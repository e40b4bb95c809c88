package eu.fbk.knowledgegraph.source;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * A semantic model row of the definitions store. Only enabled rows are loaded in the graph.
 */
public final class StoredDefinition {

    private final String name;

    @Nullable
    private final String content;

    @Nullable
    private final String format;

    private final boolean enabled;

    public StoredDefinition(final String name, @Nullable final String content,
            @Nullable final String format, final boolean enabled) {
        this.name = Preconditions.checkNotNull(name);
        this.content = content;
        this.format = format;
        this.enabled = enabled;
    }

    public String getName() {
        return this.name;
    }

    /**
     * Returns the stored text, or the empty string if the row has no content.
     * 
     * @return the content text
     */
    public String getContent() {
        return this.content == null ? "" : this.content;
    }

    public ModelFormat getFormat() {
        return ModelFormat.forName(this.format);
    }

    public boolean isEnabled() {
        return this.enabled;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", this.name)
                .add("format", getFormat()).add("enabled", this.enabled).toString();
    }

}
