package eu.fbk.knowledgegraph.source;

import java.util.Locale;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * The already-read content of a definition file.
 */
public final class DefinitionFile {

    private final String path;

    private final String text;

    @Nullable
    private final ModelFormat declaredFormat;

    public DefinitionFile(final String path, final String text) {
        this(path, text, null);
    }

    public DefinitionFile(final String path, final String text,
            @Nullable final ModelFormat declaredFormat) {
        this.path = Preconditions.checkNotNull(path);
        this.text = Preconditions.checkNotNull(text);
        this.declaredFormat = declaredFormat;
    }

    public String getPath() {
        return this.path;
    }

    /**
     * Returns the file name, i.e., the last segment of the path.
     * 
     * @return the file name
     */
    public String getName() {
        final int index = Math.max(this.path.lastIndexOf('/'), this.path.lastIndexOf('\\'));
        return index < 0 ? this.path : this.path.substring(index + 1);
    }

    /**
     * Returns the file extension in lowercase, without the dot.
     * 
     * @return the extension, null if the name has none
     */
    @Nullable
    public String getExtension() {
        final String name = getName();
        final int index = name.lastIndexOf('.');
        return index <= 0 || index == name.length() - 1 ? null : name.substring(index + 1)
                .toLowerCase(Locale.ROOT);
    }

    public String getText() {
        return this.text;
    }

    /**
     * Returns the declared format if any, otherwise the format inferred from the file name.
     * 
     * @return the format to parse the file with
     */
    public ModelFormat getFormat() {
        return this.declaredFormat != null ? this.declaredFormat : ModelFormat
                .forFileName(getName());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("path", this.path)
                .add("format", getFormat()).add("chars", this.text.length()).toString();
    }

}
