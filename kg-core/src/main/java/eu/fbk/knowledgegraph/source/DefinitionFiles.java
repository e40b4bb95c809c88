package eu.fbk.knowledgegraph.source;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.google.common.base.Charsets;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.io.Files;
import com.google.common.io.Resources;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads definition files from the file system or the classpath, on behalf of collaborators that
 * implement {@link SourceProvider}.
 */
public final class DefinitionFiles {

    private static final Logger LOGGER = LoggerFactory.getLogger(DefinitionFiles.class);

    /** Extensions of the files recognized as definition files. */
    public static final Set<String> EXTENSIONS = ImmutableSet.of("ttl", "rdf", "xml", "owl",
            "skos");

    private DefinitionFiles() {
    }

    /**
     * Reads all the definition files directly contained in a directory, sorted by name. Files
     * with an unknown extension are ignored; unreadable files are logged and skipped. A missing
     * directory yields an empty list.
     * 
     * @param directory
     *            the directory to scan
     * @return the definition files read
     */
    public static List<DefinitionFile> scan(final File directory) {
        Preconditions.checkNotNull(directory);
        final List<DefinitionFile> result = Lists.newArrayList();
        final File[] files = directory.listFiles();
        if (files == null) {
            LOGGER.info("Definitions directory not found: {}", directory);
            return result;
        }
        Arrays.sort(files);
        for (final File file : files) {
            if (!file.isFile() || !isDefinitionFile(file.getName())) {
                continue;
            }
            try {
                final String text = Files.asCharSource(file, Charsets.UTF_8).read();
                result.add(new DefinitionFile(file.getPath(), text));
            } catch (final IOException ex) {
                LOGGER.warn("Skipping definition file {}: {}", file, ex.getMessage());
            }
        }
        LOGGER.debug("{} definition files read from {}", result.size(), directory);
        return result;
    }

    /**
     * Reads definition files bundled as classpath resources, resolved relative to the supplied
     * class. Missing resources are logged and skipped.
     * 
     * @param referenceClass
     *            the class resource names are resolved against
     * @param resourceNames
     *            the resource names
     * @return the definition files read, in the order of the names
     */
    public static List<DefinitionFile> fromClasspath(final Class<?> referenceClass,
            final Iterable<String> resourceNames) {
        final List<DefinitionFile> result = Lists.newArrayList();
        for (final String name : resourceNames) {
            final URL url = referenceClass.getResource(name);
            if (url == null) {
                LOGGER.warn("Skipping missing schema resource {}", name);
                continue;
            }
            try {
                result.add(new DefinitionFile(name, Resources.toString(url, Charsets.UTF_8)));
            } catch (final IOException ex) {
                LOGGER.warn("Skipping schema resource {}: {}", name, ex.getMessage());
            }
        }
        return result;
    }

    /**
     * Returns true if the file name has one of the recognized {@link #EXTENSIONS}.
     * 
     * @param fileName
     *            the file name
     * @return true for definition files
     */
    public static boolean isDefinitionFile(final String fileName) {
        final int index = fileName.lastIndexOf('.');
        return index > 0
                && EXTENSIONS.contains(fileName.substring(index + 1).toLowerCase(Locale.ROOT));
    }

}
