package eu.fbk.knowledgegraph.source;

import java.io.IOException;
import java.util.List;

/**
 * Supplies the current content of all graph sources at rebuild time.
 * <p>
 * Implementations are provided by the collaborators owning the sources (file system, definitions
 * store, glossary manager, governance tables). Every method returns already-read content: the
 * graph engine performs no I/O itself. A method throwing an {@code IOException} makes the rebuild
 * skip the sources of that kind only.
 * </p>
 */
public interface SourceProvider {

    /**
     * Returns the taxonomy files to load.
     * 
     * @return the definition files, possibly empty
     * @throws IOException
     *             if the files cannot be listed or read
     */
    List<DefinitionFile> getDefinitionFiles() throws IOException;

    /**
     * Returns all the rows of the definitions store, enabled or not.
     * 
     * @return the stored definitions, possibly empty
     * @throws IOException
     *             if the store cannot be accessed
     */
    List<StoredDefinition> getStoredDefinitions() throws IOException;

    /**
     * Returns the built-in schema files, always loaded.
     * 
     * @return the schema files, possibly empty
     * @throws IOException
     *             if the schemas cannot be read
     */
    List<DefinitionFile> getBuiltinSchemas() throws IOException;

    /**
     * Returns the glossaries whose statements are loaded in the graph.
     * 
     * @return the glossaries, possibly empty
     * @throws IOException
     *             if the glossaries cannot be extracted
     */
    List<Glossary> getGlossaries() throws IOException;

    /**
     * Returns the governance links between catalog entities and graph resources.
     * 
     * @return the entity links, possibly empty
     * @throws IOException
     *             if the links cannot be retrieved
     */
    List<EntityLink> getEntityLinks() throws IOException;

}
