package org.sasslite.engine;

import java.io.IOException;

/**
 * File access used when resolving imports.
 */
public interface SourceFileSystem {

    /**
     * @return true if the path names a regular file that can be read
     */
    boolean isReadable(String path);

    String read(String path) throws IOException;

    /**
     * Joins a load path and a relative file name.
     */
    String resolve(String directory, String name);
}
