package com.oxypy.api.vfs;

import java.io.IOException;

/**
 * Abstraction over a source file handed to language services.
 * <p>
 * Path separators should always be normalized to forward slashes '/'.
 */
public interface FileObject {

    /**
     * @return The file name with extension (e.g., "main.py").
     */
    String getName();

    /**
     * @return The extension without the dot (e.g., "py"), or empty string if none.
     */
    default String getExtension() {
        String name = getName();
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot + 1) : "";
    }

    /**
     * @return The path of this file.
     */
    String getPath();

    /**
     * Reads the whole file as text.
     */
    String getText() throws IOException;
}
