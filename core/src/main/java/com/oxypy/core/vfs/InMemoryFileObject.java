package com.oxypy.core.vfs;

import com.oxypy.api.vfs.FileObject;

import java.util.Objects;

/**
 * {@link FileObject} backed by a string. Used for unsaved editor buffers and in tests.
 */
public class InMemoryFileObject implements FileObject {

    private final String path;
    private final String name;
    private volatile String content;

    public InMemoryFileObject(String path, String content) {
        this.path = normalize(Objects.requireNonNull(path, "path"));
        this.content = content != null ? content : "";
        int slash = this.path.lastIndexOf('/');
        this.name = slash >= 0 ? this.path.substring(slash + 1) : this.path;
    }

    public void setContent(String content) {
        this.content = content != null ? content : "";
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getText() {
        return content;
    }

    @Override
    public String toString() {
        return "InMemoryFileObject{" + path + "}";
    }

    private static String normalize(String path) {
        return path.replace('\\', '/');
    }
}
