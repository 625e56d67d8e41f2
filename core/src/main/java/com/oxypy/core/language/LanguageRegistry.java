package com.oxypy.core.language;

import com.oxypy.api.language.LanguageSupport;
import com.oxypy.api.vfs.FileObject;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Ordered registry of {@link LanguageSupport} instances, keyed by language id.
 *
 * Lookup by file walks supports in registration order; the first one that can handle the file wins.
 * Re-registering an id replaces the previous support but keeps its position.
 */
public final class LanguageRegistry {

    private static final Logger LOG = Logger.getLogger(LanguageRegistry.class.getName());

    private final Map<String, LanguageSupport> supportsById = new LinkedHashMap<>();

    public synchronized void register(@NotNull LanguageSupport support) {
        Objects.requireNonNull(support, "support");
        String id = support.getId();
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("language id is blank: " + support.getClass().getName());
        }
        LanguageSupport previous = supportsById.put(id.trim(), support);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("language action=register id=" + id.trim() + " replaced=" + (previous != null));
        }
    }

    public synchronized void unregister(String id) {
        if (id == null || id.isBlank()) return;
        supportsById.remove(id.trim());
    }

    @Nullable
    public synchronized LanguageSupport getById(String id) {
        if (id == null || id.isBlank()) return null;
        return supportsById.get(id.trim());
    }

    @NotNull
    public synchronized List<LanguageSupport> getAll() {
        return List.copyOf(supportsById.values());
    }

    /**
     * @return the first support that handles {@code file}, or {@code null} if none does
     */
    @Nullable
    public LanguageSupport find(@NotNull FileObject file) {
        Objects.requireNonNull(file, "file");

        List<LanguageSupport> snapshot;
        synchronized (this) {
            snapshot = new ArrayList<>(supportsById.values());
        }

        for (LanguageSupport s : snapshot) {
            boolean handles;
            try {
                handles = s.canHandle(file);
            } catch (RuntimeException e) {
                LOG.log(Level.WARNING, "language action=canHandle result=fail id=" + s.getId() + " file=" + file.getName(), e);
                continue;
            }
            if (handles) {
                return s;
            }
        }
        return null;
    }

    /**
     * Like {@link #find(FileObject)} but fails when no support is registered for the file.
     */
    @NotNull
    public LanguageSupport require(@NotNull FileObject file) {
        LanguageSupport support = find(file);
        if (support == null) {
            throw new IllegalStateException("No LanguageSupport registered for file: " + file.getName());
        }
        return support;
    }
}
