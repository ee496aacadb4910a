package com.osman.filelog.config;

import java.nio.file.Path;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Thin wrapper around {@link Preferences} holding the user's persisted log settings.
 */
public final class PreferencesStore {
    private static final String ROOT_NODE = "com/osman/filelog";
    private static final Logger LOGGER = Logger.getLogger(PreferencesStore.class.getName());

    private final Preferences delegate;

    PreferencesStore(Preferences delegate) {
        this.delegate = delegate;
    }

    public static PreferencesStore global() {
        return new PreferencesStore(Preferences.userRoot().node(ROOT_NODE));
    }

    public Optional<Path> getPath(String key) {
        return getString(key).map(Path::of);
    }

    public void putPath(String key, Path path) {
        if (path == null) return;
        putString(key, path.toString());
    }

    public Optional<String> getString(String key) {
        String value = delegate.get(key, null);
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    public void putString(String key, String value) {
        if (key == null || key.isBlank() || value == null) return;
        delegate.put(key, value);
        flushQuietly();
    }

    private void flushQuietly() {
        try {
            delegate.flush();
        } catch (BackingStoreException ex) {
            LOGGER.log(Level.FINE, "Preferences not persisted: {0}", ex.getMessage());
        }
    }
}
