package dev.jobhunter.settings;

/**
 * Read/write contract of the external settings storage.
 * Implementations must return snapshots, never live mutable state.
 */
public interface PreferenceSource {

    /**
     * Load the stored preferences, falling back to {@link Preferences#defaults()} when nothing is stored.
     */
    Preferences load();

    /**
     * Persist the given (already validated) preferences.
     *
     * @return The preferences as stored
     */
    Preferences save(Preferences preferences);
}
