package spectraview.windows;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import spectraview.windows.roi.RegionSaveDefaults;

import java.nio.file.Path;
import java.util.prefs.BackingStoreException;
import java.util.prefs.Preferences;

/**
 * Viewer settings kept between sessions.
 * <p>
 * The last region save directory and "include bands" state are serialized to compact
 * JSON and stored in the {@value #SAVE_DEFAULTS_KEY} preference entry.
 * Unreadable or missing entries fall back to defaults; failures are logged, never thrown.
 */
public final class ViewerPreferences {

    private static final Logger logger = LoggerFactory.getLogger(ViewerPreferences.class);

    static final String SAVE_DEFAULTS_KEY = "regions.saveDefaults";

    private static final String NODE_NAME = "spectraview/windows";

    private static final Gson GSON = new GsonBuilder().create();

    private static ViewerPreferences defaultPreferences;

    private final Preferences node;

    /**
     * @param node preference node the entries are stored in
     */
    public ViewerPreferences(Preferences node) {
        this.node = node;
    }

    /**
     * Preferences stored in the current user's preference tree.
     */
    public static synchronized ViewerPreferences getDefault() {
        if (defaultPreferences == null) {
            defaultPreferences = new ViewerPreferences(Preferences.userRoot().node(NODE_NAME));
        }
        return defaultPreferences;
    }

    /**
     * Load the region save defaults. The returned object stores itself whenever it changes.
     */
    public RegionSaveDefaults loadSaveDefaults() {
        Path directory = RegionSaveDefaults.defaultSaveDirectory();
        boolean includeBands = false;

        JsonObject obj = readObject(SAVE_DEFAULTS_KEY);
        if (obj != null) {
            try {
                if (obj.has("dir")) {
                    directory = Path.of(obj.get("dir").getAsString());
                }
                if (obj.has("bands")) {
                    includeBands = obj.get("bands").getAsBoolean();
                }
            } catch (RuntimeException e) {
                logger.warn("Invalid region save defaults, using defaults: {}", e.getMessage());
            }
        }

        logger.debug("Loaded region save defaults: {}, include bands {}", directory, includeBands);
        return new RegionSaveDefaults(directory, includeBands, this::storeSaveDefaults);
    }

    public void storeSaveDefaults(RegionSaveDefaults defaults) {
        JsonObject obj = new JsonObject();
        obj.addProperty("dir", defaults.getSaveDirectory().toString());
        obj.addProperty("bands", defaults.isIncludeBands());
        writeObject(SAVE_DEFAULTS_KEY, obj);
    }

    private JsonObject readObject(String key) {
        String json = node.get(key, null);
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return JsonParser.parseString(json).getAsJsonObject();
        } catch (RuntimeException e) {
            logger.warn("Failed to read preference {}, using defaults: {}", key, e.getMessage());
            return null;
        }
    }

    private void writeObject(String key, JsonObject obj) {
        try {
            node.put(key, GSON.toJson(obj));
            node.flush();
            logger.debug("Stored preference {}", key);
        } catch (BackingStoreException | RuntimeException e) {
            logger.warn("Failed to store preference {}: {}", key, e.getMessage());
        }
    }
}
