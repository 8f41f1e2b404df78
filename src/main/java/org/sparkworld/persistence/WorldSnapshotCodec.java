package org.sparkworld.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * JSON encoding of {@link WorldSnapshot}s.
 */
public class WorldSnapshotCodec {

    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * @param snapshot The snapshot.
     * @return Pretty-printed JSON.
     */
    public String encode(WorldSnapshot snapshot) {
        return gson.toJson(snapshot);
    }

    /**
     * @param json JSON produced by {@link #encode(WorldSnapshot)}.
     * @return The snapshot.
     * @throws PersistenceException if the JSON is malformed or empty.
     */
    public WorldSnapshot decode(String json) {
        WorldSnapshot snapshot;
        try {
            snapshot = gson.fromJson(json, WorldSnapshot.class);
        } catch (JsonParseException e) {
            throw new PersistenceException("Malformed world snapshot: " + e.getMessage(), e);
        }
        if (snapshot == null) {
            throw new PersistenceException("Empty world snapshot");
        }
        return snapshot;
    }
}
