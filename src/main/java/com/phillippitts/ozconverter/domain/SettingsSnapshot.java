package com.phillippitts.ozconverter.domain;

import com.phillippitts.ozconverter.exception.SettingsSnapshotException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat key/value copy of the converter settings taken when a job is submitted.
 *
 * <p>Later changes to the live settings never affect a job already in the queue.
 * Decoded into typed form by {@link JobSettings#decode(SettingsSnapshot)} on the worker.
 *
 * @param values unmodifiable settings map
 */
public record SettingsSnapshot(Map<String, String> values) {

    private static final SettingsSnapshot EMPTY = new SettingsSnapshot(Map.of());

    public SettingsSnapshot {
        Objects.requireNonNull(values, "values");
        values = Map.copyOf(values);
    }

    public static SettingsSnapshot empty() {
        return EMPTY;
    }

    public String get(String key) {
        return values.get(key);
    }

    /**
     * Copy with one entry added or replaced.
     */
    public SettingsSnapshot with(String key, Object value) {
        Map<String, String> copy = new HashMap<>(values);
        copy.put(key, String.valueOf(value));
        return new SettingsSnapshot(copy);
    }

    public String toJson() {
        return new JSONObject(values).toString();
    }

    public static SettingsSnapshot fromJson(String json) {
        try {
            JSONObject obj = new JSONObject(json);
            Map<String, String> map = new HashMap<>();
            for (String key : obj.keySet()) {
                map.put(key, String.valueOf(obj.get(key)));
            }
            return new SettingsSnapshot(map);
        } catch (JSONException e) {
            throw new SettingsSnapshotException("Unreadable settings snapshot: " + e.getMessage());
        }
    }
}
