package com.phillippitts.ozconverter.domain;

import com.phillippitts.ozconverter.exception.SettingsSnapshotException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsSnapshotTest {

    @Test
    void isIsolatedFromTheSourceMap() {
        Map<String, String> live = new HashMap<>();
        live.put(JobSettings.COPY_LOCALLY, "false");
        SettingsSnapshot snapshot = new SettingsSnapshot(live);

        live.put(JobSettings.COPY_LOCALLY, "true");

        assertThat(snapshot.get(JobSettings.COPY_LOCALLY)).isEqualTo("false");
        assertThatThrownBy(() -> snapshot.values().put("x", "y"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void withReturnsACopy() {
        SettingsSnapshot original = SettingsSnapshot.empty();

        SettingsSnapshot changed = original.with(JobSettings.VALIDATE_OUTPUT, false);

        assertThat(original.get(JobSettings.VALIDATE_OUTPUT)).isNull();
        assertThat(changed.get(JobSettings.VALIDATE_OUTPUT)).isEqualTo("false");
    }

    @Test
    void jsonRoundTripKeepsValuesAsStrings() {
        SettingsSnapshot snapshot = SettingsSnapshot.empty()
                .with(JobSettings.SUBPROCESS_TIMEOUT_SECONDS, 120)
                .with(JobSettings.TOOL_SEVENZIP, "C:\\Tools\\7za.exe");

        SettingsSnapshot parsed = SettingsSnapshot.fromJson(snapshot.toJson());

        assertThat(parsed).isEqualTo(snapshot);
    }

    @Test
    void unreadableJsonIsASnapshotError() {
        assertThatThrownBy(() -> SettingsSnapshot.fromJson("{not json"))
                .isInstanceOf(SettingsSnapshotException.class)
                .hasMessageContaining("Unreadable settings snapshot");
    }
}
