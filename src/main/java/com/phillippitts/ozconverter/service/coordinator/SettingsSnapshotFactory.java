package com.phillippitts.ozconverter.service.coordinator;

import com.phillippitts.ozconverter.config.properties.ConverterProperties;
import com.phillippitts.ozconverter.config.properties.ToolPathsConfig;
import com.phillippitts.ozconverter.domain.JobSettings;
import com.phillippitts.ozconverter.domain.SettingsSnapshot;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Copies the live converter settings into the flat map every job carries.
 *
 * <p>Per-media chdman values are only written while their use flag is on, so a disabled
 * override is indistinguishable from chdman's own default.
 */
@Component
public class SettingsSnapshotFactory {

    private final ConverterProperties properties;
    private final ToolPathsConfig tools;

    public SettingsSnapshotFactory(ConverterProperties properties, ToolPathsConfig tools) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.tools = Objects.requireNonNull(tools, "tools");
    }

    public SettingsSnapshot snapshot() {
        Map<String, String> values = new HashMap<>();
        values.put(JobSettings.COPY_LOCALLY, String.valueOf(properties.isCopyLocally()));
        if (properties.getMainTempDir() != null && !properties.getMainTempDir().isBlank()) {
            values.put(JobSettings.MAIN_TEMP_DIR, properties.getMainTempDir());
        }
        values.put(JobSettings.DELETE_SOURCE_ON_SUCCESS, String.valueOf(properties.isDeleteSourceOnSuccess()));
        values.put(JobSettings.SUBPROCESS_TIMEOUT_SECONDS, String.valueOf(properties.getSubprocessTimeoutSeconds()));
        values.put(JobSettings.VALIDATE_OUTPUT, String.valueOf(properties.isValidateOutput()));

        ConverterProperties.Chdman chdman = properties.getChdman();
        values.put(JobSettings.CHDMAN_NUM_PROCESSORS_MODE, chdman.getNumProcessorsMode());
        values.put(JobSettings.CHDMAN_NUM_PROCESSORS_MANUAL, String.valueOf(chdman.getNumProcessorsManual()));
        values.put(JobSettings.CHDMAN_VERIFY_FIX, String.valueOf(chdman.isVerifyFix()));
        for (String media : JobSettings.CHDMAN_MEDIA) {
            ConverterProperties.Media m = chdman.forMedia(media);
            if (m.isUseCustomHunks() && m.getHunks() > 0) {
                values.put("chdman." + media + ".hunks", String.valueOf(m.getHunks()));
            }
            if (m.isUseCustomCompression() && m.getCompression() != null && !m.getCompression().isBlank()) {
                values.put("chdman." + media + ".compression", m.getCompression());
            }
        }

        ConverterProperties.Dolphin dolphin = properties.getDolphin();
        values.put(JobSettings.DOLPHIN_RVZ_COMPRESSION_TYPE, dolphin.getRvzCompressionType());
        values.put(JobSettings.DOLPHIN_RVZ_COMPRESSION_LEVEL, String.valueOf(dolphin.getRvzCompressionLevel()));
        values.put(JobSettings.DOLPHIN_RVZ_BLOCK_SIZE, String.valueOf(dolphin.getRvzBlockSize()));
        values.put(JobSettings.DOLPHIN_WIA_COMPRESSION_TYPE, dolphin.getWiaCompressionType());
        values.put(JobSettings.DOLPHIN_WIA_COMPRESSION_LEVEL, String.valueOf(dolphin.getWiaCompressionLevel()));
        values.put(JobSettings.DOLPHIN_GCZ_BLOCK_SIZE, String.valueOf(dolphin.getGczBlockSize()));

        values.put(JobSettings.TOOL_CHDMAN, tools.chdman());
        values.put(JobSettings.TOOL_DOLPHINTOOL, tools.dolphintool());
        values.put(JobSettings.TOOL_MAXCSO, tools.maxcso());
        values.put(JobSettings.TOOL_SEVENZIP, tools.sevenzip());
        return new SettingsSnapshot(values);
    }
}
