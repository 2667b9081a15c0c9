package com.phillippitts.ozconverter.config.properties;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Locations of the external tools. A bare name is looked up on the {@code PATH}.
 *
 * <p>Example application.properties:
 * <pre>
 * converter.tools.chdman=/opt/mame/chdman
 * converter.tools.dolphintool=DolphinTool
 * converter.tools.maxcso=maxcso
 * converter.tools.sevenzip=7za
 * </pre>
 *
 * @param chdman MAME chdman executable
 * @param dolphintool Dolphin's command-line converter
 * @param maxcso maxcso executable
 * @param sevenzip 7-Zip command-line executable
 */
@ConfigurationProperties(prefix = "converter.tools")
@Validated
public record ToolPathsConfig(
        @NotBlank(message = "chdman path must not be blank")
        String chdman,

        @NotBlank(message = "DolphinTool path must not be blank")
        String dolphintool,

        @NotBlank(message = "maxcso path must not be blank")
        String maxcso,

        @NotBlank(message = "7-Zip path must not be blank")
        String sevenzip
) {
    @ConstructorBinding
    public ToolPathsConfig {
    }

    public ToolPathsConfig() {
        this("chdman", "DolphinTool", "maxcso", "7za");
    }

    /**
     * Tool name to configured path, in a stable order.
     */
    public Map<String, String> asMap() {
        Map<String, String> tools = new LinkedHashMap<>();
        tools.put("chdman", chdman);
        tools.put("dolphintool", dolphintool);
        tools.put("maxcso", maxcso);
        tools.put("sevenzip", sevenzip);
        return tools;
    }
}
