package com.phillippitts.ozconverter.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Live converter settings ({@code converter.*}).
 *
 * <p>Mutable so they can be changed between batches. Jobs never read this object: the
 * coordinator copies it into a snapshot when a job is submitted.
 */
@Validated
@ConfigurationProperties(prefix = "converter")
public class ConverterProperties {

    private boolean copyLocally = false;
    private String mainTempDir = "";
    private boolean deleteSourceOnSuccess = false;

    @Min(1)
    private long subprocessTimeoutSeconds = 3600;

    private boolean validateOutput = true;

    @Valid
    @NotNull
    private Chdman chdman = new Chdman();

    @Valid
    @NotNull
    private Dolphin dolphin = new Dolphin();

    public boolean isCopyLocally() {
        return copyLocally;
    }

    public void setCopyLocally(boolean copyLocally) {
        this.copyLocally = copyLocally;
    }

    public String getMainTempDir() {
        return mainTempDir;
    }

    public void setMainTempDir(String mainTempDir) {
        this.mainTempDir = mainTempDir;
    }

    public boolean isDeleteSourceOnSuccess() {
        return deleteSourceOnSuccess;
    }

    public void setDeleteSourceOnSuccess(boolean deleteSourceOnSuccess) {
        this.deleteSourceOnSuccess = deleteSourceOnSuccess;
    }

    public long getSubprocessTimeoutSeconds() {
        return subprocessTimeoutSeconds;
    }

    public void setSubprocessTimeoutSeconds(long subprocessTimeoutSeconds) {
        this.subprocessTimeoutSeconds = subprocessTimeoutSeconds;
    }

    public boolean isValidateOutput() {
        return validateOutput;
    }

    public void setValidateOutput(boolean validateOutput) {
        this.validateOutput = validateOutput;
    }

    public Chdman getChdman() {
        return chdman;
    }

    public void setChdman(Chdman chdman) {
        this.chdman = chdman;
    }

    public Dolphin getDolphin() {
        return dolphin;
    }

    public void setDolphin(Dolphin dolphin) {
        this.dolphin = dolphin;
    }

    /**
     * chdman options ({@code converter.chdman.*}).
     */
    public static class Chdman {
        @Pattern(regexp = "auto|manual", message = "num-processors-mode must be 'auto' or 'manual'")
        private String numProcessorsMode = "auto";

        @Min(1)
        private int numProcessorsManual = Math.max(1, Runtime.getRuntime().availableProcessors() * 2 / 3);

        private boolean verifyFix = false;

        private Media cd = new Media();
        private Media dvd = new Media();
        private Media hd = new Media();
        private Media ld = new Media();
        private Media raw = new Media();

        public String getNumProcessorsMode() {
            return numProcessorsMode;
        }

        public void setNumProcessorsMode(String numProcessorsMode) {
            this.numProcessorsMode = numProcessorsMode;
        }

        public int getNumProcessorsManual() {
            return numProcessorsManual;
        }

        public void setNumProcessorsManual(int numProcessorsManual) {
            this.numProcessorsManual = numProcessorsManual;
        }

        public boolean isVerifyFix() {
            return verifyFix;
        }

        public void setVerifyFix(boolean verifyFix) {
            this.verifyFix = verifyFix;
        }

        public Media getCd() {
            return cd;
        }

        public void setCd(Media cd) {
            this.cd = cd;
        }

        public Media getDvd() {
            return dvd;
        }

        public void setDvd(Media dvd) {
            this.dvd = dvd;
        }

        public Media getHd() {
            return hd;
        }

        public void setHd(Media hd) {
            this.hd = hd;
        }

        public Media getLd() {
            return ld;
        }

        public void setLd(Media ld) {
            this.ld = ld;
        }

        public Media getRaw() {
            return raw;
        }

        public void setRaw(Media raw) {
            this.raw = raw;
        }

        public Media forMedia(String key) {
            return switch (key) {
                case "cd" -> cd;
                case "dvd" -> dvd;
                case "hd" -> hd;
                case "ld" -> ld;
                case "raw" -> raw;
                default -> throw new IllegalArgumentException("Unknown chdman media: " + key);
            };
        }
    }

    /**
     * Per-media chdman overrides. Values only apply while their use flag is on.
     */
    public static class Media {
        private boolean useCustomHunks = false;
        private int hunks = 0;
        private boolean useCustomCompression = false;
        private String compression = "";

        public boolean isUseCustomHunks() {
            return useCustomHunks;
        }

        public void setUseCustomHunks(boolean useCustomHunks) {
            this.useCustomHunks = useCustomHunks;
        }

        public int getHunks() {
            return hunks;
        }

        public void setHunks(int hunks) {
            this.hunks = hunks;
        }

        public boolean isUseCustomCompression() {
            return useCustomCompression;
        }

        public void setUseCustomCompression(boolean useCustomCompression) {
            this.useCustomCompression = useCustomCompression;
        }

        public String getCompression() {
            return compression;
        }

        public void setCompression(String compression) {
            this.compression = compression;
        }
    }

    /**
     * DolphinTool options ({@code converter.dolphin.*}).
     */
    public static class Dolphin {
        private String rvzCompressionType = "zstd";
        private int rvzCompressionLevel = 5;
        private int rvzBlockSize = 131072;
        private String wiaCompressionType = "none";
        private int wiaCompressionLevel = 5;
        private int gczBlockSize = 131072;

        public String getRvzCompressionType() {
            return rvzCompressionType;
        }

        public void setRvzCompressionType(String rvzCompressionType) {
            this.rvzCompressionType = rvzCompressionType;
        }

        public int getRvzCompressionLevel() {
            return rvzCompressionLevel;
        }

        public void setRvzCompressionLevel(int rvzCompressionLevel) {
            this.rvzCompressionLevel = rvzCompressionLevel;
        }

        public int getRvzBlockSize() {
            return rvzBlockSize;
        }

        public void setRvzBlockSize(int rvzBlockSize) {
            this.rvzBlockSize = rvzBlockSize;
        }

        public String getWiaCompressionType() {
            return wiaCompressionType;
        }

        public void setWiaCompressionType(String wiaCompressionType) {
            this.wiaCompressionType = wiaCompressionType;
        }

        public int getWiaCompressionLevel() {
            return wiaCompressionLevel;
        }

        public void setWiaCompressionLevel(int wiaCompressionLevel) {
            this.wiaCompressionLevel = wiaCompressionLevel;
        }

        public int getGczBlockSize() {
            return gczBlockSize;
        }

        public void setGczBlockSize(int gczBlockSize) {
            this.gczBlockSize = gczBlockSize;
        }
    }
}
