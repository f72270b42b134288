package github.sarthakdev143.timeline_compiler.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunable constants of the timeline compiler.
 */
@ConfigurationProperties(prefix = "timeline-compiler")
public class TimelineCompilerProperties {

    /**
     * Holes shorter than this many frames are snapped shut instead of filled.
     */
    private double gapEpsilonFrames = 0.5;

    /**
     * Relative aspect ratio difference below which no crop is applied.
     */
    private double aspectTolerance = 0.01;

    private double minimumSplitSeconds = 0.001;
    private int defaultWidth = 1920;
    private int defaultHeight = 1080;
    private int defaultFps = 30;
    private String fillColor = "black";
    private int audioSampleRate = 48000;
    private String audioChannelLayout = "stereo";
    private double muteVolumeDb = -60.0;
    private int softwareCrf = 28;
    private String softwareAudioBitrate = "96k";
    private int probeTimeoutSeconds = 10;
    private String vaapiDevice = "/dev/dri/renderD128";
    private boolean gpuFiltersEnabled = false;
    private List<String> fontDirectories = new ArrayList<>();

    public double getGapEpsilonFrames() {
        return gapEpsilonFrames;
    }

    public void setGapEpsilonFrames(double gapEpsilonFrames) {
        this.gapEpsilonFrames = gapEpsilonFrames;
    }

    public double getAspectTolerance() {
        return aspectTolerance;
    }

    public void setAspectTolerance(double aspectTolerance) {
        this.aspectTolerance = aspectTolerance;
    }

    public double getMinimumSplitSeconds() {
        return minimumSplitSeconds;
    }

    public void setMinimumSplitSeconds(double minimumSplitSeconds) {
        this.minimumSplitSeconds = minimumSplitSeconds;
    }

    public int getDefaultWidth() {
        return defaultWidth;
    }

    public void setDefaultWidth(int defaultWidth) {
        this.defaultWidth = defaultWidth;
    }

    public int getDefaultHeight() {
        return defaultHeight;
    }

    public void setDefaultHeight(int defaultHeight) {
        this.defaultHeight = defaultHeight;
    }

    public int getDefaultFps() {
        return defaultFps;
    }

    public void setDefaultFps(int defaultFps) {
        this.defaultFps = defaultFps;
    }

    public String getFillColor() {
        return fillColor;
    }

    public void setFillColor(String fillColor) {
        this.fillColor = fillColor;
    }

    public int getAudioSampleRate() {
        return audioSampleRate;
    }

    public void setAudioSampleRate(int audioSampleRate) {
        this.audioSampleRate = audioSampleRate;
    }

    public String getAudioChannelLayout() {
        return audioChannelLayout;
    }

    public void setAudioChannelLayout(String audioChannelLayout) {
        this.audioChannelLayout = audioChannelLayout;
    }

    public double getMuteVolumeDb() {
        return muteVolumeDb;
    }

    public void setMuteVolumeDb(double muteVolumeDb) {
        this.muteVolumeDb = muteVolumeDb;
    }

    public int getSoftwareCrf() {
        return softwareCrf;
    }

    public void setSoftwareCrf(int softwareCrf) {
        this.softwareCrf = softwareCrf;
    }

    public String getSoftwareAudioBitrate() {
        return softwareAudioBitrate;
    }

    public void setSoftwareAudioBitrate(String softwareAudioBitrate) {
        this.softwareAudioBitrate = softwareAudioBitrate;
    }

    public int getProbeTimeoutSeconds() {
        return probeTimeoutSeconds;
    }

    public void setProbeTimeoutSeconds(int probeTimeoutSeconds) {
        this.probeTimeoutSeconds = probeTimeoutSeconds;
    }

    public String getVaapiDevice() {
        return vaapiDevice;
    }

    public void setVaapiDevice(String vaapiDevice) {
        this.vaapiDevice = vaapiDevice;
    }

    public boolean isGpuFiltersEnabled() {
        return gpuFiltersEnabled;
    }

    public void setGpuFiltersEnabled(boolean gpuFiltersEnabled) {
        this.gpuFiltersEnabled = gpuFiltersEnabled;
    }

    public List<String> getFontDirectories() {
        return fontDirectories;
    }

    public void setFontDirectories(List<String> fontDirectories) {
        this.fontDirectories = fontDirectories;
    }
}
