package com.ghosttrace.analyzer.manifest;

import com.google.gson.annotations.SerializedName;
import java.util.Collections;
import java.util.List;

/**
 * Deserialized form of an analysis manifest: which blobs to analyze and how to monitor them.
 */
public class AnalysisManifest {

    public static class ModuleEntry {
        @SerializedName("name") private String name;
        /** Blob path; relative paths resolve against the manifest's directory. */
        @SerializedName("blob") private String blob;

        public String getName() { return name; }
        public String getBlob() { return blob; }
    }

    @SerializedName("modules")
    private List<ModuleEntry> modules;

    @SerializedName("output_dir")
    private String outputDir;

    /** Monitor poll interval in milliseconds (default: 500). */
    @SerializedName("poll_interval_ms")
    private Long pollIntervalMs;

    /** Source-file marker that identifies instrumented code (default: ".java"). */
    @SerializedName("source_marker")
    private String sourceMarker;

    public List<ModuleEntry> getModules() { return modules != null ? modules : Collections.emptyList(); }
    public String getOutputDir()          { return outputDir; }
    public long getPollIntervalMs()       { return pollIntervalMs != null ? pollIntervalMs : 500L; }
    public String getSourceMarker()       { return sourceMarker != null ? sourceMarker : ".java"; }
}
