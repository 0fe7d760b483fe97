package com.ghosttrace.analyzer.report;

import com.google.gson.GsonBuilder;

import java.io.*;
import java.nio.file.*;
import java.util.ArrayList;
import java.util.Comparator;

/**
 * Sorts and serializes a CfgReportRoot to cfg_report.json.
 * Produces deterministic output by sorting modules, edges and failures before writing.
 */
public class CfgReportSerializer {

    public static final String REPORT_FILE = "cfg_report.json";

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    /**
     * Writes {@code root} to {@code outputDir/cfg_report.json}.
     *
     * @param root      report to write
     * @param outputDir directory to write into (created if absent)
     * @return path of the written file
     */
    public Path write(CfgReportModel.CfgReportRoot root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        sort(root);

        Path reportPath = outputDir.resolve(REPORT_FILE);
        try (Writer w = Files.newBufferedWriter(reportPath)) {
            new GsonBuilder().setPrettyPrinting().create().toJson(root, w);
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + REPORT_FILE + ": " + e.getMessage(), e);
        }
        System.err.println("[ghost-analyzer] " + REPORT_FILE + " written: " + reportPath);
        return reportPath;
    }

    /** Copies every list to a mutable one and sorts it in place. */
    static void sort(CfgReportModel.CfgReportRoot root) {
        if (root.modules != null) {
            root.modules = new ArrayList<>(root.modules);
            root.modules.sort(Comparator.comparing(m -> m.name));
            for (CfgReportModel.CfgModule module : root.modules) {
                if (module.blocks != null) {
                    module.blocks = new ArrayList<>(module.blocks);
                    module.blocks.sort(Comparator.comparingInt(b -> b.id));
                }
                if (module.edges != null) {
                    module.edges = new ArrayList<>(module.edges);
                    module.edges.sort(Comparator.comparingInt((CfgReportModel.CfgEdge e) -> e.source)
                            .thenComparingInt(e -> e.target));
                }
            }
        }
        if (root.failures != null) {
            root.failures = new ArrayList<>(root.failures);
            root.failures.sort(Comparator.comparing(f -> f.module));
        }
    }
}
