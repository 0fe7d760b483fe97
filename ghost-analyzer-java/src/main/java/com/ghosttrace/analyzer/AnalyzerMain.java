package com.ghosttrace.analyzer;

import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.manifest.AnalysisManifest;
import com.ghosttrace.analyzer.manifest.ManifestReader;
import com.ghosttrace.analyzer.render.CfgRenderer;
import com.ghosttrace.analyzer.report.CfgReportBuilder;
import com.ghosttrace.analyzer.report.CfgReportSerializer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Command-line entry point for offline CFG analysis.
 *
 * Usage:
 *   java -jar ghost-analyzer-java.jar analyze --manifest &lt;manifest.json&gt; [--output &lt;dir&gt;]
 *   java -jar ghost-analyzer-java.jar analyze --blob &lt;file.ghbc&gt; [--blob ...] --output &lt;dir&gt;
 *
 * Writes cfg_report.json plus one Graphviz file per module. Exit code 2 on usage errors,
 * 1 on fatal errors, 3 when some modules failed to analyze.
 */
public class AnalyzerMain {

    public static void main(String[] args) {
        try {
            AnalysisResult result = run(args);
            System.exit(result.hasFailures() ? 3 : 0);
        } catch (UsageException e) {
            System.err.println("[ghost-analyzer] ERROR: " + e.getMessage());
            System.err.println("Usage: java -jar ghost-analyzer-java.jar analyze " +
                               "(--manifest <path> | --blob <file>...) --output <dir>");
            System.exit(2);
        } catch (Exception e) {
            System.err.println("[ghost-analyzer] FATAL: " + e.getMessage());
            System.exit(1);
        }
    }

    static AnalysisResult run(String[] args) {
        if (args.length == 0) {
            throw new UsageException("No subcommand specified");
        }
        if (!args[0].equals("analyze")) {
            throw new UsageException("Unknown subcommand: " + args[0]);
        }

        String manifestPath = null;
        String outputDir = null;
        List<Path> blobs = new ArrayList<>();

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--manifest" -> manifestPath = requireNext(args, i++, "--manifest");
                case "--output"   -> outputDir    = requireNext(args, i++, "--output");
                case "--blob"     -> blobs.add(Paths.get(requireNext(args, i++, "--blob")));
                default -> throw new UsageException("Unknown flag: " + args[i]);
            }
        }

        if (manifestPath == null && blobs.isEmpty()) {
            throw new UsageException("--manifest or at least one --blob is required");
        }
        if (manifestPath != null && !blobs.isEmpty()) {
            throw new UsageException("--manifest and --blob cannot be combined");
        }

        // 1. Load blobs
        Map<String, byte[]> modules;
        BlobLoader loader = new BlobLoader();
        if (manifestPath != null) {
            Path manifest = Paths.get(manifestPath);
            System.err.println("[ghost-analyzer] Reading manifest: " + manifest);
            AnalysisManifest config = new ManifestReader().read(manifest);
            if (outputDir == null) outputDir = config.getOutputDir();
            Path baseDir = manifest.toAbsolutePath().getParent();
            modules = loader.load(config, baseDir);
        } else {
            modules = loader.load(blobs);
        }
        if (outputDir == null) throw new UsageException("--output is required");
        Path output = Paths.get(outputDir);

        // 2. Analyze
        System.err.println("[ghost-analyzer] Analyzing " + modules.size() + " module(s)...");
        AnalysisResult result = new CfgPipeline().analyzeAll(modules);
        for (ControlFlowGraph cfg : result.cfgs().values()) {
            System.err.println("[ghost-analyzer] " + cfg.name() + ": " + cfg.nodes().size() + " blocks, "
                    + cfg.edges().size() + " edges, " + cfg.unresolvedTargets().size() + " unresolved");
        }

        // 3. Serialize
        new CfgReportSerializer().write(new CfgReportBuilder().build(result), output);
        writeDotFiles(result, output);

        System.err.println("[ghost-analyzer] Done. " + result.cfgs().size() + " analyzed, "
                + result.failures().size() + " failed.");
        return result;
    }

    private static void writeDotFiles(AnalysisResult result, Path output) {
        for (Map.Entry<String, ControlFlowGraph> e : result.cfgs().entrySet()) {
            String safe = e.getKey().replaceAll("[^a-zA-Z0-9_.-]", "_");
            Path dot = output.resolve(safe + ".dot");
            try {
                Files.writeString(dot, CfgRenderer.toDot(e.getValue()));
            } catch (IOException ex) {
                throw new UncheckedIOException("Failed to write " + dot, ex);
            }
        }
    }

    private static String requireNext(String[] args, int i, String flag) {
        if (i + 1 >= args.length) {
            throw new UsageException(flag + " requires an argument");
        }
        return args[i + 1];
    }

    static class UsageException extends RuntimeException {
        UsageException(String msg) { super(msg); }
    }
}
