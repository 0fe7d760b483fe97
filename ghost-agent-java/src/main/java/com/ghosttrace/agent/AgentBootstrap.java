package com.ghosttrace.agent;

import com.ghosttrace.analyzer.AnalysisResult;
import com.ghosttrace.analyzer.BlobLoader;
import com.ghosttrace.analyzer.CfgPipeline;
import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.manifest.AnalysisManifest;
import com.ghosttrace.analyzer.manifest.ManifestReader;
import net.bytebuddy.agent.builder.AgentBuilder;
import net.bytebuddy.utility.JavaModule;

import java.lang.instrument.Instrumentation;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Map;

import static net.bytebuddy.matcher.ElementMatchers.*;

/**
 * Java Agent entry point.
 * Attached to the target application JVM via:
 *   java -javaagent:ghost-agent-java.jar=output=/path/to/out,namespace=com.myapp,cfg=/path/to/blobs -jar app.jar
 *
 * Agent args (key=value pairs separated by comma):
 *   output    directory where ghost_report.json is written (default: java.io.tmpdir)
 *   namespace class name prefix to instrument (default: "com.")
 *   cfg       directory of *.ghbc instruction blobs to analyze and publish
 *   manifest  analysis manifest; supplies blobs, poll interval and marker instead of cfg/interval/marker
 *   marker    source-file marker of traced frames (default: ".java")
 *   interval  monitor poll interval in ms (default: 500)
 */
public class AgentBootstrap {

    static final String MAIN_THREAD = "main";

    public static void premain(String agentArgs, Instrumentation instrumentation) {
        AgentConfig config = parseArgs(agentArgs);
        System.err.println("[ghost-agent] attaching to namespace: " + config.namespace());
        System.err.println("[ghost-agent] output: " + config.outputPath());

        AnalysisManifest manifest = config.manifestPath() != null
            ? new ManifestReader().read(Paths.get(config.manifestPath()))
            : null;
        MonitorConfig monitorConfig = manifest != null
            ? MonitorConfig.from(manifest)
            : new MonitorConfig(Duration.ofMillis(config.pollIntervalMs()), config.sourceMarker());
        System.err.println("[ghost-agent] poll interval=" + monitorConfig.pollInterval().toMillis()
            + "ms marker=" + monitorConfig.sourceMarker());

        GhostSession s = new GhostSession(monitorConfig, new StderrMonitorListener(), null);

        // Register shutdown hook first so it fires even if instrumentation fails
        Path reportPath = Paths.get(config.outputPath(), GhostReportWriter.REPORT_FILE);
        Runtime.getRuntime().addShutdownHook(new Thread(new ShutdownHook(s, reportPath), "ghost-shutdown"));
        Thread.setDefaultUncaughtExceptionHandler(
            recordingHandler(s.monitor(), Thread.getDefaultUncaughtExceptionHandler()));

        new AgentBuilder.Default()
            .with(new AgentBuilder.Listener.Adapter() {
                @Override
                public void onError(String typeName, ClassLoader classLoader,
                                    JavaModule module, boolean loaded, Throwable throwable) {
                    System.err.println("[ghost-agent] TRANSFORM ERROR for " + typeName + ": " + throwable);
                }
            })
            // The agent and analyzer must stay uninstrumented, or the hook would trace itself.
            .type(
                nameStartsWith(config.namespace())
                    .and(not(nameStartsWith("com.ghosttrace.")))
                    .and(not(nameContains("$$Lambda")))
                    .and(not(nameContains("$Proxy")))
            )
            .transform((builder, typeDescription, classLoader, module, protectionDomain) -> {
                byte[] classFile = LineProbes.classFileOf(typeDescription, classLoader);
                return classFile == null ? builder : builder.visit(LineProbes.forClassFile(classFile));
            })
            .installOn(instrumentation);
        System.err.println("[ghost-agent] line probes installed");

        s.start();

        Map<String, byte[]> blobs = loadBlobs(config, manifest);
        if (blobs.isEmpty()) {
            System.err.println("[ghost-agent] WARNING: no instruction blobs given; the monitor waits until shutdown");
            return;
        }
        publish(s, blobs);
    }

    /** Called when agent is loaded after JVM startup (dynamic attach). */
    public static void agentmain(String agentArgs, Instrumentation instrumentation) {
        premain(agentArgs, instrumentation);
    }

    // -----------------------------------------------------------------------
    // Helpers
    // -----------------------------------------------------------------------

    static AgentConfig parseArgs(String agentArgs) {
        String outputPath = System.getProperty("java.io.tmpdir");
        String namespace = "com.";
        String cfgDir = null;
        String manifestPath = null;
        String sourceMarker = MonitorConfig.DEFAULT_SOURCE_MARKER;
        long pollIntervalMs = MonitorConfig.DEFAULT_POLL_INTERVAL_MS;

        if (agentArgs != null && !agentArgs.isBlank()) {
            for (String part : agentArgs.split(",")) {
                String[] kv = part.split("=", 2);
                if (kv.length != 2) continue;
                String value = kv[1].trim();
                switch (kv[0].trim()) {
                    case "output"    -> outputPath   = value;
                    case "namespace" -> namespace    = value;
                    case "cfg"       -> cfgDir       = value;
                    case "manifest"  -> manifestPath = value;
                    case "marker"    -> { if (!value.isEmpty()) sourceMarker = value; }
                    case "interval"  -> pollIntervalMs = parseInterval(value, pollIntervalMs);
                    default -> System.err.println("[ghost-agent] WARNING: unknown agent arg: " + kv[0].trim());
                }
            }
        }
        return new AgentConfig(outputPath, namespace, cfgDir, manifestPath, sourceMarker, pollIntervalMs);
    }

    private static long parseInterval(String value, long fallback) {
        try {
            long ms = Long.parseLong(value);
            if (ms > 0) return ms;
        } catch (NumberFormatException e) {
            System.err.println("[ghost-agent] WARNING: interval is not a number: " + value);
            return fallback;
        }
        System.err.println("[ghost-agent] WARNING: interval must be positive: " + value);
        return fallback;
    }

    static Map<String, byte[]> loadBlobs(AgentConfig config, AnalysisManifest manifest) {
        BlobLoader loader = new BlobLoader();
        if (manifest != null) {
            Path baseDir = Paths.get(config.manifestPath()).toAbsolutePath().getParent();
            return loader.load(manifest, baseDir);
        }
        if (config.cfgDir() != null) {
            return loader.loadDirectory(Paths.get(config.cfgDir()));
        }
        return Map.of();
    }

    /** Analyzes the blobs and publishes every CFG that built. Returns the published map. */
    static Map<String, ControlFlowGraph> publish(GhostSession s, Map<String, byte[]> blobs) {
        AnalysisResult result = new CfgPipeline().analyzeAll(blobs);
        if (result.cfgs().isEmpty()) {
            System.err.println("[ghost-agent] ERROR: no CFG could be built from " + blobs.size() + " blob(s)");
            return Map.of();
        }
        s.publishCfgs(result.cfgs());
        System.err.println("[ghost-agent] published " + result.cfgs().size() + " CFG(s), "
            + result.failures().size() + " failed");
        return result.cfgs();
    }

    /**
     * Records an uncaught exception of the main thread as the program's terminal error, then
     * delegates. Other threads dying do not end the program, so they are only delegated.
     */
    static Thread.UncaughtExceptionHandler recordingHandler(GhostMonitor monitor,
                                                            Thread.UncaughtExceptionHandler previous) {
        return (thread, error) -> {
            if (MAIN_THREAD.equals(thread.getName()) && monitor.notifyFinished(error)) {
                System.err.println("[ghost-agent] uncaught exception in " + thread.getName() + ": " + error);
            }
            if (previous != null) {
                previous.uncaughtException(thread, error);
            } else {
                error.printStackTrace();
            }
        };
    }

    record AgentConfig(
        String outputPath,
        String namespace,
        String cfgDir,
        String manifestPath,
        String sourceMarker,
        long pollIntervalMs
    ) {}
}
