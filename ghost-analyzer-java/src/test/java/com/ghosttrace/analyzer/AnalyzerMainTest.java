package com.ghosttrace.analyzer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AnalyzerMainTest {

    @TempDir
    Path tempDir;

    @Test
    void analyzesBlobsIntoReportAndDotFiles() throws IOException {
        Path branch = tempDir.resolve("branch.ghbc");
        Path loop = tempDir.resolve("loop.ghbc");
        Files.write(branch, CfgFixtures.ifElse());
        Files.write(loop, CfgFixtures.forLoop());
        Path out = tempDir.resolve("out");

        AnalysisResult result = AnalyzerMain.run(new String[] {
            "analyze", "--blob", branch.toString(), "--blob", loop.toString(), "--output", out.toString()});

        assertFalse(result.hasFailures());
        assertEquals(2, result.cfgs().size());
        assertTrue(Files.exists(out.resolve("cfg_report.json")));
        assertTrue(Files.readString(out.resolve("branch.dot")).startsWith("digraph \"if_else\""));
        assertTrue(Files.exists(out.resolve("loop.dot")));
    }

    @Test
    void manifestSuppliesBlobsAndOutputDir() throws IOException {
        Files.createDirectories(tempDir.resolve("blobs"));
        Files.write(tempDir.resolve("blobs/loop.ghbc"), CfgFixtures.forLoop());
        Files.write(tempDir.resolve("blobs/junk.ghbc"), new byte[] {9, 9, 9});
        Path manifest = tempDir.resolve("manifest.json");
        Files.writeString(manifest, """
            {
              "modules": [
                {"name": "loop", "blob": "blobs/loop.ghbc"},
                {"name": "junk", "blob": "blobs/junk.ghbc"}
              ],
              "output_dir": "%s"
            }
            """.formatted(tempDir.resolve("report").toString().replace("\\", "\\\\")));

        AnalysisResult result = AnalyzerMain.run(new String[] {"analyze", "--manifest", manifest.toString()});

        assertTrue(result.hasFailures());
        assertTrue(result.failures().containsKey("junk"));
        assertTrue(result.cfgs().containsKey("loop"));
        assertTrue(Files.exists(tempDir.resolve("report/cfg_report.json")));
    }

    @Test
    void noArgumentsIsAUsageError() {
        assertThrows(AnalyzerMain.UsageException.class, () -> AnalyzerMain.run(new String[0]));
    }

    @Test
    void unknownSubcommandIsAUsageError() {
        assertThrows(AnalyzerMain.UsageException.class, () -> AnalyzerMain.run(new String[] {"trace"}));
    }

    @Test
    void unknownFlagIsAUsageError() {
        assertThrows(AnalyzerMain.UsageException.class,
            () -> AnalyzerMain.run(new String[] {"analyze", "--verbose"}));
    }

    @Test
    void missingFlagArgumentIsAUsageError() {
        assertThrows(AnalyzerMain.UsageException.class,
            () -> AnalyzerMain.run(new String[] {"analyze", "--blob"}));
    }

    @Test
    void inputIsRequired() {
        assertThrows(AnalyzerMain.UsageException.class,
            () -> AnalyzerMain.run(new String[] {"analyze", "--output", tempDir.toString()}));
    }

    @Test
    void manifestAndBlobAreExclusive() {
        assertThrows(AnalyzerMain.UsageException.class, () -> AnalyzerMain.run(new String[] {
            "analyze", "--manifest", "m.json", "--blob", "a.ghbc", "--output", tempDir.toString()}));
    }

    @Test
    void outputIsRequiredForBlobs() throws IOException {
        Path blob = tempDir.resolve("x.ghbc");
        Files.write(blob, CfgFixtures.ifElse());
        assertThrows(AnalyzerMain.UsageException.class,
            () -> AnalyzerMain.run(new String[] {"analyze", "--blob", blob.toString()}));
    }

    @Test
    void moduleNameDropsTheExtension() {
        assertEquals("if_else", BlobLoader.moduleName(Path.of("dir/if_else.ghbc")));
        assertEquals("plain", BlobLoader.moduleName(Path.of("plain")));
    }

    @Test
    void loadDirectoryPicksUpOnlyBlobFiles() throws IOException {
        Files.write(tempDir.resolve("a.ghbc"), CfgFixtures.ifElse());
        Files.write(tempDir.resolve("notes.txt"), new byte[] {1});
        assertEquals(Set.of("a"), new BlobLoader().loadDirectory(tempDir).keySet());
    }
}
