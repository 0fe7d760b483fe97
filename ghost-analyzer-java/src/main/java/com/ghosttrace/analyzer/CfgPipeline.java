package com.ghosttrace.analyzer;

import com.ghosttrace.analyzer.bytecode.DecodeException;
import com.ghosttrace.analyzer.bytecode.DecodedCode;
import com.ghosttrace.analyzer.bytecode.InstructionDecoder;
import com.ghosttrace.analyzer.cfg.BlockPartition;
import com.ghosttrace.analyzer.cfg.BlockPartitioner;
import com.ghosttrace.analyzer.cfg.CfgBuilder;
import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decoder → partitioner → CFG builder.
 * Stateless; safe to share across threads.
 */
public class CfgPipeline {

    private final InstructionDecoder decoder = new InstructionDecoder();
    private final BlockPartitioner partitioner = new BlockPartitioner();
    private final CfgBuilder builder = new CfgBuilder();

    /**
     * Builds the CFG of one blob. The graph is named after the code unit in the blob.
     *
     * @throws DecodeException if the blob is malformed
     */
    public ControlFlowGraph buildCfg(byte[] blob) {
        DecodedCode code = decoder.decode(blob);
        BlockPartition partition = partitioner.partition(code.instructions());
        return builder.build(code.name(), partition);
    }

    /**
     * Builds one CFG per module. A module that fails is recorded in
     * {@link AnalysisResult#failures()} and the rest still run.
     */
    public AnalysisResult analyzeAll(Map<String, byte[]> blobsByModule) {
        Map<String, ControlFlowGraph> cfgs = new LinkedHashMap<>();
        Map<String, String> failures = new TreeMap<>();
        for (Map.Entry<String, byte[]> entry : new TreeMap<>(blobsByModule).entrySet()) {
            String module = entry.getKey();
            try {
                cfgs.put(module, buildCfg(entry.getValue()));
            } catch (DecodeException e) {
                System.err.println("[ghost-analyzer] ERROR: module " + module + " failed to decode: " + e.getMessage());
                failures.put(module, e.getMessage());
            } catch (IllegalArgumentException e) {
                System.err.println("[ghost-analyzer] ERROR: module " + module + " failed analysis: " + e.getMessage());
                failures.put(module, e.getMessage());
            }
        }
        return new AnalysisResult(Collections.unmodifiableMap(cfgs), Collections.unmodifiableMap(failures));
    }
}
