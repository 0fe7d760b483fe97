package com.ghosttrace.agent;

import com.ghosttrace.analyzer.CfgPipeline;
import com.ghosttrace.analyzer.bytecode.InstructionBlobWriter;
import com.ghosttrace.analyzer.cfg.ControlFlowGraph;

import java.util.LinkedHashMap;
import java.util.Map;

final class AgentFixtures {

    private AgentFixtures() {}

    /** Blob for a two-way branch: starts {0, 4, 6}. */
    static byte[] branchBlob(String name) {
        return new InstructionBlobWriter(name, name + ".java")
            .op(0, "LOAD_NAME", 0, 1)
            .op(2, "POP_JUMP_IF_FALSE", 6)
            .op(4, "RETURN_CONST", 0, 2)
            .op(6, "RETURN_CONST", 1, 3)
            .toBytes();
    }

    static Map<String, ControlFlowGraph> cfgs(String... names) {
        CfgPipeline pipeline = new CfgPipeline();
        Map<String, ControlFlowGraph> cfgs = new LinkedHashMap<>();
        for (String name : names) {
            cfgs.put(name, pipeline.buildCfg(branchBlob(name)));
        }
        return cfgs;
    }

    static TraceFrame frame(String function, String sourceFile, Map<String, Object> locals) {
        return frameAt(function, sourceFile, 1, locals);
    }

    static TraceFrame frameAt(String function, String sourceFile, int line, Map<String, Object> locals) {
        return new TraceFrame(function, sourceFile, line, locals);
    }
}
