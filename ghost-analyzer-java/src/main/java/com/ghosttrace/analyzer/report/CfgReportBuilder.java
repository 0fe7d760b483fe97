package com.ghosttrace.analyzer.report;

import com.ghosttrace.analyzer.AnalysisResult;
import com.ghosttrace.analyzer.bytecode.Instruction;
import com.ghosttrace.analyzer.cfg.BasicBlock;
import com.ghosttrace.analyzer.cfg.ControlFlowEdge;
import com.ghosttrace.analyzer.cfg.ControlFlowGraph;
import com.ghosttrace.analyzer.cfg.UnresolvedTarget;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts live CFGs into the serializable report model. Counters are read at conversion time.
 */
public class CfgReportBuilder {

    public static final String REPORT_VERSION = "0.1";
    public static final String ANALYZER_VERSION = "0.1.0";

    public CfgReportModel.CfgReportRoot build(AnalysisResult result) {
        CfgReportModel.CfgReportRoot root = new CfgReportModel.CfgReportRoot();
        root.reportVersion = REPORT_VERSION;
        root.analyzerVersion = ANALYZER_VERSION;
        root.modules = modules(result.cfgs());
        root.failures = new ArrayList<>();
        for (Map.Entry<String, String> f : result.failures().entrySet()) {
            CfgReportModel.ModuleFailure failure = new CfgReportModel.ModuleFailure();
            failure.module = f.getKey();
            failure.error = f.getValue();
            root.failures.add(failure);
        }
        return root;
    }

    public List<CfgReportModel.CfgModule> modules(Map<String, ControlFlowGraph> cfgs) {
        List<CfgReportModel.CfgModule> modules = new ArrayList<>();
        for (Map.Entry<String, ControlFlowGraph> e : cfgs.entrySet()) {
            CfgReportModel.CfgModule module = module(e.getValue());
            module.name = e.getKey();
            modules.add(module);
        }
        return modules;
    }

    public CfgReportModel.CfgModule module(ControlFlowGraph cfg) {
        CfgReportModel.CfgModule module = new CfgReportModel.CfgModule();
        module.name = cfg.name();
        module.blocks = new ArrayList<>();
        for (BasicBlock block : cfg.partition().blocks()) {
            CfgReportModel.CfgBlock b = new CfgReportModel.CfgBlock();
            b.id = block.id();
            b.startOffset = block.startOffset();
            b.endOffset = block.endOffset();
            b.lines = new ArrayList<>(block.lines());
            b.execCount = block.executionCount();
            b.instructions = new ArrayList<>();
            for (Instruction instr : block.instructions()) {
                b.instructions.add(instr.toString().strip());
            }
            module.blocks.add(b);
        }
        module.edges = new ArrayList<>();
        for (ControlFlowEdge edge : cfg.edges()) {
            CfgReportModel.CfgEdge e = new CfgReportModel.CfgEdge();
            e.source = edge.source();
            e.target = edge.target();
            e.kind = edge.kind().name().toLowerCase();
            e.hitCount = edge.hitCount();
            module.edges.add(e);
        }
        module.unresolved = new ArrayList<>();
        for (UnresolvedTarget miss : cfg.unresolvedTargets()) {
            CfgReportModel.CfgUnresolved u = new CfgReportModel.CfgUnresolved();
            u.blockId = miss.blockId();
            u.instructionOffset = miss.instructionOffset();
            u.targetOffset = miss.targetOffset();
            u.kind = miss.kind().name().toLowerCase();
            module.unresolved.add(u);
        }
        return module;
    }
}
