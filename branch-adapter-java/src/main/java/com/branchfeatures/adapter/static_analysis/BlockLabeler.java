package com.branchfeatures.adapter.static_analysis;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Routine;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves a readable label for every block.
 *
 * <p>Priority: the target name a branch uses for the block, then the block's own declared name,
 * then a {@code <unnamed_N>} placeholder. The first branch to name a block wins. Declared names
 * that are empty or {@value #RESERVED_NAME} are ignored.
 *
 * <p>Branch target names come from the terminator's structured label list. A terminator without
 * one has its names read positionally from its printed form.
 */
public class BlockLabeler {

    static final String RESERVED_NAME = "0";
    private static final Pattern LABEL_TOKEN = Pattern.compile("\\bL\\d+\\b");

    private final PrintStream diagnostics;

    public BlockLabeler(PrintStream diagnostics) {
        this.diagnostics = diagnostics;
    }

    public Map<Block, String> label(Routine routine) {
        Map<Block, String> labels = new LinkedHashMap<>();
        int n = 0;
        for (Block block : routine.blocks()) {
            labels.put(block, "<unnamed_" + n++ + ">");
        }

        Set<Block> branchLabeled = new HashSet<>();
        for (Block block : routine.blocks()) {
            Instruction terminator = block.terminator();
            if (terminator == null || terminator.kind() != InstructionKind.BRANCH) {
                continue;
            }
            List<Block> targets = terminator.targets().isEmpty()
                    ? new ArrayList<>(block.successors())
                    : terminator.targets();
            List<String> names = terminator.targetLabels() != null
                    ? terminator.targetLabels()
                    : labelsIn(terminator.text());
            for (int i = 0; i < targets.size() && i < names.size(); i++) {
                String name = names.get(i);
                Block target = targets.get(i);
                if (name == null || name.isEmpty() || branchLabeled.contains(target)) {
                    continue;
                }
                labels.put(target, name);
                branchLabeled.add(target);
            }
        }

        for (Block block : routine.blocks()) {
            String declared = block.name();
            if (!branchLabeled.contains(block) && !declared.isEmpty() && !RESERVED_NAME.equals(declared)) {
                labels.put(block, declared);
            }
        }

        if (diagnostics != null) {
            for (Block block : routine.blocks()) {
                Instruction first = block.firstInstruction();
                diagnostics.println("[branch-adapter] BB: " + labels.get(block) + " starts with "
                        + (first == null ? "<empty>" : first.toString()));
            }
        }
        return labels;
    }

    static List<String> labelsIn(String text) {
        List<String> names = new ArrayList<>();
        Matcher m = LABEL_TOKEN.matcher(text);
        while (m.find()) {
            names.add(m.group());
        }
        return names;
    }
}
