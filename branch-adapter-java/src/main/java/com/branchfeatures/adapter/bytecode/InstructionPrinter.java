package com.branchfeatures.adapter.bytecode;

import org.objectweb.asm.Opcodes;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MultiANewArrayInsnNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.TypeInsnNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.util.Printer;

import java.util.Map;

/**
 * One-line textual rendering of a bytecode instruction, with labels shown by their
 * {@code L<n>} names. For example {@code IF_ICMPGE L3} or {@code INVOKESTATIC java/lang/Math.max(II)I}.
 */
final class InstructionPrinter {

    private final Map<LabelNode, String> labelNames;

    InstructionPrinter(Map<LabelNode, String> labelNames) {
        this.labelNames = labelNames;
    }

    String print(AbstractInsnNode node) {
        String mnemonic = Printer.OPCODES[node.getOpcode()];
        return switch (node.getType()) {
            case AbstractInsnNode.INT_INSN -> {
                IntInsnNode n = (IntInsnNode) node;
                yield mnemonic + " " + (n.getOpcode() == Opcodes.NEWARRAY ? Printer.TYPES[n.operand] : n.operand);
            }
            case AbstractInsnNode.VAR_INSN -> mnemonic + " " + ((VarInsnNode) node).var;
            case AbstractInsnNode.TYPE_INSN -> mnemonic + " " + ((TypeInsnNode) node).desc;
            case AbstractInsnNode.FIELD_INSN -> {
                FieldInsnNode n = (FieldInsnNode) node;
                yield mnemonic + " " + n.owner + "." + n.name + " : " + n.desc;
            }
            case AbstractInsnNode.METHOD_INSN -> {
                MethodInsnNode n = (MethodInsnNode) node;
                yield mnemonic + " " + n.owner + "." + n.name + n.desc;
            }
            case AbstractInsnNode.INVOKE_DYNAMIC_INSN -> {
                InvokeDynamicInsnNode n = (InvokeDynamicInsnNode) node;
                yield mnemonic + " " + n.name + n.desc;
            }
            case AbstractInsnNode.JUMP_INSN -> mnemonic + " " + name(((JumpInsnNode) node).label);
            case AbstractInsnNode.LDC_INSN -> {
                Object cst = ((LdcInsnNode) node).cst;
                yield mnemonic + " " + (cst instanceof String ? "\"" + cst + "\"" : String.valueOf(cst));
            }
            case AbstractInsnNode.IINC_INSN -> {
                IincInsnNode n = (IincInsnNode) node;
                yield mnemonic + " " + n.var + " " + n.incr;
            }
            case AbstractInsnNode.TABLESWITCH_INSN -> {
                TableSwitchInsnNode n = (TableSwitchInsnNode) node;
                StringBuilder sb = new StringBuilder(mnemonic);
                for (int i = 0; i < n.labels.size(); i++) {
                    sb.append(' ').append(n.min + i).append(": ").append(name(n.labels.get(i)));
                }
                yield sb.append(" default: ").append(name(n.dflt)).toString();
            }
            case AbstractInsnNode.LOOKUPSWITCH_INSN -> {
                LookupSwitchInsnNode n = (LookupSwitchInsnNode) node;
                StringBuilder sb = new StringBuilder(mnemonic);
                for (int i = 0; i < n.labels.size(); i++) {
                    sb.append(' ').append(n.keys.get(i)).append(": ").append(name(n.labels.get(i)));
                }
                yield sb.append(" default: ").append(name(n.dflt)).toString();
            }
            case AbstractInsnNode.MULTIANEWARRAY_INSN -> {
                MultiANewArrayInsnNode n = (MultiANewArrayInsnNode) node;
                yield mnemonic + " " + n.desc + " " + n.dims;
            }
            default -> mnemonic;
        };
    }

    private String name(LabelNode label) {
        String name = labelNames.get(label);
        return name != null ? name : "L?";
    }
}
