package com.branchfeatures.adapter.bytecode;

import com.branchfeatures.adapter.ir.Block;
import com.branchfeatures.adapter.ir.Instruction;
import com.branchfeatures.adapter.ir.InstructionKind;
import com.branchfeatures.adapter.ir.Operand;
import com.branchfeatures.adapter.ir.Routine;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AbstractInsnNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.FieldInsnNode;
import org.objectweb.asm.tree.IincInsnNode;
import org.objectweb.asm.tree.InsnList;
import org.objectweb.asm.tree.IntInsnNode;
import org.objectweb.asm.tree.InvokeDynamicInsnNode;
import org.objectweb.asm.tree.JumpInsnNode;
import org.objectweb.asm.tree.LabelNode;
import org.objectweb.asm.tree.LdcInsnNode;
import org.objectweb.asm.tree.LookupSwitchInsnNode;
import org.objectweb.asm.tree.MethodInsnNode;
import org.objectweb.asm.tree.MethodNode;
import org.objectweb.asm.tree.TableSwitchInsnNode;
import org.objectweb.asm.tree.TryCatchBlockNode;
import org.objectweb.asm.tree.VarInsnNode;
import org.objectweb.asm.tree.analysis.Analyzer;
import org.objectweb.asm.tree.analysis.AnalyzerException;
import org.objectweb.asm.tree.analysis.BasicInterpreter;
import org.objectweb.asm.tree.analysis.BasicValue;
import org.objectweb.asm.tree.analysis.Frame;
import org.objectweb.asm.tree.analysis.SourceInterpreter;
import org.objectweb.asm.tree.analysis.SourceValue;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import static org.objectweb.asm.Opcodes.*;

/**
 * Builds a {@link Routine} from a JVM method body.
 *
 * <p>Blocks start at the first instruction, at every jump, switch and exception-handler target,
 * and right after every jump, switch, return, throw and {@code ret}. A block's declared name is
 * the first label in front of its first instruction. Labels are named {@code L0, L1, ...} in
 * method order.
 *
 * <p>Successors are listed the way the terminator reports them: for a conditional jump the
 * jump target first, then the fall-through; for a switch the default target, then the cases.
 * Every block overlapping a try range also gets its handler as a successor.
 *
 * <p>Operands come from two data-flow passes over the method: a {@link SourceInterpreter}
 * pass names the instructions that may have produced each stack and local value, and a
 * {@link BasicInterpreter} pass tells reference values from primitives. Only producers earlier
 * in the method than their consumer are kept, so loop-carried definitions do not appear.
 */
public class RoutineBuilder {

    private final LoopNestBuilder loopNestBuilder = new LoopNestBuilder();

    /** One routine per concrete method; methods that fail analysis are skipped with a warning. */
    public List<Routine> build(ClassNode classNode) {
        List<Routine> routines = new ArrayList<>();
        for (MethodNode method : classNode.methods) {
            if (method.instructions.size() == 0) {
                continue; // abstract or native
            }
            try {
                routines.add(build(classNode.name, method));
            } catch (AnalyzerException | RuntimeException e) {
                System.err.println("[branch-adapter] Warning: skipping " + routineName(classNode.name, method)
                        + ": " + e);
            }
        }
        return routines;
    }

    public Routine build(String owner, MethodNode method) throws AnalyzerException {
        Frame<SourceValue>[] sourceFrames = new Analyzer<>(new SourceInterpreter()).analyze(owner, method);
        Frame<BasicValue>[] typeFrames = new Analyzer<>(new BasicInterpreter()).analyze(owner, method);
        return new MethodScan(owner, method, sourceFrames, typeFrames).scan();
    }

    static String routineName(String owner, MethodNode method) {
        return owner.replace('/', '.') + "." + method.name + method.desc;
    }

    static InstructionKind kindOf(int opcode) {
        return switch (opcode) {
            case IFEQ, IFNE, IFLT, IFGE, IFGT, IFLE,
                 IF_ICMPEQ, IF_ICMPNE, IF_ICMPLT, IF_ICMPGE, IF_ICMPGT, IF_ICMPLE,
                 IF_ACMPEQ, IF_ACMPNE, IFNULL, IFNONNULL,
                 GOTO, JSR -> InstructionKind.BRANCH;
            case TABLESWITCH, LOOKUPSWITCH -> InstructionKind.SWITCH;
            case RET -> InstructionKind.INDIRECT_BRANCH;
            case INVOKEVIRTUAL, INVOKESPECIAL, INVOKESTATIC, INVOKEINTERFACE, INVOKEDYNAMIC -> InstructionKind.CALL;
            case IRETURN, LRETURN, FRETURN, DRETURN, ARETURN, RETURN -> InstructionKind.RETURN;
            case IALOAD, LALOAD, FALOAD, DALOAD, AALOAD, BALOAD, CALOAD, SALOAD,
                 GETFIELD, GETSTATIC -> InstructionKind.LOAD;
            case IASTORE, LASTORE, FASTORE, DASTORE, AASTORE, BASTORE, CASTORE, SASTORE,
                 PUTFIELD, PUTSTATIC -> InstructionKind.STORE;
            case ATHROW -> InstructionKind.THROW;
            default -> InstructionKind.OTHER;
        };
    }

    static boolean isConditionalJump(int opcode) {
        return (opcode >= IFEQ && opcode <= IF_ACMPNE) || opcode == IFNULL || opcode == IFNONNULL;
    }

    /** Literal pushed by a constant instruction, or null when the instruction pushes no literal. */
    static Operand literalOf(AbstractInsnNode node) {
        int opcode = node.getOpcode();
        if (opcode >= ICONST_M1 && opcode <= ICONST_5) return Operand.intConstant(opcode - ICONST_0);
        if (opcode == LCONST_0 || opcode == LCONST_1) return Operand.intConstant(opcode - LCONST_0);
        if (opcode >= FCONST_0 && opcode <= FCONST_2) return Operand.floatConstant(opcode - FCONST_0);
        if (opcode == DCONST_0 || opcode == DCONST_1) return Operand.floatConstant(opcode - DCONST_0);
        if (opcode == BIPUSH || opcode == SIPUSH) return Operand.intConstant(((IntInsnNode) node).operand);
        if (opcode == ACONST_NULL) return Operand.other("null", true);
        if (opcode == LDC) {
            Object cst = ((LdcInsnNode) node).cst;
            if (cst instanceof Integer || cst instanceof Long) return Operand.intConstant(((Number) cst).longValue());
            if (cst instanceof Float || cst instanceof Double) return Operand.floatConstant(((Number) cst).doubleValue());
            if (cst instanceof String) return Operand.global("\"" + cst + "\"");
            if (cst instanceof Type) return Operand.global(((Type) cst).getDescriptor());
            return Operand.global(String.valueOf(cst));
        }
        return null;
    }

    /** State for building one method. */
    private final class MethodScan {

        private final String owner;
        private final MethodNode method;
        private final InsnList insns;
        private final Frame<SourceValue>[] sourceFrames;
        private final Frame<BasicValue>[] typeFrames;
        private final int parameterSlots;

        private final Map<LabelNode, String> labelNames = new HashMap<>();
        private final List<AbstractInsnNode> real = new ArrayList<>();
        private final Map<AbstractInsnNode, Instruction> instructions = new HashMap<>();
        private final List<Block> blocks = new ArrayList<>();
        private Block[] blockAt;
        private int[] blockStart;

        MethodScan(String owner, MethodNode method, Frame<SourceValue>[] sourceFrames, Frame<BasicValue>[] typeFrames) {
            this.owner = owner;
            this.method = method;
            this.insns = method.instructions;
            this.sourceFrames = sourceFrames;
            this.typeFrames = typeFrames;
            int argumentSlots = Type.getArgumentsAndReturnSizes(method.desc) >> 2;
            this.parameterSlots = (method.access & ACC_STATIC) != 0 ? argumentSlots - 1 : argumentSlots;
        }

        Routine scan() {
            int labelCount = 0;
            for (AbstractInsnNode node : insns) {
                if (node instanceof LabelNode) {
                    labelNames.put((LabelNode) node, "L" + labelCount++);
                } else if (node.getOpcode() >= 0) {
                    real.add(node);
                }
            }
            InstructionPrinter printer = new InstructionPrinter(labelNames);
            for (int i = 0; i < real.size(); i++) {
                AbstractInsnNode node = real.get(i);
                int opcode = node.getOpcode();
                instructions.put(node, new Instruction(i, kindOf(opcode), isConditionalJump(opcode), printer.print(node)));
            }

            Routine routine = new Routine(routineName(owner, method));
            formBlocks(routine);
            linkBlocks();
            for (int i = 0; i < real.size(); i++) {
                resolveOperands(real.get(i));
            }
            routine.setLoops(loopNestBuilder.build(routine));
            return routine;
        }

        private void formBlocks(Routine routine) {
            Set<Integer> leaders = new TreeSet<>();
            if (!real.isEmpty()) {
                leaders.add(0);
            }
            for (int i = 0; i < real.size(); i++) {
                AbstractInsnNode node = real.get(i);
                int opcode = node.getOpcode();
                if (node instanceof JumpInsnNode) {
                    addLeader(leaders, position(((JumpInsnNode) node).label));
                    addLeader(leaders, i + 1);
                } else if (node instanceof TableSwitchInsnNode) {
                    TableSwitchInsnNode sw = (TableSwitchInsnNode) node;
                    addLeader(leaders, position(sw.dflt));
                    sw.labels.forEach(l -> addLeader(leaders, position(l)));
                    addLeader(leaders, i + 1);
                } else if (node instanceof LookupSwitchInsnNode) {
                    LookupSwitchInsnNode sw = (LookupSwitchInsnNode) node;
                    addLeader(leaders, position(sw.dflt));
                    sw.labels.forEach(l -> addLeader(leaders, position(l)));
                    addLeader(leaders, i + 1);
                } else if ((opcode >= IRETURN && opcode <= RETURN) || opcode == ATHROW || opcode == RET) {
                    addLeader(leaders, i + 1);
                }
            }
            for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
                addLeader(leaders, position(tcb.handler));
            }

            blockAt = new Block[real.size()];
            blockStart = new int[leaders.size()];
            Block current = null;
            for (int i = 0; i < real.size(); i++) {
                if (leaders.contains(i)) {
                    current = new Block(blocks.size(), declaredName(real.get(i)));
                    blockStart[blocks.size()] = i;
                    blocks.add(current);
                    routine.addBlock(current);
                }
                current.addInstruction(instructions.get(real.get(i)));
                blockAt[i] = current;
            }
        }

        private void linkBlocks() {
            for (Block block : blocks) {
                Instruction last = block.terminator();
                AbstractInsnNode node = real.get(last.index());
                int opcode = node.getOpcode();
                Block next = last.index() + 1 < real.size() ? blockAt[last.index() + 1] : null;
                List<Block> targets = new ArrayList<>();
                List<String> targetLabels = new ArrayList<>();

                if (node instanceof JumpInsnNode) {
                    LabelNode label = ((JumpInsnNode) node).label;
                    targets.add(blockAt[position(label)]);
                    targetLabels.add(labelNames.get(label));
                    if (opcode != GOTO && next != null) {
                        targets.add(next);
                        targetLabels.add(next.name().isEmpty() ? null : next.name());
                    }
                } else if (node instanceof TableSwitchInsnNode) {
                    TableSwitchInsnNode sw = (TableSwitchInsnNode) node;
                    addTarget(targets, targetLabels, sw.dflt);
                    sw.labels.forEach(l -> addTarget(targets, targetLabels, l));
                } else if (node instanceof LookupSwitchInsnNode) {
                    LookupSwitchInsnNode sw = (LookupSwitchInsnNode) node;
                    addTarget(targets, targetLabels, sw.dflt);
                    sw.labels.forEach(l -> addTarget(targets, targetLabels, l));
                } else if (!((opcode >= IRETURN && opcode <= RETURN) || opcode == ATHROW || opcode == RET)) {
                    if (next != null) {
                        block.addSuccessor(next);
                    }
                }

                if (!targets.isEmpty()) {
                    last.setTargets(targets, targetLabels);
                    targets.forEach(block::addSuccessor);
                }
            }

            for (TryCatchBlockNode tcb : method.tryCatchBlocks) {
                int start = position(tcb.start);
                int end = position(tcb.end);
                if (end < 0) end = real.size();
                Block handler = blockAt[position(tcb.handler)];
                for (Block block : blocks) {
                    int first = blockStart[block.index()];
                    int last = block.terminator().index();
                    if (first < end && last >= start) {
                        block.addSuccessor(handler);
                    }
                }
            }
        }

        private void resolveOperands(AbstractInsnNode node) {
            Instruction instruction = instructions.get(node);
            int frameIndex = insns.indexOf(node);
            Frame<SourceValue> sources = sourceFrames[frameIndex];
            Frame<BasicValue> types = typeFrames[frameIndex];
            int opcode = node.getOpcode();

            if ((node instanceof VarInsnNode && opcode >= ILOAD && opcode <= ALOAD) || opcode == RET) {
                instruction.addOperand(localOperand(((VarInsnNode) node).var, sources, types, instruction.index()));
            } else if (node instanceof IincInsnNode) {
                IincInsnNode iinc = (IincInsnNode) node;
                instruction.addOperand(localOperand(iinc.var, sources, types, instruction.index()));
                instruction.addOperand(Operand.intConstant(iinc.incr));
            }

            if (sources != null) {
                boolean decides = instruction.isConditionalBranch() || instruction.kind() == InstructionKind.SWITCH;
                int consumed = StackEffect.consumedValues(node, sources);
                int top = sources.getStackSize() - 1;
                for (int k = consumed - 1; k >= 0; k--) {
                    int slot = top - k;
                    if (slot < 0) continue;
                    BasicValue type = types == null ? null : types.getStack(slot);
                    Operand operand = stackOperand(sources.getStack(slot), type, instruction.index());
                    if (decides) {
                        instruction.addConditionOperand(operand);
                    } else {
                        instruction.addOperand(operand);
                    }
                }
            }

            if (opcode != ACONST_NULL) {
                Operand literal = literalOf(node);
                if (literal != null) {
                    instruction.addOperand(literal);
                }
            }
            if (node instanceof FieldInsnNode && (opcode == GETSTATIC || opcode == PUTSTATIC)) {
                FieldInsnNode field = (FieldInsnNode) node;
                instruction.addOperand(Operand.global(field.owner + "." + field.name));
            } else if (node instanceof MethodInsnNode) {
                MethodInsnNode call = (MethodInsnNode) node;
                instruction.addOperand(Operand.global(call.owner + "." + call.name + call.desc));
            } else if (node instanceof InvokeDynamicInsnNode) {
                InvokeDynamicInsnNode indy = (InvokeDynamicInsnNode) node;
                instruction.addOperand(Operand.global(indy.name + indy.desc));
            } else if (node instanceof JumpInsnNode) {
                instruction.addOperand(Operand.label(labelNames.get(((JumpInsnNode) node).label)));
            } else if (node instanceof TableSwitchInsnNode) {
                TableSwitchInsnNode sw = (TableSwitchInsnNode) node;
                instruction.addOperand(Operand.label(labelNames.get(sw.dflt)));
                sw.labels.forEach(l -> instruction.addOperand(Operand.label(labelNames.get(l))));
            } else if (node instanceof LookupSwitchInsnNode) {
                LookupSwitchInsnNode sw = (LookupSwitchInsnNode) node;
                instruction.addOperand(Operand.label(labelNames.get(sw.dflt)));
                sw.labels.forEach(l -> instruction.addOperand(Operand.label(labelNames.get(l))));
            }
        }

        private Operand localOperand(int var, Frame<SourceValue> sources, Frame<BasicValue> types, int consumer) {
            if (sources == null) {
                return Operand.other("local" + var, false);
            }
            boolean pointer = types != null && types.getLocal(var).isReference();
            List<Instruction> producers = producersBefore(sources.getLocal(var).insns, consumer);
            if (!producers.isEmpty()) {
                return Operand.produced(producers, pointer);
            }
            if (var < parameterSlots) {
                return Operand.parameter(var, pointer);
            }
            return Operand.other("local" + var, pointer);
        }

        private Operand stackOperand(SourceValue value, BasicValue type, int consumer) {
            boolean pointer = type != null && type.isReference();
            if (value.insns.size() == 1) {
                Operand literal = literalOf(value.insns.iterator().next());
                if (literal != null) {
                    return literal;
                }
            }
            List<Instruction> producers = producersBefore(value.insns, consumer);
            if (!producers.isEmpty()) {
                return Operand.produced(producers, pointer);
            }
            return Operand.other("stack", pointer);
        }

        private List<Instruction> producersBefore(Set<AbstractInsnNode> nodes, int consumer) {
            List<Instruction> producers = new ArrayList<>();
            for (AbstractInsnNode node : nodes) {
                Instruction producer = instructions.get(node);
                if (producer != null && producer.index() < consumer) {
                    producers.add(producer);
                }
            }
            producers.sort(Comparator.comparingInt(Instruction::index));
            return producers;
        }

        private void addTarget(List<Block> targets, List<String> targetLabels, LabelNode label) {
            targets.add(blockAt[position(label)]);
            targetLabels.add(labelNames.get(label));
        }

        private void addLeader(Set<Integer> leaders, int position) {
            if (position >= 0 && position < real.size()) {
                leaders.add(position);
            }
        }

        /** Position of the first real instruction at or after {@code node}; -1 past the end. */
        private int position(AbstractInsnNode node) {
            for (AbstractInsnNode n = node; n != null; n = n.getNext()) {
                if (n.getOpcode() >= 0) {
                    return instructions.get(n).index();
                }
            }
            return -1;
        }

        private String declaredName(AbstractInsnNode first) {
            String name = "";
            for (AbstractInsnNode n = first.getPrevious(); n != null && n.getOpcode() < 0; n = n.getPrevious()) {
                if (n instanceof LabelNode) {
                    name = labelNames.get(n);
                }
            }
            return name;
        }
    }
}
