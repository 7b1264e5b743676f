package com.branchfeatures.agent;

import net.bytebuddy.ByteBuddy;
import net.bytebuddy.description.type.TypeDescription;
import net.bytebuddy.dynamic.ClassFileLocator;
import net.bytebuddy.pool.TypePool;

import java.util.Map;

/**
 * Offline counterpart of the agent: instruments class-file bytes without loading them.
 * All classes passed through one instance share its {@link BranchHistoryInstrumenter} counter.
 */
public class ClassInstrumenter {

    private final BranchHistoryInstrumenter instrumenter;
    private final ClassFileLocator corpus;

    public ClassInstrumenter() {
        this(new BranchHistoryInstrumenter(), Map.of());
    }

    /**
     * @param corpus class files, by binary name, that the instrumented classes may reference
     *               (supertypes outside the system class path)
     */
    public ClassInstrumenter(BranchHistoryInstrumenter instrumenter, Map<String, byte[]> corpus) {
        this.instrumenter = instrumenter;
        this.corpus = new ClassFileLocator.Simple(corpus);
    }

    public BranchHistoryInstrumenter instrumenter() {
        return instrumenter;
    }

    /**
     * Returns the instrumented class file.
     *
     * @param typeName  binary name of the class, e.g. {@code com.example.Foo}
     * @param classFile original class-file bytes
     * @throws InstrumentationException if the class cannot be described or rewritten
     */
    public byte[] instrument(String typeName, byte[] classFile) {
        ClassFileLocator locator = new ClassFileLocator.Compound(
                ClassFileLocator.Simple.of(typeName, classFile),
                corpus,
                ClassFileLocator.ForClassLoader.ofSystemLoader());
        try {
            TypeDescription type = TypePool.Default.of(locator).describe(typeName).resolve();
            return new ByteBuddy()
                    .redefine(type, locator)
                    .visit(instrumenter.asVisitorWrapper())
                    .make()
                    .getBytes();
        } catch (RuntimeException e) {
            throw new InstrumentationException("Failed to instrument " + typeName + ": " + e.getMessage(), e);
        }
    }

    public static class InstrumentationException extends RuntimeException {
        public InstrumentationException(String msg, Throwable cause) { super(msg, cause); }
    }
}
