package com.branchfeatures.adapter.bytecode;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.tree.ClassNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipFile;

/**
 * Collects compiled class files from a single {@code .class} file, a directory tree, or a jar.
 * Entries come back sorted by path so every run visits classes in the same order.
 */
public class ClassFileLoader {

    private static final String CLASS_SUFFIX = ".class";

    public static class ClassFileLoadException extends RuntimeException {
        public ClassFileLoadException(String message) { super(message); }
        public ClassFileLoadException(String message, Throwable cause) { super(message, cause); }
    }

    /**
     * One class file.
     *
     * @param typeName     binary name, e.g. {@code com.example.Foo$Bar}
     * @param relativePath path of the entry inside the input
     * @param bytes        raw class file
     */
    public record ClassFileEntry(String typeName, String relativePath, byte[] bytes) {}

    public List<ClassFileEntry> load(Path input) {
        if (!Files.exists(input)) {
            throw new ClassFileLoadException("Input not found: " + input);
        }
        if (Files.isDirectory(input)) {
            return loadDirectory(input);
        }
        String fileName = input.getFileName().toString();
        if (fileName.endsWith(".jar") || fileName.endsWith(".zip")) {
            return loadJar(input);
        }
        if (fileName.endsWith(CLASS_SUFFIX)) {
            List<ClassFileEntry> single = new ArrayList<>();
            addEntry(single, fileName, readAll(input));
            return single;
        }
        throw new ClassFileLoadException("Unsupported input (expected .class, .jar or directory): " + input);
    }

    /** Parses an entry into a tree with full method bodies. */
    public ClassNode parse(ClassFileEntry entry) {
        ClassNode node = new ClassNode();
        new ClassReader(entry.bytes()).accept(node, 0);
        return node;
    }

    private List<ClassFileEntry> loadDirectory(Path root) {
        List<Path> classFiles;
        try (Stream<Path> walk = Files.walk(root)) {
            classFiles = walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(CLASS_SUFFIX))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ClassFileLoadException("Failed to scan directory: " + root, e);
        }
        List<ClassFileEntry> entries = new ArrayList<>();
        for (Path file : classFiles) {
            String relative = root.relativize(file).toString().replace('\\', '/');
            addEntry(entries, relative, readAll(file));
        }
        return entries;
    }

    private List<ClassFileEntry> loadJar(Path jar) {
        List<ClassFileEntry> entries = new ArrayList<>();
        try (ZipFile zip = new ZipFile(jar.toFile())) {
            List<ZipEntry> zipEntries = new ArrayList<>();
            Enumeration<? extends ZipEntry> e = zip.entries();
            while (e.hasMoreElements()) {
                ZipEntry entry = e.nextElement();
                if (!entry.isDirectory() && entry.getName().endsWith(CLASS_SUFFIX)) {
                    zipEntries.add(entry);
                }
            }
            zipEntries.sort((a, b) -> a.getName().compareTo(b.getName()));
            for (ZipEntry entry : zipEntries) {
                try (InputStream in = zip.getInputStream(entry)) {
                    addEntry(entries, entry.getName(), in.readAllBytes());
                }
            }
        } catch (IOException ex) {
            throw new ClassFileLoadException("Failed to read jar: " + jar, ex);
        }
        return Collections.unmodifiableList(entries);
    }

    private void addEntry(List<ClassFileEntry> entries, String relativePath, byte[] bytes) {
        String fileName = relativePath.substring(relativePath.lastIndexOf('/') + 1);
        if (fileName.equals("module-info.class")) {
            return;
        }
        try {
            String typeName = new ClassReader(bytes).getClassName().replace('/', '.');
            entries.add(new ClassFileEntry(typeName, relativePath, bytes));
        } catch (IllegalArgumentException | ArrayIndexOutOfBoundsException e) {
            System.err.println("[branch-adapter] Warning: skipping malformed class file " + relativePath
                    + ": " + e);
        }
    }

    private static byte[] readAll(Path file) {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new ClassFileLoadException("Failed to read " + file, e);
        }
    }
}
