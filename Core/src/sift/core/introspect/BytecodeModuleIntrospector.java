package sift.core.introspect;

import org.objectweb.asm.ClassReader;
import org.objectweb.asm.ClassVisitor;
import org.objectweb.asm.Label;
import org.objectweb.asm.MethodVisitor;
import org.objectweb.asm.Opcodes;
import sift.core.exception.ModuleNotFoundException;
import sift.core.type.PackageName;
import sift.core.util.Logger;
import sift.core.util.ObjectChecker;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A module introspector that treats a module as an enclosing class whose member classes hold the tests, in the same
 * way as JUnit's {@code Enclosed} runner.
 *
 * Every class file is read as a resource of the given class loader and parsed with ASM. Nothing is ever loaded as a
 * {@link Class}, so no static initializer of the module or its classes runs during introspection.
 */
public final class BytecodeModuleIntrospector implements ModuleIntrospector {
    private static final Logger LOGGER = Logger.forClass(BytecodeModuleIntrospector.class);
    private final ClassLoader classLoader;

    private BytecodeModuleIntrospector(ClassLoader classLoader) {
        ObjectChecker.assertNonNull(classLoader);
        this.classLoader = classLoader;
    }

    /**
     * Constructs a new introspector that reads class files through the given class loader.
     *
     * @param classLoader The class loader to find class files with.
     * @return the introspector.
     */
    public static BytecodeModuleIntrospector withClassLoader(ClassLoader classLoader) {
        return new BytecodeModuleIntrospector(classLoader);
    }

    @Override
    public ModuleInfo introspect(PackageName packageName, String module) throws ModuleNotFoundException {
        ObjectChecker.assertNonNull(packageName, module);

        String qualifiedName = packageName.qualify(module);
        String internalName = qualifiedName.replace('.', '/');
        LOGGER.log("Inspecting module " + qualifiedName);

        List<String> memberClasses = new ArrayList<>();
        readClass(qualifiedName, internalName).accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public void visitInnerClass(String name, String outerName, String innerName, int access) {
                // The InnerClasses attribute also lists the module's own enclosing classes and any local or anonymous
                // classes, only direct members have the module as their outer class.
                if (internalName.equals(outerName) && innerName != null && (access & Opcodes.ACC_SYNTHETIC) == 0) {
                    memberClasses.add(innerName);
                }
            }
        }, ClassReader.SKIP_CODE | ClassReader.SKIP_FRAMES);

        List<ClassInfo> classes = new ArrayList<>();
        for (String memberClass : memberClasses) {
            classes.add(readClassInfo(qualifiedName, internalName + "$" + memberClass, memberClass));
        }
        return new ModuleInfo(qualifiedName, classes);
    }

    private ClassInfo readClassInfo(String moduleName, String internalName, String simpleName) throws ModuleNotFoundException {
        Map<String, MethodLine> methods = new LinkedHashMap<>();
        readClass(moduleName, internalName).accept(new ClassVisitor(Opcodes.ASM9) {
            @Override
            public MethodVisitor visitMethod(int access, String name, String descriptor, String signature, String[] exceptions) {
                if (name.startsWith("<") || (access & (Opcodes.ACC_SYNTHETIC | Opcodes.ACC_BRIDGE)) != 0) {
                    return null;
                }
                // Overloads share a name, the earliest line wins.
                MethodLine methodLine = methods.computeIfAbsent(name, k -> new MethodLine());
                return new MethodVisitor(Opcodes.ASM9) {
                    @Override
                    public void visitLineNumber(int line, Label start) {
                        methodLine.line = Math.min(methodLine.line, line);
                    }
                };
            }
        }, ClassReader.SKIP_FRAMES);

        Map<String, Integer> methodLines = new LinkedHashMap<>();
        for (Map.Entry<String, MethodLine> entry : methods.entrySet()) {
            methodLines.put(entry.getKey(), entry.getValue().line);
        }
        return new ClassInfo(simpleName, methodLines);
    }

    private ClassReader readClass(String moduleName, String internalName) throws ModuleNotFoundException {
        String resource = internalName + ".class";
        try (InputStream stream = this.classLoader.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new ModuleNotFoundException(moduleName, "No module named '" + moduleName + "': " + resource + " not found.");
            }
            return new ClassReader(stream);
        } catch (IOException e) {
            throw new ModuleNotFoundException(moduleName, "Module '" + moduleName + "' could not be read: " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return this.getClass().getName() + " { class loader: " + this.classLoader + " }";
    }

    private static final class MethodLine {
        private int line = ClassInfo.UNKNOWN_LINE;
    }
}
