package com.architecture.memory.graphexport.service.analyzer;

import com.architecture.memory.graphexport.dto.AnalysisRequest;
import com.architecture.memory.graphexport.exception.CodeAnalysisException;
import com.architecture.memory.graphexport.model.graph.CodeNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import spoon.Launcher;
import spoon.reflect.CtModel;
import spoon.reflect.code.CtInvocation;
import spoon.reflect.declaration.CtClass;
import spoon.reflect.declaration.CtConstructor;
import spoon.reflect.declaration.CtElement;
import spoon.reflect.declaration.CtExecutable;
import spoon.reflect.declaration.CtField;
import spoon.reflect.declaration.CtMethod;
import spoon.reflect.declaration.CtModifiable;
import spoon.reflect.declaration.CtParameter;
import spoon.reflect.declaration.CtType;
import spoon.reflect.reference.CtExecutableReference;
import spoon.reflect.reference.CtTypeReference;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileVisitOption;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds a code graph from Java sources with Spoon.
 *
 * Two passes:
 *   Pass 1 - STRUCTURE: one CompilationUnit node per source file with its types, members,
 *            parameters and invocations as structural children.
 *   Pass 2 - LINK: semantic edges (EXTENDS, IMPLEMENTS, INVOKES, TYPE_OF, RETURNS) between
 *            nodes created in pass 1. Targets outside the analyzed sources get no edge.
 *
 * One root is returned per source file per input location, so overlapping locations
 * (a directory and a file inside it) yield the same root more than once.
 */
@Service
@Slf4j
public class SpoonGraphAnalyzer {

    public static final String EXTENDS = "EXTENDS";
    public static final String IMPLEMENTS = "IMPLEMENTS";
    public static final String INVOKES = "INVOKES";
    public static final String TYPE_OF = "TYPE_OF";
    public static final String RETURNS = "RETURNS";

    private static final int COMPLIANCE_LEVEL = 17;

    // ========================= PUBLIC API =========================

    public List<CodeNode> analyze(AnalysisRequest request) {
        log.info("[spoon-analyzer] Starting analysis of {} location(s) under {}",
                request.getSourceLocations().size(), request.getTopLevel());

        Map<Path, List<Path>> filesByLocation = new LinkedHashMap<>();
        for (Path location : request.getSourceLocations()) {
            filesByLocation.put(location, listJavaFiles(location));
        }
        if (request.isLoadIncludes()) {
            for (Path include : existing(request.getIncludePaths())) {
                filesByLocation.putIfAbsent(include, listJavaFiles(include));
            }
        }

        Set<Path> allFiles = filesByLocation.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (allFiles.isEmpty()) {
            log.warn("[spoon-analyzer] No Java sources found");
            return List.of();
        }

        CtModel model = buildSpoonModel(allFiles, request);
        GraphIndex index = new GraphIndex();

        // PASS 1: structure
        for (CtType<?> ctType : model.getAllTypes()) {
            Path file = safeGetFilePath(ctType);
            if (file == null) {
                continue;
            }
            CodeNode unit = index.units.computeIfAbsent(file, this::compilationUnitNode);
            unit.addChild(typeNode(ctType, index));
        }

        // PASS 2: semantic edges
        link(index);

        List<CodeNode> roots = new ArrayList<>();
        filesByLocation.values().forEach(files -> files.stream()
                .map(index.units::get)
                .filter(Objects::nonNull)
                .forEach(roots::add));

        log.info("[spoon-analyzer] Analysis complete: units={}, types={}, executables={}, roots={}",
                index.units.size(), index.types.size(), index.executables.size(), roots.size());
        return roots;
    }

    // ========================= SPOON MODEL =========================

    private CtModel buildSpoonModel(Set<Path> files, AnalysisRequest request) {
        Launcher launcher = new Launcher();
        files.forEach(file -> launcher.addInputResource(file.toString()));
        launcher.getEnvironment().setNoClasspath(true);
        launcher.getEnvironment().setComplianceLevel(COMPLIANCE_LEVEL);
        launcher.getEnvironment().setIgnoreDuplicateDeclarations(true);
        launcher.getEnvironment().setCommentEnabled(false);

        if (!request.isLoadIncludes()) {
            String[] classpath = existing(request.getIncludePaths()).stream()
                    .map(Path::toString)
                    .toArray(String[]::new);
            if (classpath.length > 0) {
                launcher.getEnvironment().setSourceClasspath(classpath);
            }
        }

        try {
            return launcher.buildModel();
        } catch (RuntimeException ex) {
            throw new CodeAnalysisException("Spoon could not build a model of " + request.getTopLevel(), ex);
        }
    }

    // Spoon records real file paths, so units and roots are keyed by the real path too
    private List<Path> listJavaFiles(Path location) {
        try {
            Path realLocation = location.toRealPath();
            if (Files.isRegularFile(realLocation)) {
                return realLocation.toString().endsWith(".java") ? List.of(realLocation) : List.of();
            }
            try (Stream<Path> paths = Files.walk(realLocation, FileVisitOption.FOLLOW_LINKS)) {
                return paths.filter(Files::isRegularFile)
                        .filter(path -> path.toString().endsWith(".java"))
                        .map(this::toRealPath)
                        .distinct()
                        .sorted(Comparator.naturalOrder())
                        .collect(Collectors.toList());
            }
        } catch (IOException | UncheckedIOException ex) {
            throw new CodeAnalysisException("Cannot list sources under " + location, ex);
        }
    }

    private Path toRealPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private List<Path> existing(List<Path> paths) {
        List<Path> result = new ArrayList<>();
        for (Path path : paths) {
            if (Files.exists(path)) {
                result.add(path);
            } else {
                log.warn("[spoon-analyzer] Skipping missing include path: {}", path);
            }
        }
        return result;
    }

    // ========================= PASS 1: STRUCTURE =========================

    private CodeNode compilationUnitNode(Path file) {
        return CodeNode.builder()
                .id("unit:" + file)
                .kind("CompilationUnit")
                .name(file.getFileName().toString())
                .build()
                .property("file", file.toString());
    }

    private CodeNode typeNode(CtType<?> ctType, GraphIndex index) {
        String qualifiedName = ctType.getQualifiedName();
        CodeNode node = CodeNode.builder()
                .id("type:" + qualifiedName)
                .kind(typeKind(ctType))
                .name(ctType.getSimpleName())
                .build()
                .property("qualifiedName", qualifiedName)
                .property("lineStart", safeGetLine(ctType))
                .property("lineEnd", safeGetEndLine(ctType));
        addModifiers(node, ctType);
        index.types.put(qualifiedName, node);
        index.typeElements.put(node, ctType);

        for (CtField<?> field : ctType.getFields()) {
            CodeNode fieldNode = CodeNode.builder()
                    .id("field:" + qualifiedName + "." + field.getSimpleName())
                    .kind("Field")
                    .name(field.getSimpleName())
                    .build()
                    .property("type", typeName(field.getType()))
                    .property("lineStart", safeGetLine(field));
            addModifiers(fieldNode, field);
            index.typedNodes.put(fieldNode, field.getType());
            node.addChild(fieldNode);
        }

        if (ctType instanceof CtClass<?> ctClass) {
            for (CtConstructor<?> constructor : ctClass.getConstructors()) {
                if (!constructor.isImplicit()) {
                    node.addChild(executableNode(qualifiedName, constructor, "Constructor", index));
                }
            }
        }

        ctType.getMethods().stream()
                .sorted(Comparator.comparing(CtMethod::getSignature))
                .forEach(method -> {
                    CodeNode methodNode = executableNode(qualifiedName, method, "Method", index);
                    index.typedNodes.put(methodNode, method.getType());
                    node.addChild(methodNode);
                });

        ctType.getNestedTypes().stream()
                .sorted(Comparator.comparing(CtType::getQualifiedName))
                .forEach(nested -> node.addChild(typeNode(nested, index)));

        return node;
    }

    private CodeNode executableNode(String ownerName, CtExecutable<?> executable, String kind, GraphIndex index) {
        String signature = executable.getSignature();
        String id = "executable:" + ownerName + "#" + signature;
        CodeNode node = CodeNode.builder()
                .id(id)
                .kind(kind)
                .name(executable.getSimpleName())
                .build()
                .property("signature", signature)
                .property("lineStart", safeGetLine(executable))
                .property("lineEnd", safeGetEndLine(executable));
        if (executable instanceof CtModifiable modifiable) {
            addModifiers(node, modifiable);
        }
        index.executables.put(ownerName + "#" + signature, node);

        List<CtParameter<?>> parameters = executable.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            CtParameter<?> parameter = parameters.get(i);
            CodeNode parameterNode = CodeNode.builder()
                    .id(id + "/param:" + i)
                    .kind("Parameter")
                    .name(parameter.getSimpleName())
                    .build()
                    .property("index", i)
                    .property("type", typeName(parameter.getType()));
            index.typedNodes.put(parameterNode, parameter.getType());
            node.addChild(parameterNode);
        }

        List<CtElement> invocations = executable.getElements(e -> e instanceof CtInvocation);
        int ordinal = 0;
        for (CtElement element : invocations) {
            CtInvocation<?> invocation = (CtInvocation<?>) element;
            CtExecutableReference<?> execRef = invocation.getExecutable();
            if (execRef == null) {
                continue;
            }
            CodeNode invocationNode = CodeNode.builder()
                    .id(id + "/call:" + ordinal++)
                    .kind("Invocation")
                    .name(execRef.getSimpleName())
                    .build()
                    .property("line", safeGetLine(invocation))
                    .property("target", targetKey(execRef));
            index.invocations.put(invocationNode, execRef);
            node.addChild(invocationNode);
        }
        return node;
    }

    private String typeKind(CtType<?> ctType) {
        if (ctType.isAnnotationType()) return "Annotation";
        if (ctType.isEnum()) return "Enum";
        if (ctType.isInterface()) return "Interface";
        return "Class";
    }

    private void addModifiers(CodeNode node, CtModifiable element) {
        List<String> modifiers = element.getModifiers().stream()
                .map(modifier -> modifier.toString())
                .sorted()
                .collect(Collectors.toList());
        if (!modifiers.isEmpty()) {
            node.property("modifiers", modifiers);
        }
    }

    // ========================= PASS 2: LINK =========================

    private void link(GraphIndex index) {
        int unresolved = 0;

        for (Map.Entry<CodeNode, CtType<?>> entry : index.typeElements.entrySet()) {
            CtType<?> ctType = entry.getValue();
            CodeNode superclass = index.type(ctType.getSuperclass());
            if (superclass != null) {
                entry.getKey().addEdge(EXTENDS, superclass);
            }
            for (CtTypeReference<?> superInterface : ctType.getSuperInterfaces()) {
                CodeNode target = index.type(superInterface);
                if (target != null) {
                    entry.getKey().addEdge(ctType.isInterface() ? EXTENDS : IMPLEMENTS, target);
                }
            }
        }

        for (Map.Entry<CodeNode, CtTypeReference<?>> entry : index.typedNodes.entrySet()) {
            CodeNode target = index.type(entry.getValue());
            if (target != null) {
                String type = "Method".equals(entry.getKey().getKind()) ? RETURNS : TYPE_OF;
                entry.getKey().addEdge(type, target);
            }
        }

        for (Map.Entry<CodeNode, CtExecutableReference<?>> entry : index.invocations.entrySet()) {
            CodeNode target = index.executables.get(targetKey(entry.getValue()));
            if (target != null) {
                entry.getKey().addEdge(INVOKES, target);
            } else {
                unresolved++;
            }
        }

        log.debug("[spoon-analyzer] Linked graph, {} invocation(s) point outside the analyzed sources", unresolved);
    }

    private String targetKey(CtExecutableReference<?> execRef) {
        CtTypeReference<?> declaringType = execRef.getDeclaringType();
        String owner = declaringType != null ? declaringType.getQualifiedName() : "?";
        return owner + "#" + safeGetSignature(execRef);
    }

    // ========================= HELPERS =========================

    private String typeName(CtTypeReference<?> reference) {
        return reference != null ? reference.getQualifiedName() : null;
    }

    private String safeGetSignature(CtExecutableReference<?> execRef) {
        try { return execRef.getSignature(); } catch (Exception e) { return execRef.getSimpleName() + "(?)"; }
    }

    private int safeGetLine(CtElement element) {
        try { return element.getPosition().getLine(); } catch (Exception e) { return 0; }
    }

    private int safeGetEndLine(CtElement element) {
        try { return element.getPosition().getEndLine(); } catch (Exception e) { return 0; }
    }

    private Path safeGetFilePath(CtElement element) {
        try { return element.getPosition().getFile().toPath().toRealPath(); } catch (Exception e) { return null; }
    }

    /**
     * Lookup tables shared by both passes of one analysis.
     */
    private static final class GraphIndex {
        private final Map<Path, CodeNode> units = new LinkedHashMap<>();
        private final Map<String, CodeNode> types = new HashMap<>();
        private final Map<String, CodeNode> executables = new HashMap<>();
        private final Map<CodeNode, CtType<?>> typeElements = new LinkedHashMap<>();
        private final Map<CodeNode, CtTypeReference<?>> typedNodes = new LinkedHashMap<>();
        private final Map<CodeNode, CtExecutableReference<?>> invocations = new LinkedHashMap<>();

        private CodeNode type(CtTypeReference<?> reference) {
            if (reference == null) {
                return null;
            }
            return types.get(reference.getQualifiedName());
        }
    }
}
