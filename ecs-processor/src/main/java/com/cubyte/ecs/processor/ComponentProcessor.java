package com.cubyte.ecs.processor;

import com.google.auto.service.AutoService;

import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.annotation.processing.SupportedAnnotationTypes;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.*;
import javax.lang.model.type.DeclaredType;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.tools.JavaFileObject;
import java.io.IOException;
import java.io.Writer;
import java.util.*;

/**
 * Annotation processor that generates, for every component type:
 * - a {@code <Component>Meta} class with NAME, SIZE, ALIGNMENT and a prebuilt ConstructibleTrait (TRAIT)
 * Also generates a central registry com.cubyte.ecs.generated.GeneratedComponents
 * with registerAll(World) for quick startup registration.
 * <p>
 * Sizes follow the same SEQUENTIAL / PADDING / EXPLICIT rules the runtime type registry applies,
 * so a generated trait and a reflected one agree.
 */
@AutoService(Processor.class)
@SupportedAnnotationTypes({
        "com.cubyte.ecs.core.component.Component.Field",
        "com.cubyte.ecs.core.component.Component.Layout",
})
public class ComponentProcessor extends BaseProcessor {
    // ---------------------------------------------------------------------
    // Constants
    // ---------------------------------------------------------------------
    private static final String ANNO_LAYOUT = "com.cubyte.ecs.core.component.Component.Layout";
    private static final String ANNO_FIELD = "com.cubyte.ecs.core.component.Component.Field";
    private static final String ANNO_NAME = "com.cubyte.ecs.core.component.Component.Name";
    private static final String COMPONENT_IFACE = "com.cubyte.ecs.core.component.Component";
    private static final String ENTITY = "com.cubyte.ecs.core.entity.Entity";
    private static final String TRAIT = "com.cubyte.ecs.core.reflection.ConstructibleTrait";
    private static final String REGISTRY_TYPES = "com.cubyte.ecs.core.reflection.TypeRegistry";
    private static final String WORLD = "com.cubyte.ecs.core.World";
    private static final String REGISTRY_PACKAGE = "com.cubyte.ecs.generated";
    private static final String REGISTRY_NAME = "GeneratedComponents";

    // Accumulate discovered component types to generate a central registry (FQNs)
    private final Set<String> collectedComponents = new LinkedHashSet<>();
    // Computed layouts, keyed by type FQN
    private final Map<String, LocalLayout> layouts = new HashMap<>();
    // Types whose layout is being computed; a self reference is laid out as an opaque reference
    private final Set<String> inProgress = new HashSet<>();

    @Override
    public SourceVersion getSupportedSourceVersion() {
        return SourceVersion.latestSupported();
    }

    @Override
    public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
        Set<TypeElement> candidates = collectCandidateComponentTypes(roundEnv);
        if (!candidates.isEmpty()) {
            note("Found %d candidate component types", candidates.size());
        }
        for (TypeElement compType : candidates) {
            String fqn = compType.getQualifiedName().toString();
            if (collectedComponents.contains(fqn)) continue;
            try {
                generateMetaSource(compType, layoutOf(compType));
                collectedComponents.add(fqn);
            } catch (IOException ex) {
                error("Failed to generate meta for %s: %s", fqn, ex.getMessage());
            }
        }
        if (roundEnv.processingOver() && !collectedComponents.isEmpty()) {
            try {
                generateCentralRegistry();
            } catch (IOException ex) {
                error("Failed to generate central registry: %s", ex.getMessage());
            }
        }
        return false;
    }

    // ---------------------------------------------------------------------
    // Candidate discovery
    // ---------------------------------------------------------------------
    private Set<TypeElement> collectCandidateComponentTypes(RoundEnvironment roundEnv) {
        Set<TypeElement> owners = new LinkedHashSet<>();
        TypeElement layoutAnno = getTypeElement(ANNO_LAYOUT);
        TypeElement fieldAnno = getTypeElement(ANNO_FIELD);
        if (layoutAnno != null) {
            for (Element e : roundEnv.getElementsAnnotatedWith(layoutAnno)) {
                if (e instanceof TypeElement te) owners.add(te);
            }
        }
        if (fieldAnno != null) {
            for (Element e : roundEnv.getElementsAnnotatedWith(fieldAnno)) {
                if (e.getEnclosingElement() instanceof TypeElement te) owners.add(te);
            }
        }

        TypeElement componentInterface = getTypeElement(COMPONENT_IFACE);
        Set<TypeElement> result = new LinkedHashSet<>();
        for (TypeElement owner : owners) {
            if (componentInterface == null
                    || !typeUtils.isAssignable(typeUtils.erasure(owner.asType()), typeUtils.erasure(componentInterface.asType()))) {
                continue;
            }
            if (owner.getKind() != ElementKind.CLASS && owner.getKind() != ElementKind.RECORD) {
                warning(owner, "Only classes and records get generated component metadata");
                continue;
            }
            if (owner.getNestingKind() != NestingKind.TOP_LEVEL) {
                warning(owner, "Nested component %s is registered through reflection", owner.getQualifiedName());
                continue;
            }
            result.add(owner);
        }
        return result;
    }

    // ---------------------------------------------------------------------
    // Layout computation
    // ---------------------------------------------------------------------
    private LocalLayout layoutOf(TypeElement type) {
        String fqn = type.getQualifiedName().toString();
        LocalLayout cached = layouts.get(fqn);
        if (cached != null) return cached;

        AnnotationMirror layoutAnno = getAnnotation(type, ANNO_LAYOUT);
        LayoutType layoutType = LayoutType.PADDING;
        if (layoutAnno != null) {
            String kind = readEnumConst(layoutAnno, "value");
            layoutType = kind != null ? LayoutType.valueOf(kind) : LayoutType.SEQUENTIAL;
        }

        inProgress.add(fqn);
        try {
            List<VariableElement> fields = instanceFields(type);
            boolean annotatedOnly = fields.stream().anyMatch(f -> hasAnnotation(f, ANNO_FIELD));
            if (annotatedOnly) {
                fields.removeIf(f -> !hasAnnotation(f, ANNO_FIELD));
            }
            if (layoutType == LayoutType.EXPLICIT) {
                fields.sort(Comparator.comparingInt(ComponentProcessor::explicitOffset));
            }

            List<GeneratedField> out = new ArrayList<>();
            long currentOffset = 0L;
            long end = 0L;
            int maxAlignment = 1;
            for (VariableElement ve : fields) {
                AnnotationMirror fieldAnno = getAnnotation(ve, ANNO_FIELD);
                long naturalSize;
                int naturalAlignment;
                FieldType ft = classify(ve.asType());
                if (ft == FieldType.COMPOSITE) {
                    TypeElement nested = (TypeElement) typeUtils.asElement(ve.asType());
                    LocalLayout sub = layoutOf(nested);
                    naturalSize = sub.size();
                    naturalAlignment = sub.alignment();
                } else {
                    naturalSize = ft.size;
                    naturalAlignment = ft.naturalAlignment;
                }
                int sizeAttr = readInt(fieldAnno, "size", 0);
                int alignAttr = readInt(fieldAnno, "alignment", 0);
                int offsetAttr = readInt(fieldAnno, "offset", -1);
                long size = sizeAttr > 0 ? sizeAttr : naturalSize;
                int alignment = alignAttr > 0 ? alignAttr : naturalAlignment;

                long offset;
                if (layoutType == LayoutType.EXPLICIT && fieldAnno != null && offsetAttr >= 0) {
                    offset = offsetAttr;
                } else if (layoutType == LayoutType.SEQUENTIAL) {
                    offset = currentOffset;
                } else {
                    offset = alignUp(currentOffset, alignment);
                }
                out.add(new GeneratedField(ve.getSimpleName().toString(), ft, offset, size, alignment));
                currentOffset = offset + size;
                end = Math.max(end, currentOffset);
                maxAlignment = Math.max(maxAlignment, alignment);
            }

            int alignOverride = readInt(layoutAnno, "alignment", 0);
            int sizeOverride = readInt(layoutAnno, "size", -1);
            int alignment = alignOverride > 0 ? alignOverride
                    : layoutType == LayoutType.SEQUENTIAL ? 1 : maxAlignment;
            long size = sizeOverride > 0 ? sizeOverride
                    : layoutType == LayoutType.SEQUENTIAL ? end : alignUp(end, alignment);

            LocalLayout layout = new LocalLayout(out, size, alignment);
            layouts.put(fqn, layout);
            return layout;
        } finally {
            inProgress.remove(fqn);
        }
    }

    // Superclass fields first; a field shadowed by a subclass is left out
    private List<VariableElement> instanceFields(TypeElement type) {
        List<VariableElement> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (TypeElement c = type; c != null && isUserType(c); c = superclassOf(c)) {
            List<VariableElement> declared = new ArrayList<>();
            for (Element e : c.getEnclosedElements()) {
                if (e.getKind() != ElementKind.FIELD) continue;
                Set<Modifier> modifiers = e.getModifiers();
                if (modifiers.contains(Modifier.STATIC) || modifiers.contains(Modifier.TRANSIENT)) continue;
                if (seen.add(e.getSimpleName().toString())) {
                    declared.add((VariableElement) e);
                }
            }
            out.addAll(0, declared);
        }
        return out;
    }

    private TypeElement superclassOf(TypeElement type) {
        TypeMirror superclass = type.getSuperclass();
        return superclass.getKind() == TypeKind.DECLARED ? (TypeElement) typeUtils.asElement(superclass) : null;
    }

    // Classes of named modules (the platform) are opaque, as for the runtime registry
    private boolean isUserType(TypeElement type) {
        if (type.getQualifiedName().contentEquals("java.lang.Object")) return false;
        ModuleElement module = elementUtils.getModuleOf(type);
        return module == null || module.isUnnamed();
    }

    private static int explicitOffset(VariableElement field) {
        int offset = readInt(getAnnotation(field, ANNO_FIELD), "offset", -1);
        return offset >= 0 ? offset : Integer.MAX_VALUE;
    }

    private FieldType classify(TypeMirror type) {
        switch (type.getKind()) {
            case BYTE: return FieldType.BYTE;
            case SHORT: return FieldType.SHORT;
            case INT: return FieldType.INT;
            case LONG: return FieldType.LONG;
            case FLOAT: return FieldType.FLOAT;
            case DOUBLE: return FieldType.DOUBLE;
            case BOOLEAN: return FieldType.BOOLEAN;
            case CHAR: return FieldType.CHAR;
            case DECLARED: break;
            default: return FieldType.OBJECT;
        }
        TypeElement element = (TypeElement) ((DeclaredType) type).asElement();
        String fqn = element.getQualifiedName().toString();
        switch (fqn) {
            case "java.lang.Byte": return FieldType.BYTE;
            case "java.lang.Short": return FieldType.SHORT;
            case "java.lang.Integer": return FieldType.INT;
            case "java.lang.Long": return FieldType.LONG;
            case "java.lang.Float": return FieldType.FLOAT;
            case "java.lang.Double": return FieldType.DOUBLE;
            case "java.lang.Boolean": return FieldType.BOOLEAN;
            case "java.lang.Character": return FieldType.CHAR;
            case "java.lang.String": return FieldType.STRING;
            case ENTITY: return FieldType.ENTITY;
            default: break;
        }
        if (element.getKind() == ElementKind.ENUM) return FieldType.ENUM;
        boolean composite = element.getKind() == ElementKind.RECORD || (element.getKind() == ElementKind.CLASS
                && typeUtils.isAssignable(typeUtils.erasure(type), typeUtils.erasure(getTypeElement(COMPONENT_IFACE).asType())));
        if (composite && !inProgress.contains(fqn)) return FieldType.COMPOSITE;
        return FieldType.OBJECT;
    }

    // ---------------------------------------------------------------------
    // Source generation
    // ---------------------------------------------------------------------
    private void generateMetaSource(TypeElement compType, LocalLayout layout) throws IOException {
        String pkg = elementUtils.getPackageOf(compType).getQualifiedName().toString();
        String simpleName = compType.getSimpleName().toString();
        String metaName = simpleName + "Meta";
        String fqn = pkg.isEmpty() ? metaName : pkg + "." + metaName;
        String compFqn = compType.getQualifiedName().toString();
        String name = readString(getAnnotation(compType, ANNO_NAME), "value");
        if (name == null) name = simpleName;

        JavaFileObject file = processingEnv.getFiler().createSourceFile(fqn, compType);
        try (Writer w = file.openWriter()) {
            if (!pkg.isEmpty()) w.write("package " + pkg + ";\n\n");
            w.write("@SuppressWarnings(\"all\")\n");
            w.write("public final class " + metaName + " {\n");
            w.write("    public static final String NAME = \"" + escape(name) + "\";\n");
            w.write("    public static final long SIZE = " + layout.size() + "L;\n");
            w.write("    public static final int ALIGNMENT = " + layout.alignment() + ";\n");
            for (GeneratedField f : layout.fields()) {
                w.write("    public static final long OFFSET_" + f.name.toUpperCase(Locale.ROOT) + " = " + f.offset + "L;\n");
            }
            w.write("\n");

            String destructor = isAutoCloseable(compType)
                    ? TRAIT + ".<" + compFqn + ">closeDestructor()"
                    : TRAIT + ".<" + compFqn + ">noDestructor()";
            w.write("    public static final " + TRAIT + "<" + compFqn + "> TRAIT =\n");
            w.write("        new " + TRAIT + "<" + compFqn + ">(" + compFqn + ".class, SIZE, ALIGNMENT, " + destructor + ")");
            String defaultConstructor = defaultConstructorExpression(compType, layout);
            if (defaultConstructor != null) {
                w.write("\n            .withDefaultConstructor(" + defaultConstructor + ")");
            }
            if (compType.getKind() == ElementKind.RECORD) {
                w.write("\n            .withCopyConstructor(java.util.function.UnaryOperator.identity())");
            } else if (hasConstructor(compType, compType.asType())) {
                w.write("\n            .withCopyConstructor(other -> new " + compFqn + "(other))");
            } else if (defaultConstructor != null) {
                w.write("\n            .withCopyConstructor(" + REGISTRY_TYPES + ".fieldwiseCopy(" + compFqn + ".class, "
                        + defaultConstructor + "))");
            }
            w.write("\n            .withMoveConstructor(java.util.function.UnaryOperator.identity());\n\n");

            w.write("    private " + metaName + "() {}\n");
            w.write("}\n");
        }
    }

    private void generateCentralRegistry() throws IOException {
        String fqn = REGISTRY_PACKAGE + "." + REGISTRY_NAME;
        JavaFileObject file = processingEnv.getFiler().createSourceFile(fqn);
        try (Writer w = file.openWriter()) {
            w.write("package " + REGISTRY_PACKAGE + ";\n\n");
            w.write("@SuppressWarnings(\"all\")\n");
            w.write("public final class " + REGISTRY_NAME + " {\n");
            w.write("    private " + REGISTRY_NAME + "() {}\n\n");
            w.write("    public static void registerAll(" + WORLD + " world) {\n");
            for (String fqnComp : collectedComponents) {
                w.write("        if (world.componentTypeId(" + fqnComp + ".class) == null) {\n");
                w.write("            world.registerComponent(" + fqnComp + ".class);\n");
                w.write("        }\n");
            }
            w.write("    }\n");
            w.write("}\n");
        }
    }

    private String defaultConstructorExpression(TypeElement compType, LocalLayout layout) {
        if (compType.getModifiers().contains(Modifier.ABSTRACT)) return null;
        String compFqn = compType.getQualifiedName().toString();
        if (compType.getKind() == ElementKind.RECORD) {
            StringJoiner args = new StringJoiner(", ");
            for (Element e : compType.getEnclosedElements()) {
                if (e.getKind() == ElementKind.FIELD && !e.getModifiers().contains(Modifier.STATIC)) {
                    args.add(zeroLiteral(e.asType()));
                }
            }
            return "() -> new " + compFqn + "(" + args + ")";
        }
        return hasConstructor(compType) ? "() -> new " + compFqn + "()" : null;
    }

    // Non-private constructor with exactly these parameter types
    private boolean hasConstructor(TypeElement type, TypeMirror... parameterTypes) {
        for (Element e : type.getEnclosedElements()) {
            if (e.getKind() != ElementKind.CONSTRUCTOR || e.getModifiers().contains(Modifier.PRIVATE)) continue;
            List<? extends VariableElement> params = ((ExecutableElement) e).getParameters();
            if (params.size() != parameterTypes.length) continue;
            boolean same = true;
            for (int i = 0; i < params.size() && same; i++) {
                same = typeUtils.isSameType(typeUtils.erasure(params.get(i).asType()), typeUtils.erasure(parameterTypes[i]));
            }
            if (same) return true;
        }
        return false;
    }

    private boolean isAutoCloseable(TypeElement type) {
        TypeElement closeable = getTypeElement("java.lang.AutoCloseable");
        return closeable != null && typeUtils.isAssignable(typeUtils.erasure(type.asType()), closeable.asType());
    }

    private static String zeroLiteral(TypeMirror type) {
        TypeKind kind = type.getKind();
        switch (kind) {
            case BOOLEAN: return "false";
            case CHAR: return "'\\0'";
            case BYTE: return "(byte) 0";
            case SHORT: return "(short) 0";
            case INT: return "0";
            case LONG: return "0L";
            case FLOAT: return "0f";
            case DOUBLE: return "0d";
            default: return "null";
        }
    }

    private static String escape(String s) {
        return s.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    private static long alignUp(long value, int alignment) {
        return ((value + alignment - 1L) / alignment) * alignment;
    }

    // ---------------------------------------------------------------------
    // Internal data structures
    // ---------------------------------------------------------------------
    private enum LayoutType { SEQUENTIAL, PADDING, EXPLICIT }

    private enum FieldType {
        BYTE(1, 1), SHORT(2, 2), INT(4, 4), LONG(8, 8), FLOAT(4, 4), DOUBLE(8, 8), BOOLEAN(1, 1), CHAR(2, 2),
        STRING(8, 8), ENUM(4, 4), ENTITY(8, 4), COMPOSITE(0, 1), OBJECT(8, 8);
        final long size; final int naturalAlignment;
        FieldType(long sz, int na) { this.size = sz; this.naturalAlignment = na; }
    }

    private static final class GeneratedField {
        final String name; final FieldType ft; final long offset; final long size; final int alignment;
        GeneratedField(String n, FieldType ft, long off, long sz, int a) { this.name = n; this.ft = ft; this.offset = off; this.size = sz; this.alignment = a; }
    }

    private record LocalLayout(List<GeneratedField> fields, long size, int alignment) {}
}
