package com.cubyte.ecs.processor;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.ProcessingEnvironment;
import javax.lang.model.element.*;
import javax.lang.model.util.Elements;
import javax.lang.model.util.Types;
import javax.tools.Diagnostic;
import java.util.*;

/**
 * Shared base annotation processor: messaging and annotation mirror helpers.
 */
public abstract class BaseProcessor extends AbstractProcessor {
    protected Elements elementUtils;
    protected Types typeUtils;

    @Override
    public synchronized void init(ProcessingEnvironment processingEnv) {
        super.init(processingEnv);
        this.elementUtils = processingEnv.getElementUtils();
        this.typeUtils = processingEnv.getTypeUtils();
    }

    // ---------------------------------------------------------------------
    // Messaging helpers
    // ---------------------------------------------------------------------
    protected void error(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.ERROR,
                String.format(Locale.ROOT, fmt, args));
    }
    protected void warning(Element element, String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.WARNING,
                String.format(Locale.ROOT, fmt, args), element);
    }
    protected void note(String fmt, Object... args) {
        processingEnv.getMessager().printMessage(Diagnostic.Kind.NOTE,
                String.format(Locale.ROOT, fmt, args));
    }

    // ---------------------------------------------------------------------
    // Element helpers
    // ---------------------------------------------------------------------
    protected TypeElement getTypeElement(String fqn) {
        return elementUtils.getTypeElement(fqn);
    }

    // ---------------------------------------------------------------------
    // Annotation mirror utilities (static for easy import)
    // ---------------------------------------------------------------------
    public static boolean hasAnnotation(Element e, String fqn) {
        return getAnnotation(e, fqn) != null;
    }
    public static AnnotationMirror getAnnotation(Element e, String fqn) {
        for (AnnotationMirror am : e.getAnnotationMirrors()) {
            if (((TypeElement) am.getAnnotationType().asElement()).getQualifiedName().contentEquals(fqn)) return am;
        }
        return null;
    }
    public static String readString(AnnotationMirror am, String name) {
        AnnotationValue value = readValue(am, name);
        return value == null ? null : String.valueOf(value.getValue());
    }
    public static int readInt(AnnotationMirror am, String name, int defaultValue) {
        AnnotationValue value = readValue(am, name);
        return value != null && value.getValue() instanceof Number n ? n.intValue() : defaultValue;
    }
    public static String readEnumConst(AnnotationMirror am, String name) {
        AnnotationValue value = readValue(am, name);
        if (value == null) return null;
        String s = value.getValue().toString();
        return s.substring(s.lastIndexOf('.') + 1);
    }
    private static AnnotationValue readValue(AnnotationMirror am, String name) {
        if (am == null) return null;
        for (Map.Entry<? extends ExecutableElement, ? extends AnnotationValue> e : am.getElementValues().entrySet()) {
            if (e.getKey().getSimpleName().contentEquals(name)) return e.getValue();
        }
        return null;
    }
}
