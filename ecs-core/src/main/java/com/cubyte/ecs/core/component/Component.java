package com.cubyte.ecs.core.component;

import java.lang.annotation.*;

/**
 * Marker interface for component types.
 * <p>
 * Implementing it is optional for registration: any class or record can be stored in a world.
 * It is required for the compile-time processor to pick up a type and pre-build its trait.
 */
public interface Component {

    /**
     * Overrides the name a component type is packed under (defaults to the simple class name).
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    @interface Name {
        String value();
    }

    /**
     * Annotation to mark a field as a component field with layout information.
     * When a type declares at least one annotated field, only annotated fields are reflected.
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.FIELD)
    @interface Field {
        /**
         * Size in bytes (0 means auto-detect from type)
         */
        int size() default 0;

        /**
         * Explicit offset position in bytes (-1 means auto-layout)
         */
        int offset() default -1;

        /**
         * Alignment requirement in bytes (0 means natural alignment)
         */
        int alignment() default 0;
    }

    /**
     * Annotation to specify the overall component layout
     */
    @Retention(RetentionPolicy.RUNTIME)
    @Target(ElementType.TYPE)
    @interface Layout {
        /**
         * Layout strategy: SEQUENTIAL (packed), PADDING (aligned) or EXPLICIT (field offsets)
         */
        LayoutType value() default LayoutType.SEQUENTIAL;

        /**
         * Total size override (-1 means auto-calculate)
         */
        int size() default -1;

        /**
         * Alignment override (0 means the largest field alignment, or 1 for SEQUENTIAL)
         */
        int alignment() default 0;
    }

    enum LayoutType {
        SEQUENTIAL,  // Pack fields sequentially
        PADDING,     // Add padding for alignment
        EXPLICIT     // Use explicit offsets
    }
}
