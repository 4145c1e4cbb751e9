package com.cubyte.ecs;

import com.cubyte.ecs.core.WorldTest;
import com.cubyte.ecs.core.command.CommandBufferTest;
import com.cubyte.ecs.core.component.ComponentMaskTest;
import com.cubyte.ecs.core.component.ComponentStorageTest;
import com.cubyte.ecs.core.data.PackTest;
import com.cubyte.ecs.core.data.PackageJsonTest;
import com.cubyte.ecs.core.entity.EntityManagerTest;
import com.cubyte.ecs.core.query.QueryTest;
import com.cubyte.ecs.core.reflection.ConstructibleTraitTest;
import com.cubyte.ecs.core.reflection.TypeRegistryTest;
import com.cubyte.ecs.core.resource.ResourceManagerTest;
import org.junit.platform.suite.api.SelectClasses;
import org.junit.platform.suite.api.Suite;
import org.junit.platform.suite.api.SuiteDisplayName;

/**
 * Every core test, grouped for running from an IDE.
 */
@Suite
@SuiteDisplayName("ECS Core Test Suite")
@SelectClasses({
        // Reflection and storage
        ConstructibleTraitTest.class,
        TypeRegistryTest.class,
        ComponentMaskTest.class,
        ComponentStorageTest.class,
        EntityManagerTest.class,
        ResourceManagerTest.class,

        // World surface
        WorldTest.class,
        QueryTest.class,
        CommandBufferTest.class,
        PackTest.class,
        PackageJsonTest.class,
        WorldConfigTest.class,
        ECSTest.class
})
public class CoreTestSuite {
}
