package io.buildeval.core;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/**
 * Layering of the core module: the XML object model and the error types sit below evaluation,
 * and nothing in core knows about the command-line front end.
 */
@AnalyzeClasses(
        packages = "io.buildeval.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class CoreArchitectureTest {

    @ArchTest
    static final ArchRule noStandaloneDependencies = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.buildeval.standalone..")
            .because("the core library must be usable without the command-line front end");

    @ArchTest
    static final ArchRule constructionBelowEvaluation = noClasses()
            .that()
            .resideInAnyPackage("io.buildeval.core.construction..", "io.buildeval.core.error..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.buildeval.core.evaluation..", "io.buildeval.core.engine..")
            .because("the object model and errors are shared by every evaluation stage");

    @ArchTest
    static final ArchRule engineOnTop = noClasses()
            .that()
            .resideOutsideOfPackage("io.buildeval.core.engine..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.buildeval.core.engine..")
            .because("the project collection is the outermost layer of the library");

    @ArchTest
    static final ArchRule noReflectionUsage = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("java.lang.reflect..")
            .because("property functions dispatch through explicit tables, never reflection");
}
