package io.buildeval.standalone;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** The configuration layer stays independent of evaluation, and only the entry point exits the JVM. */
@AnalyzeClasses(
        packages = "io.buildeval.standalone",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class StandaloneArchitectureTest {

    @ArchTest
    static final ArchRule configIndependent = noClasses()
            .that()
            .resideInAPackage("io.buildeval.standalone.config..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.buildeval.core..", "io.buildeval.standalone.cli..")
            .because("configuration is loaded before anything is evaluated");

    @ArchTest
    static final ArchRule onlyMainExits = noClasses()
            .that()
            .doNotHaveSimpleName("StandaloneMain")
            .should()
            .callMethod(System.class, "exit", int.class);
}
