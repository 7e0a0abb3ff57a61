package io.constela.core.arch;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

/** Layering guardrails: the data packages never reach back into the passes. */
@AnalyzeClasses(
        packages = "io.constela.core",
        importOptions = {ImportOption.DoNotIncludeTests.class})
class ArchitectureTest {

    @ArchTest
    static final ArchRule dataPackagesDoNotDependOnPasses = noClasses()
            .that()
            .resideInAnyPackage("io.constela.core.model..", "io.constela.core.ir..", "io.constela.core.error..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage(
                    "io.constela.core.schema..",
                    "io.constela.core.analysis..",
                    "io.constela.core.transform..",
                    "io.constela.core.engine..")
            .because("AST, IR and errors are shared vocabulary consumed by the passes");

    @ArchTest
    static final ArchRule passesDoNotDependOnOrchestrator = noClasses()
            .that()
            .resideInAnyPackage(
                    "io.constela.core.schema..", "io.constela.core.analysis..", "io.constela.core.transform..")
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("io.constela.core.engine..")
            .because("each pass must be usable on its own");

    @ArchTest
    static final ArchRule noLoggingBackendInMainCode = noClasses()
            .should()
            .dependOnClassesThat()
            .resideInAnyPackage("ch.qos.logback..")
            .because("main code logs through the SLF4J API only");

    @ArchTest
    static final ArchRule compilerHasOnlyFinalFields = classes()
            .that()
            .haveSimpleName("ConstelaCompiler")
            .should()
            .haveOnlyFinalFields()
            .because("one compiler instance is shared across threads");
}
