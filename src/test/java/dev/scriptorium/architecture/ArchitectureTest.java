package dev.scriptorium.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.scriptorium", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // Pipeline packages are driven by the facade, never the other way round.
    @ArchTest
    static final ArchRule pipeline_should_not_depend_on_facade =
        noClasses().that().resideInAnyPackage(
                "..ingestion..", "..search..", "..embedding..", "..concurrent..", "..error.."
            )
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // Search and ingestion share the embedding layer but not each other.
    @ArchTest
    static final ArchRule search_should_not_depend_on_ingestion =
        noClasses().that().resideInAPackage("..search..")
            .should().dependOnClassesThat().resideInAPackage("..ingestion..");

    @ArchTest
    static final ArchRule ingestion_should_not_depend_on_search =
        noClasses().that().resideInAPackage("..ingestion..")
            .should().dependOnClassesThat().resideInAPackage("..search..");

    // Config package should not depend on the facade
    @ArchTest
    static final ArchRule config_should_not_depend_on_facade =
        noClasses().that().resideInAPackage("..config..")
            .should().dependOnClassesThat().resideInAPackage("..api..");

    // Error types are leaves
    @ArchTest
    static final ArchRule errors_should_not_depend_on_pipeline =
        noClasses().that().resideInAPackage("..error..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..api..", "..search..", "..ingestion..", "..embedding..", "..config.."
            );

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.scriptorium.(*)..").should().beFreeOfCycles();
}
