package dev.citecrawl.architecture;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

@AnalyzeClasses(packages = "dev.citecrawl", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

    // The crawl core only talks to collaborators through its own interfaces.
    @ArchTest
    static final ArchRule core_should_not_depend_on_adapters =
        noClasses().that().resideInAnyPackage(
                "dev.citecrawl.crawl..", "dev.citecrawl.document.."
            )
            .should().dependOnClassesThat().resideInAnyPackage(
                "dev.citecrawl.scopus..",
                "dev.citecrawl.text..",
                "dev.citecrawl.extraction..",
                "dev.citecrawl.export..",
                "dev.citecrawl.cli.."
            );

    // Only the command line wires a run together
    @ArchTest
    static final ArchRule adapters_should_not_depend_on_cli =
        noClasses().that().resideInAnyPackage(
                "dev.citecrawl.scopus..",
                "dev.citecrawl.text..",
                "dev.citecrawl.extraction..",
                "dev.citecrawl.export.."
            )
            .should().dependOnClassesThat().resideInAPackage("dev.citecrawl.cli..");

    @ArchTest
    static final ArchRule config_should_not_depend_on_features =
        noClasses().that().resideInAPackage("dev.citecrawl.config..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "dev.citecrawl.crawl..",
                "dev.citecrawl.scopus..",
                "dev.citecrawl.extraction..",
                "dev.citecrawl.cli.."
            )
            .allowEmptyShould(true);

    // No cyclic dependencies between top-level packages
    @ArchTest
    static final ArchRule no_package_cycles =
        slices().matching("dev.citecrawl.(*)..").should().beFreeOfCycles();
}
