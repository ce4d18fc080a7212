package com.checkpoint.core;

import com.checkpoint.core.engine.AnalysisEngine;
import com.checkpoint.core.model.FlagStatus;
import com.checkpoint.core.model.IssueOrdering;
import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests to validate package layering.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are records or enums, except the mutable flag record</li>
 *   <li>Workspaces know nothing about the engines that use them</li>
 *   <li>Retention stays independent of analysis</li>
 *   <li>Core never depends on the CLI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter()
            .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
            .importPackages("com.checkpoint.core");
    }

    /**
     * FlagStatus is updated in place by each reconciliation phase and IssueOrdering
     * only holds comparators; everything else in the model package is a value.
     */
    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .and().doNotBelongToAnyOf(FlagStatus.class, IssueOrdering.class)
            .should().beRecords();

        rule.check(classes);
    }

    @Test
    void models_shouldNotDependOnServices() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..model..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..engine..", "..flags..", "..retention..", "..workspace..", "..source..", "..config..");

        rule.check(classes);
    }

    @Test
    void workspace_shouldNotDependOnConsumers() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..workspace..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..engine..", "..flags..", "..retention..", "..config..");

        rule.check(classes);
    }

    @Test
    void retention_shouldNotDependOnAnalysis() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..retention..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..engine..", "..flags..", "..source..");

        rule.check(classes);
    }

    /**
     * Utilities should be low-level, reusable components with no domain dependencies.
     */
    @Test
    void utilClasses_shouldNotDependOnDomain() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..util..")
            .should().dependOnClassesThat()
            .resideInAnyPackage("..model..", "..engine..", "..flags..", "..retention..", "..workspace..", "..source..");

        rule.check(classes);
    }

    @Test
    void engines_shouldImplementAnalysisEngine() {
        ArchRule rule = classes()
            .that().resideInAPackage("..flags..")
            .and().haveSimpleNameEndingWith("Engine")
            .should().implement(AnalysisEngine.class);

        rule.check(classes);
    }

    @Test
    void core_shouldNotDependOnCli() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("com.checkpoint.core..")
            .should().dependOnClassesThat().resideInAPackage("com.checkpoint.cli..");

        rule.check(classes);
    }
}
