package com.stridegraph.core;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.*;

/**
 * ArchUnit tests for the layering of the analysis pipeline.
 *
 * <p>These tests ensure:
 * <ul>
 *   <li>Domain models are records or enums without pipeline or library dependencies</li>
 *   <li>The reasoning step performs no I/O</li>
 *   <li>Pipeline stages never reach into output sinks or the engine facade</li>
 *   <li>Sink implementations implement the sink SPI</li>
 * </ul>
 */
class ArchitectureTest {

    private static JavaClasses classes;

    @BeforeAll
    static void importClasses() {
        classes = new ClassFileImporter().importPackages("com.stridegraph.core");
    }

    @Test
    void models_shouldBeRecords() {
        ArchRule rule = classes()
            .that().resideInAPackage("..model..")
            .and().areTopLevelClasses()
            .and().areNotEnums()
            .should().beRecords();

        rule.check(classes);
    }

    /**
     * Models are shared by every stage and carry no library or pipeline dependencies.
     */
    @Test
    void models_shouldNotDependOnPipelineOrLibraries() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..core.model..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "..core.config..", "..core.normalize..", "..core.graph..", "..core.rules..",
                "..core.reasoning..", "..core.report..", "..core.io..", "..core.output..", "..core.engine..",
                "org.slf4j..", "com.fasterxml..");

        rule.check(classes);
    }

    @Test
    void reasoning_shouldNotPerformIo() {
        ArchRule rule = noClasses()
            .that().resideInAPackage("..reasoning..")
            .should().dependOnClassesThat().resideInAnyPackage("java.io..", "java.nio..");

        rule.check(classes);
    }

    @Test
    void pipelineStages_shouldNotDependOnOutputOrEngine() {
        ArchRule rule = noClasses()
            .that().resideInAnyPackage("..core.normalize..", "..core.graph..", "..core.reasoning..", "..core.rules..", "..core.report..")
            .should().dependOnClassesThat().resideInAnyPackage(
                "com.stridegraph.core.output..", "com.stridegraph.core.engine..", "com.stridegraph.core.io..");

        rule.check(classes);
    }

    @Test
    void sinks_shouldImplementReportSink() {
        ArchRule rule = classes()
            .that().resideInAPackage("..output.impl..")
            .and().haveSimpleNameEndingWith("Sink")
            .should().implement("com.stridegraph.core.output.ReportSink");

        rule.check(classes);
    }
}
