package com.dcarunner;

import com.tngtech.archunit.core.domain.JavaClasses;
import com.tngtech.archunit.core.importer.ClassFileImporter;
import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.lang.ArchRule;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

/**
 * Package boundaries: collaborators below execution never reach up into execution or scheduling.
 */
class ModuleDependencyArchTest {

    private static JavaClasses classes;

    @BeforeAll
    static void scan() {
        classes = new ClassFileImporter()
                .withImportOption(ImportOption.Predefined.DO_NOT_INCLUDE_TESTS)
                .importPackages("com.dcarunner");
    }

    @Test
    void domain_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.dcarunner.domain..")
                .should().dependOnClassesThat().resideInAnyPackage("com.dcarunner.chain..",
                        "com.dcarunner.ability..", "com.dcarunner.authorization..", "com.dcarunner.execution..",
                        "com.dcarunner.scheduling..", "com.dcarunner.store..", "com.dcarunner.records..",
                        "com.dcarunner.pricing..", "com.dcarunner.config..");
        rule.check(classes);
    }

    @Test
    void common_may_only_depend_on_failure_taxonomy() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.dcarunner.common..")
                .should().dependOnClassesThat().resideInAnyPackage("com.dcarunner.domain..",
                        "com.dcarunner.chain..", "com.dcarunner.ability..", "com.dcarunner.authorization..",
                        "com.dcarunner.execution..", "com.dcarunner.scheduling..", "com.dcarunner.failure.config..",
                        "com.dcarunner.config..", "com.dcarunner.store..", "com.dcarunner.records..");
        rule.check(classes);
    }

    @Test
    void collaborators_must_not_depend_on_execution_or_scheduling() {
        ArchRule rule = noClasses()
                .that().resideInAnyPackage("com.dcarunner.chain..", "com.dcarunner.ability..",
                        "com.dcarunner.authorization..", "com.dcarunner.pricing..", "com.dcarunner.records..",
                        "com.dcarunner.store..", "com.dcarunner.failure..")
                .should().dependOnClassesThat().resideInAnyPackage("com.dcarunner.execution..",
                        "com.dcarunner.scheduling..");
        rule.check(classes);
    }

    @Test
    void execution_must_not_depend_on_scheduling() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.dcarunner.execution..")
                .should().dependOnClassesThat().resideInAPackage("com.dcarunner.scheduling..");
        rule.check(classes);
    }

    @Test
    void config_must_not_depend_on_app_modules() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.dcarunner.config")
                .should().dependOnClassesThat().resideInAnyPackage("com.dcarunner.execution..",
                        "com.dcarunner.scheduling..", "com.dcarunner.chain..", "com.dcarunner.pricing..");
        rule.check(classes);
    }

    @Test
    void scheduling_should_not_import_execution_record_repository() {
        ArchRule rule = noClasses()
                .that().resideInAPackage("com.dcarunner.scheduling..")
                .should().dependOnClassesThat().haveSimpleName("ExecutionRecordRepository");
        rule.check(classes);
    }

    @Test
    void no_cyclic_dependencies_between_slices() {
        ArchRule rule = slices()
                .matching("com.dcarunner.(*)..")
                .should().beFreeOfCycles();
        rule.check(classes);
    }
}
