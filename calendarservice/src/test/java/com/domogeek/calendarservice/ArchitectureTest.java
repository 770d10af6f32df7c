package com.domogeek.calendarservice;

/*
 * 10/16/2026 - 5:03 PM
 * @author domogeek
 */

import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.domogeek.calendarservice")
public class ArchitectureTest {
    @ArchTest
    static final ArchRule controllers_should_not_access_caldav = noClasses().that().resideInAPackage("..controller..").should().dependOnClassesThat().resideInAPackage("..caldav..");

    @ArchTest
    static final ArchRule model_should_not_depend_on_spring = noClasses().that().resideInAPackage("..model..").should().dependOnClassesThat().resideInAPackage("org.springframework..");

    @ArchTest
    static final ArchRule services_should_be_in_service_package = classes().that().haveSimpleNameEndingWith("Service").should().resideInAPackage("..service..");
}
