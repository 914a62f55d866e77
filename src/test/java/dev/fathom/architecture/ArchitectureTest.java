package dev.fathom.architecture;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;
import static com.tngtech.archunit.library.dependencies.SlicesRuleDefinition.slices;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

@AnalyzeClasses(packages = "dev.fathom", importOptions = ImportOption.DoNotIncludeTests.class)
class ArchitectureTest {

  // Feature packages should not depend on adapter packages
  @ArchTest
  static final ArchRule features_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAnyPackage(
              "..project..",
              "..extraction..",
              "..vector..",
              "..indexing..",
              "..process..",
              "..literal..",
              "..structural..",
              "..search..",
              "..dependency..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..mcp..", "..api..", "..cli..");

  // Adapter packages should not depend on each other
  @ArchTest
  static final ArchRule mcp_should_not_depend_on_other_adapters =
      noClasses()
          .that()
          .resideInAPackage("..mcp..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..api..", "..cli..");

  @ArchTest
  static final ArchRule api_should_not_depend_on_other_adapters =
      noClasses()
          .that()
          .resideInAPackage("..api..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..mcp..", "..cli..");

  @ArchTest
  static final ArchRule cli_should_not_depend_on_other_adapters =
      noClasses()
          .that()
          .resideInAPackage("..cli..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..mcp..", "..api..");

  // Config package should not depend on adapter packages
  @ArchTest
  static final ArchRule config_should_not_depend_on_adapters =
      noClasses()
          .that()
          .resideInAPackage("..config..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..mcp..", "..api..", "..cli..");

  // Backends are reached only through the search router
  @ArchTest
  static final ArchRule adapters_should_not_call_search_backends =
      noClasses()
          .that()
          .resideInAnyPackage("..mcp..", "..api..", "..cli..")
          .should()
          .dependOnClassesThat()
          .resideInAnyPackage("..literal..", "..vector..", "..process..");

  // No cyclic dependencies between top-level packages
  @ArchTest
  static final ArchRule no_package_cycles =
      slices().matching("dev.fathom.(*)..").should().beFreeOfCycles();
}
