package com.ciro.ferrum;

import com.tngtech.archunit.core.importer.ImportOption;
import com.tngtech.archunit.junit.AnalyzeClasses;
import com.tngtech.archunit.junit.ArchTest;
import com.tngtech.archunit.lang.ArchRule;

import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.classes;
import static com.tngtech.archunit.lang.syntax.ArchRuleDefinition.noClasses;

@AnalyzeClasses(packages = "com.ciro.ferrum", importOptions = ImportOption.DoNotIncludeTests.class)
public class FerrumArchitectureTest {

    // --------------------------------------------------------------------------------
    // 📏 REGLAS
    // --------------------------------------------------------------------------------

    // 1. El AST es la única moneda común: no conoce a nadie
    @ArchTest
    static final ArchRule ast_depends_on_nothing = noClasses()
            .that().resideInAPackage("..ferrum.ast..")
            .should().dependOnClassesThat().resideInAnyPackage(
                    "..ferrum.parser..", "..ferrum.format..", "..ferrum.codegen..")
            .because("Todos los consumidores se comunican solo a través del AST.");

    // 2. El parser no sabe quién lo consume
    @ArchTest
    static final ArchRule parser_is_independent = noClasses()
            .that().resideInAPackage("..ferrum.parser..")
            .should().dependOnClassesThat().resideInAnyPackage("..ferrum.format..", "..ferrum.codegen..");

    // 3. Formateador y generadores no se conocen entre sí
    @ArchTest
    static final ArchRule codegen_does_not_use_formatter = noClasses()
            .that().resideInAPackage("..ferrum.codegen..")
            .should().dependOnClassesThat().resideInAPackage("..ferrum.format..");

    @ArchTest
    static final ArchRule formatter_does_not_use_codegen = noClasses()
            .that().resideInAPackage("..ferrum.format..")
            .should().dependOnClassesThat().resideInAPackage("..ferrum.codegen..");

    // 4. Nodos inmutables
    @ArchTest
    static final ArchRule ast_nodes_have_final_fields = classes()
            .that().resideInAPackage("..ferrum.ast..")
            .and().implement(com.ciro.ferrum.ast.FrrNode.class)
            .should().haveOnlyFinalFields()
            .because("Un bosque se comparte entre hilos sin copiarlo.");
}
