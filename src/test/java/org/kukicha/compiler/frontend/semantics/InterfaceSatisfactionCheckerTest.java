package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.StructType;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class InterfaceSatisfactionCheckerTest {

    private static final FunctionType AREA = new FunctionType(List.of(), List.of(PrimitiveType.FLOAT64), false);
    private static final FunctionType NAME = new FunctionType(List.of(), List.of(PrimitiveType.STRING), false);

    private TypeEnvironment environment;
    private InterfaceType shape;
    private StructType square;

    @BeforeEach
    void setUp() {
        environment = new TypeEnvironment();
        shape = new InterfaceType("Shape");
        environment.addInterfaceMethod(shape, "Area", AREA);
        environment.addInterfaceMethod(shape, "Name", NAME);
        environment.declare("Shape", shape);
        square = new StructType("Square");
        environment.declare("Square", square);
    }

    @Test
    @Tag("unit")
    void structWithEveryMethodSatisfiesWithoutDeclaration() {
        environment.declareMethod("Square", "Area", AREA);
        environment.declareMethod("Square", "Name", NAME);
        InterfaceSatisfactionChecker checker = new InterfaceSatisfactionChecker(environment);

        assertThat(checker.satisfies(square, shape)).isTrue();
        assertThat(checker.precompute()).isEqualTo(1);
    }

    @Test
    @Tag("unit")
    void missingMethodIsNamed() {
        environment.declareMethod("Square", "Area", AREA);
        InterfaceSatisfactionChecker checker = new InterfaceSatisfactionChecker(environment);

        assertThat(checker.satisfies(square, shape)).isFalse();
        assertThat(checker.missingMethods(square, shape)).containsExactly("Name");
    }

    @Test
    @Tag("unit")
    void methodWithDifferentSignatureDoesNotCount() {
        environment.declareMethod("Square", "Area", new FunctionType(List.of(), List.of(PrimitiveType.INT), false));
        environment.declareMethod("Square", "Name", NAME);
        InterfaceSatisfactionChecker checker = new InterfaceSatisfactionChecker(environment);

        assertThat(checker.missingMethods(square, shape)).containsExactly("Area");
    }

    @Test
    @Tag("unit")
    void referenceSharesTheMethodSetOfItsTarget() {
        environment.declareMethod("Square", "Area", AREA);
        environment.declareMethod("Square", "Name", NAME);
        InterfaceSatisfactionChecker checker = new InterfaceSatisfactionChecker(environment);

        assertThat(checker.satisfies(new ReferenceType(square), shape)).isTrue();
    }

    @Test
    @Tag("unit")
    void errorMethodMakesATypeAnError() {
        environment.declareMethod("Square", "Error", NAME);
        InterfaceSatisfactionChecker checker = new InterfaceSatisfactionChecker(environment);

        assertThat(checker.implementsError(square)).isTrue();
        assertThat(checker.implementsError(PrimitiveType.INT)).isFalse();
    }
}
