package org.kukicha.compiler.frontend.semantics.analysis;

import org.kukicha.compiler.diagnostics.DiagnosticsEngine;
import org.kukicha.compiler.diagnostics.ErrorKind;
import org.kukicha.compiler.frontend.parser.ast.Parameter;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks on parameter lists shared by functions, methods and interface methods.
 */
final class ParameterRules {

    private ParameterRules() {
    }

    /**
     * Reports missing type annotations, misplaced variadics, non-trailing defaults and
     * duplicate names. Each offending parameter is reported once.
     * @param params The parameters.
     * @param owner How the owner is named in messages, e.g. {@code function 'f'}.
     */
    static void check(List<Parameter> params, String owner, DiagnosticsEngine diagnostics) {
        Set<String> seen = new HashSet<>();
        boolean sawDefault = false;
        for (int i = 0; i < params.size(); i++) {
            Parameter param = params.get(i);
            if (param.type() == null) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Parameter '" + param.name() + "' of " + owner + " requires an explicit type annotation",
                        param.token());
            }
            if (!seen.add(param.name())) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Duplicate parameter '" + param.name() + "' in " + owner, param.token());
            }
            if (param.variadic() && i != params.size() - 1) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Variadic parameter '" + param.name() + "' of " + owner + " must be the last parameter",
                        param.token());
            }
            if (param.defaultValue() != null) {
                if (param.variadic()) {
                    diagnostics.reportError(ErrorKind.SEMANTIC,
                            "Variadic parameter '" + param.name() + "' cannot have a default value", param.token());
                }
                sawDefault = true;
            } else if (sawDefault && !param.variadic()) {
                diagnostics.reportError(ErrorKind.SEMANTIC,
                        "Parameter '" + param.name() + "' of " + owner + " needs a default value because an earlier parameter has one",
                        param.token(),
                        "parameters with default values must come after all parameters without them");
            }
        }
    }

    /**
     * @return The number of arguments a call must supply at minimum.
     */
    static int requiredCount(List<Parameter> params) {
        int required = 0;
        for (Parameter param : params) {
            if (param.defaultValue() == null && !param.variadic()) {
                required++;
            }
        }
        return required;
    }
}
