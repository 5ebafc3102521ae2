package org.kukicha.compiler.frontend.semantics;

import org.kukicha.compiler.frontend.semantics.types.FunctionType;
import org.kukicha.compiler.frontend.semantics.types.InterfaceType;
import org.kukicha.compiler.frontend.semantics.types.PrimitiveType;
import org.kukicha.compiler.frontend.semantics.types.ReferenceType;
import org.kukicha.compiler.frontend.semantics.types.StructType;
import org.kukicha.compiler.frontend.semantics.types.Type;
import org.kukicha.compiler.frontend.semantics.types.TypeEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural interface satisfaction: a type implements an interface if its method set contains
 * every method of the interface with an identical signature. Results are cached per
 * (type, interface) pair.
 */
public class InterfaceSatisfactionChecker {

    private static final Logger log = LoggerFactory.getLogger(InterfaceSatisfactionChecker.class);

    private static final FunctionType ERROR_METHOD = new FunctionType(List.of(), List.of(PrimitiveType.STRING), false);

    private record Key(Type type, InterfaceType iface) {
    }

    private final TypeEnvironment environment;
    private final Map<Key, List<String>> cache = new HashMap<>();

    public InterfaceSatisfactionChecker(TypeEnvironment environment) {
        this.environment = environment;
    }

    /**
     * Computes the result for every struct and interface of the unit up front.
     * @return The number of (struct, interface) pairs that satisfy.
     */
    public int precompute() {
        int satisfied = 0;
        List<StructType> structs = environment.structs();
        List<InterfaceType> interfaces = environment.interfaces();
        for (StructType struct : structs) {
            for (InterfaceType iface : interfaces) {
                if (satisfies(struct, iface)) {
                    satisfied++;
                }
            }
        }
        log.debug("Checked {} struct/interface pairs, {} satisfied", structs.size() * interfaces.size(), satisfied);
        return satisfied;
    }

    public boolean satisfies(Type type, InterfaceType iface) {
        return missingMethods(type, iface).isEmpty();
    }

    /**
     * @return The names of the interface methods the type lacks or declares with a different
     *         signature, in interface declaration order.
     */
    public List<String> missingMethods(Type type, InterfaceType iface) {
        Type key = type instanceof ReferenceType ref ? ref.target() : type;
        return cache.computeIfAbsent(new Key(key, iface), k -> computeMissing(k.type(), k.iface()));
    }

    /**
     * @return true if the type has an {@code Error() string} method.
     */
    public boolean implementsError(Type type) {
        FunctionType method = environment.methodSet(type).get("Error");
        return method != null && method.equals(ERROR_METHOD);
    }

    private List<String> computeMissing(Type type, InterfaceType iface) {
        if (type.equals(iface)) {
            return List.of();
        }
        Map<String, FunctionType> available = environment.methodSet(type);
        List<String> missing = new ArrayList<>();
        for (Map.Entry<String, FunctionType> required : iface.methods().entrySet()) {
            FunctionType actual = available.get(required.getKey());
            if (actual == null || !actual.equals(required.getValue())) {
                missing.add(required.getKey());
            }
        }
        return List.copyOf(missing);
    }
}
