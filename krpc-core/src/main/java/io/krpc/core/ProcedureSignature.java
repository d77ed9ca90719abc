package io.krpc.core;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Static signature of a callable procedure. Argument decoding is driven entirely by the
 * parameter types listed here.
 *
 * <p>Procedures without a result declare {@link ValueType#NULL} and return {@link Value#nullValue()}.
 *
 * @param service service the procedure belongs to
 * @param name procedure name, unique within the service
 * @param parameters parameters in positional order
 * @param returnType shape of the result value
 */
public record ProcedureSignature(String service, String name, List<Parameter> parameters, ValueType returnType) {

    public ProcedureSignature {
        Objects.requireNonNull(service, "service");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(returnType, "returnType");
        parameters = List.copyOf(parameters);
    }

    public static ProcedureSignature of(String service, String name, ValueType returnType, Parameter... parameters) {
        return new ProcedureSignature(service, name, List.of(parameters), returnType);
    }

    public String fullName() {
        return service + "." + name;
    }

    /**
     * A positional parameter, optionally carrying the value used when a call omits it.
     *
     * @param name parameter name
     * @param type expected shape of the argument
     * @param defaultValue value used when the argument is omitted, or {@code null} if required
     */
    public record Parameter(String name, ValueType type, Value defaultValue) {
        public Parameter {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }

        public static Parameter required(String name, ValueType type) {
            return new Parameter(name, type, null);
        }

        public static Parameter optional(String name, ValueType type, Value defaultValue) {
            return new Parameter(name, type, Objects.requireNonNull(defaultValue, "defaultValue"));
        }

        public boolean isOptional() {
            return defaultValue != null;
        }

        public Optional<Value> defaultValueIfPresent() {
            return Optional.ofNullable(defaultValue);
        }
    }
}
