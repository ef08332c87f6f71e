package tech.grantwell.engine.authorize;

import java.util.Optional;

public enum ResponseType {

    /** Authorization code flow. */
    CODE("code"),
    /** Implicit flow. */
    TOKEN("token");

    private final String parameter;

    ResponseType(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    public static Optional<ResponseType> fromParameter(String value) {
        for (ResponseType type : values()) {
            if (type.parameter.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
