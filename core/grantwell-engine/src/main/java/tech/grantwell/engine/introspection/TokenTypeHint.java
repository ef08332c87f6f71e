package tech.grantwell.engine.introspection;

/**
 * {@code token_type_hint} values (RFC 7009 Section 2.1).
 */
public enum TokenTypeHint {

    ACCESS_TOKEN("access_token"),
    REFRESH_TOKEN("refresh_token");

    private final String parameter;

    TokenTypeHint(String parameter) {
        this.parameter = parameter;
    }

    public String parameter() {
        return parameter;
    }

    /**
     * Unknown or absent hints are ignored, returning {@code null}.
     */
    public static TokenTypeHint fromParameter(String value) {
        for (TokenTypeHint hint : values()) {
            if (hint.parameter.equals(value)) {
                return hint;
            }
        }
        return null;
    }
}
