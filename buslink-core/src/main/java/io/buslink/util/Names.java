package io.buslink.util;

import io.buslink.InvalidNameException;

import java.util.regex.Pattern;

/**
 * Syntax checks for API, event and procedure names.
 *
 * <p>An API name is one or more dot-separated identifiers ({@code shop}, {@code acme.billing}).
 * An event or procedure name is a single identifier that does not start with an underscore.
 */
public final class Names {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern API_NAME = Pattern.compile(
            "[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)*");

    private Names() {
    }

    public static void validateApiName(String apiName) {
        if (apiName == null || apiName.isEmpty()) {
            throw new InvalidNameException("Empty API name specified");
        }
        if (!API_NAME.matcher(apiName).matches()) {
            throw new InvalidNameException("'" + apiName + "' is not a valid API name. "
                    + "API names are dot-separated identifiers, for example 'company.auth'");
        }
    }

    /**
     * Validates the name of an event or RPC on the given API.
     *
     * @param apiName the owning API
     * @param type    {@code "event"} or {@code "rpc"}, used in the error message
     * @param name    the name to check
     * @throws InvalidNameException if either name is malformed
     */
    public static void validateEventOrRpcName(String apiName, String type, String name) {
        validateApiName(apiName);
        if (name == null || name.isEmpty()) {
            throw new InvalidNameException("Empty " + type + " name specified when calling API " + apiName);
        }
        if (name.startsWith("_")) {
            throw new InvalidNameException("You can not use '" + name + "' as an " + type
                    + " because it starts with an underscore. API: " + apiName);
        }
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new InvalidNameException("'" + name + "' is not a valid " + type
                    + " name on API " + apiName + ". Names must be identifiers");
        }
    }
}
