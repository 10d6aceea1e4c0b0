package org.peerdisco;

import java.util.*;

/**
 * Named parameters, from the environment overlaid with {@code -name value} command line pairs. A flag with no value reads as "true".
 */
public class Args {

    private final Map<String, String> params;

    public Args(Map<String, String> params) {
        this.params = params;
    }

    public String getArg(String param) {
        if (!params.containsKey(param))
            throw new IllegalStateException("No parameter: " + param);
        return params.get(param);
    }

    public Optional<String> getOptionalArg(String param) {
        return Optional.ofNullable(params.get(param));
    }

    public Args setArg(String param, String value) {
        Map<String, String> newParams = paramMap();
        newParams.putAll(params);
        newParams.put(param, value);
        return new Args(newParams);
    }

    public boolean hasArg(String arg) {
        return params.containsKey(arg);
    }

    public int getInt(String param, int def) {
        if (!params.containsKey(param))
            return def;
        return parseInt(param, params.get(param));
    }

    public int getInt(String param) {
        if (!params.containsKey(param))
            throw new IllegalStateException("No parameter: " + param);
        return parseInt(param, params.get(param));
    }

    private static int parseInt(String param, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Parameter " + param + " is not an integer: " + value, e);
        }
    }

    public static Args parse(String[] args, Map<String, String> env) {
        Map<String, String> map = paramMap();
        map.putAll(env);
        for (int i = 0; i < args.length; i++) {
            String argName = args[i];
            if (argName.startsWith("-"))
                argName = argName.substring(1);

            if ((i == args.length - 1) || args[i + 1].startsWith("-"))
                map.put(argName, "true");
            else
                map.put(argName, args[++i]);
        }
        return new Args(map);
    }

    private static <K, V> Map<K, V> paramMap() {
        return new LinkedHashMap<>(16, 0.75f, false);
    }
}
