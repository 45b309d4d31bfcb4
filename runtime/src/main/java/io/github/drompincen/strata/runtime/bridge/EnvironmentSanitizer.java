package io.github.drompincen.strata.runtime.bridge;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the environment of the bridge process from a fixed allow-list, so secrets held
 * in unrelated variables of the host never reach the child.
 */
public final class EnvironmentSanitizer {

    public static final String NONCE_VARIABLE = "STRATA_BRIDGE_NONCE";

    public static final List<String> ALLOWED_VARIABLES = List.of(
            "PATH", "HOME", "USER", "LOGNAME", "SHELL", "TMPDIR",
            "ANTHROPIC_API_KEY", "NODE_PATH", "NVM_DIR",
            "LANG", "LC_ALL", "LC_CTYPE");

    private EnvironmentSanitizer() {}

    public static Map<String, String> sanitize(Map<String, String> ambient, String nonce) {
        Map<String, String> env = new LinkedHashMap<>();
        for (String key : ALLOWED_VARIABLES) {
            String value = ambient.get(key);
            if (value != null) env.put(key, value);
        }
        env.put("TERM", "dumb");
        env.put("NO_COLOR", "1");
        env.put(NONCE_VARIABLE, nonce);
        return env;
    }

    /**
     * Replaces the content of {@code target} (typically {@link ProcessBuilder#environment()},
     * which starts as a copy of the host environment).
     */
    public static void apply(Map<String, String> target, Map<String, String> ambient, String nonce) {
        Map<String, String> env = sanitize(ambient, nonce);
        target.clear();
        target.putAll(env);
    }
}
