package io.surfworks.accelforge.host;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates the first-boot shell script passed to created instances.
 *
 * <p>The script touches an initialization flag file, then runs the user's init script
 * (its shebang line removed).
 */
public final class UserData {

    /** Flag file created once the instance has been initialized */
    public static final String INITIALIZED_FLAG = "/etc/nginx/.INITIALIZED";

    private UserData() {
    }

    /**
     * Builds the user data script.
     *
     * @param initScript bash script to append, or null
     * @return the script text
     * @throws IOException if the init script cannot be read
     */
    public static String generate(Path initScript) throws IOException {
        List<String> lines = new ArrayList<>();
        lines.add("#!/usr/bin/env bash");
        lines.add("touch \"" + INITIALIZED_FLAG + "\"");

        if (initScript != null) {
            List<String> script = Files.readAllLines(initScript, StandardCharsets.UTF_8);
            int first = 0;
            if (!script.isEmpty() && script.get(0).startsWith("#!")) {
                first = 1;
            }
            lines.addAll(script.subList(first, script.size()));
        }
        return String.join("\n", lines).strip() + "\n";
    }
}
