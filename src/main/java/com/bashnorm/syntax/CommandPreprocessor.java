package com.bashnorm.syntax;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Textual clean-up applied to corpus commands before they are parsed.
 */
public class CommandPreprocessor {
    private static final Pattern SUDO = Pattern.compile("(^|\\s)sudo(?:\\s+|$)");
    private static final Pattern FULL_PATH_FIND = Pattern.compile("(~/bin/find|/usr/bin/find|/bin/find)(?=\\s|$)");
    private static final Pattern PROMPT = Pattern.compile("^[$#] ");
    private static final Pattern PROMPT_FIND = Pattern.compile("^[$#]find ");
    private static final Pattern TAR_FIRST_WORD = Pattern.compile("^tar (\\w)");

    public String preprocess(String command) {
        if (command == null) {
            return "";
        }
        String cmd = command.replace('\n', ' ').strip();

        cmd = SUDO.matcher(cmd).replaceAll("$1").strip();
        cmd = FULL_PATH_FIND.matcher(cmd).replaceAll("find");

        cmd = PROMPT.matcher(cmd).replaceFirst("");
        cmd = PROMPT_FIND.matcher(cmd).replaceFirst("find ");

        // common spelling errors around escaped parentheses
        cmd = cmd.replace("-\\(", "\\(");
        cmd = cmd.replace("-\\)", "\\)");
        cmd = cmd.replace("\"\\)", "\" \\)");

        // the first argument of tar is always read as an option
        Matcher tar = TAR_FIRST_WORD.matcher(cmd);
        if (tar.find()) {
            cmd = tar.replaceFirst("tar -$1");
        }
        return cmd.strip();
    }
}
