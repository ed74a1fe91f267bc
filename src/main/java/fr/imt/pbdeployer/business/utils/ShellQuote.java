package fr.imt.pbdeployer.business.utils;

import fr.imt.pbdeployer.exception.ValidationException;
import lombok.experimental.UtilityClass;

import java.util.regex.Pattern;

@UtilityClass
public class ShellQuote {

    private static final Pattern SAFE_NAME = Pattern.compile("[A-Za-z0-9@._-]+");
    private static final Pattern SAFE_PATH = Pattern.compile("/[A-Za-z0-9@._/-]*");

    /**
     * Quotes a value for a POSIX shell, so that it is passed as a single literal word.
     */
    public static String quote(String value) {
        return "'" + value.replace("'", "'\"'\"'") + "'";
    }

    /**
     * Rejects values that are not plain identifiers (user, service or application names).
     */
    public static String requireSafeName(String what, String value) {
        if (value == null || !SAFE_NAME.matcher(value).matches()) {
            throw new ValidationException("Invalid " + what + ": " + value);
        }
        return value;
    }

    /**
     * Rejects anything but an absolute path made of plain characters and no parent references.
     */
    public static String requireSafePath(String what, String value) {
        if (value == null || !SAFE_PATH.matcher(value).matches() || value.contains("..")) {
            throw new ValidationException("Invalid " + what + ": " + value);
        }
        return value;
    }

    /**
     * Reduces an arbitrary label to characters usable in a file name.
     */
    public static String sanitizeFileName(String value) {
        return value
                .replaceAll("[^a-zA-Z0-9._-]", "_")
                .replaceAll("\\.\\.", "_");
    }
}
