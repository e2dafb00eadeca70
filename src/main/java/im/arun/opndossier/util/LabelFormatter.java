package im.arun.opndossier.util;

/**
 * Turns schema identifiers into human-readable labels.
 */
public final class LabelFormatter {

    private LabelFormatter() {
    }

    /**
     * Split a CamelCase identifier into words while keeping acronyms whole.
     * A space goes before every uppercase letter whose predecessor is not
     * uppercase, so "DisableConsoleMenu" becomes "Disable Console Menu",
     * "IPv6Allow" becomes "IPv6 Allow" and "DisableVLANHWFilter" becomes
     * "Disable VLANHWFilter". A leading lowercase letter is capitalized.
     */
    public static String formatLabel(String name) {
        if (name == null || name.isEmpty()) {
            return "";
        }

        StringBuilder result = new StringBuilder(name.length() + 8);
        result.append(Character.toUpperCase(name.charAt(0)));

        for (int i = 1; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c) && !Character.isUpperCase(name.charAt(i - 1))) {
                result.append(' ');
            }
            result.append(c);
        }

        return result.toString();
    }

    /**
     * Title of a sequence element, e.g. "[0]".
     */
    public static String formatIndex(int index) {
        return "[" + index + "]";
    }
}
