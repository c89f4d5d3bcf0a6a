package org.sasslite.dsl;

/**
 * Describes indentation strings for error messages, e.g. "2 spaces" or
 * "1 tab was".
 */
public final class Indentation {

    private Indentation() {
        // Static utility class
    }

    public static String describe(String indentation) {
        return describe(indentation, false);
    }

    /**
     * @param indentation The whitespace to describe
     * @param was         Whether to append the matching form of "was"/"were"
     */
    public static String describe(String indentation, boolean was) {
        String noun;
        if (indentation.indexOf('\t') < 0) {
            noun = "space";
        } else if (indentation.indexOf(' ') < 0) {
            noun = "tab";
        } else {
            return quote(indentation) + (was ? " was" : "");
        }

        boolean singular = indentation.length() == 1;
        String verb = "";
        if (was) {
            verb = singular ? " was" : " were";
        }
        return indentation.length() + " " + noun + (singular ? "" : "s") + verb;
    }

    private static String quote(String whitespace) {
        return "\"" + whitespace.replace("\t", "\\t") + "\"";
    }
}
