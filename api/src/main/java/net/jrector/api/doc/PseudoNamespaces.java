package net.jrector.api.doc;

import net.jrector.api.Nodes;
import org.jetbrains.annotations.Nullable;

import java.util.Collection;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The {@code Vendor_Package_Class} naming convention that predates PHP namespaces.
 * <p>
 * An underscore only separates segments when a letter stands on both sides of it. Digits, leading and trailing
 * underscores stay part of the name, and of a doubled underscore one is kept.
 */
public final class PseudoNamespaces {
    private static final Pattern SEPARATOR = Pattern.compile("(?<=[a-zA-Z])(_?)_(?=[a-zA-Z])");

    private PseudoNamespaces() {
    }

    /**
     * {@code Some_Chicken} becomes {@code Some\Chicken}. A leading backslash is kept.
     */
    public static String toNamespaced(String name) {
        return SEPARATOR.matcher(name).replaceAll("$1\\\\");
    }

    /**
     * The namespace a declaration named {@code name} moves into, {@code null} if the name has no separator.
     */
    @Nullable
    public static String namespaceOf(String name) {
        var namespaced = toNamespaced(name);
        int separator = namespaced.lastIndexOf('\\');
        return separator <= 0 ? null : namespaced.substring(0, separator);
    }

    /**
     * The last segment of a pseudo-namespaced name.
     */
    public static String shortNameOf(String name) {
        var namespaced = toNamespaced(name);
        return namespaced.substring(namespaced.lastIndexOf('\\') + 1);
    }

    /**
     * Whether {@code name} starts with {@code prefix} and is not one of {@code excludedClasses}.
     * Class names compare case-insensitively.
     */
    public static boolean matches(String name, String prefix, Collection<String> excludedClasses) {
        var bare = Nodes.stripLeadingBackslash(name).toLowerCase(Locale.ROOT);
        if (!bare.startsWith(prefix.toLowerCase(Locale.ROOT))) {
            return false;
        }
        for (var excluded : excludedClasses) {
            if (bare.equals(Nodes.stripLeadingBackslash(excluded).toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }
}
