package net.jrector.api.doc;

import net.jrector.api.Node;
import net.jrector.api.ResolvedType;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Renames class references in the type part of {@code @var}, {@code @param}, {@code @return} and {@code @throws}
 * tags, including their {@code @psalm-} and {@code @phpstan-} variants.
 * <p>
 * The renamer function receives every class reference as written (a leading backslash included) and returns
 * the replacement, or its argument to keep it.
 */
public final class DocTypeRenamer {
    private static final Pattern TAG = Pattern.compile("@(?:psalm-|phpstan-)?(?:var|param|return|throws)(?=\\s)[ \\t]+");
    private static final Pattern CLASS_REFERENCE = Pattern.compile("\\\\?[A-Za-z_][A-Za-z0-9_]*(?:\\\\[A-Za-z_][A-Za-z0-9_]*)*");
    // Keywords that may appear in doc types without being classes
    private static final Set<String> PSEUDO_TYPES = Set.of(
            "integer", "boolean", "double", "resource", "scalar", "numeric", "list", "non-empty-list", "class",
            "positive", "negative", "non", "empty", "key", "of", "value", "this"
    );

    public DocTypeRenamer() {
    }

    /**
     * Renames types in the doc comment of {@code node}, if it has one.
     *
     * @return whether the doc comment changed
     */
    public boolean renameTypes(Node node, UnaryOperator<String> renamer) {
        var docComment = node.docComment();
        if (docComment == null) {
            return false;
        }
        var renamed = renameTypes(docComment.text(), renamer);
        if (renamed.equals(docComment.text())) {
            return false;
        }
        node.setDocComment(docComment.withText(renamed));
        return true;
    }

    public String renameTypes(String docText, UnaryOperator<String> renamer) {
        var result = new StringBuilder(docText.length());
        var tags = TAG.matcher(docText);
        int position = 0;
        while (tags.find(position)) {
            int typeStart = tags.end();
            int typeEnd = findTypeEnd(docText, typeStart);
            result.append(docText, position, typeStart);
            result.append(renameTypeExpression(docText.substring(typeStart, typeEnd), renamer));
            position = typeEnd;
        }
        result.append(docText, position, docText.length());
        return result.toString();
    }

    /**
     * Rewrites references to classes starting with {@code namespacePrefix} into fully qualified namespaced form,
     * {@code Some_Chicken} becoming {@code \Some\Chicken}.
     */
    public boolean changeUnderscoreType(Node node, String namespacePrefix, Collection<String> excludedClasses) {
        return renameTypes(node, type -> {
            if (!PseudoNamespaces.matches(type, namespacePrefix, excludedClasses)) {
                return type;
            }
            var namespaced = PseudoNamespaces.toNamespaced(type);
            return namespaced.startsWith("\\") ? namespaced : "\\" + namespaced;
        });
    }

    private static String renameTypeExpression(String type, UnaryOperator<String> renamer) {
        var matcher = CLASS_REFERENCE.matcher(type);
        var result = new StringBuilder();
        while (matcher.find()) {
            var reference = matcher.group();
            String replacement = reference;
            if (isClassReference(type, matcher)) {
                replacement = renamer.apply(reference);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    private static boolean isClassReference(String type, Matcher matcher) {
        var reference = matcher.group();
        // part of a hyphenated keyword like non-empty-string
        if (matcher.start() > 0 && type.charAt(matcher.start() - 1) == '-') {
            return false;
        }
        if (matcher.end() < type.length() && type.charAt(matcher.end()) == '-') {
            return false;
        }
        // array shape keys
        if (matcher.end() < type.length() && type.charAt(matcher.end()) == ':') {
            return false;
        }
        var lower = reference.toLowerCase(Locale.ROOT);
        return !ResolvedType.isBuiltinTypeName(lower) && !PSEUDO_TYPES.contains(lower);
    }

    /**
     * The type ends at the first whitespace outside of brackets.
     */
    private static int findTypeEnd(String text, int start) {
        int depth = 0;
        int i = start;
        for (; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '<' || c == '{' || c == '(') {
                depth++;
            } else if ((c == '>' || c == '}' || c == ')') && depth > 0) {
                depth--;
            } else if (Character.isWhitespace(c) && (depth == 0 || c == '\n')) {
                break;
            } else if (c == '$' && depth == 0) {
                break;
            } else if (c == '*' && depth == 0 && i + 1 < text.length() && text.charAt(i + 1) == '/') {
                break;
            }
        }
        return i;
    }
}
