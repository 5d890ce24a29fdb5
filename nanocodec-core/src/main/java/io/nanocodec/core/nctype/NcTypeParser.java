// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.nctype;

import io.nanocodec.core.error.TypeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for type descriptors.
 *
 * <pre>
 * type      := leaf | type '?' | container
 * container := NAME '[' args ']'
 * args      := type (',' type)*
 * </pre>
 *
 * <p>
 * Containers: {@code SignedData}, {@code RawSignedData} and {@code Optional} match exactly;
 * {@code dict}, {@code tuple}, {@code list}, {@code set}, {@code deque} and {@code frozenset}
 * match in any case. Dict takes exactly two arguments, Tuple at least one, the rest exactly one.
 * Surrounding whitespace is ignored at every level. Nesting is limited to {@link #MAX_DEPTH}.
 */
public final class NcTypeParser {
    private static final Pattern CONTAINER_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]*$");

    /** Deepest nesting of containers and optional suffixes a descriptor may use. */
    public static final int MAX_DEPTH = 64;

    private NcTypeParser() {}

    /**
     * Parses a descriptor into a type tree.
     *
     * @param descriptor the descriptor, e.g. {@code "Dict[str, Set[int]]?"}
     * @return the parsed tree
     * @throws TypeParseException if the descriptor is outside the grammar
     */
    public static NcType parse(final String descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        return parse(descriptor, 0);
    }

    private static NcType parse(final String descriptor, final int depth) {
        final String trimmed = descriptor.trim();

        // trailing '?' suffixes, innermost last
        int end = trimmed.length();
        int optionals = 0;
        while (end > 0 && trimmed.charAt(end - 1) == '?') {
            optionals++;
            end--;
            while (end > 0 && trimmed.charAt(end - 1) <= ' ') {
                end--;
            }
        }
        if (depth + optionals > MAX_DEPTH) {
            throw TypeParseException.tooDeep(MAX_DEPTH);
        }

        NcType parsed = parseBody(trimmed.substring(0, end), depth + optionals);
        for (int i = 0; i < optionals; i++) {
            parsed = new NcType.Optional(parsed);
        }
        return parsed;
    }

    private static NcType parseBody(final String type, final int depth) {
        final LeafType leaf = LeafType.lookup(type);
        if (leaf != null) {
            return new NcType.Simple(leaf);
        }
        if (depth >= MAX_DEPTH) {
            throw TypeParseException.tooDeep(MAX_DEPTH);
        }
        final int next = depth + 1;

        final int open = type.indexOf('[');
        if (open <= 0 || !type.endsWith("]")) {
            throw TypeParseException.invalidSyntax(type);
        }
        final String container = type.substring(0, open).trim();
        if (!CONTAINER_NAME.matcher(container).matches()) {
            throw TypeParseException.invalidSyntax(type);
        }
        final String inner = type.substring(open + 1, type.length() - 1).trim();
        final List<String> args = splitTopLevel(inner, ',');

        switch (container) {
            case "SignedData":
                return new NcType.SignedData(parse(single(container, args), next), inner);
            case "RawSignedData":
                return new NcType.RawSignedData(parse(single(container, args), next), inner);
            case "Optional":
                return new NcType.Optional(parse(single(container, args), next));
            default:
                break;
        }

        if (container.equalsIgnoreCase("dict")) {
            if (args.size() != 2) {
                throw TypeParseException.wrongArity(container, 2, args.size());
            }
            return new NcType.Dict(parse(args.get(0), next), parse(args.get(1), next));
        }

        if (container.equalsIgnoreCase("tuple")) {
            if (args.isEmpty()) {
                throw TypeParseException.wrongArity(container, 1, 0);
            }
            final List<NcType> elements = new ArrayList<>(args.size());
            for (String arg : args) {
                elements.add(parse(arg, next));
            }
            return new NcType.Tuple(elements);
        }

        final CollectionKind collection = CollectionKind.lookup(container);
        if (collection != null) {
            return new NcType.Collection(collection, parse(single(container, args), next));
        }

        throw TypeParseException.unsupportedType(type);
    }

    /**
     * Splits {@code value} on {@code separator} where the separator sits outside any brackets.
     *
     * <p>
     * A {@code '['} opens a level only when it is the first character or follows a letter, so
     * {@code "Tuple[Address, Amount]"} stays whole while {@code "Address, Amount"} splits in two.
     * A {@code ']'} always closes one. Parts are trimmed. Blank input yields no parts, while a
     * blank part after a separator is kept so the caller can reject it.
     *
     * @param value     the text to split
     * @param separator the separator character
     * @return the trimmed top-level parts, empty for blank input
     */
    public static List<String> splitTopLevel(final String value, final char separator) {
        final List<String> result = new ArrayList<>();
        final StringBuilder current = new StringBuilder();
        int depth = 0;
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == '[' && (i == 0 || isAsciiLetter(value.charAt(i - 1)))) {
                depth++;
            } else if (c == ']') {
                depth--;
            } else if (c == separator && depth == 0) {
                result.add(current.toString().trim());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        final String last = current.toString().trim();
        if (!last.isEmpty() || !result.isEmpty()) {
            result.add(last);
        }
        return result;
    }

    private static boolean isAsciiLetter(final char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }

    private static String single(final String container, final List<String> args) {
        if (args.size() != 1) {
            throw TypeParseException.wrongArity(container, 1, args.size());
        }
        return args.get(0);
    }
}
