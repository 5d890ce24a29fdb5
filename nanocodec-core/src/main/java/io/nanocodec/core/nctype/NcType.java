// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.nctype;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Parsed form of a type descriptor such as {@code "SignedData[Optional[int]]"}.
 *
 * <p>
 * Every node is either a {@link Simple} leaf or a container over one or more child nodes. Trees
 * are immutable and acyclic. {@link #typeName()} renders a normalized descriptor: single spaces
 * after commas, collection names in lower case.
 *
 * <p>Nested names shadow {@code java.util.Optional} and {@code java.util.Collection}; refer to
 * them as {@code NcType.Optional} and {@code NcType.Collection} from outside.
 */
public sealed interface NcType {

    enum Kind {
        SIMPLE,
        OPTIONAL,
        SIGNED_DATA,
        RAW_SIGNED_DATA,
        TUPLE,
        COLLECTION,
        DICT
    }

    Kind kind();

    String typeName();

    record Simple(LeafType leaf) implements NcType {
        public Simple {
            Objects.requireNonNull(leaf, "leaf");
        }

        @Override
        public Kind kind() {
            return Kind.SIMPLE;
        }

        @Override
        public String typeName() {
            return leaf.typeName();
        }
    }

    record Optional(NcType inner) implements NcType {
        public Optional {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public Kind kind() {
            return Kind.OPTIONAL;
        }

        @Override
        public String typeName() {
            return inner.typeName() + "?";
        }
    }

    /**
     * Value signed on behalf of a producer contract.
     *
     * @param subtype the inner descriptor as written, compared against the envelope's declared type
     */
    record SignedData(NcType inner, String subtype) implements NcType {
        public SignedData {
            Objects.requireNonNull(inner, "inner");
            Objects.requireNonNull(subtype, "subtype");
        }

        @Override
        public Kind kind() {
            return Kind.SIGNED_DATA;
        }

        @Override
        public String typeName() {
            return "SignedData[" + inner.typeName() + "]";
        }
    }

    record RawSignedData(NcType inner, String subtype) implements NcType {
        public RawSignedData {
            Objects.requireNonNull(inner, "inner");
            Objects.requireNonNull(subtype, "subtype");
        }

        @Override
        public Kind kind() {
            return Kind.RAW_SIGNED_DATA;
        }

        @Override
        public String typeName() {
            return "RawSignedData[" + inner.typeName() + "]";
        }
    }

    record Tuple(List<NcType> elements) implements NcType {
        public Tuple {
            elements = List.copyOf(elements);
            if (elements.isEmpty()) {
                throw new IllegalArgumentException("Tuple needs at least one element");
            }
        }

        @Override
        public Kind kind() {
            return Kind.TUPLE;
        }

        @Override
        public String typeName() {
            return elements.stream().map(NcType::typeName).collect(Collectors.joining(", ", "Tuple[", "]"));
        }
    }

    record Collection(CollectionKind collectionKind, NcType element) implements NcType {
        public Collection {
            Objects.requireNonNull(collectionKind, "collectionKind");
            Objects.requireNonNull(element, "element");
        }

        @Override
        public Kind kind() {
            return Kind.COLLECTION;
        }

        @Override
        public String typeName() {
            return collectionKind.typeName() + "[" + element.typeName() + "]";
        }
    }

    record Dict(NcType key, NcType value) implements NcType {
        public Dict {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Kind kind() {
            return Kind.DICT;
        }

        @Override
        public String typeName() {
            return "Dict[" + key.typeName() + ", " + value.typeName() + "]";
        }
    }
}
