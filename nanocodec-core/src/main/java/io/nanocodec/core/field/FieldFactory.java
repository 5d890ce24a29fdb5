// SPDX-License-Identifier: MIT OR Apache-2.0
package io.nanocodec.core.field;

import io.nanocodec.core.DebugLogger;
import io.nanocodec.core.chain.Network;
import io.nanocodec.core.error.TypeParseException;
import io.nanocodec.core.nctype.NcType;
import io.nanocodec.core.nctype.NcTypeParser;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps type nodes to field codecs. Children are built before the container that wraps them.
 *
 * <p>
 * Several names deliberately share one codec:
 * <ul>
 * <li>{@code bytes}, {@code TxOutputScript} -&gt; {@link BytesField}</li>
 * <li>{@code ContractId}, {@code BlueprintId}, {@code VertexId} -&gt; {@link Bytes32Field}</li>
 * <li>{@code int}, {@code VarInt} -&gt; {@link IntField}</li>
 * <li>{@code SignedData}, {@code RawSignedData} -&gt; {@link SignedDataField}</li>
 * <li>{@code list}, {@code set}, {@code deque}, {@code frozenset} -&gt; {@link CollectionField}</li>
 * </ul>
 */
public final class FieldFactory {

    private FieldFactory() {}

    /**
     * Parses {@code descriptor} and builds its field.
     *
     * @throws TypeParseException if the descriptor cannot be parsed
     */
    public static NcField<?> fieldFor(final String descriptor, final Network network) {
        final NcType type = NcTypeParser.parse(descriptor);
        DebugLogger.logParse("[nc type] %s parsed as %s", descriptor, type);
        return fieldFor(type, network);
    }

    public static NcField<?> fieldFor(final NcType type, final Network network) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(network, "network");
        switch (type.kind()) {
            case SIMPLE:
                return simpleField((NcType.Simple) type, network);
            case OPTIONAL:
                return new OptionalField<>(fieldFor(((NcType.Optional) type).inner(), network));
            case SIGNED_DATA: {
                final NcType.SignedData signed = (NcType.SignedData) type;
                return SignedDataField.signed(fieldFor(signed.inner(), network), signed.subtype());
            }
            case RAW_SIGNED_DATA: {
                final NcType.RawSignedData raw = (NcType.RawSignedData) type;
                return SignedDataField.raw(fieldFor(raw.inner(), network), raw.subtype());
            }
            case TUPLE: {
                final List<NcField<?>> elements = new ArrayList<>();
                for (NcType element : ((NcType.Tuple) type).elements()) {
                    elements.add(fieldFor(element, network));
                }
                return new TupleField(elements);
            }
            case COLLECTION: {
                final NcType.Collection collection = (NcType.Collection) type;
                return new CollectionField<>(collection.collectionKind(), fieldFor(collection.element(), network));
            }
            case DICT: {
                final NcType.Dict dict = (NcType.Dict) type;
                return new DictField<>(fieldFor(dict.key(), network), fieldFor(dict.value(), network));
            }
            default:
                throw TypeParseException.unsupportedType(type.typeName());
        }
    }

    private static NcField<?> simpleField(final NcType.Simple simple, final Network network) {
        switch (simple.leaf()) {
            case STR:
                return new StrField();
            case INT:
            case VAR_INT:
                return new IntField(simple.leaf());
            case BOOL:
                return new BoolField();
            case FLOAT:
                return new FloatField();
            case BYTES:
            case TX_OUTPUT_SCRIPT:
                return new BytesField(simple.leaf());
            case ADDRESS:
                return new AddressField(network);
            case TIMESTAMP:
                return new TimestampField();
            case AMOUNT:
                return new AmountField();
            case TOKEN_UID:
                return new TokenUidField();
            case BLUEPRINT_ID:
            case CONTRACT_ID:
            case VERTEX_ID:
                return new Bytes32Field(simple.leaf());
            case CALLER_ID:
                return new CallerIdField(network);
            default:
                throw TypeParseException.unsupportedType(simple.typeName());
        }
    }
}
