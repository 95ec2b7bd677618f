/**
 * Conversion between {@link works.bosk.docnode.Node Node} trees and Java values.
 * <p>
 * The major components are:
 *
 * <ul>
 *     <li>
 *         the {@link works.bosk.docnode.convert.Converter Converter} interface and its relatives,
 *         which describe one type's mapping in both directions;
 *     </li>
 *     <li>
 *         the {@link works.bosk.docnode.convert.Category Category} enum,
 *         which sorts every supported type into exactly one kind of conversion; and
 *     </li>
 *     <li>
 *         the {@link works.bosk.docnode.convert.ConversionRegistry ConversionRegistry},
 *         which classifies a requested type and assembles its converter
 *         from the ones in the {@link works.bosk.docnode.convert.scalar scalar},
 *         {@link works.bosk.docnode.convert.container container}
 *         and {@link works.bosk.docnode.convert.binary binary} packages.
 *     </li>
 * </ul>
 *
 * Decoding reports a mismatched node by returning an empty result, never by throwing.
 * Exceptions are reserved for types that can't be converted at all,
 * and for the {@link works.bosk.docnode.convert.ConversionRegistry#as as} conveniences.
 */
package works.bosk.docnode.convert;
