/**
 * Conversion between weakly-typed document {@link works.bosk.docnode.Node nodes}
 * and strongly-typed Java values.
 * <p>
 * The major packages are:
 *
 * <ul>
 *     <li>
 *         {@link works.bosk.docnode}, the document node model
 *         and the value types it introduces;
 *     </li>
 *     <li>
 *         {@link works.bosk.docnode.types},
 *         a compact description of the Java types that can be converted;
 *     </li>
 *     <li>
 *         {@link works.bosk.docnode.convert},
 *         whose {@link works.bosk.docnode.convert.ConversionRegistry ConversionRegistry}
 *         classifies a requested type and hands out a matching
 *         {@link works.bosk.docnode.convert.Converter Converter}; and
 *     </li>
 *     <li>
 *         {@link works.bosk.docnode.exceptions}, for exception-style callers.
 *     </li>
 * </ul>
 */
module works.bosk.docnode {
	requires com.google.common;
	requires org.slf4j;

	requires static lombok;

	exports works.bosk.docnode;
	exports works.bosk.docnode.convert;
	exports works.bosk.docnode.convert.binary;
	exports works.bosk.docnode.convert.container;
	exports works.bosk.docnode.convert.scalar;
	exports works.bosk.docnode.exceptions;
	exports works.bosk.docnode.types;
}
