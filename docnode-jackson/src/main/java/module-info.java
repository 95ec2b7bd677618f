/**
 * Bridges Jackson {@link tools.jackson.databind.JsonNode JsonNode} trees
 * and document {@link works.bosk.docnode.Node Node} trees,
 * so JSON can be decoded into Java values by a
 * {@link works.bosk.docnode.convert.ConversionRegistry ConversionRegistry}.
 */
module works.bosk.docnode.jackson {
	requires transitive works.bosk.docnode;
	requires transitive tools.jackson.core;
	requires transitive tools.jackson.databind;
	requires org.slf4j;

	exports works.bosk.docnode.jackson;
}
