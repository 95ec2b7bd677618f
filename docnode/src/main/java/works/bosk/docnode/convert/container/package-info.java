/**
 * Converters for sequences, fixed-length arrays, pairs and maps.
 * Their elements are handled by other converters supplied at construction.
 */
package works.bosk.docnode.convert.container;
