package works.bosk.docnode.convert;

import works.bosk.docnode.Node;

/**
 * A {@link Converter} for mutable containers that can also decode into
 * a container supplied by the caller.
 */
public interface ContainerConverter<T> extends Converter<T> {
	/**
	 * On failure, {@code destination} may have been partially overwritten,
	 * depending on the {@link works.bosk.docnode.convert.container.ContainerDecodeMode ContainerDecodeMode};
	 * the individual converters document exactly how.
	 *
	 * @return true if {@code node} was decoded successfully into {@code destination}
	 */
	boolean decodeInto(Node node, T destination);
}
