package works.bosk.docnode.convert;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.bosk.docnode.Node;
import works.bosk.docnode.Pair;
import works.bosk.docnode.convert.binary.BinaryConverter;
import works.bosk.docnode.convert.container.ArrayConverter;
import works.bosk.docnode.convert.container.ListConverter;
import works.bosk.docnode.convert.container.MapConverter;
import works.bosk.docnode.convert.container.PairConverter;
import works.bosk.docnode.convert.scalar.BooleanConverter;
import works.bosk.docnode.convert.scalar.CharacterConverter;
import works.bosk.docnode.convert.scalar.FloatingPointConverter;
import works.bosk.docnode.convert.scalar.NodeConverter;
import works.bosk.docnode.convert.scalar.NullConverter;
import works.bosk.docnode.convert.scalar.SignedIntegerConverter;
import works.bosk.docnode.convert.scalar.StringConverter;
import works.bosk.docnode.convert.scalar.TextEncoder;
import works.bosk.docnode.convert.scalar.UnsignedIntegerConverter;
import works.bosk.docnode.exceptions.BadConversionException;
import works.bosk.docnode.exceptions.UnsupportedTypeException;
import works.bosk.docnode.types.ArrayType;
import works.bosk.docnode.types.BoundType;
import works.bosk.docnode.types.DataType;
import works.bosk.docnode.types.TypeReference;

import static java.util.Objects.requireNonNull;
import static works.bosk.docnode.convert.container.ArrayConverter.ANY_LENGTH;
import static works.bosk.docnode.convert.container.ContainerFactories.listFactory;
import static works.bosk.docnode.convert.container.ContainerFactories.mapFactory;

/**
 * Finds the {@link Encoder} or {@link Converter} for a given type.
 * <p>
 * Each type is {@link Category#of classified} the first time it's requested,
 * and the resulting converter is remembered, so later requests are cheap.
 * Converters for container element, key and value types come from the same registry,
 * so they share its {@link ConversionSettings}.
 * <p>
 * A type that can't be converted is rejected with {@link UnsupportedTypeException}
 * when its converter is requested, before any node is read.
 * That includes container types whose element types lead back to themselves,
 * like {@code class Tree extends ArrayList<Tree>}.
 * <p>
 * Registries and the converters they return are thread-safe.
 */
public final class ConversionRegistry {
	private static final Logger LOGGER = LoggerFactory.getLogger(ConversionRegistry.class);

	static {
		Category.verifyPartition();
	}

	private static final ConversionRegistry STANDARD = new ConversionRegistry(ConversionSettings.DEFAULT);

	private final ConversionSettings settings;
	private final Map<DataType, Encoder<?>> memo = new ConcurrentHashMap<>();

	/**
	 * Types whose converters this thread is currently building.
	 */
	private final ThreadLocal<Set<DataType>> inProgress = ThreadLocal.withInitial(HashSet::new);

	private ConversionRegistry(ConversionSettings settings) {
		this.settings = requireNonNull(settings);
	}

	/**
	 * @return a shared registry with {@link ConversionSettings#DEFAULT default settings}
	 */
	public static ConversionRegistry standard() {
		return STANDARD;
	}

	public static ConversionRegistry create(ConversionSettings settings) {
		return new ConversionRegistry(settings);
	}

	public ConversionSettings settings() {
		return settings;
	}

	public Category categoryOf(DataType type) {
		return Category.of(type);
	}

	@SuppressWarnings("unchecked")
	public <T> Encoder<T> encoderFor(Class<T> type) {
		return (Encoder<T>) encoderFor(DataType.of(type));
	}

	@SuppressWarnings("unchecked")
	public <T> Encoder<T> encoderFor(TypeReference<T> type) {
		return (Encoder<T>) encoderFor(DataType.of(type));
	}

	public Encoder<?> encoderFor(DataType type) {
		Encoder<?> result = memo.get(type);
		if (result == null) {
			// Not computeIfAbsent: building a container converter
			// recursively requests its element converters.
			Set<DataType> building = inProgress.get();
			if (!building.add(type)) {
				throw new UnsupportedTypeException("Recursive type " + type + " contains itself");
			}
			Encoder<?> built;
			try {
				built = build(type);
			} finally {
				building.remove(type);
			}
			result = memo.putIfAbsent(type, built);
			if (result == null) {
				result = built;
			}
		}
		return result;
	}

	@SuppressWarnings("unchecked")
	public <T> Converter<T> converterFor(Class<T> type) {
		return (Converter<T>) converterFor(DataType.of(type));
	}

	@SuppressWarnings("unchecked")
	public <T> Converter<T> converterFor(TypeReference<T> type) {
		return (Converter<T>) converterFor(DataType.of(type));
	}

	/**
	 * @throws UnsupportedTypeException if {@code type} can't be converted,
	 * or can only be encoded
	 */
	public Converter<?> converterFor(DataType type) {
		Encoder<?> encoder = encoderFor(type);
		if (encoder instanceof Converter<?> c) {
			return c;
		} else {
			throw new UnsupportedTypeException("Type " + type + " can be encoded but not decoded");
		}
	}

	/**
	 * @throws UnsupportedTypeException if {@code type} is not a
	 * {@link Category#isContainer() container} type
	 */
	public ContainerConverter<?> containerConverterFor(DataType type) {
		Converter<?> converter = converterFor(type);
		if (converter instanceof ContainerConverter<?> c) {
			return c;
		} else {
			throw new UnsupportedTypeException("Type " + type + " can't be decoded into an existing object");
		}
	}

	public <T> Node encode(T value, Class<T> type) {
		return Encoder.encodeNullable(encoderFor(type), value);
	}

	public <T> Node encode(T value, TypeReference<T> type) {
		return Encoder.encodeNullable(encoderFor(type), value);
	}

	public <T> Optional<T> decode(Node node, Class<T> type) {
		return converterFor(type).decode(node);
	}

	public <T> Optional<T> decode(Node node, TypeReference<T> type) {
		return converterFor(type).decode(node);
	}

	/**
	 * What's left in {@code destination} on failure depends on
	 * {@link ConversionSettings#getContainerDecodeMode()}.
	 *
	 * @return true if the decode succeeded
	 */
	public <T> boolean decodeInto(Node node, T destination, Class<T> type) {
		return decodeInto(node, destination, DataType.of(type));
	}

	public <T> boolean decodeInto(Node node, T destination, TypeReference<T> type) {
		return decodeInto(node, destination, DataType.of(type));
	}

	@SuppressWarnings("unchecked")
	private <T> boolean decodeInto(Node node, T destination, DataType type) {
		ContainerConverter<T> converter = (ContainerConverter<T>) containerConverterFor(type);
		return converter.decodeInto(node, requireNonNull(destination));
	}

	/**
	 * @throws BadConversionException if {@code node} doesn't decode as {@code type}
	 */
	public <T> T as(Node node, Class<T> type) {
		return converterFor(type).decode(node)
			.orElseThrow(() -> new BadConversionException(node, DataType.of(type)));
	}

	public <T> T as(Node node, TypeReference<T> type) {
		return converterFor(type).decode(node)
			.orElseThrow(() -> new BadConversionException(node, DataType.of(type)));
	}

	/**
	 * @return the decoded value, or {@code fallback} if {@code node} doesn't decode as {@code type}
	 */
	public <T> T as(Node node, Class<T> type, T fallback) {
		return converterFor(type).decode(node).orElse(fallback);
	}

	public <T> T as(Node node, TypeReference<T> type, T fallback) {
		return converterFor(type).decode(node).orElse(fallback);
	}

	private Encoder<?> build(DataType type) {
		Category category = Category.of(type);
		LOGGER.debug("Building converter for {} in category {}", type, category);
		try {
			return switch (category) {
				case BOOLEAN -> new BooleanConverter();
				case SIGNED_INTEGER -> SignedIntegerConverter.forClass(type.rawClass());
				case UNSIGNED_INTEGER -> UnsignedIntegerConverter.forClass(type.rawClass());
				case FLOATING_POINT -> FloatingPointConverter.forClass(type.rawClass(), settings.getFloatFormat());
				case CHARACTER_UNIT -> new CharacterConverter();
				case STRING -> new StringConverter();
				case NULL -> new NullConverter();
				case NODE -> new NodeConverter();
				case SEQUENCE -> listConverter((BoundType) type);
				case FIXED_ARRAY -> arrayConverter((ArrayType) type);
				case PAIR -> pairConverter((BoundType) type);
				case MAP -> mapConverter((BoundType) type);
				case BINARY -> new BinaryConverter(settings.getBase64Codec());
				case ENCODE_ONLY_TEXT -> new TextEncoder();
			};
		} catch (IllegalArgumentException e) {
			throw new UnsupportedTypeException("Can't convert type " + type + ": " + e.getMessage(), e);
		}
	}

	private ListConverter<Object> listConverter(BoundType type) {
		DataType elementType = type.parameterType(List.class, 0);
		return new ListConverter<>(
			elementConverter(elementType, type),
			listFactory(type.rawClass()),
			settings.getContainerDecodeMode());
	}

	private ArrayConverter arrayConverter(ArrayType type) {
		DataType elementType = type.elementType();
		return new ArrayConverter(
			elementType.rawClass(),
			elementConverter(elementType, type),
			ANY_LENGTH,
			settings.getContainerDecodeMode());
	}

	private PairConverter<Object, Object> pairConverter(BoundType type) {
		return new PairConverter<>(
			elementConverter(type.parameterType(Pair.class, 0), type),
			elementConverter(type.parameterType(Pair.class, 1), type));
	}

	private MapConverter<Object, Object> mapConverter(BoundType type) {
		return new MapConverter<>(
			elementConverter(type.parameterType(Map.class, 0), type),
			elementConverter(type.parameterType(Map.class, 1), type),
			mapFactory(type.rawClass()),
			settings.getContainerDecodeMode());
	}

	@SuppressWarnings("unchecked")
	private Converter<Object> elementConverter(DataType elementType, DataType containerType) {
		Encoder<?> encoder = encoderFor(elementType);
		if (encoder instanceof Converter<?> c) {
			return (Converter<Object>) c;
		} else {
			throw new UnsupportedTypeException("Container type " + containerType + " has element type " + elementType + " that can't be decoded");
		}
	}
}
