package works.bosk.docnode.types;

import java.lang.reflect.GenericArrayType;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.util.List;
import java.util.stream.Stream;
import works.bosk.docnode.exceptions.UnsupportedTypeException;

/**
 * A fully-specified Java type: a primitive, a class with its type arguments, or an array.
 * <p>
 * Unlike {@link Type}, these have value semantics, so they work as map keys.
 * Type variables and wildcards are not supported, since there would be
 * no way to know which conversion to use for them.
 */
public sealed interface DataType permits ArrayType, BoundType, PrimitiveType {
	PrimitiveType BOOLEAN = new PrimitiveType(boolean.class);
	PrimitiveType BYTE = new PrimitiveType(byte.class);
	PrimitiveType SHORT = new PrimitiveType(short.class);
	PrimitiveType INT = new PrimitiveType(int.class);
	PrimitiveType LONG = new PrimitiveType(long.class);
	PrimitiveType FLOAT = new PrimitiveType(float.class);
	PrimitiveType DOUBLE = new PrimitiveType(double.class);
	PrimitiveType CHAR = new PrimitiveType(char.class);
	BoundType STRING = new BoundType(String.class, List.of());

	/**
	 * For primitives, the primitive class; for arrays, the array class;
	 * otherwise, the class with its type arguments erased.
	 */
	Class<?> rawClass();

	/**
	 * @throws UnsupportedTypeException if {@code type} is, or contains,
	 * a type variable or wildcard
	 */
	static DataType of(Type type) {
		if (type instanceof Class<?> clazz) {
			if (clazz.isArray()) {
				return new ArrayType(of(clazz.getComponentType()));
			} else if (clazz.isPrimitive()) {
				return new PrimitiveType(clazz);
			} else {
				return new BoundType(clazz, List.of());
			}
		} else if (type instanceof ParameterizedType pt) {
			return new BoundType(
				(Class<?>) pt.getRawType(),
				Stream.of(pt.getActualTypeArguments()).map(DataType::of).toList());
		} else if (type instanceof GenericArrayType t) {
			return new ArrayType(of(t.getGenericComponentType()));
		}
		throw new UnsupportedTypeException("Unsupported type: " + type);
	}

	static DataType of(TypeReference<?> ref) {
		return of(ref.reflectionType());
	}
}
