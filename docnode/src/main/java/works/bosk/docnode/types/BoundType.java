package works.bosk.docnode.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;
import java.lang.reflect.TypeVariable;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import works.bosk.docnode.exceptions.UnsupportedTypeException;

import static java.util.stream.Collectors.joining;
import static java.util.stream.Collectors.toList;

/**
 * A class accompanied by its type arguments.
 * <p>
 * For ordinary classes, {@code bindings} will be empty.
 * It is also empty for a generic class used without type arguments,
 * in which case {@link #parameterType} can still find arguments
 * that the class supplies to its supertypes.
 */
public record BoundType(Class<?> rawClass, List<DataType> bindings) implements DataType {
	public BoundType {
		assert !rawClass.isPrimitive() && !rawClass.isArray();
		bindings = List.copyOf(bindings);
	}

	public BoundType(Class<?> rawClass, DataType... bindings) {
		this(rawClass, List.of(bindings));
	}

	/**
	 * Determines the type argument that this type supplies for one of the
	 * type parameters of {@code target}.
	 * For example, if this is {@code ArrayList<String>}, then
	 * {@code parameterType(List.class, 0)} is {@code String}.
	 *
	 * @throws IllegalArgumentException if {@code target} is not a supertype of this type,
	 * or the argument can't be determined because it's not bound
	 */
	public DataType parameterType(Class<?> target, int index) {
		if (!target.isAssignableFrom(rawClass)) {
			throw new IllegalArgumentException(this + " is not a subtype of " + target.getSimpleName());
		}
		List<DataType> arguments = argumentsFor(rawClass, ownBindings(), target);
		DataType result = (arguments == null) ? null : arguments.get(index);
		if (result == null) {
			throw new IllegalArgumentException("Type argument " + index + " of " + target.getSimpleName() + " is not bound in " + this);
		}
		return result;
	}

	private Map<String, DataType> ownBindings() {
		Map<String, DataType> result = new HashMap<>();
		TypeVariable<?>[] parameters = rawClass.getTypeParameters();
		for (int i = 0; i < bindings.size() && i < parameters.length; i++) {
			result.put(parameters[i].getName(), bindings.get(i));
		}
		return result;
	}

	/**
	 * @return the arguments {@code current} supplies to {@code target},
	 * with null for any that are unbound; or null if {@code target} is not found
	 */
	private static List<DataType> argumentsFor(Class<?> current, Map<String, DataType> bindings, Class<?> target) {
		if (current == target) {
			return Arrays.stream(target.getTypeParameters())
				.map(p -> bindings.get(p.getName()))
				.collect(toList());
		}
		Type superclass = current.getGenericSuperclass();
		if (superclass != null) {
			List<DataType> result = argumentsViaSupertype(superclass, bindings, target);
			if (result != null) {
				return result;
			}
		}
		for (Type iface: current.getGenericInterfaces()) {
			List<DataType> result = argumentsViaSupertype(iface, bindings, target);
			if (result != null) {
				return result;
			}
		}
		return null;
	}

	private static List<DataType> argumentsViaSupertype(Type supertype, Map<String, DataType> bindings, Class<?> target) {
		if (supertype instanceof Class<?> c) {
			if (!target.isAssignableFrom(c)) {
				return null;
			}
			return argumentsFor(c, Map.of(), target);
		} else if (supertype instanceof ParameterizedType pt) {
			Class<?> raw = (Class<?>) pt.getRawType();
			if (!target.isAssignableFrom(raw)) {
				return null;
			}
			TypeVariable<?>[] parameters = raw.getTypeParameters();
			Type[] arguments = pt.getActualTypeArguments();
			Map<String, DataType> superBindings = new HashMap<>();
			for (int i = 0; i < parameters.length; i++) {
				DataType resolved = resolve(arguments[i], bindings);
				if (resolved != null) {
					superBindings.put(parameters[i].getName(), resolved);
				}
			}
			return argumentsFor(raw, superBindings, target);
		}
		return null;
	}

	private static DataType resolve(Type argument, Map<String, DataType> bindings) {
		if (argument instanceof TypeVariable<?> tv) {
			return bindings.get(tv.getName());
		}
		try {
			return DataType.of(argument);
		} catch (UnsupportedTypeException e) {
			// Wildcards and nested variables leave the argument unbound
			return null;
		}
	}

	@Override
	public String toString() {
		String simpleName = rawClass.getSimpleName();
		if (simpleName.isEmpty()) {
			// Anonymous classes
			simpleName = rawClass.getName();
			simpleName = simpleName.substring(simpleName.lastIndexOf('.') + 1);
		}
		if (bindings.isEmpty()) {
			return simpleName;
		} else {
			return simpleName + "<"
				+ bindings.stream()
				.map(DataType::toString)
				.collect(joining(","))
				+ ">";
		}
	}
}
