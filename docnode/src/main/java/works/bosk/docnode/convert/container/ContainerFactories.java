package works.bosk.docnode.convert.container;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Chooses how to create a fresh container of a requested type.
 */
public final class ContainerFactories {
	private ContainerFactories() {}

	/**
	 * @throws IllegalArgumentException if no suitable implementation is known
	 */
	@SuppressWarnings("unchecked")
	public static <E> Supplier<List<E>> listFactory(Class<?> listClass) {
		if (listClass == List.class || listClass == ArrayList.class) {
			return ArrayList::new;
		} else if (listClass == LinkedList.class) {
			return LinkedList::new;
		} else {
			return (Supplier<List<E>>) (Supplier<?>) reflectiveFactory(listClass);
		}
	}

	/**
	 * Plain {@link Map} gets a {@link LinkedHashMap} so it keeps the node's order.
	 *
	 * @throws IllegalArgumentException if no suitable implementation is known
	 */
	@SuppressWarnings("unchecked")
	public static <K, V> Supplier<Map<K, V>> mapFactory(Class<?> mapClass) {
		if (mapClass == Map.class || mapClass == AbstractMap.class || mapClass == LinkedHashMap.class) {
			return LinkedHashMap::new;
		} else if (mapClass == HashMap.class) {
			return HashMap::new;
		} else if (mapClass == SortedMap.class || mapClass == NavigableMap.class || mapClass == TreeMap.class) {
			return TreeMap::new;
		} else {
			return (Supplier<Map<K, V>>) (Supplier<?>) reflectiveFactory(mapClass);
		}
	}

	private static Supplier<Object> reflectiveFactory(Class<?> containerClass) {
		if (containerClass.isInterface() || Modifier.isAbstract(containerClass.getModifiers())) {
			throw new IllegalArgumentException("No default implementation for " + containerClass.getSimpleName());
		}
		Constructor<?> constructor;
		try {
			constructor = containerClass.getConstructor();
		} catch (NoSuchMethodException e) {
			throw new IllegalArgumentException(containerClass.getSimpleName() + " has no public no-argument constructor", e);
		}
		return () -> {
			try {
				return constructor.newInstance();
			} catch (InstantiationException | IllegalAccessException e) {
				throw new IllegalStateException("Unable to instantiate " + containerClass.getSimpleName(), e);
			} catch (InvocationTargetException e) {
				throw new IllegalStateException("Constructor of " + containerClass.getSimpleName() + " failed", e.getCause());
			}
		};
	}
}
