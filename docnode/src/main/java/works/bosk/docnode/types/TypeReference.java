package works.bosk.docnode.types;

import java.lang.reflect.ParameterizedType;
import java.lang.reflect.Type;

/**
 * Captures a generic type for use at runtime:
 * <pre>
 * new TypeReference&lt;Map&lt;String, List&lt;Integer&gt;&gt;&gt;() { }
 * </pre>
 */
@SuppressWarnings("unused") // The type parameter is used only via reflection
public abstract class TypeReference<T> {
	Type reflectionType() {
		return ((ParameterizedType) getClass().getGenericSuperclass()).getActualTypeArguments()[0];
	}
}
