package works.wtypes.containers;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.math.BigDecimal;
import java.util.Map;
import java.util.NoSuchElementException;
import org.jetbrains.annotations.Nullable;
import works.wtypes.TypeDescriptor;
import works.wtypes.exceptions.DefinitionError;
import works.wtypes.exceptions.ValidationFailure;
import works.wtypes.schema.Values;

/**
 * A {@link DictContainer} whose fields can also be accessed as attributes:
 * by name with {@link #attr} and {@link #setAttr}, or through a typed interface with {@link #as}.
 * <p>
 * All of these go through the same validation as {@link #put}, so they accept and reject exactly the same values.
 */
public class RecordContainer extends DictContainer {
	public RecordContainer(TypeDescriptor type) {
		super(type);
	}

	public RecordContainer(TypeDescriptor type, @Nullable Map<String, ?> seed) {
		super(type, seed);
	}

	public static RecordContainer from(TypeDescriptor type, @Nullable Object seed) {
		return new RecordContainer(type, requireObject(type, seed));
	}

	/**
	 * @throws NoSuchElementException if the field is absent
	 */
	public Object attr(String name) {
		if (!containsKey(name)) {
			throw new NoSuchElementException("No attribute \"" + name + "\"");
		}
		return get(name);
	}

	/**
	 * @throws ValidationFailure if the value is not allowed, in which case nothing changes
	 */
	public void setAttr(String name, @Nullable Object value) {
		setField(name, value);
	}

	/**
	 * Returns a live view of this record through the given interface.
	 * <p>
	 * A method with no parameters reads the field it names; a method with one parameter writes it.
	 * The field name is given by an {@link Attribute} annotation if present,
	 * or else derived from the method name: {@code port()}, {@code getPort()},
	 * {@code isPort()}, {@code port(p)} and {@code setPort(p)} all refer to the field {@code port}.
	 * Writing methods may return {@code void} or the view itself, for chaining.
	 * Default methods are invoked as written.
	 *
	 * @throws DefinitionError if {@code view} is not an interface
	 */
	public <V> V as(Class<V> view) {
		if (!view.isInterface()) {
			throw new DefinitionError("Attribute view must be an interface: " + view.getName());
		}
		InvocationHandler handler = (proxy, method, args) -> {
			if (method.getDeclaringClass() == Object.class) {
				return objectMethod(proxy, method, args);
			} else if (method.isDefault()) {
				return InvocationHandler.invokeDefault(proxy, method, args);
			}
			int parameterCount = method.getParameterCount();
			if (parameterCount == 0) {
				String name = attributeName(method);
				return coerce(name, attr(name), method.getReturnType());
			} else if (parameterCount == 1) {
				setAttr(attributeName(method), args[0]);
				return method.getReturnType().isInstance(proxy) ? proxy : null;
			} else {
				throw new UnsupportedOperationException("Not an attribute accessor: " + method);
			}
		};
		return view.cast(Proxy.newProxyInstance(view.getClassLoader(), new Class<?>[]{ view }, handler));
	}

	private Object objectMethod(Object proxy, Method method, Object[] args) {
		return switch (method.getName()) {
			case "equals" -> proxy == args[0];
			case "hashCode" -> System.identityHashCode(proxy);
			case "toString" -> proxy.getClass().getInterfaces()[0].getSimpleName() + this;
			default -> throw new UnsupportedOperationException(method.toString());
		};
	}

	private static String attributeName(Method method) {
		Attribute annotation = method.getAnnotation(Attribute.class);
		if (annotation != null) {
			return annotation.value();
		}
		String name = method.getName();
		if (method.getParameterCount() == 0) {
			if (name.startsWith("get") && name.length() > 3) {
				return decapitalize(name.substring(3));
			} else if (name.startsWith("is") && name.length() > 2) {
				return decapitalize(name.substring(2));
			}
		} else if (name.startsWith("set") && name.length() > 3) {
			return decapitalize(name.substring(3));
		}
		return name;
	}

	private static String decapitalize(String s) {
		return Character.toLowerCase(s.charAt(0)) + s.substring(1);
	}

	/**
	 * JSON numbers arrive as whatever {@link Number} subclass the source produced,
	 * so convert them to the numeric type the view method declares.
	 *
	 * @throws IllegalStateException if the value can't be returned as that type without loss
	 */
	private static Object coerce(String name, @Nullable Object value, Class<?> returnType) {
		if (value == null) {
			if (returnType.isPrimitive()) {
				throw new IllegalStateException("Attribute \"" + name + "\" is null and can't be returned as " + returnType);
			}
			return null;
		}
		if (value instanceof Number n) {
			if (returnType == double.class || returnType == Double.class) {
				return n.doubleValue();
			} else if (returnType == float.class || returnType == Float.class) {
				return n.floatValue();
			}
			try {
				if (returnType == int.class || returnType == Integer.class) {
					return exact(n).intValueExact();
				} else if (returnType == long.class || returnType == Long.class) {
					return exact(n).longValueExact();
				} else if (returnType == short.class || returnType == Short.class) {
					return exact(n).shortValueExact();
				} else if (returnType == byte.class || returnType == Byte.class) {
					return exact(n).byteValueExact();
				}
			} catch (ArithmeticException e) {
				throw new IllegalStateException("Attribute \"" + name + "\" value " + value + " can't be returned as " + returnType + " without loss", e);
			}
		}
		return value;
	}

	private static BigDecimal exact(Number n) {
		BigDecimal result = Values.toBigDecimal(n);
		if (result == null) {
			throw new ArithmeticException("Not a finite number: " + n);
		}
		return result;
	}
}
