package works.wtypes.schema;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.jetbrains.annotations.Nullable;

/**
 * Helpers for treating plain Java values as JSON values.
 */
public final class Values {
	private Values() {}

	/**
	 * @return the exact decimal value of {@code n}, or null if it isn't finite
	 */
	public static @Nullable BigDecimal toBigDecimal(Number n) {
		if (n instanceof BigDecimal bd) {
			return bd;
		} else if (n instanceof BigInteger bi) {
			return new BigDecimal(bi);
		} else if (n instanceof Double || n instanceof Float) {
			double d = n.doubleValue();
			if (Double.isNaN(d) || Double.isInfinite(d)) {
				return null;
			}
			return BigDecimal.valueOf(d);
		} else if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte) {
			return BigDecimal.valueOf(n.longValue());
		} else {
			try {
				return new BigDecimal(n.toString());
			} catch (NumberFormatException e) {
				return null;
			}
		}
	}

	public static boolean isIntegral(Number n) {
		if (n instanceof Long || n instanceof Integer || n instanceof Short || n instanceof Byte || n instanceof BigInteger) {
			return true;
		}
		BigDecimal bd = toBigDecimal(n);
		return bd != null && (bd.signum() == 0 || bd.stripTrailingZeros().scale() <= 0);
	}

	/**
	 * JSON equality: numbers compare by value regardless of their Java class,
	 * objects compare by their members, and arrays element by element.
	 */
	public static boolean jsonEquals(@Nullable Object a, @Nullable Object b) {
		if (a == b) {
			return true;
		} else if (a instanceof Number na && b instanceof Number nb) {
			BigDecimal da = toBigDecimal(na);
			BigDecimal db = toBigDecimal(nb);
			if (da == null || db == null) {
				return a.equals(b);
			}
			return da.compareTo(db) == 0;
		} else if (a instanceof CharSequence && b instanceof CharSequence) {
			return a.toString().equals(b.toString());
		} else if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
			if (ma.size() != mb.size()) {
				return false;
			}
			for (Map.Entry<?, ?> e : ma.entrySet()) {
				if (!mb.containsKey(e.getKey()) || !jsonEquals(e.getValue(), mb.get(e.getKey()))) {
					return false;
				}
			}
			return true;
		} else if (a instanceof List<?> la && b instanceof List<?> lb) {
			if (la.size() != lb.size()) {
				return false;
			}
			Iterator<?> ia = la.iterator();
			Iterator<?> ib = lb.iterator();
			while (ia.hasNext()) {
				if (!jsonEquals(ia.next(), ib.next())) {
					return false;
				}
			}
			return true;
		} else {
			return Objects.equals(a, b);
		}
	}

	/**
	 * @return a copy of {@code value} in which every {@link Map} and {@link List}
	 * has been replaced by a fresh {@link LinkedHashMap} or {@link ArrayList}.
	 * Other values are shared.
	 */
	public static @Nullable Object deepCopy(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(k, deepCopy(v)));
			return result;
		} else if (value instanceof List<?> list) {
			List<Object> result = new ArrayList<>(list.size());
			list.forEach(v -> result.add(deepCopy(v)));
			return result;
		} else {
			return value;
		}
	}

	/**
	 * @return a copy of {@code value} in which every {@link Map} and {@link List}
	 * has been replaced by an unmodifiable copy, so that nobody holding the original
	 * (or the result) can change the nested contents afterward. Other values are shared.
	 */
	public static @Nullable Object freeze(@Nullable Object value) {
		if (value instanceof Map<?, ?> map) {
			Map<Object, Object> result = new LinkedHashMap<>();
			map.forEach((k, v) -> result.put(k, freeze(v)));
			return Collections.unmodifiableMap(result);
		} else if (value instanceof List<?> list) {
			List<Object> result = new ArrayList<>(list.size());
			list.forEach(v -> result.add(freeze(v)));
			return Collections.unmodifiableList(result);
		} else {
			return value;
		}
	}
}
