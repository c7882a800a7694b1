package works.wtypes.schema;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks for the string {@link Keyword#FORMAT formats} the library knows about.
 * Unknown format names are annotations only and accept every string.
 */
public final class Formats {
	private Formats() {}

	public static final String DATE_TIME = "date-time";
	public static final String DATE = "date";
	public static final String TIME = "time";
	public static final String EMAIL = "email";
	public static final String HOSTNAME = "hostname";
	public static final String IPV4 = "ipv4";
	public static final String IPV6 = "ipv6";
	public static final String URI_FORMAT = "uri";
	public static final String UUID = "uuid";
	public static final String REGEX = "regex";

	private static final Pattern EMAIL_PATTERN = Pattern.compile("[^@\\s]+@[^@\\s]+");
	private static final Pattern HOSTNAME_LABEL = Pattern.compile("[A-Za-z0-9]([A-Za-z0-9-]{0,61}[A-Za-z0-9])?");
	private static final Pattern IPV4_PATTERN = Pattern.compile("(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)(\\.(25[0-5]|2[0-4]\\d|1\\d\\d|[1-9]?\\d)){3}");
	private static final Pattern UUID_PATTERN = Pattern.compile("[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
	private static final Pattern HEX_GROUP = Pattern.compile("[0-9a-fA-F]{1,4}");

	private static final Map<String, Predicate<String>> CHECKS = Map.of(
		DATE_TIME, s -> parses(() -> OffsetDateTime.parse(s.toUpperCase(Locale.ROOT))),
		DATE, s -> parses(() -> LocalDate.parse(s)),
		TIME, s -> parses(() -> OffsetTime.parse(s.toUpperCase(Locale.ROOT))) || parses(() -> LocalTime.parse(s)),
		EMAIL, s -> EMAIL_PATTERN.matcher(s).matches(),
		HOSTNAME, Formats::isHostname,
		IPV4, s -> IPV4_PATTERN.matcher(s).matches(),
		IPV6, Formats::isIpv6,
		URI_FORMAT, Formats::isAbsoluteUri,
		UUID, s -> UUID_PATTERN.matcher(s).matches(),
		REGEX, Formats::isRegex
	);

	private static final Map<String, Pattern> PATTERN_CACHE = new ConcurrentHashMap<>();

	public static boolean isKnown(String format) {
		return CHECKS.containsKey(format);
	}

	public static boolean conforms(String format, String value) {
		Predicate<String> check = CHECKS.get(format);
		return check == null || check.test(value);
	}

	/**
	 * For {@code pattern} keywords, whose number is bounded by the schemas declared.
	 *
	 * @throws PatternSyntaxException if {@code regex} is malformed
	 */
	public static Pattern compiledPattern(String regex) {
		Pattern result = PATTERN_CACHE.get(regex);
		if (result == null) {
			result = Pattern.compile(regex);
			Pattern existing = PATTERN_CACHE.putIfAbsent(regex, result);
			if (existing != null) {
				result = existing;
			}
		}
		return result;
	}

	static int cachedPatternCount() {
		return PATTERN_CACHE.size();
	}

	private static boolean parses(Runnable parser) {
		try {
			parser.run();
			return true;
		} catch (DateTimeParseException e) {
			return false;
		}
	}

	private static boolean isHostname(String s) {
		String name = s.endsWith(".") ? s.substring(0, s.length() - 1) : s;
		if (name.isEmpty() || name.length() > 253) {
			return false;
		}
		for (String label : name.split("\\.", -1)) {
			if (!HOSTNAME_LABEL.matcher(label).matches()) {
				return false;
			}
		}
		return true;
	}

	private static boolean isIpv6(String s) {
		int doubleColon = s.indexOf("::");
		if (doubleColon != s.lastIndexOf("::")) {
			return false;
		}
		String body = s;
		int groupsAvailable = 8;
		int lastColon = s.lastIndexOf(':');
		if (lastColon >= 0 && s.indexOf('.', lastColon) > lastColon) {
			// Embedded IPv4 tail occupies two groups
			if (!IPV4_PATTERN.matcher(s.substring(lastColon + 1)).matches()) {
				return false;
			}
			body = s.substring(0, lastColon + 1) + "0";
			groupsAvailable = 7;
		}
		if (doubleColon >= 0) {
			String head = body.substring(0, doubleColon);
			String tail = body.substring(doubleColon + 2);
			int headGroups = countGroups(head);
			int tailGroups = countGroups(tail);
			return headGroups >= 0 && tailGroups >= 0 && headGroups + tailGroups < groupsAvailable;
		} else {
			return countGroups(body) == groupsAvailable;
		}
	}

	/**
	 * @return the number of colon-separated hex groups, or -1 if malformed
	 */
	private static int countGroups(String s) {
		if (s.isEmpty()) {
			return 0;
		}
		String[] groups = s.split(":", -1);
		for (String g : groups) {
			if (!HEX_GROUP.matcher(g).matches()) {
				return -1;
			}
		}
		return groups.length;
	}

	private static boolean isAbsoluteUri(String s) {
		try {
			return new URI(s).isAbsolute();
		} catch (URISyntaxException e) {
			return false;
		}
	}

	/**
	 * Data values are compiled without caching; only declared {@code pattern} keywords are cached.
	 */
	private static boolean isRegex(String s) {
		try {
			Pattern.compile(s);
			return true;
		} catch (PatternSyntaxException e) {
			return false;
		}
	}
}
