package works.wtypes.containers;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * On a method of an interface passed to {@link RecordContainer#as},
 * names the field the method reads or writes, overriding the name derived from the method.
 */
@Retention(RUNTIME)
@Target(METHOD)
public @interface Attribute {
	String value();
}
