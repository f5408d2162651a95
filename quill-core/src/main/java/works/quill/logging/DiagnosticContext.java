package works.quill.logging;

import java.util.HashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.slf4j.MDC;

/**
 * A thread-local set of name-value pairs, mirrored into SLF4J's {@link MDC},
 * that lets every log line emitted during an operation say which document
 * and schema it concerns.
 * <p>
 * Scopes nest: closing a scope restores the attributes that were in effect when it opened.
 */
public final class DiagnosticContext {
	private DiagnosticContext() { }

	public static final class DiagnosticScope implements AutoCloseable {
		private final Map<String, String> oldValues = new HashMap<>();

		DiagnosticScope(Map<String, String> attributes) {
			attributes.forEach((name, value) -> {
				oldValues.put(name, MDC.get(name));
				MDC.put(name, value);
			});
		}

		@Override
		public void close() {
			oldValues.forEach((name, value) -> {
				if (value == null) {
					MDC.remove(name);
				} else {
					MDC.put(name, value);
				}
			});
		}
	}

	/**
	 * @return the current thread's value of the attribute with the given <code>name</code>,
	 * or <code>null</code> if no such attribute has been defined.
	 */
	public static @Nullable String getAttribute(String name) {
		return MDC.get(name);
	}

	/**
	 * Adds a single attribute to the current thread's diagnostic context.
	 * If the attribute already exists, it will be replaced until the scope closes.
	 */
	public static DiagnosticScope withAttribute(String name, String value) {
		return new DiagnosticScope(Map.of(name, value));
	}

	public static DiagnosticScope withAttributes(Map<String, String> attributes) {
		return new DiagnosticScope(attributes);
	}
}
