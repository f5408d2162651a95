package works.quill.logback;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.filter.Filter;
import ch.qos.logback.core.spi.FilterReply;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.quill.EditSession;
import works.quill.logging.MdcKeys;

import static ch.qos.logback.core.spi.FilterReply.DENY;
import static ch.qos.logback.core.spi.FilterReply.NEUTRAL;
import static java.util.stream.Collectors.toMap;
import static works.quill.logging.MdcKeys.DOCUMENT;

/**
 * Raises or lowers log levels for the operations on one edited document,
 * leaving the logs of every other document alone.
 * <p>
 * Add this to an appender in <code>logback.xml</code>, then {@link #register} a
 * {@link LogController} under the {@link EditSession#getName() session name}.
 */
public class DocumentLogFilter extends Filter<ILoggingEvent> {
	private static final ConcurrentHashMap<String, LogController> controllersByDocument = new ConcurrentHashMap<>();

	public static final class LogController {
		final Map<String, Level> overrides = new ConcurrentHashMap<>();

		// SLF4J's Level has no OFF, so this uses Logback's
		public void setLogging(Level level, Class<?>... loggers) {
			overrides.putAll(Stream.of(loggers).collect(toMap(Class::getName, c -> level)));
		}

		public void clear() {
			overrides.clear();
		}
	}

	public static LogController withOverrides(String documentName, Level level, Class<?>... loggers) {
		LogController controller = new LogController();
		controller.setLogging(level, loggers);
		register(documentName, controller);
		return controller;
	}

	/**
	 * Causes <code>controller</code> to control logs having
	 * the MDC key {@link MdcKeys#DOCUMENT} equal to <code>documentName</code>.
	 *
	 * @throws IllegalStateException if that document already has a controller
	 */
	public static void register(String documentName, LogController controller) {
		LOGGER.debug("Registering controller {} for document \"{}\"", System.identityHashCode(controller), documentName);
		LogController old = controllersByDocument.putIfAbsent(documentName, controller);
		if (old != null && old != controller) {
			throw new IllegalStateException("Document \"" + documentName + "\" already has a log controller");
		}
	}

	public static void unregister(String documentName) {
		controllersByDocument.remove(documentName);
	}

	@Override
	public FilterReply decide(ILoggingEvent event) {
		String documentName = event.getMDCPropertyMap().get(DOCUMENT);
		if (documentName == null) {
			return NEUTRAL;
		}
		var controller = controllersByDocument.get(documentName);
		if (controller == null) {
			return NEUTRAL;
		}
		Level level = controller.overrides.get(event.getLoggerName());
		if (level == null) {
			return NEUTRAL;
		}
		if (event.getLevel().isGreaterOrEqual(level)) {
			return NEUTRAL;
		} else {
			return DENY;
		}
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(DocumentLogFilter.class);
}
