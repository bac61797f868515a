package org.javai.srilang.testsupport;

import java.io.Serializable;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.Layout;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.layout.PatternLayout;

/**
 * Log4j2 appender that records what a compiler component logs, for assertions.
 * <p>
 * Usage:
 * <pre>
 * try (LogCaptorAppender captor = LogCaptorAppender.create(ConstantFolder.class, Level.DEBUG)) {
 *     folder.fold(module);
 *     assertThat(captor.messages()).anyMatch(msg -> msg.startsWith("Folding finished"));
 * }
 * </pre>
 * Closing the captor detaches it and restores the logger's previous level.
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig loggerConfig;
	private final boolean ownsLoggerConfig;
	private final Level previousLevel;
	private final List<LogEvent> events = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(String name, LoggerContext context, LoggerConfig loggerConfig, boolean ownsLoggerConfig,
			Level previousLevel, Layout<? extends Serializable> layout) {
		super(name, null, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.loggerConfig = loggerConfig;
		this.ownsLoggerConfig = ownsLoggerConfig;
		this.previousLevel = previousLevel;
	}

	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		return create(loggerClass.getName(), level);
	}

	/**
	 * Capture everything logged at {@code level} or above under {@code loggerName},
	 * which may also be a package name.
	 */
	public static LogCaptorAppender create(String loggerName, Level level) {
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig loggerConfig = configuration.getLoggerConfig(loggerName);
		boolean owned = false;

		if (!loggerConfig.getName().equals(loggerName)) {
			LoggerConfig dedicated = new LoggerConfig(loggerName, level, true);
			configuration.addLogger(loggerName, dedicated);
			loggerConfig = dedicated;
			owned = true;
		}

		Level previousLevel = loggerConfig.getLevel();
		loggerConfig.setLevel(level);

		LogCaptorAppender captor = new LogCaptorAppender(
				"srilang-captor-" + System.nanoTime(),
				context,
				loggerConfig,
				owned,
				previousLevel,
				PatternLayout.newBuilder().withPattern("%-5level %logger - %msg").build());
		captor.start();
		loggerConfig.addAppender(captor, level, null);
		context.updateLoggers();
		return captor;
	}

	@Override
	public void append(LogEvent event) {
		events.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return Collections.unmodifiableList(events);
	}

	public List<String> messages() {
		return events.stream()
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	/**
	 * Messages logged at exactly {@code level}.
	 */
	public List<String> messages(Level level) {
		return events.stream()
				.filter(e -> e.getLevel().equals(level))
				.map(e -> e.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		loggerConfig.removeAppender(getName());
		if (ownsLoggerConfig) {
			context.getConfiguration().removeLogger(loggerConfig.getName());
		}
		else {
			loggerConfig.setLevel(previousLevel);
		}
		context.updateLoggers();
		events.clear();
	}
}
