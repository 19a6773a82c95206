package org.javai.schemeload.testsupport;

import java.io.Serializable;
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
 * Captures what a logger emits while a test runs.
 * <pre>
 * try (LogCaptorAppender log = LogCaptorAppender.create(ScriptLoader.class, Level.DEBUG)) {
 *     loader.loadSource("a.scm", text);
 *     assertThat(log.messagesAt(Level.WARN)).anyMatch(m -&gt; m.contains("failed"));
 * }
 * </pre>
 */
public final class LogCaptorAppender extends AbstractAppender implements AutoCloseable {

	private final LoggerContext context;
	private final LoggerConfig config;
	private final boolean ownsConfig;
	private final Level previousLevel;
	private final List<LogEvent> captured = new CopyOnWriteArrayList<>();

	private LogCaptorAppender(LoggerContext context, LoggerConfig config, boolean ownsConfig, Level previousLevel,
			Layout<? extends Serializable> layout) {
		super("capture-" + config.getName() + "-" + System.nanoTime(), null, layout, false, Property.EMPTY_ARRAY);
		this.context = context;
		this.config = config;
		this.ownsConfig = ownsConfig;
		this.previousLevel = previousLevel;
	}

	/**
	 * Attaches a capturing appender to the logger named after {@code loggerClass}, lowering it to
	 * {@code level} until {@link #close()}.
	 */
	public static LogCaptorAppender create(Class<?> loggerClass, Level level) {
		String name = loggerClass.getName();
		LoggerContext context = (LoggerContext) LogManager.getContext(false);
		Configuration configuration = context.getConfiguration();
		LoggerConfig config = configuration.getLoggerConfig(name);
		boolean owns = !config.getName().equals(name);
		if (owns) {
			config = new LoggerConfig(name, level, true);
			configuration.addLogger(name, config);
		}
		Level previous = config.getLevel();
		config.setLevel(level);

		LogCaptorAppender appender = new LogCaptorAppender(context, config, owns, previous,
				PatternLayout.newBuilder().withPattern("%-5level %msg").build());
		appender.start();
		config.addAppender(appender, level, null);
		context.updateLoggers();
		return appender;
	}

	@Override
	public void append(LogEvent event) {
		captured.add(event.toImmutable());
	}

	public List<LogEvent> events() {
		return List.copyOf(captured);
	}

	public List<String> messages() {
		return captured.stream().map(event -> event.getMessage().getFormattedMessage()).toList();
	}

	/**
	 * Formatted messages logged at exactly {@code level}.
	 */
	public List<String> messagesAt(Level level) {
		return captured.stream()
				.filter(event -> event.getLevel().equals(level))
				.map(event -> event.getMessage().getFormattedMessage())
				.toList();
	}

	@Override
	public void close() {
		stop();
		config.removeAppender(getName());
		if (ownsConfig) {
			context.getConfiguration().removeLogger(config.getName());
		} else {
			config.setLevel(previousLevel);
		}
		context.updateLoggers();
		captured.clear();
	}
}
