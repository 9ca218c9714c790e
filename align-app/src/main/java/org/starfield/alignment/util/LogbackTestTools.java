package org.starfield.alignment.util;

import java.io.File;
import java.text.SimpleDateFormat;
import java.util.Date;

import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import ch.qos.logback.core.FileAppender;

import static org.slf4j.Logger.ROOT_LOGGER_NAME;

/**
 * Adjusts logback levels and appenders from code so that tests and interactive runs can
 * quiet (or capture) pipeline logging.
 */
public class LogbackTestTools {

    public static void setRootLogLevelToError() {
        setRootLogLevel(Level.ERROR);
    }

    public static void setRootLogLevel(final Level rootLogLevel) {
        setLogLevel(ROOT_LOGGER_NAME, rootLogLevel);
    }

    public static void setLogLevelToDebug(final Class<?> loggerClass) {
        setLogLevel(loggerClass.getName(), Level.DEBUG);
    }

    public static void setLogLevel(final String loggerName,
                                   final Level logLevel) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        loggerContext.getLogger(loggerName).setLevel(logLevel);
    }

    /**
     * @return level currently configured for the named logger (null if it inherits its level).
     */
    public static Level getLogLevel(final String loggerName) {
        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        return loggerContext.getLogger(loggerName).getLevel();
    }

    /**
     * Adds a root file appender named with the current time (e.g. align.20150710_120000.log)
     * that shares the console appender's encoder.
     *
     * @return the log file.
     *
     * @throws IllegalStateException
     *   if no console appender is configured.
     */
    public static File setRootFileAppenderWithTimestamp(final File logDirectory,
                                                        final String logFileNamePrefix)
            throws IllegalStateException {

        final SimpleDateFormat sdf = new SimpleDateFormat("yyyyMMdd_HHmmss");
        final File logFile = new File(logDirectory, logFileNamePrefix + "." + sdf.format(new Date()) + ".log");

        final LoggerContext loggerContext = (LoggerContext) LoggerFactory.getILoggerFactory();
        final Logger rootLogger = loggerContext.getLogger(ROOT_LOGGER_NAME);
        final ConsoleAppender<ILoggingEvent> stdoutAppender =
                (ConsoleAppender<ILoggingEvent>) rootLogger.getAppender(CONSOLE_APPENDER_NAME);
        if (stdoutAppender == null) {
            throw new IllegalStateException("root logger has no '" + CONSOLE_APPENDER_NAME + "' appender");
        }

        if (rootLogger.getAppender(FILE_APPENDER_NAME) != null) {
            rootLogger.detachAppender(FILE_APPENDER_NAME);
        }

        final FileAppender<ILoggingEvent> fileAppender = new FileAppender<>();
        fileAppender.setName(FILE_APPENDER_NAME);
        fileAppender.setFile(logFile.getAbsolutePath());
        fileAppender.setEncoder(stdoutAppender.getEncoder());
        fileAppender.setContext(stdoutAppender.getContext());
        fileAppender.start();
        rootLogger.addAppender(fileAppender);

        return logFile;
    }

    public static final String CONSOLE_APPENDER_NAME = "STDOUT";
    public static final String FILE_APPENDER_NAME = "alignFileAppender";
}
