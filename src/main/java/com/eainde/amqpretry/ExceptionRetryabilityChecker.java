package com.eainde.amqpretry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a handler failure may enter the retry ladder, based on configured lists of
 * exception class names. With both lists empty every failure is retryable.
 */
public class ExceptionRetryabilityChecker {

    private static final Logger logger = LoggerFactory.getLogger(ExceptionRetryabilityChecker.class);

    private final List<Class<?>> nonRetryableExceptions;
    private final List<Class<?>> retryableExceptions;

    public ExceptionRetryabilityChecker(List<String> nonRetryableExceptions, List<String> retryableExceptions) {
        this.nonRetryableExceptions = resolve(nonRetryableExceptions);
        this.retryableExceptions = resolve(retryableExceptions);
    }

    public static ExceptionRetryabilityChecker retryEverything() {
        return new ExceptionRetryabilityChecker(List.of(), List.of());
    }

    /**
     * Checks if a given handler failure is retryable.
     * The non-retryable list always wins. If a retryable list is configured, the failure must be on it.
     *
     * @param cause The exception thrown by the handler.
     * @return true if the failure is retryable, false otherwise.
     */
    public boolean isRetryable(Throwable cause) {
        if (cause == null) {
            return true;
        }

        if (isInstanceOfAny(cause, nonRetryableExceptions)) {
            logger.warn("Exception {} is in the NON-RETRYABLE list. Decision: DO NOT RETRY.", cause.getClass().getName());
            return false;
        }

        if (!retryableExceptions.isEmpty()) {
            if (isInstanceOfAny(cause, retryableExceptions)) {
                return true;
            }
            logger.warn("Exception {} is NOT in the defined RETRYABLE list. Decision: DO NOT RETRY.", cause.getClass().getName());
            return false;
        }

        return true;
    }

    private static boolean isInstanceOfAny(Throwable cause, List<Class<?>> exceptionClasses) {
        return exceptionClasses.stream().anyMatch(exceptionClass -> exceptionClass.isInstance(cause));
    }

    private static List<Class<?>> resolve(List<String> classNames) {
        List<Class<?>> classes = new ArrayList<>();
        if (classNames == null) {
            return classes;
        }
        for (String className : classNames) {
            try {
                classes.add(Class.forName(className));
            } catch (ClassNotFoundException e) {
                logger.error("Configured exception class not found on classpath: {}", className, e);
            }
        }
        return classes;
    }
}
