/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.arbo.commons.properties;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

/**
 * Typed access to a system property with a default value.
 * <p>
 * Reading the property is logged at TRACE level. A value that does not parse
 * or is rejected by the validator is logged at ERROR level and replaced by the
 * default. A value that differs from the default is logged at INFO level
 * (configurable through {@link #logSuccessAs(Level)}).
 * <p>
 * The supported types are: {@link Boolean}, {@link Integer}, {@link Long},
 * {@link String}
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private final String propName;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private Level successLogLevel = Level.INFO;
    private Predicate<T> validator = (a) -> true;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@NotNull String propName, @NotNull T defaultValue) {
        this.propName = Objects.requireNonNull(propName, "propertyName must be non-null");
        this.defaultValue = Objects.requireNonNull(defaultValue, "defaultValue must be non-null");
        this.parser = getValueParser(defaultValue);
    }

    /**
     * Create it for a given property name and default value.
     *
     * @throws IllegalArgumentException if the type of the default value is
     *             not supported
     */
    public static <U> SystemPropertySupplier<U> create(@NotNull String propName, @NotNull U defaultValue) {
        return new SystemPropertySupplier<U>(propName, defaultValue);
    }

    /**
     * Specify the {@link Logger} to log to (defaults to this classes logger otherwise).
     */
    public SystemPropertySupplier<T> loggingTo(@NotNull Logger log) {
        this.log = Objects.requireNonNull(log);
        return this;
    }

    /**
     * Specify a validation expression.
     */
    public SystemPropertySupplier<T> validateWith(@NotNull Predicate<T> validator) {
        this.validator = Objects.requireNonNull(validator);
        return this;
    }

    /**
     * Specify the {@link Level} of the message logged when the value differs
     * from the default.
     */
    public SystemPropertySupplier<T> logSuccessAs(@NotNull Level successLogLevel) {
        this.successLogLevel = Objects.requireNonNull(successLogLevel);
        return this;
    }

    /**
     * <em>For unit testing</em>: specify a function to read system properties
     * (overriding default of {@code System.getProperty(String)}).
     */
    SystemPropertySupplier<T> usingSystemPropertyReader(@NotNull Function<String, String> sysPropReader) {
        this.sysPropReader = Objects.requireNonNull(sysPropReader);
        return this;
    }

    /**
     * Obtains the value of the system property, or the default when it is
     * absent, malformed or invalid.
     *
     * @return value of system property
     */
    @Override
    public T get() {
        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return defaultValue;
        }
        log.trace("System property {} set to '{}'", propName, value);

        T returnValue = defaultValue;
        try {
            T v = parser.apply(value);
            if (validator.test(v)) {
                returnValue = v;
            } else {
                log.error("Ignoring invalid value '{}' for system property {}", value, propName);
            }
        } catch (NumberFormatException ex) {
            log.error("Ignoring malformed value '{}' for system property {}", value, propName);
        }

        if (!returnValue.equals(defaultValue)) {
            logSuccess(String.format("System property %s found to be '%s'", propName, returnValue));
        }
        return returnValue;
    }

    private void logSuccess(String msg) {
        switch (successLogLevel) {
            case ERROR:
                log.error(msg);
                break;
            case WARN:
                log.warn(msg);
                break;
            case INFO:
                log.info(msg);
                break;
            case DEBUG:
                log.debug(msg);
                break;
            case TRACE:
                log.trace(msg);
                break;
            default:
                break;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> getValueParser(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) Boolean.valueOf(v);
        } else if (defaultValue instanceof Integer) {
            return v -> (T) Integer.valueOf(v);
        } else if (defaultValue instanceof Long) {
            return v -> (T) Long.valueOf(v);
        } else if (defaultValue instanceof String) {
            return v -> (T) v;
        } else {
            throw new IllegalArgumentException(String.format(
                    "expects a defaultValue of Boolean, Integer, Long, or String, but got: %s", defaultValue.getClass()));
        }
    }
}
