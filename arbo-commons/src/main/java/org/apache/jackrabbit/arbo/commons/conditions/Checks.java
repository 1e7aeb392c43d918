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
package org.apache.jackrabbit.arbo.commons.conditions;

import java.util.Objects;

import org.apache.jackrabbit.arbo.commons.properties.SystemPropertySupplier;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Precondition checks for arguments and state, failing with
 * {@link IllegalArgumentException} and {@link IllegalStateException}
 * respectively. Messages use {@link String#format} templates.
 */
public final class Checks {

    private Checks() {
        // no instances for you
    }

    private static final Logger LOG = LoggerFactory.getLogger(Checks.class);

    // when true, message templates are checked even when the condition holds
    private static final boolean CHECKMESSAGETEMPLATE = SystemPropertySupplier
            .create("arbo.precondition.checks.CHECKMESSAGETEMPLATE", false).loggingTo(LOG).get();

    /**
     * Checks the specified expression
     *
     * @param expression
     *            to check
     * @throws IllegalArgumentException
     *             when false
     */
    public static void checkArgument(boolean expression) throws IllegalArgumentException {
        if (!expression) {
            throw new IllegalArgumentException();
        }
    }

    /**
     * Checks the specified expression
     *
     * @param expression
     *            to check
     * @param message
     *            to use in exception
     * @throws IllegalArgumentException
     *             when false
     */
    public static void checkArgument(boolean expression, @NotNull String message) throws IllegalArgumentException {
        Objects.requireNonNull(message);
        if (!expression) {
            throw new IllegalArgumentException(message);
        }
    }

    /**
     * Checks the specified expression
     *
     * @param expression
     *            to check
     * @param messageTemplate
     *            to use in exception (using {@link String#format} syntax)
     * @param messageArgs
     *            arguments of the template
     * @throws IllegalArgumentException
     *             when false
     */
    public static void checkArgument(boolean expression, @NotNull String messageTemplate,
            @Nullable Object... messageArgs) throws IllegalArgumentException {
        validateEagerly(messageTemplate, messageArgs);
        if (!expression) {
            throw new IllegalArgumentException(format(messageTemplate, messageArgs));
        }
    }

    /**
     * Checks the state expression
     *
     * @param expression
     *            to check
     * @param messageTemplate
     *            to use in exception (using {@link String#format} syntax)
     * @param messageArgs
     *            arguments of the template
     * @throws IllegalStateException
     *             when false
     */
    public static void checkState(boolean expression, @NotNull String messageTemplate,
            @Nullable Object... messageArgs) throws IllegalStateException {
        validateEagerly(messageTemplate, messageArgs);
        if (!expression) {
            throw new IllegalStateException(format(messageTemplate, messageArgs));
        }
    }

    private static void validateEagerly(@NotNull String messageTemplate, @Nullable Object... messageArgs) {
        Objects.requireNonNull(messageTemplate);
        if (CHECKMESSAGETEMPLATE) {
            checkTemplate(messageTemplate, messageArgs);
        }
    }

    private static String format(@NotNull String messageTemplate, @Nullable Object... messageArgs) {
        Objects.requireNonNull(messageTemplate);
        if (!CHECKMESSAGETEMPLATE) {
            checkTemplate(messageTemplate, messageArgs);
        }
        return String.format(messageTemplate, messageArgs);
    }

    static boolean checkTemplate(@NotNull String messageTemplate, @Nullable Object... messageArgs) {
        int argsSpecified = messageArgs.length;
        int argsInTemplate = countArguments(messageTemplate);
        boolean result = argsSpecified == argsInTemplate;
        if (!result) {
            LOG.error("Invalid message format: template '{}', argument count {}", messageTemplate, argsSpecified);
        }
        return result;
    }

    static int countArguments(String template) {
        int count = 0;
        boolean inEscape = false;

        for (char c : template.toCharArray()) {
            if (inEscape) {
                if (c != '%') {
                    count += 1;
                }
                inEscape = false;
            } else if (c == '%') {
                inEscape = true;
            }
        }

        if (inEscape) {
            LOG.error("trailing escape character '%' found", new Exception("call stack"));
        }

        return count;
    }
}
