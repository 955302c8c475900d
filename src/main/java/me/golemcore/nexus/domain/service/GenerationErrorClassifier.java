package me.golemcore.nexus.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies generation failures into stable machine-readable reason codes.
 *
 * <p>
 * Codes embedded in a message as {@code "[code] details"} win over the
 * exception type, which wins over anything further down the cause chain.
 */
public final class GenerationErrorClassifier {

    private static final String CODE_PREFIX = "generation.";

    public static final String REQUEST_ABORTED = "generation.request.aborted";
    public static final String REQUEST_TIMEOUT = "generation.request.timeout";
    public static final String BACKEND_UNAVAILABLE = "generation.backend.unavailable";
    public static final String EMPTY_RESPONSE = "generation.empty_response";
    public static final String RATE_LIMIT = "generation.rate_limit";
    public static final String AUTHENTICATION = "generation.authentication";
    public static final String INVALID_REQUEST = "generation.invalid_request";
    public static final String CONTENT_FILTERED = "generation.content_filtered";
    public static final String UNKNOWN = "generation.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";
    private static final String CLASS_RATE_LIMIT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "RateLimitException";
    private static final String CLASS_TIMEOUT_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "TimeoutException";
    private static final String CLASS_AUTHENTICATION_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "AuthenticationException";
    private static final String CLASS_INVALID_REQUEST_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InvalidRequestException";
    private static final String CLASS_MODEL_NOT_FOUND_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ModelNotFoundException";
    private static final String CLASS_CONTENT_FILTERED_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "ContentFilteredException";
    private static final String CLASS_INTERNAL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "InternalServerException";
    private static final String CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX
            + "UnresolvedModelServerException";
    private static final String CLASS_HTTP_EXCEPTION = LANGCHAIN4J_EXCEPTIONS_PREFIX + "HttpException";

    private GenerationErrorClassifier() {
    }

    public static String classify(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String embedded = extractCode(current.getMessage());
            if (embedded != null && !embedded.isBlank()) {
                return embedded;
            }

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    /**
     * Prefix a human diagnostic with a machine-readable code.
     */
    public static String withCode(String code, String message) {
        if (message == null || message.isBlank()) {
            return "[" + code + "]";
        }
        if (message.startsWith("[" + code + "]")) {
            return message;
        }
        return "[" + code + "] " + message;
    }

    /**
     * Extract a code from diagnostics like: "[generation.some.code] details".
     * Bracketed text without the {@code generation.} prefix, such as a JSON
     * array from a backend, is not a code.
     */
    public static String extractCode(String message) {
        if (message == null || !message.startsWith("[" + CODE_PREFIX)) {
            return null;
        }
        int end = message.indexOf(']');
        if (end <= CODE_PREFIX.length() + 1) {
            return null;
        }
        String code = message.substring(1, end);
        return code.chars().allMatch(GenerationErrorClassifier::isCodeChar) ? code : null;
    }

    private static boolean isCodeChar(int ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '.' || ch == '_';
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }
        if (throwable instanceof ConnectException || throwable instanceof UnknownHostException) {
            return BACKEND_UNAVAILABLE;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }

        if (CLASS_RATE_LIMIT_EXCEPTION.equals(className)) {
            return RATE_LIMIT;
        }
        if (CLASS_TIMEOUT_EXCEPTION.equals(className)) {
            return REQUEST_TIMEOUT;
        }
        if (CLASS_AUTHENTICATION_EXCEPTION.equals(className)) {
            return AUTHENTICATION;
        }
        if (CLASS_INVALID_REQUEST_EXCEPTION.equals(className)
                || CLASS_MODEL_NOT_FOUND_EXCEPTION.equals(className)) {
            return INVALID_REQUEST;
        }
        if (CLASS_CONTENT_FILTERED_EXCEPTION.equals(className)) {
            return CONTENT_FILTERED;
        }
        if (CLASS_INTERNAL_SERVER_EXCEPTION.equals(className)
                || CLASS_UNRESOLVED_MODEL_SERVER_EXCEPTION.equals(className)) {
            return BACKEND_UNAVAILABLE;
        }
        if (CLASS_HTTP_EXCEPTION.equals(className)) {
            return classifyHttpExceptionByStatus(throwable);
        }
        return UNKNOWN;
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return UNKNOWN;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return REQUEST_TIMEOUT;
        }
        if (statusCode >= 500) {
            return BACKEND_UNAVAILABLE;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return UNKNOWN;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }
}
