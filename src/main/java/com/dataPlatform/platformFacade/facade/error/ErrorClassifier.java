package com.dataPlatform.platformFacade.facade.error;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Maps upstream failure text to an {@link ErrorKind}.
 *
 * The platform client only gives us exception text, so matching is by substring and
 * the rule order matters: "404 ... timeout" is NOT_FOUND because that rule is checked
 * first.
 */
@Component
public class ErrorClassifier {

    static final String AUTHENTICATION_MESSAGE = "Authentication failed. Please check your API credentials.";
    static final String PERMISSION_MESSAGE = "Access denied. You may not have permission to access this resource.";
    static final String NOT_FOUND_MESSAGE = "Resource not found. Please check the identifier.";
    static final String RATE_LIMIT_MESSAGE = "Rate limit exceeded. Please wait before making more requests.";
    static final String TIMEOUT_MESSAGE = "Request timed out. Please try again later.";
    static final String UNKNOWN_MESSAGE_PREFIX = "An unexpected error occurred: ";

    private static final List<Rule> RULES = List.of(
            new Rule(text -> text.contains("401") || text.contains("Unauthorized"),
                    ErrorKind.AUTHENTICATION, AUTHENTICATION_MESSAGE),
            new Rule(text -> text.contains("403") || text.contains("Forbidden"),
                    ErrorKind.PERMISSION, PERMISSION_MESSAGE),
            new Rule(text -> text.contains("404") || text.contains("Not Found"),
                    ErrorKind.NOT_FOUND, NOT_FOUND_MESSAGE),
            new Rule(text -> text.contains("429") || lower(text).contains("rate limit"),
                    ErrorKind.RATE_LIMIT, RATE_LIMIT_MESSAGE),
            new Rule(text -> lower(text).contains("timeout"),
                    ErrorKind.TIMEOUT, TIMEOUT_MESSAGE)
    );

    /**
     * Classifies an error text.
     *
     * @param errorText Failure text from the platform client (null treated as empty)
     * @return Kind and user-facing message
     */
    public ClassifiedError classify(String errorText) {
        String text = errorText != null ? errorText : "";
        for (Rule rule : RULES) {
            if (rule.matches().test(text)) {
                return new ClassifiedError(rule.kind(), rule.message());
            }
        }
        return new ClassifiedError(ErrorKind.UNKNOWN, UNKNOWN_MESSAGE_PREFIX + text);
    }

    /**
     * Classifies a thrown failure by its message, or its class name when it has none.
     */
    public ClassifiedError classify(Throwable failure) {
        return classify(describe(failure));
    }

    /**
     * Text used to classify a failure.
     */
    public static String describe(Throwable failure) {
        if (failure == null) {
            return "";
        }
        String message = failure.getMessage();
        return message != null && !message.isBlank() ? message : failure.getClass().getName();
    }

    private static String lower(String text) {
        return text.toLowerCase(Locale.ROOT);
    }

    private record Rule(Predicate<String> matches, ErrorKind kind, String message) {
    }
}
