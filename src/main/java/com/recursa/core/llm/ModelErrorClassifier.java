package com.recursa.core.llm;

import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.web.client.ResourceAccessException;

import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Maps exceptions raised by the model transport onto the runtime's model error types.
 */
public final class ModelErrorClassifier {

    private ModelErrorClassifier() {}

    public static ModelInvocationException classify(RuntimeException e) {
        if (e instanceof ModelInvocationException mie) {
            return mie;
        }
        if (e instanceof LlmEmptyResponseException || e instanceof LlmParseException) {
            return new MalformedModelOutputException(e.getMessage(), e);
        }
        if (e instanceof TransientAiException || e instanceof ResourceAccessException
                || hasCause(e, TimeoutException.class)) {
            return new TransientModelException(describe(e), e);
        }
        if (e instanceof NonTransientAiException) {
            if (isAuthorizationFailure(e.getMessage())) {
                return new ModelAuthorizationException(describe(e), e);
            }
            return new ModelInvocationException(describe(e), e);
        }
        return new ModelInvocationException(describe(e), e);
    }

    static boolean isAuthorizationFailure(String message) {
        if (message == null) {
            return false;
        }
        String m = message.toLowerCase(Locale.ROOT);
        return m.contains("401") || m.contains("403") || m.contains("unauthorized")
                || m.contains("forbidden") || m.contains("invalid api key") || m.contains("incorrect api key");
    }

    private static String describe(RuntimeException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    private static boolean hasCause(Throwable e, Class<? extends Throwable> type) {
        Throwable current = e.getCause();
        while (current != null) {
            if (type.isInstance(current)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
