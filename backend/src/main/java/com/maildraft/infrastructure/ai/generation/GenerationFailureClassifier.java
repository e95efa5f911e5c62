package com.maildraft.infrastructure.ai.generation;

import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.ConnectException;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a generation failure can resolve itself. Connection failures, timeouts,
 * rate limiting and 5xx answers are transient; other 4xx answers (bad request, auth, unknown model)
 * are permanent and must not consume the retry budget. Never throws.
 */
public final class GenerationFailureClassifier {

    private static final int MAX_MESSAGE_LENGTH = 200;

    private GenerationFailureClassifier() {
    }

    public static GenerationFailure classify(Throwable t) {
        List<Throwable> chain = causeChain(t);

        for (Throwable x : chain) {
            if (x instanceof OpenAIServiceException se) {
                int status = se.statusCode();
                if (status == 429) {
                    return new GenerationFailure("RATE_LIMIT", true, status, shortMsg(se));
                }
                if (status >= 500) {
                    return new GenerationFailure("UPSTREAM_5XX", true, status, shortMsg(se));
                }
                if (status == 401 || status == 403) {
                    return new GenerationFailure("AUTH", false, status, shortMsg(se));
                }
                if (status == 408) {
                    return new GenerationFailure("TIMEOUT", true, status, shortMsg(se));
                }
                if (status >= 400) {
                    return new GenerationFailure("HTTP_4XX", false, status, shortMsg(se));
                }
            }
        }

        for (Throwable x : chain) {
            if (x instanceof TimeoutException || x instanceof InterruptedIOException) {
                return new GenerationFailure("TIMEOUT", true, null, shortMsg(x));
            }
            if (x instanceof ConnectException || x instanceof UnknownHostException) {
                return new GenerationFailure("CONNECTION", true, null, shortMsg(x));
            }
        }

        for (Throwable x : chain) {
            if (x instanceof OpenAIIoException || x instanceof IOException) {
                return new GenerationFailure("IO", true, null, shortMsg(x));
            }
            if (x instanceof EmptyCompletionException) {
                return new GenerationFailure("EMPTY_COMPLETION", true, null, shortMsg(x));
            }
            if (x instanceof IllegalArgumentException) {
                return new GenerationFailure("INVALID_REQUEST", false, null, shortMsg(x));
            }
        }

        Throwable root = chain.isEmpty() ? t : chain.get(chain.size() - 1);
        return new GenerationFailure("UNKNOWN", true, null, shortMsg(root));
    }

    private static List<Throwable> causeChain(Throwable t) {
        List<Throwable> chain = new ArrayList<>();
        Throwable cur = t;
        int hops = 0;
        while (cur != null && hops++ < 20) {
            chain.add(cur);
            Throwable next = cur.getCause();
            if (next == cur) {
                break;
            }
            cur = next;
        }
        return chain;
    }

    private static String shortMsg(Throwable t) {
        if (t == null) {
            return "";
        }
        String message = t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
        message = message.replaceAll("\\s+", " ").trim();
        return message.length() > MAX_MESSAGE_LENGTH ? message.substring(0, MAX_MESSAGE_LENGTH) + "..." : message;
    }
}
