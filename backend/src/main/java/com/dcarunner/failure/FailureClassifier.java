package com.dcarunner.failure;

import com.dcarunner.domain.OperationKind;
import com.dcarunner.failure.config.FailureProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides whether a failed fire is retried at the next schedule or disables the job.
 * Typed failures raised by this service decide by type. Keyword matching is reserved for rejections reported by
 * the signing relay, whose error taxonomy is not ours. Anything unrecognised is transient.
 */
@Component
@RequiredArgsConstructor
public class FailureClassifier {

    private final FailureProperties properties;

    public Disposition classify(OperationKind kind, Throwable failure) {
        if (failure instanceof AmbiguousOutcomeException) {
            return Disposition.AMBIGUOUS;
        }
        if (failure instanceof AuthorizationRevokedException
                || failure instanceof PermittedVersionDowngradeException
                || failure instanceof InsufficientBalanceException
                || failure instanceof MalformedConfigurationException
                || failure instanceof AuxiliaryLookupException
                || failure instanceof InvalidAmountException) {
            return Disposition.FATAL;
        }
        if (failure instanceof PrecheckRejectedException || failure instanceof ExecutionRejectedException) {
            return matchesFatalKeyword(kind, (OperationException) failure) ? Disposition.FATAL : Disposition.TRANSIENT;
        }
        // untyped failures before acknowledgement land here; the fire boundary escalates later ones to ambiguous
        return Disposition.TRANSIENT;
    }

    private boolean matchesFatalKeyword(OperationKind kind, OperationException rejection) {
        String haystack = diagnosticText(rejection);
        for (String keyword : keywordsFor(kind)) {
            if (keyword != null && !keyword.isBlank() && haystack.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private List<String> keywordsFor(OperationKind kind) {
        List<String> keywords = new ArrayList<>(properties.getFatalKeywords());
        if (kind != null) {
            keywords.addAll(properties.getKindFatalKeywords().getOrDefault(kind, List.of()));
        }
        return keywords;
    }

    private static String diagnosticText(OperationException rejection) {
        StringBuilder sb = new StringBuilder();
        sb.append(rejection.getMessage()).append(' ').append(rejection.getContext());
        Throwable cause = rejection.getCause();
        while (cause != null && cause != cause.getCause()) {
            sb.append(' ').append(cause.getMessage());
            cause = cause.getCause();
        }
        return sb.toString().toLowerCase(Locale.ROOT);
    }
}
