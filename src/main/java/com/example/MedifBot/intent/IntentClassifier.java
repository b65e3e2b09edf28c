package com.example.MedifBot.intent;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Decides which path a message takes. Rules are evaluated in order and the first
 * match wins: contact details, then social short-circuit, then retrieval.
 */
@Component
@RequiredArgsConstructor
public class IntentClassifier {

    private final SocialResponseClassifier socialResponseClassifier;

    public Intent classify(String message) {
        for (Function<String, Optional<Intent>> rule : rules()) {
            Optional<Intent> intent = rule.apply(message);
            if (intent.isPresent()) {
                return intent.get();
            }
        }
        return Intent.informationRequest();
    }

    private List<Function<String, Optional<Intent>>> rules() {
        return List.of(
                this::contactRule,
                this::socialRule
        );
    }

    private Optional<Intent> contactRule(String message) {
        return ContactInfoDetector.looksLikeContact(message)
                ? Optional.of(Intent.contactShare())
                : Optional.empty();
    }

    private Optional<Intent> socialRule(String message) {
        return socialResponseClassifier.classify(message)
                .map(reply -> new Intent(
                        reply.greeting() ? IntentKind.GREETING : IntentKind.COURTESY,
                        reply.text()));
    }
}
