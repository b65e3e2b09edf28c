package com.example.MedifBot.intent;

/**
 * Classification of one incoming message.
 *
 * @param kind  which path the message takes
 * @param reply canned reply for {@link IntentKind#GREETING} and {@link IntentKind#COURTESY}, otherwise null
 */
public record Intent(IntentKind kind, String reply) {

    public static Intent contactShare() {
        return new Intent(IntentKind.CONTACT_SHARE, null);
    }

    public static Intent informationRequest() {
        return new Intent(IntentKind.INFORMATION_REQUEST, null);
    }

    public boolean isShortCircuit() {
        return kind == IntentKind.GREETING || kind == IntentKind.COURTESY;
    }
}
