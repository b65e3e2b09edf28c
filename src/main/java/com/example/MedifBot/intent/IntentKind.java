package com.example.MedifBot.intent;

public enum IntentKind {
    /** Message shares an e-mail or phone number. */
    CONTACT_SHARE,
    /** Plain greeting; answered without the contact suffix. */
    GREETING,
    /** Thanks, acknowledgements, farewells. */
    COURTESY,
    /** Anything that needs retrieval and generation. */
    INFORMATION_REQUEST
}
