package com.example.MedifBot.intent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentClassifierTest {

    private final IntentClassifier classifier = new IntentClassifier(new SocialResponseClassifier());

    @Test
    void contactDetailsWinOverCourseKeywords() {
        Intent intent = classifier.classify("quiero el curso de instalaciones, mi correo es x@y.com");

        assertThat(intent.kind()).isEqualTo(IntentKind.CONTACT_SHARE);
        assertThat(intent.isShortCircuit()).isFalse();
    }

    @Test
    void contactDetailsWinOverCourtesy() {
        assertThat(classifier.classify("gracias, mi whatsapp es 600123456").kind())
                .isEqualTo(IntentKind.CONTACT_SHARE);
    }

    @Test
    void greetingIsShortCircuited() {
        Intent intent = classifier.classify("Hola");

        assertThat(intent.kind()).isEqualTo(IntentKind.GREETING);
        assertThat(intent.reply()).isEqualTo(SocialResponseClassifier.HELLO);
        assertThat(intent.isShortCircuit()).isTrue();
    }

    @Test
    void thanksIsCourtesy() {
        assertThat(classifier.classify("Gracias!!").kind()).isEqualTo(IntentKind.COURTESY);
    }

    @Test
    void questionsGoToRetrieval() {
        Intent intent = classifier.classify("gracias, cuánto cuesta el curso?");

        assertThat(intent.kind()).isEqualTo(IntentKind.INFORMATION_REQUEST);
        assertThat(intent.reply()).isNull();
    }
}
