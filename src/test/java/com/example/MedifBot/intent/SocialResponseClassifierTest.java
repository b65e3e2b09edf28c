package com.example.MedifBot.intent;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SocialResponseClassifierTest {

    private final SocialResponseClassifier classifier = new SocialResponseClassifier();

    @Nested
    @DisplayName("exact table lookup")
    class ExactLookup {

        @Test
        @DisplayName("thanks with punctuation maps to the thanks reply")
        void thanks() {
            assertThat(classifier.classify("Gracias!!"))
                    .contains(new SocialReply(SocialResponseClassifier.THANKS, false));
        }

        @ParameterizedTest
        @ValueSource(strings = {"Hola", "holaaaa", "HOLA!!", "Holi"})
        @DisplayName("greeting variants are flagged as greetings")
        void greetings(String message) {
            assertThat(classifier.classify(message))
                    .hasValueSatisfying(reply -> {
                        assertThat(reply.text()).isEqualTo(SocialResponseClassifier.HELLO);
                        assertThat(reply.greeting()).isTrue();
                    });
        }

        @Test
        @DisplayName("accented and elongated spellings reach the same entry")
        void accentInsensitive() {
            assertThat(classifier.classify("Buenos díasss"))
                    .hasValueSatisfying(reply -> assertThat(reply.text()).isEqualTo(SocialResponseClassifier.GOOD_MORNING));
        }

        @Test
        @DisplayName("farewells are not greetings")
        void farewell() {
            assertThat(classifier.classify("chau"))
                    .contains(new SocialReply(SocialResponseClassifier.BYE, false));
        }
    }

    @Nested
    @DisplayName("courtesy patterns")
    class Patterns {

        @Test
        @DisplayName("matches when every keyword is present")
        void matchesAllKeywords() {
            assertThat(classifier.classify("Muchísimas gracias por la ayuda"))
                    .hasValueSatisfying(reply -> assertThat(reply.text()).isEqualTo(SocialResponseClassifier.THANKS));
            assertThat(classifier.classify("que pase un buen dia"))
                    .hasValueSatisfying(reply -> assertThat(reply.text()).isEqualTo(SocialResponseClassifier.NICE_DAY));
        }

        @Test
        @DisplayName("question mark sends the message to retrieval")
        void questionMarkSkipsPatterns() {
            assertThat(classifier.classify("gracias, cuánto cuesta el curso?")).isEmpty();
        }

        @Test
        @DisplayName("informative markers send the message to retrieval")
        void informativeMarkerSkipsPatterns() {
            assertThat(classifier.classify("gracias, pero quiero saber el precio del curso")).isEmpty();
            assertThat(classifier.classify("gracias te paso mi correo luego")).isEmpty();
        }
    }

    @Test
    void unrelatedMessageHasNoReply() {
        assertThat(classifier.classify("Necesito el temario del curso de CYPE")).isEmpty();
        assertThat(classifier.classify("   ")).isEmpty();
    }
}
