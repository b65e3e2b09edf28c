package com.example.MedifBot.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TextNormalizerTest {

    @Nested
    @DisplayName("normalize")
    class Normalize {

        @Test
        @DisplayName("collapses elongated letters and drops punctuation")
        void collapsesElongationAndPunctuation() {
            assertThat(TextNormalizer.normalize("Holaaaa!!")).isEqualTo(TextNormalizer.normalize("hola"));
            assertThat(TextNormalizer.normalize("Holaaaa!!")).isEqualTo("hola");
        }

        @Test
        @DisplayName("strips accents and lowercases")
        void stripsAccents() {
            assertThat(TextNormalizer.normalize("¿Buen DÍA, qué tal?")).isEqualTo("buen dia que tal");
        }

        @Test
        @DisplayName("collapses whitespace runs and trims")
        void collapsesWhitespace() {
            assertThat(TextNormalizer.normalize("  muchas \t\n gracias  ")).isEqualTo("muchas gracias");
        }

        @Test
        @DisplayName("returns empty string for null, empty and punctuation-only input")
        void totalOnEmptyInput() {
            assertThat(TextNormalizer.normalize(null)).isEmpty();
            assertThat(TextNormalizer.normalize("")).isEmpty();
            assertThat(TextNormalizer.normalize("?!¡¿...")).isEmpty();
        }
    }

    @Nested
    @DisplayName("cleanWhitespace")
    class CleanWhitespace {

        @Test
        @DisplayName("keeps accents and case but removes control characters")
        void keepsAccents() {
            assertThat(TextNormalizer.cleanWhitespace("Instalación\u0007  de\n\nCYPE "))
                    .isEqualTo("Instalación de CYPE");
        }
    }
}
