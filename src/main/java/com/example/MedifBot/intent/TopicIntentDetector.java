package com.example.MedifBot.intent;

import com.example.MedifBot.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps keyword hits in a normalized message to knowledge-base source prefixes
 * and detects course questions. Filters are advisory: an empty set means "search everything".
 */
@Component
public class TopicIntentDetector {

    private static final Map<String, List<String>> SOURCE_INTENT_KEYWORDS = sourceTable();

    private static final List<String> COURSE_INTENT_KEYWORDS = normalizedList(
            "curso", "cursos", "capacitacion", "formacion", "taller", "instalaciones", "instalacion"
    );

    /** Prefixes in declaration order whose keywords occur as substrings of the message. */
    public Set<String> inferSourceFilters(String normalizedMessage) {
        Set<String> prefixes = new LinkedHashSet<>();
        if (normalizedMessage == null || normalizedMessage.isEmpty()) {
            return prefixes;
        }
        SOURCE_INTENT_KEYWORDS.forEach((prefix, keywords) -> {
            if (keywords.stream().anyMatch(normalizedMessage::contains)) {
                prefixes.add(prefix);
            }
        });
        return prefixes;
    }

    public boolean isCourseRequest(String normalizedMessage) {
        if (normalizedMessage == null || normalizedMessage.isEmpty()) {
            return false;
        }
        return COURSE_INTENT_KEYWORDS.stream().anyMatch(normalizedMessage::contains);
    }

    private static Map<String, List<String>> sourceTable() {
        Map<String, List<String>> table = new LinkedHashMap<>();
        table.put("faq/", normalizedList("faq", "preguntas frecuentes", "pregunta frecuente"));
        table.put("servicios/", normalizedList("servicio", "servicios", "contratar", "ofrecemos", "diseno", "proyecto"));
        table.put("cursos/", normalizedList("curso", "cursos", "capacitacion", "formacion", "taller", "educacion"));
        table.put("software/", normalizedList("software", "cype", "sap2000", "etabs", "modelacion", "cypeunext"));
        return Collections.unmodifiableMap(table);
    }

    private static List<String> normalizedList(String... keywords) {
        return Arrays.stream(keywords).map(TextNormalizer::normalize).toList();
    }
}
