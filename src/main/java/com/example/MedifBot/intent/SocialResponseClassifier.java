package com.example.MedifBot.intent;

import com.example.MedifBot.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Recognizes greetings, thanks, acknowledgements and farewells so they can be
 * answered without touching retrieval or the model.
 *
 * All lookup tables are normalized once at class load with {@link TextNormalizer#normalize},
 * the same function applied to incoming messages, so "buenos diass" and "buenos días"
 * land on the same entry.
 */
@Component
public class SocialResponseClassifier {

    static final String HELLO = "Hola, ¿cómo estás?";
    static final String GOOD_MORNING = "Buenos días, ¿en qué te puedo ayudar?";
    static final String GOOD_AFTERNOON = "Buenas tardes, ¿en qué te ayudo?";
    static final String GOOD_EVENING = "Buenas noches, ¿en qué puedo ayudarte?";
    static final String ALL_GOOD = "¡Genial! ¿En qué te puedo ayudar?";
    static final String RELAXED = "¡Perfecto! ¿En qué te ayudo?";
    static final String THANKS = "¡Con gusto! Si necesitas algo más, aquí estaré.";
    static final String ACK = "Perfecto, quedo atento.";
    static final String UNDERSTOOD = "Perfecto, gracias por avisar.";
    static final String BYE = "¡Hasta luego! 😊";
    static final String SEE_YOU_SOON = "¡Hasta pronto! 😊";
    static final String NICE_DAY = "Que tengas un excelente día.";
    static final String BE_WELL = "Que estés muy bien.";

    private static final Map<String, String> EXACT_RESPONSES = normalizedTable(
            Map.entry("hola", HELLO),
            Map.entry("holaaa", HELLO),
            Map.entry("holi", HELLO),
            Map.entry("holis", HELLO),
            Map.entry("holita", HELLO),
            Map.entry("ola", HELLO),
            Map.entry("olaas", HELLO),
            Map.entry("hello", HELLO),
            Map.entry("hey", HELLO),
            Map.entry("ey", HELLO),
            Map.entry("buenas", HELLO),
            Map.entry("buenas buenas", HELLO),
            Map.entry("buenos dias", GOOD_MORNING),
            Map.entry("buen dia", GOOD_MORNING),
            Map.entry("bd", GOOD_MORNING),
            Map.entry("b dias", GOOD_MORNING),
            Map.entry("buenas tardes", GOOD_AFTERNOON),
            Map.entry("bt", GOOD_AFTERNOON),
            Map.entry("b tardes", GOOD_AFTERNOON),
            Map.entry("tardes", GOOD_AFTERNOON),
            Map.entry("buenas noches", GOOD_EVENING),
            Map.entry("bn", GOOD_EVENING),
            Map.entry("noches", GOOD_EVENING),
            Map.entry("que tal", HELLO),
            Map.entry("q tal", HELLO),
            Map.entry("como estas", HELLO),
            Map.entry("como andas", HELLO),
            Map.entry("como vas", HELLO),
            Map.entry("todo bien", ALL_GOOD),
            Map.entry("todo ok", ALL_GOOD),
            Map.entry("todo tranqui", RELAXED),
            Map.entry("que onda", HELLO),
            Map.entry("onda", HELLO),
            Map.entry("que mas", HELLO),
            Map.entry("que mas pues", HELLO),
            Map.entry("que hubo", HELLO),
            Map.entry("quiubo", HELLO),
            Map.entry("parce", HELLO),
            Map.entry("parcero", HELLO),
            Map.entry("wey", HELLO),
            Map.entry("che", HELLO),
            Map.entry("amigo", HELLO),
            Map.entry("que pasa", HELLO),
            Map.entry("todo bien tio", HELLO),
            Map.entry("buenas tio", HELLO),
            Map.entry("vale", ACK),
            Map.entry("ok vale", ACK),
            Map.entry("gracias", THANKS),
            Map.entry("muchas gracias", THANKS),
            Map.entry("mil gracias", THANKS),
            Map.entry("gracias totales", THANKS),
            Map.entry("thanks", THANKS),
            Map.entry("ok gracias", THANKS),
            Map.entry("gracias amigo", THANKS),
            Map.entry("gracias bro", THANKS),
            Map.entry("ok", ACK),
            Map.entry("okey", ACK),
            Map.entry("oki", ACK),
            Map.entry("okis", ACK),
            Map.entry("perfecto", ACK),
            Map.entry("excelente", ACK),
            Map.entry("genial", ACK),
            Map.entry("de acuerdo", ACK),
            Map.entry("entendido", UNDERSTOOD),
            Map.entry("listo", ACK),
            Map.entry("dale", ACK),
            Map.entry("va", ACK),
            Map.entry("bien", ACK),
            Map.entry("chau", BYE),
            Map.entry("chao", BYE),
            Map.entry("adios", BYE),
            Map.entry("nos vemos", BYE),
            Map.entry("hasta luego", BYE),
            Map.entry("hasta pronto", SEE_YOU_SOON),
            Map.entry("bye", BYE),
            Map.entry("bye bye", BYE)
    );

    /** First pattern whose keywords all occur in the message wins. */
    private static final List<CourtesyPattern> COURTESY_PATTERNS = List.of(
            pattern(THANKS, "agradecid"),
            pattern(THANKS, "muchas", "gracias"),
            pattern(THANKS, "con", "gusto"),
            pattern(THANKS, "gracias"),
            pattern(THANKS, "muchisimas", "gracias"),
            pattern(NICE_DAY, "que", "pase", "buen", "dia"),
            pattern(NICE_DAY, "pase", "buen", "dia"),
            pattern(BE_WELL, "que", "este", "bien"),
            pattern(BE_WELL, "que", "este", "muy"),
            pattern(ACK, "todo", "claro"),
            pattern(ACK, "perfecto"),
            pattern(ACK, "excelente"),
            pattern(ACK, "genial")
    );

    /** Words that turn a polite message into a real question. */
    private static final Set<String> INFORMATIVE_MARKERS = normalizedSet(
            "precio", "costo", "cuesta", "curso", "servicio", "informacion", "detalle",
            "solicito", "saber", "necesito", "puedo", "puedes", "instalar", "disenar",
            "diseno", "calcular", "cotizacion", "presupuesto", "proyecto", "consulta",
            "contacto", "telefono", "email", "correo"
    );

    private static final Set<String> GREETING_KEYWORDS = normalizedSet(
            "hola", "buen", "buenas", "buenos", "saludos", "hey", "holi",
            "buen día", "qué tal", "como estas"
    );

    public Optional<SocialReply> classify(String message) {
        String normalized = TextNormalizer.normalize(message);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        String reply = EXACT_RESPONSES.get(normalized);
        if (reply == null) {
            reply = matchCourtesyPattern(message, normalized);
        }
        if (reply == null) {
            return Optional.empty();
        }
        return Optional.of(new SocialReply(reply, isGreeting(normalized)));
    }

    /** True when the normalized message is itself one of the greeting keywords. */
    public boolean isGreeting(String normalizedMessage) {
        return GREETING_KEYWORDS.contains(normalizedMessage);
    }

    private String matchCourtesyPattern(String message, String normalized) {
        if (message.indexOf('?') >= 0 || message.indexOf('¿') >= 0) {
            return null;
        }
        for (String marker : INFORMATIVE_MARKERS) {
            if (normalized.contains(marker)) {
                return null;
            }
        }
        for (CourtesyPattern candidate : COURTESY_PATTERNS) {
            if (candidate.matches(normalized)) {
                return candidate.reply();
            }
        }
        return null;
    }

    @SafeVarargs
    private static Map<String, String> normalizedTable(Map.Entry<String, String>... entries) {
        Map<String, String> table = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : entries) {
            table.putIfAbsent(TextNormalizer.normalize(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(table);
    }

    private static Set<String> normalizedSet(String... words) {
        return Arrays.stream(words)
                .map(TextNormalizer::normalize)
                .collect(Collectors.toUnmodifiableSet());
    }

    private static CourtesyPattern pattern(String reply, String... keywords) {
        return new CourtesyPattern(
                Arrays.stream(keywords).map(TextNormalizer::normalize).toList(),
                reply);
    }

    private record CourtesyPattern(List<String> keywords, String reply) {
        boolean matches(String normalized) {
            return keywords.stream().allMatch(normalized::contains);
        }
    }
}
