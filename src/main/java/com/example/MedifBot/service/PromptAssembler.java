package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.model.ConversationTurn;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Builds the grounded prompt sent to the chat model. Section order is fixed:
 * instructions, course guideline, previous-answer block, history, context, question, marker.
 * Empty sections are skipped.
 */
@Component
@RequiredArgsConstructor
public class PromptAssembler {

    static final String SYSTEM_INSTRUCTIONS =
            "Eres el asistente virtual oficial de Medifestructuras (www.medifestructuras.com). "
                    + "Responde siempre usando solo la informacion que aparece dentro del CONTEXTO y se muy conciso. "
                    + "Si no encuentras la respuesta en el CONTEXTO, deja claro que no la tienes y sugiere visitar "
                    + "la pagina web, escribir a eduardo.mediavilla@medifestructuras.com o llamar al +357 96863257. "
                    + "Evita inventar precios, cursos o servicios que no esten citados. "
                    + "Si el usuario vuelve a preguntar o dice que no entendio, reformula la respuesta con un lenguaje "
                    + "mas simple, ejemplos o pasos. "
                    + "El historial de la conversacion solo sirve para mantener el tono; no lo uses como fuente de hechos.";

    public static final String COURSE_RESPONSE_GUIDELINES =
            "Cuando la pregunta sea sobre cursos, confirma que Medif Estructuras ofrece 9 cursos en total "
                    + "(8 de estructuras y 1 de instalaciones), menciona primero esa visión general, luego describe "
                    + "un curso específico documentado en la base de conocimientos y cierra con el llamado a la acción "
                    + "sin negar cursos ni decir “no tengo información”.";

    static final String NO_HISTORY = "(no previous messages)";
    static final String RESPONSE_MARKER = "RESPUESTA:";

    private final ChatbotProperties properties;

    /**
     * Assemble the final prompt. {@code contextText} is cut to the configured budget, keeping its head.
     */
    public String buildPrompt(String previousAnswerBlock,
                              String historyText,
                              String contextText,
                              String userMessage,
                              String courseInstruction) {
        String context = truncateContext(contextText);
        return Stream.of(
                        SYSTEM_INSTRUCTIONS,
                        courseInstruction,
                        previousAnswerBlock,
                        "Conversacion hasta ahora:\n" + (isBlank(historyText) ? NO_HISTORY : historyText),
                        isBlank(context) ? null : "CONTEXTO:\n" + context,
                        "NUEVA PREGUNTA DEL USUARIO:\n" + userMessage,
                        RESPONSE_MARKER
                )
                .filter(section -> !isBlank(section))
                .collect(Collectors.joining("\n\n"))
                .strip();
    }

    /**
     * Render the last few turns as "Usuario: ..." / "Asistente: ..." lines, keeping the most recent
     * characters when the text exceeds the budget. Also picks the latest assistant reply from the
     * whole history.
     */
    public HistoryView renderHistory(List<ConversationTurn> history) {
        if (history == null || history.isEmpty()) {
            return new HistoryView(NO_HISTORY, Optional.empty());
        }
        ChatbotProperties.History config = properties.getHistory();

        int start = Math.max(0, history.size() - config.getMaxTurns());
        List<String> lines = new ArrayList<>();
        for (ConversationTurn turn : history.subList(start, history.size())) {
            String prefix = ConversationTurn.USER.equals(turn.role()) ? "Usuario" : "Asistente";
            String content = turn.content() == null ? "" : turn.content().strip();
            lines.add(prefix + ": " + content);
        }

        Optional<String> lastAssistantReply = Optional.empty();
        for (int i = history.size() - 1; i >= 0; i--) {
            ConversationTurn turn = history.get(i);
            if (turn.isAssistant()) {
                lastAssistantReply = Optional.ofNullable(turn.content());
                break;
            }
        }

        String text = truncateTail(String.join("\n", lines), config.getMaxChars());
        return new HistoryView(text, lastAssistantReply);
    }

    /** Instruction not to repeat the previous answer verbatim; empty when there is none. */
    public String previousAnswerBlock(String lastAssistantReply) {
        if (isBlank(lastAssistantReply)) {
            return "";
        }
        return "Tu respuesta anterior fue:\n"
                + "\"\"\"\n"
                + lastAssistantReply.strip() + "\n"
                + "\"\"\"\n"
                + "El usuario volvio a consultar o indico que no entendio. "
                + "No repitas la misma redaccion ni estructura; explicalo con lenguaje mas simple, pasos o ejemplos, "
                + "pero mantente preciso.";
    }

    public String truncateContext(String context) {
        if (context == null) {
            return "";
        }
        int limit = properties.getRag().getMaxContextChars();
        return context.length() <= limit ? context : context.substring(0, limit);
    }

    static String truncateTail(String text, int limit) {
        return text.length() <= limit ? text : text.substring(text.length() - limit);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * @param text               rendered, budget-limited history
     * @param lastAssistantReply most recent assistant message, if any
     */
    public record HistoryView(String text, Optional<String> lastAssistantReply) {
    }
}
