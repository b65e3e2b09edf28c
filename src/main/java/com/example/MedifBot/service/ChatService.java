package com.example.MedifBot.service;

import com.example.MedifBot.config.ChatbotProperties;
import com.example.MedifBot.exception.InvalidMessageException;
import com.example.MedifBot.intent.Intent;
import com.example.MedifBot.intent.IntentClassifier;
import com.example.MedifBot.intent.IntentKind;
import com.example.MedifBot.intent.TopicIntentDetector;
import com.example.MedifBot.model.ChatRequest;
import com.example.MedifBot.model.ChatResponse;
import com.example.MedifBot.model.ConversationTurn;
import com.example.MedifBot.model.PersistOutcome;
import com.example.MedifBot.model.RetrievalResult;
import com.example.MedifBot.util.KeywordExtractor;
import com.example.MedifBot.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Locale;

/**
 * Per-message flow of the website chat:
 *  - contact details shared  -> fixed acknowledgement
 *  - greeting / courtesy     -> canned reply
 *  - anything else           -> history + retrieval + generation
 *
 * Blocking work (database, Redis, embedding, chat model) runs on boundedElastic;
 * the pacing delays are timers and do not hold a thread.
 */
@Service
@RequiredArgsConstructor
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);

    public static final String CONTACT_PROMPT =
            "También podés hacer clic en “Enviar mis datos” o escribir tus datos en el chat "
                    + "para que coordinemos tu consulta, link de pago o llamada.";

    public static final String CONTACT_ACK =
            "Gracias, hemos recibido tus datos y te contactaremos a la brevedad posible.";

    public static final String FALLBACK_RESPONSE =
            "No tengo suficiente informacion en la base de conocimiento para responder eso. "
                    + "Por favor revisa www.medifestructuras.com o contactanos a eduardo.mediavilla@medifestructuras.com "
                    + "o por telefono al +357 96863257.";

    private final IntentClassifier intentClassifier;
    private final TopicIntentDetector topicIntentDetector;
    private final ContextRetrievalService contextRetrievalService;
    private final PromptAssembler promptAssembler;
    private final GenerationService generationService;
    private final ConversationStore conversationStore;
    private final ChatbotProperties properties;

    /**
     * Answer one message.
     *
     * @throws InvalidMessageException immediately (not through the Mono) when the message is blank
     */
    public Mono<ChatResponse> chat(ChatRequest request) {
        String userMessage = request.message() == null ? "" : request.message().strip();
        if (userMessage.isEmpty()) {
            throw new InvalidMessageException("El mensaje no puede estar vacio.");
        }
        String conversationId = request.resolveConversationId();
        log.info("/chat called, conv_id={} question={}", conversationId, abbreviate(userMessage, 100));

        Intent intent = intentClassifier.classify(userMessage);
        Mono<ChatResponse> flow = switch (intent.kind()) {
            case CONTACT_SHARE -> acknowledgeContact(conversationId, userMessage, request.ip());
            case GREETING, COURTESY -> shortCircuit(conversationId, userMessage, request.ip(), intent);
            case INFORMATION_REQUEST -> answer(conversationId, userMessage, request.ip());
        };

        return Mono.fromRunnable(() -> conversationStore.ensureConversation(conversationId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(flow);
    }

    private Mono<ChatResponse> acknowledgeContact(String conversationId, String userMessage, String ip) {
        log.info("Contact info received for conv={}", conversationId);
        String response = appendContactPrompt(CONTACT_ACK);
        return Mono.delay(properties.getPacing().getContactDelay())
                .publishOn(Schedulers.boundedElastic())
                .map(tick -> {
                    persistExchange(conversationId, userMessage, response, ip);
                    return new ChatResponse(response, conversationId);
                });
    }

    private Mono<ChatResponse> shortCircuit(String conversationId, String userMessage, String ip, Intent intent) {
        log.info("Short-circuit social message for conv={} kind={}", conversationId, intent.kind());
        String response = intent.kind() == IntentKind.GREETING
                ? intent.reply()
                : appendContactPrompt(intent.reply());
        return Mono.delay(properties.getPacing().getSocialDelay())
                .publishOn(Schedulers.boundedElastic())
                .map(tick -> {
                    persistExchange(conversationId, userMessage, response, ip);
                    return new ChatResponse(response, conversationId);
                });
    }

    private Mono<ChatResponse> answer(String conversationId, String userMessage, String ip) {
        return Mono.fromCallable(() -> generateAnswer(conversationId, userMessage))
                .subscribeOn(Schedulers.boundedElastic())
                .map(answer -> {
                    String finalAnswer = appendContactPrompt(answer);
                    persistExchange(conversationId, userMessage, finalAnswer, ip);
                    log.info("/chat completed, conv_id={}", conversationId);
                    return new ChatResponse(finalAnswer, conversationId);
                });
    }

    /**
     * Retrieval and generation for an information request. Exceptions from either step
     * propagate so nothing is persisted for a failed turn.
     */
    String generateAnswer(String conversationId, String userMessage) {
        ChatbotProperties.History historyConfig = properties.getHistory();
        List<ConversationTurn> history = conversationStore.getRecent(conversationId, historyConfig.getMaxTurns());
        PromptAssembler.HistoryView historyView = promptAssembler.renderHistory(history);
        String previousAnswerBlock = promptAssembler.previousAnswerBlock(
                historyView.lastAssistantReply().orElse(null));

        String normalizedMessage = TextNormalizer.normalize(userMessage);
        boolean courseIntent = topicIntentDetector.isCourseRequest(normalizedMessage);
        List<String> keywords = KeywordExtractor.extract(userMessage);

        RetrievalResult retrieval = contextRetrievalService.retrieve(
                userMessage, keywords, normalizedMessage, courseIntent);
        log.info("RAG conv={} filters={} retrieved={} used={} keywords={} best_similarity={} threshold={}",
                conversationId,
                retrieval.sourceFilters().isEmpty() ? "all" : String.join(",", retrieval.sourceFilters()),
                retrieval.similarCount(),
                retrieval.usedCount(),
                retrieval.keywordCount(),
                String.format(Locale.US, "%.3f", retrieval.bestSimilarity()),
                String.format(Locale.US, "%.2f", properties.getRag().getMinSimilarity()));

        if (retrieval.isEmpty()) {
            log.warn("No context available for conv={}, skipping generation", conversationId);
            return FALLBACK_RESPONSE;
        }

        String prompt = promptAssembler.buildPrompt(
                previousAnswerBlock,
                historyView.text(),
                retrieval.joinedContext(),
                userMessage,
                courseIntent ? PromptAssembler.COURSE_RESPONSE_GUIDELINES : null);

        ChatbotProperties.Generation generation = properties.getGeneration();
        return generationService.generate(prompt, generation.getTemperature(), generation.getTopP());
    }

    /**
     * Add the contact call-to-action once. A missing final punctuation mark is added first.
     */
    public static String appendContactPrompt(String answer) {
        String stripped = answer == null ? "" : answer.strip();
        if (stripped.isEmpty()) {
            return CONTACT_PROMPT;
        }
        if (stripped.contains(CONTACT_PROMPT)) {
            return stripped;
        }
        char last = stripped.charAt(stripped.length() - 1);
        String punctuation = (last == '.' || last == '!' || last == '?') ? "" : ".";
        return stripped + punctuation + " " + CONTACT_PROMPT;
    }

    private void persistExchange(String conversationId, String userMessage, String assistantMessage, String ip) {
        PersistOutcome user = conversationStore.saveTurn(conversationId, ConversationTurn.USER, userMessage, ip);
        PersistOutcome assistant = conversationStore.saveTurn(conversationId, ConversationTurn.ASSISTANT, assistantMessage, ip);
        if (!user.saved() || !assistant.saved()) {
            log.warn("Exchange for conv={} only partially saved (user={}, assistant={})",
                    conversationId, user.saved(), assistant.saved());
        }
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }
}
