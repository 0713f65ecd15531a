package dev.juridica.rag.conversation;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.juridica.rag.completion.ChatMessage;
import dev.juridica.rag.completion.CompletionClient;

/**
 * Derives a title and category for a new conversation. The model is asked for
 * a JSON object; when its output cannot be used the title is derived from the
 * question and the category from the {@link QueryClassifier}.
 */
public class ConversationMetadataGenerator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationMetadataGenerator.class);

    static final int TITLE_LENGTH = 50;

    private static final String INSTRUCTION = """
            Propose un titre court (50 caractères maximum) et une catégorie pour cette conversation. \
            Réponds uniquement avec un objet JSON de la forme {"title": "...", "category": "..."}.""";

    private final CompletionClient completionClient;
    private final QueryClassifier classifier;
    private final ObjectMapper objectMapper;

    public ConversationMetadataGenerator(CompletionClient completionClient, QueryClassifier classifier,
            ObjectMapper objectMapper) {
        this.completionClient = Objects.requireNonNull(completionClient, "completionClient");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public ConversationMetadata generate(String question, String answer) {
        try {
            String output = completionClient.complete(List.of(
                    ChatMessage.system(INSTRUCTION),
                    ChatMessage.user("Question : " + question + "\nRéponse : " + answer)));
            return parse(output);
        } catch (MalformedModelOutputException ex) {
            LOGGER.debug("Model metadata unusable, deriving it from the question: {}", ex.getMessage());
        } catch (RuntimeException ex) {
            LOGGER.warn("Metadata generation failed, deriving it from the question: {}", ex.getMessage());
        }
        return new ConversationMetadata(fallbackTitle(question), classifier.classify(question));
    }

    ConversationMetadata parse(String output) {
        if (output == null) {
            throw new MalformedModelOutputException("empty model output");
        }
        int start = output.indexOf('{');
        int end = output.lastIndexOf('}');
        if (start < 0 || end <= start) {
            throw new MalformedModelOutputException("no JSON object in model output");
        }
        ConversationMetadata metadata;
        try {
            metadata = objectMapper.readValue(output.substring(start, end + 1), ConversationMetadata.class);
        } catch (JsonProcessingException ex) {
            throw new MalformedModelOutputException("invalid JSON in model output", ex);
        }
        if (metadata.title() == null || metadata.title().isBlank()) {
            throw new MalformedModelOutputException("model output has no title");
        }
        String title = metadata.title().strip();
        if (title.length() > TITLE_LENGTH) {
            title = title.substring(0, TITLE_LENGTH);
        }
        String category = metadata.category() == null || metadata.category().isBlank()
                ? QueryClassifier.DEFAULT_CATEGORY
                : metadata.category().strip().toLowerCase(Locale.ROOT);
        return new ConversationMetadata(title, category);
    }

    static String fallbackTitle(String question) {
        String title = question.strip().replaceAll("\\s+", " ");
        if (title.length() > TITLE_LENGTH) {
            title = title.substring(0, TITLE_LENGTH).strip() + "...";
        }
        if (title.isEmpty()) {
            return title;
        }
        return title.substring(0, 1).toUpperCase(Locale.ROOT) + title.substring(1);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ConversationMetadata(String title, String category) {
    }
}
