package com.rulesdsl.builder;

import com.rulesdsl.dsl.RuleDraft;
import com.rulesdsl.dsl.json.RuleLogicCodec;
import com.rulesdsl.exception.RuleParseException;
import com.rulesdsl.validation.RuleDraftValidator;
import com.rulesdsl.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns plain English into rule drafts through a multi-turn conversation with a model.
 * A reply carrying a valid draft completes the conversation; anything else is a clarifying question.
 */
public class RuleBuilderService {

    private static final Logger log = LoggerFactory.getLogger(RuleBuilderService.class);

    static final int GENERATED_CONFIDENCE = 85;
    static final int REFINED_CONFIDENCE = 90;

    private static final Pattern DRAFT_JSON = Pattern.compile("\\{[\\s\\S]*\"logic\"[\\s\\S]*}");
    private static final Pattern ANY_JSON = Pattern.compile("\\{[\\s\\S]*}");

    private final RuleGenerationClient client;
    private final RuleBuilderSettings settings;
    private final RuleLogicCodec codec;
    private final RuleDraftValidator validator;

    public RuleBuilderService(RuleGenerationClient client, RuleBuilderSettings settings,
                              RuleLogicCodec codec, RuleDraftValidator validator) {
        this.client = client;
        this.settings = settings;
        this.codec = codec;
        this.validator = validator;
    }

    /**
     * Continue the conversation with a new user message.
     */
    public RuleBuilderResponse generate(RuleBuilderRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        messages.add(ChatMessage.system(settings.systemPrompt()));
        messages.addAll(request.history());
        messages.add(ChatMessage.user(buildUserMessage(request)));

        String content;
        try {
            content = chat(messages);
        } catch (RuntimeException e) {
            log.warn("Rule generation failed for product {}: {}", request.productId(), e.getMessage());
            return RuleBuilderResponse.failure(errorMessage(e));
        }

        Matcher matcher = DRAFT_JSON.matcher(content);
        if (matcher.find()) {
            try {
                RuleDraft draft = codec.readDraft(matcher.group());
                ValidationResult validation = validator.validate(draft);
                if (validation.valid()) {
                    String before = content.substring(0, content.indexOf('{')).trim();
                    String message = before.isEmpty()
                            ? "I've created the rule \"" + draft.name() + "\". Please review and save it."
                            : before;
                    log.info("Generated rule '{}' for product {}", draft.name(), request.productId());
                    return RuleBuilderResponse.draft(draft, message, GENERATED_CONFIDENCE);
                }
                log.warn("Generated draft rejected: {}", validation.error());
            } catch (RuleParseException e) {
                log.warn("Reply contained unparseable rule JSON: {}", e.getMessage());
            }
        }

        log.debug("No complete rule in reply, continuing conversation");
        return RuleBuilderResponse.conversation(content);
    }

    /**
     * Ask the model to revise a draft according to instructions.
     */
    public RuleBuilderResponse refine(RuleDraft current, String instructions) {
        String userMessage = "Refine this rule based on the following instructions:\n\n"
                + "Current Rule:\n" + codec.writeDraftPretty(current) + "\n\n"
                + "Refinement Instructions:\n\"" + instructions + "\"\n\n"
                + "Respond with the updated rule as valid JSON matching the RuleDraft schema.";

        try {
            String content = chat(List.of(ChatMessage.system(settings.systemPrompt()), ChatMessage.user(userMessage)));
            Matcher matcher = ANY_JSON.matcher(content);
            if (!matcher.find()) {
                return RuleBuilderResponse.failure("Could not parse refined rule from AI response");
            }
            RuleDraft draft = codec.readDraft(matcher.group());
            log.info("Refined rule '{}'", draft.name());
            return RuleBuilderResponse.draft(draft, null, REFINED_CONFIDENCE);
        } catch (RuntimeException e) {
            log.warn("Rule refinement failed: {}", e.getMessage());
            return RuleBuilderResponse.failure(errorMessage(e));
        }
    }

    private String chat(List<ChatMessage> messages) {
        String content = client.chat(messages, settings.maxTokens(), settings.temperature());
        return content == null ? "" : content;
    }

    static String buildUserMessage(RuleBuilderRequest request) {
        if (!request.isFirstTurn()) {
            return request.text();
        }
        StringBuilder sb = new StringBuilder(request.text());
        ProductContext product = request.productContext();
        if (product != null) {
            sb.append("\n\nProduct Context:")
                    .append("\n- Product Name: ").append(orUnknown(product.name()))
                    .append("\n- Line of Business: ").append(orUnknown(product.lineOfBusiness()));
            if (!product.coverages().isEmpty()) {
                sb.append("\n- Available Coverages: ").append(describe(product.coverages()));
            }
            if (!product.forms().isEmpty()) {
                sb.append("\n- Available Forms: ").append(describe(product.forms()));
            }
        }
        if (request.targetId() != null && !request.targetId().isEmpty()) {
            sb.append("\n\nTarget ID: ").append(request.targetId());
        }
        return sb.toString();
    }

    private static String describe(List<NamedRef> refs) {
        return refs.stream().map(r -> r.name() + " (" + r.id() + ")").collect(Collectors.joining(", "));
    }

    private static String orUnknown(String value) {
        return value == null || value.isEmpty() ? "Unknown" : value;
    }

    private static String errorMessage(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : "Unknown error";
    }
}
