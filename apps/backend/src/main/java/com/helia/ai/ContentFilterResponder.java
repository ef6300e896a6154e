package com.helia.ai;

import com.helia.domain.PersonaConfig;
import com.helia.error.ProviderException;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a content-policy rejection from the provider into a refusal spoken in the persona's voice.
 */
@Component
public class ContentFilterResponder {

    private static final String UNSPECIFIED = "content that violates our safety guidelines";

    /** Checked in order; the first category named in the provider error wins. */
    private static final Map<String, String> CATEGORY_EXPLANATIONS = new LinkedHashMap<>();

    static {
        CATEGORY_EXPLANATIONS.put("self_harm", "content related to self-harm or unsafe behaviors");
        CATEGORY_EXPLANATIONS.put("jailbreak", "attempts to bypass safety measures");
        CATEGORY_EXPLANATIONS.put("violence", "content that may involve violence or harm");
        CATEGORY_EXPLANATIONS.put("sexual", "inappropriate or sexual content");
        CATEGORY_EXPLANATIONS.put("hate", "content that promotes hate speech or discrimination");
        CATEGORY_EXPLANATIONS.put("drugs", "illegal or unethical activities, such as drug-related requests");
    }

    public String refusal(PersonaConfig persona, ProviderException cause) {
        return "I'm sorry, but I can't assist with requests that involve " + explain(cause) + ". "
                + "My role is to " + persona.safetyRole() + ". "
                + persona.safetySuggestion() + " "
                + "What would you like to explore instead?";
    }

    String explain(ProviderException cause) {
        String detail = describe(cause);
        for (Map.Entry<String, String> entry : CATEGORY_EXPLANATIONS.entrySet()) {
            if (detail.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return UNSPECIFIED;
    }

    private static String describe(Throwable cause) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = cause; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t.getMessage() != null) {
                text.append(t.getMessage()).append(' ');
            }
        }
        return text.toString().toLowerCase(Locale.ROOT);
    }
}
