package com.helia.ai;

import com.helia.domain.PersonaConfig;
import com.helia.domain.PromptContext;
import reactor.core.publisher.Flux;

/**
 * Streaming model seam. Callers depend on this interface only, never on a concrete SDK.
 *
 * <p>The returned flux is lazy (nothing is sent upstream before subscription), finite, emits text
 * chunks in generation order and fails with {@link com.helia.error.ProviderException}. Cancelling
 * the subscription must release the upstream request.</p>
 */
public interface ModelProvider {

    Flux<String> stream(PersonaConfig persona, PromptContext context);
}
