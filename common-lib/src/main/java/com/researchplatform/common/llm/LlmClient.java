package com.researchplatform.common.llm;

import reactor.core.publisher.Mono;

/**
 * Opaque language-model call: prompt text in, completion text out.
 *
 * <p>Implementations apply their own timeout and signal failure with an error; they make no
 * promise about the shape of the returned text. Callers own parsing and fallback.
 */
public interface LlmClient {

    Mono<String> complete(String prompt);
}
