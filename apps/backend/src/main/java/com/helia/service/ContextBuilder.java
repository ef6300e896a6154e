package com.helia.service;

import com.helia.domain.PromptContext;
import com.helia.domain.Session;

public interface ContextBuilder {

    /** System prompt of the session's persona followed by the trailing message window, oldest first. */
    PromptContext build(Session session);
}
